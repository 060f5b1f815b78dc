/*
 * Original work Copyright (c) 2008-2020, Hazelcast, Inc.
 * Modified work Copyright (c) 2020, MicroRaft.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.raftcore.impl.handler;

import io.raftcore.RaftEndpoint;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.log.RaftLog;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesFailureResponse;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.message.AppendEntriesSuccessResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.List;

import static io.raftcore.RaftRole.FOLLOWER;
import static java.lang.Math.min;

/**
 * Appends the entries of an {@link AppendEntriesRequest} to the local log when the log contains the entry preceding
 * them, and replies with an {@link AppendEntriesSuccessResponse} or an {@link AppendEntriesFailureResponse}.
 * <p>
 * Uncommitted local entries conflicting with the request are truncated. An empty request is a heartbeat and it also
 * carries the commit index of the leader.
 * <p>
 * See <i>5.3 Log replication</i> of the Raft paper.
 */
public class AppendEntriesRequestHandler
        extends AbstractMessageHandler<AppendEntriesRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppendEntriesRequestHandler.class);

    public AppendEntriesRequestHandler(RaftNodeImpl raftNode, AppendEntriesRequest request) {
        super(raftNode, request);
    }

    @Override
    protected void handle(@Nonnull AppendEntriesRequest request) {
        LOGGER.debug("{} received {}.", localEndpointStr(), request);
        RaftEndpoint leader = request.getSender();

        if (request.getTerm() < state.term()) {
            LOGGER.debug("{} Rejecting {} of stale term, current term: {}", localEndpointStr(), request, state.term());
            node.send(leader, failure(state.term(), 0, 0));
            return;
        }

        followLeader(request);

        RaftLog log = state.log();
        if (!containsPreviousEntry(log, request)) {
            node.send(leader,
                    failure(request.getTerm(), request.getQuerySequenceNumber(), request.getFlowControlSequenceNumber()));
            return;
        }

        List<LogEntry> newEntries = reconcile(log, request);
        if (!newEntries.isEmpty()) {
            LOGGER.debug("{} Appending {} entries from index: {}", localEndpointStr(), newEntries.size(),
                    newEntries.get(0).getIndex());
            log.appendEntries(newEntries);
            log.flush();
        }

        // entries after the last entry of this request may belong to an older leader, so they are not acknowledged
        long lastVerifiedIndex = request.getPreviousLogIndex() + request.getLogEntries().size();
        boolean advanced = advanceCommitIndex(min(request.getCommitIndex(), lastVerifiedIndex));
        try {
            node.send(leader, success(lastVerifiedIndex));
        } finally {
            if (advanced) {
                node.applyLogEntries();
            }
        }
    }

    private void followLeader(AppendEntriesRequest request) {
        RaftEndpoint leader = request.getSender();
        if (request.getTerm() > state.term() || state.role() != FOLLOWER) {
            LOGGER.info("{} Following {} in term: {}, previous term: {}, previous role: {}", localEndpointStr(),
                    leader.getId(), request.getTerm(), state.term(), state.role());
            node.toFollower(request.getTerm());
        }

        if (!leader.equals(state.leader())) {
            LOGGER.info("{} Setting leader: {}", localEndpointStr(), leader.getId());
            node.leader(leader);
        }

        node.leaderHeartbeatReceived();
    }

    private boolean containsPreviousEntry(RaftLog log, AppendEntriesRequest request) {
        long previousIndex = request.getPreviousLogIndex();
        if (previousIndex == 0) {
            return true;
        }

        LogEntry previous = log.getLogEntry(previousIndex);
        if (previous == null) {
            LOGGER.debug("{} No entry at previous index of {}, last log index: {}", localEndpointStr(), request,
                    log.lastLogIndex());
            return false;
        } else if (previous.getTerm() != request.getPreviousLogTerm()) {
            LOGGER.debug("{} Entry at previous index of {} has term: {}", localEndpointStr(), request, previous.getTerm());
            return false;
        }

        return true;
    }

    /**
     * Returns the suffix of the request entries missing from the local log. Truncates the local log from the first
     * entry whose term differs from the request.
     */
    private List<LogEntry> reconcile(RaftLog log, AppendEntriesRequest request) {
        List<LogEntry> entries = request.getLogEntries();
        for (int i = 0; i < entries.size(); i++) {
            LogEntry entry = entries.get(i);
            LogEntry local = log.getLogEntry(entry.getIndex());
            if (local == null) {
                return entries.subList(i, entries.size());
            } else if (local.getTerm() != entry.getTerm()) {
                truncate(log, entry.getIndex());
                return entries.subList(i, entries.size());
            }
        }

        return Collections.emptyList();
    }

    private void truncate(RaftLog log, long fromIndex) {
        if (fromIndex <= state.commitIndex()) {
            throw new IllegalStateException(localEndpointStr() + " Cannot truncate committed entry at index: " + fromIndex
                    + ", commit index: " + state.commitIndex());
        }

        List<LogEntry> truncated = log.truncateEntriesFrom(fromIndex);
        LOGGER.warn("{} Truncated {} entries from index: {}", localEndpointStr(), truncated.size(), fromIndex);
        state.invalidateFuturesFrom(fromIndex, node.newNotLeaderException());
        log.flush();
    }

    private boolean advanceCommitIndex(long newCommitIndex) {
        if (newCommitIndex <= state.commitIndex()) {
            return false;
        }

        LOGGER.debug("{} Setting commit index: {}.", localEndpointStr(), newCommitIndex);
        state.commitIndex(newCommitIndex);
        return true;
    }

    private AppendEntriesSuccessResponse success(long lastLogIndex) {
        return modelFactory.createAppendEntriesSuccessResponseBuilder()
                           .setGroupId(node.getGroupId())
                           .setSender(localEndpoint())
                           .setTerm(state.term())
                           .setLastLogIndex(lastLogIndex)
                           .setQuerySequenceNumber(message.getQuerySequenceNumber())
                           .setFlowControlSequenceNumber(message.getFlowControlSequenceNumber())
                           .build();
    }

    private AppendEntriesFailureResponse failure(int term, long querySequenceNumber, long flowControlSequenceNumber) {
        return modelFactory.createAppendEntriesFailureResponseBuilder()
                           .setGroupId(node.getGroupId())
                           .setSender(localEndpoint())
                           .setTerm(term)
                           .setExpectedNextIndex(message.getPreviousLogIndex() + 1)
                           .setQuerySequenceNumber(querySequenceNumber)
                           .setFlowControlSequenceNumber(flowControlSequenceNumber)
                           .build();
    }

}

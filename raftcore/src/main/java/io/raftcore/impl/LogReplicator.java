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


package io.raftcore.impl;

import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;
import io.raftcore.executor.RaftNodeExecutor;
import io.raftcore.impl.log.RaftLog;
import io.raftcore.impl.state.FollowerState;
import io.raftcore.impl.state.LeaderState;
import io.raftcore.impl.state.RaftState;
import io.raftcore.impl.task.RaftNodeStatusAwareTask;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesRequest.AppendEntriesRequestBuilder;
import io.raftcore.model.message.RaftMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map.Entry;

import static java.lang.Math.min;
import static java.util.Collections.emptyList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Leader side of the log replication. Builds the append entries requests of the followers, limits the number of
 * in-flight requests per follower with a backoff, flushes the leader's own log in parallel with the followers and
 * advances the commit index.
 * <p>
 * Used only on the Raft node thread while the local Raft node is the leader.
 */
final class LogReplicator {

    static final long BACKOFF_RESET_PERIOD_MILLIS = 250;

    private static final Logger LOGGER = LoggerFactory.getLogger(LogReplicator.class);
    private static final int MIN_BACKOFF_ROUNDS = 4;

    private final RaftNodeImpl node;
    private final RaftNodeExecutor executor;
    private final RaftModelFactory modelFactory;
    private final int batchSize;
    private final int maxBackoffRounds;

    private Runnable backoffResetTask;
    // null when the log is not durable, so the leader's whole log counts towards the quorum
    private Runnable flushTask;

    LogReplicator(RaftNodeImpl node, RaftConfig config, RaftNodeExecutor executor, RaftModelFactory modelFactory) {
        this.node = node;
        this.executor = executor;
        this.modelFactory = modelFactory;
        this.batchSize = config.getAppendEntriesRequestBatchSize();
        this.maxBackoffRounds = maxBackoffRounds(config);
    }

    private static int maxBackoffRounds(RaftConfig config) {
        long periodSecs = config.getLeaderHeartbeatPeriodSecs();
        // a 1 sec heartbeat period would leave no room for the backoff before the next heartbeat
        long backoffSecs = periodSecs == 1 && config.getLeaderHeartbeatTimeoutSecs() > 1 ? 2 : periodSecs;
        return (int) (SECONDS.toMillis(backoffSecs) / BACKOFF_RESET_PERIOD_MILLIS);
    }

    void init(boolean durableLog) {
        backoffResetTask = new BackoffResetTask();
        if (durableLog) {
            flushTask = new FlushTask();
        }
    }

    private RaftState state() {
        return node.state();
    }

    void broadcastAppendEntries() {
        RaftState state = state();
        List<RaftEndpoint> followers = state.remoteMembers();
        if (!followers.isEmpty()) {
            followers.forEach(this::sendAppendEntries);
            return;
        }

        // a singleton leader is the majority by itself once its log is flushed
        RaftLog log = state.log();
        if (log.flushedLogIndex() == log.lastLogIndex() || !submitFlushTask(state.leaderState())) {
            tryAdvanceCommitIndex();
        }
    }

    void sendAppendEntries(RaftEndpoint target) {
        RaftState state = state();
        LeaderState leaderState = state.leaderState();
        FollowerState follower = leaderState.getFollowerStateOrNull(target);
        if (follower == null) {
            LOGGER.warn("{} follower: {} not found to send append entries request.", node.localEndpointStr(),
                    target.getId());
            return;
        } else if (follower.isRequestBackoffSet()) {
            // sent again on the follower's response or on the backoff expiry
            return;
        }

        RaftLog log = state.log();
        long nextIndex = follower.nextIndex();
        long prevLogIndex = nextIndex - 1;
        int prevLogTerm = prevLogIndex > 0 ? log.getLogEntry(prevLogIndex).getTerm() : 0;

        // Until the match index of the follower is known, only empty requests are sent to find where the logs match.
        boolean probing = prevLogIndex > 0 && follower.matchIndex() == 0;
        List<LogEntry> entries = probing || nextIndex > log.lastLogIndex()
                                 ? emptyList()
                                 : log.getLogEntriesBetween(nextIndex, min(nextIndex + batchSize - 1, log.lastLogIndex()));
        // Heartbeats of a caught-up follower are not flow-controlled unless they carry a query round.
        boolean flowControlled = probing || !entries.isEmpty() || leaderState.queryState().queryCount() > 0;

        AppendEntriesRequestBuilder builder = modelFactory.createAppendEntriesRequestBuilder()
                                                          .setGroupId(node.getGroupId())
                                                          .setSender(node.getLocalEndpoint())
                                                          .setTerm(state.term())
                                                          .setPreviousLogIndex(prevLogIndex)
                                                          .setPreviousLogTerm(prevLogTerm)
                                                          .setCommitIndex(state.commitIndex())
                                                          .setQuerySequenceNumber(leaderState.querySequenceNumber())
                                                          .setLogEntries(entries);
        if (flowControlled) {
            builder.setFlowControlSequenceNumber(follower.setRequestBackoff(MIN_BACKOFF_ROUNDS, maxBackoffRounds));
        }

        RaftMessage request = builder.build();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} Sending {} to {} with next index: {}", node.localEndpointStr(), request, target.getId(),
                    nextIndex);
        }

        node.send(target, request);

        if (flowControlled) {
            scheduleBackoffResetTask(leaderState);
        }

        if (!entries.isEmpty() && entries.get(entries.size() - 1).getIndex() > log.flushedLogIndex()) {
            // the leader writes to its disk while the followers write to theirs
            submitFlushTask(leaderState);
        }
    }

    void scheduleBackoffResetTask(LeaderState leaderState) {
        if (leaderState.isRequestBackoffResetTaskScheduled()) {
            return;
        }

        executor.schedule(backoffResetTask, BACKOFF_RESET_PERIOD_MILLIS, MILLISECONDS);
        leaderState.requestBackoffResetTaskScheduled(true);
    }

    /**
     * Completes a backoff round of every flow-controlled follower. The followers whose backoff is over get a new append
     * entries request. The task is scheduled again while any follower is still backing off.
     */
    private void completeBackoffRounds() {
        LeaderState leaderState = state().leaderState();
        if (leaderState == null) {
            return;
        }

        leaderState.requestBackoffResetTaskScheduled(false);
        boolean backingOff = false;
        for (Entry<RaftEndpoint, FollowerState> e : leaderState.getFollowerStates().entrySet()) {
            FollowerState follower = e.getValue();
            if (!follower.isRequestBackoffSet()) {
                continue;
            } else if (follower.completeBackoffRound()) {
                sendAppendEntries(e.getKey());
            } else {
                backingOff = true;
            }
        }

        if (backingOff) {
            scheduleBackoffResetTask(leaderState);
        }
    }

    /**
     * Flushes the log. A leader counts the flushed entries towards the quorum. A node that lost the leadership meanwhile
     * still flushes, since its log is not touched by anyone else until the next append entries request.
     */
    private void flushLeaderLog() {
        RaftState state = state();
        state.log().flush();
        LeaderState leaderState = state.leaderState();
        if (leaderState != null) {
            leaderState.flushTaskSubmitted(false);
            tryAdvanceCommitIndex();
        }
    }

    private boolean submitFlushTask(LeaderState leaderState) {
        if (flushTask == null) {
            return false;
        } else if (!leaderState.isFlushTaskSubmitted()) {
            executor.submit(flushTask);
            leaderState.flushTaskSubmitted(true);
        }

        return true;
    }

    /**
     * Returns the highest log index known to be durable on the majority. The leader's own slot is its flushed log index.
     * Section 10.2.1 of the Raft dissertation allows the leader to commit an entry before its own disk write completes.
     */
    private long quorumMatchIndex() {
        RaftState state = state();
        long[] indices = state.leaderState().matchIndices();
        RaftLog log = state.log();
        indices[indices.length - 1] = flushTask != null ? log.flushedLogIndex() : log.lastLogIndex();
        Arrays.sort(indices);

        long quorumMatchIndex = indices[indices.length - state.majority()];
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} Quorum match index: {}, indices: {}", node.localEndpointStr(), quorumMatchIndex,
                    Arrays.toString(indices));
        }

        return quorumMatchIndex;
    }

    /**
     * Commits up to the quorum match index if the entry there is from the current term. Terms never decrease along the log,
     * so no lower index can be committed by counting replicas either. Earlier entries are committed along with it (§5.4.2).
     */
    boolean tryAdvanceCommitIndex() {
        RaftState state = state();
        long quorumMatchIndex = quorumMatchIndex();
        if (quorumMatchIndex <= state.commitIndex()) {
            return false;
        }

        LogEntry entry = state.log().getLogEntry(quorumMatchIndex);
        if (entry.getTerm() != state.term()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} cannot commit {} before an entry of the current term: {} is replicated.",
                        node.localEndpointStr(), entry, state.term());
            }

            return false;
        }

        LOGGER.debug("{} Setting commit index: {}", node.localEndpointStr(), quorumMatchIndex);
        state.commitIndex(quorumMatchIndex);
        node.applyLogEntries();
        broadcastAppendEntries();
        node.tryRunQueries();
        return true;
    }

    private final class BackoffResetTask
            extends RaftNodeStatusAwareTask {

        BackoffResetTask() {
            super(LogReplicator.this.node);
        }

        @Override
        protected void doRun() {
            completeBackoffRounds();
        }

    }

    private final class FlushTask
            extends RaftNodeStatusAwareTask {

        FlushTask() {
            super(LogReplicator.this.node);
        }

        @Override
        protected void doRun() {
            flushLeaderLog();
        }

    }

}

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
import io.raftcore.model.message.VoteRequest;
import io.raftcore.model.message.VoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Decides on a {@link VoteRequest} and replies with a {@link VoteResponse}.
 * <p>
 * The local Raft node votes at most once per term and only for a candidate whose log is at least as up-to-date as its
 * own. The vote is persisted before the response is sent. A sticky request is rejected while the local Raft node still
 * hears from a leader other than the candidate (Section 4.2.3 of the Raft dissertation).
 * <p>
 * See <i>5.2 Leader election</i> of the Raft paper.
 */
public class VoteRequestHandler
        extends AbstractMessageHandler<VoteRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(VoteRequestHandler.class);

    public VoteRequestHandler(RaftNodeImpl raftNode, VoteRequest request) {
        super(raftNode, request);
    }

    @Override
    protected void handle(@Nonnull VoteRequest request) {
        RaftEndpoint candidate = request.getSender();
        int candidateTerm = request.getTerm();

        if (candidateTerm < state.term()) {
            LOGGER.info("{} Rejecting {} of stale term, current term: {}", localEndpointStr(), request, state.term());
            reply(candidate, state.term(), false);
            if (state.leaderState() != null) {
                // lets the stale candidate learn the current leader
                node.sendAppendEntriesRequest(candidate);
            }

            return;
        } else if (request.isSticky() && isLeaderAlive() && !candidate.equals(state.leader())) {
            LOGGER.info("{} Rejecting {} since the leader is still alive.", localEndpointStr(), request);
            reply(candidate, state.term(), false);
            return;
        }

        if (candidateTerm > state.term()) {
            LOGGER.info("{} Moving to term: {} from term: {} as {} after {}", localEndpointStr(), candidateTerm,
                    state.term(), state.role(), request);
            node.toFollower(candidateTerm);
        }

        reply(candidate, candidateTerm, decide(request));
    }

    private boolean isLeaderAlive() {
        return state.leaderState() != null || !node.isLeaderHeartbeatTimeoutElapsed();
    }

    private boolean decide(VoteRequest request) {
        RaftEndpoint candidate = request.getSender();
        if (state.leader() != null && !candidate.equals(state.leader())) {
            LOGGER.warn("{} No vote for {} since the leader is {}", localEndpointStr(), request, state.leader().getId());
            return false;
        } else if (state.votedEndpoint() != null) {
            boolean sameCandidate = candidate.equals(state.votedEndpoint());
            LOGGER.info("{} {} for {}, already voted for: {}", localEndpointStr(), sameCandidate ? "Vote" : "No vote",
                    request, state.votedEndpoint().getId());
            return sameCandidate;
        } else if (!state.log().isNotAheadOf(request.getLastLogTerm(), request.getLastLogIndex())) {
            LOGGER.info("{} No vote for {} since local log is ahead. Last log term: {}, last log index: {}",
                    localEndpointStr(), request, state.log().lastLogTerm(), state.log().lastLogIndex());
            return false;
        }

        LOGGER.info("{} Granted vote for {}", localEndpointStr(), request);
        state.grantVote(request.getTerm(), candidate);
        return true;
    }

    private void reply(RaftEndpoint candidate, int term, boolean granted) {
        node.send(candidate, modelFactory.createVoteResponseBuilder()
                                         .setGroupId(node.getGroupId())
                                         .setSender(localEndpoint())
                                         .setTerm(term)
                                         .setGranted(granted)
                                         .build());
    }

}

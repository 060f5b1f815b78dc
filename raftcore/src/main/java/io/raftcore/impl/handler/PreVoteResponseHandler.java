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

import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.state.CandidateState;
import io.raftcore.model.message.PreVoteRequest;
import io.raftcore.model.message.PreVoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static io.raftcore.RaftRole.FOLLOWER;

/**
 * Counts the pre-votes granted for a {@link PreVoteRequest}. The follower becomes a candidate once the majority has
 * granted its pre-vote.
 */
public class PreVoteResponseHandler
        extends AbstractResponseHandler<PreVoteResponse> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PreVoteResponseHandler.class);

    public PreVoteResponseHandler(RaftNodeImpl raftNode, PreVoteResponse response) {
        super(raftNode, response);
    }

    @Override
    protected void handleResponse(@Nonnull PreVoteResponse response) {
        CandidateState preCandidateState = state.preCandidateState();
        if (!isExpected(response, preCandidateState)) {
            return;
        }

        if (!response.isGranted()) {
            LOGGER.debug("{} Pre-vote denied by {}", localEndpointStr(), response.getSender().getId());
            return;
        }

        if (preCandidateState.grantVote(response.getSender())) {
            LOGGER.info("{} Pre-vote of {} for term: {}, votes: {}/{}", localEndpointStr(), response.getSender().getId(),
                    response.getTerm(), preCandidateState.voteCount(), preCandidateState.majority());
        }

        if (preCandidateState.isMajorityGranted()) {
            LOGGER.info("{} Pre-vote majority reached, starting the election.", localEndpointStr());
            node.toCandidate();
        }
    }

    private boolean isExpected(PreVoteResponse response, CandidateState preCandidateState) {
        if (state.role() != FOLLOWER || preCandidateState == null) {
            LOGGER.debug("{} Ignored {}, no pre-vote in progress.", localEndpointStr(), response);
            return false;
        } else if (response.getTerm() < state.term()) {
            LOGGER.warn("{} Ignored {} of stale term, current term: {}", localEndpointStr(), response, state.term());
            return false;
        }

        return true;
    }

}

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
import io.raftcore.impl.state.FollowerState;
import io.raftcore.model.message.AppendEntriesFailureResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static io.raftcore.RaftRole.LEADER;

/**
 * Handles the rejection of an append entries request. A higher term in the response makes the local Raft node a
 * follower. Otherwise the leader walks the next index of the follower back by one entry and probes again until the logs
 * match.
 * <p>
 * See <i>5.3 Log replication</i> of the Raft paper.
 */
public class AppendEntriesFailureResponseHandler
        extends AbstractResponseHandler<AppendEntriesFailureResponse> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppendEntriesFailureResponseHandler.class);

    public AppendEntriesFailureResponseHandler(RaftNodeImpl raftNode, AppendEntriesFailureResponse response) {
        super(raftNode, response);
    }

    @Override
    protected void handleResponse(@Nonnull AppendEntriesFailureResponse response) {
        if (response.getTerm() > state.term()) {
            LOGGER.info("{} Moving to term: {} of {} from term: {}", localEndpointStr(), response.getTerm(),
                    response.getSender().getId(), state.term());
            node.toFollower(response.getTerm());
            return;
        } else if (state.role() != LEADER || response.getTerm() < state.term()) {
            LOGGER.debug("{} Ignored {}, role: {}, term: {}", localEndpointStr(), response, state.role(), state.term());
            return;
        }

        FollowerState follower = state.leaderState().getFollowerStateOrNull(response.getSender());
        if (follower == null) {
            LOGGER.warn("{} Ignored {} of a non-follower.", localEndpointStr(), response);
            return;
        }

        LOGGER.debug("{} received {}.", localEndpointStr(), response);
        follower.responseReceived(response.getFlowControlSequenceNumber(), node.getClock().millis());
        node.tryAckQuery(response.getQuerySequenceNumber(), response.getSender());

        // a response to an older probe says nothing about the current next index
        if (response.getExpectedNextIndex() != follower.nextIndex()) {
            return;
        }

        long nextIndex = follower.nextIndex() - 1;
        if (nextIndex <= follower.matchIndex()) {
            LOGGER.error("{} Next index: {} of follower: {} cannot go below its match index: {}", localEndpointStr(),
                    nextIndex, response.getSender().getId(), follower.matchIndex());
            return;
        }

        follower.nextIndex(nextIndex);
        LOGGER.debug("{} next index: {} for follower: {}", localEndpointStr(), nextIndex, response.getSender().getId());
        node.sendAppendEntriesRequest(response.getSender());
    }

}

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
import io.raftcore.impl.state.LeaderState;
import io.raftcore.model.message.AppendEntriesSuccessResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static io.raftcore.RaftRole.LEADER;

/**
 * Moves the match index and the next index of a follower forward after it has appended entries, then tries to commit.
 * The response may also ack the open query round.
 * <p>
 * See <i>5.3 Log replication</i> of the Raft paper.
 */
public class AppendEntriesSuccessResponseHandler
        extends AbstractResponseHandler<AppendEntriesSuccessResponse> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppendEntriesSuccessResponseHandler.class);

    public AppendEntriesSuccessResponseHandler(RaftNodeImpl raftNode, AppendEntriesSuccessResponse response) {
        super(raftNode, response);
    }

    @Override
    protected void handleResponse(@Nonnull AppendEntriesSuccessResponse response) {
        if (state.role() != LEADER || response.getTerm() != state.term()) {
            LOGGER.debug("{} Ignored {}, role: {}, term: {}", localEndpointStr(), response, state.role(), state.term());
            return;
        }

        LeaderState leaderState = state.leaderState();
        FollowerState follower = leaderState.getFollowerStateOrNull(response.getSender());
        if (follower == null) {
            LOGGER.warn("{} Ignored {} of a non-follower.", localEndpointStr(), response);
            return;
        }

        LOGGER.debug("{} received {}.", localEndpointStr(), response);
        follower.responseReceived(response.getFlowControlSequenceNumber(), node.getClock().millis());
        leaderState.queryState().tryAck(response.getQuerySequenceNumber(), response.getSender());

        long appendedIndex = response.getLastLogIndex();
        boolean committed = false;
        if (appendedIndex > follower.matchIndex()) {
            follower.matchIndex(appendedIndex);
            follower.nextIndex(appendedIndex + 1);
            LOGGER.debug("{} match index: {} for follower: {}", localEndpointStr(), appendedIndex,
                    response.getSender().getId());

            committed = node.tryAdvanceCommitIndex();
            if (!committed && needsAnotherRequest(appendedIndex)) {
                node.sendAppendEntriesRequest(response.getSender());
            }
        }

        if (!committed) {
            // the ack above may complete the query round
            node.tryRunQueries();
        }

        if (state.leaderState() != null && state.leaderState().queryState()
                                                   .isAckNeeded(response.getSender(), state.majority())) {
            node.sendAppendEntriesRequest(response.getSender());
        }
    }

    /**
     * Returns true if the follower still misses entries or does not know that its last entry is committed.
     */
    private boolean needsAnotherRequest(long followerLastLogIndex) {
        return followerLastLogIndex < state.log().lastLogIndex() || followerLastLogIndex == state.commitIndex();
    }

}

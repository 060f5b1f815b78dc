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
import io.raftcore.model.message.PreVoteRequest;
import io.raftcore.model.message.PreVoteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Answers whether the sender of a {@link PreVoteRequest} could win an election in the next term. Neither the term nor
 * the vote of the local Raft node changes.
 * <p>
 * Nodes that still hear from a leader never grant a pre-vote, so a member rejoining after a partition cannot force the
 * group into a new term. See <i>Four modifications for the Raft consensus algorithm</i> by Henrik Ingo.
 */
public class PreVoteRequestHandler
        extends AbstractMessageHandler<PreVoteRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PreVoteRequestHandler.class);

    public PreVoteRequestHandler(RaftNodeImpl raftNode, PreVoteRequest request) {
        super(raftNode, request);
    }

    @Override
    protected void handle(@Nonnull PreVoteRequest request) {
        RaftEndpoint sender = request.getSender();
        int nextTerm = request.getTerm();

        if (nextTerm < state.term()) {
            LOGGER.info("{} Rejecting {} of stale term, current term: {}", localEndpointStr(), request, state.term());
            reply(sender, state.term(), false);
            if (state.leaderState() != null) {
                node.sendAppendEntriesRequest(sender);
            }
        } else if (state.leaderState() != null || !node.isLeaderHeartbeatTimeoutElapsed()) {
            LOGGER.info("{} Rejecting {} since the leader is still alive.", localEndpointStr(), request);
            reply(sender, state.term(), false);
        } else if (!state.log().isNotAheadOf(request.getLastLogTerm(), request.getLastLogIndex())) {
            LOGGER.info("{} Rejecting {} since local log is ahead. Last log term: {}, last log index: {}",
                    localEndpointStr(), request, state.log().lastLogTerm(), state.log().lastLogIndex());
            reply(sender, nextTerm, false);
        } else {
            LOGGER.info("{} Granted pre-vote for {}", localEndpointStr(), request);
            reply(sender, nextTerm, true);
        }
    }

    private void reply(RaftEndpoint sender, int term, boolean granted) {
        node.send(sender, modelFactory.createPreVoteResponseBuilder()
                                      .setGroupId(node.getGroupId())
                                      .setSender(localEndpoint())
                                      .setTerm(term)
                                      .setGranted(granted)
                                      .build());
    }

}

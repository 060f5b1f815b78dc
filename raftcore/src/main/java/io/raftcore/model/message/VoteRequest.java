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

package io.raftcore.model.message;

import io.raftcore.RaftEndpoint;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Raft message for the RequestVote RPC. Sent by candidates to gather votes. The sender is the candidate.
 * <p>
 * A sticky request is rejected by a Raft node that heard from a live leader recently.
 */
public interface VoteRequest
        extends RaftMessage {

    int getLastLogTerm();

    long getLastLogIndex();

    boolean isSticky();

    /**
     * The builder interface for {@link VoteRequest}.
     */
    interface VoteRequestBuilder
            extends RaftMessageBuilder<VoteRequest> {

        @Nonnull
        VoteRequestBuilder setGroupId(@Nonnull Object groupId);

        @Nonnull
        VoteRequestBuilder setSender(@Nonnull RaftEndpoint sender);

        @Nonnull
        VoteRequestBuilder setTerm(@Nonnegative int term);

        @Nonnull
        VoteRequestBuilder setLastLogTerm(@Nonnegative int lastLogTerm);

        @Nonnull
        VoteRequestBuilder setLastLogIndex(@Nonnegative long lastLogIndex);

        @Nonnull
        VoteRequestBuilder setSticky(boolean sticky);

    }

}

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
 * Positive response for {@link AppendEntriesRequest}. Carries the last log index the follower has in common with the leader
 * after handling the request.
 */
public interface AppendEntriesSuccessResponse
        extends RaftMessage {

    long getLastLogIndex();

    long getQuerySequenceNumber();

    long getFlowControlSequenceNumber();

    /**
     * The builder interface for {@link AppendEntriesSuccessResponse}.
     */
    interface AppendEntriesSuccessResponseBuilder
            extends RaftMessageBuilder<AppendEntriesSuccessResponse> {

        @Nonnull
        AppendEntriesSuccessResponseBuilder setGroupId(@Nonnull Object groupId);

        @Nonnull
        AppendEntriesSuccessResponseBuilder setSender(@Nonnull RaftEndpoint sender);

        @Nonnull
        AppendEntriesSuccessResponseBuilder setTerm(@Nonnegative int term);

        @Nonnull
        AppendEntriesSuccessResponseBuilder setLastLogIndex(@Nonnegative long lastLogIndex);

        @Nonnull
        AppendEntriesSuccessResponseBuilder setQuerySequenceNumber(@Nonnegative long querySequenceNumber);

        @Nonnull
        AppendEntriesSuccessResponseBuilder setFlowControlSequenceNumber(@Nonnegative long flowControlSequenceNumber);

    }

}

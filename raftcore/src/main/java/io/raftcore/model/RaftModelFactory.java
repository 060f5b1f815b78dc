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

package io.raftcore.model;

import io.raftcore.RaftNode;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;
import io.raftcore.model.impl.DefaultRaftModelFactory;
import io.raftcore.model.log.LogEntry.LogEntryBuilder;
import io.raftcore.model.message.AppendEntriesFailureResponse.AppendEntriesFailureResponseBuilder;
import io.raftcore.model.message.AppendEntriesRequest.AppendEntriesRequestBuilder;
import io.raftcore.model.message.AppendEntriesSuccessResponse.AppendEntriesSuccessResponseBuilder;
import io.raftcore.model.message.PreVoteRequest.PreVoteRequestBuilder;
import io.raftcore.model.message.PreVoteResponse.PreVoteResponseBuilder;
import io.raftcore.model.message.VoteRequest.VoteRequestBuilder;
import io.raftcore.model.message.VoteResponse.VoteResponseBuilder;
import io.raftcore.model.persistence.RaftTermPersistentState.RaftTermPersistentStateBuilder;

import javax.annotation.Nonnull;

/**
 * Used for creating {@link RaftModel} objects with the builder pattern.
 * <p>
 * Users can provide an implementation of this interface while creating {@link RaftNode} instances, for instance to create
 * objects that their transport layer knows how to serialize. Otherwise, {@link DefaultRaftModelFactory} is used.
 * <p>
 * A {@link RaftModelFactory} implementation can implement {@link RaftNodeLifecycleAware} to perform initialization and
 * clean up work during Raft node startup and termination.
 */
public interface RaftModelFactory {

    @Nonnull
    LogEntryBuilder createLogEntryBuilder();

    @Nonnull
    RaftTermPersistentStateBuilder createRaftTermPersistentStateBuilder();

    @Nonnull
    AppendEntriesRequestBuilder createAppendEntriesRequestBuilder();

    @Nonnull
    AppendEntriesSuccessResponseBuilder createAppendEntriesSuccessResponseBuilder();

    @Nonnull
    AppendEntriesFailureResponseBuilder createAppendEntriesFailureResponseBuilder();

    @Nonnull
    PreVoteRequestBuilder createPreVoteRequestBuilder();

    @Nonnull
    PreVoteResponseBuilder createPreVoteResponseBuilder();

    @Nonnull
    VoteRequestBuilder createVoteRequestBuilder();

    @Nonnull
    VoteResponseBuilder createVoteResponseBuilder();

}

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

package io.raftcore.model.impl;

import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.impl.log.DefaultLogEntry;
import io.raftcore.model.impl.message.DefaultAppendEntriesFailureResponse;
import io.raftcore.model.impl.message.DefaultAppendEntriesRequest;
import io.raftcore.model.impl.message.DefaultAppendEntriesSuccessResponse;
import io.raftcore.model.impl.message.DefaultPreVoteRequest;
import io.raftcore.model.impl.message.DefaultPreVoteResponse;
import io.raftcore.model.impl.message.DefaultVoteRequest;
import io.raftcore.model.impl.message.DefaultVoteResponse;
import io.raftcore.model.impl.persistence.DefaultRaftTermPersistentState;
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
 * The default implementation of {@link RaftModelFactory}.
 * <p>
 * Every builder creates an immutable object of the {@code io.raftcore.model.impl} package.
 */
public class DefaultRaftModelFactory
        implements RaftModelFactory {

    @Nonnull
    @Override
    public LogEntryBuilder createLogEntryBuilder() {
        return DefaultLogEntry.newBuilder();
    }

    @Nonnull
    @Override
    public RaftTermPersistentStateBuilder createRaftTermPersistentStateBuilder() {
        return DefaultRaftTermPersistentState.newBuilder();
    }

    @Nonnull
    @Override
    public AppendEntriesRequestBuilder createAppendEntriesRequestBuilder() {
        return DefaultAppendEntriesRequest.newBuilder();
    }

    @Nonnull
    @Override
    public AppendEntriesSuccessResponseBuilder createAppendEntriesSuccessResponseBuilder() {
        return DefaultAppendEntriesSuccessResponse.newBuilder();
    }

    @Nonnull
    @Override
    public AppendEntriesFailureResponseBuilder createAppendEntriesFailureResponseBuilder() {
        return DefaultAppendEntriesFailureResponse.newBuilder();
    }

    @Nonnull
    @Override
    public PreVoteRequestBuilder createPreVoteRequestBuilder() {
        return DefaultPreVoteRequest.newBuilder();
    }

    @Nonnull
    @Override
    public PreVoteResponseBuilder createPreVoteResponseBuilder() {
        return DefaultPreVoteResponse.newBuilder();
    }

    @Nonnull
    @Override
    public VoteRequestBuilder createVoteRequestBuilder() {
        return DefaultVoteRequest.newBuilder();
    }

    @Nonnull
    @Override
    public VoteResponseBuilder createVoteResponseBuilder() {
        return DefaultVoteResponse.newBuilder();
    }

}

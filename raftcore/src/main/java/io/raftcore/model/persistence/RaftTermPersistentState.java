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

package io.raftcore.model.persistence;

import io.raftcore.RaftEndpoint;
import io.raftcore.model.RaftModel;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The term and the vote of a Raft node. Must be flushed to stable storage before the Raft node acts on it.
 */
public interface RaftTermPersistentState
        extends RaftModel {

    int getTerm();

    @Nullable
    RaftEndpoint getVotedFor();

    /**
     * The builder interface for {@link RaftTermPersistentState}.
     */
    interface RaftTermPersistentStateBuilder {

        @Nonnull
        RaftTermPersistentStateBuilder setTerm(@Nonnegative int term);

        @Nonnull
        RaftTermPersistentStateBuilder setVotedFor(@Nullable RaftEndpoint votedFor);

        @Nonnull
        RaftTermPersistentState build();

    }

}

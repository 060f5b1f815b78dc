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

package io.raftcore.model.impl.persistence;

import io.raftcore.RaftEndpoint;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.model.persistence.RaftTermPersistentState.RaftTermPersistentStateBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable {@link RaftTermPersistentState}. Instances are created via {@link #newBuilder()}.
 */
public final class DefaultRaftTermPersistentState
        implements RaftTermPersistentState {

    private final int term;
    private final RaftEndpoint votedFor;

    private DefaultRaftTermPersistentState(Builder builder) {
        this.term = builder.term;
        this.votedFor = builder.votedFor;
    }

    @Nonnull
    public static RaftTermPersistentStateBuilder newBuilder() {
        return new Builder();
    }

    @Override
    public int getTerm() {
        return term;
    }

    @Nullable
    @Override
    public RaftEndpoint getVotedFor() {
        return votedFor;
    }

    @Override
    public String toString() {
        return "RaftTermPersistentState{term=" + term + ", votedFor=" + (votedFor != null ? votedFor.getId() : null)
                + '}';
    }

    /**
     * Collects the fields of a {@link DefaultRaftTermPersistentState}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements RaftTermPersistentStateBuilder {

        private int term;
        private RaftEndpoint votedFor;

        private Builder() {
        }

        @Nonnull
        @Override
        public RaftTermPersistentStateBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public RaftTermPersistentStateBuilder setVotedFor(@Nullable RaftEndpoint votedFor) {
            this.votedFor = votedFor;
            return this;
        }

        @Nonnull
        @Override
        public RaftTermPersistentState build() {
            return new DefaultRaftTermPersistentState(this);
        }

    }

}

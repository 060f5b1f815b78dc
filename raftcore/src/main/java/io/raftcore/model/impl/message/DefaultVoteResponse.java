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

package io.raftcore.model.impl.message;

import io.raftcore.RaftEndpoint;
import io.raftcore.model.message.VoteResponse;
import io.raftcore.model.message.VoteResponse.VoteResponseBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link VoteResponse}. Instances are created via {@link #newBuilder()}.
 */
public final class DefaultVoteResponse
        implements VoteResponse {

    private final Object groupId;
    private final RaftEndpoint sender;
    private final int term;
    private final boolean granted;

    private DefaultVoteResponse(Builder builder) {
        this.groupId = requireNonNull(builder.groupId, "groupId");
        this.sender = requireNonNull(builder.sender, "sender");
        this.term = builder.term;
        this.granted = builder.granted;
    }

    @Nonnull
    public static VoteResponseBuilder newBuilder() {
        return new Builder();
    }

    @Override
    public Object getGroupId() {
        return groupId;
    }

    @Nonnull
    @Override
    public RaftEndpoint getSender() {
        return sender;
    }

    @Override
    public int getTerm() {
        return term;
    }

    @Override
    public boolean isGranted() {
        return granted;
    }

    @Override
    public String toString() {
        return "VoteResponse{groupId=" + groupId + ", sender=" + sender.getId() + ", term=" + term + ", granted="
                + granted + '}';
    }

    /**
     * Collects the fields of a {@link DefaultVoteResponse}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements VoteResponseBuilder {

        private Object groupId;
        private RaftEndpoint sender;
        private int term;
        private boolean granted;

        private Builder() {
        }

        @Nonnull
        @Override
        public VoteResponseBuilder setGroupId(@Nonnull Object groupId) {
            this.groupId = groupId;
            return this;
        }

        @Nonnull
        @Override
        public VoteResponseBuilder setSender(@Nonnull RaftEndpoint sender) {
            this.sender = sender;
            return this;
        }

        @Nonnull
        @Override
        public VoteResponseBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public VoteResponseBuilder setGranted(boolean granted) {
            this.granted = granted;
            return this;
        }

        @Nonnull
        @Override
        public VoteResponse build() {
            return new DefaultVoteResponse(this);
        }

    }

}

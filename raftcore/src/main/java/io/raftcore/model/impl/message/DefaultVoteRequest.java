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
import io.raftcore.model.message.VoteRequest;
import io.raftcore.model.message.VoteRequest.VoteRequestBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link VoteRequest}. Instances are created via {@link #newBuilder()}.
 * <p>
 * Asks for the vote of the receiver for the sender in the given term.
 */
public final class DefaultVoteRequest
        implements VoteRequest {

    private final Object groupId;
    private final RaftEndpoint sender;
    private final int term;
    private final int lastLogTerm;
    private final long lastLogIndex;
    private final boolean sticky;

    private DefaultVoteRequest(Builder builder) {
        this.groupId = requireNonNull(builder.groupId, "groupId");
        this.sender = requireNonNull(builder.sender, "sender");
        this.term = builder.term;
        this.lastLogTerm = builder.lastLogTerm;
        this.lastLogIndex = builder.lastLogIndex;
        this.sticky = builder.sticky;
    }

    @Nonnull
    public static VoteRequestBuilder newBuilder() {
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
    public int getLastLogTerm() {
        return lastLogTerm;
    }

    @Override
    public long getLastLogIndex() {
        return lastLogIndex;
    }

    @Override
    public boolean isSticky() {
        return sticky;
    }

    @Override
    public String toString() {
        return "VoteRequest{groupId=" + groupId + ", sender=" + sender.getId() + ", term=" + term + ", lastLogTerm="
                + lastLogTerm + ", lastLogIndex=" + lastLogIndex + ", sticky=" + sticky + '}';
    }

    /**
     * Collects the fields of a {@link DefaultVoteRequest}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements VoteRequestBuilder {

        private Object groupId;
        private RaftEndpoint sender;
        private int term;
        private int lastLogTerm;
        private long lastLogIndex;
        private boolean sticky;

        private Builder() {
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setGroupId(@Nonnull Object groupId) {
            this.groupId = groupId;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setSender(@Nonnull RaftEndpoint sender) {
            this.sender = sender;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setLastLogTerm(@Nonnegative int lastLogTerm) {
            this.lastLogTerm = lastLogTerm;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setLastLogIndex(@Nonnegative long lastLogIndex) {
            this.lastLogIndex = lastLogIndex;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequestBuilder setSticky(boolean sticky) {
            this.sticky = sticky;
            return this;
        }

        @Nonnull
        @Override
        public VoteRequest build() {
            return new DefaultVoteRequest(this);
        }

    }

}

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
import io.raftcore.model.message.AppendEntriesFailureResponse;
import io.raftcore.model.message.AppendEntriesFailureResponse.AppendEntriesFailureResponseBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link AppendEntriesFailureResponse}. Instances are created via {@link #newBuilder()}.
 * <p>
 * The expected next index tells the leader where the log of the sender diverges.
 */
public final class DefaultAppendEntriesFailureResponse
        implements AppendEntriesFailureResponse {

    private final Object groupId;
    private final RaftEndpoint sender;
    private final int term;
    private final long expectedNextIndex;
    private final long querySequenceNumber;
    private final long flowControlSequenceNumber;

    private DefaultAppendEntriesFailureResponse(Builder builder) {
        this.groupId = requireNonNull(builder.groupId, "groupId");
        this.sender = requireNonNull(builder.sender, "sender");
        this.term = builder.term;
        this.expectedNextIndex = builder.expectedNextIndex;
        this.querySequenceNumber = builder.querySequenceNumber;
        this.flowControlSequenceNumber = builder.flowControlSequenceNumber;
    }

    @Nonnull
    public static AppendEntriesFailureResponseBuilder newBuilder() {
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
    public long getExpectedNextIndex() {
        return expectedNextIndex;
    }

    @Override
    public long getQuerySequenceNumber() {
        return querySequenceNumber;
    }

    @Override
    public long getFlowControlSequenceNumber() {
        return flowControlSequenceNumber;
    }

    @Override
    public String toString() {
        return "AppendEntriesFailureResponse{groupId=" + groupId + ", sender=" + sender.getId() + ", term=" + term
                + ", expectedNextIndex=" + expectedNextIndex + ", querySequenceNumber=" + querySequenceNumber
                + ", flowControlSequenceNumber=" + flowControlSequenceNumber + '}';
    }

    /**
     * Collects the fields of a {@link DefaultAppendEntriesFailureResponse}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements AppendEntriesFailureResponseBuilder {

        private Object groupId;
        private RaftEndpoint sender;
        private int term;
        private long expectedNextIndex;
        private long querySequenceNumber;
        private long flowControlSequenceNumber;

        private Builder() {
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setGroupId(@Nonnull Object groupId) {
            this.groupId = groupId;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setSender(@Nonnull RaftEndpoint sender) {
            this.sender = sender;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setExpectedNextIndex(@Nonnegative long expectedNextIndex) {
            this.expectedNextIndex = expectedNextIndex;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setQuerySequenceNumber(@Nonnegative long querySequenceNumber) {
            this.querySequenceNumber = querySequenceNumber;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponseBuilder setFlowControlSequenceNumber(@Nonnegative long flowControlSequenceNumber) {
            this.flowControlSequenceNumber = flowControlSequenceNumber;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesFailureResponse build() {
            return new DefaultAppendEntriesFailureResponse(this);
        }

    }

}

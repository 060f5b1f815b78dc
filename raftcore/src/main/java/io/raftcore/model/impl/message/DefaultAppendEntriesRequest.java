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
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.message.AppendEntriesRequest.AppendEntriesRequestBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.util.List;

import static java.util.Collections.emptyList;
import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link AppendEntriesRequest}. Instances are created via {@link #newBuilder()}.
 * <p>
 * An empty entry list makes the request a heartbeat.
 */
public final class DefaultAppendEntriesRequest
        implements AppendEntriesRequest {

    private final Object groupId;
    private final RaftEndpoint sender;
    private final int term;
    private final int previousLogTerm;
    private final long previousLogIndex;
    private final long commitIndex;
    private final List<LogEntry> logEntries;
    private final long querySequenceNumber;
    private final long flowControlSequenceNumber;

    private DefaultAppendEntriesRequest(Builder builder) {
        this.groupId = requireNonNull(builder.groupId, "groupId");
        this.sender = requireNonNull(builder.sender, "sender");
        this.term = builder.term;
        this.previousLogTerm = builder.previousLogTerm;
        this.previousLogIndex = builder.previousLogIndex;
        this.commitIndex = builder.commitIndex;
        this.logEntries = builder.logEntries;
        this.querySequenceNumber = builder.querySequenceNumber;
        this.flowControlSequenceNumber = builder.flowControlSequenceNumber;
    }

    @Nonnull
    public static AppendEntriesRequestBuilder newBuilder() {
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
    public int getPreviousLogTerm() {
        return previousLogTerm;
    }

    @Override
    public long getPreviousLogIndex() {
        return previousLogIndex;
    }

    @Override
    public long getCommitIndex() {
        return commitIndex;
    }

    @Nonnull
    @Override
    public List<LogEntry> getLogEntries() {
        return logEntries;
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
        return "AppendEntriesRequest{groupId=" + groupId + ", sender=" + sender.getId() + ", term=" + term
                + ", previousLogTerm=" + previousLogTerm + ", previousLogIndex=" + previousLogIndex + ", commitIndex="
                + commitIndex + ", logEntryCount=" + logEntries.size() + ", querySequenceNumber="
                + querySequenceNumber + ", flowControlSequenceNumber=" + flowControlSequenceNumber + '}';
    }

    /**
     * Collects the fields of a {@link DefaultAppendEntriesRequest}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements AppendEntriesRequestBuilder {

        private Object groupId;
        private RaftEndpoint sender;
        private int term;
        private int previousLogTerm;
        private long previousLogIndex;
        private long commitIndex;
        private List<LogEntry> logEntries = emptyList();
        private long querySequenceNumber;
        private long flowControlSequenceNumber;

        private Builder() {
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setGroupId(@Nonnull Object groupId) {
            this.groupId = groupId;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setSender(@Nonnull RaftEndpoint sender) {
            this.sender = sender;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setPreviousLogTerm(@Nonnegative int previousLogTerm) {
            this.previousLogTerm = previousLogTerm;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setPreviousLogIndex(@Nonnegative long previousLogIndex) {
            this.previousLogIndex = previousLogIndex;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setCommitIndex(@Nonnegative long commitIndex) {
            this.commitIndex = commitIndex;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setLogEntries(@Nonnull List<LogEntry> logEntries) {
            this.logEntries = requireNonNull(logEntries);
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setQuerySequenceNumber(@Nonnegative long querySequenceNumber) {
            this.querySequenceNumber = querySequenceNumber;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequestBuilder setFlowControlSequenceNumber(@Nonnegative long flowControlSequenceNumber) {
            this.flowControlSequenceNumber = flowControlSequenceNumber;
            return this;
        }

        @Nonnull
        @Override
        public AppendEntriesRequest build() {
            return new DefaultAppendEntriesRequest(this);
        }

    }

}

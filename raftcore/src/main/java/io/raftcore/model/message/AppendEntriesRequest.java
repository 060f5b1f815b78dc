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
import io.raftcore.model.log.LogEntry;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import java.util.List;

/**
 * Raft message for the AppendEntries RPC. Sent by the leader to replicate log entries and also used as heartbeat when it
 * carries no entries. The sender is the leader.
 * <p>
 * {@link #getCommitIndex()} is the leader's commit index. The query sequence number is used by the leader to collect
 * acknowledgements for linearizable queries and the flow control sequence number is used to match responses with the
 * request backoff state of the follower.
 */
public interface AppendEntriesRequest
        extends RaftMessage {

    int getPreviousLogTerm();

    long getPreviousLogIndex();

    long getCommitIndex();

    @Nonnull
    List<LogEntry> getLogEntries();

    long getQuerySequenceNumber();

    long getFlowControlSequenceNumber();

    /**
     * The builder interface for {@link AppendEntriesRequest}.
     */
    interface AppendEntriesRequestBuilder
            extends RaftMessageBuilder<AppendEntriesRequest> {

        @Nonnull
        AppendEntriesRequestBuilder setGroupId(@Nonnull Object groupId);

        @Nonnull
        AppendEntriesRequestBuilder setSender(@Nonnull RaftEndpoint sender);

        @Nonnull
        AppendEntriesRequestBuilder setTerm(@Nonnegative int term);

        @Nonnull
        AppendEntriesRequestBuilder setPreviousLogTerm(@Nonnegative int previousLogTerm);

        @Nonnull
        AppendEntriesRequestBuilder setPreviousLogIndex(@Nonnegative long previousLogIndex);

        @Nonnull
        AppendEntriesRequestBuilder setCommitIndex(@Nonnegative long commitIndex);

        @Nonnull
        AppendEntriesRequestBuilder setLogEntries(@Nonnull List<LogEntry> logEntries);

        @Nonnull
        AppendEntriesRequestBuilder setQuerySequenceNumber(@Nonnegative long querySequenceNumber);

        @Nonnull
        AppendEntriesRequestBuilder setFlowControlSequenceNumber(@Nonnegative long flowControlSequenceNumber);

    }

}

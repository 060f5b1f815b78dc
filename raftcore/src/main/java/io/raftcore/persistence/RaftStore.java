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

package io.raftcore.persistence;

import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.statemachine.StateMachine;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Persists the internal state of the Raft consensus algorithm: the local endpoint, the initial group members, the term and
 * vote, and the Raft log. Internal state of {@link StateMachine} implementations are not persisted with this interface.
 * <p>
 * A Raft node treats an {@link IOException} thrown by any of these methods as fatal. It terminates itself with a
 * {@link PersistenceFailureException}, because it can no longer guarantee that its promises, such as a granted vote, survive
 * a restart.
 * <p>
 * A {@link RaftStore} implementation can implement {@link RaftNodeLifecycleAware} to perform initialization and clean up
 * work during {@link RaftNode} startup and termination.
 */
public interface RaftStore {

    /**
     * Persists and flushes the given local Raft endpoint. When this method returns, the given data has become durable.
     *
     * @param localEndpoint
     *            the Raft endpoint of the local Raft node to persist
     *
     * @throws IOException
     *             if any failure occurs during persisting the given value
     */
    void persistAndFlushLocalEndpoint(@Nonnull RaftEndpoint localEndpoint) throws IOException;

    /**
     * Persists and flushes the given initial Raft group members. When this method returns, the given data has become
     * durable.
     *
     * @param initialGroupMembers
     *            the initial Raft group member list to persist
     *
     * @throws IOException
     *             if any failure occurs during persisting the given values
     */
    void persistAndFlushInitialGroupMembers(@Nonnull Collection<RaftEndpoint> initialGroupMembers) throws IOException;

    /**
     * Persists and flushes the term and the Raft endpoint that the local Raft node voted for in that term. A Raft node calls
     * this method before it acts on a new term or sends a vote.
     *
     * @param termPersistentState
     *            the term and vote to persist
     *
     * @throws IOException
     *             if any failure occurs during persisting the given values
     */
    void persistAndFlushTerm(@Nonnull RaftTermPersistentState termPersistentState) throws IOException;

    /**
     * Persists the given log entries. The entries have sequential indices and the first entry follows the last persisted
     * one, unless {@link #truncateLogEntriesFrom(long)} rolled the log back in between. The entries are durable only after
     * {@link #flush()} returns.
     *
     * @param logEntries
     *            the log entries to persist
     *
     * @throws IOException
     *             if any failure occurs during persisting the given log entries
     */
    void persistLogEntries(@Nonnull List<LogEntry> logEntries) throws IOException;

    /**
     * Rolls back the log by truncating all entries starting with the given index. A truncated log entry is no longer valid
     * and must not be restored.
     *
     * @param logIndexInclusive
     *            the log index value from which the log entries must be truncated
     *
     * @throws IOException
     *             if any failure occurs during truncating the log entries
     */
    void truncateLogEntriesFrom(long logIndexInclusive) throws IOException;

    /**
     * Forces all buffered Raft log changes to be written to the storage and returns after those changes are written.
     *
     * @throws IOException
     *             if any failure occurs during the flush operation
     */
    void flush() throws IOException;

}

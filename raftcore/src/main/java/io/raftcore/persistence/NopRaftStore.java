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
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.List;

/**
 * Used when a Raft node runs only in memory and does not survive restarts.
 */
public final class NopRaftStore
        implements RaftStore {

    public static final NopRaftStore INSTANCE = new NopRaftStore();

    private NopRaftStore() {
    }

    @Override
    public void persistAndFlushLocalEndpoint(@Nonnull RaftEndpoint localEndpoint) {
    }

    @Override
    public void persistAndFlushInitialGroupMembers(@Nonnull Collection<RaftEndpoint> initialGroupMembers) {
    }

    @Override
    public void persistAndFlushTerm(@Nonnull RaftTermPersistentState termPersistentState) {
    }

    @Override
    public void persistLogEntries(@Nonnull List<LogEntry> logEntries) {
    }

    @Override
    public void truncateLogEntriesFrom(long logIndexInclusive) {
    }

    @Override
    public void flush() {
    }

}

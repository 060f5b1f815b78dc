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
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Contains restored state of a {@link RaftNode}. All the fields in this class are persisted via {@link RaftStore}.
 */
public final class RestoredRaftState {

    private final RaftEndpoint localEndpoint;
    private final List<RaftEndpoint> initialGroupMembers;
    private final RaftTermPersistentState termPersistentState;
    private final List<LogEntry> entries;

    public RestoredRaftState(@Nonnull RaftEndpoint localEndpoint, @Nonnull Collection<RaftEndpoint> initialGroupMembers,
                             @Nonnull RaftTermPersistentState termPersistentState, @Nonnull List<LogEntry> entries) {
        this.localEndpoint = requireNonNull(localEndpoint);
        this.initialGroupMembers = unmodifiableList(new ArrayList<>(requireNonNull(initialGroupMembers)));
        this.termPersistentState = requireNonNull(termPersistentState);
        this.entries = requireNonNull(entries);
    }

    @Nonnull
    public RaftEndpoint getLocalEndpoint() {
        return localEndpoint;
    }

    @Nonnull
    public List<RaftEndpoint> getInitialGroupMembers() {
        return initialGroupMembers;
    }

    @Nonnull
    public RaftTermPersistentState getTermPersistentState() {
        return termPersistentState;
    }

    @Nonnull
    public List<LogEntry> getLogEntries() {
        return entries;
    }

}

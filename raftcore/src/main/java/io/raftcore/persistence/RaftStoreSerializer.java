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
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.transport.Transport;

import javax.annotation.Nonnull;

/**
 * Similarly to the {@link RaftModelFactory}, users of the disk-based {@link RaftStore} implementations provide the
 * conversion of a few types into binary data. This logic usually exists in the {@link Transport} implementation as well.
 * Persisted data may be read back long after it is written, so evolution of the serialized types must be considered.
 */
public interface RaftStoreSerializer {

    Serializer<RaftEndpoint> raftEndpointSerializer();

    Serializer<LogEntry> logEntrySerializer();

    Serializer<RaftTermPersistentState> raftTermPersistentStateSerializer();

    /**
     * Converts objects of a single type to and from bytes.
     *
     * @param <T>
     *            the serialized type
     */
    interface Serializer<T> {

        @Nonnull
        byte[] serialize(@Nonnull T element);

        @Nonnull
        T deserialize(@Nonnull byte[] element);

    }

}

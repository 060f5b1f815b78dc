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

package io.raftcore.model;

import io.raftcore.persistence.RaftStore;
import io.raftcore.transport.Transport;

/**
 * The base interface for the objects that hit the network and persistent storage.
 * <p>
 * Raft model objects are created by {@link RaftModelFactory}, sent over the network by {@link Transport} and written to
 * stable storage by {@link RaftStore}.
 */
public interface RaftModel {
}

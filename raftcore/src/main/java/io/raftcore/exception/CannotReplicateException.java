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

package io.raftcore.exception;

import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;

/**
 * Thrown when an operation cannot be temporarily replicated. It can occur in one of the following cases:
 * <ul>
 * <li>There are too many uncommitted operations in the leader's Raft log, see
 * {@link RaftConfig#getMaxPendingLogEntryCount()},</li>
 * <li>A linearizable query is sent to a new leader which has not committed an entry in its current term yet.</li>
 * </ul>
 * The operation can be retried on the same Raft node after some time.
 */
public class CannotReplicateException
        extends RaftException {

    private static final long serialVersionUID = 4407025930140337716L;

    public CannotReplicateException(RaftEndpoint leader) {
        super("Cannot replicate new operations for now", leader);
    }

}

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

package io.raftcore;

/**
 * Statuses of a Raft node during its lifecycle.
 *
 * @see RaftNode
 */
public enum RaftNodeStatus {

    /**
     * Initial status of a Raft node. It stays in this status until it is started.
     */
    INITIAL,

    /**
     * A Raft node stays in this status while it executes the Raft consensus algorithm.
     */
    ACTIVE,

    /**
     * A Raft node moves to this status when it is terminated, either via {@link RaftNode#terminate()} or because its
     * persistent state could not be written. A terminated Raft node does not execute the Raft consensus algorithm anymore.
     */
    TERMINATED;

    /**
     * Returns true if the given Raft node status is a terminal.
     *
     * @param status
     *            the status to check
     *
     * @return true if the given status is terminal
     */
    public static boolean isTerminal(RaftNodeStatus status) {
        return status == TERMINATED;
    }

}

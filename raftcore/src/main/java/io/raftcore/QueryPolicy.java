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
 * Policies to decide how a query operation will be executed on the state machine. Each policy offers different consistency
 * guarantees.
 */
public enum QueryPolicy {

    /**
     * Runs the query on the local state machine of any Raft node.
     * <p>
     * Reading stale value is possible when a follower lags behind the leader.
     */
    EVENTUAL_CONSISTENCY,

    /**
     * Runs the query on the local state machine of the leader Raft node.
     * <p>
     * The leader Raft node executes a given query with its local state machine if it has heard from a majority of the group
     * within the leader heartbeat timeout. Stale reads are possible in rare cases of clock drift.
     */
    LEADER_LEASE,

    /**
     * Runs the query in a linearizable manner on the leader Raft node by using the read-index protocol.
     * <p>
     * The leader records its commit index as the read index, confirms its leadership with a quorum round of append-entries
     * requests, and runs the query once the read index is applied.
     */
    LINEARIZABLE

}

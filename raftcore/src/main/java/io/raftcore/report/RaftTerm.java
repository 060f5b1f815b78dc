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

package io.raftcore.report;

import io.raftcore.RaftEndpoint;

import javax.annotation.Nullable;

/**
 * Contains information about a Raft node's current term, its known leader and its vote in that term.
 */
public interface RaftTerm {

    /**
     * Returns the term this Raft node is currently at.
     *
     * @return the term this Raft node is currently at
     */
    int getTerm();

    /**
     * Returns the known leader endpoint in the current term, or null if the leader is not known yet.
     *
     * @return the known leader endpoint in the current term
     */
    @Nullable
    RaftEndpoint getLeaderEndpoint();

    /**
     * Returns the endpoint this Raft node has voted for in the current term, or null if it has not voted yet.
     *
     * @return the endpoint this Raft node has voted for in the current term
     */
    @Nullable
    RaftEndpoint getVotedEndpoint();

}

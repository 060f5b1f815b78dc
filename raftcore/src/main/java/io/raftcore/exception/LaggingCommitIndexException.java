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

import io.raftcore.QueryPolicy;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;

/**
 * Thrown when a Raft node's current commit index is smaller than the commit index specified in a
 * {@link RaftNode#query(Object, QueryPolicy, long)} call. The Raft node cannot execute the query without breaking the
 * monotonicity of the observed state.
 */
public class LaggingCommitIndexException
        extends RaftException {

    private static final long serialVersionUID = -2244714904905721002L;

    public LaggingCommitIndexException(long commitIndex, long expectedCommitIndex, RaftEndpoint leader) {
        super("Commit index: " + commitIndex + " is smaller than min commit index: " + expectedCommitIndex, leader);
    }

}

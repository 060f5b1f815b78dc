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

import io.raftcore.RaftEndpoint;

/**
 * A Raft leader may demote to the follower role after it appends an entry to its local Raft log, but before discovering its
 * commit status. In this case the outcome of the operation is unknown: the entry may or may not be committed by the next
 * leader. Callers receive this exception and decide on retrying by themselves. Retries are safe only if operations are
 * idempotent.
 * <p>
 * A Raft node whose persistent state cannot be written also fails its pending operations with this exception.
 */
public class IndeterminateStateException
        extends RaftException {

    private static final long serialVersionUID = -736303015926722821L;

    public IndeterminateStateException() {
        this(null);
    }

    public IndeterminateStateException(RaftEndpoint leader) {
        super("Operation result is indeterminate", leader);
    }

}

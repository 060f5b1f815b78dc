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

package io.raftcore.statemachine;

import io.raftcore.RaftNode;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The abstraction used by {@link RaftNode} to execute operations on the user-defined state machine.
 * <p>
 * Operations committed in a Raft group are applied to the state machine in the order of their log indices, and each
 * operation is applied exactly once. Queries are also passed to {@link #runOperation(long, Object)}, with the commit index
 * they observe.
 * <p>
 * State machine implementations must be deterministic. They are only called by the Raft node thread, so they need no
 * synchronization for the Raft node's own calls.
 * <p>
 * A state machine implementation can implement {@link RaftNodeLifecycleAware} to perform initialization and clean up work
 * during Raft node startup and termination.
 */
public interface StateMachine {

    /**
     * Executes the given operation on the given commit index.
     * <p>
     * An exception thrown by this method is reported as the result of the operation and does not stop the Raft node.
     *
     * @param commitIndex
     *            the Raft log index the given operation is committed at
     * @param operation
     *            the user-supplied operation to execute
     *
     * @return the result of the operation execution
     */
    Object runOperation(long commitIndex, @Nonnull Object operation);

    /**
     * Returns the operation to be appended after a new leader is elected in a new term. Returning null skips appending an
     * entry. Committing a new-term entry lets the new leader commit the entries of the previous terms without waiting for a
     * new client operation.
     *
     * @return the operation to be appended after a new leader is elected, or null
     */
    @Nullable
    Object getNewTermOperation();

}

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

package io.raftcore.executor;

import io.raftcore.RaftNode;
import io.raftcore.executor.impl.DefaultRaftNodeExecutor;

import javax.annotation.Nonnull;
import java.util.concurrent.TimeUnit;

/**
 * The abstraction used by {@link RaftNode} to execute the Raft consensus algorithm with the Actor model.
 * <p>
 * A Raft node runs by submitting tasks to its Raft node executor. All tasks submitted by a Raft node must be executed
 * serially, with maintaining the happens-before relationship, so that the Raft state and the user-provided state machine
 * are mutated by a single writer without further synchronization.
 * <p>
 * An executor may reject tasks with {@link java.util.concurrent.RejectedExecutionException} once the Raft node is
 * terminated. The Raft node fails the future of a rejected API call.
 * <p>
 * A default implementation, {@link DefaultRaftNodeExecutor} is provided and should be suitable for most of the use-cases.
 *
 * @see RaftNode
 * @see DefaultRaftNodeExecutor
 */
public interface RaftNodeExecutor {

    /**
     * Executes the given task on the underlying platform.
     * <p>
     * The underlying platform is free to execute the given task immediately if it fits to the defined guarantees.
     *
     * @param task
     *            the task to be executed.
     */
    void execute(@Nonnull Runnable task);

    /**
     * Submits the given task for execution. If the caller is already on the Raft node thread, the task is put into the
     * internal task queue.
     *
     * @param task
     *            the task object to be executed later.
     */
    void submit(@Nonnull Runnable task);

    /**
     * Schedules the task to be executed after the given delay, still on the Raft node thread.
     *
     * @param task
     *            the task to be executed in future
     * @param delay
     *            the time from now to delay execution
     * @param timeUnit
     *            the time unit of the delay
     */
    void schedule(@Nonnull Runnable task, long delay, @Nonnull TimeUnit timeUnit);

}

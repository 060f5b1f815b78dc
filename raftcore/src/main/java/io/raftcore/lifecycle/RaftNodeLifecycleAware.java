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

package io.raftcore.lifecycle;

import io.raftcore.RaftNode;
import io.raftcore.executor.RaftNodeExecutor;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.persistence.RaftStore;
import io.raftcore.report.RaftNodeReportListener;
import io.raftcore.statemachine.StateMachine;
import io.raftcore.transport.Transport;

/**
 * Used by {@link RaftNode} to notify its components for its lifecycle-related changes, such as startup and termination.
 * These components are {@link RaftNodeExecutor}, {@link StateMachine}, {@link RaftModelFactory}, {@link Transport},
 * {@link RaftStore}, and {@link RaftNodeReportListener}.
 * <p>
 * {@link RaftNode} only notifies the components that implement this interface, in random order.
 */
public interface RaftNodeLifecycleAware {

    /**
     * Called by {@link RaftNode} during startup. If an exception is thrown, {@link RaftNode} stops its start procedure and
     * immediately terminates itself.
     */
    default void onRaftNodeStart() {
    }

    /**
     * Called by {@link RaftNode} during termination. Exceptions thrown here are logged by {@link RaftNode}.
     */
    default void onRaftNodeTerminate() {
    }

}

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

import io.raftcore.lifecycle.RaftNodeLifecycleAware;

import java.util.function.Consumer;

/**
 * Used for informing external systems about events related to the execution of the Raft consensus algorithm.
 * <p>
 * Called when a Raft node changes its role or status, and periodically. Implementations are called on the Raft node thread
 * and must return promptly. A {@link RaftNodeReportListener} implementation can implement {@link RaftNodeLifecycleAware}.
 */
public interface RaftNodeReportListener
        extends Consumer<RaftNodeReport> {
}

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
 * Represents the result of an operation which is triggered on a Raft node. Contains the result and the commit index on which
 * the operation is executed.
 *
 * @param <T>
 *            type of the actual result object
 */
public interface Ordered<T> {

    /**
     * Returns the commit index on which the operation is executed.
     *
     * @return the commit index on which the operation is executed
     */
    long getCommitIndex();

    /**
     * Returns the actual result of the operation.
     *
     * @return the actual result of the operation
     */
    T getResult();

}

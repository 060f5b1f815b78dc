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

import io.raftcore.persistence.RaftStore;

/**
 * Thrown when the {@link RaftStore} of a Raft node fails to write its persistent state. A Raft node that cannot persist its
 * term, vote or log entries cannot keep its promises to the rest of the group, hence it terminates itself on this failure.
 */
public class PersistenceFailureException
        extends RaftException {

    private static final long serialVersionUID = 1958723476813320431L;

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, null, cause);
    }

}

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

package io.raftcore.model.log;

import io.raftcore.model.RaftModel;
import io.raftcore.model.RaftModelFactory;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Represents an entry in the Raft log.
 * <p>
 * Each log entry stores an operation that will be executed on the state machine along with the term number when the
 * operation was received by the leader. Term numbers are used to detect inconsistencies between logs. Each log entry also
 * has an integer index identifying its position in the Raft log. Indices start from 1.
 * <p>
 * {@link LogEntry} objects are created by {@link RaftModelFactory}.
 */
public interface LogEntry
        extends RaftModel {

    long getIndex();

    int getTerm();

    @Nonnull
    Object getOperation();

    /**
     * The builder interface for {@link LogEntry}.
     */
    interface LogEntryBuilder {

        @Nonnull
        LogEntryBuilder setIndex(@Nonnegative long index);

        @Nonnull
        LogEntryBuilder setTerm(@Nonnegative int term);

        @Nonnull
        LogEntryBuilder setOperation(@Nonnull Object operation);

        @Nonnull
        LogEntry build();

    }

}

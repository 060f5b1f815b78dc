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

package io.raftcore.model.impl.log;

import io.raftcore.model.log.LogEntry;
import io.raftcore.model.log.LogEntry.LogEntryBuilder;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;
import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link LogEntry}. Instances are created via {@link #newBuilder()}.
 * <p>
 * Log entries are compared by their index and term only.
 */
public final class DefaultLogEntry
        implements LogEntry {

    private final long index;
    private final int term;
    private final Object operation;

    private DefaultLogEntry(Builder builder) {
        this.index = builder.index;
        this.term = builder.term;
        this.operation = requireNonNull(builder.operation, "operation");
    }

    @Nonnull
    public static LogEntryBuilder newBuilder() {
        return new Builder();
    }

    @Override
    public long getIndex() {
        return index;
    }

    @Override
    public int getTerm() {
        return term;
    }

    @Nonnull
    @Override
    public Object getOperation() {
        return operation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof LogEntry)) {
            return false;
        }

        LogEntry that = (LogEntry) o;
        return index == that.getIndex() && term == that.getTerm();
    }

    @Override
    public int hashCode() {
        return hash(index, term);
    }

    @Override
    public String toString() {
        return "LogEntry{index=" + index + ", term=" + term + ", operation=" + operation + '}';
    }

    /**
     * Collects the fields of a {@link DefaultLogEntry}. The builder can be reused after {@link #build()}.
     */
    public static final class Builder
            implements LogEntryBuilder {

        private long index;
        private int term;
        private Object operation;

        private Builder() {
        }

        @Nonnull
        @Override
        public LogEntryBuilder setIndex(@Nonnegative long index) {
            this.index = index;
            return this;
        }

        @Nonnull
        @Override
        public LogEntryBuilder setTerm(@Nonnegative int term) {
            this.term = term;
            return this;
        }

        @Nonnull
        @Override
        public LogEntryBuilder setOperation(@Nonnull Object operation) {
            this.operation = operation;
            return this;
        }

        @Nonnull
        @Override
        public LogEntry build() {
            return new DefaultLogEntry(this);
        }

    }

}

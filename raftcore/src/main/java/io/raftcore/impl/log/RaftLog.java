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

package io.raftcore.impl.log;

import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.model.log.LogEntry;
import io.raftcore.persistence.NopRaftStore;
import io.raftcore.persistence.RaftStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.singletonList;
import static java.util.Objects.requireNonNull;

/**
 * {@code RaftLog} keeps and maintains Raft log entries and mirrors every change to the {@link RaftStore}.
 * <p>
 * Index of a log entry is its position in the log and starts from 1. A log entry is never changed once appended. Entries at
 * the end of the log can be truncated to resolve a conflict with a new leader. The Raft node guarantees that committed
 * entries are never truncated.
 * <p>
 * Appended entries become durable only after {@link #flush()}. Failures of the underlying store are reported with
 * {@link PersistenceFailureException}.
 */
public final class RaftLog {

    private final List<LogEntry> entries = new ArrayList<>();
    private final RaftStore store;
    private long flushedLogIndex;
    private boolean dirty;

    private RaftLog(RaftStore store) {
        this.store = requireNonNull(store);
    }

    public static RaftLog create() {
        return create(NopRaftStore.INSTANCE);
    }

    public static RaftLog create(RaftStore store) {
        return new RaftLog(store);
    }

    public static RaftLog restore(List<LogEntry> entries, RaftStore store) {
        RaftLog log = new RaftLog(store);
        long expectedIndex = 1;
        for (LogEntry entry : entries) {
            if (entry.getIndex() != expectedIndex) {
                throw new IllegalArgumentException("Restored log entries are not sequential. Expected index: "
                        + expectedIndex + ", entry: " + entry);
            }

            log.entries.add(entry);
            expectedIndex++;
        }

        log.flushedLogIndex = log.lastLogIndex();

        return log;
    }

    /**
     * Returns the log entry stored at the given index, or null if there is no entry at that index.
     */
    public LogEntry getLogEntry(long entryIndex) {
        if (entryIndex < 1) {
            throw new IllegalArgumentException("Illegal index: " + entryIndex + ". Index starts from 1.");
        } else if (!containsLogEntry(entryIndex)) {
            return null;
        }

        LogEntry logEntry = entries.get(toPosition(entryIndex));
        assert logEntry.getIndex() == entryIndex : "Expected: " + entryIndex + ", Entry: " + logEntry;
        return logEntry;
    }

    public boolean containsLogEntry(long entryIndex) {
        return entryIndex > 0 && entryIndex <= entries.size();
    }

    /**
     * Truncates the log entries starting from the given index, inclusive, and returns the truncated entries.
     */
    public List<LogEntry> truncateEntriesFrom(long entryIndex) {
        if (entryIndex < 1) {
            throw new IllegalArgumentException("Illegal index: " + entryIndex + ". Index starts from 1.");
        } else if (entryIndex > lastLogIndex()) {
            throw new IllegalArgumentException("Illegal index: " + entryIndex + ", last log index: " + lastLogIndex());
        }

        List<LogEntry> tail = entries.subList(toPosition(entryIndex), entries.size());
        List<LogEntry> truncated = new ArrayList<>(tail);
        tail.clear();

        try {
            store.truncateLogEntriesFrom(entryIndex);
        } catch (IOException e) {
            throw new PersistenceFailureException("Could not truncate log entries from index: " + entryIndex, e);
        }

        flushedLogIndex = Math.min(flushedLogIndex, entryIndex - 1);
        dirty = true;

        return truncated;
    }

    public long lastLogIndex() {
        return entries.size();
    }

    public int lastLogTerm() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).getTerm();
    }

    /**
     * Returns true if a log ending with the given term and index is at least as up-to-date as this log. The log with the
     * later last term wins. Logs with the same last term are compared by their length.
     */
    public boolean isNotAheadOf(int otherLastLogTerm, long otherLastLogIndex) {
        int lastLogTerm = lastLogTerm();
        return lastLogTerm != otherLastLogTerm ? lastLogTerm < otherLastLogTerm : lastLogIndex() <= otherLastLogIndex;
    }

    /**
     * Returns the highest log index known to be written to the stable storage.
     */
    public long flushedLogIndex() {
        return flushedLogIndex;
    }

    public void appendEntry(LogEntry entry) {
        appendEntries(singletonList(entry));
    }

    public void appendEntries(List<LogEntry> newEntries) {
        int lastTerm = lastLogTerm();
        long lastIndex = lastLogIndex();

        for (LogEntry entry : newEntries) {
            if (entry.getTerm() < lastTerm) {
                throw new IllegalArgumentException(
                        "Cannot append " + entry + " since its term is lower than last log term: " + lastTerm);
            } else if (entry.getIndex() != lastIndex + 1) {
                throw new IllegalArgumentException(
                        "Cannot append " + entry + " since its index is not equal to (lastLogIndex + 1): " + (lastIndex + 1));
            }

            lastIndex++;
            lastTerm = entry.getTerm();
        }

        if (newEntries.isEmpty()) {
            return;
        }

        try {
            store.persistLogEntries(newEntries);
        } catch (IOException e) {
            throw new PersistenceFailureException("Could not persist " + newEntries.size() + " log entries starting from "
                    + "index: " + newEntries.get(0).getIndex(), e);
        }

        entries.addAll(newEntries);
        dirty = true;
    }

    /**
     * Returns log entries between the given indices, both inclusive.
     */
    public List<LogEntry> getLogEntriesBetween(long fromEntryIndex, long toEntryIndex) {
        if (fromEntryIndex > toEntryIndex) {
            throw new IllegalArgumentException(
                    "Illegal from entry index: " + fromEntryIndex + ", to entry index: " + toEntryIndex);
        } else if (!containsLogEntry(fromEntryIndex)) {
            throw new IllegalArgumentException("Illegal from entry index: " + fromEntryIndex);
        } else if (toEntryIndex > lastLogIndex()) {
            throw new IllegalArgumentException("Illegal to entry index: " + toEntryIndex + ", last log index: "
                    + lastLogIndex());
        }

        return new ArrayList<>(entries.subList(toPosition(fromEntryIndex), toPosition(toEntryIndex) + 1));
    }

    /**
     * Flushes the changes to the stable storage if there is any change since the last flush.
     */
    public void flush() {
        if (dirty) {
            try {
                store.flush();
            } catch (IOException e) {
                throw new PersistenceFailureException("Could not flush the Raft log", e);
            }

            dirty = false;
        }

        flushedLogIndex = lastLogIndex();
    }

    private int toPosition(long entryIndex) {
        return (int) (entryIndex - 1);
    }

}

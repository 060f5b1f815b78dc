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

package io.raftcore.store.sqlite;

import io.raftcore.RaftEndpoint;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RaftStoreSerializer;
import io.raftcore.persistence.RestoredRaftState;
import org.jooq.CloseableDSLContext;
import org.jooq.Converter;
import org.jooq.Field;
import org.jooq.InsertValuesStep2;
import org.jooq.Record;
import org.jooq.Record3;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteConfig.JournalMode;
import org.sqlite.SQLiteConfig.LockingMode;
import org.sqlite.SQLiteConfig.Pragma;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A {@link RaftStore} implementation which uses SQLite for persistence. A user of this class is advised to create it with
 * {@link #create(File, RaftModelFactory, RaftStoreSerializer)}, and then use {@link #getRestoredRaftState()} to acquire
 * any previously persisted state before building the Raft node.
 * <p>
 * The store keeps a single connection open in exclusive locking mode with auto-commit disabled. Log entries become
 * durable only on {@link #flush()}, which commits the ongoing transaction. The local endpoint, the initial group members
 * and the term state are committed immediately.
 * <p>
 * There are three tables in this store.
 * <ol>
 * <li>logEntries stores the log entries, keyed by their indices</li>
 * <li>initialMembers stores the initial group members in their original order</li>
 * <li>kv stores the remaining metadata in a single row with one column per value</li>
 * </ol>
 * Failures of the underlying database are reported with {@link IOException}, which terminates the Raft node.
 */
public final class SqliteRaftStore
        implements RaftStore, RaftNodeLifecycleAware {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteRaftStore.class);

    private static final Table<Record> KV = DSL.table("kv");
    private static final Field<String> KEY = DSL.field("key", SQLDataType.VARCHAR);
    private static final String PK = "pk";
    private static final Field<Integer> TERM = DSL.field("term", SQLDataType.INTEGER);
    private static final Table<Record> INITIAL_MEMBERS = DSL.table("initialMembers");
    private static final Field<Integer> POSITION = DSL.field("position", SQLDataType.INTEGER);
    private static final Table<Record> LOG_ENTRIES = DSL.table("logEntries");
    private static final Field<Long> INDEX = DSL.field("logIndex", SQLDataType.BIGINT);

    private final Field<RaftEndpoint> localEndpointField;
    private final Field<RaftEndpoint> votedForField;
    private final Field<RaftEndpoint> memberField;
    private final Field<LogEntry> logEntryField;
    private final CloseableDSLContext dsl;
    private final RaftModelFactory modelFactory;

    SqliteRaftStore(CloseableDSLContext dsl, RaftStoreSerializer serializer, RaftModelFactory modelFactory) {
        this.dsl = requireNonNull(dsl);
        this.modelFactory = requireNonNull(modelFactory);
        localEndpointField = endpointField("localEndpoint", serializer);
        votedForField = endpointField("votedFor", serializer);
        memberField = endpointField("member", serializer);
        logEntryField = DSL.field("logEntry", SQLDataType.BLOB
                .asConvertedDataType(new JooqConverterAdapter<>(serializer.logEntrySerializer(), LogEntry.class)));
    }

    private static Field<RaftEndpoint> endpointField(String name, RaftStoreSerializer serializer) {
        return DSL.field(name, SQLDataType.BLOB.asConvertedDataType(
                new JooqConverterAdapter<>(serializer.raftEndpointSerializer(), RaftEndpoint.class)));
    }

    /**
     * Creates the SQLite based {@link RaftStore} on the given database file and initializes its tables if they do not
     * exist yet.
     *
     * @throws IOException
     *             if the database cannot be opened or initialized
     */
    public static SqliteRaftStore create(@Nonnull File sqliteDb, @Nonnull RaftModelFactory modelFactory,
                                         @Nonnull RaftStoreSerializer serializer)
            throws IOException {
        SQLiteConfig config = new SQLiteConfig();
        // https://www.sqlite.org/pragma.html#pragma_journal_mode
        config.setPragma(Pragma.JOURNAL_MODE, JournalMode.WAL.getValue());
        // https://www.sqlite.org/pragma.html#pragma_locking_mode
        // the database file is owned by the connection for its whole lifetime
        config.setPragma(Pragma.LOCKING_MODE, LockingMode.EXCLUSIVE.getValue());
        // https://www.sqlite.org/pragma.html#pragma_synchronous
        config.setPragma(Pragma.SYNCHRONOUS, "EXTRA");

        try {
            CloseableDSLContext dsl = DSL.using(jdbcUrl(sqliteDb), config.toProperties());
            dsl.connection(conn -> conn.setAutoCommit(false));

            SqliteRaftStore store = new SqliteRaftStore(dsl, serializer, modelFactory);
            store.createTablesIfNotExists();
            LOGGER.info("Opened Raft store at {}", sqliteDb);
            return store;
        } catch (DataAccessException e) {
            throw new IOException("Could not open Raft store at " + sqliteDb, e);
        }
    }

    private static String jdbcUrl(File file) {
        return "jdbc:sqlite:" + file;
    }

    private void createTablesIfNotExists() {
        dsl.createTableIfNotExists(KV)
           .column(KEY)
           .column(localEndpointField)
           .column(TERM)
           .column(votedForField)
           .primaryKey(KEY)
           .execute();
        dsl.insertInto(KV).columns(KEY).values(PK).onConflictDoNothing().execute();

        dsl.createTableIfNotExists(INITIAL_MEMBERS).column(POSITION).column(memberField).primaryKey(POSITION).execute();

        dsl.createTableIfNotExists(LOG_ENTRIES).column(INDEX).column(logEntryField).primaryKey(INDEX).execute();

        dsl.connection(Connection::commit);
    }

    @Override
    public void onRaftNodeTerminate() {
        try {
            // entries that are not flushed yet are not durable
            dsl.connection(Connection::rollback);
        } catch (DataAccessException e) {
            LOGGER.warn("Could not roll back the ongoing transaction of the Raft store", e);
        } finally {
            dsl.close();
        }
    }

    @Override
    public void persistAndFlushLocalEndpoint(@Nonnull RaftEndpoint localEndpoint) throws IOException {
        try {
            dsl.update(KV).set(localEndpointField, localEndpoint).execute();
            dsl.connection(Connection::commit);
        } catch (DataAccessException e) {
            throw new IOException("Could not persist local endpoint: " + localEndpoint, e);
        }
    }

    @Override
    public void persistAndFlushInitialGroupMembers(@Nonnull Collection<RaftEndpoint> initialGroupMembers)
            throws IOException {
        try {
            dsl.deleteFrom(INITIAL_MEMBERS).execute();
            InsertValuesStep2<Record, Integer, RaftEndpoint> statement = dsl.insertInto(INITIAL_MEMBERS, POSITION,
                    memberField);
            int position = 0;
            for (RaftEndpoint member : initialGroupMembers) {
                statement.values(position++, member);
            }

            if (position > 0) {
                statement.execute();
            }

            dsl.connection(Connection::commit);
        } catch (DataAccessException e) {
            throw new IOException("Could not persist initial group members: " + initialGroupMembers, e);
        }
    }

    @Override
    public void persistAndFlushTerm(@Nonnull RaftTermPersistentState termPersistentState) throws IOException {
        try {
            dsl.update(KV)
               .set(TERM, termPersistentState.getTerm())
               .set(votedForField, termPersistentState.getVotedFor())
               .execute();
            dsl.connection(Connection::commit);
        } catch (DataAccessException e) {
            throw new IOException("Could not persist term state: " + termPersistentState, e);
        }
    }

    @Override
    public void persistLogEntries(@Nonnull List<LogEntry> logEntries) throws IOException {
        if (logEntries.isEmpty()) {
            return;
        }

        try {
            InsertValuesStep2<Record, Long, LogEntry> statement = dsl.insertInto(LOG_ENTRIES, INDEX, logEntryField);
            for (LogEntry entry : logEntries) {
                statement.values(entry.getIndex(), entry);
            }

            statement.onDuplicateKeyIgnore().execute();
        } catch (DataAccessException e) {
            throw new IOException("Could not persist " + logEntries.size() + " log entries from index: "
                    + logEntries.get(0).getIndex(), e);
        }
    }

    @Override
    public void truncateLogEntriesFrom(@Nonnegative long logIndexInclusive) throws IOException {
        try {
            dsl.deleteFrom(LOG_ENTRIES).where(INDEX.greaterOrEqual(logIndexInclusive)).execute();
        } catch (DataAccessException e) {
            throw new IOException("Could not truncate log entries from index: " + logIndexInclusive, e);
        }
    }

    @Override
    public void flush() throws IOException {
        try {
            dsl.connection(Connection::commit);
        } catch (DataAccessException e) {
            throw new IOException("Could not flush the Raft store", e);
        }
    }

    /**
     * Returns the Raft state persisted by an earlier run, or an empty optional if the local endpoint and the initial group
     * members have not been persisted yet. A missing term state is restored as term 0 without a vote.
     *
     * @throws IOException
     *             if the persisted state cannot be read
     */
    public Optional<RestoredRaftState> getRestoredRaftState() throws IOException {
        try {
            Record3<RaftEndpoint, Integer, RaftEndpoint> record = dsl.select(localEndpointField, TERM, votedForField)
                                                                     .from(KV)
                                                                     .fetchOne();
            if (record == null || record.get(localEndpointField) == null) {
                // the kv row is created on initialization but SQLite has no transactional DDL
                return Optional.empty();
            }

            checkState(record.get(TERM) != null || record.get(votedForField) == null,
                    "expected term to be set since voted for is set");

            List<RaftEndpoint> initialMembers = dsl.select(memberField)
                                                   .from(INITIAL_MEMBERS)
                                                   .orderBy(POSITION)
                                                   .fetch(memberField);
            if (initialMembers.isEmpty()) {
                checkState(record.get(TERM) == null, "expected initial group members to be set before this node can vote");
                return Optional.empty();
            }

            int term = record.get(TERM) != null ? record.get(TERM) : 0;
            RaftTermPersistentState termPersistentState = modelFactory.createRaftTermPersistentStateBuilder()
                                                                      .setTerm(term)
                                                                      .setVotedFor(record.get(votedForField))
                                                                      .build();
            List<LogEntry> logEntries = dsl.select(logEntryField).from(LOG_ENTRIES).orderBy(INDEX).fetch(logEntryField);

            LOGGER.info("Restored local endpoint: {}, term: {}, voted for: {}, log entry count: {}",
                    record.get(localEndpointField), term, record.get(votedForField), logEntries.size());

            return Optional.of(new RestoredRaftState(record.get(localEndpointField), initialMembers, termPersistentState,
                    logEntries));
        } catch (DataAccessException e) {
            throw new IOException("Could not read the persisted Raft state", e);
        }
    }

    private static void checkState(boolean condition, String errorMessage) {
        if (!condition) {
            throw new IllegalStateException(errorMessage);
        }
    }

    private static final class JooqConverterAdapter<T>
            implements Converter<byte[], T> {

        private final RaftStoreSerializer.Serializer<T> serializer;
        private final Class<T> clazz;

        private JooqConverterAdapter(RaftStoreSerializer.Serializer<T> serializer, Class<T> clazz) {
            this.serializer = serializer;
            this.clazz = clazz;
        }

        @Override
        @Nullable
        public T from(@Nullable byte[] bytes) {
            if (bytes == null) {
                return null;
            }

            return serializer.deserialize(bytes);
        }

        @Override
        @Nullable
        public byte[] to(@Nullable T element) {
            if (element == null) {
                return null;
            }

            return serializer.serialize(element);
        }

        @Override
        public Class<byte[]> fromType() {
            return byte[].class;
        }

        @Override
        public Class<T> toType() {
            return clazz;
        }

    }

}

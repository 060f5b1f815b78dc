/*
 * Copyright (c) 2020, MicroRaft.
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

package io.raftcore.hocon;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import io.raftcore.RaftConfig;
import io.raftcore.RaftConfig.RaftConfigBuilder;

import javax.annotation.Nonnull;
import java.io.File;

import static com.typesafe.config.ConfigException.WrongType;
import static io.raftcore.hocon.HoconRaftConfigFields.APPEND_ENTRIES_REQUEST_BATCH_SIZE_FIELD_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.LEADER_ELECTION_TIMEOUT_MILLIS_FIELD_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.LEADER_HEARTBEAT_PERIOD_SECS_FIELD_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.LEADER_HEARTBEAT_TIMEOUT_SECS_FIELD_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.MAX_PENDING_LOG_ENTRY_COUNT_FIELD_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.RAFT_CONFIG_CONTAINER_NAME;
import static io.raftcore.hocon.HoconRaftConfigFields.RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS_FIELD_NAME;
import static java.util.Objects.requireNonNull;

/**
 * {@link RaftConfig} parser for HOCON files
 */
public final class HoconRaftConfigParser {

    /*

        A sample HOCON string is below:
        ---
        raft {
          leader-election-timeout-millis: 1000
          leader-heartbeat-timeout-secs: 10
          leader-heartbeat-period-secs: 2
          max-pending-log-entry-count: 5000
          append-entries-request-batch-size: 1000
          raft-node-report-publish-period-secs: 10
        }

     */

    private static final ConfigParseOptions FAIL_IF_MISSING = ConfigParseOptions.defaults().setAllowMissing(false);

    private HoconRaftConfigParser() {
    }

    /**
     * Parses the given config object to populate RaftConfig. Fields missing in the "raft" section keep their default
     * values.
     *
     * @param config
     *            the config object to read the "raft" section from
     *
     * @return the created RaftConfig object
     *
     * @throws NullPointerException
     *             if the given config object is null
     * @throws IllegalArgumentException
     *             if the given config object has no "raft" section, or a value is not positive
     * @throws WrongType
     *             if a configuration value has wrong type
     */
    public static RaftConfig parseConfig(@Nonnull Config config) {
        requireNonNull(config);
        if (!config.hasPath(RAFT_CONFIG_CONTAINER_NAME)) {
            throw new IllegalArgumentException("No raft config provided!");
        }

        RaftConfigBuilder builder = RaftConfig.newBuilder();

        if (config.hasPath(LEADER_ELECTION_TIMEOUT_MILLIS_FIELD_NAME)) {
            builder.setLeaderElectionTimeoutMillis(config.getLong(LEADER_ELECTION_TIMEOUT_MILLIS_FIELD_NAME));
        }

        if (config.hasPath(LEADER_HEARTBEAT_PERIOD_SECS_FIELD_NAME)) {
            builder.setLeaderHeartbeatPeriodSecs(config.getLong(LEADER_HEARTBEAT_PERIOD_SECS_FIELD_NAME));
        }

        if (config.hasPath(LEADER_HEARTBEAT_TIMEOUT_SECS_FIELD_NAME)) {
            builder.setLeaderHeartbeatTimeoutSecs(config.getLong(LEADER_HEARTBEAT_TIMEOUT_SECS_FIELD_NAME));
        }

        if (config.hasPath(APPEND_ENTRIES_REQUEST_BATCH_SIZE_FIELD_NAME)) {
            builder.setAppendEntriesRequestBatchSize(config.getInt(APPEND_ENTRIES_REQUEST_BATCH_SIZE_FIELD_NAME));
        }

        if (config.hasPath(MAX_PENDING_LOG_ENTRY_COUNT_FIELD_NAME)) {
            builder.setMaxPendingLogEntryCount(config.getInt(MAX_PENDING_LOG_ENTRY_COUNT_FIELD_NAME));
        }

        if (config.hasPath(RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS_FIELD_NAME)) {
            builder.setRaftNodeReportPublishPeriodSecs(config.getInt(RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS_FIELD_NAME));
        }

        return builder.build();
    }

    /**
     * Parses the given HOCON string to populate RaftConfig
     *
     * @param hocon
     *            the HOCON string to parse
     *
     * @return the created RaftConfig object
     *
     * @see #parseConfig(Config)
     */
    public static RaftConfig parseString(@Nonnull String hocon) {
        requireNonNull(hocon);
        return parseConfig(ConfigFactory.parseString(hocon));
    }

    /**
     * Parses the given HOCON file to populate RaftConfig
     *
     * @param file
     *            the HOCON file to parse
     *
     * @return the created RaftConfig object
     *
     * @throws com.typesafe.config.ConfigException.IO
     *             if the file cannot be read
     *
     * @see #parseConfig(Config)
     */
    public static RaftConfig parseFile(@Nonnull File file) {
        requireNonNull(file);
        return parseConfig(ConfigFactory.parseFileAnySyntax(file, FAIL_IF_MISSING));
    }

    /**
     * Parses the given classpath resource to populate RaftConfig
     *
     * @param resourceName
     *            name of the HOCON resource on the classpath
     *
     * @return the created RaftConfig object
     *
     * @see #parseConfig(Config)
     */
    public static RaftConfig parseResource(@Nonnull String resourceName) {
        requireNonNull(resourceName);
        return parseConfig(ConfigFactory.parseResourcesAnySyntax(resourceName, FAIL_IF_MISSING));
    }

}

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

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.raftcore.RaftConfig;
import io.raftcore.test.util.BaseTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static io.raftcore.hocon.HoconRaftConfigParser.parseConfig;
import static io.raftcore.hocon.HoconRaftConfigParser.parseFile;
import static io.raftcore.hocon.HoconRaftConfigParser.parseResource;
import static io.raftcore.hocon.HoconRaftConfigParser.parseString;
import static org.assertj.core.api.Assertions.assertThat;

public class HoconRaftConfigParserTest
        extends BaseTest {

    private static final String VALID_CONFIG = "raft {\n" + "  leader-election-timeout-millis: 750\n"
            + "  leader-heartbeat-period-secs: 15\n" + "  leader-heartbeat-timeout-secs: 45\n"
            + "  append-entries-request-batch-size: 750\n" + "  max-pending-log-entry-count: 1500\n"
            + "  raft-node-report-publish-period-secs: 20\n" + "}\n";

    @Rule
    public final TemporaryFolder tempFolder = new TemporaryFolder();

    @Test
    public void test_parseValidHoconString() {
        RaftConfig config = parseConfig(ConfigFactory.parseString(VALID_CONFIG));

        assertThat(config.getLeaderElectionTimeoutMillis()).isEqualTo(750L);
        assertThat(config.getLeaderHeartbeatPeriodSecs()).isEqualTo(15L);
        assertThat(config.getLeaderHeartbeatTimeoutSecs()).isEqualTo(45L);
        assertThat(config.getAppendEntriesRequestBatchSize()).isEqualTo(750);
        assertThat(config.getMaxPendingLogEntryCount()).isEqualTo(1500);
        assertThat(config.getRaftNodeReportPublishPeriodSecs()).isEqualTo(20);
    }

    @Test
    public void test_missingFieldsFallBackToDefaults() {
        RaftConfig config = parseString("raft {\n  leader-election-timeout-millis: 500\n}\n");

        assertThat(config.getLeaderElectionTimeoutMillis()).isEqualTo(500L);
        assertThat(config.getLeaderHeartbeatPeriodSecs()).isEqualTo(RaftConfig.DEFAULT_LEADER_HEARTBEAT_PERIOD_SECS);
        assertThat(config.getLeaderHeartbeatTimeoutSecs()).isEqualTo(RaftConfig.DEFAULT_LEADER_HEARTBEAT_TIMEOUT_SECS);
        assertThat(config.getAppendEntriesRequestBatchSize())
                .isEqualTo(RaftConfig.DEFAULT_APPEND_ENTRIES_REQUEST_BATCH_SIZE);
        assertThat(config.getMaxPendingLogEntryCount()).isEqualTo(RaftConfig.DEFAULT_MAX_PENDING_LOG_ENTRY_COUNT);
        assertThat(config.getRaftNodeReportPublishPeriodSecs())
                .isEqualTo(RaftConfig.DEFAULT_RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS);
    }

    @Test
    public void test_parseFile() throws IOException {
        File file = tempFolder.newFile("raft.conf");
        Files.write(file.toPath(), VALID_CONFIG.getBytes(StandardCharsets.UTF_8));

        RaftConfig config = parseFile(file);

        assertThat(config.getLeaderElectionTimeoutMillis()).isEqualTo(750L);
        assertThat(config.getMaxPendingLogEntryCount()).isEqualTo(1500);
    }

    @Test
    public void test_parseResource() {
        RaftConfig config = parseResource("raftcore-test.conf");

        assertThat(config.getLeaderElectionTimeoutMillis()).isEqualTo(250L);
        assertThat(config.getLeaderHeartbeatPeriodSecs()).isEqualTo(1L);
        assertThat(config.getLeaderHeartbeatTimeoutSecs()).isEqualTo(5L);
        assertThat(config.getAppendEntriesRequestBatchSize()).isEqualTo(100);
        assertThat(config.getMaxPendingLogEntryCount()).isEqualTo(200);
        assertThat(config.getRaftNodeReportPublishPeriodSecs()).isEqualTo(3);
    }

    @Test(expected = ConfigException.class)
    public void test_missingResource() {
        parseResource("no-such-raftcore-config.conf");
    }

    @Test(expected = ConfigException.class)
    public void test_missingFile() {
        parseFile(new File(tempFolder.getRoot(), "missing.conf"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_nonExistingConfig() {
        parseConfig(ConfigFactory.parseString(""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_nonPositiveValue() {
        parseString("raft {\n  append-entries-request-batch-size: 0\n}\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_heartbeatTimeoutSmallerThanPeriod() {
        parseString("raft {\n  leader-heartbeat-period-secs: 5\n  leader-heartbeat-timeout-secs: 2\n}\n");
    }

    @Test(expected = ConfigException.WrongType.class)
    public void test_wrongValueType() {
        parseString("raft {\n  leader-election-timeout-millis: \"soon\"\n}\n");
    }

    @Test(expected = NullPointerException.class)
    public void test_nullConfig() {
        parseConfig(null);
    }

}

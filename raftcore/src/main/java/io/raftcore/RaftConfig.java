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

import io.raftcore.exception.CannotReplicateException;
import io.raftcore.report.RaftNodeReport;

import java.io.Serializable;
import java.util.Objects;

/**
 * Tuning parameters of a Raft node. Instances are immutable and created with {@link #newBuilder()}. The builder checks
 * every value on assignment, so a built config is always valid.
 */
public final class RaftConfig
        implements Serializable {

    public static final long DEFAULT_LEADER_ELECTION_TIMEOUT_MILLIS = 1000;
    public static final long DEFAULT_LEADER_HEARTBEAT_PERIOD_SECS = 2;
    public static final long DEFAULT_LEADER_HEARTBEAT_TIMEOUT_SECS = 10;
    public static final int DEFAULT_APPEND_ENTRIES_REQUEST_BATCH_SIZE = 1000;
    public static final int DEFAULT_MAX_PENDING_LOG_ENTRY_COUNT = 5000;
    public static final int DEFAULT_RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS = 10;

    /**
     * Config with all parameters set to their defaults.
     */
    public static final RaftConfig DEFAULT_RAFT_CONFIG = newBuilder().build();

    private static final long serialVersionUID = 1L;

    private final long leaderElectionTimeoutMillis;
    private final long leaderHeartbeatPeriodSecs;
    private final long leaderHeartbeatTimeoutSecs;
    private final int appendEntriesRequestBatchSize;
    private final int maxPendingLogEntryCount;
    private final int raftNodeReportPublishPeriodSecs;

    private RaftConfig(RaftConfigBuilder builder) {
        this.leaderElectionTimeoutMillis = builder.leaderElectionTimeoutMillis;
        this.leaderHeartbeatPeriodSecs = builder.leaderHeartbeatPeriodSecs;
        this.leaderHeartbeatTimeoutSecs = builder.leaderHeartbeatTimeoutSecs;
        this.appendEntriesRequestBatchSize = builder.appendEntriesRequestBatchSize;
        this.maxPendingLogEntryCount = builder.maxPendingLogEntryCount;
        this.raftNodeReportPublishPeriodSecs = builder.raftNodeReportPublishPeriodSecs;
    }

    public static RaftConfigBuilder newBuilder() {
        return new RaftConfigBuilder();
    }

    /**
     * Returns how long a candidate waits for the majority of votes before it starts another election round. Each round
     * adds a random noise of up to 100 milliseconds to this value.
     */
    public long getLeaderElectionTimeoutMillis() {
        return leaderElectionTimeoutMillis;
    }

    /**
     * Returns the period of the heartbeats of the leader. A heartbeat is an append entries request which may or may not
     * carry log entries.
     */
    public long getLeaderHeartbeatPeriodSecs() {
        return leaderHeartbeatPeriodSecs;
    }

    /**
     * Returns how long a follower waits for the leader before it suspects the leader has failed. The leader steps down
     * after the same duration passes without a response from the majority.
     */
    public long getLeaderHeartbeatTimeoutSecs() {
        return leaderHeartbeatTimeoutSecs;
    }

    /**
     * Returns the maximum number of log entries in a single append entries request.
     */
    public int getAppendEntriesRequestBatchSize() {
        return appendEntriesRequestBatchSize;
    }

    /**
     * Returns the number of appended but not yet committed entries at which the leader starts rejecting new operations
     * with {@link CannotReplicateException}. It also bounds the number of waiting linearizable queries.
     */
    public int getMaxPendingLogEntryCount() {
        return maxPendingLogEntryCount;
    }

    /**
     * Returns the period of the {@link RaftNodeReport} publications.
     */
    public int getRaftNodeReportPublishPeriodSecs() {
        return raftNodeReportPublishPeriodSecs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof RaftConfig)) {
            return false;
        }

        RaftConfig that = (RaftConfig) o;
        return leaderElectionTimeoutMillis == that.leaderElectionTimeoutMillis
                && leaderHeartbeatPeriodSecs == that.leaderHeartbeatPeriodSecs
                && leaderHeartbeatTimeoutSecs == that.leaderHeartbeatTimeoutSecs
                && appendEntriesRequestBatchSize == that.appendEntriesRequestBatchSize
                && maxPendingLogEntryCount == that.maxPendingLogEntryCount
                && raftNodeReportPublishPeriodSecs == that.raftNodeReportPublishPeriodSecs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(leaderElectionTimeoutMillis, leaderHeartbeatPeriodSecs, leaderHeartbeatTimeoutSecs,
                appendEntriesRequestBatchSize, maxPendingLogEntryCount, raftNodeReportPublishPeriodSecs);
    }

    @Override
    public String toString() {
        return "RaftConfig{leaderElectionTimeoutMillis=" + leaderElectionTimeoutMillis + ", leaderHeartbeatPeriodSecs="
                + leaderHeartbeatPeriodSecs + ", leaderHeartbeatTimeoutSecs=" + leaderHeartbeatTimeoutSecs
                + ", appendEntriesRequestBatchSize=" + appendEntriesRequestBatchSize + ", maxPendingLogEntryCount="
                + maxPendingLogEntryCount + ", raftNodeReportPublishPeriodSecs=" + raftNodeReportPublishPeriodSecs + '}';
    }

    /**
     * Builds {@link RaftConfig} objects. Unset parameters keep their defaults.
     */
    public static final class RaftConfigBuilder {

        private long leaderElectionTimeoutMillis = DEFAULT_LEADER_ELECTION_TIMEOUT_MILLIS;
        private long leaderHeartbeatPeriodSecs = DEFAULT_LEADER_HEARTBEAT_PERIOD_SECS;
        private long leaderHeartbeatTimeoutSecs = DEFAULT_LEADER_HEARTBEAT_TIMEOUT_SECS;
        private int appendEntriesRequestBatchSize = DEFAULT_APPEND_ENTRIES_REQUEST_BATCH_SIZE;
        private int maxPendingLogEntryCount = DEFAULT_MAX_PENDING_LOG_ENTRY_COUNT;
        private int raftNodeReportPublishPeriodSecs = DEFAULT_RAFT_NODE_REPORT_PUBLISH_PERIOD_SECS;

        private RaftConfigBuilder() {
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive! Given: " + value);
            }

            return value;
        }

        public RaftConfigBuilder setLeaderElectionTimeoutMillis(long millis) {
            leaderElectionTimeoutMillis = requirePositive(millis, "leader election timeout millis");
            return this;
        }

        public RaftConfigBuilder setLeaderHeartbeatPeriodSecs(long secs) {
            leaderHeartbeatPeriodSecs = requirePositive(secs, "leader heartbeat period secs");
            return this;
        }

        public RaftConfigBuilder setLeaderHeartbeatTimeoutSecs(long secs) {
            leaderHeartbeatTimeoutSecs = requirePositive(secs, "leader heartbeat timeout secs");
            return this;
        }

        public RaftConfigBuilder setAppendEntriesRequestBatchSize(int batchSize) {
            appendEntriesRequestBatchSize = (int) requirePositive(batchSize, "append entries request batch size");
            return this;
        }

        public RaftConfigBuilder setMaxPendingLogEntryCount(int count) {
            maxPendingLogEntryCount = (int) requirePositive(count, "max pending log entry count");
            return this;
        }

        public RaftConfigBuilder setRaftNodeReportPublishPeriodSecs(int secs) {
            raftNodeReportPublishPeriodSecs = (int) requirePositive(secs, "raft node report publish period secs");
            return this;
        }

        /**
         * @throws IllegalArgumentException
         *             if the leader heartbeat timeout is shorter than the leader heartbeat period
         */
        public RaftConfig build() {
            if (leaderHeartbeatTimeoutSecs < leaderHeartbeatPeriodSecs) {
                throw new IllegalArgumentException("leader heartbeat timeout secs: " + leaderHeartbeatTimeoutSecs
                        + " cannot be smaller than leader heartbeat period secs: " + leaderHeartbeatPeriodSecs);
            }

            return new RaftConfig(this);
        }

    }

}

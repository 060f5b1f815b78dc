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

package io.raftcore.impl.report;

import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNodeStatus;
import io.raftcore.RaftRole;
import io.raftcore.report.RaftLogStats;
import io.raftcore.report.RaftNodeReport;
import io.raftcore.report.RaftTerm;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable view of a Raft node's state, taken on the Raft node thread.
 */
public final class RaftNodeReportImpl
        implements RaftNodeReport {

    private final RaftNodeReportReason reason;
    private final Object groupId;
    private final RaftEndpoint localEndpoint;
    private final List<RaftEndpoint> members;
    private final RaftRole role;
    private final RaftNodeStatus status;
    private final RaftTerm term;
    private final RaftLogStats log;
    private final Map<RaftEndpoint, Long> heartbeatTimestamps;
    private final Optional<Long> quorumHeartbeatTimestamp;
    private final Optional<Long> leaderHeartbeatTimestamp;

    @SuppressWarnings("checkstyle:parameternumber")
    public RaftNodeReportImpl(RaftNodeReportReason reason, Object groupId, RaftEndpoint localEndpoint,
                              List<RaftEndpoint> members, RaftRole role, RaftNodeStatus status, RaftTerm term,
                              RaftLogStats log, Map<RaftEndpoint, Long> heartbeatTimestamps,
                              Optional<Long> quorumHeartbeatTimestamp, Optional<Long> leaderHeartbeatTimestamp) {
        this.reason = requireNonNull(reason, "reason");
        this.groupId = requireNonNull(groupId, "groupId");
        this.localEndpoint = requireNonNull(localEndpoint, "localEndpoint");
        this.members = requireNonNull(members, "members");
        this.role = requireNonNull(role, "role");
        this.status = requireNonNull(status, "status");
        this.term = requireNonNull(term, "term");
        this.log = requireNonNull(log, "log");
        this.heartbeatTimestamps = requireNonNull(heartbeatTimestamps, "heartbeatTimestamps");
        this.quorumHeartbeatTimestamp = requireNonNull(quorumHeartbeatTimestamp, "quorumHeartbeatTimestamp");
        this.leaderHeartbeatTimestamp = requireNonNull(leaderHeartbeatTimestamp, "leaderHeartbeatTimestamp");
    }

    @Nonnull
    @Override
    public RaftNodeReportReason getReason() {
        return reason;
    }

    @Nonnull
    @Override
    public Object getGroupId() {
        return groupId;
    }

    @Nonnull
    @Override
    public RaftEndpoint getEndpoint() {
        return localEndpoint;
    }

    @Nonnull
    @Override
    public List<RaftEndpoint> getMembers() {
        return members;
    }

    @Nonnull
    @Override
    public RaftRole getRole() {
        return role;
    }

    @Nonnull
    @Override
    public RaftNodeStatus getStatus() {
        return status;
    }

    @Nonnull
    @Override
    public RaftTerm getTerm() {
        return term;
    }

    @Nonnull
    @Override
    public RaftLogStats getLog() {
        return log;
    }

    @Nonnull
    @Override
    public Map<RaftEndpoint, Long> getHeartbeatTimestamps() {
        return heartbeatTimestamps;
    }

    @Nonnull
    @Override
    public Optional<Long> getQuorumHeartbeatTimestamp() {
        return quorumHeartbeatTimestamp;
    }

    @Nonnull
    @Override
    public Optional<Long> getLeaderHeartbeatTimestamp() {
        return leaderHeartbeatTimestamp;
    }

    @Override
    public String toString() {
        return "RaftNodeReport{reason=" + reason + ", groupId=" + groupId + ", endpoint=" + localEndpoint.getId() + ", role="
               + role + ", status=" + status + ", term=" + term + ", log=" + log + ", members=" + members
               + ", heartbeats=" + heartbeatTimestamps + ", quorumHeartbeat=" + quorumHeartbeatTimestamp.orElse(null)
               + ", leaderHeartbeat=" + leaderHeartbeatTimestamp.orElse(null) + '}';
    }

}

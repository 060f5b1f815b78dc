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

package io.raftcore.report;

import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.RaftNodeStatus;
import io.raftcore.RaftRole;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contains information about a Raft node's local state related to the execution of the Raft consensus algorithm.
 * <p>
 * Raft node reports are published either periodically, see {@link RaftConfig#getRaftNodeReportPublishPeriodSecs()}, or
 * when there is a change in the role or status of a Raft node.
 *
 * @see RaftNodeReportListener
 */
public interface RaftNodeReport {

    @Nonnull
    RaftNodeReportReason getReason();

    @Nonnull
    Object getGroupId();

    @Nonnull
    RaftEndpoint getEndpoint();

    /**
     * Returns the members of the Raft group this Raft node belongs to.
     *
     * @return the members of the Raft group
     */
    @Nonnull
    List<RaftEndpoint> getMembers();

    @Nonnull
    RaftRole getRole();

    @Nonnull
    RaftNodeStatus getStatus();

    @Nonnull
    RaftTerm getTerm();

    @Nonnull
    RaftLogStats getLog();

    /**
     * Returns timestamps of the latest responses received from the followers. Non-empty only on the leader.
     *
     * @return timestamps of the latest responses received from the followers
     */
    @Nonnull
    Map<RaftEndpoint, Long> getHeartbeatTimestamps();

    /**
     * Returns the earliest response timestamp among the majority of the group, counting the leader itself. For instance,
     * with the leader A and followers B=10, C=8, D=6, E=4, it returns 8. Present only on the leader.
     *
     * @return the earliest response timestamp of the majority
     */
    @Nonnull
    Optional<Long> getQuorumHeartbeatTimestamp();

    /**
     * Returns the timestamp of the latest heartbeat received from the leader. Present only on a follower which has heard from
     * a leader.
     *
     * @return the timestamp of the latest heartbeat received from the leader
     */
    @Nonnull
    Optional<Long> getLeaderHeartbeatTimestamp();

    /**
     * Denotes the reason for a given report
     */
    enum RaftNodeReportReason {

        /**
         * The report is created on a periodic reporting tick of the {@link RaftNode}.
         */
        PERIODIC,

        /**
         * The report is created when a {@link RaftNode} changes its {@link RaftNodeStatus}.
         */
        STATUS_CHANGE,

        /**
         * The report is created when a {@link RaftNode} changes its role or discovers the leader in the current term.
         */
        ROLE_CHANGE,

        /**
         * The report is created for a {@link RaftNode#getReport()} call.
         */
        API_CALL

    }

}

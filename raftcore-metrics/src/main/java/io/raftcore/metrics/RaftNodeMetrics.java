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

package io.raftcore.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.RaftNode.RaftNodeBuilder;
import io.raftcore.RaftNodeStatus;
import io.raftcore.RaftRole;
import io.raftcore.report.RaftLogStats;
import io.raftcore.report.RaftNodeReport;
import io.raftcore.report.RaftNodeReport.RaftNodeReportReason;
import io.raftcore.report.RaftNodeReportListener;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToLongFunction;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * Publishes the {@link RaftNodeReport}s of a single Raft node as Micrometer gauges.
 * <p>
 * Register it via {@link RaftNodeBuilder#setRaftNodeReportListener(RaftNodeReportListener)} and bind it to a
 * {@link MeterRegistry}. Gauges read the last published report and have default values until the first report arrives.
 * <ul>
 * <li>"raft.node.role": ordinal of the {@link RaftRole} (0: leader, 1: candidate, 2: follower)</li>
 * <li>"raft.node.status": ordinal of the {@link RaftNodeStatus} (0: initial, 1: active, 2: terminated)</li>
 * <li>"raft.node.report.reason": ordinal of the {@link RaftNodeReportReason} of the last report (0: periodic, 1: status
 * change, 2: role change, 3: API call)</li>
 * <li>"raft.node.term": the current term</li>
 * <li>"raft.group.members.size" and "raft.group.members.majority": the member count and the quorum size</li>
 * <li>"raft.log.commit.index", "raft.log.last.applied", "raft.log.last.index", "raft.log.last.term"</li>
 * <li>"raft.log.follower.match.index": the match index of each follower, tagged with "follower". Only the leader
 * reports it.</li>
 * </ul>
 * Every gauge carries the tags given to the constructor.
 *
 * @see RaftNode
 * @see RaftNodeReportListener
 */
public final class RaftNodeMetrics
        implements RaftNodeReportListener, MeterBinder {

    static final String FOLLOWER_TAG = "follower";

    private final Tags tags;
    private volatile RaftNodeReport report;
    private volatile MultiGauge followerMatchIndices;

    /**
     * Tags the gauges with "raft.group.id" and "raft.node.id".
     */
    public RaftNodeMetrics(String groupId, String nodeId) {
        this(asList(Tag.of("raft.group.id", requireNonNull(groupId)), Tag.of("raft.node.id", requireNonNull(nodeId))));
    }

    public RaftNodeMetrics(List<Tag> tags) {
        this.tags = Tags.of(requireNonNull(tags));
    }

    @Override
    public void accept(@Nonnull RaftNodeReport report) {
        this.report = requireNonNull(report);

        MultiGauge gauge = followerMatchIndices;
        if (gauge != null) {
            gauge.register(report.getLog().getFollowerMatchIndices().keySet().stream()
                                 .map(follower -> MultiGauge.Row.of(Tags.of(FOLLOWER_TAG, follower.getId().toString()),
                                         () -> followerMatchIndex(follower)))
                                 .collect(toList()), true);
        }
    }

    @Override
    public void bindTo(@Nonnull MeterRegistry registry) {
        gauge(registry, "raft.node.role", "The role of the Raft node (0: leader, 1: candidate, 2: follower)",
                r -> r.getRole().ordinal(), RaftRole.FOLLOWER.ordinal());
        gauge(registry, "raft.node.status", "The status of the Raft node (0: initial, 1: active, 2: terminated)",
                r -> r.getStatus().ordinal(), RaftNodeStatus.INITIAL.ordinal());
        gauge(registry, "raft.node.report.reason",
                "The reason of the last report (0: periodic, 1: status change, 2: role change, 3: API call)",
                r -> r.getReason().ordinal(), RaftNodeReportReason.PERIODIC.ordinal());
        gauge(registry, "raft.node.term", "The current term of the Raft node", r -> r.getTerm().getTerm(), 0);
        gauge(registry, "raft.group.members.size", "The number of Raft nodes in the Raft group",
                r -> r.getMembers().size(), 0);
        gauge(registry, "raft.group.members.majority", "The quorum size of the Raft group",
                r -> r.getMembers().size() / 2 + 1, 0);

        logGauge(registry, "raft.log.commit.index", "The highest committed Raft log index", RaftLogStats::getCommitIndex);
        logGauge(registry, "raft.log.last.applied", "The highest Raft log index applied to the state machine",
                RaftLogStats::getLastApplied);
        logGauge(registry, "raft.log.last.index", "The index of the last appended Raft log entry",
                RaftLogStats::getLastLogIndex);
        logGauge(registry, "raft.log.last.term", "The term of the last appended Raft log entry",
                RaftLogStats::getLastLogTerm);

        followerMatchIndices = MultiGauge.builder("raft.log.follower.match.index")
                                         .description("The highest Raft log index known to be replicated on the follower")
                                         .tags(tags)
                                         .register(registry);
    }

    private void gauge(MeterRegistry registry, String name, String description, Function<RaftNodeReport, Number> value,
                       Number defaultValue) {
        Gauge.builder(name, this, metrics -> metrics.read(value, defaultValue))
             .description(description)
             .tags(tags)
             .register(registry);
    }

    private void logGauge(MeterRegistry registry, String name, String description, ToLongFunction<RaftLogStats> value) {
        gauge(registry, name, description, r -> value.applyAsLong(r.getLog()), 0L);
    }

    private double read(Function<RaftNodeReport, Number> value, Number defaultValue) {
        RaftNodeReport current = report;
        return (current != null ? value.apply(current) : defaultValue).doubleValue();
    }

    private long followerMatchIndex(RaftEndpoint follower) {
        RaftNodeReport current = report;
        return current != null ? current.getLog().getFollowerMatchIndices().getOrDefault(follower, 0L) : 0L;
    }

}

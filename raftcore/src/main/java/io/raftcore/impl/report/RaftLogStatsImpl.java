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
import io.raftcore.report.RaftLogStats;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Contains statistics about a Raft node's Raft log at the time of creation.
 */
public final class RaftLogStatsImpl
        implements RaftLogStats {

    private final long commitIndex;
    private final long lastApplied;
    private final int lastLogTerm;
    private final long lastLogIndex;
    private final Map<RaftEndpoint, Long> followerMatchIndices;

    public RaftLogStatsImpl(long commitIndex, long lastApplied, int lastLogTerm, long lastLogIndex,
                            Map<RaftEndpoint, Long> followerMatchIndices) {
        this.commitIndex = commitIndex;
        this.lastApplied = lastApplied;
        this.lastLogTerm = lastLogTerm;
        this.lastLogIndex = lastLogIndex;
        this.followerMatchIndices = followerMatchIndices;
    }

    @Override
    public long getCommitIndex() {
        return commitIndex;
    }

    @Override
    public long getLastApplied() {
        return lastApplied;
    }

    @Override
    public int getLastLogTerm() {
        return lastLogTerm;
    }

    @Override
    public long getLastLogIndex() {
        return lastLogIndex;
    }

    @Nonnull
    @Override
    public Map<RaftEndpoint, Long> getFollowerMatchIndices() {
        return followerMatchIndices;
    }

    @Override
    public String toString() {
        return "RaftLogStats{" + "commitIndex=" + commitIndex + ", lastApplied=" + lastApplied + ", lastLogTerm="
               + lastLogTerm + ", lastLogIndex=" + lastLogIndex + ", followerMatchIndices=" + followerMatchIndices + '}';
    }

}

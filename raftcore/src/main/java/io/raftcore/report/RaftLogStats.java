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

import io.raftcore.RaftEndpoint;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Contains statistics about a Raft node's Raft log.
 */
public interface RaftLogStats {

    long getCommitIndex();

    long getLastApplied();

    int getLastLogTerm();

    long getLastLogIndex();

    /**
     * Returns the match indices of the followers. Non-empty only on the leader.
     *
     * @return the match indices of the followers
     */
    @Nonnull
    Map<RaftEndpoint, Long> getFollowerMatchIndices();

}

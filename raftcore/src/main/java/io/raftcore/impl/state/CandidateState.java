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

package io.raftcore.impl.state;

import io.raftcore.RaftEndpoint;

import java.util.HashSet;
import java.util.Set;

/**
 * State maintained by each candidate during the pre-voting and voting phases.
 */
public final class CandidateState {

    private final int majority;
    private final Set<RaftEndpoint> voters = new HashSet<>();

    CandidateState(int majority) {
        this.majority = majority;
    }

    /**
     * Records the vote of the given endpoint. Multiple votes from the same endpoint are counted only once.
     *
     * @return false if the endpoint has already voted, true otherwise
     */
    public boolean grantVote(RaftEndpoint voter) {
        return voters.add(voter);
    }

    public boolean isMajorityGranted() {
        return voteCount() >= majority();
    }

    public int majority() {
        return majority;
    }

    public int voteCount() {
        return voters.size();
    }

}

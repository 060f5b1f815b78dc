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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Volatile state of a leader. It lives as long as the local Raft node stays the leader of a single term.
 */
public final class LeaderState {

    private final Map<RaftEndpoint, FollowerState> followerStates;
    private final QueryState queryState = new QueryState();
    private boolean requestBackoffResetTaskScheduled;
    private boolean flushTaskSubmitted;

    LeaderState(Collection<RaftEndpoint> followers, long lastLogIndex, long currentTimeMillis) {
        Map<RaftEndpoint, FollowerState> states = new LinkedHashMap<>();
        for (RaftEndpoint follower : followers) {
            // the leader assumes followers are up to date until a response says otherwise
            states.put(follower, new FollowerState(0, lastLogIndex + 1, currentTimeMillis));
        }

        this.followerStates = Collections.unmodifiableMap(states);
    }

    /**
     * Returns the match indices of the followers in member order. The extra last slot is left for the caller to put the
     * index of the leader.
     */
    public long[] matchIndices() {
        long[] indices = new long[followerStates.size() + 1];
        int i = 0;
        for (FollowerState follower : followerStates.values()) {
            indices[i++] = follower.matchIndex();
        }

        return indices;
    }

    public FollowerState getFollowerState(RaftEndpoint follower) {
        FollowerState followerState = followerStates.get(follower);
        if (followerState == null) {
            throw new IllegalArgumentException(follower + " is not a follower");
        }

        return followerState;
    }

    /**
     * Returns null for endpoints that are not a follower of this leader, such as the leader itself or non-members.
     */
    public FollowerState getFollowerStateOrNull(RaftEndpoint follower) {
        return followerStates.get(follower);
    }

    public Map<RaftEndpoint, FollowerState> getFollowerStates() {
        return followerStates;
    }

    public QueryState queryState() {
        return queryState;
    }

    public long querySequenceNumber() {
        return queryState.querySequenceNumber();
    }

    public boolean isRequestBackoffResetTaskScheduled() {
        return requestBackoffResetTaskScheduled;
    }

    public void requestBackoffResetTaskScheduled(boolean scheduled) {
        requestBackoffResetTaskScheduled = scheduled;
    }

    public boolean isFlushTaskSubmitted() {
        return flushTaskSubmitted;
    }

    public void flushTaskSubmitted(boolean submitted) {
        flushTaskSubmitted = submitted;
    }

    /**
     * Returns the latest time at which the leader had heard from a quorum of the given size, counting itself as always
     * heard from.
     */
    public long quorumResponseTimestamp(int quorumSize) {
        if (quorumSize <= 1) {
            return Long.MAX_VALUE;
        }

        long[] timestamps = followerStates.values().stream().mapToLong(FollowerState::responseTimestamp).sorted()
                                          .toArray();
        // the leader is one member of the quorum, the other quorumSize - 1 members are the most recent responders
        return timestamps[timestamps.length - (quorumSize - 1)];
    }

}

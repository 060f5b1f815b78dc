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

/**
 * Replication progress of a single follower, tracked by the leader.
 * <p>
 * The leader does not pipeline append entries requests. After sending a request that carries entries, a probe or a
 * query round, it waits for the response for a number of backoff rounds. The length of the wait doubles on every
 * consecutive backoff and is capped by the caller. A response that echoes the last flow control sequence number ends
 * the wait early.
 */
public final class FollowerState {

    private long matchIndex;
    private long nextIndex;
    private long responseTimestamp;
    private long lastFlowControlSequenceNumber;
    private int remainingBackoffRounds;
    private int consecutiveBackoffs;

    FollowerState(long matchIndex, long nextIndex, long currentTimeMillis) {
        this.matchIndex = matchIndex;
        this.nextIndex = nextIndex;
        this.responseTimestamp = currentTimeMillis;
    }

    /**
     * Highest log index known to be stored on the follower.
     */
    public long matchIndex() {
        return matchIndex;
    }

    public void matchIndex(long matchIndex) {
        this.matchIndex = matchIndex;
    }

    /**
     * Log index of the first entry to put into the next append entries request.
     */
    public long nextIndex() {
        return nextIndex;
    }

    public void nextIndex(long nextIndex) {
        this.nextIndex = nextIndex;
    }

    public boolean isRequestBackoffSet() {
        return remainingBackoffRounds > 0;
    }

    /**
     * Starts waiting for the response of a request that is about to be sent.
     *
     * @return the flow control sequence number to put into that request
     */
    public long setRequestBackoff(int minRounds, int maxRounds) {
        assert remainingBackoffRounds == 0 : "backoff already set, remaining rounds: " + remainingBackoffRounds;
        long rounds = (long) minRounds << Math.min(consecutiveBackoffs, 30);
        remainingBackoffRounds = (int) Math.min(rounds, maxRounds);
        consecutiveBackoffs++;
        return ++lastFlowControlSequenceNumber;
    }

    /**
     * @return true if this was the last round of the current backoff
     */
    public boolean completeBackoffRound() {
        assert remainingBackoffRounds > 0;
        remainingBackoffRounds--;
        return remainingBackoffRounds == 0;
    }

    /**
     * Records an append entries response. The backoff is cleared only if the response belongs to the last request.
     *
     * @return true if the backoff is cleared
     */
    public boolean responseReceived(long flowControlSequenceNumber, long currentTimeMillis) {
        if (currentTimeMillis > responseTimestamp) {
            responseTimestamp = currentTimeMillis;
        }

        if (flowControlSequenceNumber != lastFlowControlSequenceNumber) {
            return false;
        }

        resetRequestBackoff();
        return true;
    }

    public void resetRequestBackoff() {
        remainingBackoffRounds = 0;
        consecutiveBackoffs = 0;
    }

    /**
     * Local time of the latest append entries response of the follower.
     */
    public long responseTimestamp() {
        return responseTimestamp;
    }

    int remainingBackoffRounds() {
        return remainingBackoffRounds;
    }

    long lastFlowControlSequenceNumber() {
        return lastFlowControlSequenceNumber;
    }

    @Override
    public String toString() {
        return "FollowerState{matchIndex=" + matchIndex + ", nextIndex=" + nextIndex + ", remainingBackoffRounds="
                + remainingBackoffRounds + ", consecutiveBackoffs=" + consecutiveBackoffs + ", responseTimestamp="
                + responseTimestamp + ", lastFlowControlSequenceNumber=" + lastFlowControlSequenceNumber + '}';
    }

}

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

import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class FollowerStateTest {

    private static final long TIME = 12345;

    private FollowerState followerState;

    @Before
    public void setUp() {
        followerState = new FollowerState(0L, 1L, TIME);
    }

    @Test
    public void testInitialState() {
        assertThat(followerState.matchIndex()).isEqualTo(0);
        assertThat(followerState.nextIndex()).isEqualTo(1);
        assertThat(followerState.responseTimestamp()).isEqualTo(TIME);
        assertThat(followerState.isRequestBackoffSet()).isFalse();
    }

    @Test
    public void testFirstBackoff() {
        long flowControlSeqNo = followerState.setRequestBackoff(1, 4);

        assertThat(flowControlSeqNo).isGreaterThan(0);
        assertThat(followerState.lastFlowControlSequenceNumber()).isEqualTo(flowControlSeqNo);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(1);
        assertThat(followerState.isRequestBackoffSet()).isTrue();
    }

    @Test
    public void testValidResponseReceivedOnBackoff() {
        long flowControlSeqNo = followerState.setRequestBackoff(1, 4);
        boolean success = followerState.responseReceived(flowControlSeqNo, TIME + 1);

        assertThat(success).isTrue();
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(0);
        assertThat(followerState.responseTimestamp()).isEqualTo(TIME + 1);
    }

    @Test
    public void testStaleResponseReceivedOnBackoff() {
        long flowControlSeqNo = followerState.setRequestBackoff(1, 4);
        boolean success = followerState.responseReceived(flowControlSeqNo - 1, TIME + 1);

        assertThat(success).isFalse();
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(1);
        assertThat(followerState.responseTimestamp()).isEqualTo(TIME + 1);
    }

    @Test
    public void testResponseTimestampDoesNotGoBack() {
        followerState.responseReceived(0, TIME - 1);

        assertThat(followerState.responseTimestamp()).isEqualTo(TIME);
    }

    @Test
    public void testConsecutiveBackoffPeriodsDoubleUpToMaxRounds() {
        followerState.setRequestBackoff(1, 4);
        assertThat(followerState.completeBackoffRound()).isTrue();

        followerState.setRequestBackoff(1, 4);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(2);
        assertThat(followerState.completeBackoffRound()).isFalse();
        assertThat(followerState.completeBackoffRound()).isTrue();

        followerState.setRequestBackoff(1, 4);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(4);
        for (int i = 0; i < 4; i++) {
            followerState.completeBackoffRound();
        }

        long flowControlSeqNo = followerState.setRequestBackoff(1, 4);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(4);
        assertThat(followerState.lastFlowControlSequenceNumber()).isEqualTo(flowControlSeqNo);
    }

    @Test
    public void testResetRequestBackoffRestartsFromMinRounds() {
        followerState.setRequestBackoff(2, 16);
        followerState.completeBackoffRound();
        followerState.completeBackoffRound();
        followerState.setRequestBackoff(2, 16);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(4);

        followerState.resetRequestBackoff();
        assertThat(followerState.isRequestBackoffSet()).isFalse();

        followerState.setRequestBackoff(2, 16);
        assertThat(followerState.remainingBackoffRounds()).isEqualTo(2);
    }

}

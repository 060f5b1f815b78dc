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
import io.raftcore.model.impl.persistence.DefaultRaftTermPersistentState;
import io.raftcore.model.persistence.RaftTermPersistentState;
import org.junit.Test;

import static io.raftcore.impl.local.LocalRaftEndpoint.newEndpoint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RaftTermStateTest {

    private final RaftEndpoint endpoint1 = newEndpoint();
    private final RaftEndpoint endpoint2 = newEndpoint();

    @Test
    public void testInitialTerm() {
        assertThat(RaftTermState.INITIAL.getTerm()).isEqualTo(0);
        assertThat(RaftTermState.INITIAL.getLeaderEndpoint()).isNull();
        assertThat(RaftTermState.INITIAL.getVotedEndpoint()).isNull();
    }

    @Test
    public void testSwitchToHigherTermResetsLeaderAndVote() {
        RaftTermState state = RaftTermState.INITIAL.switchTo(1).grantVote(1, endpoint1).withLeader(endpoint1);

        RaftTermState next = state.switchTo(2);

        assertThat(next.getTerm()).isEqualTo(2);
        assertThat(next.getLeaderEndpoint()).isNull();
        assertThat(next.getVotedEndpoint()).isNull();
        assertThat(state.getLeaderEndpoint()).isEqualTo(endpoint1);
    }

    @Test
    public void testSwitchToSameTermKeepsVote() {
        RaftTermState state = RaftTermState.INITIAL.switchTo(1).grantVote(1, endpoint1);

        assertThat(state.switchTo(1).getVotedEndpoint()).isEqualTo(endpoint1);
    }

    @Test
    public void testSwitchToLowerTermFails() {
        RaftTermState state = RaftTermState.INITIAL.switchTo(3);

        assertThatThrownBy(() -> state.switchTo(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testVoteCannotBeGrantedTwiceInSameTerm() {
        RaftTermState state = RaftTermState.INITIAL.switchTo(1).grantVote(1, endpoint1);

        assertThatThrownBy(() -> state.grantVote(1, endpoint2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testVoteCannotBeGrantedForAnotherTerm() {
        RaftTermState state = RaftTermState.INITIAL.switchTo(1);

        assertThatThrownBy(() -> state.grantVote(2, endpoint1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testRestoreAndPopulate() {
        RaftTermPersistentState persisted = DefaultRaftTermPersistentState.newBuilder().setTerm(4)
                                                                                         .setVotedFor(endpoint2)
                                                                                         .build();

        RaftTermState state = RaftTermState.restore(persisted);

        assertThat(state.getTerm()).isEqualTo(4);
        assertThat(state.getVotedEndpoint()).isEqualTo(endpoint2);
        assertThat(state.getLeaderEndpoint()).isNull();

        RaftTermPersistentState populated = state.populate(DefaultRaftTermPersistentState.newBuilder()).build();
        assertThat(populated.getTerm()).isEqualTo(4);
        assertThat(populated.getVotedFor()).isEqualTo(endpoint2);
    }

}

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

package io.raftcore.impl;

import io.raftcore.RaftEndpoint;
import io.raftcore.exception.NotLeaderException;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.impl.local.InMemoryRaftStore;
import io.raftcore.impl.local.LocalRaftGroup;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.persistence.RestoredRaftState;
import io.raftcore.test.util.BaseTest;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static io.raftcore.RaftNodeStatus.TERMINATED;
import static io.raftcore.impl.local.LocalRaftGroup.IN_MEMORY_RAFT_STORE_FACTORY;
import static io.raftcore.impl.local.SimpleStateMachine.applyValue;
import static io.raftcore.test.util.AssertionUtils.eventually;
import static io.raftcore.test.util.RaftTestUtils.TEST_RAFT_CONFIG;
import static io.raftcore.test.util.RaftTestUtils.getCommitIndex;
import static io.raftcore.test.util.RaftTestUtils.getInMemoryStore;
import static io.raftcore.test.util.RaftTestUtils.getLastApplied;
import static io.raftcore.test.util.RaftTestUtils.getTerm;
import static io.raftcore.test.util.RaftTestUtils.getVotedEndpoint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PersistenceTest
        extends BaseTest {

    private LocalRaftGroup group;

    @After
    public void destroy() {
        if (group != null) {
            group.destroy();
        }
    }

    private RaftNodeImpl startGroupAndElectLeader() {
        group = LocalRaftGroup.newBuilder(3)
                              .setConfig(TEST_RAFT_CONFIG)
                              .enableNewTermOperation()
                              .setRaftStoreFactory(IN_MEMORY_RAFT_STORE_FACTORY)
                              .start();
        return group.waitUntilLeaderElected();
    }

    private static List<String> replicateValues(RaftNodeImpl leader, String prefix, int count) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String value = prefix + i;
            leader.replicate(applyValue(value)).join();
            values.add(value);
        }

        return values;
    }

    @Test(timeout = 300_000)
    public void testEveryNodePersistsTermAndVote() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        int term = getTerm(leader);

        eventually(() -> group.getNodes().forEach(node -> {
            RaftTermPersistentState persisted = getInMemoryStore(node).termPersistentState();
            assertThat(persisted).isNotNull();
            assertThat(persisted.getTerm()).isEqualTo(term);
            assertThat(persisted.getVotedFor()).isEqualTo(getVotedEndpoint(node));
        }));

        assertThat(getInMemoryStore(leader).termPersistentState().getVotedFor()).isEqualTo(leader.getLocalEndpoint());
    }

    @Test(timeout = 300_000)
    public void testEveryNodePersistsCommittedEntriesInIndexOrder() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        int count = 10;
        replicateValues(leader, "val", count);

        // the leader appended one more entry when it took over the term
        eventually(() -> group.getNodes().forEach(node -> {
            List<LogEntry> stored = getInMemoryStore(node).logEntries();
            assertThat(stored).hasSize(count + 1);
            for (int i = 0; i < stored.size(); i++) {
                assertThat(stored.get(i).getIndex()).isEqualTo(i + 1);
            }
        }));
    }

    @Test(timeout = 300_000)
    public void testLeaderPersistsEntriesItCannotCommit() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        leader.replicate(applyValue("committed")).join();
        long commitIndex = getCommitIndex(leader);

        group.dropMessagesToAll(leader.getLocalEndpoint(), AppendEntriesRequest.class);
        for (int i = 0; i < 5; i++) {
            leader.replicate(applyValue("pending" + i));
        }

        eventually(() -> assertThat(getInMemoryStore(leader).logEntries()).hasSize((int) commitIndex + 5));
        assertThat(getCommitIndex(leader)).isEqualTo(commitIndex);
    }

    @Test(timeout = 300_000)
    public void testIsolatedLeaderTruncatesItsStoreAfterRejoining() {
        RaftNodeImpl oldLeader = startGroupAndElectLeader();
        RaftEndpoint oldLeaderEndpoint = oldLeader.getLocalEndpoint();
        oldLeader.replicate(applyValue("committed")).join();
        long commitIndex = getCommitIndex(oldLeader);
        eventually(() -> group.getNodes().forEach(node -> assertThat(getCommitIndex(node)).isEqualTo(commitIndex)));

        List<RaftNodeImpl> majority = group.getNodesExcept(oldLeaderEndpoint);
        group.splitMembers(oldLeaderEndpoint);
        for (int i = 0; i < 10; i++) {
            oldLeader.replicate(applyValue("isolated" + i));
        }

        eventually(() -> assertThat(getInMemoryStore(oldLeader).logEntries()).hasSize((int) commitIndex + 10));
        eventually(() -> majority.forEach(
                node -> assertThat(node.getLeaderEndpoint()).isNotNull().isNotEqualTo(oldLeaderEndpoint)));

        RaftNodeImpl newLeader = group.getNode(majority.get(0).getLeaderEndpoint());
        replicateValues(newLeader, "majority", 10);

        group.merge();

        eventually(() -> {
            assertThat(oldLeader.getLeaderEndpoint()).isEqualTo(newLeader.getLocalEndpoint());
            List<LogEntry> stored = getInMemoryStore(oldLeader).logEntries();
            assertThat(stored).hasSize((int) getCommitIndex(newLeader));
            assertThat(stored.get(stored.size() - 1).getTerm()).isEqualTo(getTerm(newLeader));
            assertThat(group.getStateMachine(oldLeaderEndpoint).valueList()).doesNotContain("isolated0");
        });
    }

    @Test(timeout = 300_000)
    public void testRestartedLeaderRejoinsAsFollowerWithItsState() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        List<String> values = replicateValues(leader, "val", 10);

        InMemoryRaftStore store = getInMemoryStore(leader);
        group.terminateNode(leader.getLocalEndpoint());
        RestoredRaftState restoredState = store.toRestoredRaftState();

        RaftNodeImpl newLeader = group.waitUntilLeaderElected();
        RaftNodeImpl restarted = group.restoreNode(restoredState, store);

        eventually(() -> {
            assertThat(restarted.getLeaderEndpoint()).isEqualTo(newLeader.getLocalEndpoint());
            assertThat(getTerm(restarted)).isEqualTo(getTerm(newLeader));
            assertThat(getCommitIndex(restarted)).isEqualTo(getCommitIndex(newLeader));
            assertThat(getLastApplied(restarted)).isEqualTo(getLastApplied(newLeader));
            assertThat(group.getStateMachine(restarted.getLocalEndpoint()).valueList()).containsExactlyElementsOf(values);
        });
    }

    @Test(timeout = 300_000)
    public void testRestartedFollowerCatchesUpFromItsState() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        RaftNodeImpl follower = group.getAnyFollower();
        int count = 10;
        replicateValues(leader, "val", count);

        InMemoryRaftStore store = getInMemoryStore(follower);
        group.terminateNode(follower.getLocalEndpoint());
        RestoredRaftState restoredState = store.toRestoredRaftState();
        assertThat(restoredState.getTermPersistentState().getTerm()).isEqualTo(getTerm(leader));

        leader.replicate(applyValue("missed")).join();
        RaftNodeImpl restarted = group.restoreNode(restoredState, store);

        eventually(() -> {
            assertThat(restarted.getLeaderEndpoint()).isEqualTo(leader.getLocalEndpoint());
            assertThat(getTerm(restarted)).isEqualTo(getTerm(leader));
            assertThat(getCommitIndex(restarted)).isEqualTo(getCommitIndex(leader));
            assertThat(group.getStateMachine(restarted.getLocalEndpoint()).valueList()).endsWith("missed")
                                                                                     .hasSize(count + 1);
        });
    }

    @Test(timeout = 300_000)
    public void testFollowerTerminatesOnStoreFailureAndGroupStaysAvailable() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        RaftNodeImpl follower = group.getAnyFollower();
        leader.replicate(applyValue("before")).join();

        getInMemoryStore(follower).failWrites();

        assertThat(leader.replicate(applyValue("after")).join().getResult()).isEqualTo("after");
        eventually(() -> assertThat(follower.getStatus()).isEqualTo(TERMINATED));

        assertThatThrownBy(() -> follower.replicate(applyValue("rejected")).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(NotLeaderException.class);
    }

    @Test(timeout = 300_000)
    public void testLeaderTerminatesOnStoreFailureAndNewLeaderTakesOver() {
        RaftNodeImpl leader = startGroupAndElectLeader();
        leader.replicate(applyValue("before")).join();

        getInMemoryStore(leader).failWrites();

        assertThatThrownBy(() -> leader.replicate(applyValue("lost")).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(PersistenceFailureException.class);
        assertThat(leader.getStatus()).isEqualTo(TERMINATED);

        RaftNodeImpl newLeader = group.waitUntilLeaderElected();
        assertThat(newLeader.getLocalEndpoint()).isNotEqualTo(leader.getLocalEndpoint());
        newLeader.replicate(applyValue("after")).join();
    }

}

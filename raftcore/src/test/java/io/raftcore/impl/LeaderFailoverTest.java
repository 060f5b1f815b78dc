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

import io.raftcore.Ordered;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftRole;
import io.raftcore.exception.IndeterminateStateException;
import io.raftcore.exception.NotLeaderException;
import io.raftcore.impl.local.LocalRaftGroup;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.message.AppendEntriesSuccessResponse;
import io.raftcore.model.message.VoteRequest;
import io.raftcore.test.util.BaseTest;
import org.junit.After;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.raftcore.impl.local.SimpleStateMachine.applyValue;
import static io.raftcore.test.util.AssertionUtils.allTheTime;
import static io.raftcore.test.util.AssertionUtils.eventually;
import static io.raftcore.test.util.RaftTestUtils.TEST_RAFT_CONFIG;
import static io.raftcore.test.util.RaftTestUtils.getCommitIndex;
import static io.raftcore.test.util.RaftTestUtils.getLastLogEntry;
import static io.raftcore.test.util.RaftTestUtils.getRole;
import static io.raftcore.test.util.RaftTestUtils.getTerm;
import static io.raftcore.test.util.RaftTestUtils.getVotedEndpoint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Covers what happens to the log and to the pending operations when the leader fails or gets partitioned.
 */
public class LeaderFailoverTest
        extends BaseTest {

    private LocalRaftGroup group;

    @After
    public void destroy() {
        if (group != null) {
            group.destroy();
        }
    }

    private static long lastLogIndex(RaftNodeImpl node) {
        LogEntry entry = getLastLogEntry(node);
        return entry != null ? entry.getIndex() : 0;
    }

    private void awaitCommitIndexOnAll(List<RaftNodeImpl> nodes, long commitIndex) {
        eventually(() -> {
            for (RaftNodeImpl node : nodes) {
                assertThat(getCommitIndex(node)).isEqualTo(commitIndex);
            }
        });
    }

    private void awaitLeaderOnAll(List<RaftNodeImpl> nodes, RaftEndpoint exLeader) {
        eventually(() -> {
            for (RaftNodeImpl node : nodes) {
                assertThat(node.getLeaderEndpoint()).isNotNull().isNotEqualTo(exLeader);
            }
        });
    }

    @Test(timeout = 300_000)
    public void when_2NodeGroupStarts_then_allNodesAgreeOnTheLeader() {
        verifyAllNodesAgreeOnLeader(2);
    }

    @Test(timeout = 300_000)
    public void when_3NodeGroupStarts_then_allNodesAgreeOnTheLeader() {
        verifyAllNodesAgreeOnLeader(3);
    }

    private void verifyAllNodesAgreeOnLeader(int groupSize) {
        group = LocalRaftGroup.start(groupSize);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        int term = getTerm(leader);

        eventually(() -> group.getNodes().forEach(node -> {
            assertThat(node.getLeaderEndpoint()).isEqualTo(leader.getLocalEndpoint());
            assertThat(getTerm(node)).isEqualTo(term);
        }));

        assertThat(group.getNodes()).filteredOn(node -> getRole(node) == RaftRole.LEADER).hasSize(1);
    }

    @Test(timeout = 300_000)
    public void when_leaderTerminates_then_followersElectNewLeaderInHigherTerm() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl oldLeader = group.waitUntilLeaderElected();
        int oldTerm = getTerm(oldLeader);
        List<RaftNodeImpl> survivors = group.getNodesExcept(oldLeader.getLocalEndpoint());

        group.terminateNode(oldLeader.getLocalEndpoint());
        awaitLeaderOnAll(survivors, oldLeader.getLocalEndpoint());

        RaftNodeImpl newLeader = group.waitUntilLeaderElected();
        assertThat(getTerm(newLeader)).isGreaterThan(oldTerm);
        assertThat(newLeader.replicate(applyValue("val")).join().getResult()).isEqualTo("val");
    }

    @Test(timeout = 300_000)
    public void when_followerTerminates_then_leaderStillCommitsWithRemainingMajority() {
        group = LocalRaftGroup.start(3);
        RaftNodeImpl leader = group.waitUntilLeaderElected();

        group.terminateNode(group.getAnyNodeExcept(leader.getLocalEndpoint()).getLocalEndpoint());

        assertThat(leader.replicate(applyValue("val")).join().getResult()).isEqualTo("val");
    }

    @Test(timeout = 300_000)
    public void when_isolatedFollowerRejoins_then_itDoesNotDisruptTheLeader() {
        group = LocalRaftGroup.start(3);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        int term = getTerm(leader);
        RaftNodeImpl isolated = group.getAnyNodeExcept(leader.getLocalEndpoint());
        RaftEndpoint isolatedEndpoint = isolated.getLocalEndpoint();

        group.dropMessagesTo(leader.getLocalEndpoint(), isolatedEndpoint, AppendEntriesRequest.class);
        leader.replicate(applyValue("val")).join();
        group.splitMembers(isolatedEndpoint);

        // pre-vote rounds do not increment the term
        allTheTime(() -> assertThat(getTerm(isolated)).isEqualTo(term), 3);

        group.resetAllRulesFrom(leader.getLocalEndpoint());
        group.merge();

        RaftNodeImpl currentLeader = group.waitUntilLeaderElected();
        assertThat(currentLeader.getLocalEndpoint()).isNotEqualTo(isolatedEndpoint);
        assertThat(getTerm(currentLeader)).isEqualTo(term);
    }

    @Test(timeout = 300_000)
    public void when_newLeaderHasUncommittedEntryOfOldTerm_then_itCommitsItOnlyWithItsOwnEntry() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl oldLeader = group.waitUntilLeaderElected();
        oldLeader.replicate(applyValue("val1")).join();
        awaitCommitIndexOnAll(group.getNodes(), 1);

        List<RaftNodeImpl> followers = group.getNodesExcept(oldLeader.getLocalEndpoint());
        RaftNodeImpl successor = followers.get(0);
        RaftNodeImpl other = followers.get(1);
        group.dropMessagesTo(oldLeader.getLocalEndpoint(), other.getLocalEndpoint(), AppendEntriesRequest.class);
        group.dropMessagesTo(successor.getLocalEndpoint(), oldLeader.getLocalEndpoint(),
                AppendEntriesSuccessResponse.class);

        oldLeader.replicate(applyValue("val2"));
        eventually(() -> assertThat(lastLogIndex(successor)).isEqualTo(2));

        group.terminateNode(oldLeader.getLocalEndpoint());
        eventually(() -> followers.forEach(
                node -> assertThat(node.getLeaderEndpoint()).isEqualTo(successor.getLocalEndpoint())));

        // the entry at index 2 has the previous term
        allTheTime(() -> followers.forEach(node -> assertThat(getCommitIndex(node)).isEqualTo(1)), 3);

        successor.replicate(applyValue("val3")).join();

        eventually(() -> followers.forEach(node -> {
            assertThat(getCommitIndex(node)).isEqualTo(3);
            assertThat(group.getStateMachine(node.getLocalEndpoint()).valueList()).containsExactly("val1", "val2",
                    "val3");
        }));
    }

    @Test(timeout = 300_000)
    public void when_followerWithExtraEntryCannotWin_then_itsExtraEntryIsOverwritten() {
        group = LocalRaftGroup.start(5, TEST_RAFT_CONFIG);
        RaftNodeImpl oldLeader = group.waitUntilLeaderElected();
        oldLeader.replicate(applyValue("val1")).join();
        awaitCommitIndexOnAll(group.getNodes(), 1);

        List<RaftNodeImpl> followers = group.getNodesExcept(oldLeader.getLocalEndpoint());
        RaftNodeImpl ahead = followers.get(0);
        List<RaftNodeImpl> behind = followers.subList(1, followers.size());
        for (RaftNodeImpl node : behind) {
            group.dropMessagesTo(oldLeader.getLocalEndpoint(), node.getLocalEndpoint(), AppendEntriesRequest.class);
        }

        oldLeader.replicate(applyValue("val2"));
        eventually(() -> assertThat(lastLogIndex(ahead)).isEqualTo(2));

        for (RaftNodeImpl node : behind) {
            group.dropMessagesTo(ahead.getLocalEndpoint(), node.getLocalEndpoint(), VoteRequest.class);
        }

        group.terminateNode(oldLeader.getLocalEndpoint());

        RaftNodeImpl newLeader = group.waitUntilLeaderElected();
        assertThat(newLeader.getLocalEndpoint()).isNotEqualTo(ahead.getLocalEndpoint());

        newLeader.replicate(applyValue("val3")).join();

        eventually(() -> followers.forEach(node -> {
            assertThat(getCommitIndex(node)).isEqualTo(2);
            assertThat(group.getStateMachine(node.getLocalEndpoint()).valueList()).containsExactly("val1", "val3");
        }));
        assertThat(lastLogIndex(ahead)).isEqualTo(2);
    }

    @Test(timeout = 300_000)
    public void when_leaderIsCutOffInMinority_then_itsEntriesAreReplacedByTheMajority() {
        int entryCount = 10;
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl oldLeader = group.waitUntilLeaderElected();
        oldLeader.replicate(applyValue("val1")).join();
        awaitCommitIndexOnAll(group.getNodes(), 1);

        List<RaftNodeImpl> majority = group.getNodesExcept(oldLeader.getLocalEndpoint());
        group.splitMembers(oldLeader.getLocalEndpoint());

        List<CompletableFuture<Ordered<Object>>> lostFutures = IntStream.range(0, entryCount)
                .mapToObj(i -> oldLeader.<Object>replicate(applyValue("lost" + i)))
                .collect(Collectors.toList());

        awaitLeaderOnAll(majority, oldLeader.getLocalEndpoint());
        RaftNodeImpl majorityLeader = group.getNode(majority.get(0).getLeaderEndpoint());
        for (int i = 0; i < entryCount; i++) {
            majorityLeader.replicate(applyValue("kept" + i)).join();
        }

        group.merge();
        assertThat(group.waitUntilLeaderElected().getLocalEndpoint()).isNotEqualTo(oldLeader.getLocalEndpoint());

        for (CompletableFuture<Ordered<Object>> future : lostFutures) {
            assertThatThrownBy(future::join).satisfies(e -> assertThat(e.getCause())
                    .isInstanceOfAny(NotLeaderException.class, IndeterminateStateException.class));
        }

        List<Object> expected = IntStream.range(0, entryCount).mapToObj(i -> "kept" + i).collect(Collectors.toList());
        expected.add(0, "val1");
        eventually(() -> group.getNodes().forEach(
                node -> assertThat(group.getStateMachine(node.getLocalEndpoint()).valueList()).isEqualTo(expected)));
    }

    @Test(timeout = 300_000)
    public void when_leaderLosesMajority_then_itStepsDownAndKeepsItsVote() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        assertThat(getVotedEndpoint(leader)).isEqualTo(leader.getLocalEndpoint());

        group.splitMembers(leader.getLocalEndpoint());

        assertThatThrownBy(() -> leader.replicate(applyValue("val")).join()).satisfies(
                e -> assertThat(e.getCause()).isInstanceOfAny(IndeterminateStateException.class,
                        NotLeaderException.class));
        eventually(() -> assertThat(getRole(leader)).isEqualTo(RaftRole.FOLLOWER));
        assertThat(getVotedEndpoint(leader)).isEqualTo(leader.getLocalEndpoint());
    }

    @Test(timeout = 300_000)
    public void when_leaderIsTerminatedWithUncommittedEntry_then_itsFutureFailsIndeterminately() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        group.dropMessagesToAll(leader.getLocalEndpoint(), AppendEntriesRequest.class);

        CompletableFuture<Ordered<Object>> future = leader.replicate(applyValue("val"));
        eventually(() -> assertThat(lastLogIndex(leader)).isEqualTo(1));

        leader.terminate().join();

        assertThat(leader.getLeaderEndpoint()).isNull();
        assertThatThrownBy(future::join).hasCauseInstanceOf(IndeterminateStateException.class);
    }

}

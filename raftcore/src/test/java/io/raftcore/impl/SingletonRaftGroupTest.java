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
import io.raftcore.RaftNodeStatus;
import io.raftcore.RaftRole;
import io.raftcore.impl.local.LocalRaftGroup;
import io.raftcore.test.util.BaseTest;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static io.raftcore.QueryPolicy.EVENTUAL_CONSISTENCY;
import static io.raftcore.QueryPolicy.LEADER_LEASE;
import static io.raftcore.QueryPolicy.LINEARIZABLE;
import static io.raftcore.impl.local.LocalRaftGroup.IN_MEMORY_RAFT_STORE_FACTORY;
import static io.raftcore.impl.local.SimpleStateMachine.applyValue;
import static io.raftcore.impl.local.SimpleStateMachine.queryLastValue;
import static io.raftcore.test.util.AssertionUtils.eventually;
import static io.raftcore.test.util.RaftTestUtils.TEST_RAFT_CONFIG;
import static io.raftcore.test.util.RaftTestUtils.getCommitIndex;
import static io.raftcore.test.util.RaftTestUtils.getInMemoryStore;
import static io.raftcore.test.util.RaftTestUtils.getRole;
import static io.raftcore.test.util.RaftTestUtils.getTerm;
import static org.assertj.core.api.Assertions.assertThat;

public class SingletonRaftGroupTest
        extends BaseTest {

    private LocalRaftGroup group;

    @After
    public void destroy() {
        if (group != null) {
            group.destroy();
        }
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupIsStarted_then_leaderIsElected() {
        group = LocalRaftGroup.start(1, TEST_RAFT_CONFIG);

        RaftNodeImpl leader = group.waitUntilLeaderElected();

        assertThat(leader.getLocalEndpoint()).isEqualTo(group.getNodes().get(0).getLocalEndpoint());
        assertThat(getRole(leader)).isEqualTo(RaftRole.LEADER);
        assertThat(getTerm(leader)).isEqualTo(1);
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupIsStarted_then_operationsAreCommitted() {
        group = LocalRaftGroup.start(1, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();

        for (int i = 1; i <= 10; i++) {
            Ordered<Object> result = leader.replicate(applyValue("val" + i)).join();
            assertThat(result.getCommitIndex()).isEqualTo(i);
            assertThat(result.getResult()).isEqualTo("val" + i);
        }

        assertThat(group.getStateMachine(leader.getLocalEndpoint()).size()).isEqualTo(10);
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupHasStore_then_operationsAreCommittedAfterFlush() {
        group = LocalRaftGroup.newBuilder(1)
                              .setConfig(TEST_RAFT_CONFIG)
                              .setRaftStoreFactory(IN_MEMORY_RAFT_STORE_FACTORY)
                              .start();
        RaftNodeImpl leader = group.waitUntilLeaderElected();

        Ordered<Object> result = leader.replicate(applyValue("val")).join();

        assertThat(result.getCommitIndex()).isEqualTo(1);
        assertThat(getInMemoryStore(leader).logEntries()).hasSize(1);
        assertThat(getInMemoryStore(leader).flushCount()).isGreaterThan(0);
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupIsStartedWithNewTermOperation_then_itIsCommitted() {
        group = LocalRaftGroup.newBuilder(1).setConfig(TEST_RAFT_CONFIG).enableNewTermOperation().start();
        RaftNodeImpl leader = group.waitUntilLeaderElected();

        eventually(() -> assertThat(getCommitIndex(leader)).isEqualTo(1));

        Ordered<Object> result = leader.replicate(applyValue("val")).join();
        assertThat(result.getCommitIndex()).isEqualTo(2);
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupIsQueried_then_allPoliciesReturnLatestValue() {
        group = LocalRaftGroup.start(1, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        leader.replicate(applyValue("val")).join();

        assertThat(leader.query(queryLastValue(), LINEARIZABLE, 0).join().getResult()).isEqualTo("val");
        assertThat(leader.query(queryLastValue(), LEADER_LEASE, 0).join().getResult()).isEqualTo("val");
        assertThat(leader.query(queryLastValue(), EVENTUAL_CONSISTENCY, 0).join().getResult()).isEqualTo("val");
    }

    @Test(timeout = 300_000)
    public void when_singletonRaftGroupIsTerminated_then_statusIsTerminated() {
        group = LocalRaftGroup.start(1, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        leader.replicate(applyValue("val")).join();

        leader.terminate().join();

        assertThat(leader.getStatus()).isEqualTo(RaftNodeStatus.TERMINATED);
    }

    @Test(timeout = 300_000)
    public void when_replicateRacesWithTerminate_then_everyFutureCompletes() throws Exception {
        group = LocalRaftGroup.start(1, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        leader.replicate(applyValue("val")).join();

        List<CompletableFuture<Ordered<Object>>> futures = new ArrayList<>();
        CountDownLatch replicating = new CountDownLatch(1);
        Thread replicator = new Thread(() -> {
            for (int i = 0; i < 100_000 && leader.getStatus() != RaftNodeStatus.TERMINATED; i++) {
                futures.add(leader.replicate(applyValue("val")));
                replicating.countDown();
            }

            while (leader.getStatus() != RaftNodeStatus.TERMINATED) {
                Thread.yield();
            }

            // submitted after the status is observed as terminated
            futures.add(leader.replicate(applyValue("val")));
        });
        replicator.start();

        replicating.await();
        leader.terminate().join();
        replicator.join();

        // only read after join(), so no synchronization on the list
        eventually(() -> assertThat(futures).allMatch(CompletableFuture::isDone));
        assertThat(futures.get(futures.size() - 1)).isCompletedExceptionally();
    }

}

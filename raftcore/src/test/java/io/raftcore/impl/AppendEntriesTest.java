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
import io.raftcore.impl.local.LocalRaftGroup;
import io.raftcore.model.impl.DefaultRaftModelFactory;
import io.raftcore.model.message.AppendEntriesFailureResponse;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.message.RaftMessage;
import io.raftcore.report.RaftNodeReport;
import io.raftcore.test.util.BaseTest;
import org.junit.After;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static io.raftcore.impl.local.SimpleStateMachine.applyValue;
import static io.raftcore.test.util.AssertionUtils.eventually;
import static io.raftcore.test.util.RaftTestUtils.TEST_RAFT_CONFIG;
import static io.raftcore.test.util.RaftTestUtils.getCommitIndex;
import static io.raftcore.test.util.RaftTestUtils.getMatchIndex;
import static io.raftcore.test.util.RaftTestUtils.getTerm;
import static java.util.Collections.emptyList;
import static org.assertj.core.api.Assertions.assertThat;

public class AppendEntriesTest
        extends BaseTest {

    private LocalRaftGroup group;

    @After
    public void tearDown() {
        if (group != null) {
            group.destroy();
        }
    }

    @Test(timeout = 300_000)
    public void when_followerMissesEntries_then_itCatchesUpWithNewLeader() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();

        List<RaftNodeImpl> followers = group.getNodesExcept(leader.getLocalEndpoint());
        RaftNodeImpl follower0 = followers.get(0);
        RaftNodeImpl follower1 = followers.get(1);

        group.dropMessagesTo(leader.getLocalEndpoint(), follower0.getLocalEndpoint(), AppendEntriesRequest.class);

        int operationCount = 10;
        for (int i = 0; i < operationCount; i++) {
            leader.replicate(applyValue("value" + i)).join();
        }

        RaftNodeReport leaderReport = leader.getReport().join().getResult();
        assertThat(leaderReport.getLog().getLastLogIndex()).isEqualTo(operationCount);

        RaftNodeReport follower1Report = follower1.getReport().join().getResult();
        assertThat(follower1Report.getLog().getLastLogIndex()).isEqualTo(operationCount);

        RaftNodeReport follower0Report = follower0.getReport().join().getResult();
        assertThat(follower0Report.getLog().getLastLogIndex()).isEqualTo(0);

        // follower0 cannot win the election with its empty log
        group.terminateNode(leader.getLocalEndpoint());
        RaftNodeImpl newLeader = group.waitUntilLeaderElected();
        assertThat(newLeader.getLocalEndpoint()).isEqualTo(follower1.getLocalEndpoint());

        newLeader.replicate(applyValue("valueNew")).join();

        eventually(() -> {
            RaftNodeReport report = follower0.getReport().join().getResult();
            assertThat(report.getLog().getLastLogIndex()).isEqualTo(operationCount + 1);
            assertThat(report.getLog().getCommitIndex()).isEqualTo(operationCount + 1);
            assertThat(group.getStateMachine(follower0.getLocalEndpoint()).size()).isEqualTo(operationCount + 1);
        });
    }

    @Test(timeout = 300_000)
    public void when_appendEntriesRequestHasStaleTerm_then_itIsRejectedWithCurrentTerm() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        leader.replicate(applyValue("val")).join();

        RaftNodeImpl follower = group.getAnyFollower();
        RaftEndpoint leaderEndpoint = leader.getLocalEndpoint();
        int currentTerm = getTerm(follower);
        long followerCommitIndex = getCommitIndex(follower);

        long stalePreviousLogIndex = 1000;
        AtomicReference<AppendEntriesFailureResponse> responseRef = new AtomicReference<>();
        group.alterMessagesTo(follower.getLocalEndpoint(), leaderEndpoint, message -> {
            if (message instanceof AppendEntriesFailureResponse
                    && ((AppendEntriesFailureResponse) message).getExpectedNextIndex() == stalePreviousLogIndex + 1) {
                responseRef.set((AppendEntriesFailureResponse) message);
            }

            return message;
        });

        RaftMessage staleRequest = new DefaultRaftModelFactory().createAppendEntriesRequestBuilder()
                                                                .setGroupId(follower.getGroupId())
                                                                .setSender(leaderEndpoint)
                                                                .setTerm(currentTerm - 1)
                                                                .setPreviousLogIndex(stalePreviousLogIndex)
                                                                .setPreviousLogTerm(currentTerm - 1)
                                                                .setCommitIndex(stalePreviousLogIndex)
                                                                .setLogEntries(emptyList())
                                                                .build();
        follower.handle(staleRequest);

        eventually(() -> {
            AppendEntriesFailureResponse response = responseRef.get();
            assertThat(response).isNotNull();
            assertThat(response.getTerm()).isEqualTo(currentTerm);
        });

        assertThat(getTerm(follower)).isEqualTo(currentTerm);
        assertThat(getCommitIndex(follower)).isEqualTo(followerCommitIndex);
        assertThat(follower.getLeaderEndpoint()).isEqualTo(leaderEndpoint);
    }

    @Test(timeout = 300_000)
    public void when_messageOfAnotherGroupIsReceived_then_itIsIgnored() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        RaftNodeImpl follower = group.getAnyFollower();
        int term = getTerm(follower);

        RaftMessage request = new DefaultRaftModelFactory().createAppendEntriesRequestBuilder()
                                                           .setGroupId("another-group")
                                                           .setSender(leader.getLocalEndpoint())
                                                           .setTerm(term + 10)
                                                           .setLogEntries(emptyList())
                                                           .build();
        follower.handle(request);

        leader.replicate(applyValue("val")).join();

        assertThat(getTerm(follower)).isEqualTo(term);
        assertThat(getTerm(leader)).isEqualTo(term);
    }

    @Test(timeout = 300_000)
    public void when_followerLogIsBehind_then_leaderBacksOffNextIndexUntilLogsMatch() {
        group = LocalRaftGroup.start(3, TEST_RAFT_CONFIG);
        RaftNodeImpl leader = group.waitUntilLeaderElected();
        RaftNodeImpl slowFollower = group.getAnyFollower();

        for (int i = 0; i < 5; i++) {
            leader.replicate(applyValue("val" + i)).join();
        }

        eventually(() -> assertThat(getMatchIndex(leader, slowFollower.getLocalEndpoint())).isEqualTo(5));

        group.dropMessagesTo(leader.getLocalEndpoint(), slowFollower.getLocalEndpoint(), AppendEntriesRequest.class);

        for (int i = 5; i < 20; i++) {
            leader.replicate(applyValue("val" + i)).join();
        }

        assertThat(getMatchIndex(leader, slowFollower.getLocalEndpoint())).isEqualTo(5);

        group.allowMessagesTo(leader.getLocalEndpoint(), slowFollower.getLocalEndpoint(), AppendEntriesRequest.class);

        eventually(() -> {
            assertThat(getMatchIndex(leader, slowFollower.getLocalEndpoint())).isEqualTo(20);
            assertThat(getCommitIndex(slowFollower)).isEqualTo(20);
            assertThat(group.getStateMachine(slowFollower.getLocalEndpoint()).size()).isEqualTo(20);
        });
    }

}

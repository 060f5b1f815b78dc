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

package io.raftcore.impl.local;

import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.RaftNode.RaftNodeBuilder;
import io.raftcore.executor.impl.DefaultRaftNodeExecutor;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.state.RaftTermState;
import io.raftcore.model.message.RaftMessage;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RestoredRaftState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static io.raftcore.RaftNodeStatus.isTerminal;
import static io.raftcore.test.util.AssertionUtils.eventually;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * A Raft group whose nodes run in the same JVM and talk over {@link LocalTransport}. Tests use it to terminate nodes,
 * partition the group and drop or alter messages on the way.
 *
 * @see LocalRaftEndpoint
 * @see Firewall
 */
public final class LocalRaftGroup {

    public static final Function<RaftEndpoint, RaftStore> IN_MEMORY_RAFT_STORE_FACTORY = e -> new InMemoryRaftStore();

    private static final String GROUP_ID = "local-group";

    private final RaftConfig config;
    private final boolean newTermOperationEnabled;
    private final Map<RaftEndpoint, Member> members = new LinkedHashMap<>();

    private LocalRaftGroup(LocalRaftGroupBuilder builder) {
        this.config = builder.config;
        this.newTermOperationEnabled = builder.newTermOperationEnabled;

        List<RaftEndpoint> endpoints = new ArrayList<>();
        for (int i = 0; i < builder.groupSize; i++) {
            endpoints.add(LocalRaftEndpoint.newEndpoint());
        }

        for (RaftEndpoint endpoint : endpoints) {
            Member member = new Member(endpoint);
            RaftNodeBuilder nodeBuilder = member.nodeBuilder().setLocalEndpoint(endpoint)
                                                              .setInitialGroupMembers(endpoints);
            if (builder.raftStoreFactory != null) {
                nodeBuilder.setStore(builder.raftStoreFactory.apply(endpoint));
            }

            member.node = (RaftNodeImpl) nodeBuilder.build();
            members.put(endpoint, member);
        }
    }

    public static LocalRaftGroup start(int groupSize) {
        return newBuilder(groupSize).start();
    }

    public static LocalRaftGroup start(int groupSize, RaftConfig config) {
        return newBuilder(groupSize).setConfig(config).start();
    }

    public static LocalRaftGroupBuilder newBuilder(int groupSize) {
        return new LocalRaftGroupBuilder(groupSize);
    }

    /**
     * Connects the Raft nodes to each other and starts them.
     */
    public void start() {
        connectAll();
        members.values().forEach(member -> member.node.start());
    }

    private void connectAll() {
        for (Member from : members.values()) {
            for (Member to : members.values()) {
                if (from != to && to.isAlive()) {
                    from.transport.discoverNode(to.node);
                }
            }
        }
    }

    /**
     * Replaces a terminated Raft node with a new one built from the given restored state and store, and starts it.
     */
    public RaftNodeImpl restoreNode(RestoredRaftState restoredState, RaftStore store) {
        RaftEndpoint endpoint = requireNonNull(restoredState).getLocalEndpoint();
        Member previous = members.get(endpoint);
        if (previous != null && previous.isAlive()) {
            throw new IllegalStateException(endpoint.getId() + " is still running");
        }

        Member member = new Member(endpoint);
        member.node = (RaftNodeImpl) member.nodeBuilder().setRestoredState(restoredState).setStore(store).build();
        members.put(endpoint, member);
        connectAll();
        member.node.start();
        return member.node;
    }

    public List<RaftNodeImpl> getNodes() {
        return members.values().stream().map(member -> member.node).collect(toList());
    }

    public List<RaftNodeImpl> getNodesExcept(RaftEndpoint endpoint) {
        member(endpoint);
        return members.values()
                      .stream()
                      .filter(member -> !member.endpoint.equals(endpoint))
                      .map(member -> member.node)
                      .collect(toList());
    }

    public RaftNodeImpl getAnyNodeExcept(RaftEndpoint endpoint) {
        return getNodesExcept(endpoint).get(0);
    }

    public RaftNodeImpl getNode(RaftEndpoint endpoint) {
        return member(endpoint).node;
    }

    public SimpleStateMachine getStateMachine(RaftEndpoint endpoint) {
        return member(endpoint).stateMachine;
    }

    /**
     * Returns the leader that every running Raft node reports in the same term, or null while they disagree.
     *
     * @throws AssertionError
     *             if a running Raft node knows no leader
     */
    public RaftEndpoint getLeaderEndpoint() {
        RaftTermState agreed = null;
        for (Member member : members.values()) {
            if (!member.isAlive()) {
                continue;
            }

            RaftTermState view = member.node.getTerm();
            if (view.getLeaderEndpoint() == null) {
                throw new AssertionError(member.endpoint.getId() + " knows no leader in term: " + view.getTerm());
            } else if (agreed == null) {
                agreed = view;
            } else if (agreed.getTerm() != view.getTerm() || !agreed.getLeaderEndpoint().equals(view.getLeaderEndpoint())) {
                return null;
            }
        }

        return agreed != null ? agreed.getLeaderEndpoint() : null;
    }

    public RaftNodeImpl getLeaderNode() {
        RaftEndpoint leader = getLeaderEndpoint();
        if (leader == null) {
            return null;
        }

        Member member = members.get(leader);
        if (member == null || !member.isAlive()) {
            throw new AssertionError(leader.getId() + " is reported as the leader but it is not running");
        }

        return member.node;
    }

    /**
     * Blocks until the running Raft nodes agree on a leader.
     */
    public RaftNodeImpl waitUntilLeaderElected() {
        AtomicReference<RaftNodeImpl> leader = new AtomicReference<>();
        eventually(() -> {
            leader.set(getLeaderNode());
            assertThat(leader.get()).isNotNull();
        });

        return leader.get();
    }

    public RaftNodeImpl getAnyFollower() {
        RaftEndpoint leader = getLeaderEndpoint();
        if (leader == null) {
            throw new AssertionError("No leader yet");
        }

        return getAnyNodeExcept(leader);
    }

    /**
     * Cuts the given Raft endpoints off from the rest of the group in both directions.
     */
    public void splitMembers(RaftEndpoint... endpoints) {
        splitMembers(Arrays.asList(endpoints));
    }

    public void splitMembers(Collection<RaftEndpoint> endpoints) {
        List<Member> island = endpoints.stream().map(this::member).collect(toList());
        for (Member inside : island) {
            for (Member outside : members.values()) {
                if (!island.contains(outside)) {
                    inside.transport.undiscoverNode(outside.node);
                    outside.transport.undiscoverNode(inside.node);
                }
            }
        }
    }

    /**
     * Heals every partition created by {@link #splitMembers(Collection)}.
     */
    public void merge() {
        connectAll();
    }

    public <T extends RaftMessage> void dropMessagesTo(RaftEndpoint source, RaftEndpoint target, Class<T> messageType) {
        member(source).transport.getFirewall().dropMessagesTo(target, messageType);
    }

    public <T extends RaftMessage> void allowMessagesTo(RaftEndpoint source, RaftEndpoint target, Class<T> messageType) {
        member(source).transport.getFirewall().allowMessagesTo(target, messageType);
    }

    public void dropAllMessagesTo(RaftEndpoint source, RaftEndpoint target) {
        member(source).transport.getFirewall().dropAllMessagesTo(target);
    }

    public <T extends RaftMessage> void dropMessagesToAll(RaftEndpoint source, Class<T> messageType) {
        member(source).transport.getFirewall().dropMessagesToAll(messageType);
    }

    public void alterMessagesTo(RaftEndpoint source, RaftEndpoint target, Function<RaftMessage, RaftMessage> function) {
        member(source).transport.getFirewall().alterMessagesTo(target, function);
    }

    public void resetAllRulesFrom(RaftEndpoint source) {
        member(source).transport.getFirewall().resetAllRules();
    }

    /**
     * Terminates the Raft node and disconnects it. The endpoint stays in the group so that it can be restored.
     */
    public void terminateNode(RaftEndpoint endpoint) {
        Member member = member(endpoint);
        member.node.terminate().join();
        splitMembers(endpoint);
        member.shutdownExecutor();
    }

    public void destroy() {
        members.values().forEach(member -> member.node.terminate());
        members.values().forEach(Member::shutdownExecutor);
        members.clear();
    }

    private Member member(RaftEndpoint endpoint) {
        Member member = members.get(requireNonNull(endpoint));
        if (member == null) {
            throw new IllegalArgumentException("Unknown endpoint: " + endpoint);
        }

        return member;
    }

    public static final class LocalRaftGroupBuilder {

        private final int groupSize;
        private RaftConfig config = RaftConfig.DEFAULT_RAFT_CONFIG;
        private boolean newTermOperationEnabled;
        private Function<RaftEndpoint, RaftStore> raftStoreFactory;

        private LocalRaftGroupBuilder(int groupSize) {
            if (groupSize < 1) {
                throw new IllegalArgumentException("Group size must be positive: " + groupSize);
            }

            this.groupSize = groupSize;
        }

        public LocalRaftGroupBuilder setConfig(RaftConfig config) {
            this.config = requireNonNull(config);
            return this;
        }

        /**
         * Makes the state machines return an operation for new terms, so that every new leader appends an entry.
         */
        public LocalRaftGroupBuilder enableNewTermOperation() {
            this.newTermOperationEnabled = true;
            return this;
        }

        public LocalRaftGroupBuilder setRaftStoreFactory(Function<RaftEndpoint, RaftStore> raftStoreFactory) {
            this.raftStoreFactory = requireNonNull(raftStoreFactory);
            return this;
        }

        public LocalRaftGroup build() {
            return new LocalRaftGroup(this);
        }

        public LocalRaftGroup start() {
            LocalRaftGroup group = build();
            group.start();
            return group;
        }

    }

    private final class Member {

        final RaftEndpoint endpoint;
        final LocalTransport transport;
        final SimpleStateMachine stateMachine = new SimpleStateMachine(newTermOperationEnabled);
        RaftNodeImpl node;

        Member(RaftEndpoint endpoint) {
            this.endpoint = endpoint;
            this.transport = new LocalTransport(endpoint);
        }

        RaftNodeBuilder nodeBuilder() {
            return RaftNode.newBuilder()
                           .setGroupId(GROUP_ID)
                           .setConfig(config)
                           .setTransport(transport)
                           .setStateMachine(stateMachine);
        }

        boolean isAlive() {
            return !isTerminal(node.getStatus()) && !executor().getExecutor().isShutdown();
        }

        void shutdownExecutor() {
            executor().getExecutor().shutdown();
        }

        DefaultRaftNodeExecutor executor() {
            return (DefaultRaftNodeExecutor) node.getExecutor();
        }

    }

}

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

import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.RaftNode.RaftNodeBuilder;
import io.raftcore.executor.RaftNodeExecutor;
import io.raftcore.executor.impl.DefaultRaftNodeExecutor;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.impl.DefaultRaftModelFactory;
import io.raftcore.persistence.NopRaftStore;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RestoredRaftState;
import io.raftcore.report.RaftNodeReportListener;
import io.raftcore.statemachine.StateMachine;
import io.raftcore.transport.Transport;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;

import static io.raftcore.RaftConfig.DEFAULT_RAFT_CONFIG;
import static java.util.Objects.requireNonNull;

public class RaftNodeBuilderImpl
        implements RaftNodeBuilder {

    private static final RaftNodeReportListener NO_OP_LISTENER = report -> {
    };

    private Object groupId;
    private RaftEndpoint localEndpoint;
    private Collection<RaftEndpoint> initialGroupMembers;
    private RestoredRaftState restoredState;
    private RaftConfig config = DEFAULT_RAFT_CONFIG;
    private RaftNodeExecutor executor;
    private Transport transport;
    private StateMachine stateMachine;
    private RaftNodeReportListener listener = NO_OP_LISTENER;
    private RaftStore store = NopRaftStore.INSTANCE;
    private RaftModelFactory modelFactory = new DefaultRaftModelFactory();
    private Random random = new Random();
    private Clock clock = Clock.systemUTC();
    private boolean built;

    @Nonnull
    @Override
    public RaftNodeBuilder setGroupId(@Nonnull Object groupId) {
        this.groupId = requireNonNull(groupId, "groupId");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setLocalEndpoint(@Nonnull RaftEndpoint localEndpoint) {
        checkNotRestoring("local endpoint");
        this.localEndpoint = requireNonNull(localEndpoint, "localEndpoint");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setInitialGroupMembers(@Nonnull Collection<RaftEndpoint> initialGroupMembers) {
        checkNotRestoring("initial group members");
        this.initialGroupMembers = new LinkedHashSet<>(requireNonNull(initialGroupMembers, "initialGroupMembers"));
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setRestoredState(@Nonnull RestoredRaftState restoredState) {
        if (localEndpoint != null || initialGroupMembers != null) {
            throw new IllegalStateException("Restored state conflicts with the local endpoint or initial members set "
                                            + "before");
        }

        this.restoredState = requireNonNull(restoredState, "restoredState");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setConfig(@Nonnull RaftConfig config) {
        this.config = requireNonNull(config, "config");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setExecutor(@Nonnull RaftNodeExecutor executor) {
        this.executor = requireNonNull(executor, "executor");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setTransport(@Nonnull Transport transport) {
        this.transport = requireNonNull(transport, "transport");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setStateMachine(@Nonnull StateMachine stateMachine) {
        this.stateMachine = requireNonNull(stateMachine, "stateMachine");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setStore(@Nonnull RaftStore store) {
        this.store = requireNonNull(store, "store");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setModelFactory(@Nonnull RaftModelFactory modelFactory) {
        this.modelFactory = requireNonNull(modelFactory, "modelFactory");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setRaftNodeReportListener(@Nonnull RaftNodeReportListener listener) {
        this.listener = requireNonNull(listener, "listener");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setRandom(@Nonnull Random random) {
        this.random = requireNonNull(random, "random");
        return this;
    }

    @Nonnull
    @Override
    public RaftNodeBuilder setClock(@Nonnull Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    @Nonnull
    @Override
    public RaftNode build() {
        verifyComplete();
        built = true;

        RaftNodeExecutor nodeExecutor = executor != null ? executor : new DefaultRaftNodeExecutor();
        if (restoredState == null) {
            return new RaftNodeImpl(groupId, localEndpoint, initialGroupMembers, config, nodeExecutor, stateMachine,
                    transport, modelFactory, store, listener, random, clock);
        }

        return new RaftNodeImpl(groupId, restoredState, config, nodeExecutor, stateMachine, transport, modelFactory,
                store, listener, random, clock);
    }

    private void checkNotRestoring(String property) {
        if (restoredState != null) {
            throw new IllegalStateException("Cannot set " + property + " after restored state is provided");
        }
    }

    private void verifyComplete() {
        if (built) {
            throw new IllegalStateException("This builder has already built a Raft node");
        }

        List<String> missing = new ArrayList<>();
        if (groupId == null) {
            missing.add("group id");
        }
        if (restoredState == null) {
            if (localEndpoint == null) {
                missing.add("local endpoint or restored state");
            }
            if (initialGroupMembers == null || initialGroupMembers.isEmpty()) {
                missing.add("initial group members or restored state");
            }
        }
        if (transport == null) {
            missing.add("transport");
        }
        if (stateMachine == null) {
            missing.add("state machine");
        }

        if (!missing.isEmpty()) {
            throw new IllegalStateException("Cannot build Raft node, missing: " + String.join(", ", missing));
        }
    }

}

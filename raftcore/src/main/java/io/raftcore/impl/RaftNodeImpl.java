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
import io.raftcore.QueryPolicy;
import io.raftcore.RaftConfig;
import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.RaftNodeStatus;
import io.raftcore.exception.CannotReplicateException;
import io.raftcore.exception.LaggingCommitIndexException;
import io.raftcore.exception.NotLeaderException;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.exception.RaftException;
import io.raftcore.executor.RaftNodeExecutor;
import io.raftcore.impl.handler.AppendEntriesFailureResponseHandler;
import io.raftcore.impl.handler.AppendEntriesRequestHandler;
import io.raftcore.impl.handler.AppendEntriesSuccessResponseHandler;
import io.raftcore.impl.handler.PreVoteRequestHandler;
import io.raftcore.impl.handler.PreVoteResponseHandler;
import io.raftcore.impl.handler.VoteRequestHandler;
import io.raftcore.impl.handler.VoteResponseHandler;
import io.raftcore.impl.log.RaftLog;
import io.raftcore.impl.report.RaftLogStatsImpl;
import io.raftcore.impl.report.RaftNodeReportImpl;
import io.raftcore.impl.state.FollowerState;
import io.raftcore.impl.state.LeaderState;
import io.raftcore.impl.state.QueryState;
import io.raftcore.impl.state.RaftState;
import io.raftcore.impl.state.RaftTermState;
import io.raftcore.impl.task.HeartbeatTask;
import io.raftcore.impl.task.LeaderElectionTimeoutTask;
import io.raftcore.impl.task.PreVoteTask;
import io.raftcore.impl.task.PreVoteTimeoutTask;
import io.raftcore.impl.task.QueryTask;
import io.raftcore.impl.task.RaftStateSummaryPublishTask;
import io.raftcore.impl.task.ReplicateTask;
import io.raftcore.impl.util.OrderedFuture;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.message.AppendEntriesFailureResponse;
import io.raftcore.model.message.AppendEntriesRequest;
import io.raftcore.model.message.AppendEntriesSuccessResponse;
import io.raftcore.model.message.PreVoteRequest;
import io.raftcore.model.message.PreVoteResponse;
import io.raftcore.model.message.RaftMessage;
import io.raftcore.model.message.VoteRequest;
import io.raftcore.model.message.VoteResponse;
import io.raftcore.persistence.NopRaftStore;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RestoredRaftState;
import io.raftcore.report.RaftNodeReport;
import io.raftcore.report.RaftNodeReport.RaftNodeReportReason;
import io.raftcore.report.RaftNodeReportListener;
import io.raftcore.statemachine.StateMachine;
import io.raftcore.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Stream;

import static io.raftcore.RaftNodeStatus.ACTIVE;
import static io.raftcore.RaftNodeStatus.INITIAL;
import static io.raftcore.RaftNodeStatus.TERMINATED;
import static io.raftcore.RaftNodeStatus.isTerminal;
import static io.raftcore.RaftRole.FOLLOWER;
import static io.raftcore.RaftRole.LEADER;
import static java.util.Collections.emptyMap;
import static java.util.Collections.shuffle;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static java.util.stream.Collectors.toList;

/**
 * Implementation of {@link RaftNode}.
 * <p>
 * Every API call, inbound Raft message and timer becomes a task on the {@link RaftNodeExecutor}, which runs them one at a
 * time. {@link RaftState} is therefore mutated by a single thread and needs no locking. Leader side replication is done
 * by {@link LogReplicator}.
 * <p>
 * The node terminates itself when its {@link RaftStore} fails to persist the term, the vote or log entries, since it can
 * no longer keep the promises it has made to the other members.
 */
@SuppressWarnings({"checkstyle:classfanoutcomplexity", "checkstyle:classdataabstractioncoupling"})
public final class RaftNodeImpl
        implements RaftNode {

    private static final Logger LOGGER = LoggerFactory.getLogger(RaftNode.class);
    private static final int ELECTION_TIMEOUT_NOISE_MILLIS = 100;

    private final Object groupId;
    private final RaftState state;
    private final RaftConfig config;
    private final Transport transport;
    private final RaftNodeExecutor executor;
    private final StateMachine stateMachine;
    private final RaftModelFactory modelFactory;
    private final RaftStore store;
    private final RaftNodeReportListener raftNodeReportListener;
    private final Random random;
    private final Clock clock;
    private final String localEndpointStr;
    private final long leaderHeartbeatTimeoutMillis;
    private final LogReplicator replicator;
    private final List<RaftNodeLifecycleAware> lifecycleAwareComponents;
    private final List<RaftNodeLifecycleAware> startedComponents = new ArrayList<>();

    private long lastLeaderHeartbeatTimestamp;
    private volatile RaftNodeStatus status = INITIAL;

    @SuppressWarnings("checkstyle:parameternumber")
    RaftNodeImpl(Object groupId, RaftEndpoint localEndpoint, Collection<RaftEndpoint> initialGroupMembers,
                 RaftConfig config, RaftNodeExecutor executor, StateMachine stateMachine, Transport transport,
                 RaftModelFactory modelFactory, RaftStore store, RaftNodeReportListener raftNodeReportListener,
                 Random random, Clock clock) {
        this(groupId, RaftState.create(groupId, localEndpoint, initialGroupMembers, store, modelFactory), config,
                executor, stateMachine, transport, modelFactory, store, raftNodeReportListener, random, clock);
    }

    @SuppressWarnings("checkstyle:parameternumber")
    RaftNodeImpl(Object groupId, RestoredRaftState restoredState, RaftConfig config, RaftNodeExecutor executor,
                 StateMachine stateMachine, Transport transport, RaftModelFactory modelFactory, RaftStore store,
                 RaftNodeReportListener raftNodeReportListener, Random random, Clock clock) {
        this(groupId, RaftState.restore(groupId, requireNonNull(restoredState), store, modelFactory), config, executor,
                stateMachine, transport, modelFactory, store, raftNodeReportListener, random, clock);
    }

    @SuppressWarnings("checkstyle:parameternumber")
    private RaftNodeImpl(Object groupId, RaftState state, RaftConfig config, RaftNodeExecutor executor,
                         StateMachine stateMachine, Transport transport, RaftModelFactory modelFactory, RaftStore store,
                         RaftNodeReportListener raftNodeReportListener, Random random, Clock clock) {
        this.groupId = requireNonNull(groupId);
        this.state = state;
        this.config = requireNonNull(config);
        this.executor = requireNonNull(executor);
        this.stateMachine = requireNonNull(stateMachine);
        this.transport = requireNonNull(transport);
        this.modelFactory = requireNonNull(modelFactory);
        this.store = requireNonNull(store);
        this.raftNodeReportListener = requireNonNull(raftNodeReportListener);
        this.random = requireNonNull(random);
        this.clock = requireNonNull(clock);
        this.localEndpointStr = state.localEndpoint().getId() + "<" + groupId + ">";
        this.leaderHeartbeatTimeoutMillis = SECONDS.toMillis(config.getLeaderHeartbeatTimeoutSecs());
        this.replicator = new LogReplicator(this, config, executor, modelFactory);
        this.lifecycleAwareComponents = Stream.of(executor, transport, stateMachine, store, modelFactory,
                raftNodeReportListener)
                                              .filter(RaftNodeLifecycleAware.class::isInstance)
                                              .map(RaftNodeLifecycleAware.class::cast)
                                              .collect(toList());
        // components must not depend on a particular start order
        shuffle(lifecycleAwareComponents);
    }

    @Nonnull
    @Override
    public Object getGroupId() {
        return groupId;
    }

    @Nonnull
    @Override
    public RaftEndpoint getLocalEndpoint() {
        return state.localEndpoint();
    }

    @Nonnull
    @Override
    public List<RaftEndpoint> getInitialMembers() {
        return state.members();
    }

    @Nonnull
    @Override
    public RaftConfig getConfig() {
        return config;
    }

    @Nonnull
    @Override
    public RaftTermState getTerm() {
        return state.termState();
    }

    @Nonnull
    @Override
    public RaftNodeStatus getStatus() {
        return status;
    }

    public RaftState state() {
        return state;
    }

    public RaftNodeExecutor getExecutor() {
        return executor;
    }

    public RaftModelFactory getModelFactory() {
        return modelFactory;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Returns the id and the group of the local Raft endpoint to prefix the log lines with.
     */
    public String localEndpointStr() {
        return localEndpointStr;
    }

    /**
     * Returns the leader known by the local Raft node. It might be stale.
     */
    @Nullable
    public RaftEndpoint getLeaderEndpoint() {
        return state.leader();
    }

    /**
     * Moves the Raft node to the given status and publishes a report. {@link RaftNodeStatus#TERMINATED} is final.
     *
     * @throws IllegalStateException
     *             if the Raft node is already terminated
     */
    public void setStatus(RaftNodeStatus newStatus) {
        if (isTerminal(status)) {
            throw new IllegalStateException("Cannot set status: " + newStatus + " since already " + status);
        } else if (status == newStatus) {
            return;
        }

        status = newStatus;
        if (newStatus == ACTIVE) {
            LOGGER.info("{} Status is set to {}", localEndpointStr, newStatus);
        } else {
            LOGGER.warn("{} Status is set to {}", localEndpointStr, newStatus);
        }

        publishRaftNodeReport(RaftNodeReportReason.STATUS_CHANGE);
    }

    @Nonnull
    @Override
    public CompletableFuture<Ordered<Object>> start() {
        OrderedFuture<Object> future = new OrderedFuture<>();
        if (status != INITIAL) {
            future.fail(new IllegalStateException("Cannot start RaftNode when " + status));
            return future;
        }

        submitIfNotTerminated(() -> {
            if (status != INITIAL) {
                future.fail(new IllegalStateException("Cannot start RaftNode of " + localEndpointStr + " when " + status));
                return;
            }

            try {
                doStart();
                future.completeNull(state.commitIndex());
            } catch (Throwable t) {
                LOGGER.error(localEndpointStr + " could not start.", t);
                if (!isTerminal(status)) {
                    setStatus(TERMINATED);
                }

                terminateComponents();
                future.fail(t);
            }
        }, future);

        return future;
    }

    private void doStart() throws Exception {
        LOGGER.info("{} Starting for {} with {} members: {}", localEndpointStr, groupId, state.memberCount(),
                state.members());

        replicator.init(!(store instanceof NopRaftStore));
        executor.schedule(new HeartbeatTask(this), config.getLeaderHeartbeatPeriodSecs(), SECONDS);
        executor.schedule(new RaftStateSummaryPublishTask(this), config.getRaftNodeReportPublishPeriodSecs(), SECONDS);

        for (RaftNodeLifecycleAware component : lifecycleAwareComponents) {
            startedComponents.add(component);
            component.onRaftNodeStart();
        }

        state.persistInitialState();
        setStatus(ACTIVE);

        if (state.memberCount() == 1) {
            LOGGER.info("{} is the single member in the Raft group.", localEndpointStr);
            toSingletonLeader();
        } else {
            LOGGER.info("{} started.", localEndpointStr);
            runPreVote();
        }
    }

    private void terminateComponents() {
        for (RaftNodeLifecycleAware component : startedComponents) {
            try {
                component.onRaftNodeTerminate();
            } catch (Throwable t) {
                LOGGER.error(localEndpointStr + " failure during termination of " + component, t);
            }
        }

        startedComponents.clear();
    }

    @Nonnull
    @Override
    public CompletableFuture<Ordered<Object>> terminate() {
        OrderedFuture<Object> future = new OrderedFuture<>();
        if (isTerminal(status)) {
            future.completeNull(state.commitIndex());
            return future;
        }

        Runnable task = () -> {
            if (isTerminal(status)) {
                future.completeNull(state.commitIndex());
                return;
            }

            boolean started = status != INITIAL;
            Throwable failure = null;
            try {
                if (status == ACTIVE) {
                    // another leader may still commit the pending entries
                    toFollower(state.term());
                }

                setStatus(TERMINATED);
                state.invalidateAllFutures(newNotLeaderException());
            } catch (Throwable t) {
                LOGGER.error("Failure during termination of " + localEndpointStr, t);
                failure = t;
            } finally {
                if (started) {
                    terminateComponents();
                }
            }

            // completed last so that the caller observes terminated components
            if (failure == null) {
                future.completeNull(state.commitIndex());
            } else {
                future.fail(failure);
            }
        };

        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // a concurrent terminate() already shut the executor down
            LOGGER.debug("{} is already terminated", localEndpointStr);
            future.completeNull(state.commitIndex());
        }

        return future;
    }

    /**
     * Terminates this Raft node after its {@link RaftStore} failed. Pending futures are failed with the given exception.
     */
    public void terminateOnPersistenceFailure(PersistenceFailureException e) {
        if (isTerminal(status)) {
            return;
        }

        LOGGER.error(localEndpointStr + " Terminating because of a persistence failure!", e);
        try {
            setStatus(TERMINATED);
            state.invalidateAllFutures(e);
        } finally {
            terminateComponents();
        }
    }

    @Override
    public void handle(@Nonnull RaftMessage message) {
        if (isTerminal(status)) {
            LOGGER.warn("{} will not handle {} because {}", localEndpointStr,
                    LOGGER.isDebugEnabled() ? message : message.getClass().getSimpleName(), status);
            return;
        } else if (!groupId.equals(message.getGroupId())) {
            LOGGER.warn("{} will not handle {} of another Raft group", localEndpointStr, message);
            return;
        }

        Runnable handler = newMessageHandler(message);
        try {
            executor.execute(handler);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("{} terminated before handling {}", localEndpointStr, message);
        } catch (Throwable t) {
            LOGGER.error(localEndpointStr + " could not handle " + message, t);
        }
    }

    private Runnable newMessageHandler(RaftMessage message) {
        if (message instanceof AppendEntriesRequest) {
            return new AppendEntriesRequestHandler(this, (AppendEntriesRequest) message);
        } else if (message instanceof AppendEntriesSuccessResponse) {
            return new AppendEntriesSuccessResponseHandler(this, (AppendEntriesSuccessResponse) message);
        } else if (message instanceof AppendEntriesFailureResponse) {
            return new AppendEntriesFailureResponseHandler(this, (AppendEntriesFailureResponse) message);
        } else if (message instanceof VoteRequest) {
            return new VoteRequestHandler(this, (VoteRequest) message);
        } else if (message instanceof VoteResponse) {
            return new VoteResponseHandler(this, (VoteResponse) message);
        } else if (message instanceof PreVoteRequest) {
            return new PreVoteRequestHandler(this, (PreVoteRequest) message);
        } else if (message instanceof PreVoteResponse) {
            return new PreVoteResponseHandler(this, (PreVoteResponse) message);
        }

        throw new IllegalArgumentException("Invalid Raft msg: " + message);
    }

    @Nonnull
    @Override
    public <T> CompletableFuture<Ordered<T>> replicate(@Nonnull Object operation) {
        OrderedFuture<Object> future = new OrderedFuture<>();
        submitIfNotTerminated(new ReplicateTask(this, requireNonNull(operation), future), future);
        return cast(future);
    }

    @Nonnull
    @Override
    public <T> CompletableFuture<Ordered<T>> query(@Nonnull Object operation, @Nonnull QueryPolicy queryPolicy,
                                                   long minCommitIndex) {
        OrderedFuture<Object> future = new OrderedFuture<>();
        submitIfNotTerminated(new QueryTask(this, requireNonNull(operation), requireNonNull(queryPolicy),
                Math.max(minCommitIndex, 0L), future), future);
        return cast(future);
    }

    @SuppressWarnings("unchecked")
    private static <T> CompletableFuture<Ordered<T>> cast(OrderedFuture<Object> future) {
        return (CompletableFuture<Ordered<T>>) (CompletableFuture<?>) future;
    }

    @Nonnull
    @Override
    public CompletableFuture<Ordered<RaftNodeReport>> getReport() {
        OrderedFuture<RaftNodeReport> future = new OrderedFuture<>();
        submitIfNotTerminated(() -> {
            try {
                future.complete(state.commitIndex(), newReport(RaftNodeReportReason.API_CALL));
            } catch (Throwable t) {
                future.fail(t);
            }
        }, future);

        return future;
    }

    private void submitIfNotTerminated(Runnable task, OrderedFuture<?> future) {
        if (isTerminal(status)) {
            future.fail(newNotLeaderException());
            return;
        }

        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // terminated after the status check
            LOGGER.debug("{} rejected {}", localEndpointStr, task);
            future.fail(newNotLeaderException());
        }
    }

    public RaftException newNotLeaderException() {
        return new NotLeaderException(getLocalEndpoint(), isTerminal(status) ? null : getLeaderEndpoint());
    }

    public RaftException newCannotReplicateException() {
        return new CannotReplicateException(isTerminal(status) ? null : getLeaderEndpoint());
    }

    public RaftException newLaggingCommitIndexException(long minCommitIndex) {
        assert minCommitIndex > state.commitIndex() : "min commit index: " + minCommitIndex
                + " must be greater than commit index: " + state.commitIndex();
        return new LaggingCommitIndexException(state.commitIndex(), minCommitIndex, state.leader());
    }

    /**
     * Returns true if the leader can append a new operation. Appends are rejected once the number of appended but not yet
     * committed entries reaches {@link RaftConfig#getMaxPendingLogEntryCount()}.
     */
    public boolean canReplicateNewOperation() {
        return state.log().lastLogIndex() - state.commitIndex() < config.getMaxPendingLogEntryCount();
    }

    /**
     * Returns true if the leader can take a new linearizable query. The leader needs a committed entry of its current term
     * to know the latest commit index (Section 6.4 of the Raft dissertation). The number of waiting queries is also bounded
     * by {@link RaftConfig#getMaxPendingLogEntryCount()}.
     */
    public boolean canQueryLinearizable() {
        long commitIndex = state.commitIndex();
        if (commitIndex == 0 || state.log().getLogEntry(commitIndex).getTerm() != state.term()) {
            return false;
        }

        return state.leaderState().queryState().queryCount() < config.getMaxPendingLogEntryCount();
    }

    /**
     * Applies the committed entries after {@code lastApplied} to the state machine in log index order and completes
     * their futures.
     */
    public void applyLogEntries() {
        assert state.commitIndex() >= state.lastApplied() : localEndpointStr + " commit index: " + state.commitIndex()
                + " is smaller than last applied: " + state.lastApplied();

        RaftLog log = state.log();
        while (state.lastApplied() < state.commitIndex()) {
            long index = state.lastApplied() + 1;
            LogEntry entry = log.getLogEntry(index);
            if (entry == null) {
                String msg = localEndpointStr + " failed to get log entry at index: " + index;
                LOGGER.error(msg);
                throw new AssertionError(msg);
            }

            LOGGER.debug("{} Processing {}", localEndpointStr, entry);
            Object result;
            try {
                result = stateMachine.runOperation(index, entry.getOperation());
            } catch (Exception e) {
                LOGGER.error(localEndpointStr + " execution of " + entry.getOperation() + " at commit index: " + index
                        + " failed.", e);
                result = e;
            }

            state.lastApplied(index);
            state.completeFuture(index, result);
        }
    }

    /**
     * Runs the given query on the state machine at the last applied index and completes the future with its result.
     */
    public void runQuery(Object operation, OrderedFuture<Object> future) {
        long lastApplied = state.lastApplied();
        try {
            future.complete(lastApplied, stateMachine.runOperation(lastApplied, operation));
        } catch (Throwable t) {
            LOGGER.error(localEndpointStr + " query: " + operation + " failed at log index: " + lastApplied, t);
            future.fail(t);
        }
    }

    /**
     * Counts the ack of the given follower for the given query round and runs the waiting queries if the round has a
     * quorum.
     */
    public void tryAckQuery(long querySequenceNumber, RaftEndpoint sender) {
        LeaderState leaderState = state.leaderState();
        if (leaderState != null && leaderState.queryState().tryAck(querySequenceNumber, sender)) {
            LOGGER.debug("{} ack from {} for query sequence number: {}", localEndpointStr, sender.getId(),
                    querySequenceNumber);
            tryRunQueries();
        }
    }

    /**
     * Runs the waiting linearizable queries once the majority has acked the current query round and the state machine has
     * caught up with the read index.
     */
    public void tryRunQueries() {
        LeaderState leaderState = state.leaderState();
        if (leaderState == null) {
            return;
        }

        QueryState queryState = leaderState.queryState();
        if (!queryState.isQuorumAckReceived(state.commitIndex(), state.majority())) {
            return;
        }

        Collection<Entry<Object, OrderedFuture<Object>>> queries = queryState.queries();
        LOGGER.debug("{} running {} queries at commit index: {}, query sequence number: {}", localEndpointStr,
                queries.size(), state.commitIndex(), queryState.querySequenceNumber());
        queries.forEach(query -> runQuery(query.getKey(), query.getValue()));
        queryState.reset();
    }

    public void broadcastAppendEntriesRequest() {
        replicator.broadcastAppendEntries();
    }

    public void sendAppendEntriesRequest(RaftEndpoint target) {
        replicator.sendAppendEntries(target);
    }

    /**
     * Advances the commit index to the highest index replicated on the majority if that entry is from the current term.
     *
     * @return true if the commit index is advanced
     */
    public boolean tryAdvanceCommitIndex() {
        return replicator.tryAdvanceCommitIndex();
    }

    /**
     * Sends the given message to the given endpoint. A failure of the transport is only logged, since lost messages are
     * sent again with the next heartbeat or election round.
     */
    public void send(RaftEndpoint target, RaftMessage message) {
        try {
            transport.send(target, message);
        } catch (Throwable t) {
            LOGGER.error("Could not send " + (LOGGER.isDebugEnabled() ? message : message.getClass().getSimpleName())
                    + " to " + target, t);
        }
    }

    private void sendToRemoteMembers(RaftMessage message) {
        for (RaftEndpoint member : state.remoteMembers()) {
            send(member, message);
        }
    }

    public void leaderHeartbeatReceived() {
        lastLeaderHeartbeatTimestamp = Math.max(lastLeaderHeartbeatTimestamp, clock.millis());
    }

    /**
     * Returns true if the leader heartbeat timeout has elapsed since the last append entries request of the known leader.
     */
    public boolean isLeaderHeartbeatTimeoutElapsed() {
        return isLeaderHeartbeatTimeoutElapsed(lastLeaderHeartbeatTimestamp);
    }

    private boolean isLeaderHeartbeatTimeoutElapsed(long timestamp) {
        return clock.millis() - timestamp >= leaderHeartbeatTimeoutMillis;
    }

    /**
     * Steps down if the leader has not heard from the majority within the leader heartbeat timeout.
     *
     * @return true if the local Raft node is not the leader anymore
     */
    public boolean demoteToFollowerIfQuorumHeartbeatTimeoutElapsed() {
        Optional<Long> quorumTimestamp = getQuorumHeartbeatTimestamp();
        if (!quorumTimestamp.isPresent()) {
            return true;
        } else if (!isLeaderHeartbeatTimeoutElapsed(quorumTimestamp.get())) {
            return false;
        }

        LOGGER.warn("{} Demoting to {} since not received append entries responses from majority recently. Latest "
                + "quorum timestamp: {}", localEndpointStr, FOLLOWER, quorumTimestamp.get());
        toFollower(state.term());
        return true;
    }

    private Optional<Long> getQuorumHeartbeatTimestamp() {
        LeaderState leaderState = state.leaderState();
        return leaderState != null
               ? Optional.of(Math.min(leaderState.quorumResponseTimestamp(state.majority()), clock.millis()))
               : Optional.empty();
    }

    /**
     * Records the given endpoint as the known leader of the current term.
     */
    public void leader(RaftEndpoint member) {
        state.leader(member);
        publishRaftNodeReport(RaftNodeReportReason.ROLE_CHANGE);
    }

    public void toFollower(int term) {
        state.toFollower(term);
        publishRaftNodeReport(RaftNodeReportReason.ROLE_CHANGE);
    }

    /**
     * Becomes the leader of the current term. The new term operation of the state machine, if any, is appended first and
     * then the followers are contacted.
     */
    public void toLeader() {
        state.toLeader(clock.millis());

        Object newTermOperation = stateMachine.getNewTermOperation();
        if (newTermOperation != null) {
            RaftLog log = state.log();
            log.appendEntry(modelFactory.createLogEntryBuilder()
                                        .setTerm(state.term())
                                        .setIndex(log.lastLogIndex() + 1)
                                        .setOperation(newTermOperation)
                                        .build());
        }

        broadcastAppendEntriesRequest();
        publishRaftNodeReport(RaftNodeReportReason.ROLE_CHANGE);
    }

    /**
     * Starts an election for the next term unless a leader is already known. The vote requests are sticky, so the members
     * that still hear from a leader reject them.
     */
    public void toCandidate() {
        if (state.leader() != null) {
            LOGGER.warn("{} No new election round, we already have a LEADER: {}", localEndpointStr, state.leader().getId());
            return;
        }

        state.toCandidate();
        RaftLog log = state.log();
        LOGGER.info("{} Leader election started for term: {}, last log index: {}, last log term: {}", localEndpointStr,
                state.term(), log.lastLogIndex(), log.lastLogTerm());
        publishRaftNodeReport(RaftNodeReportReason.ROLE_CHANGE);

        sendToRemoteMembers(modelFactory.createVoteRequestBuilder()
                                        .setGroupId(groupId)
                                        .setSender(getLocalEndpoint())
                                        .setTerm(state.term())
                                        .setLastLogTerm(log.lastLogTerm())
                                        .setLastLogIndex(log.lastLogIndex())
                                        .setSticky(true)
                                        .build());

        executor.schedule(new LeaderElectionTimeoutTask(this, state.term()), getLeaderElectionTimeoutMs(), MILLISECONDS);
    }

    /**
     * Asks the other members if they would vote for the local Raft node in the next term. The local term does not change.
     */
    public void preCandidate() {
        state.initPreCandidateState();
        int nextTerm = state.term() + 1;
        RaftLog log = state.log();
        LOGGER.info("{} Pre-vote started for next term: {}, last log index: {}, last log term: {}", localEndpointStr,
                nextTerm, log.lastLogIndex(), log.lastLogTerm());

        sendToRemoteMembers(modelFactory.createPreVoteRequestBuilder()
                                        .setGroupId(groupId)
                                        .setSender(getLocalEndpoint())
                                        .setTerm(nextTerm)
                                        .setLastLogTerm(log.lastLogTerm())
                                        .setLastLogIndex(log.lastLogIndex())
                                        .build());

        executor.schedule(new PreVoteTimeoutTask(this, state.term()), getLeaderElectionTimeoutMs(), MILLISECONDS);
    }

    public void runPreVote() {
        new PreVoteTask(this, state.term()).run();
    }

    /**
     * Makes the only member of a singleton Raft group the leader of the next term.
     */
    public void toSingletonLeader() {
        state.toCandidate();
        LOGGER.info("{} Leader election started for term: {}, last log index: {}, last log term: {}", localEndpointStr,
                state.term(), state.log().lastLogIndex(), state.log().lastLogTerm());
        publishRaftNodeReport(RaftNodeReportReason.ROLE_CHANGE);

        toLeader();
        LOGGER.info("{} We are the LEADER!", localEndpointStr);
    }

    /**
     * Returns the leader election timeout with a random noise so that candidates do not split votes forever.
     */
    public long getLeaderElectionTimeoutMs() {
        return config.getLeaderElectionTimeoutMillis() + random.nextInt(ELECTION_TIMEOUT_NOISE_MILLIS);
    }

    /**
     * Passes a new {@link RaftNodeReport} to the {@link RaftNodeReportListener}. Status and role changes are also logged
     * with the member list.
     */
    public void publishRaftNodeReport(RaftNodeReportReason reason) {
        RaftNodeReportImpl report = newReport(reason);
        if (reason == RaftNodeReportReason.STATUS_CHANGE || reason == RaftNodeReportReason.ROLE_CHANGE) {
            LOGGER.info(describe(report));
        }

        try {
            raftNodeReportListener.accept(report);
        } catch (Throwable t) {
            LOGGER.error(localEndpointStr + "'s listener: " + raftNodeReportListener + " failed for " + report, t);
        }
    }

    private String describe(RaftNodeReport report) {
        StringBuilder sb = new StringBuilder(localEndpointStr);
        sb.append(" term: ").append(report.getTerm().getTerm())
          .append(", lastLogIndex: ").append(report.getLog().getLastLogIndex())
          .append(", commitIndex: ").append(report.getLog().getCommitIndex())
          .append(", members of ").append(groupId).append(" [");
        for (RaftEndpoint member : state.members()) {
            sb.append("\n\t").append(member.getId());
            if (member.equals(getLocalEndpoint())) {
                sb.append(" - ").append(state.role()).append(" this (").append(status).append(")");
            } else if (member.equals(state.leader())) {
                sb.append(" - ").append(LEADER);
            }
        }

        return sb.append("\n] reason: ").append(report.getReason()).append("\n").toString();
    }

    private RaftNodeReportImpl newReport(RaftNodeReportReason reason) {
        LeaderState leaderState = state.leaderState();
        Map<RaftEndpoint, Long> heartbeatTimestamps = followerValues(leaderState, FollowerState::responseTimestamp);
        Optional<Long> quorumTimestamp = getQuorumHeartbeatTimestamp();
        // only followers report when they last heard from the leader
        Optional<Long> leaderHeartbeatTimestamp = leaderState == null && lastLeaderHeartbeatTimestamp > 0
                                                  ? Optional.of(lastLeaderHeartbeatTimestamp)
                                                  : Optional.empty();

        RaftLog log = state.log();
        RaftLogStatsImpl logStats = new RaftLogStatsImpl(state.commitIndex(), state.lastApplied(), log.lastLogTerm(),
                log.lastLogIndex(), followerValues(leaderState, FollowerState::matchIndex));

        return new RaftNodeReportImpl(requireNonNull(reason), groupId, state.localEndpoint(), state.members(),
                state.role(), status, state.termState(), logStats, heartbeatTimestamps, quorumTimestamp,
                leaderHeartbeatTimestamp);
    }

    private static Map<RaftEndpoint, Long> followerValues(LeaderState leaderState,
                                                          Function<FollowerState, Long> valueFn) {
        if (leaderState == null) {
            return emptyMap();
        }

        Map<RaftEndpoint, Long> values = new LinkedHashMap<>();
        leaderState.getFollowerStates().forEach((follower, followerState) -> values.put(follower,
                valueFn.apply(followerState)));
        return values;
    }

}

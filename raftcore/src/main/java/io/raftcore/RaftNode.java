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

package io.raftcore;

import io.raftcore.exception.CannotReplicateException;
import io.raftcore.exception.IndeterminateStateException;
import io.raftcore.exception.LaggingCommitIndexException;
import io.raftcore.exception.NotLeaderException;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.executor.RaftNodeExecutor;
import io.raftcore.executor.impl.DefaultRaftNodeExecutor;
import io.raftcore.impl.RaftNodeBuilderImpl;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.impl.DefaultRaftModelFactory;
import io.raftcore.model.message.RaftMessage;
import io.raftcore.persistence.NopRaftStore;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RestoredRaftState;
import io.raftcore.report.RaftNodeReport;
import io.raftcore.report.RaftNodeReportListener;
import io.raftcore.report.RaftTerm;
import io.raftcore.statemachine.StateMachine;
import io.raftcore.transport.Transport;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * A Raft node runs the Raft consensus algorithm as a member of a Raft group.
 * <p>
 * Operations and queries passed to Raft nodes must be deterministic, i.e., they must produce the same result independent
 * of when or on which Raft node it is being executed.
 * <p>
 * Before a Raft group is created, its member list must be decided. Then, a Raft node is created for each one of its
 * members with the same member list. The member list does not change afterwards.
 * <p>
 * Status of a Raft node is {@link RaftNodeStatus#INITIAL} on creation, and it moves to {@link RaftNodeStatus#ACTIVE} and
 * starts executing the Raft consensus algorithm when {@link #start()} is called.
 * <p>
 * Raft nodes execute the Raft consensus algorithm with the Actor model. Each Raft node runs in a single-threaded manner.
 * It uses a {@link RaftNodeExecutor} to sequentially handle API calls and {@link RaftMessage} objects created via
 * {@link RaftModelFactory}. Raft nodes communicate with each other via {@link Transport}, run committed operations on
 * the user-provided {@link StateMachine} and persist their state via {@link RaftStore}.
 * <p>
 * Every API method returns a {@link CompletableFuture} which is completed with an {@link Ordered} result on the Raft node
 * thread.
 *
 * @see RaftEndpoint
 * @see RaftRole
 * @see RaftNodeStatus
 * @see StateMachine
 */
public interface RaftNode {

    /**
     * Returns a new builder to configure a Raft node that is going to be created.
     *
     * @return a new builder to configure a Raft node that is going to be created
     */
    static RaftNodeBuilder newBuilder() {
        return new RaftNodeBuilderImpl();
    }

    /**
     * Returns the unique ID of the Raft group that this Raft node belongs to.
     *
     * @return the unique ID of the Raft group that this Raft node belongs to
     */
    @Nonnull
    Object getGroupId();

    /**
     * Returns the local endpoint of this Raft node.
     *
     * @return the local endpoint of this Raft node
     */
    @Nonnull
    RaftEndpoint getLocalEndpoint();

    /**
     * Returns the config object this Raft node is initialized with.
     *
     * @return the config object this Raft node is initialized with
     */
    @Nonnull
    RaftConfig getConfig();

    /**
     * Returns the locally known term information.
     * <p>
     * Please note that the other Raft nodes in the Raft group may have already switched to a higher term.
     *
     * @return the locally known term information
     */
    @Nonnull
    RaftTerm getTerm();

    /**
     * Returns the current status of this Raft node.
     *
     * @return the current status of this Raft node
     */
    @Nonnull
    RaftNodeStatus getStatus();

    /**
     * Returns the member list of the Raft group this Raft node belongs to.
     *
     * @return the member list of the Raft group
     */
    @Nonnull
    List<RaftEndpoint> getInitialMembers();

    /**
     * Triggers this Raft node to start executing the Raft consensus algorithm.
     * <p>
     * The returned future is completed with {@link IllegalStateException} if this Raft node has already terminated.
     *
     * @return the future object to be notified after this Raft node starts
     */
    @Nonnull
    CompletableFuture<Ordered<Object>> start();

    /**
     * Forcefully sets the status of this Raft node to {@link RaftNodeStatus#TERMINATED} and makes the Raft node stops
     * executing the Raft consensus algorithm.
     *
     * @return the future object to be notified after this Raft node terminates
     */
    @Nonnull
    CompletableFuture<Ordered<Object>> terminate();

    /**
     * Handles the given Raft message which can be either a Raft RPC request or a response.
     * <p>
     * Silently ignores the given Raft message if this Raft node has already terminated, or the message belongs to
     * another Raft group or comes from an unknown endpoint.
     *
     * @param message
     *            the object sent by another Raft node of this Raft group
     */
    void handle(@Nonnull RaftMessage message);

    /**
     * Replicates, commits, and executes the given operation via this Raft node. The given operation is executed once it
     * is committed in the Raft group, and the returned future object is notified with its execution result.
     * <p>
     * The returned future is notified with an {@link Ordered} object that contains the log index on which the given
     * operation is committed and executed.
     * <p>
     * The returned future can be notified with {@link NotLeaderException}, {@link CannotReplicateException},
     * {@link IndeterminateStateException} or {@link PersistenceFailureException}.
     *
     * @param operation
     *            the operation to replicate
     * @param <T>
     *            type of the result of the operation execution
     *
     * @return the future to be notified with the result of the operation execution, or the exception if the replication
     *         fails
     */
    @Nonnull
    <T> CompletableFuture<Ordered<T>> replicate(@Nonnull Object operation);

    /**
     * Executes the given query operation based on the given query policy without appending it to the Raft log.
     * <p>
     * The returned future is notified with an {@link Ordered} object that contains the commit index on which the given
     * query is executed.
     * <p>
     * If the caller is providing a query policy which is weaker than {@link QueryPolicy#LINEARIZABLE}, it can also
     * provide a minimum commit index. Then, the local Raft node executes the given query only if its local commit index
     * is greater than or equal to the required commit index. Otherwise, the returned future is notified with
     * {@link LaggingCommitIndexException}.
     *
     * @param operation
     *            the query operation to execute
     * @param queryPolicy
     *            the query policy to decide how to execute the given query
     * @param minCommitIndex
     *            the minimum commit index that this Raft node has to have in order to execute the given query
     * @param <T>
     *            type of the result of the query execution
     *
     * @return the future to be notified with the result of the query execution, or the exception if the query cannot be
     *         executed
     */
    @Nonnull
    <T> CompletableFuture<Ordered<T>> query(@Nonnull Object operation, @Nonnull QueryPolicy queryPolicy,
                                            long minCommitIndex);

    /**
     * Returns a report object that contains information about this Raft node's local state related to the execution of
     * the Raft consensus algorithm.
     *
     * @return a report object that contains information about this Raft node's local state
     */
    @Nonnull
    CompletableFuture<Ordered<RaftNodeReport>> getReport();

    /**
     * The builder interface for configuring and creating Raft node instances.
     */
    interface RaftNodeBuilder {

        /**
         * Sets the unique ID of the Raft group that this Raft node belongs to.
         *
         * @param groupId
         *            the group id to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setGroupId(@Nonnull Object groupId);

        /**
         * Sets the endpoint of the Raft node being created.
         * <p>
         * This method must be used when a Raft node is created for the first time. For a restarted Raft node,
         * {@link #setRestoredState(RestoredRaftState)} must be used instead.
         *
         * @param localEndpoint
         *            the Raft endpoint to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setLocalEndpoint(@Nonnull RaftEndpoint localEndpoint);

        /**
         * Sets the member list of the Raft group. The local endpoint must be in the member list.
         *
         * @param initialGroupMembers
         *            the member list of the Raft group
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setInitialGroupMembers(@Nonnull Collection<RaftEndpoint> initialGroupMembers);

        /**
         * Sets the state recovered from {@link RaftStore}. The local endpoint and the member list are taken from the
         * restored state.
         *
         * @param restoredState
         *            the restored Raft state which will be used while creating the Raft node
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setRestoredState(@Nonnull RestoredRaftState restoredState);

        /**
         * Sets the Raft config. If not set, {@link RaftConfig#DEFAULT_RAFT_CONFIG} is used.
         *
         * @param config
         *            the config object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setConfig(@Nonnull RaftConfig config);

        /**
         * Sets the Raft node executor. If not set, {@link DefaultRaftNodeExecutor} is used.
         *
         * @param executor
         *            the executor object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setExecutor(@Nonnull RaftNodeExecutor executor);

        /**
         * Sets the transport object that will be used by the Raft node to send messages to the other members.
         *
         * @param transport
         *            the transport object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setTransport(@Nonnull Transport transport);

        /**
         * Sets the state machine object that will run committed operations.
         *
         * @param stateMachine
         *            the state machine object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setStateMachine(@Nonnull StateMachine stateMachine);

        /**
         * Sets the Raft store. If not set, {@link NopRaftStore} is used.
         *
         * @param store
         *            the Raft state object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setStore(@Nonnull RaftStore store);

        /**
         * Sets the Raft model factory. If not set, {@link DefaultRaftModelFactory} is used.
         *
         * @param modelFactory
         *            the model factory object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setModelFactory(@Nonnull RaftModelFactory modelFactory);

        /**
         * Sets the Raft node report listener object. Optional.
         *
         * @param listener
         *            the Raft node report listener object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setRaftNodeReportListener(@Nonnull RaftNodeReportListener listener);

        /**
         * Sets the random object used to randomize election timeouts. Useful for testing.
         *
         * @param random
         *            the random object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setRandom(@Nonnull Random random);

        /**
         * Sets the clock used for heartbeat timestamps. Useful for testing.
         *
         * @param clock
         *            the clock object to create the Raft node with
         *
         * @return the builder object for fluent calls
         */
        @Nonnull
        RaftNodeBuilder setClock(@Nonnull Clock clock);

        /**
         * Builds and returns the Raft node instance with the given settings.
         *
         * @return the built Raft node instance
         */
        @Nonnull
        RaftNode build();

    }

}

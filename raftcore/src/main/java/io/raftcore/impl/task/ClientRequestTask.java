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


package io.raftcore.impl.task;

import io.raftcore.RaftNodeStatus;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.exception.RaftException;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.state.RaftState;
import io.raftcore.impl.util.OrderedFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static io.raftcore.RaftNodeStatus.INITIAL;
import static io.raftcore.RaftNodeStatus.isTerminal;

/**
 * Base class of the tasks created for the operations and queries of the clients. Each task owns the future returned to
 * the client and completes it exactly once.
 * <p>
 * A Raft node that is not started yet fails the future with
 * {@link io.raftcore.exception.CannotReplicateException}. A terminated one fails it with
 * {@link io.raftcore.exception.NotLeaderException}.
 */
abstract class ClientRequestTask
        implements Runnable {

    protected final RaftNodeImpl raftNode;
    protected final RaftState state;
    protected final Object operation;
    protected final OrderedFuture<Object> future;

    ClientRequestTask(RaftNodeImpl raftNode, Object operation, OrderedFuture<Object> future) {
        this.raftNode = raftNode;
        this.state = raftNode.state();
        this.operation = operation;
        this.future = future;
    }

    @Override
    public final void run() {
        RaftNodeStatus status = raftNode.getStatus();
        if (status == INITIAL || isTerminal(status)) {
            logger().debug("{} Won't run {}, since Raft node is {}.", raftNode.localEndpointStr(), operation, status);
            future.fail(status == INITIAL ? raftNode.newCannotReplicateException() : raftNode.newNotLeaderException());
            return;
        }

        try {
            RaftException rejection = validate();
            if (rejection != null) {
                future.fail(rejection);
            } else {
                execute();
            }
        } catch (PersistenceFailureException e) {
            future.fail(e);
            raftNode.terminateOnPersistenceFailure(e);
        } catch (Throwable t) {
            logger().error(raftNode.localEndpointStr() + " could not run " + operation, t);
            future.fail(new RaftException("Internal failure", raftNode.getLeaderEndpoint(), t));
        }
    }

    /**
     * Returns the exception to fail the future with if the request cannot be served by the local Raft node, or null.
     */
    @Nullable
    protected abstract RaftException validate();

    /**
     * Serves the request. Called only if {@link #validate()} returns null.
     */
    protected abstract void execute();

    private Logger logger() {
        return LoggerFactory.getLogger(getClass());
    }

}

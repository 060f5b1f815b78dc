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

import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNodeStatus;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.state.RaftState;
import io.raftcore.model.RaftModelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.raftcore.RaftNodeStatus.ACTIVE;

/**
 * A task that runs only while its Raft node is {@link RaftNodeStatus#ACTIVE}.
 * <p>
 * A {@link PersistenceFailureException} thrown by {@link #doRun()} terminates the Raft node. Any other failure is logged
 * and the Raft node keeps running.
 */
public abstract class RaftNodeStatusAwareTask
        implements Runnable {

    protected final RaftNodeImpl node;
    protected final RaftState state;
    protected final RaftModelFactory modelFactory;
    private final Logger logger;

    protected RaftNodeStatusAwareTask(RaftNodeImpl node) {
        this.node = node;
        this.state = node.state();
        this.modelFactory = node.getModelFactory();
        this.logger = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final void run() {
        RaftNodeStatus status = node.getStatus();
        if (status != ACTIVE) {
            logger.debug("{} Skipped {} in status {}", localEndpointStr(), getClass().getSimpleName(), status);
            return;
        }

        try {
            doRun();
        } catch (PersistenceFailureException e) {
            node.terminateOnPersistenceFailure(e);
        } catch (Throwable t) {
            logger.error(localEndpointStr() + " " + getClass().getSimpleName() + " failed", t);
        }
    }

    protected abstract void doRun();

    protected final RaftEndpoint localEndpoint() {
        return node.getLocalEndpoint();
    }

    protected final String localEndpointStr() {
        return node.localEndpointStr();
    }

}

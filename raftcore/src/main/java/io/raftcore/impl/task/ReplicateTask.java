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

import io.raftcore.RaftNode;
import io.raftcore.exception.RaftException;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.log.RaftLog;
import io.raftcore.impl.util.OrderedFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.raftcore.RaftRole.LEADER;

/**
 * Appends an operation to the log of the leader and starts replicating it.
 * <p>
 * Scheduled by {@link RaftNode#replicate(Object)}. Followers and candidates reject the operation with
 * {@link io.raftcore.exception.NotLeaderException}. The leader rejects it with
 * {@link io.raftcore.exception.CannotReplicateException} when too many entries are waiting to be committed.
 */
public final class ReplicateTask
        extends ClientRequestTask {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicateTask.class);

    public ReplicateTask(RaftNodeImpl raftNode, Object operation, OrderedFuture<Object> future) {
        super(raftNode, operation, future);
    }

    @Override
    protected RaftException validate() {
        if (state.role() != LEADER) {
            return raftNode.newNotLeaderException();
        }

        return raftNode.canReplicateNewOperation() ? null : raftNode.newCannotReplicateException();
    }

    @Override
    protected void execute() {
        RaftLog log = state.log();
        long index = log.lastLogIndex() + 1;
        LOGGER.debug("{} Appending {} at log index: {} in term: {}", raftNode.localEndpointStr(), operation, index,
                state.term());

        log.appendEntry(raftNode.getModelFactory()
                                .createLogEntryBuilder()
                                .setTerm(state.term())
                                .setIndex(index)
                                .setOperation(operation)
                                .build());
        state.registerFuture(index, future);
        raftNode.broadcastAppendEntriesRequest();
    }

}

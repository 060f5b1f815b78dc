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

import io.raftcore.QueryPolicy;
import io.raftcore.RaftNode;
import io.raftcore.exception.RaftException;
import io.raftcore.impl.RaftNodeImpl;
import io.raftcore.impl.state.QueryState;
import io.raftcore.impl.util.OrderedFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.raftcore.QueryPolicy.EVENTUAL_CONSISTENCY;
import static io.raftcore.QueryPolicy.LINEARIZABLE;
import static io.raftcore.RaftRole.LEADER;

/**
 * Runs a query on the state machine without appending it to the log.
 * <p>
 * Scheduled by {@link RaftNode#query(Object, QueryPolicy, long)}. A {@link QueryPolicy#LINEARIZABLE} query of a
 * multi-member group waits in the {@link QueryState} of the leader until the majority acks a heartbeat round started
 * after the query arrived.
 */
public final class QueryTask
        extends ClientRequestTask {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryTask.class);

    private final QueryPolicy queryPolicy;
    private final long minCommitIndex;

    public QueryTask(RaftNodeImpl raftNode, Object operation, QueryPolicy queryPolicy, long minCommitIndex,
                     OrderedFuture<Object> future) {
        super(raftNode, operation, future);
        this.queryPolicy = queryPolicy;
        this.minCommitIndex = minCommitIndex;
    }

    @Override
    protected RaftException validate() {
        if (queryPolicy != EVENTUAL_CONSISTENCY) {
            if (state.role() != LEADER) {
                return raftNode.newNotLeaderException();
            } else if (queryPolicy == LINEARIZABLE && !raftNode.canQueryLinearizable()) {
                return raftNode.newCannotReplicateException();
            } else if (queryPolicy != LINEARIZABLE && raftNode.demoteToFollowerIfQuorumHeartbeatTimeoutElapsed()) {
                // the lease is over, another leader may exist
                return raftNode.newNotLeaderException();
            }
        }

        return state.commitIndex() < minCommitIndex ? raftNode.newLaggingCommitIndexException(minCommitIndex) : null;
    }

    @Override
    protected void execute() {
        if (queryPolicy != LINEARIZABLE || state.majority() == 1) {
            LOGGER.debug("{} Querying {} with {} in term: {}", raftNode.localEndpointStr(), operation, queryPolicy,
                    state.term());
            raftNode.runQuery(operation, future);
            return;
        }

        QueryState queryState = state.leaderState().queryState();
        LOGGER.debug("{} Adding query at commit index: {}, query sequence number: {}", raftNode.localEndpointStr(),
                state.commitIndex(), queryState.querySequenceNumber());
        if (queryState.addQuery(state.commitIndex(), operation, future)) {
            raftNode.broadcastAppendEntriesRequest();
        }
    }

}

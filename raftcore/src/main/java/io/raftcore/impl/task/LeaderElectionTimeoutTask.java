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

import io.raftcore.impl.RaftNodeImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.raftcore.RaftRole.CANDIDATE;

/**
 * Scheduled when the local Raft node becomes a candidate. Starts a new election in the next term if the candidate is
 * still waiting for votes of the term it was scheduled for.
 */
public final class LeaderElectionTimeoutTask
        extends RaftNodeStatusAwareTask {

    private static final Logger LOGGER = LoggerFactory.getLogger(LeaderElectionTimeoutTask.class);

    private final int term;

    public LeaderElectionTimeoutTask(RaftNodeImpl raftNode, int term) {
        super(raftNode);
        this.term = term;
    }

    @Override
    protected void doRun() {
        if (state.role() != CANDIDATE || state.term() != term) {
            return;
        }

        LOGGER.warn("{} Leader election for term: {} has timed out!", localEndpointStr(), term);
        node.toCandidate();
    }

}

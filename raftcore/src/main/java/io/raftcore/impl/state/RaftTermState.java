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

package io.raftcore.impl.state;

import io.raftcore.RaftEndpoint;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.model.persistence.RaftTermPersistentState.RaftTermPersistentStateBuilder;
import io.raftcore.report.RaftTerm;

import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;

/**
 * Immutable view of a Raft node's state in a term. Every transition creates a new instance, so a reference published to
 * other threads never changes under them.
 */
public final class RaftTermState
        implements RaftTerm {

    public static final RaftTermState INITIAL = new RaftTermState(0, null, null);

    /**
     * Highest term this node has seen.
     * <p>
     * Initialized to 0 on first boot, increases monotonically.
     * <p>
     * [PERSISTENT]
     */
    private final int term;
    /**
     * Latest known leader endpoint (or null if not known).
     */
    private final RaftEndpoint leaderEndpoint;
    /**
     * Endpoint that received vote in the current term, or null if none.
     * <p>
     * [PERSISTENT]
     */
    private final RaftEndpoint votedEndpoint;

    private RaftTermState(int term, RaftEndpoint leaderEndpoint, RaftEndpoint votedEndpoint) {
        this.term = term;
        this.leaderEndpoint = leaderEndpoint;
        this.votedEndpoint = votedEndpoint;
    }

    public static RaftTermState restore(@Nonnull RaftTermPersistentState persistentState) {
        return new RaftTermState(persistentState.getTerm(), null, persistentState.getVotedFor());
    }

    @Override
    public int getTerm() {
        return term;
    }

    @Override
    public RaftEndpoint getLeaderEndpoint() {
        return leaderEndpoint;
    }

    @Override
    public RaftEndpoint getVotedEndpoint() {
        return votedEndpoint;
    }

    /**
     * Moves to the given term. The known leader is reset. The vote is kept only if the term does not change.
     */
    public RaftTermState switchTo(int newTerm) {
        if (newTerm < term) {
            throw new IllegalArgumentException("New term: " + newTerm + " is smaller than the current term: " + term);
        }

        return new RaftTermState(newTerm, null, newTerm > term ? null : votedEndpoint);
    }

    public RaftTermState grantVote(int term, RaftEndpoint votedEndpoint) {
        requireNonNull(votedEndpoint);
        if (this.term != term) {
            throw new IllegalStateException(
                    "Current term: " + this.term + ", voted term: " + term + ", voted for: " + votedEndpoint);
        } else if (this.votedEndpoint != null) {
            throw new IllegalStateException("Current term: " + this.term + ", already voted for: " + this.votedEndpoint
                    + ", new vote to: " + votedEndpoint);
        }

        return new RaftTermState(this.term, this.leaderEndpoint, votedEndpoint);
    }

    public RaftTermState withLeader(RaftEndpoint leaderEndpoint) {
        assert this.leaderEndpoint == null || leaderEndpoint == null || this.leaderEndpoint.equals(leaderEndpoint)
                : "current term: " + this.term + " current leader: " + this.leaderEndpoint + " new leader: "
                + leaderEndpoint;
        return new RaftTermState(this.term, leaderEndpoint, this.votedEndpoint);
    }

    public RaftTermPersistentStateBuilder populate(@Nonnull RaftTermPersistentStateBuilder builder) {
        return builder.setTerm(term).setVotedFor(votedEndpoint);
    }

    @Override
    public String toString() {
        return "RaftTerm{" + "term=" + term + ", leaderEndpoint=" + leaderEndpoint + ", votedEndpoint=" + votedEndpoint
               + '}';
    }

}

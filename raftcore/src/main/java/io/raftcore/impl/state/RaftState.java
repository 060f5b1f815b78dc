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
import io.raftcore.RaftRole;
import io.raftcore.exception.IndeterminateStateException;
import io.raftcore.exception.NotLeaderException;
import io.raftcore.exception.PersistenceFailureException;
import io.raftcore.exception.RaftException;
import io.raftcore.impl.log.RaftLog;
import io.raftcore.impl.util.OrderedFuture;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.persistence.RaftStore;
import io.raftcore.persistence.RestoredRaftState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static io.raftcore.RaftRole.CANDIDATE;
import static io.raftcore.RaftRole.FOLLOWER;
import static io.raftcore.RaftRole.LEADER;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * State maintained by a Raft node.
 * <p>
 * Only the Raft node thread mutates this object. {@link #role()} and {@link #termState()} are volatile so that they can
 * be read by other threads for reporting.
 */
public final class RaftState {

    private static final Logger LOGGER = LoggerFactory.getLogger(RaftState.class);

    private final Object groupId;
    private final RaftEndpoint localEndpoint;
    // fixed for the lifetime of the group, contains the local endpoint
    private final List<RaftEndpoint> members;
    private final List<RaftEndpoint> remoteMembers;
    private final RaftStore store;
    private final RaftLog log;
    private final RaftModelFactory modelFactory;
    // log index -> future of the operation appended there while this node was the leader
    private final Map<Long, OrderedFuture<Object>> futures = new HashMap<>();

    private volatile RaftTermState termState;
    private volatile RaftRole role = FOLLOWER;

    // volatile state, both are learnt again after a restart
    private long commitIndex;
    private long lastApplied;

    // null unless this node is in the matching role or runs a pre-vote
    private LeaderState leaderState;
    private CandidateState preCandidateState;
    private CandidateState candidateState;

    private RaftState(Object groupId, RaftEndpoint localEndpoint, Collection<RaftEndpoint> members,
                      RaftTermState termState, RaftLog log, RaftStore store, RaftModelFactory modelFactory) {
        this.groupId = requireNonNull(groupId);
        this.localEndpoint = requireNonNull(localEndpoint);
        this.members = unmodifiableList(new ArrayList<>(new LinkedHashSet<>(requireNonNull(members))));
        if (!this.members.contains(localEndpoint)) {
            throw new IllegalArgumentException(localEndpoint + " is not a member of " + this.members);
        }

        List<RaftEndpoint> remoteMembers = new ArrayList<>(this.members);
        remoteMembers.remove(localEndpoint);
        this.remoteMembers = unmodifiableList(remoteMembers);
        this.termState = requireNonNull(termState);
        this.log = requireNonNull(log);
        this.store = requireNonNull(store);
        this.modelFactory = requireNonNull(modelFactory);
    }

    public static RaftState create(Object groupId, RaftEndpoint localEndpoint, Collection<RaftEndpoint> members,
                                   RaftStore store, RaftModelFactory modelFactory) {
        return new RaftState(groupId, localEndpoint, members, RaftTermState.INITIAL, RaftLog.create(store), store,
                modelFactory);
    }

    /**
     * Creates a Raft state from the state recovered from the stable storage. The commit index and the last applied index
     * start from 0 because they are not persisted. They are learnt again from the leader.
     */
    public static RaftState restore(Object groupId, RestoredRaftState restoredState, RaftStore store,
                                    RaftModelFactory modelFactory) {
        RaftTermState termState = restoredState.getTermPersistentState() != null
                                  ? RaftTermState.restore(restoredState.getTermPersistentState())
                                  : RaftTermState.INITIAL;
        return new RaftState(groupId, restoredState.getLocalEndpoint(), restoredState.getInitialGroupMembers(), termState,
                RaftLog.restore(restoredState.getLogEntries(), store), store, modelFactory);
    }

    public Object groupId() {
        return groupId;
    }

    public RaftEndpoint localEndpoint() {
        return localEndpoint;
    }

    public List<RaftEndpoint> members() {
        return members;
    }

    public List<RaftEndpoint> remoteMembers() {
        return remoteMembers;
    }

    public int memberCount() {
        return members.size();
    }

    public RaftStore store() {
        return store;
    }

    public RaftLog log() {
        return log;
    }

    public RaftRole role() {
        return role;
    }

    public RaftTermState termState() {
        return termState;
    }

    /**
     * Returns the latest term this Raft node has seen.
     */
    public int term() {
        return termState.getTerm();
    }

    /**
     * Returns the known leader endpoint in the current term, or null.
     */
    public RaftEndpoint leader() {
        return termState.getLeaderEndpoint();
    }

    public RaftEndpoint votedEndpoint() {
        return termState.getVotedEndpoint();
    }

    public long commitIndex() {
        return commitIndex;
    }

    public void commitIndex(long index) {
        if (index < commitIndex) {
            throw new IllegalArgumentException("Commit index: " + index + " cannot be smaller than " + commitIndex);
        }

        commitIndex = index;
    }

    public long lastApplied() {
        return lastApplied;
    }

    public void lastApplied(long index) {
        if (index != lastApplied + 1) {
            throw new IllegalArgumentException("Cannot apply log index: " + index + ", last applied: " + lastApplied);
        }

        lastApplied = index;
    }

    public LeaderState leaderState() {
        return leaderState;
    }

    public CandidateState candidateState() {
        return candidateState;
    }

    public CandidateState preCandidateState() {
        return preCandidateState;
    }

    /**
     * Persists the local endpoint and the initial member list to the Raft store.
     *
     * @throws IOException
     *             if an IO error occurs inside the store
     */
    public void persistInitialState() throws IOException {
        store.persistAndFlushLocalEndpoint(localEndpoint);
        store.persistAndFlushInitialGroupMembers(members);
    }

    /**
     * Switches this Raft node to the follower role in the given term. Clears leader and (pre)candidate states. Pending
     * futures of the entries that are not committed yet are failed with {@link IndeterminateStateException} since those
     * entries may or may not be committed by the next leader.
     */
    public void toFollower(int term) {
        switchTermState(termState.switchTo(term));
        LeaderState formerLeaderState = leaderState;
        clearRoleStates();
        role = FOLLOWER;
        if (formerLeaderState != null) {
            // after the switch so that the exception carries the updated leader
            formerLeaderState.queryState().fail(new NotLeaderException(localEndpoint, leader()));
        }

        invalidateFuturesFrom(commitIndex + 1, new IndeterminateStateException(leader()));
    }

    /**
     * Switches this Raft node to the candidate role. Increments the term and votes for itself.
     */
    public void toCandidate() {
        int nextTerm = term() + 1;
        switchTermState(termState.switchTo(nextTerm).grantVote(nextTerm, localEndpoint));
        clearRoleStates();
        role = CANDIDATE;
        candidateState = newSelfVotedCandidateState();
    }

    /**
     * Persists a vote for the given endpoint in the given term. The vote is visible only after it is flushed.
     */
    public void grantVote(int term, RaftEndpoint member) {
        switchTermState(termState.grantVote(term, member));
    }

    /**
     * Switches this Raft node to the leader role and initializes the leader state for the remote members.
     */
    public void toLeader(long currentTimeMillis) {
        if (role != CANDIDATE) {
            throw new IllegalStateException("Cannot become " + LEADER + " from " + role);
        }

        leader(localEndpoint);
        clearRoleStates();
        role = LEADER;
        leaderState = new LeaderState(remoteMembers, log.lastLogIndex(), currentTimeMillis);
    }

    /**
     * Updates the known leader to the given endpoint. An ongoing pre-voting round is abandoned once a leader is known.
     */
    public void leader(RaftEndpoint endpoint) {
        termState = termState.withLeader(endpoint);
        if (endpoint != null) {
            preCandidateState = null;
        }
    }

    /**
     * Returns the number of votes a candidate needs to win the election. It is also the number of nodes that must store a
     * log entry before the leader commits it.
     */
    public int majority() {
        return members.size() / 2 + 1;
    }

    public boolean isKnownMember(RaftEndpoint endpoint) {
        return members.contains(endpoint);
    }

    /**
     * Initializes the pre-candidate state for pre-voting and grants a vote for the local endpoint.
     */
    public void initPreCandidateState() {
        preCandidateState = newSelfVotedCandidateState();
    }

    private CandidateState newSelfVotedCandidateState() {
        CandidateState candidate = new CandidateState(majority());
        candidate.grantVote(localEndpoint);
        return candidate;
    }

    private void clearRoleStates() {
        leaderState = null;
        candidateState = null;
        preCandidateState = null;
    }

    /**
     * Flushes the given term state to the store and then makes it the current one.
     *
     * @throws PersistenceFailureException
     *             if the store fails, in which case the current term state is kept
     */
    private void switchTermState(RaftTermState next) {
        try {
            store.persistAndFlushTerm(next.populate(modelFactory.createRaftTermPersistentStateBuilder()).build());
        } catch (IOException e) {
            throw new PersistenceFailureException("Could not persist " + next, e);
        }

        termState = next;
    }

    /**
     * Registers the future of the operation appended at the given log index.
     */
    public void registerFuture(long logIndex, OrderedFuture<Object> future) {
        OrderedFuture<Object> previous = futures.put(logIndex, future);
        assert previous == null : localEndpoint.getId() + " already has a future at log index: " + logIndex;
    }

    /**
     * If there is a future object at the given log index, it is completed with the given result. Future objects are
     * registered only on the leader. A {@link Throwable} result fails the future.
     */
    public void completeFuture(long logIndex, Object result) {
        OrderedFuture<Object> future = futures.remove(logIndex);
        if (future == null) {
            return;
        } else if (result instanceof Throwable) {
            future.fail((Throwable) result);
        } else {
            future.complete(logIndex, result);
        }
    }

    /**
     * Fails futures registered at or after the given log index with the given exception.
     */
    public void invalidateFuturesFrom(long startIndexInclusive, RaftException e) {
        int sizeBefore = futures.size();
        futures.entrySet().removeIf(entry -> {
            if (entry.getKey() < startIndexInclusive) {
                return false;
            }

            entry.getValue().fail(e);
            return true;
        });

        int invalidated = sizeBefore - futures.size();
        if (invalidated > 0) {
            LOGGER.warn("{} Failed {} pending futures from log index: {} with {}", localEndpoint.getId(), invalidated,
                    startIndexInclusive, e.getClass().getSimpleName());
        }
    }

    /**
     * Fails all registered futures and waiting queries with the given exception. Called when the Raft node terminates.
     */
    public void invalidateAllFutures(RaftException e) {
        invalidateFuturesFrom(0, e);
        if (leaderState != null) {
            leaderState.queryState().fail(e);
        }
    }

    public int pendingFutureCount() {
        return futures.size();
    }

}

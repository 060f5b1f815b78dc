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
import io.raftcore.impl.util.OrderedFuture;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;

/**
 * Linearizable queries waiting on the leader for a round of heartbeats, as described in Section 6.4 of the Raft
 * dissertation.
 * <p>
 * The first query of a round fixes the read index to the current commit index and opens the round by incrementing the
 * query sequence number, which is sent with the following append entries requests. Followers echo it in their responses.
 * The queries of a round run once the majority, counting the leader, has echoed it and the read index has been applied.
 */
public final class QueryState {

    private final List<Entry<Object, OrderedFuture<Object>>> queries = new ArrayList<>();
    private final Set<RaftEndpoint> ackedFollowers = new HashSet<>();
    private long readIndex;
    private long querySequenceNumber;

    /**
     * @return true if a new round is opened for the given query
     */
    public boolean addQuery(long commitIndex, Object query, OrderedFuture<Object> resultFuture) {
        if (commitIndex < readIndex) {
            throw new IllegalArgumentException("Query: " + query + " cannot be added at commit index: " + commitIndex
                    + " to " + this);
        }

        readIndex = commitIndex;
        queries.add(new SimpleImmutableEntry<>(query, resultFuture));
        if (queries.size() > 1) {
            return false;
        }

        querySequenceNumber++;
        return true;
    }

    /**
     * Counts the ack of the given follower if it belongs to the open round.
     *
     * @return true if the ack is counted for the first time
     */
    public boolean tryAck(long ackedSequenceNumber, RaftEndpoint follower) {
        if (queries.isEmpty() || ackedSequenceNumber < querySequenceNumber) {
            return false;
        } else if (ackedSequenceNumber > querySequenceNumber) {
            throw new IllegalStateException("Follower: " + follower + " acked query sequence number: "
                    + ackedSequenceNumber + " which is not opened yet. " + this);
        }

        return ackedFollowers.add(follower);
    }

    public long querySequenceNumber() {
        return querySequenceNumber;
    }

    public long readIndex() {
        return readIndex;
    }

    public boolean isQuorumAckReceived(long commitIndex, int quorumSize) {
        if (commitIndex < readIndex) {
            throw new IllegalStateException("Commit index: " + commitIndex + " is behind the read index of " + this);
        }

        return !queries.isEmpty() && votes() >= quorumSize;
    }

    /**
     * Returns true if the open round still needs an ack and the given follower has not sent one yet.
     */
    public boolean isAckNeeded(RaftEndpoint follower, int quorumSize) {
        return !queries.isEmpty() && votes() < quorumSize && !ackedFollowers.contains(follower);
    }

    private int votes() {
        return ackedFollowers.size() + 1;
    }

    public int queryCount() {
        return queries.size();
    }

    public Collection<Entry<Object, OrderedFuture<Object>>> queries() {
        return queries;
    }

    /**
     * Fails the waiting queries and closes the round.
     */
    public void fail(Throwable t) {
        for (Entry<Object, OrderedFuture<Object>> query : queries) {
            query.getValue().fail(t);
        }

        reset();
    }

    /**
     * Drops the waiting queries and the acks. The query sequence number is kept so the next round gets a new one.
     */
    public void reset() {
        queries.clear();
        ackedFollowers.clear();
    }

    @Override
    public String toString() {
        return "QueryState{querySequenceNumber=" + querySequenceNumber + ", readIndex=" + readIndex + ", queryCount="
                + queries.size() + ", ackedFollowers=" + ackedFollowers + '}';
    }

}

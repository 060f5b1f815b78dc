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

package io.raftcore.transport;

import io.raftcore.RaftEndpoint;
import io.raftcore.lifecycle.RaftNodeLifecycleAware;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.message.RaftMessage;

import javax.annotation.Nonnull;

/**
 * Used for communicating Raft nodes with each other.
 * <p>
 * Transport implementations must be non-blocking. A Raft node must be able to send a Raft message to another Raft node and
 * continue without waiting for a response. Responses arrive later as new messages passed to the target's
 * {@code RaftNode#handle(RaftMessage)} method.
 * <p>
 * Transport implementations must be able to serialize {@link RaftMessage} objects created by {@link RaftModelFactory}.
 * <p>
 * A {@link Transport} implementation can implement {@link RaftNodeLifecycleAware} to perform initialization and clean up
 * work during Raft node startup and termination.
 */
public interface Transport {

    /**
     * Sends the given {@link RaftMessage} object to the given endpoint. This method must not block the caller Raft node and
     * must not throw an exception. Raft messages are handled idempotently and the lost ones are re-sent with the next
     * heartbeat or election round.
     *
     * @param target
     *            the target endpoint to send the Raft message
     * @param message
     *            the Raft message object to be sent
     */
    void send(@Nonnull RaftEndpoint target, @Nonnull RaftMessage message);

}

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

package io.raftcore.impl.local;

import io.raftcore.RaftEndpoint;
import io.raftcore.RaftNode;
import io.raftcore.model.message.RaftMessage;
import io.raftcore.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.raftcore.RaftNodeStatus.isTerminal;
import static java.util.Objects.requireNonNull;

/**
 * Hands Raft messages to the Raft nodes in the same JVM by calling {@link RaftNode#handle(RaftMessage)}. A message to a
 * peer that is not connected, or that the {@link Firewall} drops, is lost silently.
 */
public class LocalTransport
        implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalTransport.class);

    private final RaftEndpoint localEndpoint;
    private final Map<RaftEndpoint, RaftNode> peers = new ConcurrentHashMap<>();
    private final Firewall firewall = new Firewall();

    public LocalTransport(RaftEndpoint localEndpoint) {
        this.localEndpoint = requireNonNull(localEndpoint);
    }

    @Override
    public void send(@Nonnull RaftEndpoint target, @Nonnull RaftMessage message) {
        if (target.equals(localEndpoint)) {
            throw new IllegalArgumentException(localEndpoint.getId() + " tried to send " + message + " to itself");
        }

        RaftNode peer = peers.get(target);
        if (peer == null || firewall.shouldDrop(target, message)) {
            return;
        }

        RaftMessage delivered = firewall.tryAlterMessage(target, message);
        if (delivered != null) {
            peer.handle(delivered);
        } else {
            LOGGER.error("{} altered {} to null on the way to {}", localEndpoint.getId(), message, target.getId());
        }
    }

    /**
     * Connects this transport to the given peer. A terminated Raft node of the same endpoint is replaced.
     */
    public void discoverNode(RaftNode node) {
        RaftEndpoint endpoint = node.getLocalEndpoint();
        if (endpoint.equals(localEndpoint)) {
            throw new IllegalArgumentException(localEndpoint.getId() + " cannot connect to itself");
        }

        peers.merge(endpoint, node, (current, candidate) -> {
            if (current != candidate && !isTerminal(current.getStatus())) {
                throw new IllegalArgumentException(localEndpoint.getId() + " is already connected to " + endpoint.getId());
            }

            return candidate;
        });
    }

    public void undiscoverNode(RaftNode node) {
        peers.remove(node.getLocalEndpoint(), node);
    }

    public Firewall getFirewall() {
        return firewall;
    }

}

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

package io.raftcore.model.message;

import io.raftcore.RaftEndpoint;
import io.raftcore.model.RaftModel;

import javax.annotation.Nonnull;

/**
 * Implemented by request and response classes of the Raft RPCs. Every message carries the group id, the sender endpoint
 * and the term known by the sender.
 */
public interface RaftMessage
        extends RaftModel {

    Object getGroupId();

    @Nonnull
    RaftEndpoint getSender();

    int getTerm();

    /**
     * The base builder interface for Raft messages.
     *
     * @param <T>
     *            the message type to build
     */
    interface RaftMessageBuilder<T extends RaftMessage> {

        @Nonnull
        T build();

    }

}

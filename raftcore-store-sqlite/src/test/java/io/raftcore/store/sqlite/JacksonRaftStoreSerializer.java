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

package io.raftcore.store.sqlite;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.raftcore.RaftEndpoint;
import io.raftcore.model.RaftModelFactory;
import io.raftcore.model.impl.DefaultRaftModelFactory;
import io.raftcore.model.log.LogEntry;
import io.raftcore.model.persistence.RaftTermPersistentState;
import io.raftcore.persistence.RaftStoreSerializer;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serializes the default model with Jackson. Operations of log entries are strings.
 */
enum JacksonRaftStoreSerializer
        implements RaftStoreSerializer {

    INSTANCE;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final RaftModelFactory MODEL_FACTORY = new DefaultRaftModelFactory();

    @Override
    public Serializer<RaftEndpoint> raftEndpointSerializer() {
        return new JacksonSerializer<RaftEndpoint>() {
            @Override
            JsonNode toJson(RaftEndpoint endpoint) {
                return OBJECT_MAPPER.getNodeFactory().textNode((String) endpoint.getId());
            }

            @Override
            RaftEndpoint fromJson(JsonNode json) {
                return TestRaftEndpoint.of(json.asText());
            }
        };
    }

    @Override
    public Serializer<LogEntry> logEntrySerializer() {
        return new JacksonSerializer<LogEntry>() {
            @Override
            JsonNode toJson(LogEntry entry) {
                ObjectNode node = OBJECT_MAPPER.createObjectNode();
                node.put("index", entry.getIndex());
                node.put("term", entry.getTerm());
                node.put("operation", String.valueOf(entry.getOperation()));
                return node;
            }

            @Override
            LogEntry fromJson(JsonNode json) {
                return MODEL_FACTORY.createLogEntryBuilder()
                                    .setIndex(json.get("index").asLong())
                                    .setTerm(json.get("term").asInt())
                                    .setOperation(json.get("operation").asText())
                                    .build();
            }
        };
    }

    @Override
    public Serializer<RaftTermPersistentState> raftTermPersistentStateSerializer() {
        return new JacksonSerializer<RaftTermPersistentState>() {
            @Override
            JsonNode toJson(RaftTermPersistentState state) {
                ObjectNode node = OBJECT_MAPPER.createObjectNode();
                node.put("term", state.getTerm());
                if (state.getVotedFor() != null) {
                    node.put("votedFor", (String) state.getVotedFor().getId());
                }

                return node;
            }

            @Override
            RaftTermPersistentState fromJson(JsonNode json) {
                JsonNode votedFor = json.get("votedFor");
                return MODEL_FACTORY.createRaftTermPersistentStateBuilder()
                                    .setTerm(json.get("term").asInt())
                                    .setVotedFor(votedFor != null ? TestRaftEndpoint.of(votedFor.asText()) : null)
                                    .build();
            }
        };
    }

    private abstract static class JacksonSerializer<T>
            implements Serializer<T> {

        abstract JsonNode toJson(T element);

        abstract T fromJson(JsonNode json);

        @Nonnull
        @Override
        public byte[] serialize(@Nonnull T element) {
            try {
                return OBJECT_MAPPER.writeValueAsBytes(toJson(element));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Nonnull
        @Override
        public T deserialize(@Nonnull byte[] element) {
            try {
                return fromJson(OBJECT_MAPPER.readTree(element));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

    }

}

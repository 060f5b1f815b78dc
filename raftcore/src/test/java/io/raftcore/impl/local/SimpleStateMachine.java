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

import io.raftcore.statemachine.StateMachine;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the committed values along with their commit indices so that tests can assert on them.
 * <p>
 * Thread safe. Test threads read the collected values while the Raft node thread applies new ones.
 */
public class SimpleStateMachine
        implements StateMachine {

    private final Map<Long, Object> values = new LinkedHashMap<>();
    private final boolean newTermOperationEnabled;
    private Object lastValue;

    public SimpleStateMachine() {
        this(true);
    }

    public SimpleStateMachine(boolean newTermOperationEnabled) {
        this.newTermOperationEnabled = newTermOperationEnabled;
    }

    public static Object applyValue(Object value) {
        return new Apply(value);
    }

    public static Object queryLastValue() {
        return new QueryLast();
    }

    public static Object queryAllValues() {
        return new QueryAll();
    }

    /**
     * Returns an operation that fails with {@link IllegalStateException} when it is executed.
     */
    public static Object failingOperation() {
        return new Fail();
    }

    public synchronized Object get(long commitIndex) {
        return values.get(commitIndex);
    }

    public synchronized int size() {
        return values.size();
    }

    /**
     * Returns the committed values sorted by their commit indices.
     */
    public synchronized List<Object> valueList() {
        return new ArrayList<>(values.values());
    }

    public synchronized List<Long> commitIndices() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public synchronized Object runOperation(long commitIndex, @Nonnull Object operation) {
        if (operation instanceof Apply) {
            Object value = ((Apply) operation).value;
            if (values.containsKey(commitIndex)) {
                throw new AssertionError("Cannot apply " + value + " since commit index: " + commitIndex
                        + " already contains: " + values.get(commitIndex));
            }

            values.put(commitIndex, value);
            lastValue = value;
            return value;
        } else if (operation instanceof QueryLast) {
            return lastValue;
        } else if (operation instanceof QueryAll) {
            return valueList();
        } else if (operation instanceof NewTermOperation) {
            return null;
        } else if (operation instanceof Fail) {
            throw new IllegalStateException("Failed at commit index: " + commitIndex);
        }

        throw new IllegalArgumentException("Invalid operation: " + operation + " at commit index: " + commitIndex);
    }

    @Nullable
    @Override
    public Object getNewTermOperation() {
        return newTermOperationEnabled ? new NewTermOperation() : null;
    }

    private static final class Apply {
        final Object value;

        Apply(Object value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return "Apply{value=" + value + '}';
        }
    }

    private static final class QueryLast {
        @Override
        public String toString() {
            return "QueryLast{}";
        }
    }

    private static final class QueryAll {
        @Override
        public String toString() {
            return "QueryAll{}";
        }
    }

    private static final class Fail {
        @Override
        public String toString() {
            return "Fail{}";
        }
    }

    private static final class NewTermOperation {
        @Override
        public String toString() {
            return "NewTermOperation{}";
        }
    }

}

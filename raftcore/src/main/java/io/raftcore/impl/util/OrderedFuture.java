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

package io.raftcore.impl.util;

import io.raftcore.Ordered;
import io.raftcore.RaftNode;

import java.util.concurrent.CompletableFuture;

/**
 * Implements {@link CompletableFuture} and {@link Ordered} together, so that the return value and the result of a
 * {@link RaftNode} API call is realized with a single object.
 * <p>
 * Completion methods are called only by the Raft node thread. Callers cannot complete or cancel the future.
 *
 * @param <T>
 *            type of the result
 */
public class OrderedFuture<T>
        extends CompletableFuture<Ordered<T>>
        implements Ordered<T> {

    private static final String EXTERNAL_COMPLETION_ERROR = "This future cannot be completed from outside of RaftNode";

    private long commitIndex;
    private T result;

    public final void completeNull(long commitIndex) {
        complete(commitIndex, null);
    }

    public final void complete(long commitIndex, T result) {
        assert commitIndex >= 0;

        if (isDone()) {
            throw new IllegalStateException("Cannot complete already completed future! new commit index: " + commitIndex
                    + " result: " + result);
        }

        this.commitIndex = commitIndex;
        this.result = result;

        boolean completed = super.complete(this);
        assert completed;
    }

    public final void fail(Throwable throwable) {
        super.completeExceptionally(throwable);
    }

    @Override
    public long getCommitIndex() {
        return commitIndex;
    }

    @Override
    public T getResult() {
        return result;
    }

    @Override
    public boolean complete(Ordered<T> value) {
        throw new UnsupportedOperationException(EXTERNAL_COMPLETION_ERROR);
    }

    @Override
    public boolean completeExceptionally(Throwable throwable) {
        throw new UnsupportedOperationException(EXTERNAL_COMPLETION_ERROR);
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        throw new UnsupportedOperationException(EXTERNAL_COMPLETION_ERROR);
    }

    @Override
    public void obtrudeValue(Ordered<T> value) {
        throw new UnsupportedOperationException(EXTERNAL_COMPLETION_ERROR);
    }

    @Override
    public void obtrudeException(Throwable throwable) {
        throw new UnsupportedOperationException(EXTERNAL_COMPLETION_ERROR);
    }

    @Override
    public String toString() {
        return "OrderedFuture{" + "done=" + isDone() + ", commitIndex=" + commitIndex + ", result=" + result + '}';
    }

}

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

package io.raftcore.test.util;

import org.junit.Rule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Base class of the Raft tests. Logs start, success and failure of each test method with its duration.
 */
public class BaseTest {

    static final Logger LOGGER = LoggerFactory.getLogger("Test");

    @Rule
    public final TestWatcher testWatcher = new TestWatcher() {
        private long start;

        @Override
        protected void starting(Description description) {
            super.starting(description);
            LOGGER.info("- STARTED: {}.{}", description.getTestClass().getSimpleName(),
                    description.getMethodName());
            start = System.nanoTime();
        }

        @Override
        protected void succeeded(Description description) {
            super.succeeded(description);
            LOGGER.info("+ SUCCEEDED: {} IN {}", description.getMethodName(), elapsed());
        }

        @Override
        protected void failed(Throwable e, Description description) {
            super.failed(e, description);
            LOGGER.info("- FAILED: {} IN {}", description.getMethodName(), elapsed());
        }

        private String elapsed() {
            long nanos = System.nanoTime() - start;
            long millis = NANOSECONDS.toMillis(nanos);
            if (millis >= 1000) {
                return NANOSECONDS.toSeconds(nanos) + " secs";
            }

            return millis > 0 ? millis + " millis" : NANOSECONDS.toMicros(nanos) + " micros";
        }
    };

}

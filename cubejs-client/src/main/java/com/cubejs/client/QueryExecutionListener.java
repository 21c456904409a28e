/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cubejs.client;

import io.airlift.units.Duration;

/**
 * Receives progress notifications from a {@link QueryExecutor}. Callbacks run on the
 * thread that handled the response and must not block.
 */
public interface QueryExecutionListener
{
    QueryExecutionListener NO_OP = new QueryExecutionListener() {};

    /**
     * Called when a response did not finish the query and another request is scheduled.
     *
     * @param attempt number of requests answered so far
     * @param wait delay before the next request
     */
    default void retryScheduled(RetryReason reason, int attempt, Duration wait) {}

    default void queryCompleted(int attempts, Duration elapsed) {}

    default void queryFailed(ClientException failure) {}
}

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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The caller cancelled the execution, or interrupted the thread blocked in
 * {@link QueryExecutor#execute(Credentials, Query)}.
 */
public class QueryCancelledException
        extends ClientException
{
    private final int attempts;
    private final Duration elapsed;

    public QueryCancelledException(int attempts, Duration elapsed, Throwable cause)
    {
        super(format("Query was cancelled (attempts: %s, elapsed: %s)", attempts, requireNonNull(elapsed, "elapsed is null")), cause);
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public int getAttempts()
    {
        return attempts;
    }

    public Duration getElapsed()
    {
        return elapsed;
    }
}

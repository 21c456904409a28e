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

import java.util.Optional;
import java.util.OptionalInt;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The polling budget (attempts or elapsed time) ran out before the server produced a result.
 */
public class QueryTimeoutException
        extends ClientException
{
    private final int attempts;
    private final Duration elapsed;
    private final RetryReason lastReason;
    private final OptionalInt lastStatusCode;
    private final Optional<String> lastResponseBody;

    public QueryTimeoutException(int attempts, Duration elapsed, RetryReason lastReason, String lastMessage, OptionalInt lastStatusCode, Optional<String> lastResponseBody)
    {
        super(format("Query did not complete (attempts: %s, elapsed: %s, last outcome: %s: %s%s)",
                attempts,
                requireNonNull(elapsed, "elapsed is null"),
                requireNonNull(lastReason, "lastReason is null"),
                requireNonNull(lastMessage, "lastMessage is null"),
                lastStatusCode.isPresent() ? ", HTTP " + lastStatusCode.getAsInt() : ""));
        this.attempts = attempts;
        this.elapsed = elapsed;
        this.lastReason = lastReason;
        this.lastStatusCode = requireNonNull(lastStatusCode, "lastStatusCode is null");
        this.lastResponseBody = requireNonNull(lastResponseBody, "lastResponseBody is null");
    }

    public int getAttempts()
    {
        return attempts;
    }

    public Duration getElapsed()
    {
        return elapsed;
    }

    public RetryReason getLastReason()
    {
        return lastReason;
    }

    public OptionalInt getLastStatusCode()
    {
        return lastStatusCode;
    }

    public Optional<String> getLastResponseBody()
    {
        return lastResponseBody;
    }
}

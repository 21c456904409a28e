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

import javax.annotation.Nullable;

import java.util.Optional;
import java.util.OptionalInt;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The server rejected the query or answered with something that cannot be decoded.
 * Never retried.
 */
public class QueryFailedException
        extends ClientException
{
    private final ErrorType errorType;
    private final OptionalInt statusCode;
    private final Optional<String> responseBody;
    private final int attempts;
    private final Duration elapsed;

    public QueryFailedException(ErrorType errorType, String message, OptionalInt statusCode, Optional<String> responseBody, int attempts, Duration elapsed, @Nullable Throwable cause)
    {
        super(format("%s: %s (attempts: %s, elapsed: %s%s)",
                requireNonNull(errorType, "errorType is null"),
                requireNonNull(message, "message is null"),
                attempts,
                requireNonNull(elapsed, "elapsed is null"),
                statusCode.isPresent() ? ", HTTP " + statusCode.getAsInt() : ""), cause);
        this.errorType = errorType;
        this.statusCode = requireNonNull(statusCode, "statusCode is null");
        this.responseBody = requireNonNull(responseBody, "responseBody is null");
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public ErrorType getErrorType()
    {
        return errorType;
    }

    public OptionalInt getStatusCode()
    {
        return statusCode;
    }

    public Optional<String> getResponseBody()
    {
        return responseBody;
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

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
import javax.annotation.concurrent.Immutable;

import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Classification of a single round trip to the load endpoint.
 */
@Immutable
public abstract class Outcome
{
    public enum Kind
    {
        READY,
        CONTINUE_WAIT,
        RETRYABLE_ERROR,
        FATAL_ERROR,
    }

    private final OptionalInt statusCode;
    private final Optional<String> responseBody;

    private Outcome(OptionalInt statusCode, Optional<String> responseBody)
    {
        this.statusCode = requireNonNull(statusCode, "statusCode is null");
        this.responseBody = requireNonNull(responseBody, "responseBody is null");
    }

    public abstract Kind getKind();

    public abstract String getMessage();

    /**
     * Status of the HTTP response, empty when the transport failed before one arrived.
     */
    public OptionalInt getStatusCode()
    {
        return statusCode;
    }

    public Optional<String> getResponseBody()
    {
        return responseBody;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", getKind())
                .add("message", getMessage())
                .add("statusCode", statusCode.isPresent() ? statusCode.getAsInt() : null)
                .omitNullValues()
                .toString();
    }

    public static final class Ready
            extends Outcome
    {
        private final QueryResult result;

        public Ready(int statusCode, QueryResult result)
        {
            super(OptionalInt.of(statusCode), Optional.empty());
            this.result = requireNonNull(result, "result is null");
        }

        @Override
        public Kind getKind()
        {
            return Kind.READY;
        }

        @Override
        public String getMessage()
        {
            return "ready with " + result.getData().size() + " rows";
        }

        public QueryResult getResult()
        {
            return result;
        }
    }

    public static final class ContinueWait
            extends Outcome
    {
        private final Optional<Duration> hint;

        public ContinueWait(int statusCode, String responseBody, Optional<Duration> hint)
        {
            super(OptionalInt.of(statusCode), Optional.of(responseBody));
            this.hint = requireNonNull(hint, "hint is null");
        }

        @Override
        public Kind getKind()
        {
            return Kind.CONTINUE_WAIT;
        }

        @Override
        public String getMessage()
        {
            return CubeApi.CONTINUE_WAIT;
        }

        /**
         * Wait suggested by the server before the next request.
         */
        public Optional<Duration> getHint()
        {
            return hint;
        }
    }

    public static final class RetryableError
            extends Outcome
    {
        private final String message;
        private final Optional<Duration> hint;
        private final Throwable cause;

        public RetryableError(String message, OptionalInt statusCode, Optional<String> responseBody, Optional<Duration> hint, @Nullable Throwable cause)
        {
            super(statusCode, responseBody);
            this.message = requireNonNull(message, "message is null");
            this.hint = requireNonNull(hint, "hint is null");
            this.cause = cause;
        }

        @Override
        public Kind getKind()
        {
            return Kind.RETRYABLE_ERROR;
        }

        @Override
        public String getMessage()
        {
            return message;
        }

        public Optional<Duration> getHint()
        {
            return hint;
        }

        @Nullable
        public Throwable getCause()
        {
            return cause;
        }
    }

    public static final class FatalError
            extends Outcome
    {
        private final ErrorType errorType;
        private final String message;
        private final Throwable cause;

        public FatalError(ErrorType errorType, String message, OptionalInt statusCode, Optional<String> responseBody, @Nullable Throwable cause)
        {
            super(statusCode, responseBody);
            this.errorType = requireNonNull(errorType, "errorType is null");
            this.message = requireNonNull(message, "message is null");
            this.cause = cause;
        }

        @Override
        public Kind getKind()
        {
            return Kind.FATAL_ERROR;
        }

        public ErrorType getErrorType()
        {
            return errorType;
        }

        @Override
        public String getMessage()
        {
            return message;
        }

        @Nullable
        public Throwable getCause()
        {
            return cause;
        }
    }
}

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

import javax.annotation.concurrent.Immutable;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * What an execution does after a response was classified.
 */
@Immutable
public final class PollDecision
{
    public enum Kind
    {
        COMPLETE,
        FAIL,
        RETRY,
    }

    private final Kind kind;
    private final QueryResult result;
    private final ClientException failure;
    private final Duration wait;
    private final RetryReason reason;

    private PollDecision(Kind kind, QueryResult result, ClientException failure, Duration wait, RetryReason reason)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.result = result;
        this.failure = failure;
        this.wait = wait;
        this.reason = reason;
    }

    public static PollDecision complete(QueryResult result)
    {
        return new PollDecision(Kind.COMPLETE, requireNonNull(result, "result is null"), null, null, null);
    }

    public static PollDecision fail(ClientException failure)
    {
        return new PollDecision(Kind.FAIL, null, requireNonNull(failure, "failure is null"), null, null);
    }

    public static PollDecision retry(Duration wait, RetryReason reason)
    {
        return new PollDecision(Kind.RETRY, null, null, requireNonNull(wait, "wait is null"), requireNonNull(reason, "reason is null"));
    }

    public Kind getKind()
    {
        return kind;
    }

    public QueryResult getResult()
    {
        checkState(kind == Kind.COMPLETE, "decision is %s", kind);
        return result;
    }

    public ClientException getFailure()
    {
        checkState(kind == Kind.FAIL, "decision is %s", kind);
        return failure;
    }

    public Duration getWait()
    {
        checkState(kind == Kind.RETRY, "decision is %s", kind);
        return wait;
    }

    public RetryReason getReason()
    {
        checkState(kind == Kind.RETRY, "decision is %s", kind);
        return reason;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("kind", kind)
                .add("failure", failure)
                .add("wait", wait)
                .add("reason", reason)
                .omitNullValues()
                .toString();
    }
}

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

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Snapshot of the progress of one query execution.
 */
@Immutable
public final class PollState
{
    private final int attempt;
    private final Duration elapsed;
    private final Optional<Duration> nextWaitHint;
    private final Optional<Outcome> lastOutcome;

    public PollState(int attempt, Duration elapsed, Optional<Duration> nextWaitHint, Optional<Outcome> lastOutcome)
    {
        checkArgument(attempt >= 0, "attempt is negative");
        this.attempt = attempt;
        this.elapsed = requireNonNull(elapsed, "elapsed is null");
        this.nextWaitHint = requireNonNull(nextWaitHint, "nextWaitHint is null");
        this.lastOutcome = requireNonNull(lastOutcome, "lastOutcome is null");
    }

    /**
     * Number of requests answered so far.
     */
    public int getAttempt()
    {
        return attempt;
    }

    public Duration getElapsed()
    {
        return elapsed;
    }

    public Optional<Duration> getNextWaitHint()
    {
        return nextWaitHint;
    }

    public Optional<Outcome> getLastOutcome()
    {
        return lastOutcome;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("attempt", attempt)
                .add("elapsed", elapsed)
                .add("nextWaitHint", nextWaitHint.orElse(null))
                .add("lastOutcome", lastOutcome.orElse(null))
                .omitNullValues()
                .toString();
    }
}

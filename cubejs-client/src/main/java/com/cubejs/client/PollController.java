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

import com.google.common.base.Ticker;
import io.airlift.units.Duration;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Decides, response by response, whether a query execution is finished, failed, or
 * should poll again and after how long.
 * <p>
 * The clock starts when the controller is created. Each call to {@link #onOutcome(Outcome)}
 * counts as one attempt; continue-wait responses and retryable errors draw from the same
 * attempt and time budget.
 */
@ThreadSafe
public class PollController
{
    public enum State
    {
        START,
        POLLING,
        DONE,
        GIVEN_UP,
    }

    private final PollingPolicy policy;
    private final WaitStrategy waitStrategy;
    private final Ticker ticker;
    private final long startNanos;

    @GuardedBy("this")
    private State state = State.START;
    @GuardedBy("this")
    private int attempt;
    @GuardedBy("this")
    private Optional<Duration> nextWaitHint = Optional.empty();
    @GuardedBy("this")
    private Optional<Outcome> lastOutcome = Optional.empty();

    public PollController(PollingPolicy policy, WaitStrategy waitStrategy, Ticker ticker)
    {
        this.policy = requireNonNull(policy, "policy is null");
        this.waitStrategy = requireNonNull(waitStrategy, "waitStrategy is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
        this.startNanos = ticker.read();
    }

    public synchronized PollDecision onOutcome(Outcome outcome)
    {
        requireNonNull(outcome, "outcome is null");
        checkState(state == State.START || state == State.POLLING, "execution is already %s", state);

        attempt++;
        lastOutcome = Optional.of(outcome);
        long elapsedNanos = elapsedNanos();
        Duration elapsed = toDuration(elapsedNanos);

        switch (outcome.getKind()) {
            case READY:
                state = State.DONE;
                nextWaitHint = Optional.empty();
                return PollDecision.complete(((Outcome.Ready) outcome).getResult());
            case FATAL_ERROR:
                state = State.DONE;
                nextWaitHint = Optional.empty();
                Outcome.FatalError error = (Outcome.FatalError) outcome;
                return PollDecision.fail(new QueryFailedException(
                        error.getErrorType(),
                        error.getMessage(),
                        error.getStatusCode(),
                        error.getResponseBody(),
                        attempt,
                        elapsed,
                        error.getCause()));
            case CONTINUE_WAIT:
                nextWaitHint = ((Outcome.ContinueWait) outcome).getHint();
                return retryOrGiveUp(outcome, RetryReason.CONTINUE_WAIT, elapsedNanos);
            case RETRYABLE_ERROR:
                nextWaitHint = ((Outcome.RetryableError) outcome).getHint();
                return retryOrGiveUp(outcome, RetryReason.RETRYABLE_ERROR, elapsedNanos);
        }
        throw new IllegalArgumentException("Unknown outcome kind: " + outcome.getKind());
    }

    @GuardedBy("this")
    private PollDecision retryOrGiveUp(Outcome outcome, RetryReason reason, long elapsedNanos)
    {
        long maxElapsedNanos = policy.getMaxElapsed().roundTo(NANOSECONDS);
        if (attempt >= policy.getMaxAttempts() || elapsedNanos >= maxElapsedNanos) {
            state = State.GIVEN_UP;
            return PollDecision.fail(new QueryTimeoutException(
                    attempt,
                    toDuration(elapsedNanos),
                    reason,
                    outcome.getMessage(),
                    outcome.getStatusCode(),
                    outcome.getResponseBody()));
        }

        Duration wait = waitStrategy.computeWait(attempt, nextWaitHint);
        long remainingNanos = maxElapsedNanos - elapsedNanos;
        if (wait.roundTo(NANOSECONDS) > remainingNanos) {
            wait = toDuration(remainingNanos);
        }
        state = State.POLLING;
        return PollDecision.retry(wait, reason);
    }

    public synchronized State getState()
    {
        return state;
    }

    /**
     * Number of responses handled so far.
     */
    public synchronized int getAttempts()
    {
        return attempt;
    }

    public Duration getElapsed()
    {
        return toDuration(elapsedNanos());
    }

    public synchronized PollState getPollState()
    {
        return new PollState(attempt, getElapsed(), nextWaitHint, lastOutcome);
    }

    private long elapsedNanos()
    {
        return ticker.read() - startNanos;
    }

    private static Duration toDuration(long nanos)
    {
        return new Duration(nanos, NANOSECONDS).convertToMostSuccinctTimeUnit();
    }

    @Override
    public synchronized String toString()
    {
        return toStringHelper(this)
                .add("state", state)
                .add("attempt", attempt)
                .add("policy", policy)
                .toString();
    }
}

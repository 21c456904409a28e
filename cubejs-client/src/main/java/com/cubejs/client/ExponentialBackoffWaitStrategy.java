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

import javax.annotation.concurrent.ThreadSafe;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.lang.Math.min;
import static java.lang.Math.pow;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Exponential backoff capped at {@link PollingPolicy#getBackoffCap()}, with additive jitter.
 * <p>
 * A server hint, when the policy prefers hints, replaces the computed backoff and is
 * clamped to the cap without jitter.
 */
@ThreadSafe
public class ExponentialBackoffWaitStrategy
        implements WaitStrategy
{
    private final PollingPolicy policy;
    private final DoubleSupplier jitter;

    public ExponentialBackoffWaitStrategy(PollingPolicy policy)
    {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitter source of values in {@code [0, 1]}, the fraction of the computed
     * backoff added on top of it
     */
    public ExponentialBackoffWaitStrategy(PollingPolicy policy, DoubleSupplier jitter)
    {
        this.policy = requireNonNull(policy, "policy is null");
        this.jitter = requireNonNull(jitter, "jitter is null");
    }

    @Override
    public Duration computeWait(int attempt, Optional<Duration> serverHint)
    {
        checkArgument(attempt >= 1, "attempt must be at least 1: %s", attempt);
        requireNonNull(serverHint, "serverHint is null");

        double capNanos = policy.getBackoffCap().getValue(NANOSECONDS);
        if (serverHint.isPresent() && policy.getWaitHintMode() == WaitHintMode.PREFER_SERVER_HINT) {
            return nanos(min(serverHint.get().getValue(NANOSECONDS), capNanos));
        }

        double baseNanos = policy.getBaseBackoff().getValue(NANOSECONDS);
        if (baseNanos == 0) {
            return nanos(0);
        }
        double backoffNanos = min(baseNanos * pow(policy.getBackoffMultiplier(), attempt - 1), capNanos);

        double fraction = jitter.getAsDouble();
        checkState(fraction >= 0 && fraction <= 1, "jitter out of range: %s", fraction);
        return nanos(backoffNanos + backoffNanos * fraction);
    }

    private static Duration nanos(double value)
    {
        return new Duration(value, NANOSECONDS).convertToMostSuccinctTimeUnit();
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("policy", policy)
                .toString();
    }
}

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

import com.google.common.collect.ImmutableSet;
import io.airlift.units.Duration;

import javax.annotation.concurrent.Immutable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Polling and retry budget of a query execution.
 * <p>
 * All fields are required except {@code waitHintMode}, which defaults to
 * {@link WaitHintMode#PREFER_SERVER_HINT}. The wait before retry {@code n} (1-based) is
 * {@code min(baseBackoff * backoffMultiplier^(n-1), backoffCap)} plus a random jitter of
 * up to the same amount. The exponent starts at zero, so the first retry waits exactly
 * {@code baseBackoff} before jitter. An execution gives up once {@code maxAttempts} requests were
 * answered without a result, or once {@code maxElapsed} has passed.
 * {@code requestTimeout} bounds each individual request.
 */
@Immutable
public final class PollingPolicy
{
    public static final String BASE_BACKOFF = "polling.base-backoff";
    public static final String BACKOFF_MULTIPLIER = "polling.backoff-multiplier";
    public static final String BACKOFF_CAP = "polling.backoff-cap";
    public static final String MAX_ATTEMPTS = "polling.max-attempts";
    public static final String MAX_ELAPSED = "polling.max-elapsed";
    public static final String REQUEST_TIMEOUT = "polling.request-timeout";
    public static final String WAIT_HINT_MODE = "polling.wait-hint-mode";

    private static final Set<String> PROPERTY_NAMES = ImmutableSet.of(
            BASE_BACKOFF,
            BACKOFF_MULTIPLIER,
            BACKOFF_CAP,
            MAX_ATTEMPTS,
            MAX_ELAPSED,
            REQUEST_TIMEOUT,
            WAIT_HINT_MODE);

    private final Duration baseBackoff;
    private final double backoffMultiplier;
    private final Duration backoffCap;
    private final int maxAttempts;
    private final Duration maxElapsed;
    private final Duration requestTimeout;
    private final WaitHintMode waitHintMode;

    public PollingPolicy(
            Duration baseBackoff,
            double backoffMultiplier,
            Duration backoffCap,
            int maxAttempts,
            Duration maxElapsed,
            Duration requestTimeout,
            WaitHintMode waitHintMode)
    {
        this.baseBackoff = requireNonNull(baseBackoff, "baseBackoff is null");
        this.backoffCap = requireNonNull(backoffCap, "backoffCap is null");
        this.maxElapsed = requireNonNull(maxElapsed, "maxElapsed is null");
        this.requestTimeout = requireNonNull(requestTimeout, "requestTimeout is null");
        this.waitHintMode = requireNonNull(waitHintMode, "waitHintMode is null");

        checkArgument(backoffMultiplier >= 1.0 && !Double.isInfinite(backoffMultiplier), "backoffMultiplier must be at least 1: %s", backoffMultiplier);
        checkArgument(backoffCap.compareTo(baseBackoff) >= 0, "backoffCap %s is less than baseBackoff %s", backoffCap, baseBackoff);
        checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1: %s", maxAttempts);
        checkArgument(maxElapsed.toMillis() > 0, "maxElapsed must be positive: %s", maxElapsed);
        checkArgument(requestTimeout.toMillis() > 0, "requestTimeout must be positive: %s", requestTimeout);
        this.backoffMultiplier = backoffMultiplier;
        this.maxAttempts = maxAttempts;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static Builder builder(PollingPolicy policy)
    {
        return new Builder(policy);
    }

    /**
     * Reads a policy from {@code polling.*} properties. Durations use the airlift
     * syntax, for example {@code 250ms} or {@code 2m}.
     */
    public static PollingPolicy fromProperties(Map<String, String> properties)
    {
        requireNonNull(properties, "properties is null");
        Map<String, String> remaining = new HashMap<>(properties);
        remaining.keySet().removeAll(PROPERTY_NAMES);
        checkArgument(remaining.isEmpty(), "Unknown polling properties: %s", remaining.keySet());

        Builder builder = builder();
        String value = properties.get(BASE_BACKOFF);
        if (value != null) {
            builder.setBaseBackoff(parseDuration(BASE_BACKOFF, value));
        }
        value = properties.get(BACKOFF_MULTIPLIER);
        if (value != null) {
            builder.setBackoffMultiplier(parseNumber(BACKOFF_MULTIPLIER, value));
        }
        value = properties.get(BACKOFF_CAP);
        if (value != null) {
            builder.setBackoffCap(parseDuration(BACKOFF_CAP, value));
        }
        value = properties.get(MAX_ATTEMPTS);
        if (value != null) {
            builder.setMaxAttempts(parseInteger(MAX_ATTEMPTS, value));
        }
        value = properties.get(MAX_ELAPSED);
        if (value != null) {
            builder.setMaxElapsed(parseDuration(MAX_ELAPSED, value));
        }
        value = properties.get(REQUEST_TIMEOUT);
        if (value != null) {
            builder.setRequestTimeout(parseDuration(REQUEST_TIMEOUT, value));
        }
        value = properties.get(WAIT_HINT_MODE);
        if (value != null) {
            try {
                builder.setWaitHintMode(WaitHintMode.valueOf(value.trim().toUpperCase(Locale.ENGLISH).replace('-', '_')));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + WAIT_HINT_MODE + ": " + value, e);
            }
        }
        return builder.build();
    }

    public Duration getBaseBackoff()
    {
        return baseBackoff;
    }

    public double getBackoffMultiplier()
    {
        return backoffMultiplier;
    }

    /**
     * Upper bound of the computed backoff and of server hints. Jitter is added after
     * capping, so a jittered wait can reach twice this value.
     */
    public Duration getBackoffCap()
    {
        return backoffCap;
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    public Duration getMaxElapsed()
    {
        return maxElapsed;
    }

    public Duration getRequestTimeout()
    {
        return requestTimeout;
    }

    public WaitHintMode getWaitHintMode()
    {
        return waitHintMode;
    }

    private static Duration parseDuration(String name, String value)
    {
        try {
            return Duration.valueOf(value.trim());
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid duration for " + name + ": " + value, e);
        }
    }

    private static int parseInteger(String name, String value)
    {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private static double parseNumber(String name, String value)
    {
        try {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PollingPolicy that = (PollingPolicy) o;
        return Double.compare(that.backoffMultiplier, backoffMultiplier) == 0 &&
                maxAttempts == that.maxAttempts &&
                baseBackoff.equals(that.baseBackoff) &&
                backoffCap.equals(that.backoffCap) &&
                maxElapsed.equals(that.maxElapsed) &&
                requestTimeout.equals(that.requestTimeout) &&
                waitHintMode == that.waitHintMode;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(baseBackoff, backoffMultiplier, backoffCap, maxAttempts, maxElapsed, requestTimeout, waitHintMode);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("baseBackoff", baseBackoff)
                .add("backoffMultiplier", backoffMultiplier)
                .add("backoffCap", backoffCap)
                .add("maxAttempts", maxAttempts)
                .add("maxElapsed", maxElapsed)
                .add("requestTimeout", requestTimeout)
                .add("waitHintMode", waitHintMode)
                .toString();
    }

    public static final class Builder
    {
        private Duration baseBackoff;
        private Double backoffMultiplier;
        private Duration backoffCap;
        private Integer maxAttempts;
        private Duration maxElapsed;
        private Duration requestTimeout;
        private WaitHintMode waitHintMode = WaitHintMode.PREFER_SERVER_HINT;

        private Builder() {}

        private Builder(PollingPolicy policy)
        {
            requireNonNull(policy, "policy is null");
            baseBackoff = policy.getBaseBackoff();
            backoffMultiplier = policy.getBackoffMultiplier();
            backoffCap = policy.getBackoffCap();
            maxAttempts = policy.getMaxAttempts();
            maxElapsed = policy.getMaxElapsed();
            requestTimeout = policy.getRequestTimeout();
            waitHintMode = policy.getWaitHintMode();
        }

        public Builder setBaseBackoff(Duration baseBackoff)
        {
            this.baseBackoff = requireNonNull(baseBackoff, "baseBackoff is null");
            return this;
        }

        public Builder setBackoffMultiplier(double backoffMultiplier)
        {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder setBackoffCap(Duration backoffCap)
        {
            this.backoffCap = requireNonNull(backoffCap, "backoffCap is null");
            return this;
        }

        public Builder setMaxAttempts(int maxAttempts)
        {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder setMaxElapsed(Duration maxElapsed)
        {
            this.maxElapsed = requireNonNull(maxElapsed, "maxElapsed is null");
            return this;
        }

        public Builder setRequestTimeout(Duration requestTimeout)
        {
            this.requestTimeout = requireNonNull(requestTimeout, "requestTimeout is null");
            return this;
        }

        public Builder setWaitHintMode(WaitHintMode waitHintMode)
        {
            this.waitHintMode = requireNonNull(waitHintMode, "waitHintMode is null");
            return this;
        }

        public PollingPolicy build()
        {
            checkState(baseBackoff != null, "baseBackoff is not set");
            checkState(backoffMultiplier != null, "backoffMultiplier is not set");
            checkState(backoffCap != null, "backoffCap is not set");
            checkState(maxAttempts != null, "maxAttempts is not set");
            checkState(maxElapsed != null, "maxElapsed is not set");
            checkState(requestTimeout != null, "requestTimeout is not set");
            return new PollingPolicy(baseBackoff, backoffMultiplier, backoffCap, maxAttempts, maxElapsed, requestTimeout, waitHintMode);
        }
    }
}

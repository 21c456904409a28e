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

import com.google.common.collect.ImmutableMap;
import io.airlift.units.Duration;
import org.testng.annotations.Test;

import java.util.HashMap;
import java.util.Map;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestPollingPolicy
{
    private static final Map<String, String> PROPERTIES = ImmutableMap.<String, String>builder()
            .put("polling.base-backoff", "250ms")
            .put("polling.backoff-multiplier", "1.5")
            .put("polling.backoff-cap", "10s")
            .put("polling.max-attempts", "40")
            .put("polling.max-elapsed", "5m")
            .put("polling.request-timeout", "30s")
            .build();

    @Test
    public void testBuilder()
    {
        PollingPolicy policy = newBuilder().build();
        assertEquals(policy.getBaseBackoff(), new Duration(250, MILLISECONDS));
        assertEquals(policy.getBackoffMultiplier(), 1.5, 0.0);
        assertEquals(policy.getBackoffCap(), new Duration(10, SECONDS));
        assertEquals(policy.getMaxAttempts(), 40);
        assertEquals(policy.getMaxElapsed(), new Duration(5, MINUTES));
        assertEquals(policy.getRequestTimeout(), new Duration(30, SECONDS));
        assertEquals(policy.getWaitHintMode(), WaitHintMode.PREFER_SERVER_HINT);
        assertEquals(PollingPolicy.builder(policy).build(), policy);
    }

    @Test
    public void testMissingField()
    {
        IllegalStateException e = expectThrows(IllegalStateException.class, () -> PollingPolicy.builder()
                .setBaseBackoff(new Duration(1, SECONDS))
                .setBackoffMultiplier(2)
                .setBackoffCap(new Duration(10, SECONDS))
                .setMaxElapsed(new Duration(1, MINUTES))
                .setRequestTimeout(new Duration(10, SECONDS))
                .build());
        assertEquals(e.getMessage(), "maxAttempts is not set");

        e = expectThrows(IllegalStateException.class, () -> PollingPolicy.builder().build());
        assertEquals(e.getMessage(), "baseBackoff is not set");
    }

    @Test
    public void testInvalidValues()
    {
        expectThrows(IllegalArgumentException.class, () -> newBuilder().setBackoffMultiplier(0.5).build());
        expectThrows(IllegalArgumentException.class, () -> newBuilder().setBackoffCap(new Duration(100, MILLISECONDS)).build());
        expectThrows(IllegalArgumentException.class, () -> newBuilder().setMaxAttempts(0).build());
        expectThrows(IllegalArgumentException.class, () -> newBuilder().setMaxElapsed(new Duration(0, SECONDS)).build());
        expectThrows(IllegalArgumentException.class, () -> newBuilder().setRequestTimeout(new Duration(0, SECONDS)).build());
    }

    @Test
    public void testFromProperties()
    {
        assertEquals(PollingPolicy.fromProperties(PROPERTIES), newBuilder().build());

        PollingPolicy policy = PollingPolicy.fromProperties(ImmutableMap.<String, String>builder()
                .putAll(PROPERTIES)
                .put("polling.wait-hint-mode", "ignore-server-hint")
                .build());
        assertEquals(policy.getWaitHintMode(), WaitHintMode.IGNORE_SERVER_HINT);
    }

    @Test
    public void testInvalidProperties()
    {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> PollingPolicy.fromProperties(with("polling.backoff-cap", "soon")));
        assertTrue(e.getMessage().contains("polling.backoff-cap"), e.getMessage());

        e = expectThrows(IllegalArgumentException.class, () -> PollingPolicy.fromProperties(with("polling.max-attempts", "3.5")));
        assertTrue(e.getMessage().contains("polling.max-attempts"), e.getMessage());

        e = expectThrows(IllegalArgumentException.class, () -> PollingPolicy.fromProperties(with("polling.wait-hint-mode", "sometimes")));
        assertTrue(e.getMessage().contains("polling.wait-hint-mode"), e.getMessage());

        e = expectThrows(IllegalArgumentException.class, () -> PollingPolicy.fromProperties(with("polling.max-retries", "3")));
        assertTrue(e.getMessage().contains("polling.max-retries"), e.getMessage());

        expectThrows(IllegalStateException.class, () -> PollingPolicy.fromProperties(ImmutableMap.of("polling.base-backoff", "1s")));
    }

    private static Map<String, String> with(String key, String value)
    {
        Map<String, String> properties = new HashMap<>(PROPERTIES);
        properties.put(key, value);
        return properties;
    }

    private static PollingPolicy.Builder newBuilder()
    {
        return PollingPolicy.builder()
                .setBaseBackoff(new Duration(250, MILLISECONDS))
                .setBackoffMultiplier(1.5)
                .setBackoffCap(new Duration(10, SECONDS))
                .setMaxAttempts(40)
                .setMaxElapsed(new Duration(5, MINUTES))
                .setRequestTimeout(new Duration(30, SECONDS));
    }
}

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
import okhttp3.OkHttpClient;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

public final class OkHttpUtil
{
    private OkHttpUtil() {}

    public static void setupTimeouts(OkHttpClient.Builder clientBuilder, Duration timeout)
    {
        long millis = timeout.toMillis();
        clientBuilder
                .connectTimeout(millis, MILLISECONDS)
                .readTimeout(millis, MILLISECONDS)
                .writeTimeout(millis, MILLISECONDS);
    }

    public static OkHttpClient newHttpClient(PollingPolicy policy)
    {
        OkHttpClient.Builder builder = new OkHttpClient.Builder();
        setupTimeouts(builder, policy.getRequestTimeout());
        return builder.build();
    }
}

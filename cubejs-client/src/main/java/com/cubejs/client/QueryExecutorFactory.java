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
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import okhttp3.OkHttpClient;

import java.util.concurrent.ScheduledExecutorService;

import static java.util.concurrent.Executors.newSingleThreadScheduledExecutor;

public final class QueryExecutorFactory
{
    private QueryExecutorFactory() {}

    public static QueryExecutor newQueryExecutor(PollingPolicy policy)
    {
        return newQueryExecutor(OkHttpUtil.newHttpClient(policy), policy, QueryExecutionListener.NO_OP);
    }

    /**
     * Creates an executor with its own polling thread, stopped by {@link QueryExecutor#close()}.
     */
    public static QueryExecutor newQueryExecutor(OkHttpClient httpClient, PollingPolicy policy, QueryExecutionListener listener)
    {
        ScheduledExecutorService scheduler = newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("cubejs-poll-%s")
                .setDaemon(true)
                .build());
        return new QueryExecutor(
                new OkHttpQueryTransport(httpClient),
                policy,
                new ExponentialBackoffWaitStrategy(policy),
                Ticker.systemTicker(),
                listener,
                scheduler,
                true);
    }

    public static QueryExecutor newQueryExecutor(OkHttpClient httpClient, PollingPolicy policy, ScheduledExecutorService scheduler)
    {
        return new QueryExecutor(new OkHttpQueryTransport(httpClient), policy, scheduler);
    }
}

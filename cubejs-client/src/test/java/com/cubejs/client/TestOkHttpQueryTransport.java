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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ListenableFuture;
import io.airlift.units.Duration;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import static com.cubejs.client.ScriptedQueryTransport.CONTINUE_WAIT_BODY;
import static com.cubejs.client.ScriptedQueryTransport.READY_BODY;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestOkHttpQueryTransport
{
    private static final PollingPolicy POLICY = PollingPolicy.builder()
            .setBaseBackoff(new Duration(10, MILLISECONDS))
            .setBackoffMultiplier(2)
            .setBackoffCap(new Duration(50, MILLISECONDS))
            .setMaxAttempts(5)
            .setMaxElapsed(new Duration(1, MINUTES))
            .setRequestTimeout(new Duration(5, SECONDS))
            .build();

    private MockWebServer server;
    private OkHttpClient httpClient;

    @BeforeMethod
    public void setUp()
            throws IOException
    {
        server = new MockWebServer();
        server.start();
        httpClient = OkHttpUtil.newHttpClient(POLICY);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown()
            throws IOException
    {
        server.close();
    }

    @Test
    public void testSend()
            throws Exception
    {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Retry-After", "2")
                .addHeader("Content-Type", "application/json")
                .setBody(CONTINUE_WAIT_BODY));

        Credentials credentials = new Credentials("token", server.url("/").uri());
        HttpRequestSpec request = new RequestEncoder().encode(credentials, Query.builder().measures("Orders.count").build());
        TransportResponse response = new OkHttpQueryTransport(httpClient).send(request).get(10, SECONDS);

        assertEquals(response.getStatusCode(), 200);
        assertEquals(response.getBody(), CONTINUE_WAIT_BODY);
        assertEquals(response.getHeader("retry-after").get(), "2");
        assertEquals(response.getHeader("Retry-After").get(), "2");

        RecordedRequest recorded = server.takeRequest();
        assertEquals(recorded.getMethod(), "POST");
        assertEquals(recorded.getPath(), "/cubejs-api/v1/load");
        assertEquals(recorded.getHeader("Authorization"), "Bearer token");
        assertEquals(recorded.getHeader("Accept"), "application/json");
        assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"), recorded.getHeader("Content-Type"));
        assertTrue(recorded.getHeader("User-Agent").startsWith("cubejs-client/"), recorded.getHeader("User-Agent"));
        assertEquals(recorded.getBody().readUtf8(), request.getBody());
    }

    @Test
    public void testConnectionFailure()
    {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        HttpRequestSpec request = new RequestEncoder().encode(new Credentials("token", server.url("/").uri()), Query.builder().measures("Orders.count").build());
        OkHttpClient client = httpClient.newBuilder()
                .retryOnConnectionFailure(false)
                .build();
        ListenableFuture<TransportResponse> future = new OkHttpQueryTransport(client).send(request);

        ExecutionException e = expectThrows(ExecutionException.class, () -> future.get(10, SECONDS));
        assertTrue(e.getCause() instanceof IOException, String.valueOf(e.getCause()));
    }

    @Test
    public void testPollingAgainstServer()
            throws Exception
    {
        server.enqueue(new MockResponse().setBody(CONTINUE_WAIT_BODY));
        server.enqueue(new MockResponse().setResponseCode(502).setBody("Bad Gateway"));
        server.enqueue(new MockResponse().setBody(CONTINUE_WAIT_BODY));
        server.enqueue(new MockResponse().setBody(READY_BODY));

        Credentials credentials = new Credentials("secret", server.url("/tenant/").uri());
        Query query = Query.builder()
                .measures("Orders.count")
                .dimensions("Orders.status")
                .build();

        try (QueryExecutor executor = QueryExecutorFactory.newQueryExecutor(httpClient, POLICY, QueryExecutionListener.NO_OP)) {
            QueryResult result = executor.execute(credentials, query);
            assertEquals(result.getData().size(), 2);
            assertEquals(result.getData().get(0).get("Orders.status"), "completed");
        }

        assertEquals(server.getRequestCount(), 4);
        ObjectMapper mapper = new ObjectMapper();
        String firstBody = null;
        for (int i = 0; i < 4; i++) {
            RecordedRequest recorded = server.takeRequest();
            assertEquals(recorded.getPath(), "/tenant/cubejs-api/v1/load");
            String body = recorded.getBody().readUtf8();
            if (firstBody == null) {
                firstBody = body;
            }
            assertEquals(body, firstBody);
        }
        assertEquals(mapper.readTree(firstBody).get("query").get("dimensions").get(0).asText(), "Orders.status");
    }

    @Test
    public void testAuthorizationFailure()
    {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"error\":\"Invalid token\"}"));

        try (QueryExecutor executor = QueryExecutorFactory.newQueryExecutor(httpClient, POLICY, QueryExecutionListener.NO_OP)) {
            QueryFailedException e = expectThrows(QueryFailedException.class,
                    () -> executor.execute(new Credentials("expired", server.url("/").uri()), Query.builder().measures("Orders.count").build()));
            assertEquals(e.getErrorType(), ErrorType.AUTHORIZATION);
            assertEquals(e.getStatusCode().getAsInt(), 403);
            assertTrue(e.getMessage().contains("Invalid token"), e.getMessage());
        }
        assertEquals(server.getRequestCount(), 1);
    }
}

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.airlift.json.JsonCodec;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.URI;

import static io.airlift.json.JsonCodec.jsonCodec;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;

public class TestRequestEncoder
{
    private static final JsonCodec<LoadRequest> LOAD_REQUEST_CODEC = jsonCodec(LoadRequest.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RequestEncoder encoder = new RequestEncoder();
    private final Credentials credentials = Credentials.of("secret-token", "https://analytics.example.com");

    @Test
    public void testRequestLine()
    {
        HttpRequestSpec request = encoder.encode(credentials, Query.builder().measures("Orders.count").build());
        assertEquals(request.getMethod(), "POST");
        assertEquals(request.getUrl(), URI.create("https://analytics.example.com/cubejs-api/v1/load"));
    }

    @Test
    public void testHeaders()
    {
        HttpRequestSpec request = encoder.encode(credentials, Query.builder().measures("Orders.count").build());
        assertEquals(request.getHeaders().get("Authorization"), "Bearer secret-token");
        assertEquals(request.getHeaders().get("Content-Type"), "application/json");
        assertEquals(request.getHeaders().get("Accept"), "application/json");
        assertTrue(request.getHeaders().get("User-Agent").startsWith("cubejs-client/"));
        assertFalse(request.toString().contains("secret-token"));
    }

    @Test
    public void testLoadUrl()
    {
        assertEquals(RequestEncoder.loadUrl(URI.create("http://localhost:4000")), URI.create("http://localhost:4000/cubejs-api/v1/load"));
        assertEquals(RequestEncoder.loadUrl(URI.create("http://localhost:4000/")), URI.create("http://localhost:4000/cubejs-api/v1/load"));
        assertEquals(RequestEncoder.loadUrl(URI.create("https://example.com/tenant-a//")), URI.create("https://example.com/tenant-a/cubejs-api/v1/load"));
    }

    @Test
    public void testMinimalBody()
            throws IOException
    {
        JsonNode query = encodeQuery(Query.builder().measures("Orders.count").build());
        assertEquals(query.get("measures").toString(), "[\"Orders.count\"]");
        assertEquals(query.get("filters").toString(), "[]");
        for (String omitted : ImmutableList.of("dimensions", "segments", "timeDimensions", "order", "limit", "offset")) {
            assertFalse(query.has(omitted), omitted);
        }
    }

    @Test
    public void testFullBody()
            throws IOException
    {
        Query query = Query.builder()
                .measures("Orders.total", "Orders.count")
                .dimensions("Orders.status")
                .segments("Orders.completed")
                .timeDimension(TimeDimension.of("Orders.createdAt", DateRange.between("2024-01-01", "2024-01-31"), Granularity.WEEK))
                .timeDimension(TimeDimension.compare("Orders.shippedAt", ImmutableList.of(DateRange.parse("this week"), DateRange.parse("last week")), null))
                .filter(Filter.of("Orders.status", FilterOperator.NOT_SET))
                .filter(LogicalFilter.or(
                        Filter.of("Orders.total", FilterOperator.GREATER_THAN, "100"),
                        Filter.of("Orders.city", FilterOperator.EQUALS, "Berlin", "Paris")))
                .orderBy("Orders.total", OrderDirection.DESC)
                .orderBy("Orders.status", OrderDirection.ASC)
                .limit(50)
                .offset(10)
                .build();

        JsonNode json = encodeQuery(query);
        assertEquals(json.get("measures").toString(), "[\"Orders.total\",\"Orders.count\"]");
        assertEquals(json.get("dimensions").toString(), "[\"Orders.status\"]");
        assertEquals(json.get("segments").toString(), "[\"Orders.completed\"]");
        assertEquals(json.get("timeDimensions"), MAPPER.readTree(
                "[{\"dimension\":\"Orders.createdAt\",\"dateRange\":[\"2024-01-01\",\"2024-01-31\"],\"granularity\":\"week\"}," +
                        "{\"dimension\":\"Orders.shippedAt\",\"compareDateRange\":[\"this week\",\"last week\"]}]"));
        assertEquals(json.get("filters"), MAPPER.readTree(
                "[{\"member\":\"Orders.status\",\"operator\":\"notSet\"}," +
                        "{\"or\":[{\"member\":\"Orders.total\",\"operator\":\"gt\",\"values\":[\"100\"]}," +
                        "{\"member\":\"Orders.city\",\"operator\":\"equals\",\"values\":[\"Berlin\",\"Paris\"]}]}]"));
        assertEquals(json.get("order").toString(), "{\"Orders.total\":\"desc\",\"Orders.status\":\"asc\"}");
        assertEquals(json.get("limit").asInt(), 50);
        assertEquals(json.get("offset").asInt(), 10);

        assertEquals(LOAD_REQUEST_CODEC.fromJson(encoder.encode(credentials, query).getBody()).getQuery(), query);
    }

    @Test
    public void testRoundTrip()
    {
        Query query = Query.builder()
                .dimensions("Users.city", "Users.country")
                .timeDimension(TimeDimension.of("Users.signedUpAt", DateRange.parse("last 3 months"), Granularity.MONTH))
                .filter(LogicalFilter.and(
                        Filter.of("Users.age", FilterOperator.GREATER_THAN_OR_EQUAL, "18"),
                        LogicalFilter.or(Filter.of("Users.plan", FilterOperator.SET), Filter.of("Users.trial", FilterOperator.EQUALS, "true"))))
                .orderBy("Users.country", OrderDirection.ASC)
                .build();

        assertEquals(LOAD_REQUEST_CODEC.fromJson(encoder.encode(credentials, query).getBody()).getQuery(), query);
    }

    @Test
    public void testDeterministic()
    {
        Query query = Query.builder().measures("Orders.count").dimensions("Orders.status").limit(5).build();
        assertEquals(encoder.encode(credentials, query), encoder.encode(credentials, query));
    }

    @Test
    public void testEqualQueriesEncodeEqually()
    {
        Query first = Query.builder()
                .measures("Orders.count", "Orders.total")
                .dimensions("Orders.status")
                .build();
        Query second = Query.builder()
                .measures("Orders.count")
                .measures("Orders.total", "Orders.count")
                .dimensions("Orders.status", "Orders.status")
                .build();
        assertEquals(first, second);
        assertEquals(encoder.encode(credentials, first), encoder.encode(credentials, second));

        Query reordered = Query.builder()
                .measures("Orders.total", "Orders.count")
                .dimensions("Orders.status")
                .build();
        assertNotEquals(reordered, first);
        assertNotEquals(encoder.encode(credentials, reordered).getBody(), encoder.encode(credentials, first).getBody());
    }

    private JsonNode encodeQuery(Query query)
            throws IOException
    {
        JsonNode body = MAPPER.readTree(encoder.encode(credentials, query).getBody());
        assertEquals(body.size(), 1);
        return body.get("query");
    }
}

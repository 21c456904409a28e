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
import io.airlift.json.JsonCodec;

import javax.annotation.concurrent.ThreadSafe;

import java.net.URI;

import static com.cubejs.client.CubeApi.JSON_MEDIA_TYPE;
import static com.cubejs.client.CubeApi.LOAD_PATH;
import static com.cubejs.client.CubeApi.USER_AGENT_VALUE;
import static com.google.common.net.HttpHeaders.ACCEPT;
import static com.google.common.net.HttpHeaders.AUTHORIZATION;
import static com.google.common.net.HttpHeaders.CONTENT_TYPE;
import static com.google.common.net.HttpHeaders.USER_AGENT;
import static io.airlift.json.JsonCodec.jsonCodec;
import static java.util.Objects.requireNonNull;

/**
 * Turns a query into the POST request for the load endpoint. Encoding is a pure function
 * of its arguments: equal credentials and equal queries always produce an equal request.
 * Members are sent in the order the query holds them, which is part of query equality.
 */
@ThreadSafe
public class RequestEncoder
{
    private static final JsonCodec<LoadRequest> LOAD_REQUEST_CODEC = jsonCodec(LoadRequest.class);

    public HttpRequestSpec encode(Credentials credentials, Query query)
    {
        requireNonNull(credentials, "credentials is null");
        requireNonNull(query, "query is null");

        ImmutableMap<String, String> headers = ImmutableMap.<String, String>builder()
                .put(AUTHORIZATION, "Bearer " + credentials.getToken())
                .put(CONTENT_TYPE, JSON_MEDIA_TYPE)
                .put(ACCEPT, JSON_MEDIA_TYPE)
                .put(USER_AGENT, USER_AGENT_VALUE)
                .build();

        return new HttpRequestSpec("POST", loadUrl(credentials.getHost()), headers, LOAD_REQUEST_CODEC.toJson(new LoadRequest(query)));
    }

    static URI loadUrl(URI host)
    {
        String base = host.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + LOAD_PATH);
    }
}

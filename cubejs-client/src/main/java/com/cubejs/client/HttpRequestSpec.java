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

import javax.annotation.concurrent.Immutable;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * A fully encoded HTTP request, independent of the HTTP library that sends it.
 */
@Immutable
public final class HttpRequestSpec
{
    private final String method;
    private final URI url;
    private final Map<String, String> headers;
    private final String body;

    public HttpRequestSpec(String method, URI url, Map<String, String> headers, String body)
    {
        this.method = requireNonNull(method, "method is null");
        this.url = requireNonNull(url, "url is null");
        this.headers = ImmutableMap.copyOf(requireNonNull(headers, "headers is null"));
        this.body = requireNonNull(body, "body is null");
    }

    public String getMethod()
    {
        return method;
    }

    public URI getUrl()
    {
        return url;
    }

    public Map<String, String> getHeaders()
    {
        return headers;
    }

    public String getBody()
    {
        return body;
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
        HttpRequestSpec that = (HttpRequestSpec) o;
        return method.equals(that.method) &&
                url.equals(that.url) &&
                headers.equals(that.headers) &&
                body.equals(that.body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(method, url, headers, body);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("method", method)
                .add("url", url)
                .add("headers", headers.keySet())
                .toString();
    }
}

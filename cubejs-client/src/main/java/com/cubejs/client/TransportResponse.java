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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Status, headers and body of an HTTP response as received by a {@link QueryTransport}.
 * Header names are case-insensitive.
 */
@Immutable
public final class TransportResponse
{
    private final int statusCode;
    private final String statusMessage;
    private final ListMultimap<String, String> headers;
    private final String body;

    public TransportResponse(int statusCode, @Nullable String statusMessage, ListMultimap<String, String> headers, String body)
    {
        this.statusCode = statusCode;
        this.statusMessage = statusMessage;
        requireNonNull(headers, "headers is null");
        ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
        headers.forEach((name, value) -> builder.put(name.toLowerCase(Locale.ENGLISH), value));
        this.headers = builder.build();
        this.body = requireNonNull(body, "body is null");
    }

    public static TransportResponse of(int statusCode, String body)
    {
        return new TransportResponse(statusCode, null, ImmutableListMultimap.of(), body);
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    @Nullable
    public String getStatusMessage()
    {
        return statusMessage;
    }

    public ListMultimap<String, String> getHeaders()
    {
        return headers;
    }

    public Optional<String> getHeader(String name)
    {
        List<String> values = headers.get(name.toLowerCase(Locale.ENGLISH));
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    public String getBody()
    {
        return body;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("statusCode", statusCode)
                .add("statusMessage", statusMessage)
                .add("headers", headers)
                .omitNullValues()
                .toString();
    }
}

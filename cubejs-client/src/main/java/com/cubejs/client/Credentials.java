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

import com.google.common.base.CharMatcher;

import javax.annotation.concurrent.Immutable;

import java.net.URI;
import java.util.Objects;

import static com.cubejs.client.ValidationException.checkField;
import static com.cubejs.client.ValidationException.checkNotBlank;
import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * API token and base address of a Cube deployment.
 */
@Immutable
public final class Credentials
{
    private static final CharMatcher TOKEN_CHARACTERS = CharMatcher.inRange((char) 33, (char) 126);

    private final String token;
    private final URI host;

    public Credentials(String token, URI host)
    {
        checkNotBlank(token, "token");
        checkField(TOKEN_CHARACTERS.matchesAllOf(token), "token", "must contain only printable ASCII characters");
        checkField(host != null, "host", "must not be null");
        checkField(host.isAbsolute() && host.getHost() != null, "host", "must be an absolute URI: " + host);
        checkField("http".equalsIgnoreCase(host.getScheme()) || "https".equalsIgnoreCase(host.getScheme()), "host", "scheme must be http or https: " + host);
        checkField(host.getRawQuery() == null && host.getRawFragment() == null, "host", "must not contain a query or fragment: " + host);
        this.token = token;
        this.host = host;
    }

    public static Credentials of(String token, String host)
    {
        checkNotBlank(host, "host");
        URI uri;
        try {
            uri = URI.create(host.trim());
        }
        catch (IllegalArgumentException e) {
            throw new ValidationException("host", "not a valid URI: " + host);
        }
        return new Credentials(token, uri);
    }

    public String getToken()
    {
        return token;
    }

    public URI getHost()
    {
        return host;
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
        Credentials that = (Credentials) o;
        return token.equals(that.token) && host.equals(that.host);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(token, host);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("token", "****")
                .add("host", host)
                .toString();
    }
}

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
import io.airlift.json.JsonCodec;
import io.airlift.log.Logger;
import io.airlift.units.Duration;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static com.cubejs.client.CubeApi.CONTINUE_WAIT;
import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.net.HttpHeaders.RETRY_AFTER;
import static io.airlift.json.JsonCodec.jsonCodec;
import static java.lang.String.format;
import static java.net.HttpURLConnection.HTTP_BAD_GATEWAY;
import static java.net.HttpURLConnection.HTTP_BAD_REQUEST;
import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_NOT_FOUND;
import static java.net.HttpURLConnection.HTTP_OK;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Classifies responses of the load endpoint.
 * <ul>
 * <li>200 with a {@code data} array: ready</li>
 * <li>200 with {@code {"error": "Continue wait"}}: the query is still running</li>
 * <li>429, 5xx and transport failures: retryable</li>
 * <li>everything else, including undecodable bodies: fatal</li>
 * </ul>
 */
@ThreadSafe
public class ResponseInterpreter
{
    private static final Logger log = Logger.get(ResponseInterpreter.class);

    private static final JsonCodec<LoadResponse> LOAD_RESPONSE_CODEC = jsonCodec(LoadResponse.class);
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_MESSAGE_LENGTH = 1000;

    public Outcome interpret(TransportResponse response)
    {
        requireNonNull(response, "response is null");
        int status = response.getStatusCode();
        String body = response.getBody();

        if (status == HTTP_OK) {
            return interpretSuccess(response);
        }
        if (status == HTTP_TOO_MANY_REQUESTS) {
            return retryable("rate limited by server", response);
        }
        if (status == HTTP_BAD_GATEWAY) {
            return retryable("bad gateway", response);
        }
        if (status >= 500 && status < 600) {
            return retryable("server error: " + errorMessage(body), response);
        }
        if (status == HTTP_BAD_REQUEST) {
            return fatal(ErrorType.BAD_REQUEST, "request rejected: " + errorMessage(body), response, null);
        }
        if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
            return fatal(ErrorType.AUTHORIZATION, "authorization failed: " + errorMessage(body), response, null);
        }
        if (status == HTTP_NOT_FOUND) {
            return fatal(ErrorType.NOT_FOUND, "load endpoint not found: " + errorMessage(body), response, null);
        }
        if (status >= 400 && status < 500) {
            return fatal(ErrorType.CLIENT_ERROR, "client error: " + errorMessage(body), response, null);
        }
        return fatal(ErrorType.UNEXPECTED_RESPONSE, "unexpected response: " + errorMessage(body), response, null);
    }

    /**
     * Classifies a request that produced no response at all.
     */
    public Outcome interpretFailure(Throwable failure)
    {
        requireNonNull(failure, "failure is null");
        Throwable cause = failure;
        if (cause instanceof ExecutionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message;
        if (cause instanceof TimeoutException) {
            message = "request timed out";
        }
        else {
            message = format("transport failure: %s", cause);
        }
        return new Outcome.RetryableError(message, OptionalInt.empty(), Optional.empty(), Optional.empty(), cause);
    }

    private Outcome interpretSuccess(TransportResponse response)
    {
        String body = response.getBody();
        LoadResponse decoded;
        try {
            decoded = LOAD_RESPONSE_CODEC.fromJson(body);
        }
        catch (IllegalArgumentException e) {
            return fatal(ErrorType.MALFORMED_RESPONSE, "response is not valid JSON for a load result", response, e);
        }
        if (decoded == null) {
            return fatal(ErrorType.MALFORMED_RESPONSE, "response body is empty", response, null);
        }

        JsonNode error = decoded.getError();
        if (error != null && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.toString();
            if (CONTINUE_WAIT.equals(message)) {
                return new Outcome.ContinueWait(response.getStatusCode(), body, retryAfter(response));
            }
            return fatal(ErrorType.QUERY_ERROR, "query failed: " + truncate(message), response, null);
        }

        if (decoded.getData() == null) {
            return fatal(ErrorType.MALFORMED_RESPONSE, "response has no data array", response, null);
        }
        QueryResult result;
        try {
            result = new QueryResult(decoded.getData(), decoded.getAnnotation(), decoded.getLastRefreshTime());
        }
        catch (IllegalArgumentException e) {
            return fatal(ErrorType.MALFORMED_RESPONSE, "response data is invalid: " + e.getMessage(), response, e);
        }
        return new Outcome.Ready(response.getStatusCode(), result);
    }

    private static Outcome retryable(String message, TransportResponse response)
    {
        return new Outcome.RetryableError(
                message,
                OptionalInt.of(response.getStatusCode()),
                Optional.of(response.getBody()),
                retryAfter(response),
                null);
    }

    private static Outcome fatal(ErrorType errorType, String message, TransportResponse response, @Nullable Throwable cause)
    {
        return new Outcome.FatalError(
                errorType,
                message,
                OptionalInt.of(response.getStatusCode()),
                Optional.of(response.getBody()),
                cause);
    }

    /**
     * Message of a JSON error body ({@code {"error": "..."}}), or the raw body.
     */
    private static String errorMessage(String body)
    {
        if (isNullOrEmpty(body)) {
            return "<empty body>";
        }
        try {
            LoadResponse decoded = LOAD_RESPONSE_CODEC.fromJson(body);
            if (decoded != null && decoded.getError() != null && decoded.getError().isTextual()) {
                return truncate(decoded.getError().asText());
            }
        }
        catch (IllegalArgumentException ignored) {
            // not JSON, fall back to the raw body
        }
        return truncate(body);
    }

    private static Optional<Duration> retryAfter(TransportResponse response)
    {
        Optional<String> header = response.getHeader(RETRY_AFTER);
        if (!header.isPresent()) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            if (seconds >= 0) {
                return Optional.of(new Duration(seconds, SECONDS));
            }
        }
        catch (NumberFormatException e) {
            // HTTP-date form is not supported
        }
        log.debug("Ignoring unsupported %s header: %s", RETRY_AFTER, header.get());
        return Optional.empty();
    }

    private static String truncate(String message)
    {
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}

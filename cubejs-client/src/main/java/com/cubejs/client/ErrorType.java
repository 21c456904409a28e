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

/**
 * Classification of a non-retryable failure.
 */
public enum ErrorType
{
    /**
     * HTTP 400, the server rejected the query.
     */
    BAD_REQUEST,
    /**
     * HTTP 401 or 403.
     */
    AUTHORIZATION,
    NOT_FOUND,
    /**
     * Any other 4xx status except 429.
     */
    CLIENT_ERROR,
    /**
     * A status the load endpoint is not documented to return.
     */
    UNEXPECTED_RESPONSE,
    /**
     * HTTP 200 carrying an error message other than "Continue wait".
     */
    QUERY_ERROR,
    /**
     * Body is not valid JSON or does not match the result schema.
     */
    MALFORMED_RESPONSE,
}

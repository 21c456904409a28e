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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Sends one encoded request. Implementations must bound every call with their own
 * timeout, complete the future exceptionally on transport failures, and abort the
 * request when the returned future is cancelled.
 */
public interface QueryTransport
{
    ListenableFuture<TransportResponse> send(HttpRequestSpec request);
}

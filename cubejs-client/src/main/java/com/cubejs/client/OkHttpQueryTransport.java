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
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Sends requests with OkHttp's asynchronous dispatcher. Cancelling a returned future
 * cancels the underlying call.
 */
public class OkHttpQueryTransport
        implements QueryTransport
{
    private final OkHttpClient httpClient;

    public OkHttpQueryTransport(OkHttpClient httpClient)
    {
        this.httpClient = requireNonNull(httpClient, "httpClient is null");
    }

    @Override
    public ListenableFuture<TransportResponse> send(HttpRequestSpec request)
    {
        requireNonNull(request, "request is null");
        Request.Builder builder = new Request.Builder()
                .url(request.getUrl().toString());
        request.getHeaders().forEach(builder::header);
        builder.method(request.getMethod(), RequestBody.create(
                MediaType.get(CubeApi.JSON_MEDIA_TYPE),
                request.getBody().getBytes(UTF_8)));

        Call call = httpClient.newCall(builder.build());
        SettableFuture<TransportResponse> future = SettableFuture.create();
        future.addListener(() -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        }, directExecutor());
        call.enqueue(new OkHttpCallback(future));
        return future;
    }

    private static final class OkHttpCallback
            implements Callback
    {
        private final SettableFuture<TransportResponse> future;

        public OkHttpCallback(SettableFuture<TransportResponse> future)
        {
            this.future = requireNonNull(future, "future is null");
        }

        @Override
        public void onFailure(Call call, IOException e)
        {
            future.setException(e);
        }

        @Override
        public void onResponse(Call call, Response response)
        {
            try (ResponseBody body = response.body()) {
                ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
                for (Map.Entry<String, List<String>> entry : response.headers().toMultimap().entrySet()) {
                    headers.putAll(entry.getKey(), entry.getValue());
                }
                String content = body == null ? "" : body.string();
                future.set(new TransportResponse(response.code(), response.message(), headers.build(), content));
            }
            catch (IOException | RuntimeException e) {
                future.setException(e);
            }
        }
    }
}

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

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.airlift.log.Logger;
import io.airlift.units.Duration;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Closeable;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Throwables.throwIfUnchecked;
import static com.google.common.util.concurrent.Futures.immediateFailedFuture;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Runs queries against the load endpoint, polling until the result is ready, a
 * non-retryable error occurs, or the {@link PollingPolicy} budget is exhausted.
 * <p>
 * Each call encodes its request once and re-sends it unchanged. Waits between requests
 * are scheduled, so no thread is held while a query is pending unless the caller uses
 * the blocking {@link #execute(Credentials, Query)}.
 */
@ThreadSafe
public class QueryExecutor
        implements Closeable
{
    private static final Logger log = Logger.get(QueryExecutor.class);

    private final QueryTransport transport;
    private final PollingPolicy policy;
    private final WaitStrategy waitStrategy;
    private final Ticker ticker;
    private final QueryExecutionListener listener;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final RequestEncoder requestEncoder = new RequestEncoder();
    private final ResponseInterpreter responseInterpreter = new ResponseInterpreter();
    private final Set<Execution> executions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates an executor on a caller-owned scheduler, which {@link #close()} leaves running.
     */
    public QueryExecutor(QueryTransport transport, PollingPolicy policy, ScheduledExecutorService scheduler)
    {
        this(transport, policy, new ExponentialBackoffWaitStrategy(policy), Ticker.systemTicker(), QueryExecutionListener.NO_OP, scheduler, false);
    }

    public QueryExecutor(
            QueryTransport transport,
            PollingPolicy policy,
            WaitStrategy waitStrategy,
            Ticker ticker,
            QueryExecutionListener listener,
            ScheduledExecutorService scheduler)
    {
        this(transport, policy, waitStrategy, ticker, listener, scheduler, false);
    }

    QueryExecutor(
            QueryTransport transport,
            PollingPolicy policy,
            WaitStrategy waitStrategy,
            Ticker ticker,
            QueryExecutionListener listener,
            ScheduledExecutorService scheduler,
            boolean ownsScheduler)
    {
        this.transport = requireNonNull(transport, "transport is null");
        this.policy = requireNonNull(policy, "policy is null");
        this.waitStrategy = requireNonNull(waitStrategy, "waitStrategy is null");
        this.ticker = requireNonNull(ticker, "ticker is null");
        this.listener = requireNonNull(listener, "listener is null");
        this.scheduler = requireNonNull(scheduler, "scheduler is null");
        this.ownsScheduler = ownsScheduler;
    }

    public PollingPolicy getPolicy()
    {
        return policy;
    }

    /**
     * Starts a query. The returned future fails with {@link QueryFailedException} or
     * {@link QueryTimeoutException}; cancelling it aborts the pending request or wait.
     */
    public ListenableFuture<QueryResult> executeAsync(Credentials credentials, Query query)
    {
        return start(credentials, query).result;
    }

    /**
     * Runs a query and waits for its result.
     *
     * @throws QueryCancelledException if the thread is interrupted or the query is cancelled
     */
    public QueryResult execute(Credentials credentials, Query query)
    {
        Execution execution = start(credentials, query);
        try {
            return execution.result.get();
        }
        catch (InterruptedException e) {
            execution.result.cancel(true);
            Thread.currentThread().interrupt();
            throw execution.cancelled(e);
        }
        catch (CancellationException e) {
            throw execution.cancelled(e);
        }
        catch (ExecutionException e) {
            throwIfUnchecked(e.getCause());
            throw new ClientException("Query execution failed", e.getCause());
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Execution execution : executions) {
            execution.result.cancel(true);
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private Execution start(Credentials credentials, Query query)
    {
        requireNonNull(credentials, "credentials is null");
        requireNonNull(query, "query is null");
        checkState(!closed.get(), "QueryExecutor is closed");

        HttpRequestSpec request = requestEncoder.encode(credentials, query);
        Execution execution = new Execution(request, new PollController(policy, waitStrategy, ticker));
        executions.add(execution);
        execution.result.addListener(() -> executions.remove(execution), directExecutor());
        execution.start();
        return execution;
    }

    private final class Execution
    {
        private final HttpRequestSpec request;
        private final PollController controller;
        private final SettableFuture<QueryResult> result = SettableFuture.create();
        // in-flight request or scheduled wait
        private final AtomicReference<Future<?>> current = new AtomicReference<>();

        private Execution(HttpRequestSpec request, PollController controller)
        {
            this.request = requireNonNull(request, "request is null");
            this.controller = requireNonNull(controller, "controller is null");
        }

        private void start()
        {
            result.addListener(() -> {
                if (result.isCancelled()) {
                    Future<?> future = current.get();
                    if (future != null) {
                        future.cancel(true);
                    }
                }
            }, directExecutor());
            trySendRequest();
        }

        private void sendRequest()
        {
            if (result.isDone()) {
                return;
            }
            log.debug("Sending attempt %s to %s", controller.getAttempts() + 1, request.getUrl());

            ListenableFuture<TransportResponse> sent;
            try {
                sent = transport.send(request);
            }
            catch (RuntimeException e) {
                sent = immediateFailedFuture(e);
            }
            ListenableFuture<TransportResponse> bounded = Futures.withTimeout(sent, policy.getRequestTimeout().toMillis(), MILLISECONDS, scheduler);
            setCurrent(bounded);

            Futures.addCallback(bounded, new FutureCallback<TransportResponse>()
            {
                @Override
                public void onSuccess(TransportResponse response)
                {
                    handle(() -> responseInterpreter.interpret(response));
                }

                @Override
                public void onFailure(Throwable t)
                {
                    if (result.isDone()) {
                        return;
                    }
                    handle(() -> responseInterpreter.interpretFailure(t));
                }
            }, directExecutor());
        }

        private void handle(Supplier<Outcome> supplier)
        {
            try {
                Outcome outcome = supplier.get();
                if (result.isDone()) {
                    return;
                }
                PollDecision decision = controller.onOutcome(outcome);
                switch (decision.getKind()) {
                    case COMPLETE:
                        log.debug("Query completed after %s attempts in %s", controller.getAttempts(), controller.getElapsed());
                        notifyListener(() -> listener.queryCompleted(controller.getAttempts(), controller.getElapsed()));
                        result.set(decision.getResult());
                        return;
                    case FAIL:
                        fail(decision.getFailure());
                        return;
                    case RETRY:
                        retry(outcome, decision.getReason(), decision.getWait());
                        return;
                }
                throw new IllegalStateException("Unknown decision: " + decision.getKind());
            }
            catch (RuntimeException e) {
                log.error(e, "Query execution failed unexpectedly");
                result.setException(e);
            }
        }

        private void fail(ClientException failure)
        {
            if (failure instanceof QueryTimeoutException) {
                log.warn("Giving up on query: %s", failure.getMessage());
            }
            else {
                log.debug("Query failed: %s", failure.getMessage());
            }
            notifyListener(() -> listener.queryFailed(failure));
            result.setException(failure);
        }

        private void retry(Outcome outcome, RetryReason reason, Duration wait)
        {
            int attempt = controller.getAttempts();
            if (reason == RetryReason.CONTINUE_WAIT) {
                log.debug("Query is still being processed after attempt %s, polling again in %s", attempt, wait);
            }
            else {
                log.debug("Attempt %s failed with a retryable error (%s), retrying in %s", attempt, outcome.getMessage(), wait);
            }
            notifyListener(() -> listener.retryScheduled(reason, attempt, wait));

            if (result.isDone()) {
                return;
            }
            setCurrent(scheduler.schedule(this::trySendRequest, wait.roundTo(NANOSECONDS), NANOSECONDS));
        }

        private void trySendRequest()
        {
            try {
                sendRequest();
            }
            catch (RuntimeException e) {
                log.error(e, "Query execution failed unexpectedly");
                result.setException(e);
            }
        }

        private void setCurrent(Future<?> future)
        {
            current.set(future);
            // cancellation may have raced with the assignment
            if (result.isCancelled()) {
                future.cancel(true);
            }
        }

        private void notifyListener(Runnable notification)
        {
            try {
                notification.run();
            }
            catch (RuntimeException e) {
                log.warn(e, "Query execution listener failed");
            }
        }

        private QueryCancelledException cancelled(Throwable cause)
        {
            return new QueryCancelledException(controller.getAttempts(), controller.getElapsed(), cause);
        }
    }
}

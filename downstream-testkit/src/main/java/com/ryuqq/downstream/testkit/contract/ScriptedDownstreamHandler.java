package com.ryuqq.downstream.testkit.contract;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.request.DownstreamRequest;
import com.ryuqq.downstream.core.response.DownstreamResponse;
import com.ryuqq.downstream.core.response.LogStream;
import com.ryuqq.downstream.core.response.LogStreamResponse;
import com.ryuqq.downstream.core.response.Statistics;
import com.ryuqq.downstream.core.spi.DownstreamHandler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link DownstreamHandler} for contract tests.
 *
 * <p>Behaviour is keyed by the final query text of the request:</p>
 * <ul>
 *   <li><strong>Default:</strong> a log-stream response with a single stream labelled
 *       {@code {query="<text>"}} (see {@link #labelsFor(String)})</li>
 *   <li>{@link #respondWith(String, DownstreamResponse)}: fixed response</li>
 *   <li>{@link #failWith(String, RuntimeException)}: handler throws</li>
 *   <li>{@link #delay(String, Duration)}: waits before answering, returning early with
 *       {@link com.ryuqq.downstream.core.exception.QueryCancelledException} when the context is cancelled</li>
 * </ul>
 *
 * <p>Every call is recorded, and the number of concurrent calls is tracked so tests can assert
 * the dispatcher's concurrency bound.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class ScriptedDownstreamHandler implements DownstreamHandler {

    private final Map<String, DownstreamResponse> responses = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final List<DownstreamRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Duration defaultDelay = Duration.ZERO;

    @Override
    public DownstreamResponse execute(QueryContext ctx, DownstreamRequest request) throws InterruptedException {
        requests.add(request);
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            String query = request.query();
            awaitDelay(ctx, delays.getOrDefault(query, defaultDelay));

            RuntimeException failure = failures.get(query);
            if (failure != null) {
                throw failure;
            }
            DownstreamResponse response = responses.get(query);
            if (response != null) {
                return response;
            }
            return LogStreamResponse.success(
                request.direction(),
                request.limit(),
                List.of(new LogStream(labelsFor(query), List.of())),
                Statistics.empty(),
                List.of()
            );
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void awaitDelay(QueryContext ctx, Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return;
        }
        CountDownLatch cancelled = new CountDownLatch(1);
        try (QueryContext.Registration ignored = ctx.onCancel(cancelled::countDown)) {
            if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                ctx.throwIfCancelled();
            }
        }
    }

    /**
     * Label string of the default response for a query.
     *
     * @param query query text
     * @return {@code {query="<text>"}}
     */
    public static String labelsFor(String query) {
        return "{query=\"" + query + "\"}";
    }

    public ScriptedDownstreamHandler respondWith(String query, DownstreamResponse response) {
        responses.put(query, response);
        return this;
    }

    public ScriptedDownstreamHandler failWith(String query, RuntimeException failure) {
        failures.put(query, failure);
        return this;
    }

    public ScriptedDownstreamHandler delay(String query, Duration delay) {
        delays.put(query, delay);
        return this;
    }

    /**
     * Delay applied to queries without a specific delay.
     */
    public ScriptedDownstreamHandler delayAll(Duration delay) {
        this.defaultDelay = delay;
        return this;
    }

    public List<DownstreamRequest> requests() {
        return List.copyOf(requests);
    }

    public int callCount() {
        return requests.size();
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Highest number of concurrent calls observed since the last {@link #clear()}.
     */
    public int maxConcurrent() {
        return maxInFlight.get();
    }

    public void clear() {
        responses.clear();
        failures.clear();
        delays.clear();
        requests.clear();
        maxInFlight.set(0);
        defaultDelay = Duration.ZERO;
    }
}

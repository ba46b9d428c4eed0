package io.llmgate.core.gateway;

import io.llmgate.core.error.AttemptFailureException;
import io.llmgate.core.error.ConfigurationException;
import io.llmgate.core.error.GatewayExhaustedException;
import io.llmgate.core.error.GenerationCancelledException;
import io.llmgate.core.error.ProviderInvocationException;
import io.llmgate.core.error.ProviderTimeoutException;
import io.llmgate.core.model.LlmRequest;
import io.llmgate.core.model.LlmResponse;
import io.llmgate.core.model.Purpose;
import io.llmgate.core.observability.GenerationEvent;
import io.llmgate.core.observability.GenerationEventSink;
import io.llmgate.core.observability.LoggingEventSink;
import io.llmgate.core.provider.LlmProvider;
import io.llmgate.core.provider.ProviderRegistry;
import io.llmgate.core.route.RoutePolicy;
import io.llmgate.core.route.RouteResolver;
import io.llmgate.core.route.TimeoutPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for text generation.
 *
 * <p>For each request the route is resolved, then providers are tried strictly in order, one
 * attempt each. Every attempt races the provider call against its deadline; the loser is
 * cancelled. Any failed attempt moves on to the next provider, including output that is not a
 * JSON object when JSON mode is on. Only exhaustion of the whole route reaches the caller, as
 * {@link GatewayExhaustedException}. Interrupting the calling thread aborts the chain with
 * {@link GenerationCancelledException} without trying the remaining providers.
 *
 * <p>The gateway keeps no per-request state in fields and is safe for concurrent use.
 */
public final class LlmGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LlmGateway.class);
    private static final int MAX_LOGGED_MESSAGE = 300;

    private final ProviderRegistry registry;
    private final RouteResolver resolver;
    private final TimeoutPolicy timeouts;
    private final GenerationEventSink sink;
    private final JsonObjectValidator validator;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public LlmGateway(ProviderRegistry registry, RoutePolicy policy) {
        this(registry, policy, TimeoutPolicy.none(), new LoggingEventSink());
    }

    public LlmGateway(
        ProviderRegistry registry,
        RoutePolicy policy,
        TimeoutPolicy timeouts,
        GenerationEventSink sink
    ) {
        this(registry, policy, timeouts, sink, null);
    }

    /**
     * @param executor runs {@link #generateAsync} chains; when {@code null} the gateway creates
     *                 and owns a daemon pool that {@link #close()} shuts down
     */
    public LlmGateway(
        ProviderRegistry registry,
        RoutePolicy policy,
        TimeoutPolicy timeouts,
        GenerationEventSink sink,
        ExecutorService executor
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = new RouteResolver(registry, Objects.requireNonNull(policy, "policy must not be null"));
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.validator = new JsonObjectValidator();
        this.ownsExecutor = executor == null;
        this.executor = executor == null ? Executors.newCachedThreadPool(daemonThreads()) : executor;
    }

    public LlmResponse generate(LlmRequest request) {
        return generate(request, null);
    }

    /**
     * @param routeOverride explicit provider order, still filtered against enabled providers;
     *                      {@code null} uses the route policy
     * @throws ConfigurationException      if the route resolves to no enabled provider
     * @throws GatewayExhaustedException   if every provider in the route failed
     * @throws GenerationCancelledException if the calling thread was interrupted
     */
    public LlmResponse generate(LlmRequest request, List<String> routeOverride) {
        Objects.requireNonNull(request, "request must not be null");
        List<String> route = resolver.resolve(request.purpose(), routeOverride);
        List<String> attempted = new ArrayList<>(route.size());
        AttemptFailureException lastFailure = null;
        long chainStarted = System.nanoTime();

        for (int index = 0; index < route.size(); index++) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(request, attempted);
            }
            LlmProvider provider = registry.require(route.get(index));
            attempted.add(provider.name());
            OptionalLong timeout = timeouts.resolve(request, registry, route.get(index));

            LOG.debug(
                "Attempt {}/{} purpose={} provider={} timeout_ms={}",
                index + 1,
                route.size(),
                request.purpose().key(),
                provider.name(),
                timeout.isPresent() ? timeout.getAsLong() : "none"
            );

            long started = System.nanoTime();
            try {
                String content = attempt(provider, request, timeout, attempted);
                if (request.jsonMode()) {
                    validator.requireObject(provider.name(), content);
                }
                LlmResponse response = LlmResponse.of(
                    content,
                    provider.name(),
                    provider.model(),
                    elapsedMs(started),
                    index + 1
                );
                emit(GenerationEvent.succeeded(request, response, attempted));
                return response;
            } catch (AttemptFailureException failure) {
                lastFailure = failure;
                LOG.warn(
                    "Provider {} failed for purpose {} ({}): {}",
                    provider.name(),
                    request.purpose().key(),
                    failure.kind().key(),
                    truncate(failure.getMessage())
                );
            }
        }

        GatewayExhaustedException exhausted = new GatewayExhaustedException(attempted, lastFailure);
        emit(GenerationEvent.exhausted(request, attempted, lastFailure.kind(), elapsedMs(chainStarted)));
        throw exhausted;
    }

    /**
     * Runs {@link #generate(LlmRequest, List)} on the gateway executor. Cancelling the returned
     * future with {@code mayInterruptIfRunning} aborts the chain and the in-flight attempt.
     */
    public Future<LlmResponse> generateAsync(LlmRequest request, List<String> routeOverride) {
        Objects.requireNonNull(request, "request must not be null");
        return executor.submit(() -> generate(request, routeOverride));
    }

    public List<String> resolveRoute(Purpose purpose, List<String> routeOverride) {
        return resolver.resolve(purpose, routeOverride);
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public RoutePolicy policy() {
        return resolver.policy();
    }

    /**
     * Shuts down an owned executor and closes the event sink, which drains pending audit writes.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        try {
            sink.close();
        } catch (RuntimeException e) {
            LOG.warn("Generation event sink failed to close: {}", e.getMessage());
        }
    }

    private String attempt(
        LlmProvider provider,
        LlmRequest request,
        OptionalLong timeout,
        List<String> attempted
    ) {
        CompletableFuture<String> call;
        try {
            call = provider.generate(request);
        } catch (RuntimeException e) {
            throw asAttemptFailure(provider, e);
        }
        if (call == null) {
            throw new ProviderInvocationException(provider.name(), "provider returned no pending call");
        }

        String content;
        try {
            content = timeout.isPresent()
                ? call.get(timeout.getAsLong(), TimeUnit.MILLISECONDS)
                : call.get();
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProviderTimeoutException(provider.name(), timeout.getAsLong());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw cancelled(request, attempted);
        } catch (ExecutionException e) {
            throw asAttemptFailure(provider, e.getCause());
        } catch (CancellationException e) {
            throw new ProviderInvocationException(provider.name(), "provider cancelled the call", e);
        }

        if (content == null) {
            throw new ProviderInvocationException(provider.name(), "provider returned no content");
        }
        return content;
    }

    private AttemptFailureException asAttemptFailure(LlmProvider provider, Throwable error) {
        if (error instanceof AttemptFailureException failure) {
            return failure;
        }
        String message = error == null || error.getMessage() == null
            ? "provider call failed"
            : error.getMessage();
        return new ProviderInvocationException(provider.name(), message, error);
    }

    private GenerationCancelledException cancelled(LlmRequest request, List<String> attempted) {
        LOG.info("Generation cancelled purpose={} attempted={}", request.purpose().key(), attempted);
        return new GenerationCancelledException(attempted);
    }

    private void emit(GenerationEvent event) {
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            LOG.warn("Generation event sink failed: {}", e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= MAX_LOGGED_MESSAGE) {
            return value;
        }
        return value.substring(0, MAX_LOGGED_MESSAGE) + "...";
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "llmgate-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.berrys.resilience.retry;

import com.berrys.resilience.RemoteCall;
import com.berrys.resilience.config.RetryPolicy;
import com.berrys.resilience.error.RetriesExhaustedException;
import com.berrys.resilience.observability.RequestIdScope;
import com.berrys.resilience.observability.ResilienceEvent;
import com.berrys.resilience.observability.ResilienceEventListener;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Retries failing operations with exponential backoff and jitter on top of a Resilience4j
 * {@link Retry} built from the caller's {@link RetryPolicy}.
 *
 * <p>The blocking {@link #run} sleeps only the calling thread between attempts.
 * {@link #runReactive} waits on a Reactor timer and {@link #runAsync} on a scheduler,
 * so neither blocks a thread. Every variant gives up with {@link RetriesExhaustedException}.
 */
public class RetryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    public static final String REQUEST_ID_MDC_KEY = RequestIdScope.MDC_KEY;

    /**
     * Reactor context key under which {@link #runReactive} exposes the correlation identifier.
     */
    public static final String REQUEST_ID_CONTEXT_KEY = RequestIdScope.MDC_KEY;

    private final ResilienceEventListener listener;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public RetryExecutor() {
        this(ResilienceEventListener.NO_OP, Clock.systemUTC());
    }

    public RetryExecutor(ResilienceEventListener listener, Clock clock) {
        this(listener, clock, createScheduler(), true);
    }

    /**
     * @param scheduler runs the delayed attempts of {@link #runAsync}; left running on {@link #close()}
     */
    public RetryExecutor(ResilienceEventListener listener, Clock clock, ScheduledExecutorService scheduler) {
        this(listener, clock, scheduler, false);
    }

    private RetryExecutor(ResilienceEventListener listener, Clock clock,
                          ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.listener = listener;
        this.clock = clock;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    public <T> T run(RemoteCall<T> operation, RetryPolicy policy, String name) {
        return run(operation, policy, name, null);
    }

    /**
     * Runs the operation, retrying failures the policy considers retryable.
     *
     * @param operation the call to attempt
     * @param policy retry budget and backoff
     * @param name operation name for logs and events
     * @param requestId correlation identifier put in the logging MDC, may be null
     * @return the first successful result
     * @throws RetriesExhaustedException when the budget is spent or a failure is not retryable
     */
    public <T> T run(RemoteCall<T> operation, RetryPolicy policy, String name, String requestId) {
        String operationName = describe(name);
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = newRetry(operationName, policy, requestId, attempts);
        CheckedSupplier<T> decorated = Retry.decorateCheckedSupplier(retry, () -> {
            attempts.incrementAndGet();
            return operation.call();
        });

        try (RequestIdScope ignored = RequestIdScope.open(requestId)) {
            return decorated.get();
        } catch (Error e) {
            throw e;
        } catch (Throwable e) {
            throw new RetriesExhaustedException(operationName, attempts.get(), e);
        }
    }

    public <T> Mono<T> runReactive(Supplier<? extends Mono<T>> operation, RetryPolicy policy, String name) {
        return runReactive(operation, policy, name, null);
    }

    /**
     * Non-blocking variant: resubscribes to the supplied {@link Mono} after each retryable
     * failure. Each subscription gets its own retry budget. A non-null {@code requestId} is
     * written to the subscriber context under {@link #REQUEST_ID_CONTEXT_KEY}.
     */
    public <T> Mono<T> runReactive(Supplier<? extends Mono<T>> operation, RetryPolicy policy,
                                   String name, String requestId) {
        String operationName = describe(name);
        Mono<T> retried = Mono.defer(() -> {
            AtomicInteger attempts = new AtomicInteger();
            Retry retry = newRetry(operationName, policy, requestId, attempts);
            return Mono.<T>defer(() -> {
                    attempts.incrementAndGet();
                    return operation.get();
                })
                .transformDeferred(RetryOperator.of(retry))
                .onErrorMap(error -> new RetriesExhaustedException(operationName, attempts.get(), error));
        });
        return requestId != null ? retried.contextWrite(Context.of(REQUEST_ID_CONTEXT_KEY, requestId)) : retried;
    }

    public <T> CompletableFuture<T> runAsync(Supplier<? extends CompletionStage<T>> operation,
                                             RetryPolicy policy, String name) {
        return runAsync(operation, policy, name, null);
    }

    /**
     * Non-blocking variant for {@link CompletionStage}-based clients.
     * The returned future fails with {@link RetriesExhaustedException} when retries are exhausted.
     */
    public <T> CompletableFuture<T> runAsync(Supplier<? extends CompletionStage<T>> operation,
                                             RetryPolicy policy, String name, String requestId) {
        String operationName = describe(name);
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = newRetry(operationName, policy, requestId, attempts);
        Supplier<CompletionStage<T>> decorated = Retry.decorateCompletionStage(retry, scheduler, () -> {
            attempts.incrementAndGet();
            try (RequestIdScope ignored = RequestIdScope.open(requestId)) {
                return operation.get();
            }
        });

        CompletableFuture<T> result = new CompletableFuture<>();
        decorated.get().whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(new RetriesExhaustedException(operationName, attempts.get(), unwrap(error)));
            }
        });
        return result;
    }

    private Retry newRetry(String operationName, RetryPolicy policy, String requestId, AtomicInteger attempts) {
        Retry retry = Retry.of(operationName, policy.toRetryConfig());
        retry.getEventPublisher()
            .onRetry(event -> {
                try (RequestIdScope ignored = RequestIdScope.open(requestId)) {
                    long waitMillis = event.getWaitInterval().toMillis();
                    logger.info("Retry attempt {}/{} for {} in {} ms after: {}", event.getNumberOfRetryAttempts(),
                        policy.getMaxRetries(), operationName, waitMillis, messageOf(event.getLastThrowable()));
                    listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.RETRY_SCHEDULED, operationName,
                        "attempt=" + event.getNumberOfRetryAttempts() + " wait=" + waitMillis + "ms", clock.instant()));
                }
            })
            .onError(event -> onGiveUp(operationName, attempts.get(), event.getLastThrowable(), requestId))
            .onIgnoredError(event -> onGiveUp(operationName, attempts.get(), event.getLastThrowable(), requestId));
        return retry;
    }

    private void onGiveUp(String operationName, int attempts, Throwable error, String requestId) {
        try (RequestIdScope ignored = RequestIdScope.open(requestId)) {
            logger.error("Failed to execute {} after {} attempts: {}", operationName, attempts, messageOf(error), error);
            listener.onEvent(ResilienceEvent.of(ResilienceEvent.Type.RETRIES_EXHAUSTED, operationName,
                "attempts=" + attempts, clock.instant()));
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String messageOf(Throwable error) {
        return error != null ? error.getMessage() : null;
    }

    private static String describe(String name) {
        return name != null ? name : "operation";
    }

    private static ScheduledExecutorService createScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retry-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Stops the scheduler this executor created for itself; an injected scheduler is left alone.
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }
}

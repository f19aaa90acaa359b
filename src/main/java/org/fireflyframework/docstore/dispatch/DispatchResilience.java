/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
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

package org.fireflyframework.docstore.dispatch;

import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.fireflyframework.docstore.properties.DocumentStoreProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Resilience4j decorators for workflow start calls, one set per workflow name.
 * <p>
 * From the inside out a call is wrapped in a time limiter, an optional circuit breaker
 * and a retry with exponential backoff. Only {@link WorkflowStartException} and
 * timeouts are retried.
 */
@Slf4j
public class DispatchResilience {

    private final DocumentStoreProperties.DispatchConfig config;
    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final DocumentStoreMetrics metrics;

    private final Map<String, Retry> retries = new ConcurrentHashMap<>();
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Map<String, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();

    public DispatchResilience(DocumentStoreProperties.DispatchConfig config,
                              @Nullable DocumentStoreMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.retryRegistry = createRetryRegistry();
        this.circuitBreakerRegistry = createCircuitBreakerRegistry();
        this.timeLimiterRegistry = createTimeLimiterRegistry();

        log.info("DISPATCH_RESILIENCE_INIT: maxAttempts={}, initialBackoff={}, multiplier={}, callTimeout={}, circuitBreaker={}",
                config.getMaxAttempts(), config.getInitialBackoff(), config.getBackoffMultiplier(),
                config.getCallTimeout(), config.getCircuitBreaker().isEnabled());
    }

    /**
     * Decorates a start call of the given workflow.
     *
     * @param workflowName the workflow name, used to pick the decorators
     * @param call         the call, subscribed once per attempt
     * @param <T>          the result type
     * @return the decorated call
     */
    public <T> Mono<T> decorate(String workflowName, Mono<T> call) {
        Mono<T> decorated = call.transformDeferred(TimeLimiterOperator.of(getOrCreateTimeLimiter(workflowName)));

        if (config.getCircuitBreaker().isEnabled()) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(getOrCreateCircuitBreaker(workflowName)));
        }

        return decorated.transformDeferred(RetryOperator.of(getOrCreateRetry(workflowName)));
    }

    public Retry getOrCreateRetry(String name) {
        return retries.computeIfAbsent(name, n -> {
            Retry retry = retryRegistry.retry(n);
            retry.getEventPublisher()
                    .onRetry(event -> {
                        log.warn("DISPATCH_RETRY: workflow={}, attempt={}, wait={}ms, error={}",
                                event.getName(), event.getNumberOfRetryAttempts(),
                                event.getWaitInterval().toMillis(),
                                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
                        if (metrics != null) {
                            metrics.recordDispatchRetried(event.getName());
                        }
                    })
                    .onError(event ->
                            log.warn("DISPATCH_RETRY_EXHAUSTED: workflow={}, attempts={}",
                                    event.getName(), event.getNumberOfRetryAttempts()));
            return retry;
        });
    }

    public CircuitBreaker getOrCreateCircuitBreaker(String name) {
        return circuitBreakers.computeIfAbsent(name, n -> {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(n);
            cb.getEventPublisher()
                    .onStateTransition(event ->
                            log.info("CIRCUIT_BREAKER_STATE: name={}, from={}, to={}",
                                    event.getCircuitBreakerName(),
                                    event.getStateTransition().getFromState(),
                                    event.getStateTransition().getToState()))
                    .onCallNotPermitted(event ->
                            log.warn("CIRCUIT_BREAKER_REJECTED: name={}", event.getCircuitBreakerName()));
            return cb;
        });
    }

    public TimeLimiter getOrCreateTimeLimiter(String name) {
        return timeLimiters.computeIfAbsent(name, n -> {
            TimeLimiter tl = timeLimiterRegistry.timeLimiter(n);
            tl.getEventPublisher()
                    .onTimeout(event ->
                            log.warn("TIME_LIMITER_TIMEOUT: name={}", event.getTimeLimiterName()));
            return tl;
        });
    }

    // ==================== Registry Creation ====================

    private RetryRegistry createRetryRegistry() {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.getInitialBackoff(), config.getBackoffMultiplier()))
                .retryOnException(DispatchResilience::isTransient)
                .build();

        return RetryRegistry.of(retryConfig);
    }

    private CircuitBreakerRegistry createCircuitBreakerRegistry() {
        var cbConfig = config.getCircuitBreaker();

        CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(cbConfig.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cbConfig.getSlidingWindowSize())
                .minimumNumberOfCalls(cbConfig.getMinimumNumberOfCalls())
                .waitDurationInOpenState(cbConfig.getWaitDurationInOpenState())
                .recordException(DispatchResilience::isTransient)
                .build();

        return CircuitBreakerRegistry.of(defaultConfig);
    }

    private TimeLimiterRegistry createTimeLimiterRegistry() {
        TimeLimiterConfig defaultConfig = TimeLimiterConfig.custom()
                .timeoutDuration(config.getCallTimeout())
                .build();

        return TimeLimiterRegistry.of(defaultConfig);
    }

    static boolean isTransient(Throwable error) {
        return error instanceof WorkflowStartException || error instanceof TimeoutException;
    }
}

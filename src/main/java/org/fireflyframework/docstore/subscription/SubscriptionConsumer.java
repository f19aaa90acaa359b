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

package org.fireflyframework.docstore.subscription;

import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.exception.DispatchFailureException;
import org.fireflyframework.docstore.exception.IntegrityFaultException;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the global event stream for one consumer group and feeds every event to a
 * fixed set of {@link EventHandler}s.
 * <p>
 * Each poll cycle:
 * <ol>
 *   <li>Reads the group's committed position</li>
 *   <li>Streams events after that position (up to {@code batchSize})</li>
 *   <li>For each event in order, runs all handlers concurrently and waits for all of them</li>
 *   <li>Commits the event's position</li>
 * </ol>
 * Failure handling per event:
 * <ul>
 *   <li>{@link DispatchFailureException} from a handler is logged and counted; the
 *       position is still committed</li>
 *   <li>{@link IntegrityFaultException} halts the consumer. It stays {@link ConsumerState#HALTED}
 *       until restarted by an operator</li>
 *   <li>any other error aborts the rest of the batch without committing the failing
 *       event; the next poll delivers it again</li>
 * </ul>
 */
@Slf4j
public class SubscriptionConsumer implements DisposableBean {

    private final String consumerGroup;
    private final EventStore eventStore;
    private final CheckpointStore checkpointStore;
    private final List<EventHandler> handlers;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration shutdownTimeout;
    private final DocumentStoreMetrics metrics;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.CREATED);
    private volatile boolean stopRequested;
    private volatile Disposable subscription;
    private volatile CountDownLatch terminated = new CountDownLatch(0);
    private volatile Throwable haltCause;

    public SubscriptionConsumer(String consumerGroup,
                                EventStore eventStore,
                                CheckpointStore checkpointStore,
                                List<EventHandler> handlers,
                                Duration pollInterval,
                                int batchSize,
                                Duration shutdownTimeout,
                                @Nullable DocumentStoreMetrics metrics) {
        this.consumerGroup = consumerGroup;
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.handlers = List.copyOf(handlers);
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.shutdownTimeout = shutdownTimeout;
        this.metrics = metrics;
    }

    /**
     * Starts the polling loop. Calling it on a running consumer is a no-op; a halted
     * consumer refuses to start.
     */
    public synchronized void start() {
        if (state.get() == ConsumerState.HALTED) {
            log.warn("Consumer group {} is halted and will not be started: {}",
                    consumerGroup, haltCause != null ? haltCause.getMessage() : "unknown cause");
            return;
        }
        if (subscription != null && !subscription.isDisposed()) {
            log.debug("Consumer group {} already running", consumerGroup);
            return;
        }

        log.info("Starting consumer group {} with handlers={}, pollInterval={}, batchSize={}",
                consumerGroup, handlers.stream().map(EventHandler::getName).toList(), pollInterval, batchSize);

        stopRequested = false;
        CountDownLatch latch = new CountDownLatch(1);
        terminated = latch;
        state.set(ConsumerState.RUNNING);

        subscription = Flux.interval(pollInterval)
                .onBackpressureDrop()
                .takeWhile(tick -> !stopRequested && state.get() == ConsumerState.RUNNING)
                .flatMap(tick -> pollOnce()
                        .onErrorResume(error -> {
                            log.warn("Poll of consumer group {} failed, retrying next cycle: {}",
                                    consumerGroup, error.getMessage());
                            return Mono.empty();
                        }), 1)
                .doFinally(signal -> {
                    state.compareAndSet(ConsumerState.RUNNING, ConsumerState.STOPPED);
                    latch.countDown();
                    log.info("Consumer group {} stopped in state {}", consumerGroup, state.get());
                })
                .subscribe();
    }

    /**
     * Requests a graceful stop: the event being processed is finished and committed,
     * then the loop exits. Blocks for at most the configured shutdown timeout, after
     * which the loop is cancelled.
     */
    public void stop() {
        Disposable current = subscription;
        if (current == null || current.isDisposed()) {
            return;
        }

        log.info("Stopping consumer group {}", consumerGroup);
        stopRequested = true;
        try {
            if (!terminated.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer group {} did not stop within {}, cancelling", consumerGroup, shutdownTimeout);
                current.dispose();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.dispose();
        }
        state.compareAndSet(ConsumerState.RUNNING, ConsumerState.STOPPED);
    }

    @Override
    public void destroy() {
        stop();
    }

    /**
     * Runs one poll cycle.
     *
     * @return the number of events processed and committed
     */
    public Mono<Integer> pollOnce() {
        return Mono.defer(() -> {
            if (state.get() == ConsumerState.HALTED) {
                return Mono.error(new IllegalStateException("Consumer group " + consumerGroup + " is halted"));
            }
            return checkpointStore.loadPosition(consumerGroup)
                    .flatMap(position -> eventStore.streamAllEvents(position + 1)
                            .take(batchSize)
                            .takeWhile(event -> !stopRequested)
                            .concatMap(event -> processEvent(event).thenReturn(event))
                            .count()
                            .map(Long::intValue))
                    .doOnNext(count -> {
                        if (count > 0) {
                            log.debug("Consumer group {} processed {} event(s)", consumerGroup, count);
                        }
                    })
                    .doOnError(IntegrityFaultException.class, this::halt);
        });
    }

    private Mono<Void> processEvent(StoredEvent event) {
        List<Mono<Void>> deliveries = handlers.stream()
                .map(handler -> deliver(handler, event))
                .toList();

        return Mono.whenDelayError(deliveries)
                .onErrorMap(SubscriptionConsumer::primaryCause)
                .doOnError(error -> {
                    if (!(error instanceof IntegrityFaultException)) {
                        log.warn("Consumer group {} failed on event {} at position {}, batch aborted: {}",
                                consumerGroup, event.getEventType(), event.getPosition(), error.getMessage());
                    }
                })
                .then(Mono.defer(() -> checkpointStore.commitPosition(consumerGroup, event.getPosition())))
                .doOnSuccess(v -> {
                    if (metrics != null) {
                        metrics.recordConsumerPosition(consumerGroup, event.getPosition());
                    }
                });
    }

    private Mono<Void> deliver(EventHandler handler, StoredEvent event) {
        return Mono.defer(() -> handler.handle(event))
                .onErrorResume(DispatchFailureException.class, e -> {
                    log.warn("Handler {} in consumer group {} could not dispatch workflow '{}' for event {} at position {}: {}",
                            handler.getName(), consumerGroup, e.getWorkflowName(), event.getEventType(),
                            event.getPosition(), e.getMessage());
                    if (metrics != null) {
                        metrics.recordDispatchFailed(e.getWorkflowName());
                    }
                    return Mono.empty();
                });
    }

    private void halt(IntegrityFaultException fault) {
        haltCause = fault;
        state.set(ConsumerState.HALTED);
        stopRequested = true;
        log.error("Consumer group {} halted on integrity fault: {}", consumerGroup, fault.getMessage());
        if (metrics != null) {
            metrics.recordConsumerHalted(consumerGroup);
        }
    }

    /**
     * Picks the error to surface from a combined handler failure. An integrity fault wins
     * over everything else so that it always halts the consumer.
     */
    private static Throwable primaryCause(Throwable error) {
        List<Throwable> causes = Exceptions.unwrapMultiple(error);
        for (Throwable cause : causes) {
            if (cause instanceof IntegrityFaultException) {
                return cause;
            }
        }
        return causes.isEmpty() ? error : causes.get(0);
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public ConsumerState getState() {
        return state.get();
    }

    @Nullable
    public Throwable getHaltCause() {
        return haltCause;
    }
}

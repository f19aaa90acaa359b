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

package org.fireflyframework.docstore.eventsourcing.repository;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.exception.AggregateNotFoundException;
import org.fireflyframework.docstore.exception.ConcurrencyException;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Loads aggregates by replaying their events and saves them by appending the
 * uncommitted events with an optimistic version check.
 * <p>
 * A save whose expected version no longer matches the stream fails with
 * {@link ConcurrencyException} and appends nothing. Callers reload and retry.
 *
 * @param <A> the aggregate type
 */
@Slf4j
public class EventSourcedRepository<A extends AggregateRoot<?>> {

    private final EventStore eventStore;
    private final String aggregateType;
    private final Function<UUID, A> aggregateFactory;
    private final DocumentStoreMetrics metrics;

    public EventSourcedRepository(EventStore eventStore, String aggregateType,
                                  Function<UUID, A> aggregateFactory,
                                  @Nullable DocumentStoreMetrics metrics) {
        this.eventStore = eventStore;
        this.aggregateType = aggregateType;
        this.aggregateFactory = aggregateFactory;
        this.metrics = metrics;
    }

    /**
     * Rebuilds an aggregate from its full history.
     *
     * @param aggregateId the aggregate id
     * @return the aggregate, or {@link AggregateNotFoundException} if no events of this
     *         aggregate type exist for the id
     */
    public Mono<A> load(UUID aggregateId) {
        log.debug("Loading {} aggregate: {}", aggregateType, aggregateId);

        return eventStore.loadEventStream(aggregateId)
                .map(StoredEvent::getEnvelope)
                .collectList()
                .filter(history -> !history.isEmpty()
                        && aggregateType.equals(history.get(0).getAggregateType()))
                .switchIfEmpty(Mono.error(() -> new AggregateNotFoundException(aggregateType, aggregateId)))
                .map(history -> {
                    A aggregate = aggregateFactory.apply(aggregateId);
                    aggregate.loadFromHistory(history);
                    log.debug("Loaded {} aggregate: id={}, version={}",
                            aggregateType, aggregateId, aggregate.getCurrentVersion());
                    return aggregate;
                });
    }

    /**
     * Appends the uncommitted events of an aggregate.
     * <p>
     * The expected version is the current version minus the number of uncommitted events.
     * On success the events are marked as committed.
     *
     * @param aggregate the aggregate to save
     * @return the saved aggregate
     */
    public Mono<A> save(A aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            log.debug("No uncommitted events for {} aggregate: {}", aggregateType, aggregate.getId());
            return Mono.just(aggregate);
        }

        List<EventEnvelope> uncommittedEvents = aggregate.getUncommittedEvents();
        long expectedVersion = aggregate.getExpectedVersion();

        log.debug("Saving {} aggregate: id={}, uncommittedEvents={}, expectedVersion={}",
                aggregateType, aggregate.getId(), uncommittedEvents.size(), expectedVersion);

        return eventStore.appendEvents(aggregate.getId(), aggregateType, uncommittedEvents, expectedVersion)
                .doOnSuccess(appended -> {
                    aggregate.markEventsAsCommitted();
                    if (metrics != null) {
                        metrics.recordEventsAppended(aggregateType, appended.size());
                    }
                    log.debug("Saved {} aggregate: id={}, newVersion={}",
                            aggregateType, aggregate.getId(), aggregate.getCurrentVersion());
                })
                .doOnError(ConcurrencyException.class, e -> {
                    if (metrics != null) {
                        metrics.recordConcurrencyConflict(aggregateType);
                    }
                    log.debug("Concurrency conflict saving {} aggregate {}: {}",
                            aggregateType, aggregate.getId(), e.getMessage());
                })
                .thenReturn(aggregate);
    }

    public String getAggregateType() {
        return aggregateType;
    }
}

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

package org.fireflyframework.docstore.projection;

import org.fireflyframework.docstore.eventsourcing.event.EventPayload;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.exception.IntegrityFaultException;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.UUID;

/**
 * Maintains one read-model document per aggregate of a given type.
 * <p>
 * An event is applied only if it is the next one the document expects:
 * <ul>
 *   <li>no document yet and the event is the creation event at version 1 - the
 *       document is created</li>
 *   <li>{@code version <= lastAppliedVersion} - the event was already applied and is
 *       skipped, leaving the document untouched</li>
 *   <li>{@code version == lastAppliedVersion + 1} - the event is applied</li>
 *   <li>anything else is a gap and fails with {@link IntegrityFaultException}</li>
 * </ul>
 *
 * @param <D> the document type
 * @param <E> the event family of the aggregate
 */
@Slf4j
public abstract class AggregateProjection<D extends ReadModel, E extends EventPayload> {

    private final String aggregateType;
    private final Class<E> eventClass;
    private final ReadModelStore<D> store;
    private final DocumentStoreMetrics metrics;

    protected AggregateProjection(String aggregateType, Class<E> eventClass,
                                  ReadModelStore<D> store, @Nullable DocumentStoreMetrics metrics) {
        this.aggregateType = aggregateType;
        this.eventClass = eventClass;
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Whether the event creates the aggregate.
     */
    protected abstract boolean isCreation(E event);

    /**
     * Folds one event into the document. {@code current} is null only for the
     * creation event.
     *
     * @param current the current document, or null
     * @param event   the stored event, for version and timestamp
     * @param payload the typed payload
     * @return the new document, with {@code lastAppliedVersion} set to the event version
     */
    protected abstract D fold(@Nullable D current, StoredEvent event, E payload);

    public String getAggregateType() {
        return aggregateType;
    }

    public ReadModelStore<D> getStore() {
        return store;
    }

    /**
     * Applies one event to its aggregate's document.
     *
     * @param event the event, which must belong to this projection's aggregate type
     * @return the outcome
     */
    public Mono<ProjectionOutcome> project(StoredEvent event) {
        E payload = eventClass.cast(event.getPayload());
        UUID aggregateId = event.getAggregateId();

        return store.findById(aggregateId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(existing -> {
                    if (existing.isEmpty()) {
                        if (!isCreation(payload) || event.getVersion() != 1) {
                            return Mono.error(new IntegrityFaultException(aggregateId, 1, event.getVersion()));
                        }
                        return apply(null, event, payload);
                    }

                    long lastApplied = existing.get().getLastAppliedVersion();
                    if (event.getVersion() <= lastApplied) {
                        log.debug("Skipping {} v{} for {} {}: document already at v{}",
                                event.getEventType(), event.getVersion(), aggregateType, aggregateId, lastApplied);
                        if (metrics != null) {
                            metrics.recordProjectionSkipped(aggregateType, event.getEventType());
                        }
                        return Mono.just(ProjectionOutcome.SKIPPED);
                    }
                    if (event.getVersion() != lastApplied + 1) {
                        return Mono.error(new IntegrityFaultException(aggregateId, lastApplied + 1, event.getVersion()));
                    }
                    return apply(existing.get(), event, payload);
                });
    }

    private Mono<ProjectionOutcome> apply(@Nullable D current, StoredEvent event, E payload) {
        D updated = fold(current, event, payload);
        return store.upsert(updated)
                .doOnSuccess(v -> {
                    log.debug("Projected {} v{} onto {} {}",
                            event.getEventType(), event.getVersion(), aggregateType, event.getAggregateId());
                    if (metrics != null) {
                        metrics.recordProjectionApplied(aggregateType, event.getEventType());
                    }
                })
                .thenReturn(ProjectionOutcome.APPLIED);
    }
}

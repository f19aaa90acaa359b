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

import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.subscription.EventHandler;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes events to the projection of their aggregate type.
 * <p>
 * Integrity faults raised by a projection are propagated unchanged so that the
 * subscription consumer halts.
 */
@Slf4j
public class ProjectionEngine implements EventHandler {

    private final Map<String, AggregateProjection<?, ?>> projections = new LinkedHashMap<>();

    public ProjectionEngine(List<AggregateProjection<?, ?>> projections) {
        for (AggregateProjection<?, ?> projection : projections) {
            if (this.projections.putIfAbsent(projection.getAggregateType(), projection) != null) {
                throw new IllegalArgumentException(
                        "Duplicate projection for aggregate type " + projection.getAggregateType());
            }
        }
        log.info("ProjectionEngine initialized for aggregate types {}", this.projections.keySet());
    }

    @Override
    public String getName() {
        return "projection-engine";
    }

    @Override
    public Mono<Void> handle(StoredEvent event) {
        return project(event).then();
    }

    /**
     * Applies one event to the matching projection.
     *
     * @param event the event
     * @return the outcome, {@link ProjectionOutcome#IGNORED} for unknown aggregate types
     */
    public Mono<ProjectionOutcome> project(StoredEvent event) {
        AggregateProjection<?, ?> projection = projections.get(event.getAggregateType());
        if (projection == null) {
            log.debug("No projection for aggregate type {}, ignoring event {}",
                    event.getAggregateType(), event.getEventType());
            return Mono.just(ProjectionOutcome.IGNORED);
        }
        return projection.project(event);
    }
}

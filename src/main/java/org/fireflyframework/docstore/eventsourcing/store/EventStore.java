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

package org.fireflyframework.docstore.eventsourcing.store;

import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.exception.ConcurrencyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of domain events.
 * <p>
 * Every aggregate owns a stream whose versions run 1, 2, 3, ... without gaps.
 * All appended events also receive a strictly increasing global position that
 * subscription consumers use as their cursor.
 */
public interface EventStore {

    /**
     * Atomically appends events to the stream of one aggregate.
     * <p>
     * The append succeeds iff the stream is currently at {@code expectedVersion};
     * otherwise nothing is appended.
     *
     * @param aggregateId     the aggregate id
     * @param aggregateType   the aggregate type name
     * @param events          the events, versions {@code expectedVersion + 1} onwards
     * @param expectedVersion the version the stream must be at
     * @return the appended events with their global positions
     * @throws ConcurrencyException (as an error signal) if the stream moved on
     */
    Mono<List<StoredEvent>> appendEvents(UUID aggregateId, String aggregateType,
                                         List<EventEnvelope> events, long expectedVersion);

    /**
     * Reads all events of one aggregate in version order.
     *
     * @param aggregateId the aggregate id
     * @return the events, empty if the aggregate is unknown
     */
    Flux<StoredEvent> loadEventStream(UUID aggregateId);

    /**
     * Returns the current version of an aggregate stream, 0 if it does not exist.
     *
     * @param aggregateId the aggregate id
     * @return the current version
     */
    Mono<Long> getCurrentVersion(UUID aggregateId);

    /**
     * Reads the global stream starting at {@code fromPosition} (inclusive).
     *
     * @param fromPosition the first position to read
     * @return the events in position order
     */
    Flux<StoredEvent> streamAllEvents(long fromPosition);

    /**
     * Returns the position of the last appended event, 0 if the log is empty.
     *
     * @return the current global position
     */
    Mono<Long> getCurrentGlobalPosition();
}

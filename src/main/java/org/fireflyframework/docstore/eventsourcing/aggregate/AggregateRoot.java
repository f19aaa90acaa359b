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

package org.fireflyframework.docstore.eventsourcing.aggregate;

import lombok.Getter;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.EventPayload;
import org.fireflyframework.docstore.exception.IntegrityFaultException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for event-sourced aggregates.
 * <p>
 * Subclasses expose command methods that validate their input against the current state
 * and then call {@link #applyChange(EventPayload)}. State is only ever mutated by
 * {@link #apply(EventPayload)}, which must be a pure function of the current state and
 * the event so that replaying the same history always yields the same aggregate.
 * <p>
 * Versioning:
 * <ul>
 *   <li>a fresh aggregate is at version 0</li>
 *   <li>every applied event bumps the version by exactly one</li>
 *   <li>{@link #loadFromHistory(List)} rejects histories with gaps or reordering</li>
 * </ul>
 *
 * @param <E> the sealed event family of the aggregate
 */
public abstract class AggregateRoot<E extends EventPayload> {

    @Getter
    private final UUID id;

    @Getter
    private final String aggregateType;

    private final Class<E> eventClass;
    private final Clock clock;
    private final List<EventEnvelope> uncommittedEvents = new ArrayList<>();

    @Getter
    private long currentVersion;

    protected AggregateRoot(UUID id, String aggregateType, Class<E> eventClass, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.eventClass = Objects.requireNonNull(eventClass, "eventClass");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Mutates the aggregate state for one event. Must not validate or throw for
     * events the aggregate itself produced.
     *
     * @param event the event to fold into the state
     */
    protected abstract void apply(E event);

    /**
     * Records a new event: applies it to the state, bumps the version and buffers it
     * until the repository commits it.
     *
     * @param event the event payload
     */
    protected void applyChange(E event) {
        EventEnvelope envelope = EventEnvelope.builder()
                .eventId(UUID.randomUUID())
                .eventType(event.eventType())
                .aggregateId(id)
                .aggregateType(aggregateType)
                .version(currentVersion + 1)
                .timestamp(clock.instant())
                .payload(event)
                .build();
        apply(event);
        currentVersion = envelope.getVersion();
        uncommittedEvents.add(envelope);
    }

    /**
     * Rebuilds the state by replaying committed events in version order.
     *
     * @param history the committed events of this aggregate
     * @throws IntegrityFaultException if the versions are not exactly 1, 2, 3, ...
     */
    public void loadFromHistory(List<EventEnvelope> history) {
        for (EventEnvelope envelope : history) {
            long expected = currentVersion + 1;
            if (envelope.getVersion() != expected) {
                throw new IntegrityFaultException(id, expected, envelope.getVersion());
            }
            if (!eventClass.isInstance(envelope.getPayload())) {
                throw new IllegalArgumentException("Event " + envelope.getEventType()
                        + " does not belong to aggregate type " + aggregateType);
            }
            apply(eventClass.cast(envelope.getPayload()));
            currentVersion = envelope.getVersion();
        }
    }

    /**
     * Returns the version the event store must be at for the uncommitted events to be
     * appended.
     *
     * @return the current version minus the number of uncommitted events
     */
    public long getExpectedVersion() {
        return currentVersion - uncommittedEvents.size();
    }

    public List<EventEnvelope> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Clears the uncommitted buffer after a successful append.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    protected Clock getClock() {
        return clock;
    }
}

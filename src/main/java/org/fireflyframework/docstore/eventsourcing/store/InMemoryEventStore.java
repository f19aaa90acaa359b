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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.exception.ConcurrencyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link EventStore} kept in process memory.
 * <p>
 * Events are held in their encoded JSON form so that every read goes through the same
 * codec a durable store would use. Appends are serialized on the store instance, which
 * makes the version check and the write one atomic step.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final EventCodec codec;
    private final List<String> entries = new ArrayList<>();
    private final Map<UUID, List<Integer>> streams = new HashMap<>();
    private final Map<UUID, String> streamTypes = new HashMap<>();

    public InMemoryEventStore(EventCodec codec) {
        this.codec = codec;
    }

    @Override
    public Mono<List<StoredEvent>> appendEvents(UUID aggregateId, String aggregateType,
                                                List<EventEnvelope> events, long expectedVersion) {
        return Mono.fromCallable(() -> append(aggregateId, aggregateType, events, expectedVersion));
    }

    private synchronized List<StoredEvent> append(UUID aggregateId, String aggregateType,
                                                  List<EventEnvelope> events, long expectedVersion) {
        List<Integer> stream = streams.getOrDefault(aggregateId, List.of());
        long actualVersion = stream.size();
        if (actualVersion != expectedVersion) {
            throw new ConcurrencyException(aggregateId, expectedVersion, actualVersion);
        }
        String existingType = streamTypes.get(aggregateId);
        if (existingType != null && !existingType.equals(aggregateType)) {
            throw new IllegalArgumentException("Aggregate " + aggregateId + " is a " + existingType
                    + ", cannot append " + aggregateType + " events");
        }

        long version = expectedVersion;
        for (EventEnvelope event : events) {
            version++;
            if (!event.getAggregateId().equals(aggregateId) || event.getVersion() != version) {
                throw new IllegalArgumentException("Event " + event.getEventType() + " v" + event.getVersion()
                        + " does not continue stream " + aggregateId + " at version " + version);
            }
        }

        // encode the whole batch before touching the log so a failing event appends nothing
        List<StoredEvent> appended = new ArrayList<>(events.size());
        List<String> encoded = new ArrayList<>(events.size());
        for (EventEnvelope event : events) {
            StoredEvent stored = new StoredEvent(entries.size() + appended.size() + 1L, event);
            encoded.add(codec.encode(stored));
            appended.add(stored);
        }

        List<Integer> updated = new ArrayList<>(stream);
        for (String entry : encoded) {
            entries.add(entry);
            updated.add(entries.size() - 1);
        }
        streams.put(aggregateId, updated);
        streamTypes.putIfAbsent(aggregateId, aggregateType);
        log.debug("Appended {} event(s) to {} {}, now at version {}",
                events.size(), aggregateType, aggregateId, version);
        return appended;
    }

    @Override
    public Flux<StoredEvent> loadEventStream(UUID aggregateId) {
        return Flux.defer(() -> Flux.fromIterable(snapshotStream(aggregateId)))
                .map(codec::decode);
    }

    @Override
    public Mono<Long> getCurrentVersion(UUID aggregateId) {
        return Mono.fromCallable(() -> (long) snapshotStream(aggregateId).size());
    }

    @Override
    public Flux<StoredEvent> streamAllEvents(long fromPosition) {
        return Flux.defer(() -> Flux.fromIterable(snapshotLog(fromPosition)))
                .map(codec::decode);
    }

    @Override
    public Mono<Long> getCurrentGlobalPosition() {
        return Mono.fromCallable(this::size);
    }

    private synchronized long size() {
        return entries.size();
    }

    private synchronized List<String> snapshotStream(UUID aggregateId) {
        List<Integer> stream = streams.getOrDefault(aggregateId, List.of());
        List<String> rows = new ArrayList<>(stream.size());
        for (Integer index : stream) {
            rows.add(entries.get(index));
        }
        return rows;
    }

    private synchronized List<String> snapshotLog(long fromPosition) {
        if (fromPosition > entries.size()) {
            return List.of();
        }
        int from = (int) Math.max(0, fromPosition - 1);
        return new ArrayList<>(entries.subList(from, entries.size()));
    }
}

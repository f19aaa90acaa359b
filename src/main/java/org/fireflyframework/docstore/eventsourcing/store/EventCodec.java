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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.EventPayload;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Converts stored events to and from their JSON wire format.
 * <p>
 * Wire shape:
 * <pre>
 * {
 *   "event_id": "...", "event_type": "page.created",
 *   "aggregate_id": "...", "aggregate_type": "page",
 *   "version": 1, "position": 42,
 *   "timestamp": "2025-01-01T00:00:00Z",
 *   "payload": { ... }
 * }
 * </pre>
 * Payloads are resolved back to their classes through the {@code event_type} name.
 */
@Slf4j
public class EventCodec {

    private final ObjectMapper objectMapper;
    private final Map<String, Class<? extends EventPayload>> payloadTypes = new LinkedHashMap<>();

    public EventCodec(ObjectMapper objectMapper, Collection<Class<? extends EventPayload>> payloadClasses) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        for (Class<? extends EventPayload> payloadClass : payloadClasses) {
            String type = EventPayload.typeOf(payloadClass);
            Class<? extends EventPayload> previous = payloadTypes.putIfAbsent(type, payloadClass);
            if (previous != null && previous != payloadClass) {
                throw new IllegalStateException("Event type '" + type + "' is declared by both "
                        + previous.getName() + " and " + payloadClass.getName());
            }
        }
        log.debug("EventCodec registered {} event types", payloadTypes.size());
    }

    public Set<String> getRegisteredTypes() {
        return payloadTypes.keySet();
    }

    /**
     * Encodes a stored event.
     *
     * @param event the event
     * @return the JSON document
     * @throws EventSerializationException if the payload cannot be serialized
     */
    public String encode(StoredEvent event) {
        EventEnvelope envelope = event.getEnvelope();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event_id", envelope.getEventId().toString());
        node.put("event_type", envelope.getEventType());
        node.put("aggregate_id", envelope.getAggregateId().toString());
        node.put("aggregate_type", envelope.getAggregateType());
        node.put("version", envelope.getVersion());
        node.put("position", event.getPosition());
        node.put("timestamp", envelope.getTimestamp().toString());
        try {
            node.set("payload", objectMapper.valueToTree(envelope.getPayload()));
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to encode event " + envelope.getEventId(), e);
        }
    }

    /**
     * Decodes a stored event.
     *
     * @param json the JSON document
     * @return the event
     * @throws EventSerializationException if the document is malformed or the type unknown
     */
    public StoredEvent decode(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            String eventType = node.path("event_type").asText();
            Class<? extends EventPayload> payloadClass = payloadTypes.get(eventType);
            if (payloadClass == null) {
                throw new EventSerializationException("Unknown event type '" + eventType + "'");
            }
            EventEnvelope envelope = EventEnvelope.builder()
                    .eventId(UUID.fromString(node.path("event_id").asText()))
                    .eventType(eventType)
                    .aggregateId(UUID.fromString(node.path("aggregate_id").asText()))
                    .aggregateType(node.path("aggregate_type").asText())
                    .version(node.path("version").asLong())
                    .timestamp(Instant.parse(node.path("timestamp").asText()))
                    .payload(objectMapper.treeToValue(node.path("payload"), payloadClass))
                    .build();
            return new StoredEvent(node.path("position").asLong(), envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to decode event", e);
        }
    }
}

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

package org.fireflyframework.docstore.eventsourcing.event;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as it exists once appended to the log, tagged with its global position.
 * <p>
 * Positions start at 1 and are strictly increasing across all aggregates.
 */
@Value
public class StoredEvent {

    long position;

    @NonNull
    EventEnvelope envelope;

    public UUID getAggregateId() {
        return envelope.getAggregateId();
    }

    public String getAggregateType() {
        return envelope.getAggregateType();
    }

    public String getEventType() {
        return envelope.getEventType();
    }

    public long getVersion() {
        return envelope.getVersion();
    }

    public Instant getTimestamp() {
        return envelope.getTimestamp();
    }

    public EventPayload getPayload() {
        return envelope.getPayload();
    }
}

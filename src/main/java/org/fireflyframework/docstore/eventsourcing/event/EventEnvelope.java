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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one change to one aggregate.
 * <p>
 * {@code version} is the aggregate version that results from applying this event,
 * so the first event of every aggregate carries version 1.
 */
@Value
@Builder(toBuilder = true)
public class EventEnvelope {

    @NonNull
    UUID eventId;

    @NonNull
    String eventType;

    @NonNull
    UUID aggregateId;

    @NonNull
    String aggregateType;

    long version;

    @NonNull
    Instant timestamp;

    @NonNull
    EventPayload payload;
}

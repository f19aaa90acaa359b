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

/**
 * Marker for the immutable payload of a domain event.
 * <p>
 * Payloads carry only the business facts of the change. Identity, version and
 * timestamp live on the {@link EventEnvelope} that wraps them.
 */
public interface EventPayload {

    /**
     * Returns the event type name declared through {@link DomainEvent}.
     *
     * @return the event type name
     * @throws IllegalStateException if the payload class is not annotated
     */
    default String eventType() {
        return typeOf(getClass());
    }

    /**
     * Resolves the event type name of a payload class.
     *
     * @param payloadClass the payload class
     * @return the declared event type name
     */
    static String typeOf(Class<?> payloadClass) {
        DomainEvent annotation = payloadClass.getAnnotation(DomainEvent.class);
        if (annotation == null) {
            throw new IllegalStateException(
                    "Event payload " + payloadClass.getName() + " is missing @DomainEvent");
        }
        return annotation.value();
    }
}

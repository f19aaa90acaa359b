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

package org.fireflyframework.docstore.dispatch;

import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Maps one kind of event to the workflow it triggers.
 *
 * @param eventType    the event type name that qualifies
 * @param workflowName the workflow to start
 * @param condition    extra filter on the event
 * @param payload      builds the workflow input from the event
 */
public record DispatchRule(
        String eventType,
        String workflowName,
        Predicate<StoredEvent> condition,
        Function<StoredEvent, Map<String, Object>> payload
) {

    public boolean matches(StoredEvent event) {
        return eventType.equals(event.getEventType()) && condition.test(event);
    }
}

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

package org.fireflyframework.docstore.subscription;

import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import reactor.core.publisher.Mono;

/**
 * Receives events from a {@link SubscriptionConsumer}.
 * <p>
 * Delivery is at-least-once: after a crash between the handler's side effects and the
 * position commit, the same event is delivered again. Handlers must therefore be
 * idempotent.
 */
public interface EventHandler {

    /**
     * Name used in logs.
     */
    String getName();

    /**
     * Handles one event. The returned {@link Mono} completes once every side effect
     * of the event is durable.
     *
     * @param event the event
     * @return completion, or an error to abort the batch
     */
    Mono<Void> handle(StoredEvent event);
}

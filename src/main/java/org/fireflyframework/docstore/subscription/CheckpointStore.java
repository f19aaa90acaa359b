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

import reactor.core.publisher.Mono;

/**
 * Durable record of the last processed global position of each consumer group.
 */
public interface CheckpointStore {

    /**
     * Returns the last committed position of a group, 0 if it never committed.
     *
     * @param consumerGroup the consumer group
     * @return the committed position
     */
    Mono<Long> loadPosition(String consumerGroup);

    /**
     * Records that every event up to and including {@code position} was processed.
     * A position lower than the committed one is ignored.
     *
     * @param consumerGroup the consumer group
     * @param position      the processed position
     * @return completion
     */
    Mono<Void> commitPosition(String consumerGroup, long position);
}

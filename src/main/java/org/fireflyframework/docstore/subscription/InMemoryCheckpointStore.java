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

import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CheckpointStore} kept in process memory. Positions are lost on restart.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentHashMap<String, Long> positions = new ConcurrentHashMap<>();

    @Override
    public Mono<Long> loadPosition(String consumerGroup) {
        return Mono.fromSupplier(() -> positions.getOrDefault(consumerGroup, 0L));
    }

    @Override
    public Mono<Void> commitPosition(String consumerGroup, long position) {
        return Mono.fromRunnable(() -> positions.merge(consumerGroup, position, Math::max));
    }
}

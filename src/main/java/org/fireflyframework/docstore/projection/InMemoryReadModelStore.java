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

package org.fireflyframework.docstore.projection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReadModelStore} kept in process memory.
 *
 * @param <D> the document type
 */
public class InMemoryReadModelStore<D extends ReadModel> implements ReadModelStore<D> {

    private final ConcurrentHashMap<UUID, D> documents = new ConcurrentHashMap<>();

    @Override
    public Mono<D> findById(UUID id) {
        return Mono.justOrEmpty(documents.get(id));
    }

    @Override
    public Mono<Void> upsert(D document) {
        return Mono.fromRunnable(() -> documents.put(document.getId(), document));
    }

    @Override
    public Flux<D> findAll() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(documents.values())));
    }
}

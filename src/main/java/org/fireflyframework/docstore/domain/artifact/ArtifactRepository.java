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

package org.fireflyframework.docstore.domain.artifact;

import org.fireflyframework.docstore.eventsourcing.repository.EventSourcedRepository;
import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.springframework.lang.Nullable;

import java.time.Clock;

/**
 * Repository of {@link ArtifactAggregate}s.
 */
public class ArtifactRepository extends EventSourcedRepository<ArtifactAggregate> {

    public ArtifactRepository(EventStore eventStore, Clock clock, @Nullable DocumentStoreMetrics metrics) {
        super(eventStore, ArtifactAggregate.AGGREGATE_TYPE, id -> new ArtifactAggregate(id, clock), metrics);
    }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    @DisplayName("should start unknown groups at position zero")
    void shouldStartAtZero() {
        StepVerifier.create(store.loadPosition("fresh"))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should never move a committed position backwards")
    void shouldBeMonotonic() {
        store.commitPosition("projector", 7).block();
        store.commitPosition("projector", 3).block();

        StepVerifier.create(store.loadPosition("projector"))
                .expectNext(7L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should track groups independently")
    void shouldTrackGroupsIndependently() {
        store.commitPosition("projector", 5).block();
        store.commitPosition("dispatcher", 2).block();

        StepVerifier.create(store.loadPosition("dispatcher"))
                .expectNext(2L)
                .verifyComplete();
    }
}

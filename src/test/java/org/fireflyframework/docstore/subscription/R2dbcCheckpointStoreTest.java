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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link R2dbcCheckpointStore} against a mocked {@link DatabaseClient}.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<Long> rowsFetchSpec;

    @Mock
    private FetchSpec<Map<String, Object>> fetchSpec;

    private R2dbcCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcCheckpointStore(databaseClient, Clock.fixed(NOW, ZoneOffset.UTC));
        when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
    }

    @Nested
    @DisplayName("Load")
    class LoadTests {

        @Test
        @DisplayName("should return the stored position")
        @SuppressWarnings("unchecked")
        void shouldReturnStoredPosition() {
            when(executeSpec.map(any(Function.class))).thenReturn(rowsFetchSpec);
            when(rowsFetchSpec.one()).thenReturn(Mono.just(42L));

            StepVerifier.create(store.loadPosition("projector"))
                    .expectNext(42L)
                    .verifyComplete();

            verify(executeSpec).bind("consumerGroup", "projector");
        }

        @Test
        @DisplayName("should default to zero when no row exists")
        @SuppressWarnings("unchecked")
        void shouldDefaultToZero() {
            when(executeSpec.map(any(Function.class))).thenReturn(rowsFetchSpec);
            when(rowsFetchSpec.one()).thenReturn(Mono.empty());

            StepVerifier.create(store.loadPosition("projector"))
                    .expectNext(0L)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Commit")
    class CommitTests {

        @Test
        @DisplayName("should upsert the position only when it moves forward")
        void shouldUpsertForwardOnly() {
            when(executeSpec.fetch()).thenReturn(fetchSpec);
            when(fetchSpec.rowsUpdated()).thenReturn(Mono.just(1L));

            StepVerifier.create(store.commitPosition("dispatcher", 17))
                    .verifyComplete();

            ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
            verify(databaseClient).sql(sql.capture());
            assertThat(sql.getValue())
                    .contains("INSERT INTO consumer_positions")
                    .contains("ON CONFLICT (consumer_group)")
                    .contains("WHERE consumer_positions.position < EXCLUDED.position");
            verify(executeSpec).bind("consumerGroup", "dispatcher");
            verify(executeSpec).bind("position", 17L);
            verify(executeSpec).bind("lastUpdated", NOW);
        }

        @Test
        @DisplayName("should complete when the stored position is already ahead")
        void shouldCompleteWhenNotAhead() {
            when(executeSpec.fetch()).thenReturn(fetchSpec);
            when(fetchSpec.rowsUpdated()).thenReturn(Mono.just(0L));

            StepVerifier.create(store.commitPosition("dispatcher", 3))
                    .verifyComplete();
        }
    }
}

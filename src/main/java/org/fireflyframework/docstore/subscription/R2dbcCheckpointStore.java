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

import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * {@link CheckpointStore} backed by the {@code consumer_positions} table.
 * <p>
 * The upsert only moves a cursor forward, so a late commit from a slow replica can
 * never rewind a group. Schema: {@code schema/consumer_positions.sql}.
 */
@Slf4j
public class R2dbcCheckpointStore implements CheckpointStore {

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public R2dbcCheckpointStore(DatabaseClient databaseClient, Clock clock) {
        this.databaseClient = databaseClient;
        this.clock = clock;
    }

    @Override
    public Mono<Long> loadPosition(String consumerGroup) {
        return databaseClient.sql(
                        "SELECT position FROM consumer_positions WHERE consumer_group = :consumerGroup")
                .bind("consumerGroup", consumerGroup)
                .map(row -> row.get("position", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Void> commitPosition(String consumerGroup, long position) {
        return databaseClient.sql("""
                    INSERT INTO consumer_positions (consumer_group, position, last_updated)
                    VALUES (:consumerGroup, :position, :lastUpdated)
                    ON CONFLICT (consumer_group)
                    DO UPDATE SET position = EXCLUDED.position, last_updated = EXCLUDED.last_updated
                    WHERE consumer_positions.position < EXCLUDED.position
                    """)
                .bind("consumerGroup", consumerGroup)
                .bind("position", position)
                .bind("lastUpdated", clock.instant())
                .fetch()
                .rowsUpdated()
                .doOnNext(updated -> {
                    if (updated == 0) {
                        log.debug("Position {} of consumer group {} not ahead of committed position, ignored",
                                position, consumerGroup);
                    }
                })
                .then();
    }
}

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

package org.fireflyframework.docstore.health;

import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.subscription.CheckpointStore;
import org.fireflyframework.docstore.subscription.ConsumerState;
import org.fireflyframework.docstore.subscription.SubscriptionConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the subscription consumers.
 * <p>
 * Reports DOWN as soon as one consumer group is halted on an integrity fault. For each
 * group it shows the state, the committed position and how far it lags behind the
 * head of the event log.
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionHealthIndicator implements ReactiveHealthIndicator {

    private final List<SubscriptionConsumer> consumers;
    private final EventStore eventStore;
    private final CheckpointStore checkpointStore;

    @Override
    public Mono<Health> health() {
        return eventStore.getCurrentGlobalPosition()
                .flatMap(head -> Flux.fromIterable(consumers)
                        .concatMap(consumer -> checkpointStore.loadPosition(consumer.getConsumerGroup())
                                .map(position -> Map.entry(consumer, position)))
                        .collectList()
                        .map(entries -> {
                            boolean halted = false;
                            Map<String, Object> groups = new LinkedHashMap<>();
                            for (Map.Entry<SubscriptionConsumer, Long> entry : entries) {
                                SubscriptionConsumer consumer = entry.getKey();
                                Map<String, Object> detail = new LinkedHashMap<>();
                                detail.put("state", consumer.getState());
                                detail.put("position", entry.getValue());
                                detail.put("lag", Math.max(0, head - entry.getValue()));
                                if (consumer.getState() == ConsumerState.HALTED) {
                                    halted = true;
                                    Throwable cause = consumer.getHaltCause();
                                    detail.put("haltCause", cause != null ? cause.getMessage() : "unknown");
                                }
                                groups.put(consumer.getConsumerGroup(), detail);
                            }

                            Health.Builder builder = halted ? Health.down() : Health.up();
                            return builder
                                    .withDetail("headPosition", head)
                                    .withDetail("consumerGroups", groups)
                                    .build();
                        }))
                .timeout(Duration.ofSeconds(5))
                .onErrorResume(e -> {
                    log.warn("Subscription health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}

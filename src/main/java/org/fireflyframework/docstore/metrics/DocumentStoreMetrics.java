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

package org.fireflyframework.docstore.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics of the document store.
 * All metrics are prefixed with {@code firefly.docstore.*}.
 */
@Slf4j
public class DocumentStoreMetrics {

    private static final String PREFIX = "firefly.docstore.";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, AtomicLong> consumerPositions = new ConcurrentHashMap<>();

    public DocumentStoreMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("DocumentStoreMetrics initialized");
    }

    // ==================== Event Log Metrics ====================

    public void recordEventsAppended(String aggregateType, int count) {
        counter("events.appended", "aggregate.type", aggregateType).increment(count);
        log.debug("METRIC: events.appended aggregateType={}, count={}", aggregateType, count);
    }

    public void recordConcurrencyConflict(String aggregateType) {
        counter("concurrency.conflicts", "aggregate.type", aggregateType).increment();
        log.debug("METRIC: concurrency.conflicts aggregateType={}", aggregateType);
    }

    // ==================== Projection Metrics ====================

    public void recordProjectionApplied(String aggregateType, String eventType) {
        counter("projections.applied", "aggregate.type", aggregateType, "event.type", eventType).increment();
    }

    public void recordProjectionSkipped(String aggregateType, String eventType) {
        counter("projections.skipped", "aggregate.type", aggregateType, "event.type", eventType).increment();
        log.debug("METRIC: projections.skipped aggregateType={}, eventType={}", aggregateType, eventType);
    }

    // ==================== Dispatch Metrics ====================

    public void recordDispatchStarted(String workflowName) {
        counter("dispatch.started", "workflow.name", workflowName).increment();
        log.debug("METRIC: dispatch.started workflowName={}", workflowName);
    }

    public void recordDispatchRetried(String workflowName) {
        counter("dispatch.retried", "workflow.name", workflowName).increment();
    }

    public void recordDispatchFailed(String workflowName) {
        counter("dispatch.failed", "workflow.name", workflowName).increment();
        log.debug("METRIC: dispatch.failed workflowName={}", workflowName);
    }

    // ==================== Consumer Metrics ====================

    public void recordConsumerPosition(String consumerGroup, long position) {
        consumerPositions.computeIfAbsent(consumerGroup, group -> {
            AtomicLong ref = new AtomicLong();
            Gauge.builder(PREFIX + "consumer.position", ref, AtomicLong::get)
                    .tag("consumer.group", group)
                    .register(meterRegistry);
            return ref;
        }).set(position);
    }

    public void recordConsumerHalted(String consumerGroup) {
        counter("consumer.halts", "consumer.group", consumerGroup).increment();
        log.debug("METRIC: consumer.halts consumerGroup={}", consumerGroup);
    }

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name)
                .tags(normalizeTags(tags))
                .register(meterRegistry);
    }

    private String[] normalizeTags(String[] tags) {
        String[] normalized = tags.clone();
        for (int i = 1; i < normalized.length; i += 2) {
            if (normalized[i] == null || normalized[i].isBlank()) {
                normalized[i] = "unknown";
            }
        }
        return normalized;
    }
}

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

package org.fireflyframework.docstore.dispatch;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link WorkflowEngineClient} that records started runs in memory.
 * <p>
 * Used when no engine client is configured, and in tests. Deduplicates on the
 * idempotency key like a real engine.
 */
@Slf4j
public class InMemoryWorkflowEngineClient implements WorkflowEngineClient {

    private final ConcurrentHashMap<String, StartedWorkflow> started = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> start(String workflowName, String idempotencyKey, Map<String, Object> payload) {
        return Mono.defer(() -> {
            StartedWorkflow run = new StartedWorkflow(workflowName, idempotencyKey, Map.copyOf(payload));
            if (started.putIfAbsent(idempotencyKey, run) != null) {
                return Mono.error(new WorkflowAlreadyStartedException(idempotencyKey));
            }
            log.info("Workflow started: name={}, key={}", workflowName, idempotencyKey);
            return Mono.empty();
        });
    }

    public List<StartedWorkflow> getStartedWorkflows() {
        return List.copyOf(started.values());
    }

    public boolean isStarted(String idempotencyKey) {
        return started.containsKey(idempotencyKey);
    }

    /**
     * A workflow run accepted by this client.
     */
    public record StartedWorkflow(String workflowName, String idempotencyKey, Map<String, Object> payload) {
    }
}

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

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Starts runs in the external workflow engine.
 * <p>
 * The engine deduplicates on the idempotency key: starting a workflow twice with the
 * same key must not create a second run.
 */
public interface WorkflowEngineClient {

    /**
     * Requests a workflow run.
     *
     * @param workflowName   the workflow to run
     * @param idempotencyKey the deduplication key and run id
     * @param payload        workflow input
     * @return completion once the engine accepted the run; errors with
     *         {@link WorkflowStartException} on transient failures and
     *         {@link WorkflowAlreadyStartedException} if a run with the key exists
     */
    Mono<Void> start(String workflowName, String idempotencyKey, Map<String, Object> payload);
}

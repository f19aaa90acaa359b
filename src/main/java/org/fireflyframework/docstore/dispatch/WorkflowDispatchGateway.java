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

import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.exception.DispatchFailureException;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.fireflyframework.docstore.subscription.EventHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Starts the workflows that qualifying events trigger.
 * <p>
 * Every start call carries the key {@code "{workflowName}-{aggregateId}"}, so a
 * redelivered event resolves to the run that already exists. Transient failures are
 * retried by {@link DispatchResilience}; an "already started" answer counts as success.
 * A call that still fails surfaces as {@link DispatchFailureException}.
 */
@Slf4j
public class WorkflowDispatchGateway implements EventHandler {

    private final WorkflowEngineClient client;
    private final List<DispatchRule> rules;
    private final DispatchResilience resilience;
    private final DocumentStoreMetrics metrics;

    public WorkflowDispatchGateway(WorkflowEngineClient client,
                                   List<DispatchRule> rules,
                                   DispatchResilience resilience,
                                   @Nullable DocumentStoreMetrics metrics) {
        this.client = client;
        this.rules = List.copyOf(rules);
        this.resilience = resilience;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return "workflow-dispatch-gateway";
    }

    /**
     * Starts every workflow whose rule matches the event. All matching workflows are
     * attempted even if one of them fails; the first failure is then reported.
     */
    @Override
    public Mono<Void> handle(StoredEvent event) {
        List<DispatchRule> matching = rules.stream()
                .filter(rule -> rule.matches(event))
                .toList();
        if (matching.isEmpty()) {
            return Mono.empty();
        }

        return Flux.fromIterable(matching)
                .concatMap(rule -> dispatch(rule, event)
                        .then(Mono.<DispatchFailureException>empty())
                        .onErrorResume(DispatchFailureException.class, Mono::just))
                .collectList()
                .flatMap(failures -> {
                    if (failures.isEmpty()) {
                        return Mono.<Void>empty();
                    }
                    DispatchFailureException first = failures.get(0);
                    failures.stream().skip(1).forEach(first::addSuppressed);
                    return Mono.<Void>error(first);
                });
    }

    /**
     * Starts one workflow for one event.
     *
     * @param rule  the matching rule
     * @param event the triggering event
     * @return completion, or {@link DispatchFailureException}
     */
    public Mono<Void> dispatch(DispatchRule rule, StoredEvent event) {
        String workflowName = rule.workflowName();
        String idempotencyKey = IdempotencyKeys.of(workflowName, event.getAggregateId());

        Mono<Void> call = Mono.defer(() -> {
                    Map<String, Object> payload = rule.payload().apply(event);
                    return client.start(workflowName, idempotencyKey, payload);
                })
                .onErrorResume(WorkflowAlreadyStartedException.class, e -> {
                    log.debug("Workflow {} already started with key {}", workflowName, idempotencyKey);
                    return Mono.empty();
                });

        return resilience.decorate(workflowName, call)
                .doOnSuccess(v -> {
                    log.info("Dispatched workflow {} with key {} for event {} at position {}",
                            workflowName, idempotencyKey, event.getEventType(), event.getPosition());
                    if (metrics != null) {
                        metrics.recordDispatchStarted(workflowName);
                    }
                })
                .onErrorMap(error -> !(error instanceof DispatchFailureException),
                        error -> new DispatchFailureException(workflowName, idempotencyKey, error));
    }
}

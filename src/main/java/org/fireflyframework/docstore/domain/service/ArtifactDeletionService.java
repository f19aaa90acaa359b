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

package org.fireflyframework.docstore.domain.service;

import org.fireflyframework.docstore.domain.artifact.ArtifactAggregate;
import org.fireflyframework.docstore.domain.artifact.ArtifactRepository;
import org.fireflyframework.docstore.domain.page.PageAggregate;
import org.fireflyframework.docstore.domain.page.PageRepository;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.eventsourcing.repository.EventSourcedRepository;
import org.fireflyframework.docstore.exception.ConcurrencyException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Deletes an artifact and then each of its pages.
 * <p>
 * The artifact is marked deleted first, in its own save. Every page is then loaded,
 * deleted and saved on its own, so a conflict on one page only retries that page
 * (reload, delete, save) up to the configured number of attempts. Pages that still
 * fail are reported in the {@link CascadeDeletionResult}; they never roll back the
 * artifact or stop the remaining pages.
 * <p>
 * Deleting an already deleted aggregate emits nothing, so a partially failed cascade
 * can simply be run again.
 */
@Slf4j
public class ArtifactDeletionService {

    private final ArtifactRepository artifactRepository;
    private final PageRepository pageRepository;
    private final int childRetryAttempts;

    public ArtifactDeletionService(ArtifactRepository artifactRepository,
                                   PageRepository pageRepository,
                                   int childRetryAttempts) {
        this.artifactRepository = artifactRepository;
        this.pageRepository = pageRepository;
        this.childRetryAttempts = childRetryAttempts;
    }

    /**
     * Deletes an artifact and its pages.
     *
     * @param artifactId the artifact to delete
     * @return the per-page outcome; errors only if the artifact itself could not be deleted
     */
    public Mono<CascadeDeletionResult> deleteArtifact(UUID artifactId) {
        log.info("Starting cascading deletion of artifact {}", artifactId);

        return deleteWithRetry(artifactRepository, artifactId, ArtifactAggregate::delete)
                .flatMap(artifact -> {
                    List<UUID> pageIds = List.copyOf(artifact.getPageIds());
                    log.debug("Artifact {} deleted, deleting {} page(s)", artifactId, pageIds.size());

                    return Flux.fromIterable(pageIds)
                            .concatMap(this::deletePage)
                            .collectList()
                            .map(results -> new CascadeDeletionResult(artifactId, results));
                })
                .doOnNext(result -> {
                    if (result.allSuccessful()) {
                        log.info("Deleted artifact {} and {} page(s)",
                                artifactId, result.deletedPageIds().size());
                    } else {
                        log.warn("Deleted artifact {} but {} page(s) could not be deleted: {}",
                                artifactId, result.failures().size(), result.failures());
                    }
                });
    }

    private Mono<CascadeDeletionResult.PageDeletion> deletePage(UUID pageId) {
        return deleteWithRetry(pageRepository, pageId, PageAggregate::delete)
                .map(page -> CascadeDeletionResult.PageDeletion.deleted(pageId))
                .onErrorResume(error -> {
                    log.warn("Failed to delete page {}: {}", pageId, error.getMessage());
                    return Mono.just(CascadeDeletionResult.PageDeletion.failed(pageId, error.getMessage()));
                });
    }

    private <A extends AggregateRoot<?>> Mono<A> deleteWithRetry(EventSourcedRepository<A> repository,
                                                                UUID aggregateId,
                                                                Consumer<A> deletion) {
        return Mono.defer(() -> repository.load(aggregateId)
                        .flatMap(aggregate -> {
                            deletion.accept(aggregate);
                            return repository.save(aggregate);
                        }))
                .retryWhen(Retry.max(childRetryAttempts)
                        .filter(ConcurrencyException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Retrying deletion of {} {} after conflict (attempt {})",
                                repository.getAggregateType(), aggregateId, signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }
}

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

package org.fireflyframework.docstore.command;

import org.fireflyframework.docstore.domain.artifact.ArtifactAggregate;
import org.fireflyframework.docstore.domain.artifact.ArtifactRepository;
import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.domain.model.CompoundMention;
import org.fireflyframework.docstore.domain.model.EmbeddingMetadata;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TagMention;
import org.fireflyframework.docstore.domain.model.TextMention;
import org.fireflyframework.docstore.domain.model.TitleMention;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.domain.page.PageAggregate;
import org.fireflyframework.docstore.domain.page.PageRepository;
import org.fireflyframework.docstore.domain.service.ArtifactDeletionService;
import org.fireflyframework.docstore.domain.service.CascadeDeletionResult;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.eventsourcing.repository.EventSourcedRepository;
import org.fireflyframework.docstore.exception.DocumentStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for every write against the document model.
 * <p>
 * Each method loads the target aggregate, runs one command on it and saves it. Rejected
 * commands (validation, concurrency, not-found, invalid-operation) come back as
 * {@link CommandResult.Failure}; any other error, such as a store outage, is
 * propagated as an error signal.
 */
@Slf4j
@RequiredArgsConstructor
public class DocumentCommandService {

    private final ArtifactRepository artifactRepository;
    private final PageRepository pageRepository;
    private final ArtifactDeletionService deletionService;
    private final Clock clock;

    // ========================================================================
    // Artifact Commands
    // ========================================================================

    public Mono<CommandResult<ArtifactView>> createArtifact(String sourceUri, String sourceFilename,
                                                            ArtifactType artifactType, String mimeType,
                                                            String storageLocation) {
        return create(artifactRepository, () -> ArtifactAggregate.create(UUID.randomUUID(),
                sourceUri, sourceFilename, artifactType, mimeType, storageLocation, clock))
                .map(ArtifactView::of)
                .doOnNext(view -> log.info("Created artifact {} from {}", view.id(), view.sourceUri()))
                .transform(result -> toResult(result, null));
    }

    public Mono<CommandResult<ArtifactView>> addPages(UUID artifactId, Collection<UUID> pageIds) {
        return updateArtifact(artifactId, artifact -> artifact.addPages(pageIds));
    }

    public Mono<CommandResult<ArtifactView>> removePages(UUID artifactId, Collection<UUID> pageIds) {
        return updateArtifact(artifactId, artifact -> artifact.removePages(pageIds));
    }

    public Mono<CommandResult<ArtifactView>> updateTitleMention(UUID artifactId, TitleMention mention) {
        return updateArtifact(artifactId, artifact -> artifact.updateTitleMention(mention));
    }

    public Mono<CommandResult<ArtifactView>> updateArtifactSummary(UUID artifactId, SummaryCandidate candidate) {
        return updateArtifact(artifactId, artifact -> artifact.updateSummaryCandidate(candidate));
    }

    public Mono<CommandResult<ArtifactView>> updateTags(UUID artifactId, List<String> tags) {
        return updateArtifact(artifactId, artifact -> artifact.updateTags(tags));
    }

    public Mono<CommandResult<ArtifactView>> updateArtifactWorkflowStatus(UUID artifactId, String workflowName,
                                                                          WorkflowProgress progress) {
        return updateArtifact(artifactId, artifact -> artifact.updateWorkflowStatus(workflowName, progress));
    }

    /**
     * Deletes an artifact and all of its pages.
     *
     * @see ArtifactDeletionService#deleteArtifact(UUID)
     */
    public Mono<CommandResult<CascadeDeletionResult>> deleteArtifact(UUID artifactId) {
        return deletionService.deleteArtifact(artifactId)
                .transform(result -> toResult(result, artifactId));
    }

    // ========================================================================
    // Page Commands
    // ========================================================================

    public Mono<CommandResult<PageView>> createPage(String name, UUID artifactId, int index) {
        return create(pageRepository, () -> PageAggregate.create(UUID.randomUUID(), name, artifactId, index, clock))
                .map(PageView::of)
                .doOnNext(view -> log.info("Created page {} ({}) of artifact {}", view.id(), view.name(), artifactId))
                .transform(result -> toResult(result, null));
    }

    public Mono<CommandResult<PageView>> updateCompoundMentions(UUID pageId, List<CompoundMention> mentions) {
        return updatePage(pageId, page -> page.updateCompoundMentions(mentions));
    }

    public Mono<CommandResult<PageView>> updateTagMentions(UUID pageId, List<TagMention> mentions) {
        return updatePage(pageId, page -> page.updateTagMentions(mentions));
    }

    public Mono<CommandResult<PageView>> updateTextMention(UUID pageId, TextMention mention) {
        return updatePage(pageId, page -> page.updateTextMention(mention));
    }

    public Mono<CommandResult<PageView>> updatePageSummary(UUID pageId, SummaryCandidate candidate) {
        return updatePage(pageId, page -> page.updateSummaryCandidate(candidate));
    }

    public Mono<CommandResult<PageView>> recordTextEmbedding(UUID pageId, EmbeddingMetadata embedding) {
        return updatePage(pageId, page -> page.recordTextEmbedding(embedding));
    }

    public Mono<CommandResult<PageView>> recordSmilesEmbedding(UUID pageId, EmbeddingMetadata embedding) {
        return updatePage(pageId, page -> page.recordSmilesEmbedding(embedding));
    }

    public Mono<CommandResult<PageView>> updatePageWorkflowStatus(UUID pageId, String workflowName,
                                                                  WorkflowProgress progress) {
        return updatePage(pageId, page -> page.updateWorkflowStatus(workflowName, progress));
    }

    /**
     * Deletes a single page without touching its artifact.
     */
    public Mono<CommandResult<PageView>> deletePage(UUID pageId) {
        return updatePage(pageId, PageAggregate::delete);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Mono<CommandResult<ArtifactView>> updateArtifact(UUID artifactId, Consumer<ArtifactAggregate> command) {
        return update(artifactRepository, artifactId, command)
                .map(ArtifactView::of)
                .transform(result -> toResult(result, artifactId));
    }

    private Mono<CommandResult<PageView>> updatePage(UUID pageId, Consumer<PageAggregate> command) {
        return update(pageRepository, pageId, command)
                .map(PageView::of)
                .transform(result -> toResult(result, pageId));
    }

    private static <A extends AggregateRoot<?>> Mono<A> create(EventSourcedRepository<A> repository,
                                                                Supplier<A> factory) {
        return Mono.fromSupplier(factory).flatMap(repository::save);
    }

    private static <A extends AggregateRoot<?>> Mono<A> update(EventSourcedRepository<A> repository,
                                                                UUID aggregateId, Consumer<A> command) {
        return repository.load(aggregateId)
                .flatMap(aggregate -> {
                    command.accept(aggregate);
                    return repository.save(aggregate);
                });
    }

    private static <T> Mono<CommandResult<T>> toResult(Mono<T> execution, UUID aggregateId) {
        Function<T, CommandResult<T>> success = CommandResult::success;
        return execution
                .map(success)
                .onErrorResume(DocumentStoreException.class, e -> {
                    if (!e.getKind().isCommandFailure()) {
                        return Mono.error(e);
                    }
                    log.debug("Command rejected for aggregate {}: {} {}", aggregateId, e.getKind(), e.getMessage());
                    return Mono.just(CommandResult.<T>failure(new CommandError(e.getKind(), e.getMessage(), aggregateId)));
                });
    }
}

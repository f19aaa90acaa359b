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

package org.fireflyframework.docstore.domain.page;

import org.fireflyframework.docstore.domain.model.CompoundMention;
import org.fireflyframework.docstore.domain.model.EmbeddingMetadata;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TagMention;
import org.fireflyframework.docstore.domain.model.TextMention;
import org.fireflyframework.docstore.domain.model.Validations;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.exception.InvalidOperationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Event-sourced aggregate representing one page of an artifact.
 * <p>
 * A page keeps a back-reference to its artifact but is loaded, saved and deleted on its
 * own. Extraction pipelines attach compounds, tags, text, a summary and embeddings to
 * it over time.
 * <p>
 * Same rules as {@code ArtifactAggregate}: a deleted page rejects every command except
 * {@link #delete()}, which is then a no-op.
 *
 * @see AggregateRoot
 */
@Slf4j
@Getter
public class PageAggregate extends AggregateRoot<PageEvent> {

    public static final String AGGREGATE_TYPE = "page";

    private String name;
    private UUID artifactId;
    private int index;

    private List<CompoundMention> compoundMentions = List.of();
    private List<TagMention> tagMentions = List.of();
    private TextMention textMention;
    private SummaryCandidate summaryCandidate;
    private EmbeddingMetadata textEmbedding;
    private EmbeddingMetadata smilesEmbedding;

    private final Map<String, WorkflowProgress> workflowStatuses = new LinkedHashMap<>();

    private boolean deleted;
    private Instant deletedAt;

    @Getter(AccessLevel.NONE)
    private final PageEvent.Visitor<Void> eventHandlers = new EventHandlers();

    public PageAggregate(UUID id, Clock clock) {
        super(id, AGGREGATE_TYPE, PageEvent.class, clock);
    }

    /**
     * Creates a new page carrying a single uncommitted creation event.
     *
     * @param id         the page id
     * @param name       the page name, not blank
     * @param artifactId the owning artifact
     * @param index      zero-based position within the artifact
     * @param clock      the clock stamping events
     * @return the new aggregate at version 1
     */
    public static PageAggregate create(UUID id, String name, UUID artifactId, int index, Clock clock) {
        PageCreatedEvent event = PageCreatedEvent.builder()
                .name(Validations.requireText(name, "name"))
                .artifactId(Validations.requirePresent(artifactId, "artifactId"))
                .index(Validations.requireNonNegative(index, "index"))
                .build();

        PageAggregate aggregate = new PageAggregate(Validations.requirePresent(id, "id"), clock);
        aggregate.applyChange(event);
        return aggregate;
    }

    // ========================================================================
    // Command Methods (validate state + applyChange)
    // ========================================================================

    public void updateCompoundMentions(List<CompoundMention> mentions) {
        requireNotDeleted("update compounds of");
        List<CompoundMention> copy = Validations.requireElements(mentions, "compoundMentions");
        if (copy.equals(compoundMentions)) {
            return;
        }

        applyChange(PageCompoundMentionsUpdatedEvent.builder()
                .compoundMentions(copy)
                .build());
    }

    public void updateTagMentions(List<TagMention> mentions) {
        requireNotDeleted("update tags of");
        List<TagMention> copy = Validations.requireElements(mentions, "tagMentions");
        if (copy.equals(tagMentions)) {
            return;
        }

        applyChange(PageTagMentionsUpdatedEvent.builder()
                .tagMentions(copy)
                .build());
    }

    /**
     * Replaces the extracted text. {@code null} clears it.
     */
    public void updateTextMention(TextMention mention) {
        requireNotDeleted("update the text of");
        if (Objects.equals(textMention, mention)) {
            return;
        }

        applyChange(PageTextMentionUpdatedEvent.builder()
                .textMention(mention)
                .build());
    }

    /**
     * Replaces the summary candidate. {@code null} clears it.
     */
    public void updateSummaryCandidate(SummaryCandidate candidate) {
        requireNotDeleted("update the summary of");
        if (Objects.equals(summaryCandidate, candidate)) {
            return;
        }

        applyChange(PageSummaryCandidateUpdatedEvent.builder()
                .summaryCandidate(candidate)
                .build());
    }

    /**
     * Records that a text embedding was generated. Every call emits an event, since a
     * regenerated embedding must trigger downstream processing again.
     */
    public void recordTextEmbedding(EmbeddingMetadata embedding) {
        requireNotDeleted("record a text embedding for");
        applyChange(PageTextEmbeddingGeneratedEvent.builder()
                .embedding(Validations.requirePresent(embedding, "embedding"))
                .build());
    }

    public void recordSmilesEmbedding(EmbeddingMetadata embedding) {
        requireNotDeleted("record a SMILES embedding for");
        applyChange(PageSmilesEmbeddingGeneratedEvent.builder()
                .embedding(Validations.requirePresent(embedding, "embedding"))
                .build());
    }

    public void updateWorkflowStatus(String workflowName, WorkflowProgress progress) {
        requireNotDeleted("update a workflow status of");
        String workflow = Validations.requireText(workflowName, "workflowName");
        Validations.requirePresent(progress, "progress");
        if (progress.equals(workflowStatuses.get(workflow))) {
            return;
        }

        applyChange(PageWorkflowStatusUpdatedEvent.builder()
                .workflowName(workflow)
                .progress(progress)
                .build());
    }

    /**
     * Deletes the page. Deleting an already deleted page does nothing.
     */
    public void delete() {
        if (deleted) {
            log.debug("Page {} is already deleted", getId());
            return;
        }

        applyChange(PageDeletedEvent.builder()
                .deletedAt(getClock().instant())
                .build());
    }

    public Map<String, WorkflowProgress> getWorkflowStatuses() {
        return Collections.unmodifiableMap(workflowStatuses);
    }

    // ========================================================================
    // Event Handlers (pure state mutations)
    // ========================================================================

    @Override
    protected void apply(PageEvent event) {
        event.accept(eventHandlers);
    }

    private void on(PageCreatedEvent event) {
        this.name = event.getName();
        this.artifactId = event.getArtifactId();
        this.index = event.getIndex();
    }

    private void on(PageCompoundMentionsUpdatedEvent event) {
        this.compoundMentions = List.copyOf(event.getCompoundMentions());
    }

    private void on(PageTagMentionsUpdatedEvent event) {
        this.tagMentions = List.copyOf(event.getTagMentions());
    }

    private void on(PageTextMentionUpdatedEvent event) {
        this.textMention = event.getTextMention();
    }

    private void on(PageSummaryCandidateUpdatedEvent event) {
        this.summaryCandidate = event.getSummaryCandidate();
    }

    private void on(PageTextEmbeddingGeneratedEvent event) {
        this.textEmbedding = event.getEmbedding();
    }

    private void on(PageSmilesEmbeddingGeneratedEvent event) {
        this.smilesEmbedding = event.getEmbedding();
    }

    private void on(PageWorkflowStatusUpdatedEvent event) {
        workflowStatuses.put(event.getWorkflowName(), event.getProgress());
    }

    private void on(PageDeletedEvent event) {
        this.deleted = true;
        this.deletedAt = event.getDeletedAt();
    }

    private void requireNotDeleted(String action) {
        if (deleted) {
            throw new InvalidOperationException(getId(),
                    "Cannot " + action + " page " + getId() + ": it has been deleted");
        }
    }

    private final class EventHandlers implements PageEvent.Visitor<Void> {

        @Override
        public Void visit(PageCreatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageCompoundMentionsUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageTagMentionsUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageTextMentionUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageSummaryCandidateUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageTextEmbeddingGeneratedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageSmilesEmbeddingGeneratedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageWorkflowStatusUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(PageDeletedEvent event) {
            on(event);
            return null;
        }
    }
}

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

package org.fireflyframework.docstore.domain.artifact;

import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TitleMention;
import org.fireflyframework.docstore.domain.model.Validations;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.exception.InvalidOperationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Event-sourced aggregate representing an ingested source document (the container).
 * <p>
 * An artifact records which pages belong to it, the title and summary extracted from
 * it, its tags and the status of every workflow run against it. Pages are separate
 * aggregates; the artifact only holds their ids.
 * <p>
 * <b>Lifecycle:</b> created -> (updates)* -> deleted (terminal)
 * <p>
 * Every command rejects a deleted artifact with {@link InvalidOperationException}
 * before validating its arguments. Commands whose input would not change the state
 * emit no event; {@link #delete()} on a deleted artifact is one of them.
 *
 * @see AggregateRoot
 */
@Slf4j
@Getter
public class ArtifactAggregate extends AggregateRoot<ArtifactEvent> {

    public static final String AGGREGATE_TYPE = "artifact";

    // --- Source document ---

    private String sourceUri;
    private String sourceFilename;
    private ArtifactType artifactType;
    private String mimeType;
    private String storageLocation;

    // --- Extracted content ---

    private final Set<UUID> pageIds = new LinkedHashSet<>();
    private TitleMention titleMention;
    private SummaryCandidate summaryCandidate;
    private final List<String> tags = new ArrayList<>();

    // --- Processing ---

    private final Map<String, WorkflowProgress> workflowStatuses = new LinkedHashMap<>();

    private boolean deleted;
    private Instant deletedAt;

    @Getter(AccessLevel.NONE)
    private final ArtifactEvent.Visitor<Void> eventHandlers = new EventHandlers();

    public ArtifactAggregate(UUID id, Clock clock) {
        super(id, AGGREGATE_TYPE, ArtifactEvent.class, clock);
    }

    /**
     * Creates a new artifact carrying a single uncommitted creation event.
     *
     * @param id              the artifact id
     * @param sourceUri       where the document came from
     * @param sourceFilename  the original file name
     * @param artifactType    the kind of document
     * @param mimeType        the document MIME type
     * @param storageLocation where the original is stored
     * @param clock           the clock stamping events
     * @return the new aggregate at version 1
     */
    public static ArtifactAggregate create(UUID id, String sourceUri, String sourceFilename,
                                           ArtifactType artifactType, String mimeType,
                                           String storageLocation, Clock clock) {
        ArtifactCreatedEvent event = ArtifactCreatedEvent.builder()
                .sourceUri(Validations.requireText(sourceUri, "sourceUri"))
                .sourceFilename(Validations.requireText(sourceFilename, "sourceFilename"))
                .artifactType(Validations.requirePresent(artifactType, "artifactType"))
                .mimeType(Validations.requireText(mimeType, "mimeType"))
                .storageLocation(Validations.requireText(storageLocation, "storageLocation"))
                .build();

        ArtifactAggregate aggregate = new ArtifactAggregate(Validations.requirePresent(id, "id"), clock);
        aggregate.applyChange(event);
        return aggregate;
    }

    // ========================================================================
    // Command Methods (validate state + applyChange)
    // ========================================================================

    /**
     * Attaches pages. Ids that are already attached, or repeated in the input, are ignored.
     *
     * @param newPageIds the page ids to attach
     */
    public void addPages(Collection<UUID> newPageIds) {
        requireNotDeleted("add pages to");
        Validations.requirePresent(newPageIds, "pageIds");

        LinkedHashSet<UUID> added = new LinkedHashSet<>();
        for (UUID pageId : newPageIds) {
            Validations.requirePresent(pageId, "pageId");
            if (!pageIds.contains(pageId)) {
                added.add(pageId);
            }
        }
        if (added.isEmpty()) {
            return;
        }

        applyChange(ArtifactPagesAddedEvent.builder()
                .pageIds(List.copyOf(added))
                .build());
    }

    /**
     * Detaches pages. Ids that are not attached are ignored.
     *
     * @param removedPageIds the page ids to detach
     */
    public void removePages(Collection<UUID> removedPageIds) {
        requireNotDeleted("remove pages from");
        Validations.requirePresent(removedPageIds, "pageIds");

        LinkedHashSet<UUID> removed = new LinkedHashSet<>();
        for (UUID pageId : removedPageIds) {
            if (pageId != null && pageIds.contains(pageId)) {
                removed.add(pageId);
            }
        }
        if (removed.isEmpty()) {
            return;
        }

        applyChange(ArtifactPagesRemovedEvent.builder()
                .pageIds(List.copyOf(removed))
                .build());
    }

    /**
     * Replaces the extracted title. {@code null} clears it.
     */
    public void updateTitleMention(TitleMention mention) {
        requireNotDeleted("update the title of");
        if (Objects.equals(titleMention, mention)) {
            return;
        }

        applyChange(ArtifactTitleMentionUpdatedEvent.builder()
                .titleMention(mention)
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

        applyChange(ArtifactSummaryCandidateUpdatedEvent.builder()
                .summaryCandidate(candidate)
                .build());
    }

    /**
     * Replaces the tag list. Tags are trimmed, blank tags dropped and duplicates removed
     * keeping the first occurrence.
     *
     * @param newTags the new tags
     */
    public void updateTags(List<String> newTags) {
        requireNotDeleted("update the tags of");
        Validations.requirePresent(newTags, "tags");

        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String tag : newTags) {
            String trimmed = Validations.trimToNull(tag);
            if (trimmed != null) {
                normalized.add(trimmed);
            }
        }
        List<String> result = List.copyOf(normalized);
        if (result.equals(tags)) {
            return;
        }

        applyChange(ArtifactTagsUpdatedEvent.builder()
                .tags(result)
                .build());
    }

    /**
     * Records the status of a named workflow run against this artifact.
     *
     * @param workflowName the workflow name
     * @param progress     the new status
     */
    public void updateWorkflowStatus(String workflowName, WorkflowProgress progress) {
        requireNotDeleted("update a workflow status of");
        String name = Validations.requireText(workflowName, "workflowName");
        Validations.requirePresent(progress, "progress");
        if (progress.equals(workflowStatuses.get(name))) {
            return;
        }

        applyChange(ArtifactWorkflowStatusUpdatedEvent.builder()
                .workflowName(name)
                .progress(progress)
                .build());
    }

    /**
     * Deletes the artifact. Deleting an already deleted artifact does nothing.
     */
    public void delete() {
        if (deleted) {
            log.debug("Artifact {} is already deleted", getId());
            return;
        }

        applyChange(ArtifactDeletedEvent.builder()
                .deletedAt(getClock().instant())
                .build());
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public Set<UUID> getPageIds() {
        return Collections.unmodifiableSet(pageIds);
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public Map<String, WorkflowProgress> getWorkflowStatuses() {
        return Collections.unmodifiableMap(workflowStatuses);
    }

    // ========================================================================
    // Event Handlers (pure state mutations)
    // ========================================================================

    @Override
    protected void apply(ArtifactEvent event) {
        event.accept(eventHandlers);
    }

    private void on(ArtifactCreatedEvent event) {
        this.sourceUri = event.getSourceUri();
        this.sourceFilename = event.getSourceFilename();
        this.artifactType = event.getArtifactType();
        this.mimeType = event.getMimeType();
        this.storageLocation = event.getStorageLocation();
    }

    private void on(ArtifactPagesAddedEvent event) {
        pageIds.addAll(event.getPageIds());
    }

    private void on(ArtifactPagesRemovedEvent event) {
        event.getPageIds().forEach(pageIds::remove);
    }

    private void on(ArtifactTitleMentionUpdatedEvent event) {
        this.titleMention = event.getTitleMention();
    }

    private void on(ArtifactSummaryCandidateUpdatedEvent event) {
        this.summaryCandidate = event.getSummaryCandidate();
    }

    private void on(ArtifactTagsUpdatedEvent event) {
        tags.clear();
        tags.addAll(event.getTags());
    }

    private void on(ArtifactWorkflowStatusUpdatedEvent event) {
        workflowStatuses.put(event.getWorkflowName(), event.getProgress());
    }

    private void on(ArtifactDeletedEvent event) {
        this.deleted = true;
        this.deletedAt = event.getDeletedAt();
    }

    private void requireNotDeleted(String action) {
        if (deleted) {
            throw new InvalidOperationException(getId(),
                    "Cannot " + action + " artifact " + getId() + ": it has been deleted");
        }
    }

    private final class EventHandlers implements ArtifactEvent.Visitor<Void> {

        @Override
        public Void visit(ArtifactCreatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactPagesAddedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactPagesRemovedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactTitleMentionUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactSummaryCandidateUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactTagsUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactWorkflowStatusUpdatedEvent event) {
            on(event);
            return null;
        }

        @Override
        public Void visit(ArtifactDeletedEvent event) {
            on(event);
            return null;
        }
    }
}

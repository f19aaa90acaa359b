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
import org.fireflyframework.docstore.domain.model.ExtractionMetadata;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TitleMention;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.exception.IntegrityFaultException;
import org.fireflyframework.docstore.exception.InvalidOperationException;
import org.fireflyframework.docstore.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ArtifactAggregate} commands and replay.
 * <p>
 * Tests cover: creation, page membership, extracted content updates,
 * workflow statuses, deletion and rebuilding state from history.
 */
class ArtifactAggregateTest {

    private static final UUID ARTIFACT_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String SOURCE_URI = "s3://ingest/papers/aspirin.pdf";
    private static final String SOURCE_FILENAME = "aspirin.pdf";
    private static final String MIME_TYPE = "application/pdf";
    private static final String STORAGE_LOCATION = "s3://docstore/artifacts/aspirin.pdf";

    private ArtifactAggregate aggregate;

    @BeforeEach
    void setUp() {
        aggregate = ArtifactAggregate.create(ARTIFACT_ID, SOURCE_URI, SOURCE_FILENAME,
                ArtifactType.RESEARCH_ARTICLE, MIME_TYPE, STORAGE_LOCATION, CLOCK);
    }

    private static ExtractionMetadata metadata() {
        return new ExtractionMetadata(0.92, NOW, "extractor-v2", null, "run-1");
    }

    // ========================================================================
    // Create Tests
    // ========================================================================

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("should emit a single created event at version 1")
        void shouldEmitCreatedEvent() {
            assertThat(aggregate.getCurrentVersion()).isEqualTo(1);
            assertThat(aggregate.getExpectedVersion()).isZero();
            assertThat(aggregate.getUncommittedEvents()).hasSize(1);

            EventEnvelope envelope = aggregate.getUncommittedEvents().get(0);
            assertThat(envelope.getEventType()).isEqualTo("artifact.created");
            assertThat(envelope.getAggregateId()).isEqualTo(ARTIFACT_ID);
            assertThat(envelope.getAggregateType()).isEqualTo(ArtifactAggregate.AGGREGATE_TYPE);
            assertThat(envelope.getVersion()).isEqualTo(1);
            assertThat(envelope.getTimestamp()).isEqualTo(NOW);
            assertThat(envelope.getPayload()).isInstanceOf(ArtifactCreatedEvent.class);
        }

        @Test
        @DisplayName("should populate source fields")
        void shouldPopulateSourceFields() {
            assertThat(aggregate.getSourceUri()).isEqualTo(SOURCE_URI);
            assertThat(aggregate.getSourceFilename()).isEqualTo(SOURCE_FILENAME);
            assertThat(aggregate.getArtifactType()).isEqualTo(ArtifactType.RESEARCH_ARTICLE);
            assertThat(aggregate.getMimeType()).isEqualTo(MIME_TYPE);
            assertThat(aggregate.getStorageLocation()).isEqualTo(STORAGE_LOCATION);
            assertThat(aggregate.getPageIds()).isEmpty();
            assertThat(aggregate.isDeleted()).isFalse();
        }

        @Test
        @DisplayName("should reject a blank source URI")
        void shouldRejectBlankSourceUri() {
            assertThatThrownBy(() -> ArtifactAggregate.create(UUID.randomUUID(), "  ", SOURCE_FILENAME,
                    ArtifactType.REPORT, MIME_TYPE, STORAGE_LOCATION, CLOCK))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("sourceUri");
        }

        @Test
        @DisplayName("should reject a missing artifact type")
        void shouldRejectMissingArtifactType() {
            assertThatThrownBy(() -> ArtifactAggregate.create(UUID.randomUUID(), SOURCE_URI, SOURCE_FILENAME,
                    null, MIME_TYPE, STORAGE_LOCATION, CLOCK))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("artifactType");
        }
    }

    // ========================================================================
    // Page Membership Tests
    // ========================================================================

    @Nested
    @DisplayName("Pages")
    class PageTests {

        @Test
        @DisplayName("should add new pages and ignore already attached ones")
        void shouldAddOnlyNewPages() {
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();

            aggregate.addPages(List.of(first));
            aggregate.addPages(List.of(first, second, second));

            assertThat(aggregate.getPageIds()).containsExactly(first, second);
            assertThat(aggregate.getUncommittedEvents()).hasSize(3);
            ArtifactPagesAddedEvent last = (ArtifactPagesAddedEvent) aggregate.getUncommittedEvents().get(2).getPayload();
            assertThat(last.getPageIds()).containsExactly(second);
        }

        @Test
        @DisplayName("should emit nothing when all pages are already attached")
        void shouldEmitNothingForKnownPages() {
            UUID pageId = UUID.randomUUID();
            aggregate.addPages(List.of(pageId));
            long version = aggregate.getCurrentVersion();

            aggregate.addPages(List.of(pageId));

            assertThat(aggregate.getCurrentVersion()).isEqualTo(version);
        }

        @Test
        @DisplayName("should remove attached pages and ignore unknown ones")
        void shouldRemoveAttachedPages() {
            UUID kept = UUID.randomUUID();
            UUID removed = UUID.randomUUID();
            aggregate.addPages(List.of(kept, removed));

            aggregate.removePages(List.of(removed, UUID.randomUUID()));

            assertThat(aggregate.getPageIds()).containsExactly(kept);
            ArtifactPagesRemovedEvent event = (ArtifactPagesRemovedEvent) aggregate.getUncommittedEvents()
                    .get(2).getPayload();
            assertThat(event.getPageIds()).containsExactly(removed);
        }

        @Test
        @DisplayName("should reject a null page id")
        void shouldRejectNullPageId() {
            List<UUID> pageIds = new ArrayList<>();
            pageIds.add(null);

            assertThatThrownBy(() -> aggregate.addPages(pageIds))
                    .isInstanceOf(ValidationException.class);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(1);
        }
    }

    // ========================================================================
    // Content Tests
    // ========================================================================

    @Nested
    @DisplayName("Content")
    class ContentTests {

        @Test
        @DisplayName("should set and clear the title mention")
        void shouldSetAndClearTitle() {
            TitleMention title = new TitleMention("Aspirin synthesis revisited", metadata());

            aggregate.updateTitleMention(title);
            assertThat(aggregate.getTitleMention()).isEqualTo(title);

            aggregate.updateTitleMention(null);
            assertThat(aggregate.getTitleMention()).isNull();
            assertThat(aggregate.getCurrentVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("should emit nothing for an unchanged title")
        void shouldIgnoreUnchangedTitle() {
            aggregate.updateTitleMention(new TitleMention("Title", null));
            aggregate.updateTitleMention(new TitleMention("Title", null));

            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should store the summary candidate")
        void shouldStoreSummaryCandidate() {
            SummaryCandidate candidate = new SummaryCandidate("Machine summary", true, "Curated summary", metadata());

            aggregate.updateSummaryCandidate(candidate);

            assertThat(aggregate.getSummaryCandidate()).isEqualTo(candidate);
        }

        @Test
        @DisplayName("should normalize tags")
        void shouldNormalizeTags() {
            aggregate.updateTags(List.of(" chemistry ", "", "pharma", "chemistry"));

            assertThat(aggregate.getTags()).containsExactly("chemistry", "pharma");
        }

        @Test
        @DisplayName("should emit nothing when normalized tags are unchanged")
        void shouldIgnoreUnchangedTags() {
            aggregate.updateTags(List.of("chemistry"));
            aggregate.updateTags(List.of("chemistry ", " "));

            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should track workflow status per workflow name")
        void shouldTrackWorkflowStatus() {
            WorkflowProgress running = new WorkflowProgress.InProgress("run-7", "sampling", 0.5, NOW);
            WorkflowProgress done = new WorkflowProgress.Completed("run-7", "sampled", NOW, NOW.plusSeconds(30));

            aggregate.updateWorkflowStatus("artifact_sample_workflow", running);
            aggregate.updateWorkflowStatus("artifact_sample_workflow", done);
            aggregate.updateWorkflowStatus("artifact_sample_workflow", done);

            assertThat(aggregate.getWorkflowStatuses())
                    .containsEntry("artifact_sample_workflow", done)
                    .hasSize(1);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("should reject a blank workflow name")
        void shouldRejectBlankWorkflowName() {
            assertThatThrownBy(() -> aggregate.updateWorkflowStatus(" ", new WorkflowProgress.Pending(null)))
                    .isInstanceOf(ValidationException.class);
        }
    }

    // ========================================================================
    // Delete Tests
    // ========================================================================

    @Nested
    @DisplayName("Delete")
    class DeleteTests {

        @Test
        @DisplayName("should mark the artifact deleted with the clock time")
        void shouldMarkDeleted() {
            aggregate.delete();

            assertThat(aggregate.isDeleted()).isTrue();
            assertThat(aggregate.getDeletedAt()).isEqualTo(NOW);
            assertThat(aggregate.getUncommittedEvents().get(1).getEventType()).isEqualTo("artifact.deleted");
        }

        @Test
        @DisplayName("should emit nothing when deleted twice")
        void shouldBeNoOpWhenDeletedTwice() {
            aggregate.delete();
            aggregate.delete();

            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject commands on a deleted artifact")
        void shouldRejectCommandsAfterDelete() {
            aggregate.delete();

            assertThatThrownBy(() -> aggregate.addPages(List.of(UUID.randomUUID())))
                    .isInstanceOf(InvalidOperationException.class)
                    .hasMessageContaining(ARTIFACT_ID.toString());
            assertThatThrownBy(() -> aggregate.updateTags(List.of("late")))
                    .isInstanceOf(InvalidOperationException.class);
            assertThat(aggregate.getCurrentVersion()).isEqualTo(2);
        }
    }

    // ========================================================================
    // Replay Tests
    // ========================================================================

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        @Test
        @DisplayName("should rebuild identical state from history")
        void shouldRebuildIdenticalState() {
            UUID pageId = UUID.randomUUID();
            aggregate.addPages(List.of(pageId));
            aggregate.updateTitleMention(new TitleMention("Aspirin", metadata()));
            aggregate.updateTags(List.of("chemistry"));
            aggregate.delete();

            ArtifactAggregate replayed = new ArtifactAggregate(ARTIFACT_ID, CLOCK);
            replayed.loadFromHistory(aggregate.getUncommittedEvents());

            assertThat(replayed.getCurrentVersion()).isEqualTo(5);
            assertThat(replayed.hasUncommittedEvents()).isFalse();
            assertThat(replayed.getSourceUri()).isEqualTo(SOURCE_URI);
            assertThat(replayed.getPageIds()).containsExactly(pageId);
            assertThat(replayed.getTitleMention()).isEqualTo(aggregate.getTitleMention());
            assertThat(replayed.getTags()).containsExactly("chemistry");
            assertThat(replayed.isDeleted()).isTrue();
            assertThat(replayed.getDeletedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should raise an integrity fault on a version gap")
        void shouldFaultOnVersionGap() {
            aggregate.updateTags(List.of("a"));
            aggregate.updateTags(List.of("b"));
            List<EventEnvelope> history = new ArrayList<>(aggregate.getUncommittedEvents());
            history.remove(1);

            ArtifactAggregate replayed = new ArtifactAggregate(ARTIFACT_ID, CLOCK);

            assertThatThrownBy(() -> replayed.loadFromHistory(history))
                    .isInstanceOf(IntegrityFaultException.class)
                    .hasMessageContaining(ARTIFACT_ID.toString());
        }
    }
}

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

package org.fireflyframework.docstore.projection;

import org.fireflyframework.docstore.domain.DocumentEventTypes;
import org.fireflyframework.docstore.domain.artifact.ArtifactAggregate;
import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.domain.model.CompoundMention;
import org.fireflyframework.docstore.domain.model.EmbeddingMetadata;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TagMention;
import org.fireflyframework.docstore.domain.model.TitleMention;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.domain.page.PageAggregate;
import org.fireflyframework.docstore.eventsourcing.aggregate.AggregateRoot;
import org.fireflyframework.docstore.eventsourcing.event.EventEnvelope;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.eventsourcing.store.EventCodec;
import org.fireflyframework.docstore.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.docstore.exception.IntegrityFaultException;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProjectionEngine} with the artifact and page projections.
 * <p>
 * Tests cover: folding events into documents, idempotent redelivery, version
 * gaps, unknown aggregate types and soft deletion.
 */
class ProjectionEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryEventStore eventStore;
    private InMemoryReadModelStore<ArtifactReadModel> artifacts;
    private InMemoryReadModelStore<PageReadModel> pages;
    private SimpleMeterRegistry meterRegistry;
    private ProjectionEngine engine;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore(new EventCodec(new ObjectMapper(), DocumentEventTypes.all()));
        artifacts = new InMemoryReadModelStore<>();
        pages = new InMemoryReadModelStore<>();
        meterRegistry = new SimpleMeterRegistry();
        DocumentStoreMetrics metrics = new DocumentStoreMetrics(meterRegistry);
        engine = new ProjectionEngine(List.of(
                new ArtifactProjection(artifacts, metrics),
                new PageProjection(pages, metrics)));
    }

    private List<StoredEvent> commit(AggregateRoot<?> aggregate) {
        List<StoredEvent> stored = eventStore.appendEvents(aggregate.getId(), aggregate.getAggregateType(),
                aggregate.getUncommittedEvents(), aggregate.getExpectedVersion()).block();
        aggregate.markEventsAsCommitted();
        return stored;
    }

    private void projectAll(List<StoredEvent> events) {
        for (StoredEvent event : events) {
            engine.project(event).block();
        }
    }

    private ArtifactAggregate newArtifact() {
        return ArtifactAggregate.create(UUID.randomUUID(), "file:///paper.pdf", "paper.pdf",
                ArtifactType.RESEARCH_ARTICLE, "application/pdf", "s3://docstore/paper.pdf", CLOCK);
    }

    // ========================================================================
    // Artifact Projection Tests
    // ========================================================================

    @Nested
    @DisplayName("Artifact projection")
    class ArtifactProjectionTests {

        @Test
        @DisplayName("should build the artifact document from its events")
        void shouldBuildDocument() {
            ArtifactAggregate artifact = newArtifact();
            UUID pageId = UUID.randomUUID();
            artifact.addPages(List.of(pageId));
            artifact.updateTitleMention(new TitleMention("Aspirin", null));
            artifact.updateSummaryCandidate(new SummaryCandidate("machine text", true, "curated text", null));
            artifact.updateTags(List.of("chemistry", "pharma"));
            artifact.updateWorkflowStatus("artifact_sample_workflow", new WorkflowProgress.Pending("queued"));

            projectAll(commit(artifact));

            StepVerifier.create(artifacts.findById(artifact.getId()))
                    .assertNext(document -> {
                        assertThat(document.getSourceUri()).isEqualTo("file:///paper.pdf");
                        assertThat(document.getArtifactType()).isEqualTo(ArtifactType.RESEARCH_ARTICLE);
                        assertThat(document.getPageIds()).containsExactly(pageId);
                        assertThat(document.getTitle()).isEqualTo("Aspirin");
                        assertThat(document.getSummary()).isEqualTo("curated text");
                        assertThat(document.isSummaryLocked()).isTrue();
                        assertThat(document.getTags()).containsExactly("chemistry", "pharma");
                        assertThat(document.getWorkflowStatuses()).containsKey("artifact_sample_workflow");
                        assertThat(document.getLastAppliedVersion()).isEqualTo(6);
                        assertThat(document.getCreatedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep the deleted artifact as a flagged document")
        void shouldFlagDeletedArtifact() {
            ArtifactAggregate artifact = newArtifact();
            artifact.delete();

            projectAll(commit(artifact));

            StepVerifier.create(artifacts.findById(artifact.getId()))
                    .assertNext(document -> {
                        assertThat(document.isDeleted()).isTrue();
                        assertThat(document.getDeletedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should apply a removed page only to the page list")
        void shouldRemovePage() {
            ArtifactAggregate artifact = newArtifact();
            UUID kept = UUID.randomUUID();
            UUID removed = UUID.randomUUID();
            artifact.addPages(List.of(kept, removed));
            artifact.removePages(List.of(removed));

            projectAll(commit(artifact));

            assertThat(artifacts.findById(artifact.getId()).block().getPageIds()).containsExactly(kept);
        }
    }

    // ========================================================================
    // Page Projection Tests
    // ========================================================================

    @Nested
    @DisplayName("Page projection")
    class PageProjectionTests {

        @Test
        @DisplayName("should build the page document from its events")
        void shouldBuildDocument() {
            UUID artifactId = UUID.randomUUID();
            PageAggregate page = PageAggregate.create(UUID.randomUUID(), "page-2", artifactId, 1, CLOCK);
            CompoundMention aspirin = new CompoundMention("CC(=O)Oc1ccccc1C(=O)O", null, true, List.of(), null);
            page.updateCompoundMentions(List.of(aspirin));
            page.updateTagMentions(List.of(new TagMention("nsaid", null), new TagMention("analgesic", null)));
            page.recordTextEmbedding(new EmbeddingMetadata("text-embed-3", 1536, 2, NOW));
            page.recordSmilesEmbedding(new EmbeddingMetadata("chem-bert", 768, 1, NOW));

            projectAll(commit(page));

            StepVerifier.create(pages.findById(page.getId()))
                    .assertNext(document -> {
                        assertThat(document.getArtifactId()).isEqualTo(artifactId);
                        assertThat(document.getName()).isEqualTo("page-2");
                        assertThat(document.getIndex()).isEqualTo(1);
                        assertThat(document.getCompoundMentions()).containsExactly(aspirin);
                        assertThat(document.getTags()).containsExactly("nsaid", "analgesic");
                        assertThat(document.getTextEmbeddingModel()).isEqualTo("text-embed-3");
                        assertThat(document.getSmilesEmbeddingModel()).isEqualTo("chem-bert");
                        assertThat(document.getLastAppliedVersion()).isEqualTo(5);
                    })
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Version Rule Tests
    // ========================================================================

    @Nested
    @DisplayName("Version rules")
    class VersionRuleTests {

        @Test
        @DisplayName("should skip a redelivered event and leave the document unchanged")
        void shouldSkipRedelivery() {
            ArtifactAggregate artifact = newArtifact();
            artifact.updateTags(List.of("chemistry"));
            List<StoredEvent> events = commit(artifact);
            projectAll(events);
            ArtifactReadModel before = artifacts.findById(artifact.getId()).block();

            StepVerifier.create(engine.project(events.get(1)))
                    .expectNext(ProjectionOutcome.SKIPPED)
                    .verifyComplete();
            StepVerifier.create(engine.project(events.get(0)))
                    .expectNext(ProjectionOutcome.SKIPPED)
                    .verifyComplete();

            assertThat(artifacts.findById(artifact.getId()).block()).isEqualTo(before);
            assertThat(meterRegistry.counter("firefly.docstore.projections.skipped",
                    "aggregate.type", "artifact", "event.type", "artifact.tags_updated").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should raise an integrity fault on a version gap")
        void shouldFaultOnGap() {
            ArtifactAggregate artifact = newArtifact();
            artifact.updateTags(List.of("a"));
            artifact.updateTags(List.of("b"));
            List<StoredEvent> events = commit(artifact);
            engine.project(events.get(0)).block();

            StepVerifier.create(engine.project(events.get(2)))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(IntegrityFaultException.class);
                        IntegrityFaultException fault = (IntegrityFaultException) error;
                        assertThat(fault.getExpectedVersion()).isEqualTo(2);
                        assertThat(fault.getActualVersion()).isEqualTo(3);
                    })
                    .verify();
            assertThat(artifacts.findById(artifact.getId()).block().getLastAppliedVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("should raise an integrity fault for an update without a document")
        void shouldFaultOnMissingDocument() {
            ArtifactAggregate artifact = newArtifact();
            artifact.updateTags(List.of("orphan"));
            List<StoredEvent> events = commit(artifact);

            StepVerifier.create(engine.project(events.get(1)))
                    .expectError(IntegrityFaultException.class)
                    .verify();
        }

        @Test
        @DisplayName("should ignore events of an aggregate type without projection")
        void shouldIgnoreUnknownAggregateType() {
            ArtifactAggregate artifact = newArtifact();
            StoredEvent event = commit(artifact).get(0);
            EventEnvelope foreign = event.getEnvelope().toBuilder().aggregateType("collection").build();

            StepVerifier.create(engine.project(new StoredEvent(event.getPosition(), foreign)))
                    .expectNext(ProjectionOutcome.IGNORED)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject two projections for the same aggregate type")
        void shouldRejectDuplicateProjection() {
            assertThatThrownBy(() -> new ProjectionEngine(List.of(
                    new ArtifactProjection(artifacts, null),
                    new ArtifactProjection(artifacts, null))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("artifact");
        }
    }

    // ========================================================================
    // Query Tests
    // ========================================================================

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("should list live pages of an artifact in index order")
        void shouldListPagesInOrder() {
            UUID artifactId = UUID.randomUUID();
            PageAggregate third = PageAggregate.create(UUID.randomUUID(), "p3", artifactId, 2, CLOCK);
            PageAggregate first = PageAggregate.create(UUID.randomUUID(), "p1", artifactId, 0, CLOCK);
            PageAggregate deleted = PageAggregate.create(UUID.randomUUID(), "p2", artifactId, 1, CLOCK);
            deleted.delete();
            PageAggregate other = PageAggregate.create(UUID.randomUUID(), "x", UUID.randomUUID(), 0, CLOCK);
            projectAll(commit(third));
            projectAll(commit(first));
            projectAll(commit(deleted));
            projectAll(commit(other));

            DocumentQueryService queryService = new DocumentQueryService(artifacts, pages);

            StepVerifier.create(queryService.findPagesOfArtifact(artifactId).map(PageReadModel::getName))
                    .expectNext("p1", "p3")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should exclude deleted artifacts from the active list")
        void shouldListActiveArtifacts() {
            ArtifactAggregate live = newArtifact();
            ArtifactAggregate gone = newArtifact();
            gone.delete();
            projectAll(commit(live));
            projectAll(commit(gone));

            DocumentQueryService queryService = new DocumentQueryService(artifacts, pages);

            StepVerifier.create(queryService.findActiveArtifacts().map(ArtifactReadModel::getId))
                    .expectNext(live.getId())
                    .verifyComplete();
            StepVerifier.create(queryService.findArtifact(gone.getId()).map(ArtifactReadModel::isDeleted))
                    .expectNext(true)
                    .verifyComplete();
        }
    }
}

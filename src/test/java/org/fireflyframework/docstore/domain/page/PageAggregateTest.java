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
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
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
 * Unit tests for {@link PageAggregate}.
 */
class PageAggregateTest {

    private static final UUID PAGE_ID = UUID.randomUUID();
    private static final UUID ARTIFACT_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final CompoundMention ASPIRIN =
            new CompoundMention("CC(=O)Oc1ccccc1C(=O)O", null, true, List.of("CHEBI:15365"), null);

    private PageAggregate page;

    @BeforeEach
    void setUp() {
        page = PageAggregate.create(PAGE_ID, "page-1", ARTIFACT_ID, 0, CLOCK);
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("should emit a created event carrying the owning artifact")
        void shouldEmitCreatedEvent() {
            assertThat(page.getCurrentVersion()).isEqualTo(1);
            assertThat(page.getName()).isEqualTo("page-1");
            assertThat(page.getArtifactId()).isEqualTo(ARTIFACT_ID);
            assertThat(page.getIndex()).isZero();

            PageCreatedEvent event = (PageCreatedEvent) page.getUncommittedEvents().get(0).getPayload();
            assertThat(event.getArtifactId()).isEqualTo(ARTIFACT_ID);
            assertThat(page.getUncommittedEvents().get(0).getEventType()).isEqualTo("page.created");
        }

        @Test
        @DisplayName("should reject a negative index")
        void shouldRejectNegativeIndex() {
            assertThatThrownBy(() -> PageAggregate.create(UUID.randomUUID(), "page", ARTIFACT_ID, -1, CLOCK))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("index");
        }

        @Test
        @DisplayName("should reject a blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> PageAggregate.create(UUID.randomUUID(), "", ARTIFACT_ID, 0, CLOCK))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Extractions")
    class ExtractionTests {

        @Test
        @DisplayName("should replace compound mentions and skip identical lists")
        void shouldReplaceCompoundMentions() {
            page.updateCompoundMentions(List.of(ASPIRIN));
            page.updateCompoundMentions(List.of(ASPIRIN));

            assertThat(page.getCompoundMentions()).containsExactly(ASPIRIN);
            assertThat(page.getCurrentVersion()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject null compound mentions")
        void shouldRejectNullCompound() {
            List<CompoundMention> mentions = new ArrayList<>();
            mentions.add(null);

            assertThatThrownBy(() -> page.updateCompoundMentions(mentions))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should replace tag mentions")
        void shouldReplaceTagMentions() {
            page.updateTagMentions(List.of(new TagMention("analgesic", null)));

            assertThat(page.getTagMentions()).extracting(TagMention::tag).containsExactly("analgesic");
        }

        @Test
        @DisplayName("should set and clear the text mention")
        void shouldSetAndClearText() {
            page.updateTextMention(new TextMention("Acetylsalicylic acid is...", null));
            page.updateTextMention(null);

            assertThat(page.getTextMention()).isNull();
            assertThat(page.getCurrentVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("should store the summary candidate")
        void shouldStoreSummary() {
            SummaryCandidate candidate = new SummaryCandidate("A page about aspirin", false, null, null);

            page.updateSummaryCandidate(candidate);

            assertThat(page.getSummaryCandidate()).isEqualTo(candidate);
        }
    }

    @Nested
    @DisplayName("Embeddings")
    class EmbeddingTests {

        @Test
        @DisplayName("should emit an event on every recorded text embedding")
        void shouldEmitOnEveryTextEmbedding() {
            EmbeddingMetadata embedding = new EmbeddingMetadata("text-embed-3", 1536, 4, NOW);

            page.recordTextEmbedding(embedding);
            page.recordTextEmbedding(embedding);

            assertThat(page.getTextEmbedding()).isEqualTo(embedding);
            assertThat(page.getCurrentVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("should record the SMILES embedding separately")
        void shouldRecordSmilesEmbedding() {
            EmbeddingMetadata embedding = new EmbeddingMetadata("chem-bert", 768, 1, NOW);

            page.recordSmilesEmbedding(embedding);

            assertThat(page.getSmilesEmbedding()).isEqualTo(embedding);
            assertThat(page.getTextEmbedding()).isNull();
            assertThat(page.getUncommittedEvents().get(1).getEventType())
                    .isEqualTo("page.smiles_embedding_generated");
        }

        @Test
        @DisplayName("should reject embedding metadata without dimensions")
        void shouldRejectZeroDimensions() {
            assertThatThrownBy(() -> new EmbeddingMetadata("text-embed-3", 0, 1, NOW))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Delete")
    class DeleteTests {

        @Test
        @DisplayName("should delete once and reject later updates")
        void shouldDeleteOnce() {
            page.delete();
            page.delete();

            assertThat(page.isDeleted()).isTrue();
            assertThat(page.getDeletedAt()).isEqualTo(NOW);
            assertThat(page.getCurrentVersion()).isEqualTo(2);
            assertThatThrownBy(() -> page.updateWorkflowStatus("embedding_workflow", new WorkflowProgress.Pending(null)))
                    .isInstanceOf(InvalidOperationException.class);
        }
    }

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        @Test
        @DisplayName("should rebuild state after create, two updates and delete")
        void shouldReplayLifecycle() {
            TextMention text = new TextMention("Aspirin inhibits COX-1", null);
            page.updateCompoundMentions(List.of(ASPIRIN));
            page.updateTextMention(text);
            page.delete();

            PageAggregate replayed = new PageAggregate(PAGE_ID, CLOCK);
            replayed.loadFromHistory(page.getUncommittedEvents());

            assertThat(replayed.getCurrentVersion()).isEqualTo(4);
            assertThat(replayed.getArtifactId()).isEqualTo(ARTIFACT_ID);
            assertThat(replayed.getCompoundMentions()).containsExactly(ASPIRIN);
            assertThat(replayed.getTextMention()).isEqualTo(text);
            assertThat(replayed.isDeleted()).isTrue();
        }
    }
}

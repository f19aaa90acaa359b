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

import org.fireflyframework.docstore.domain.artifact.ArtifactAggregate;
import org.fireflyframework.docstore.domain.artifact.ArtifactCreatedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactDeletedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactPagesAddedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactPagesRemovedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactSummaryCandidateUpdatedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactTagsUpdatedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactTitleMentionUpdatedEvent;
import org.fireflyframework.docstore.domain.artifact.ArtifactWorkflowStatusUpdatedEvent;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds {@link ArtifactReadModel} documents from artifact events.
 */
public class ArtifactProjection extends AggregateProjection<ArtifactReadModel, ArtifactEvent> {

    public ArtifactProjection(ReadModelStore<ArtifactReadModel> store, @Nullable DocumentStoreMetrics metrics) {
        super(ArtifactAggregate.AGGREGATE_TYPE, ArtifactEvent.class, store, metrics);
    }

    @Override
    protected boolean isCreation(ArtifactEvent event) {
        return event instanceof ArtifactCreatedEvent;
    }

    @Override
    protected ArtifactReadModel fold(@Nullable ArtifactReadModel current, StoredEvent event, ArtifactEvent payload) {
        ArtifactReadModel.ArtifactReadModelBuilder builder = current == null
                ? ArtifactReadModel.builder().id(event.getAggregateId()).createdAt(event.getTimestamp())
                : current.toBuilder();
        builder.lastAppliedVersion(event.getVersion())
                .updatedAt(event.getTimestamp());
        return payload.accept(new Folder(current, builder)).build();
    }

    private static final class Folder implements ArtifactEvent.Visitor<ArtifactReadModel.ArtifactReadModelBuilder> {

        private final ArtifactReadModel current;
        private final ArtifactReadModel.ArtifactReadModelBuilder builder;

        private Folder(@Nullable ArtifactReadModel current, ArtifactReadModel.ArtifactReadModelBuilder builder) {
            this.current = current;
            this.builder = builder;
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactCreatedEvent event) {
            return builder.sourceUri(event.getSourceUri())
                    .sourceFilename(event.getSourceFilename())
                    .artifactType(event.getArtifactType())
                    .mimeType(event.getMimeType())
                    .storageLocation(event.getStorageLocation());
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactPagesAddedEvent event) {
            List<UUID> pageIds = new ArrayList<>(current.getPageIds());
            for (UUID pageId : event.getPageIds()) {
                if (!pageIds.contains(pageId)) {
                    pageIds.add(pageId);
                }
            }
            return builder.clearPageIds().pageIds(pageIds);
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactPagesRemovedEvent event) {
            List<UUID> pageIds = new ArrayList<>(current.getPageIds());
            pageIds.removeAll(event.getPageIds());
            return builder.clearPageIds().pageIds(pageIds);
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactTitleMentionUpdatedEvent event) {
            return builder.title(event.getTitleMention() != null ? event.getTitleMention().title() : null);
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactSummaryCandidateUpdatedEvent event) {
            SummaryCandidate candidate = event.getSummaryCandidate();
            if (candidate == null) {
                return builder.summary(null).summaryLocked(false);
            }
            String summary = candidate.humanCorrection() != null ? candidate.humanCorrection() : candidate.summary();
            return builder.summary(summary).summaryLocked(candidate.locked());
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactTagsUpdatedEvent event) {
            return builder.clearTags().tags(event.getTags());
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactWorkflowStatusUpdatedEvent event) {
            return builder.workflowStatus(event.getWorkflowName(), event.getProgress());
        }

        @Override
        public ArtifactReadModel.ArtifactReadModelBuilder visit(ArtifactDeletedEvent event) {
            return builder.deleted(true).deletedAt(event.getDeletedAt());
        }
    }
}

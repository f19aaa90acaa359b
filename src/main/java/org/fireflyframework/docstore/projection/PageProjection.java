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

import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TagMention;
import org.fireflyframework.docstore.domain.page.PageAggregate;
import org.fireflyframework.docstore.domain.page.PageCompoundMentionsUpdatedEvent;
import org.fireflyframework.docstore.domain.page.PageCreatedEvent;
import org.fireflyframework.docstore.domain.page.PageDeletedEvent;
import org.fireflyframework.docstore.domain.page.PageEvent;
import org.fireflyframework.docstore.domain.page.PageSmilesEmbeddingGeneratedEvent;
import org.fireflyframework.docstore.domain.page.PageSummaryCandidateUpdatedEvent;
import org.fireflyframework.docstore.domain.page.PageTagMentionsUpdatedEvent;
import org.fireflyframework.docstore.domain.page.PageTextEmbeddingGeneratedEvent;
import org.fireflyframework.docstore.domain.page.PageTextMentionUpdatedEvent;
import org.fireflyframework.docstore.domain.page.PageWorkflowStatusUpdatedEvent;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.springframework.lang.Nullable;

/**
 * Builds {@link PageReadModel} documents from page events.
 */
public class PageProjection extends AggregateProjection<PageReadModel, PageEvent> {

    public PageProjection(ReadModelStore<PageReadModel> store, @Nullable DocumentStoreMetrics metrics) {
        super(PageAggregate.AGGREGATE_TYPE, PageEvent.class, store, metrics);
    }

    @Override
    protected boolean isCreation(PageEvent event) {
        return event instanceof PageCreatedEvent;
    }

    @Override
    protected PageReadModel fold(@Nullable PageReadModel current, StoredEvent event, PageEvent payload) {
        PageReadModel.PageReadModelBuilder builder = current == null
                ? PageReadModel.builder().id(event.getAggregateId()).createdAt(event.getTimestamp())
                : current.toBuilder();
        builder.lastAppliedVersion(event.getVersion())
                .updatedAt(event.getTimestamp());
        return payload.accept(new Folder(builder)).build();
    }

    private static final class Folder implements PageEvent.Visitor<PageReadModel.PageReadModelBuilder> {

        private final PageReadModel.PageReadModelBuilder builder;

        private Folder(PageReadModel.PageReadModelBuilder builder) {
            this.builder = builder;
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageCreatedEvent event) {
            return builder.name(event.getName())
                    .artifactId(event.getArtifactId())
                    .index(event.getIndex());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageCompoundMentionsUpdatedEvent event) {
            return builder.clearCompoundMentions().compoundMentions(event.getCompoundMentions());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageTagMentionsUpdatedEvent event) {
            builder.clearTags();
            for (TagMention mention : event.getTagMentions()) {
                builder.tag(mention.tag());
            }
            return builder;
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageTextMentionUpdatedEvent event) {
            return builder.text(event.getTextMention() != null ? event.getTextMention().text() : null);
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageSummaryCandidateUpdatedEvent event) {
            SummaryCandidate candidate = event.getSummaryCandidate();
            if (candidate == null) {
                return builder.summary(null).summaryLocked(false);
            }
            String summary = candidate.humanCorrection() != null ? candidate.humanCorrection() : candidate.summary();
            return builder.summary(summary).summaryLocked(candidate.locked());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageTextEmbeddingGeneratedEvent event) {
            return builder.textEmbeddingModel(event.getEmbedding().model());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageSmilesEmbeddingGeneratedEvent event) {
            return builder.smilesEmbeddingModel(event.getEmbedding().model());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageWorkflowStatusUpdatedEvent event) {
            return builder.workflowStatus(event.getWorkflowName(), event.getProgress());
        }

        @Override
        public PageReadModel.PageReadModelBuilder visit(PageDeletedEvent event) {
            return builder.deleted(true).deletedAt(event.getDeletedAt());
        }
    }
}

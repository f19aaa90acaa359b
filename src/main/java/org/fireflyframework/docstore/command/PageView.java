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

import org.fireflyframework.docstore.domain.model.CompoundMention;
import org.fireflyframework.docstore.domain.model.EmbeddingMetadata;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TagMention;
import org.fireflyframework.docstore.domain.model.TextMention;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import org.fireflyframework.docstore.domain.page.PageAggregate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of a page returned by commands.
 */
public record PageView(
        UUID id,
        long version,
        String name,
        UUID artifactId,
        int index,
        List<CompoundMention> compoundMentions,
        List<TagMention> tagMentions,
        TextMention textMention,
        SummaryCandidate summaryCandidate,
        EmbeddingMetadata textEmbedding,
        EmbeddingMetadata smilesEmbedding,
        Map<String, WorkflowProgress> workflowStatuses,
        boolean deleted,
        Instant deletedAt
) {

    public static PageView of(PageAggregate page) {
        return new PageView(
                page.getId(),
                page.getCurrentVersion(),
                page.getName(),
                page.getArtifactId(),
                page.getIndex(),
                page.getCompoundMentions(),
                page.getTagMentions(),
                page.getTextMention(),
                page.getSummaryCandidate(),
                page.getTextEmbedding(),
                page.getSmilesEmbedding(),
                Map.copyOf(page.getWorkflowStatuses()),
                page.isDeleted(),
                page.getDeletedAt());
    }
}

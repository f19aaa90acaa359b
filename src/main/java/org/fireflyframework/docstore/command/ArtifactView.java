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
import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.domain.model.TitleMention;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of an artifact returned by commands.
 */
public record ArtifactView(
        UUID id,
        long version,
        String sourceUri,
        String sourceFilename,
        ArtifactType artifactType,
        String mimeType,
        String storageLocation,
        List<UUID> pageIds,
        TitleMention titleMention,
        SummaryCandidate summaryCandidate,
        List<String> tags,
        Map<String, WorkflowProgress> workflowStatuses,
        boolean deleted,
        Instant deletedAt
) {

    public static ArtifactView of(ArtifactAggregate artifact) {
        return new ArtifactView(
                artifact.getId(),
                artifact.getCurrentVersion(),
                artifact.getSourceUri(),
                artifact.getSourceFilename(),
                artifact.getArtifactType(),
                artifact.getMimeType(),
                artifact.getStorageLocation(),
                List.copyOf(artifact.getPageIds()),
                artifact.getTitleMention(),
                artifact.getSummaryCandidate(),
                List.copyOf(artifact.getTags()),
                Map.copyOf(artifact.getWorkflowStatuses()),
                artifact.isDeleted(),
                artifact.getDeletedAt());
    }
}

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

import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.domain.model.WorkflowProgress;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Query-side document of an artifact.
 */
@Value
@Builder(toBuilder = true)
public class ArtifactReadModel implements ReadModel {

    UUID id;
    String sourceUri;
    String sourceFilename;
    ArtifactType artifactType;
    String mimeType;
    String storageLocation;

    @Singular("pageId")
    List<UUID> pageIds;

    String title;
    String summary;
    boolean summaryLocked;

    @Singular("tag")
    List<String> tags;

    @Singular("workflowStatus")
    Map<String, WorkflowProgress> workflowStatuses;

    boolean deleted;
    Instant deletedAt;

    Instant createdAt;
    Instant updatedAt;
    long lastAppliedVersion;
}

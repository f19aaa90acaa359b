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
import org.fireflyframework.docstore.eventsourcing.event.DomainEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Domain Event: an artifact was registered for a newly ingested source document.
 */
@DomainEvent("artifact.created")
@Value
@Builder
@Jacksonized
public class ArtifactCreatedEvent implements ArtifactEvent {

    /**
     * Where the source document was fetched from.
     */
    String sourceUri;

    /**
     * The original file name of the source document.
     */
    String sourceFilename;

    ArtifactType artifactType;

    String mimeType;

    /**
     * Location of the stored original in blob storage.
     */
    String storageLocation;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}

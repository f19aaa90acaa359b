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

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.UUID;

/**
 * Read-side queries over the projected documents.
 * <p>
 * Results are eventually consistent with the event log: a document reflects the
 * events its projection has processed so far.
 */
@RequiredArgsConstructor
public class DocumentQueryService {

    private final ReadModelStore<ArtifactReadModel> artifacts;
    private final ReadModelStore<PageReadModel> pages;

    public Mono<ArtifactReadModel> findArtifact(UUID artifactId) {
        return artifacts.findById(artifactId);
    }

    public Mono<PageReadModel> findPage(UUID pageId) {
        return pages.findById(pageId);
    }

    /**
     * Lists the live pages of an artifact ordered by page index.
     */
    public Flux<PageReadModel> findPagesOfArtifact(UUID artifactId) {
        return pages.findAll()
                .filter(page -> artifactId.equals(page.getArtifactId()) && !page.isDeleted())
                .sort(Comparator.comparingInt(PageReadModel::getIndex));
    }

    /**
     * Lists the artifacts that have not been deleted.
     */
    public Flux<ArtifactReadModel> findActiveArtifacts() {
        return artifacts.findAll()
                .filter(artifact -> !artifact.isDeleted());
    }
}

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

package org.fireflyframework.docstore.domain.service;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of deleting an artifact together with its pages.
 * <p>
 * The artifact itself is always deleted when a result is produced. Page deletions
 * are independent of each other; a failed page never undoes the others.
 *
 * @param artifactId   the deleted artifact
 * @param pageResults  the outcome for each page, in the artifact's page order
 */
public record CascadeDeletionResult(UUID artifactId, List<PageDeletion> pageResults) {

    public CascadeDeletionResult {
        pageResults = List.copyOf(pageResults);
    }

    public boolean allSuccessful() {
        return pageResults.stream().allMatch(PageDeletion::success);
    }

    public List<UUID> deletedPageIds() {
        return pageResults.stream()
                .filter(PageDeletion::success)
                .map(PageDeletion::pageId)
                .toList();
    }

    public List<PageDeletion> failures() {
        return pageResults.stream()
                .filter(result -> !result.success())
                .toList();
    }

    /**
     * Outcome of deleting a single page.
     *
     * @param pageId       the page id
     * @param success      whether the page is now deleted
     * @param errorMessage why the deletion failed, null on success
     */
    public record PageDeletion(UUID pageId, boolean success, String errorMessage) {

        static PageDeletion deleted(UUID pageId) {
            return new PageDeletion(pageId, true, null);
        }

        static PageDeletion failed(UUID pageId, String errorMessage) {
            return new PageDeletion(pageId, false, errorMessage);
        }
    }
}

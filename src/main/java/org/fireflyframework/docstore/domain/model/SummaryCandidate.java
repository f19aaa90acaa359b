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

package org.fireflyframework.docstore.domain.model;

/**
 * A generated summary awaiting, or carrying, human review.
 *
 * @param summary         the summary text, never blank
 * @param locked          whether a reviewer locked the summary against regeneration
 * @param humanCorrection a reviewer's corrected text, if any
 * @param metadata        extraction provenance, may be null
 */
public record SummaryCandidate(
        String summary,
        boolean locked,
        String humanCorrection,
        ExtractionMetadata metadata
) {

    public SummaryCandidate {
        summary = Validations.requireText(summary, "summary");
        humanCorrection = Validations.trimToNull(humanCorrection);
    }
}

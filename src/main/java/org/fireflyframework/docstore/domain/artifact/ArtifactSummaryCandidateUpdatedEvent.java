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

import org.fireflyframework.docstore.domain.model.SummaryCandidate;
import org.fireflyframework.docstore.eventsourcing.event.DomainEvent;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Domain Event: the summary candidate of an artifact changed. A null candidate clears it.
 */
@DomainEvent("artifact.summary_candidate_updated")
@Value
@Builder
@Jacksonized
public class ArtifactSummaryCandidateUpdatedEvent implements ArtifactEvent {

    SummaryCandidate summaryCandidate;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}

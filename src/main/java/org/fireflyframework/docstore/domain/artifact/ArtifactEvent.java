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

import org.fireflyframework.docstore.eventsourcing.event.EventPayload;

import java.util.List;

/**
 * Closed family of events of the {@link ArtifactAggregate}.
 * <p>
 * Consumers handle the family through {@link Visitor}, so adding an event kind
 * breaks compilation until every fold and projection handles it.
 */
public sealed interface ArtifactEvent extends EventPayload
        permits ArtifactCreatedEvent, ArtifactPagesAddedEvent, ArtifactPagesRemovedEvent,
        ArtifactTitleMentionUpdatedEvent, ArtifactSummaryCandidateUpdatedEvent, ArtifactTagsUpdatedEvent,
        ArtifactWorkflowStatusUpdatedEvent, ArtifactDeletedEvent {

    List<Class<? extends EventPayload>> TYPES = List.of(
            ArtifactCreatedEvent.class,
            ArtifactPagesAddedEvent.class,
            ArtifactPagesRemovedEvent.class,
            ArtifactTitleMentionUpdatedEvent.class,
            ArtifactSummaryCandidateUpdatedEvent.class,
            ArtifactTagsUpdatedEvent.class,
            ArtifactWorkflowStatusUpdatedEvent.class,
            ArtifactDeletedEvent.class);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visit(ArtifactCreatedEvent event);

        R visit(ArtifactPagesAddedEvent event);

        R visit(ArtifactPagesRemovedEvent event);

        R visit(ArtifactTitleMentionUpdatedEvent event);

        R visit(ArtifactSummaryCandidateUpdatedEvent event);

        R visit(ArtifactTagsUpdatedEvent event);

        R visit(ArtifactWorkflowStatusUpdatedEvent event);

        R visit(ArtifactDeletedEvent event);
    }
}

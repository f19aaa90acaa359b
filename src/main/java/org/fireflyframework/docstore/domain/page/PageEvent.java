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

package org.fireflyframework.docstore.domain.page;

import org.fireflyframework.docstore.eventsourcing.event.EventPayload;

import java.util.List;

/**
 * Closed family of events of the {@link PageAggregate}.
 */
public sealed interface PageEvent extends EventPayload
        permits PageCreatedEvent, PageCompoundMentionsUpdatedEvent, PageTagMentionsUpdatedEvent,
        PageTextMentionUpdatedEvent, PageSummaryCandidateUpdatedEvent, PageTextEmbeddingGeneratedEvent,
        PageSmilesEmbeddingGeneratedEvent, PageWorkflowStatusUpdatedEvent, PageDeletedEvent {

    List<Class<? extends EventPayload>> TYPES = List.of(
            PageCreatedEvent.class,
            PageCompoundMentionsUpdatedEvent.class,
            PageTagMentionsUpdatedEvent.class,
            PageTextMentionUpdatedEvent.class,
            PageSummaryCandidateUpdatedEvent.class,
            PageTextEmbeddingGeneratedEvent.class,
            PageSmilesEmbeddingGeneratedEvent.class,
            PageWorkflowStatusUpdatedEvent.class,
            PageDeletedEvent.class);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visit(PageCreatedEvent event);

        R visit(PageCompoundMentionsUpdatedEvent event);

        R visit(PageTagMentionsUpdatedEvent event);

        R visit(PageTextMentionUpdatedEvent event);

        R visit(PageSummaryCandidateUpdatedEvent event);

        R visit(PageTextEmbeddingGeneratedEvent event);

        R visit(PageSmilesEmbeddingGeneratedEvent event);

        R visit(PageWorkflowStatusUpdatedEvent event);

        R visit(PageDeletedEvent event);
    }
}

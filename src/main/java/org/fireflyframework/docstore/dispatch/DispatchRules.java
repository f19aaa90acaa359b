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

package org.fireflyframework.docstore.dispatch;

import org.fireflyframework.docstore.domain.artifact.ArtifactCreatedEvent;
import org.fireflyframework.docstore.domain.page.PageCompoundMentionsUpdatedEvent;
import org.fireflyframework.docstore.domain.page.PageCreatedEvent;
import org.fireflyframework.docstore.domain.page.PageTextEmbeddingGeneratedEvent;
import org.fireflyframework.docstore.domain.page.PageTextMentionUpdatedEvent;
import org.fireflyframework.docstore.eventsourcing.event.EventPayload;
import org.fireflyframework.docstore.eventsourcing.event.StoredEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ingestion pipeline: which event starts which workflow.
 * <ul>
 *   <li>{@code artifact.created} - {@value #ARTIFACT_SAMPLE}</li>
 *   <li>{@code page.created} - {@value #COMPOUND_EXTRACTION}</li>
 *   <li>{@code page.text_mention_updated} with text - {@value #TEXT_EMBEDDING}</li>
 *   <li>{@code page.text_embedding_generated} - {@value #PAGE_SUMMARIZATION}</li>
 *   <li>{@code page.compound_mentions_updated} - {@value #SMILES_EMBEDDING}</li>
 * </ul>
 */
public final class DispatchRules {

    public static final String ARTIFACT_SAMPLE = "artifact_sample_workflow";
    public static final String COMPOUND_EXTRACTION = "compound_extraction_workflow";
    public static final String TEXT_EMBEDDING = "embedding_workflow";
    public static final String PAGE_SUMMARIZATION = "page_summarization_workflow";
    public static final String SMILES_EMBEDDING = "smiles_embedding_workflow";

    private DispatchRules() {
    }

    public static List<DispatchRule> defaults() {
        return List.of(
                new DispatchRule(type(ArtifactCreatedEvent.class), ARTIFACT_SAMPLE,
                        event -> true,
                        event -> {
                            ArtifactCreatedEvent created = (ArtifactCreatedEvent) event.getPayload();
                            Map<String, Object> payload = basePayload(event, "artifact_id");
                            payload.put("storage_location", created.getStorageLocation());
                            payload.put("mime_type", created.getMimeType());
                            return payload;
                        }),
                new DispatchRule(type(PageCreatedEvent.class), COMPOUND_EXTRACTION,
                        event -> true,
                        event -> {
                            PageCreatedEvent created = (PageCreatedEvent) event.getPayload();
                            Map<String, Object> payload = basePayload(event, "page_id");
                            payload.put("artifact_id", created.getArtifactId().toString());
                            payload.put("page_index", created.getIndex());
                            return payload;
                        }),
                new DispatchRule(type(PageTextMentionUpdatedEvent.class), TEXT_EMBEDDING,
                        event -> ((PageTextMentionUpdatedEvent) event.getPayload()).getTextMention() != null,
                        event -> basePayload(event, "page_id")),
                new DispatchRule(type(PageTextEmbeddingGeneratedEvent.class), PAGE_SUMMARIZATION,
                        event -> true,
                        event -> basePayload(event, "page_id")),
                new DispatchRule(type(PageCompoundMentionsUpdatedEvent.class), SMILES_EMBEDDING,
                        event -> true,
                        event -> basePayload(event, "page_id")));
    }

    private static String type(Class<? extends EventPayload> payloadClass) {
        return EventPayload.typeOf(payloadClass);
    }

    private static Map<String, Object> basePayload(StoredEvent event, String idField) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(idField, event.getAggregateId().toString());
        payload.put("event_type", event.getEventType());
        payload.put("event_version", event.getVersion());
        return payload;
    }
}

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

package org.fireflyframework.docstore.domain;

import org.fireflyframework.docstore.domain.artifact.ArtifactEvent;
import org.fireflyframework.docstore.domain.page.PageEvent;
import org.fireflyframework.docstore.eventsourcing.event.EventPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalogue of every event payload class of the document model, used to build
 * the event codec.
 */
public final class DocumentEventTypes {

    private DocumentEventTypes() {
    }

    public static List<Class<? extends EventPayload>> all() {
        List<Class<? extends EventPayload>> types = new ArrayList<>(ArtifactEvent.TYPES);
        types.addAll(PageEvent.TYPES);
        return List.copyOf(types);
    }
}

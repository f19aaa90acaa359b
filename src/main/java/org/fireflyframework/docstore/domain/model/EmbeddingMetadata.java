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

import org.fireflyframework.docstore.exception.ValidationException;

import java.time.Instant;

/**
 * Describes an embedding generated for a page. The vectors themselves live in an
 * external vector index.
 *
 * @param model       the embedding model name
 * @param dimensions  vector dimensions, positive
 * @param chunkCount  number of embedded chunks
 * @param generatedAt when the embedding was generated
 */
public record EmbeddingMetadata(String model, int dimensions, int chunkCount, Instant generatedAt) {

    public EmbeddingMetadata {
        model = Validations.requireText(model, "model");
        if (dimensions <= 0) {
            throw new ValidationException("dimensions must be positive, got " + dimensions);
        }
        Validations.requireNonNegative(chunkCount, "chunkCount");
        Validations.requirePresent(generatedAt, "generatedAt");
    }
}

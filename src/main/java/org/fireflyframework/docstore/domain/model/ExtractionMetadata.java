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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provenance of a value produced by an extraction model.
 * <p>
 * {@code additionalModelParams} is held in its JSON form: entries with a null value are
 * dropped and every value is converted to the type it decodes to from JSON (small
 * integers become {@code Integer}, instants become ISO-8601 strings, nested objects
 * become maps). A decoded event therefore yields a metadata value equal to the one the
 * command produced.
 *
 * @param confidence            model confidence between 0 and 1, or null if not reported
 * @param dateExtracted         when the value was extracted
 * @param modelName             the model that produced the value
 * @param additionalModelParams free-form model parameters
 * @param pipelineRunId         the pipeline run that produced the value
 */
public record ExtractionMetadata(
        Double confidence,
        Instant dateExtracted,
        String modelName,
        Map<String, Object> additionalModelParams,
        String pipelineRunId
) {

    private static final ObjectMapper PARAMS_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    public ExtractionMetadata {
        if (confidence != null) {
            Validations.requireFraction(confidence, "confidence");
        }
        additionalModelParams = normalizeParams(additionalModelParams);
    }

    private static Map<String, Object> normalizeParams(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return Map.of();
        }
        LinkedHashMap<String, Object> present = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key != null && value != null) {
                present.put(key, value);
            }
        });
        try {
            LinkedHashMap<String, Object> normalized =
                    PARAMS_MAPPER.readValue(PARAMS_MAPPER.writeValueAsBytes(present), PARAMS_TYPE);
            return Collections.unmodifiableMap(normalized);
        } catch (IOException e) {
            throw new ValidationException("additionalModelParams cannot be represented as JSON: " + e.getMessage());
        }
    }
}

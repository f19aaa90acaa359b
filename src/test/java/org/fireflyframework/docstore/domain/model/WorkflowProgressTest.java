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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowProgressTest {

    private static final Instant STARTED = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    @DisplayName("should mark completed and failed as terminal")
    void shouldReportTerminalStates() {
        assertThat(new WorkflowProgress.Pending("queued").terminal()).isFalse();
        assertThat(new WorkflowProgress.InProgress("run-1", null, 0.3, STARTED).terminal()).isFalse();
        assertThat(new WorkflowProgress.Completed("run-1", null, STARTED, STARTED.plusSeconds(5)).terminal()).isTrue();
        assertThat(new WorkflowProgress.Failed("run-1", "boom", STARTED, STARTED.plusSeconds(5)).terminal()).isTrue();
    }

    @Test
    @DisplayName("should reject progress outside zero to one")
    void shouldRejectProgressOutOfRange() {
        assertThatThrownBy(() -> new WorkflowProgress.InProgress("run-1", null, 1.5, STARTED))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("progress");
    }

    @Test
    @DisplayName("should reject completion before start")
    void shouldRejectCompletionBeforeStart() {
        assertThatThrownBy(() -> new WorkflowProgress.Completed("run-1", null, STARTED, STARTED.minusSeconds(1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("should require an error message on failure")
    void shouldRequireErrorMessage() {
        assertThatThrownBy(() -> new WorkflowProgress.Failed("run-1", " ", STARTED, STARTED))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("errorMessage");
    }

    @Test
    @DisplayName("should serialize with a status discriminator")
    void shouldSerializeWithStatus() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        WorkflowProgress progress = new WorkflowProgress.Failed("run-1", "engine unavailable", STARTED, STARTED);

        String json = mapper.writeValueAsString(progress);

        assertThat(json).contains("\"status\":\"FAILED\"");
        assertThat(mapper.readValue(json, WorkflowProgress.class)).isEqualTo(progress);
    }
}

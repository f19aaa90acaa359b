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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.fireflyframework.docstore.exception.ValidationException;

import java.time.Instant;

/**
 * Status of one named workflow run against an aggregate.
 * <p>
 * Each state carries only the fields that are meaningful for it:
 * <ul>
 *   <li>{@link Pending} - queued, nothing started</li>
 *   <li>{@link InProgress} - running, optional progress fraction</li>
 *   <li>{@link Completed} - finished, completion not before start</li>
 *   <li>{@link Failed} - finished with a required error message</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkflowProgress.Pending.class, name = "PENDING"),
        @JsonSubTypes.Type(value = WorkflowProgress.InProgress.class, name = "IN_PROGRESS"),
        @JsonSubTypes.Type(value = WorkflowProgress.Completed.class, name = "COMPLETED"),
        @JsonSubTypes.Type(value = WorkflowProgress.Failed.class, name = "FAILED")
})
public sealed interface WorkflowProgress {

    /**
     * Whether the workflow run has finished, successfully or not.
     */
    boolean terminal();

    record Pending(String message) implements WorkflowProgress {

        @Override
        public boolean terminal() {
            return false;
        }
    }

    /**
     * @param workflowRunId the engine's run id
     * @param message       free-form status message
     * @param progress      completion fraction between 0 and 1, or null if unknown
     * @param startedAt     when the run started
     */
    record InProgress(String workflowRunId, String message, Double progress, Instant startedAt)
            implements WorkflowProgress {

        public InProgress {
            if (progress != null) {
                Validations.requireFraction(progress, "progress");
            }
        }

        @Override
        public boolean terminal() {
            return false;
        }
    }

    record Completed(String workflowRunId, String message, Instant startedAt, Instant completedAt)
            implements WorkflowProgress {

        public Completed {
            Validations.requirePresent(completedAt, "completedAt");
            if (startedAt != null && completedAt.isBefore(startedAt)) {
                throw new ValidationException("completedAt " + completedAt + " is before startedAt " + startedAt);
            }
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Failed(String workflowRunId, String errorMessage, Instant startedAt, Instant failedAt)
            implements WorkflowProgress {

        public Failed {
            errorMessage = Validations.requireText(errorMessage, "errorMessage");
            Validations.requirePresent(failedAt, "failedAt");
            if (startedAt != null && failedAt.isBefore(startedAt)) {
                throw new ValidationException("failedAt " + failedAt + " is before startedAt " + startedAt);
            }
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}

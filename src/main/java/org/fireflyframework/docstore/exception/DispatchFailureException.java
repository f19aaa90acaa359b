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

package org.fireflyframework.docstore.exception;

import lombok.Getter;

/**
 * Thrown when a workflow start call could not be completed within its retry budget.
 * <p>
 * The event that triggered the dispatch is not rescheduled.
 */
@Getter
public class DispatchFailureException extends DocumentStoreException {

    private final String workflowName;
    private final String idempotencyKey;

    public DispatchFailureException(String workflowName, String idempotencyKey, Throwable cause) {
        super("Failed to start workflow '" + workflowName + "' with key " + idempotencyKey
                + ": " + cause.getMessage(), cause);
        this.workflowName = workflowName;
        this.idempotencyKey = idempotencyKey;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.DISPATCH_FAILURE;
    }
}

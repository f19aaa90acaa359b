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

/**
 * Classification of failures raised by the document store.
 * <p>
 * Callers branch on the kind, never on message text.
 */
public enum ErrorKind {

    /**
     * A command argument was rejected before any event was emitted.
     */
    VALIDATION,

    /**
     * The expected aggregate version did not match the stored version.
     */
    CONCURRENCY,

    /**
     * No events exist for the requested aggregate.
     */
    NOT_FOUND,

    /**
     * A mutating command was issued against a deleted aggregate.
     */
    INVALID_OPERATION,

    /**
     * A workflow start call exhausted its retry budget.
     */
    DISPATCH_FAILURE,

    /**
     * A version gap was detected while projecting or replaying events.
     */
    INTEGRITY_FAULT;

    /**
     * Checks if this kind is reported back to command callers as a typed failure.
     *
     * @return true for validation, concurrency, not-found and invalid-operation failures
     */
    public boolean isCommandFailure() {
        return this == VALIDATION || this == CONCURRENCY || this == NOT_FOUND || this == INVALID_OPERATION;
    }
}

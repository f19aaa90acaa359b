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

import java.util.Objects;
import java.util.UUID;

/**
 * Derives workflow idempotency keys.
 * <p>
 * A key depends only on the workflow name and the aggregate id, never on time or
 * randomness, so redelivering an event always yields the same key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    /**
     * Returns {@code "{workflowName}-{aggregateId}"}.
     */
    public static String of(String workflowName, UUID aggregateId) {
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(aggregateId, "aggregateId");
        return workflowName + "-" + aggregateId;
    }
}

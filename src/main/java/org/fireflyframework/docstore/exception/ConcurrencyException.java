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

import java.util.UUID;

/**
 * Thrown when an append is attempted with a stale expected version.
 * <p>
 * The caller must reload the aggregate and retry the command.
 */
@Getter
public class ConcurrencyException extends DocumentStoreException {

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super("Aggregate " + aggregateId + " is at version " + actualVersion
                + " but version " + expectedVersion + " was expected");
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONCURRENCY;
    }
}

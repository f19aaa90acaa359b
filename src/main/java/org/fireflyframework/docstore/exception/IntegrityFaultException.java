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
 * Thrown when the events of one aggregate are observed with a version gap.
 * <p>
 * A consumer receiving this fault halts instead of skipping the event.
 */
@Getter
public class IntegrityFaultException extends DocumentStoreException {

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public IntegrityFaultException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super("Version gap for aggregate " + aggregateId + ": expected version "
                + expectedVersion + " but received " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTEGRITY_FAULT;
    }
}

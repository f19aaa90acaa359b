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
 * Thrown when no events exist for the requested aggregate id and type.
 */
@Getter
public class AggregateNotFoundException extends DocumentStoreException {

    private final UUID aggregateId;
    private final String aggregateType;

    public AggregateNotFoundException(String aggregateType, UUID aggregateId) {
        super(aggregateType + " " + aggregateId + " not found");
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}

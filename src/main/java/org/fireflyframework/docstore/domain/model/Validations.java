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

import java.util.List;

/**
 * Argument checks shared by value objects and aggregates.
 * All failures are reported as {@link ValidationException}.
 */
public final class Validations {

    private Validations() {
    }

    /**
     * Requires a non-blank string.
     *
     * @param value the value to check
     * @param field the field name used in the error message
     * @return the value with surrounding whitespace removed
     */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value.strip();
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    /**
     * Requires a list without null elements.
     *
     * @return an immutable copy of the list
     */
    public static <T> List<T> requireElements(List<T> values, String field) {
        requirePresent(values, field);
        for (T value : values) {
            if (value == null) {
                throw new ValidationException(field + " must not contain null elements");
            }
        }
        return List.copyOf(values);
    }

    public static double requireFraction(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be between 0 and 1, got " + value);
        }
        return value;
    }

    public static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new ValidationException(field + " must not be negative, got " + value);
        }
        return value;
    }

    /**
     * Trims an optional string, mapping blank input to {@code null}.
     */
    public static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}

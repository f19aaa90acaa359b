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

package org.fireflyframework.docstore.command;

import java.util.function.Function;

/**
 * Result of a command: either the resulting state or a typed error.
 *
 * @param <T> the value type on success
 */
public sealed interface CommandResult<T> {

    static <T> CommandResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> CommandResult<T> failure(CommandError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    <U> CommandResult<U> map(Function<? super T, ? extends U> mapper);

    record Success<T>(T value) implements CommandResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> CommandResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(CommandError error) implements CommandResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> CommandResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }
    }
}

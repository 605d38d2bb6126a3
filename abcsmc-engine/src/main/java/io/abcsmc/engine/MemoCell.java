package io.abcsmc.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Objects;
import java.util.function.Supplier;

/// Lazily computed value, kept until [#reset()].
///
/// Not thread-safe; owned by the engine thread.
///
/// @param <T> the value type
public final class MemoCell<T> {

    private T value;

    /// @param supplier computes the value on first access, must not return null
    /// @return the cached value
    public T get(Supplier<? extends T> supplier) {
        if (value == null) {
            value = Objects.requireNonNull(supplier.get(), "memoized value");
        }
        return value;
    }

    public boolean isPresent() {
        return value != null;
    }

    public void reset() {
        value = null;
    }
}

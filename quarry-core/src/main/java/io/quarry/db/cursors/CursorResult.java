/*
 * CursorResult.java
 *
 * This source file is part of the Quarry open source project
 *
 * Copyright 2024-2026 the Quarry project authors
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

package io.quarry.db.cursors;

import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * The result of one {@link Cursor#getNext()}: either a value, or the reason there is no next value.
 * @param <T> the type of the value
 */
@API(API.Status.STABLE)
public final class CursorResult<T> {
    private static final CursorResult<Object> EXHAUSTED = new CursorResult<>(false, null, NoNextReason.SOURCE_EXHAUSTED);
    private static final CursorResult<Object> LIMIT_REACHED = new CursorResult<>(false, null, NoNextReason.RETURN_LIMIT_REACHED);

    private final boolean hasNext;
    @Nullable
    private final T value;
    @Nullable
    private final NoNextReason noNextReason;

    private CursorResult(boolean hasNext, @Nullable T value, @Nullable NoNextReason noNextReason) {
        this.hasNext = hasNext;
        this.value = value;
        this.noNextReason = noNextReason;
    }

    @Nonnull
    public static <T> CursorResult<T> withNextValue(@Nullable T value) {
        return new CursorResult<>(true, value, null);
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> CursorResult<T> exhausted() {
        return (CursorResult<T>) EXHAUSTED;
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> CursorResult<T> limitReached() {
        return (CursorResult<T>) LIMIT_REACHED;
    }

    public boolean hasNext() {
        return hasNext;
    }

    /**
     * Get the value.
     * @return the value of this result
     * @throws NoSuchElementException if this result has no value
     */
    @Nullable
    public T get() {
        if (!hasNext) {
            throw new NoSuchElementException("cursor result has no value: " + noNextReason);
        }
        return value;
    }

    /**
     * Get why there is no next value.
     * @return the reason
     * @throws IllegalStateException if this result has a value
     */
    @Nonnull
    public NoNextReason getNoNextReason() {
        if (hasNext) {
            throw new IllegalStateException("cursor result has a value");
        }
        return noNextReason;
    }

    @Nonnull
    public <U> CursorResult<U> map(@Nonnull Function<? super T, ? extends U> function) {
        if (hasNext) {
            return withNextValue(function.apply(value));
        }
        @SuppressWarnings("unchecked")
        final CursorResult<U> same = (CursorResult<U>) this;
        return same;
    }

    @Override
    public String toString() {
        return hasNext ? "CursorResult{" + value + "}" : "CursorResult{" + noNextReason + "}";
    }

    /**
     * Why a cursor stopped.
     */
    public enum NoNextReason {
        /**
         * The underlying source has no more elements.
         */
        SOURCE_EXHAUSTED,
        /**
         * A row limit stopped the cursor. The source may have more elements.
         */
        RETURN_LIMIT_REACHED;

        public boolean isSourceExhausted() {
            return this == SOURCE_EXHAUSTED;
        }
    }
}

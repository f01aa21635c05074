/*
 * FilterCursor.java
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
import java.util.function.Predicate;

/**
 * A cursor that only returns the elements of its inner cursor that match a predicate. An exception thrown by
 * the predicate propagates out of {@link #getNext()}.
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class FilterCursor<T> implements Cursor<T> {
    @Nonnull
    private final Cursor<T> inner;
    @Nonnull
    private final Predicate<? super T> predicate;

    public FilterCursor(@Nonnull Cursor<T> inner, @Nonnull Predicate<? super T> predicate) {
        this.inner = inner;
        this.predicate = predicate;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        CursorResult<T> result = inner.getNext();
        while (result.hasNext() && !predicate.test(result.get())) {
            result = inner.getNext();
        }
        return result;
    }

    @Override
    public void close() {
        inner.close();
    }

    @Override
    public boolean isClosed() {
        return inner.isClosed();
    }
}

/*
 * SkipCursor.java
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

/**
 * A cursor that discards the first elements of its inner cursor. Skipping is positional, so each skipped element
 * is still produced by the inner cursor.
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class SkipCursor<T> implements Cursor<T> {
    @Nonnull
    private final Cursor<T> inner;
    private int remaining;

    public SkipCursor(@Nonnull Cursor<T> inner, int skip) {
        this.inner = inner;
        this.remaining = skip;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        while (remaining > 0) {
            final CursorResult<T> skipped = inner.getNext();
            if (!skipped.hasNext()) {
                remaining = 0;
                return skipped;
            }
            remaining--;
        }
        return inner.getNext();
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

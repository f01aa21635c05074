/*
 * RowLimitedCursor.java
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

/**
 * A cursor that limits the number of elements that it allows through.
 *
 * <p>
 * The inner cursor is closed as soon as the last allowed element has been pulled from it, and is never asked
 * for one more element. With a limit of zero it is closed without being read at all.
 * </p>
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class RowLimitedCursor<T> implements Cursor<T> {
    @Nonnull
    private final Cursor<T> inner;
    private final int limit;
    private int soFar;
    @Nullable
    private CursorResult<T> noNextResult;

    public RowLimitedCursor(@Nonnull Cursor<T> inner, int limit) {
        this.inner = inner;
        this.limit = limit;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        if (noNextResult != null) {
            return noNextResult;
        }
        if (soFar >= limit) {
            inner.close();
            noNextResult = CursorResult.limitReached();
            return noNextResult;
        }
        final CursorResult<T> result = inner.getNext();
        if (!result.hasNext()) {
            noNextResult = result;
            return result;
        }
        soFar++;
        if (soFar >= limit) {
            inner.close();
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

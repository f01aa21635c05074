/*
 * ListCursor.java
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
import java.util.List;

/**
 * A cursor over a list held in memory.
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class ListCursor<T> implements Cursor<T> {
    @Nonnull
    private final List<? extends T> list;
    private int nextPosition;
    private boolean closed;

    public ListCursor(@Nonnull List<? extends T> list) {
        this.list = list;
    }

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        if (closed || nextPosition >= list.size()) {
            return CursorResult.exhausted();
        }
        return CursorResult.withNextValue(list.get(nextPosition++));
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}

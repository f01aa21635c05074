/*
 * EmptyCursor.java
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
 * A cursor that returns no elements.
 * @param <T> the type of elements of the cursor
 */
@API(API.Status.UNSTABLE)
public class EmptyCursor<T> implements Cursor<T> {
    private boolean closed;

    @Nonnull
    @Override
    public CursorResult<T> getNext() {
        return CursorResult.exhausted();
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

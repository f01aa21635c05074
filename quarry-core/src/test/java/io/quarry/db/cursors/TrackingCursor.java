/*
 * TrackingCursor.java
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

import io.quarry.db.document.Document;
import io.quarry.db.document.FieldBuffer;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * A cursor over {@code {"n": 0}, {"n": 1}, ...} that records how many documents were pulled and whether it was
 * closed.
 */
class TrackingCursor implements Cursor<Document> {
    private final int size;
    private int pulled;
    private int closeCount;

    TrackingCursor(int size) {
        this.size = size;
    }

    @Nonnull
    @Override
    public CursorResult<Document> getNext() {
        if (closeCount > 0) {
            throw new IllegalStateException("read after close");
        }
        if (pulled >= size) {
            return CursorResult.exhausted();
        }
        return CursorResult.withNextValue(FieldBuffer.of("n", pulled++));
    }

    @Override
    public void close() {
        closeCount++;
    }

    @Override
    public boolean isClosed() {
        return closeCount > 0;
    }

    int getPulled() {
        return pulled;
    }

    static List<Integer> numbers(@Nonnull List<Document> documents) {
        final List<Integer> numbers = new ArrayList<>();
        for (Document document : documents) {
            numbers.add(document.getByField("n").convertToInt());
        }
        return numbers;
    }
}

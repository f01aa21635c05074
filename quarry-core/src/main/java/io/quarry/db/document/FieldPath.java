/*
 * FieldPath.java
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

package io.quarry.db.document;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A path to a possibly nested field, written with dots: {@code address.city} or {@code tags.0}. A purely numeric
 * segment addresses an array element when the value at that point is an array, and a field of that name when it
 * is a document.
 */
@API(API.Status.STABLE)
public final class FieldPath {
    private static final Splitter DOT = Splitter.on('.');

    @Nonnull
    private final List<String> segments;

    private FieldPath(@Nonnull List<String> segments) {
        this.segments = segments;
    }

    @Nonnull
    public static FieldPath parse(@Nonnull String path) {
        if (Strings.isNullOrEmpty(path)) {
            throw new QuarryArgumentException("field path must not be empty");
        }
        final List<String> segments = DOT.splitToList(path);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new QuarryArgumentException("field path has an empty segment", LogMessageKeys.FIELD_PATH, path);
            }
        }
        return new FieldPath(ImmutableList.copyOf(segments));
    }

    @Nonnull
    public static FieldPath of(@Nonnull String... segments) {
        if (segments.length == 0) {
            throw new QuarryArgumentException("field path must not be empty");
        }
        return new FieldPath(ImmutableList.copyOf(segments));
    }

    @Nonnull
    public List<String> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    @Nonnull
    public String getFirst() {
        return segments.get(0);
    }

    @Nonnull
    public FieldPath getRest() {
        if (segments.size() < 2) {
            throw new IllegalStateException("path has no remaining segments");
        }
        return new FieldPath(segments.subList(1, segments.size()));
    }

    /**
     * Get the value at this path.
     * @param document the document to read
     * @return the value
     * @throws FieldNotFoundException if any segment of the path is missing
     */
    @Nonnull
    public Value getValue(@Nonnull Document document) {
        Value current = document.getByField(segments.get(0));
        for (int i = 1; i < segments.size(); i++) {
            current = step(current, segments.get(i));
        }
        return current;
    }

    @Nonnull
    private Value step(@Nonnull Value current, @Nonnull String segment) {
        if (current.getType() == ValueType.DOCUMENT) {
            return current.asDocument().getByField(segment);
        }
        if (current.getType() == ValueType.ARRAY) {
            final int index = arrayIndex(segment);
            final List<Value> elements = current.asArray();
            if (index >= 0 && index < elements.size()) {
                return elements.get(index);
            }
        }
        throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_PATH, this);
    }

    /**
     * Parse a segment as an array index.
     * @param segment a path segment
     * @return the index, or {@code -1} if the segment is not a non-negative integer
     */
    static int arrayIndex(@Nonnull String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return segments.equals(((FieldPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}

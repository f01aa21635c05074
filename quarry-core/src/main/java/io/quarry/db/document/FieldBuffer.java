/*
 * FieldBuffer.java
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

import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A mutable document that keeps its fields in insertion order. Used to build documents for insertion and to
 * apply updates.
 */
@API(API.Status.STABLE)
public class FieldBuffer implements Document {
    @Nonnull
    private final Map<String, Value> fields = new LinkedHashMap<>();

    public FieldBuffer() {
    }

    /**
     * Create a buffer from alternating field names and values. Values go through {@link Value#of(Object)}.
     * @param namesAndValues alternating names and values
     * @return a new buffer
     */
    @Nonnull
    public static FieldBuffer of(@Nonnull Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new QuarryArgumentException("unbalanced field names and values");
        }
        final FieldBuffer buffer = new FieldBuffer();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            buffer.add(String.valueOf(namesAndValues[i]), Value.of(namesAndValues[i + 1]));
        }
        return buffer;
    }

    @Nonnull
    public static FieldBuffer copyOf(@Nonnull Document document) {
        final FieldBuffer buffer = new FieldBuffer();
        buffer.copyFrom(document);
        return buffer;
    }

    /**
     * Add or replace a top-level field. A replaced field keeps its position.
     * @param field the field name
     * @param value the value
     * @return this buffer
     */
    @Nonnull
    public FieldBuffer add(@Nonnull String field, @Nonnull Value value) {
        fields.put(field, value);
        return this;
    }

    @Nonnull
    public FieldBuffer copyFrom(@Nonnull Document document) {
        document.iterate(this::add);
        return this;
    }

    /**
     * Set the value at a path. The last segment is added if missing; every earlier segment must exist.
     * @param path the path to set
     * @param value the new value
     * @throws FieldNotFoundException if an intermediate segment is missing
     */
    public void set(@Nonnull FieldPath path, @Nonnull Value value) {
        if (path.size() == 1) {
            add(path.getFirst(), value);
            return;
        }
        final Value child = getByField(path.getFirst());
        add(path.getFirst(), setIn(child, path.getRest(), value, path));
    }

    @Nonnull
    private static Value setIn(@Nonnull Value container, @Nonnull FieldPath rest, @Nonnull Value value,
                               @Nonnull FieldPath fullPath) {
        if (container.getType() == ValueType.DOCUMENT) {
            final FieldBuffer copy = copyOf(container.asDocument());
            copy.set(rest, value);
            return Value.ofDocument(copy);
        }
        if (container.getType() == ValueType.ARRAY) {
            final int index = FieldPath.arrayIndex(rest.getFirst());
            final List<Value> elements = new ArrayList<>(container.asArray());
            if (index >= 0 && index < elements.size()) {
                elements.set(index, rest.size() == 1 ? value : setIn(elements.get(index), rest.getRest(), value, fullPath));
                return Value.ofArray(elements);
            }
        }
        throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_PATH, fullPath);
    }

    /**
     * Remove the value at a path.
     * @param path the path to remove
     * @throws FieldNotFoundException if the path does not exist
     */
    public void delete(@Nonnull FieldPath path) {
        if (path.size() == 1) {
            if (fields.remove(path.getFirst()) == null) {
                throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_PATH, path);
            }
            return;
        }
        final Value child = getByField(path.getFirst());
        add(path.getFirst(), deleteIn(child, path.getRest(), path));
    }

    @Nonnull
    private static Value deleteIn(@Nonnull Value container, @Nonnull FieldPath rest, @Nonnull FieldPath fullPath) {
        if (container.getType() == ValueType.DOCUMENT) {
            final FieldBuffer copy = copyOf(container.asDocument());
            copy.delete(rest);
            return Value.ofDocument(copy);
        }
        if (container.getType() == ValueType.ARRAY) {
            final int index = FieldPath.arrayIndex(rest.getFirst());
            final List<Value> elements = new ArrayList<>(container.asArray());
            if (index >= 0 && index < elements.size()) {
                if (rest.size() == 1) {
                    elements.remove(index);
                } else {
                    elements.set(index, deleteIn(elements.get(index), rest.getRest(), fullPath));
                }
                return Value.ofArray(elements);
            }
        }
        throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_PATH, fullPath);
    }

    @Nonnull
    @Override
    public Value getByField(@Nonnull String field) {
        final Value value = fields.get(field);
        if (value == null) {
            throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_NAME, field);
        }
        return value;
    }

    @Override
    public void iterate(@Nonnull FieldVisitor visitor) {
        for (Map.Entry<String, Value> entry : fields.entrySet()) {
            visitor.visit(entry.getKey(), entry.getValue());
        }
    }

    public int size() {
        return fields.size();
    }

    public void reset() {
        fields.clear();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldBuffer)) {
            return false;
        }
        return fields.equals(((FieldBuffer) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return Documents.toString(this);
    }
}

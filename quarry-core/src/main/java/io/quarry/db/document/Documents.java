/*
 * Documents.java
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

import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helpers over arbitrary {@link Document} implementations.
 */
@API(API.Status.INTERNAL)
public final class Documents {
    private Documents() {
    }

    @Nonnull
    public static Map<String, Value> toMap(@Nonnull Document document) {
        final Map<String, Value> fields = new LinkedHashMap<>();
        document.iterate(fields::put);
        return fields;
    }

    @Nonnull
    public static List<String> fieldNames(@Nonnull Document document) {
        final ImmutableList.Builder<String> names = ImmutableList.builder();
        document.iterate((field, value) -> names.add(field));
        return names.build();
    }

    /**
     * Query equality of two documents: the same field names, each with values that are
     * {@linkplain Value#isEqualTo equal}. Field order is ignored.
     * @param a a document
     * @param b another document
     * @return whether the documents are equal
     */
    public static boolean equal(@Nonnull Document a, @Nonnull Document b) {
        final Map<String, Value> left = toMap(a);
        final Map<String, Value> right = toMap(b);
        if (!left.keySet().equals(right.keySet())) {
            return false;
        }
        for (Map.Entry<String, Value> entry : left.entrySet()) {
            if (!entry.getValue().isEqualTo(right.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    public static String toString(@Nonnull Document document) {
        final StringJoiner joiner = new StringJoiner(", ", "{", "}");
        document.iterate((field, value) -> joiner.add('"' + field + "\": " + value));
        return joiner.toString();
    }
}

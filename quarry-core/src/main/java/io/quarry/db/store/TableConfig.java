/*
 * TableConfig.java
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

package io.quarry.db.store;

import io.quarry.annotation.API;
import io.quarry.db.document.Document;
import io.quarry.db.document.Documents;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The configuration of a table. A table either declares the field path of its primary key, or its documents
 * are keyed by an integer taken from the table's sequence.
 */
@API(API.Status.STABLE)
public final class TableConfig {
    private static final String PRIMARY_KEY_FIELD = "primary_key";

    @Nonnull
    public static final TableConfig DEFAULT = newBuilder().build();

    @Nullable
    private final FieldPath primaryKey;

    private TableConfig(@Nullable FieldPath primaryKey) {
        this.primaryKey = primaryKey;
    }

    @Nullable
    public FieldPath getPrimaryKey() {
        return primaryKey;
    }

    public boolean hasPrimaryKey() {
        return primaryKey != null;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder().setPrimaryKey(primaryKey);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    Document toDocument() {
        final FieldBuffer buffer = new FieldBuffer();
        if (primaryKey != null) {
            buffer.add(PRIMARY_KEY_FIELD, Value.ofText(primaryKey.toString()));
        }
        return buffer;
    }

    @Nonnull
    static TableConfig fromDocument(@Nonnull Document document) {
        final Builder builder = newBuilder();
        for (String field : Documents.fieldNames(document)) {
            if (PRIMARY_KEY_FIELD.equals(field)) {
                builder.setPrimaryKey(FieldPath.parse(document.getByField(field).asText()));
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(primaryKey, ((TableConfig) o).primaryKey);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(primaryKey);
    }

    @Override
    public String toString() {
        return "TableConfig{primaryKey=" + primaryKey + "}";
    }

    /**
     * Builder for {@link TableConfig}.
     */
    public static final class Builder {
        @Nullable
        private FieldPath primaryKey;

        private Builder() {
        }

        @Nonnull
        public Builder setPrimaryKey(@Nullable FieldPath primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        @Nonnull
        public Builder setPrimaryKey(@Nonnull String path) {
            return setPrimaryKey(FieldPath.parse(path));
        }

        @Nonnull
        public TableConfig build() {
            return new TableConfig(primaryKey);
        }
    }
}

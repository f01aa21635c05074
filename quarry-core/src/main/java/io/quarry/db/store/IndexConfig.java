/*
 * IndexConfig.java
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
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.FieldPath;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The definition of a secondary index: its name, the table it belongs to, the indexed field path and whether
 * values must be unique.
 */
@API(API.Status.STABLE)
public final class IndexConfig {
    private static final String INDEX_NAME_FIELD = "index_name";
    private static final String TABLE_NAME_FIELD = "table_name";
    private static final String PATH_FIELD = "path";
    private static final String UNIQUE_FIELD = "unique";

    @Nonnull
    private final String indexName;
    @Nonnull
    private final String tableName;
    @Nonnull
    private final FieldPath path;
    private final boolean unique;

    private IndexConfig(@Nonnull String indexName, @Nonnull String tableName, @Nonnull FieldPath path, boolean unique) {
        this.indexName = indexName;
        this.tableName = tableName;
        this.path = path;
        this.unique = unique;
    }

    @Nonnull
    public String getIndexName() {
        return indexName;
    }

    @Nonnull
    public String getTableName() {
        return tableName;
    }

    @Nonnull
    public FieldPath getPath() {
        return path;
    }

    public boolean isUnique() {
        return unique;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    Document toDocument() {
        return FieldBuffer.of(
                INDEX_NAME_FIELD, indexName,
                TABLE_NAME_FIELD, tableName,
                PATH_FIELD, path.toString(),
                UNIQUE_FIELD, unique);
    }

    @Nonnull
    static IndexConfig fromDocument(@Nonnull Document document) {
        return newBuilder()
                .setIndexName(document.getByField(INDEX_NAME_FIELD).asText())
                .setTableName(document.getByField(TABLE_NAME_FIELD).asText())
                .setPath(document.getByField(PATH_FIELD).asText())
                .setUnique(document.getByField(UNIQUE_FIELD).asBool())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final IndexConfig that = (IndexConfig) o;
        return unique == that.unique && indexName.equals(that.indexName) && tableName.equals(that.tableName)
                && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexName, tableName, path, unique);
    }

    @Override
    public String toString() {
        return "IndexConfig{" + indexName + " ON " + tableName + "(" + path + ")" + (unique ? " UNIQUE" : "") + "}";
    }

    /**
     * Builder for {@link IndexConfig}.
     */
    public static final class Builder {
        @Nullable
        private String indexName;
        @Nullable
        private String tableName;
        @Nullable
        private FieldPath path;
        private boolean unique;

        private Builder() {
        }

        @Nonnull
        public Builder setIndexName(@Nonnull String indexName) {
            this.indexName = indexName;
            return this;
        }

        @Nonnull
        public Builder setTableName(@Nonnull String tableName) {
            this.tableName = tableName;
            return this;
        }

        @Nonnull
        public Builder setPath(@Nonnull FieldPath path) {
            this.path = path;
            return this;
        }

        @Nonnull
        public Builder setPath(@Nonnull String path) {
            return setPath(FieldPath.parse(path));
        }

        @Nonnull
        public Builder setUnique(boolean unique) {
            this.unique = unique;
            return this;
        }

        @Nonnull
        public IndexConfig build() {
            if (indexName == null || indexName.isEmpty()) {
                throw new QuarryArgumentException("index name must be set");
            }
            if (tableName == null || tableName.isEmpty()) {
                throw new QuarryArgumentException("table name must be set",
                        LogMessageKeys.INDEX_NAME, indexName);
            }
            if (path == null) {
                throw new QuarryArgumentException("index path must be set",
                        LogMessageKeys.INDEX_NAME, indexName);
            }
            return new IndexConfig(indexName, tableName, path, unique);
        }
    }
}

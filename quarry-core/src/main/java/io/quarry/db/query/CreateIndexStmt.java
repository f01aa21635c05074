/*
 * CreateIndexStmt.java
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

package io.quarry.db.query;

import io.quarry.annotation.API;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.Transaction;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.IndexConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@code CREATE [UNIQUE] INDEX [IF NOT EXISTS] name ON table (path)}. The index is filled from the documents
 * already in the table.
 */
@API(API.Status.STABLE)
public final class CreateIndexStmt implements Statement {
    @Nullable
    private final String indexName;
    @Nullable
    private final String tableName;
    @Nonnull
    private final String path;
    private final boolean unique;
    private final boolean ifNotExists;

    public CreateIndexStmt(@Nullable String indexName, @Nullable String tableName, @Nonnull String path,
                           boolean unique, boolean ifNotExists) {
        this.indexName = indexName;
        this.tableName = tableName;
        this.path = path;
        this.unique = unique;
        this.ifNotExists = ifNotExists;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        final String table = Statements.requireTable(tableName);
        if (indexName == null || indexName.isEmpty()) {
            throw new QuarryArgumentException("missing index name");
        }
        if (ifNotExists && transaction.listIndexes().stream().anyMatch(i -> i.getIndexName().equals(indexName))) {
            return Result.empty();
        }
        transaction.createIndex(IndexConfig.newBuilder()
                .setIndexName(indexName)
                .setTableName(table)
                .setPath(path)
                .setUnique(unique)
                .build());
        return Result.empty();
    }

    @Override
    public String toString() {
        return "CREATE " + (unique ? "UNIQUE " : "") + "INDEX " + (ifNotExists ? "IF NOT EXISTS " : "")
                + indexName + " ON " + tableName + " (" + path + ")";
    }
}

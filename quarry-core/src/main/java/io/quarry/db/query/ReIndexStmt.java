/*
 * ReIndexStmt.java
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
import io.quarry.db.Transaction;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.IndexConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@code REINDEX [name]}: rebuild every index, the indexes of one table, or one index.
 */
@API(API.Status.STABLE)
public final class ReIndexStmt implements Statement {
    @Nullable
    private final String name;

    /**
     * Create a reindex statement.
     * @param name a table name, an index name, or {@code null} for every index
     */
    public ReIndexStmt(@Nullable String name) {
        this.name = name;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        if (name == null || name.isEmpty()) {
            transaction.reIndexAll();
        } else if (transaction.listTables().contains(name)) {
            for (IndexConfig index : transaction.listIndexes(name)) {
                transaction.reIndex(index.getIndexName());
            }
        } else {
            transaction.reIndex(name);
        }
        return Result.empty();
    }

    @Override
    public String toString() {
        return "REINDEX" + (name == null ? "" : " " + name);
    }
}

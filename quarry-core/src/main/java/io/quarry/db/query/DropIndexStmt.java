/*
 * DropIndexStmt.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@code DROP INDEX [IF EXISTS] name}.
 */
@API(API.Status.STABLE)
public final class DropIndexStmt implements Statement {
    @Nullable
    private final String indexName;
    private final boolean ifExists;

    public DropIndexStmt(@Nullable String indexName, boolean ifExists) {
        this.indexName = indexName;
        this.ifExists = ifExists;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        if (indexName == null || indexName.isEmpty()) {
            throw new QuarryArgumentException("missing index name");
        }
        if (ifExists && transaction.listIndexes().stream().noneMatch(i -> i.getIndexName().equals(indexName))) {
            return Result.empty();
        }
        transaction.dropIndex(indexName);
        return Result.empty();
    }

    @Override
    public String toString() {
        return "DROP INDEX " + (ifExists ? "IF EXISTS " : "") + indexName;
    }
}

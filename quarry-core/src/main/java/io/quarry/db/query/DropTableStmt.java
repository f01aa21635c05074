/*
 * DropTableStmt.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@code DROP TABLE [IF EXISTS] table}. Drops the table's indexes with it.
 */
@API(API.Status.STABLE)
public final class DropTableStmt implements Statement {
    @Nullable
    private final String tableName;
    private final boolean ifExists;

    public DropTableStmt(@Nullable String tableName, boolean ifExists) {
        this.tableName = tableName;
        this.ifExists = ifExists;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        final String name = Statements.requireTable(tableName);
        if (ifExists && !transaction.listTables().contains(name)) {
            return Result.empty();
        }
        transaction.dropTable(name);
        return Result.empty();
    }

    @Override
    public String toString() {
        return "DROP TABLE " + (ifExists ? "IF EXISTS " : "") + tableName;
    }
}

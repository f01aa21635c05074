/*
 * CreateTableStmt.java
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
import io.quarry.db.store.TableConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * {@code CREATE TABLE [IF NOT EXISTS] table [(path PRIMARY KEY)]}.
 */
@API(API.Status.STABLE)
public final class CreateTableStmt implements Statement {
    @Nullable
    private final String tableName;
    @Nonnull
    private final TableConfig config;
    private final boolean ifNotExists;

    public CreateTableStmt(@Nullable String tableName, @Nonnull TableConfig config, boolean ifNotExists) {
        this.tableName = tableName;
        this.config = config;
        this.ifNotExists = ifNotExists;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        final String name = Statements.requireTable(tableName);
        if (ifNotExists && transaction.listTables().contains(name)) {
            return Result.empty();
        }
        transaction.createTable(name, config);
        return Result.empty();
    }

    @Override
    public String toString() {
        return "CREATE TABLE " + (ifNotExists ? "IF NOT EXISTS " : "") + tableName
                + (config.hasPrimaryKey() ? " (" + config.getPrimaryKey() + " PRIMARY KEY)" : "");
    }
}

/*
 * DeleteStmt.java
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
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * {@code DELETE FROM table [WHERE expr]}.
 */
@API(API.Status.STABLE)
public final class DeleteStmt implements Statement {
    @Nullable
    private final String tableName;
    @Nullable
    private final Expr where;

    public DeleteStmt(@Nullable String tableName, @Nullable Expr where) {
        this.tableName = tableName;
        this.where = where;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        final String name = Statements.requireTable(tableName);
        final List<byte[]> keys = Statements.matchingKeys(name, where, params, transaction);
        final Table table = transaction.getTable(name);
        for (byte[] key : keys) {
            table.delete(key);
        }
        return Result.ofRowsAffected(keys.size());
    }

    @Override
    public String toString() {
        return "DELETE FROM " + tableName + (where == null ? "" : " WHERE " + where);
    }
}

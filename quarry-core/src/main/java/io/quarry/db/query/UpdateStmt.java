/*
 * UpdateStmt.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.Transaction;
import io.quarry.db.document.EncodedDocument;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.FieldPath;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code UPDATE table SET path = expr, ... [UNSET path, ...] [WHERE expr]}.
 *
 * <p>
 * {@code SET} expressions see the document as it was before the update. Setting a path whose parent is
 * missing fails; unsetting a missing path does nothing.
 * </p>
 */
@API(API.Status.STABLE)
public final class UpdateStmt implements Statement {
    @Nullable
    private final String tableName;
    @Nonnull
    private final Map<FieldPath, Expr> setPairs;
    @Nonnull
    private final List<FieldPath> unsetFields;
    @Nullable
    private final Expr where;

    private UpdateStmt(@Nonnull Builder builder) {
        this.tableName = builder.tableName;
        this.setPairs = builder.setPairs.build();
        this.unsetFields = builder.unsetFields.build();
        this.where = builder.where;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
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
        final EvalStack stack = EvalStack.newBuilder()
                .setTransaction(transaction)
                .setTableConfig(table.getConfig())
                .setParams(params)
                .build();
        for (byte[] key : keys) {
            final EncodedDocument current = table.get(key);
            final EvalStack documentStack = stack.withDocument(current);
            final FieldBuffer updated = FieldBuffer.copyOf(current);
            for (Map.Entry<FieldPath, Expr> pair : setPairs.entrySet()) {
                updated.set(pair.getKey(), pair.getValue().eval(documentStack));
            }
            for (FieldPath path : unsetFields) {
                if (hasPath(updated, path)) {
                    updated.delete(path);
                }
            }
            table.replace(key, updated);
        }
        return Result.ofRowsAffected(keys.size());
    }

    private static boolean hasPath(@Nonnull FieldBuffer document, @Nonnull FieldPath path) {
        try {
            path.getValue(document);
            return true;
        } catch (FieldNotFoundException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        final StringJoiner set = new StringJoiner(", ");
        setPairs.forEach((path, expr) -> set.add(path + " = " + expr));
        final StringJoiner unset = new StringJoiner(", ");
        unsetFields.forEach(path -> unset.add(path.toString()));
        return "UPDATE " + tableName
                + (setPairs.isEmpty() ? "" : " SET " + set)
                + (unsetFields.isEmpty() ? "" : " UNSET " + unset)
                + (where == null ? "" : " WHERE " + where);
    }

    /**
     * Builder for {@link UpdateStmt}.
     */
    public static final class Builder {
        @Nullable
        private String tableName;
        @Nonnull
        private final ImmutableMap.Builder<FieldPath, Expr> setPairs = ImmutableMap.builder();
        @Nonnull
        private final ImmutableList.Builder<FieldPath> unsetFields = ImmutableList.builder();
        @Nullable
        private Expr where;

        private Builder() {
        }

        @Nonnull
        public Builder setTableName(@Nullable String tableName) {
            this.tableName = tableName;
            return this;
        }

        @Nonnull
        public Builder set(@Nonnull String path, @Nonnull Expr expr) {
            setPairs.put(FieldPath.parse(path), expr);
            return this;
        }

        @Nonnull
        public Builder unset(@Nonnull String path) {
            unsetFields.add(FieldPath.parse(path));
            return this;
        }

        @Nonnull
        public Builder setWhere(@Nullable Expr where) {
            this.where = where;
            return this;
        }

        @Nonnull
        public UpdateStmt build() {
            return new UpdateStmt(this);
        }
    }
}

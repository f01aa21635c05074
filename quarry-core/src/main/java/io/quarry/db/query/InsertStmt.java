/*
 * InsertStmt.java
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
import io.quarry.annotation.API;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.Transaction;
import io.quarry.db.TypeMismatchException;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.Value;
import io.quarry.db.document.ValueType;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * {@code INSERT INTO table (field, ...) VALUES (expr, ...), ...} or {@code INSERT INTO table VALUES {...}, ...}.
 *
 * <p>
 * With a field list, each row of values is zipped with the field names. Without one, each row must hold a single
 * expression evaluating to a document.
 * </p>
 */
@API(API.Status.STABLE)
public final class InsertStmt implements Statement {
    @Nullable
    private final String tableName;
    @Nonnull
    private final List<String> fieldNames;
    @Nonnull
    private final List<List<Expr>> values;

    private InsertStmt(@Nonnull Builder builder) {
        this.tableName = builder.tableName;
        this.fieldNames = builder.fieldNames;
        this.values = builder.values.build();
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
        final Table table = transaction.getTable(name);
        final EvalStack stack = Statements.stack(transaction, params);
        byte[] lastKey = null;
        for (List<Expr> row : values) {
            lastKey = table.insert(fieldNames.isEmpty() ? documentRow(row, stack) : fieldRow(row, stack));
        }
        return Result.ofInsert(values.size(), lastKey);
    }

    @Nonnull
    private FieldBuffer fieldRow(@Nonnull List<Expr> row, @Nonnull EvalStack stack) {
        if (row.size() != fieldNames.size()) {
            throw new QuarryArgumentException("number of values does not match number of fields",
                    LogMessageKeys.TABLE_NAME, tableName,
                    LogMessageKeys.VALUE, row.size());
        }
        final FieldBuffer document = new FieldBuffer();
        for (int i = 0; i < row.size(); i++) {
            document.add(fieldNames.get(i), row.get(i).eval(stack));
        }
        return document;
    }

    @Nonnull
    private FieldBuffer documentRow(@Nonnull List<Expr> row, @Nonnull EvalStack stack) {
        if (row.size() != 1) {
            throw new QuarryArgumentException("expected one document per row without a field list",
                    LogMessageKeys.TABLE_NAME, tableName);
        }
        final Value value = row.get(0).eval(stack);
        if (value.getType() != ValueType.DOCUMENT) {
            throw new TypeMismatchException("values must be documents",
                    LogMessageKeys.EXPECTED_TYPE, ValueType.DOCUMENT,
                    LogMessageKeys.ACTUAL_TYPE, value.getType());
        }
        return FieldBuffer.copyOf(value.asDocument());
    }

    @Override
    public String toString() {
        return "INSERT INTO " + tableName + (fieldNames.isEmpty() ? "" : " " + fieldNames) + " VALUES " + values;
    }

    /**
     * Builder for {@link InsertStmt}.
     */
    public static final class Builder {
        @Nullable
        private String tableName;
        @Nonnull
        private List<String> fieldNames = ImmutableList.of();
        @Nonnull
        private final ImmutableList.Builder<List<Expr>> values = ImmutableList.builder();

        private Builder() {
        }

        @Nonnull
        public Builder setTableName(@Nullable String tableName) {
            this.tableName = tableName;
            return this;
        }

        @Nonnull
        public Builder setFieldNames(@Nonnull String... fieldNames) {
            this.fieldNames = ImmutableList.copyOf(fieldNames);
            return this;
        }

        @Nonnull
        public Builder addValues(@Nonnull Expr... row) {
            values.add(ImmutableList.copyOf(row));
            return this;
        }

        @Nonnull
        public InsertStmt build() {
            return new InsertStmt(this);
        }
    }
}

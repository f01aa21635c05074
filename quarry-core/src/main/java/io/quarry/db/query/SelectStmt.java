/*
 * SelectStmt.java
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
import io.quarry.db.Transaction;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.ExprUtils;
import io.quarry.db.query.expressions.FieldSelector;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.query.plan.QueryOptimizer;
import io.quarry.db.query.plan.SortDirection;
import io.quarry.db.store.TableConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code SELECT fields FROM table [WHERE expr] [ORDER BY field [ASC|DESC]] [LIMIT expr] [OFFSET expr]}.
 */
@API(API.Status.STABLE)
public final class SelectStmt implements Statement {
    @Nullable
    private final String tableName;
    @Nullable
    private final Expr where;
    @Nullable
    private final FieldSelector orderBy;
    @Nonnull
    private final SortDirection direction;
    @Nullable
    private final Expr limit;
    @Nullable
    private final Expr offset;
    @Nonnull
    private final List<ResultField> resultFields;

    private SelectStmt(@Nonnull Builder builder) {
        this.tableName = builder.tableName;
        this.where = builder.where;
        this.orderBy = builder.orderBy;
        this.direction = builder.direction;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.resultFields = !builder.hasResultFields
                ? ImmutableList.of(Wildcard.INSTANCE)
                : builder.resultFields.build();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean isReadOnly() {
        return true;
    }

    /**
     * Build the stream of projected documents. {@code LIMIT} and {@code OFFSET} are evaluated first; if either
     * is not a number the statement fails before any storage is read.
     */
    @Nonnull
    @Override
    public Result run(@Nonnull Transaction transaction, @Nonnull Params params) {
        final String table = Statements.requireTable(tableName);
        final EvalStack stack = Statements.stack(transaction, params);
        final int offsetValue = offset == null ? QueryOptimizer.NONE : ExprUtils.evalInteger(offset, stack, "offset");
        final int limitValue = limit == null ? QueryOptimizer.NONE : ExprUtils.evalInteger(limit, stack, "limit");

        final TableConfig config = transaction.getTable(table).getConfig();
        final EvalStack projection = EvalStack.newBuilder()
                .setTransaction(transaction)
                .setTableConfig(config)
                .setParams(params)
                .build();
        final DocumentStream stream = QueryOptimizer.optimize(table, where, orderBy, direction,
                limitValue, offsetValue, params, transaction);
        return Result.ofStream(stream.map(document -> new DocumentMask(projection, document, resultFields)));
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(resultFields.stream().map(ResultField::getName).collect(Collectors.joining(", ")));
        sb.append(" FROM ").append(tableName);
        if (where != null) {
            sb.append(" WHERE ").append(where);
        }
        if (orderBy != null) {
            sb.append(" ORDER BY ").append(orderBy).append(' ').append(direction);
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }

    /**
     * Builder for {@link SelectStmt}. Without result fields the statement selects {@code *}.
     */
    public static final class Builder {
        @Nullable
        private String tableName;
        @Nullable
        private Expr where;
        @Nullable
        private FieldSelector orderBy;
        @Nonnull
        private SortDirection direction = SortDirection.ASC;
        @Nullable
        private Expr limit;
        @Nullable
        private Expr offset;
        @Nonnull
        private final ImmutableList.Builder<ResultField> resultFields = ImmutableList.builder();
        private boolean hasResultFields;

        private Builder() {
        }

        @Nonnull
        public Builder setTableName(@Nullable String tableName) {
            this.tableName = tableName;
            return this;
        }

        @Nonnull
        public Builder setWhere(@Nullable Expr where) {
            this.where = where;
            return this;
        }

        @Nonnull
        public Builder setOrderBy(@Nullable FieldSelector orderBy, @Nonnull SortDirection direction) {
            this.orderBy = orderBy;
            this.direction = direction;
            return this;
        }

        @Nonnull
        public Builder setLimit(@Nullable Expr limit) {
            this.limit = limit;
            return this;
        }

        @Nonnull
        public Builder setOffset(@Nullable Expr offset) {
            this.offset = offset;
            return this;
        }

        @Nonnull
        public Builder addResultField(@Nonnull ResultField resultField) {
            resultFields.add(resultField);
            hasResultFields = true;
            return this;
        }

        @Nonnull
        public SelectStmt build() {
            return new SelectStmt(this);
        }
    }
}

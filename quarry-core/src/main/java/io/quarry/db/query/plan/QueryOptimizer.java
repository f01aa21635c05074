/*
 * QueryOptimizer.java
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

package io.quarry.db.query.plan;

import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.Transaction;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;
import io.quarry.db.logging.KeyValueLogMessage;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.db.query.expressions.AndOperator;
import io.quarry.db.query.expressions.ComparisonOperator;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.ExprUtils;
import io.quarry.db.query.expressions.FieldSelector;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.IndexConfig;
import io.quarry.db.store.ScanRange;
import io.quarry.db.store.Table;
import io.quarry.db.store.TableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Chooses the access path of a query and assembles the stream that executes it.
 *
 * <p>
 * Planning is rule based. The conjuncts of the {@code WHERE} clause are examined in order and the first one that
 * compares the primary key path or an indexed path with a constant gives a range scan. Failing that, a primary
 * key or an index on the {@code ORDER BY} path gives a full scan in that order. Failing that, the table is
 * scanned in key order.
 * </p>
 *
 * <p>
 * The stream applies the whole {@code WHERE} clause as a filter whatever the access path, then sorts if the
 * access path does not already deliver the requested order, then skips {@code offset} documents and stops after
 * {@code limit}.
 * </p>
 */
@API(API.Status.STABLE)
public final class QueryOptimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryOptimizer.class);

    /**
     * The {@code limit} and {@code offset} argument meaning none was given.
     */
    public static final int NONE = -1;

    private QueryOptimizer() {
    }

    /**
     * Build the stream of a query.
     * @param tableName the table to read
     * @param where the filter, or {@code null} for every document
     * @param orderBy the field to order by, or {@code null} for access path order
     * @param direction the direction of {@code orderBy}
     * @param limit the maximum number of documents, or {@link #NONE}
     * @param offset the number of documents to skip, or {@link #NONE}
     * @param params the bound parameters
     * @param transaction the transaction to read in
     * @return the stream; the caller must consume or close it
     * @throws io.quarry.db.TableNotFoundException if the table does not exist
     */
    @Nonnull
    public static DocumentStream optimize(@Nonnull String tableName,
                                          @Nullable Expr where,
                                          @Nullable FieldSelector orderBy,
                                          @Nonnull SortDirection direction,
                                          int limit,
                                          int offset,
                                          @Nonnull Params params,
                                          @Nonnull Transaction transaction) {
        final Table table = transaction.getTable(tableName);
        final QueryPlan plan = plan(table.getConfig(), transaction.listIndexes(tableName),
                where, orderBy, direction, params);
        final boolean sort = orderBy != null && !plan.isOrderedBy(orderBy.getPath(), direction);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("planned query",
                    LogMessageKeys.TABLE_NAME, tableName,
                    LogMessageKeys.PLAN, plan,
                    LogMessageKeys.WHERE, where,
                    LogMessageKeys.ORDER_BY, orderBy == null ? null : orderBy + " " + direction,
                    LogMessageKeys.LIMIT, limit,
                    LogMessageKeys.OFFSET, offset,
                    "sort", sort));
        }

        final EvalStack stack = EvalStack.newBuilder()
                .setTransaction(transaction)
                .setTableConfig(table.getConfig())
                .setParams(params)
                .build();
        DocumentStream stream = DocumentStream.of(plan.execute(table));
        if (where != null) {
            stream = stream.filter(document -> where.eval(stack.withDocument(document)).isTruthy());
        }
        if (sort) {
            stream = stream.sort(comparator(orderBy.getPath(), direction));
        }
        if (offset > 0) {
            stream = stream.offset(offset);
        }
        if (limit >= 0) {
            stream = stream.limit(limit);
        }
        return stream;
    }

    /**
     * Choose the access path of a query.
     * @param config the table configuration
     * @param indexes the indexes of the table
     * @param where the filter, or {@code null}
     * @param orderBy the field to order by, or {@code null}
     * @param direction the direction of {@code orderBy}
     * @param params the bound parameters, used to evaluate the constant side of comparisons
     * @return the access path
     */
    @Nonnull
    public static QueryPlan plan(@Nonnull TableConfig config,
                                 @Nonnull List<IndexConfig> indexes,
                                 @Nullable Expr where,
                                 @Nullable FieldSelector orderBy,
                                 @Nonnull SortDirection direction,
                                 @Nonnull Params params) {
        final FieldPath orderPath = orderBy == null ? null : orderBy.getPath();
        if (where != null) {
            final EvalStack constants = EvalStack.ofParams(params);
            for (Expr conjunct : conjuncts(where)) {
                final QueryPlan plan = planComparison(config, indexes, conjunct, orderPath, direction, constants);
                if (plan != null) {
                    return plan;
                }
            }
        }
        if (orderPath != null) {
            final QueryPlan plan = planScan(config, indexes, orderPath, ScanRange.ALL, direction.isDescending());
            if (plan != null) {
                return plan;
            }
        }
        return new TableScanPlan(config.getPrimaryKey(), false);
    }

    @Nullable
    private static QueryPlan planComparison(@Nonnull TableConfig config,
                                            @Nonnull List<IndexConfig> indexes,
                                            @Nonnull Expr conjunct,
                                            @Nullable FieldPath orderPath,
                                            @Nonnull SortDirection direction,
                                            @Nonnull EvalStack constants) {
        if (!(conjunct instanceof ComparisonOperator)) {
            return null;
        }
        final ComparisonOperator comparison = (ComparisonOperator) conjunct;
        ComparisonOperator.Type type = comparison.getType();
        if (type == ComparisonOperator.Type.NEQ) {
            return null;
        }
        final FieldPath path;
        final Expr constant;
        if (comparison.getLeft() instanceof FieldSelector && ExprUtils.isConstant(comparison.getRight())) {
            path = ((FieldSelector) comparison.getLeft()).getPath();
            constant = comparison.getRight();
        } else if (comparison.getRight() instanceof FieldSelector && ExprUtils.isConstant(comparison.getLeft())) {
            path = ((FieldSelector) comparison.getRight()).getPath();
            constant = comparison.getLeft();
            type = type.flip();
        } else {
            return null;
        }
        if (!isKeyed(config, indexes, path)) {
            return null;
        }
        final ScanRange range = range(type, constant.eval(constants));
        final boolean reverse = path.equals(orderPath) && direction.isDescending();
        return planScan(config, indexes, path, range, reverse);
    }

    @Nullable
    private static QueryPlan planScan(@Nonnull TableConfig config,
                                      @Nonnull List<IndexConfig> indexes,
                                      @Nonnull FieldPath path,
                                      @Nonnull ScanRange range,
                                      boolean reverse) {
        if (path.equals(config.getPrimaryKey())) {
            return new PrimaryKeyScanPlan(path, range, reverse);
        }
        for (IndexConfig index : indexes) {
            if (index.getPath().equals(path)) {
                return new IndexScanPlan(index, range, reverse);
            }
        }
        return null;
    }

    private static boolean isKeyed(@Nonnull TableConfig config, @Nonnull List<IndexConfig> indexes,
                                   @Nonnull FieldPath path) {
        if (path.equals(config.getPrimaryKey())) {
            return true;
        }
        return indexes.stream().anyMatch(index -> index.getPath().equals(path));
    }

    @Nonnull
    private static ScanRange range(@Nonnull ComparisonOperator.Type type, @Nonnull Value value) {
        switch (type) {
            case EQ:
                return ScanRange.exactly(value);
            case GT:
            case GTE:
                return ScanRange.atLeast(value);
            case LT:
            case LTE:
                return ScanRange.atMost(value);
            default:
                throw new IllegalArgumentException("no range for comparison " + type);
        }
    }

    @Nonnull
    private static List<Expr> conjuncts(@Nonnull Expr where) {
        final List<Expr> conjuncts = new ArrayList<>();
        addConjuncts(where, conjuncts);
        return conjuncts;
    }

    private static void addConjuncts(@Nonnull Expr expr, @Nonnull List<Expr> conjuncts) {
        if (expr instanceof AndOperator) {
            for (Expr child : ((AndOperator) expr).getChildren()) {
                addConjuncts(child, conjuncts);
            }
        } else {
            conjuncts.add(expr);
        }
    }

    /**
     * Order documents by the value at a path, in the same order scans of a primary key or an index yield.
     * Documents without the field sort as {@code NULL}.
     */
    @Nonnull
    static Comparator<Document> comparator(@Nonnull FieldPath path, @Nonnull SortDirection direction) {
        final Comparator<Document> ascending = Comparator.<Document, Value>comparing(
                document -> valueOrNull(path, document), Value.SORT_ORDER);
        return direction.isDescending() ? ascending.reversed() : ascending;
    }

    @Nonnull
    private static Value valueOrNull(@Nonnull FieldPath path, @Nonnull Document document) {
        try {
            return path.getValue(document);
        } catch (FieldNotFoundException e) {
            return Value.NULL;
        }
    }
}

/*
 * QueryOptimizerTest.java
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

import io.quarry.db.Database;
import io.quarry.db.TableNotFoundException;
import io.quarry.db.Transaction;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;
import io.quarry.db.query.expressions.ComparisonOperator;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.FieldSelector;
import io.quarry.db.query.expressions.Param;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.store.IndexConfig;
import io.quarry.db.store.ScanRange;
import io.quarry.db.store.Table;
import io.quarry.db.store.TableConfig;
import io.quarry.engine.memory.MemoryEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static io.quarry.db.query.expressions.Expressions.and;
import static io.quarry.db.query.expressions.Expressions.compare;
import static io.quarry.db.query.expressions.Expressions.field;
import static io.quarry.db.query.expressions.Expressions.literal;
import static io.quarry.db.query.expressions.Expressions.or;
import static io.quarry.db.query.expressions.Expressions.param;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link QueryOptimizer}.
 */
public class QueryOptimizerTest {
    private static final TableConfig WITH_PK = TableConfig.newBuilder().setPrimaryKey("id").build();
    private static final IndexConfig AGE_INDEX = IndexConfig.newBuilder()
            .setIndexName("idx_age").setTableName("test").setPath("age").build();
    private static final List<IndexConfig> INDEXES = List.of(AGE_INDEX);

    private Database database;
    private Transaction tx;

    @BeforeEach
    public void setUp() {
        database = new Database(new MemoryEngine());
        tx = database.begin(true);
    }

    @AfterEach
    public void tearDown() {
        tx.close();
        database.close();
    }

    private static QueryPlan plan(@Nullable Expr where, @Nullable FieldSelector orderBy, SortDirection direction) {
        return QueryOptimizer.plan(WITH_PK, INDEXES, where, orderBy, direction,
                Params.of(Param.named("n", 3)));
    }

    @Test
    public void primaryKeyComparisonGivesPrimaryKeyScan() {
        QueryPlan plan = plan(field("id").gte(3), null, SortDirection.ASC);
        assertThat(plan, instanceOf(PrimaryKeyScanPlan.class));
        assertEquals(ScanRange.atLeast(Value.ofInt32(3)), ((PrimaryKeyScanPlan) plan).getRange());
        assertFalse(plan.isReverse());
    }

    @Test
    public void indexedComparisonGivesIndexScan() {
        QueryPlan plan = plan(and(field("name").eq("ada"), field("age").lt(param("n"))), null, SortDirection.ASC);
        assertThat(plan, instanceOf(IndexScanPlan.class));
        assertEquals(AGE_INDEX, ((IndexScanPlan) plan).getIndex());
        assertEquals(ScanRange.atMost(Value.ofInt32(3)), ((IndexScanPlan) plan).getRange());
    }

    @Test
    public void constantOnTheLeftIsFlipped() {
        // 3 < age is age > 3
        QueryPlan plan = plan(compare(ComparisonOperator.Type.LT, 3, field("age")),
                null, SortDirection.ASC);
        assertEquals(ScanRange.atLeast(Value.ofInt32(3)), ((IndexScanPlan) plan).getRange());
    }

    @Test
    public void firstUsableConjunctWins() {
        QueryPlan plan = plan(and(field("age").eq(1), field("id").eq(2)), null, SortDirection.ASC);
        assertThat(plan, instanceOf(IndexScanPlan.class));
        plan = plan(and(field("id").eq(2), field("age").eq(1)), null, SortDirection.ASC);
        assertThat(plan, instanceOf(PrimaryKeyScanPlan.class));
    }

    @Test
    public void unusableFiltersGiveTableScan() {
        assertThat(plan(field("age").neq(1), null, SortDirection.ASC), instanceOf(TableScanPlan.class));
        assertThat(plan(field("name").eq("ada"), null, SortDirection.ASC), instanceOf(TableScanPlan.class));
        assertThat(plan(field("age").eq(field("id")), null, SortDirection.ASC), instanceOf(TableScanPlan.class));
        assertThat(plan(or(field("age").eq(1), field("id").eq(2)), null, SortDirection.ASC),
                instanceOf(TableScanPlan.class));
        assertThat(plan(null, null, SortDirection.ASC), instanceOf(TableScanPlan.class));
    }

    @Test
    public void orderByChoosesAccessPath() {
        QueryPlan plan = plan(null, field("age"), SortDirection.DESC);
        assertThat(plan, instanceOf(IndexScanPlan.class));
        assertTrue(plan.isReverse());
        assertEquals(ScanRange.ALL, ((IndexScanPlan) plan).getRange());
        assertTrue(plan.isOrderedBy(FieldPath.parse("age"), SortDirection.DESC));

        plan = plan(field("age").gt(1), field("age"), SortDirection.DESC);
        assertTrue(plan.isOrderedBy(FieldPath.parse("age"), SortDirection.DESC));

        plan = plan(field("age").gt(1), field("id"), SortDirection.DESC);
        assertFalse(plan.isOrderedBy(FieldPath.parse("id"), SortDirection.DESC));

        plan = plan(null, field("name"), SortDirection.ASC);
        assertThat(plan, instanceOf(TableScanPlan.class));
        assertEquals(FieldPath.parse("id"), plan.getOrderPath());
    }

    @Test
    public void tableScanWithoutPrimaryKeyHasNoOrder() {
        QueryPlan plan = QueryOptimizer.plan(TableConfig.DEFAULT, List.of(), null, field("a"), SortDirection.ASC,
                Params.EMPTY);
        assertThat(plan, instanceOf(TableScanPlan.class));
        assertNull(plan.getOrderPath());
    }

    private Table populate() {
        Table table = tx.createTable("test", WITH_PK);
        tx.createIndex(AGE_INDEX);
        int[] ages = {40, 10, 30, 20, 50, 10};
        for (int i = 0; i < ages.length; i++) {
            table.insert(FieldBuffer.of("id", i + 1, "age", ages[i], "even", i % 2 == 0));
        }
        table.insert(FieldBuffer.of("id", 100, "name", "ageless"));
        return table;
    }

    private static List<Value> collect(DocumentStream stream, String field) {
        final List<Value> values = new ArrayList<>();
        stream.iterate(document -> values.add(valueOf(document, field)));
        return values;
    }

    private static Value valueOf(Document document, String field) {
        return FieldPath.parse(field).getValue(document);
    }

    private static List<Value> ints(int... ints) {
        final List<Value> values = new ArrayList<>();
        for (int i : ints) {
            values.add(Value.ofInt32(i));
        }
        return values;
    }

    @Test
    public void indexRangeFiltersStrictly() {
        populate();
        DocumentStream stream = QueryOptimizer.optimize("test", field("age").gt(20), null, SortDirection.ASC,
                QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(30, 40, 50), collect(stream, "age"));
    }

    @Test
    public void orderedDescendingWithLimitAndOffset() {
        populate();
        DocumentStream stream = QueryOptimizer.optimize("test", field("age").gte(10), field("age"), SortDirection.DESC,
                2, 1, Params.EMPTY, tx);
        assertEquals(ints(40, 30), collect(stream, "age"));
    }

    @Test
    public void descendingRangeAboveLastKey() {
        populate();
        // the upper end of both ranges lies past every stored key
        DocumentStream stream = QueryOptimizer.optimize("test", field("age").gt(25), field("age"), SortDirection.DESC,
                QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(50, 40, 30), collect(stream, "age"));

        stream = QueryOptimizer.optimize("test", field("id").gte(3), field("id"), SortDirection.DESC,
                QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(100, 6, 5, 4, 3), collect(stream, "id"));

        stream = QueryOptimizer.optimize("test", field("age").gt(60), field("age"), SortDirection.DESC,
                QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(), collect(stream, "age"));
    }

    @Test
    public void sortsWhenAccessPathDoesNotOrder() {
        populate();
        DocumentStream stream = QueryOptimizer.optimize("test", field("even").eq(true), field("age"),
                SortDirection.ASC, QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(30, 40, 50), collect(stream, "age"));

        stream = QueryOptimizer.optimize("test", field("id").lte(6), field("age"),
                SortDirection.DESC, QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(50, 40, 30, 20, 10, 10), collect(stream, "age"));
    }

    @Test
    public void missingFieldsSortFirst() {
        populate();
        DocumentStream stream = QueryOptimizer.optimize("test", null, field("age"), SortDirection.ASC,
                1, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(List.of(Value.ofText("ageless")), collect(stream, "name"));
    }

    @Test
    public void primaryKeyOrder() {
        populate();
        DocumentStream stream = QueryOptimizer.optimize("test", field("id").lt(literal(4)), field("id"),
                SortDirection.DESC, QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx);
        assertEquals(ints(3, 2, 1), collect(stream, "id"));
    }

    @Test
    public void unknownTable() {
        assertThrows(TableNotFoundException.class, () -> QueryOptimizer.optimize("nope", null, null,
                SortDirection.ASC, QueryOptimizer.NONE, QueryOptimizer.NONE, Params.EMPTY, tx));
    }
}

/*
 * Statements.java
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

import com.google.common.base.Strings;
import io.quarry.db.MissingTableSelectorException;
import io.quarry.db.Transaction;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.db.document.Keyer;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;
import io.quarry.db.query.expressions.Params;
import io.quarry.db.query.plan.QueryOptimizer;
import io.quarry.db.query.plan.SortDirection;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks shared by the statements.
 */
final class Statements {
    private Statements() {
    }

    @Nonnull
    static String requireTable(@Nullable String tableName) {
        if (Strings.isNullOrEmpty(tableName)) {
            throw new MissingTableSelectorException("missing table selector");
        }
        return tableName;
    }

    @Nonnull
    static EvalStack stack(@Nonnull Transaction transaction, @Nonnull Params params) {
        return EvalStack.newBuilder().setTransaction(transaction).setParams(params).build();
    }

    /**
     * Collect the keys of the documents matching a filter. The stream is fully consumed and closed before this
     * returns, so the caller may mutate the table afterwards.
     */
    @Nonnull
    static List<byte[]> matchingKeys(@Nonnull String tableName, @Nullable Expr where,
                                     @Nonnull Params params, @Nonnull Transaction transaction) {
        final List<byte[]> keys = new ArrayList<>();
        try (DocumentStream stream = QueryOptimizer.optimize(tableName, where, null, SortDirection.ASC,
                QueryOptimizer.NONE, QueryOptimizer.NONE, params, transaction)) {
            stream.iterate(document -> keys.add(((Keyer) document).getKey()));
        }
        return keys;
    }
}

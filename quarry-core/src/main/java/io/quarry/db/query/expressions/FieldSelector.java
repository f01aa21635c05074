/*
 * FieldSelector.java
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

package io.quarry.db.query.expressions;

import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A reference to a field of the current document. Evaluating it throws {@link FieldNotFoundException} if the
 * field is missing.
 */
@API(API.Status.STABLE)
public final class FieldSelector implements Expr {
    @Nonnull
    private final FieldPath path;

    public FieldSelector(@Nonnull FieldPath path) {
        this.path = path;
    }

    @Nonnull
    public FieldPath getPath() {
        return path;
    }

    @Nonnull
    @Override
    public Value eval(@Nonnull EvalStack stack) {
        return path.getValue(stack.requireDocument());
    }

    @Nonnull
    public ComparisonOperator eq(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.EQ, this, Expressions.toExpr(other));
    }

    @Nonnull
    public ComparisonOperator neq(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.NEQ, this, Expressions.toExpr(other));
    }

    @Nonnull
    public ComparisonOperator gt(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.GT, this, Expressions.toExpr(other));
    }

    @Nonnull
    public ComparisonOperator gte(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.GTE, this, Expressions.toExpr(other));
    }

    @Nonnull
    public ComparisonOperator lt(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.LT, this, Expressions.toExpr(other));
    }

    @Nonnull
    public ComparisonOperator lte(@Nullable Object other) {
        return new ComparisonOperator(ComparisonOperator.Type.LTE, this, Expressions.toExpr(other));
    }

    @Override
    public String toString() {
        return path.toString();
    }
}

/*
 * ResultFieldExpr.java
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
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.document.FieldVisitor;
import io.quarry.db.document.Value;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.query.expressions.Expr;

import javax.annotation.Nonnull;

/**
 * A result field computed by an expression. If the expression refers to a field the document lacks, nothing is
 * emitted; any other failure propagates.
 */
@API(API.Status.STABLE)
public final class ResultFieldExpr implements ResultField {
    @Nonnull
    private final String name;
    @Nonnull
    private final Expr expr;

    public ResultFieldExpr(@Nonnull String name, @Nonnull Expr expr) {
        this.name = name;
        this.expr = expr;
    }

    /**
     * Create a result field named after the text of its expression, such as {@code a.b} for a field selector.
     * @param expr the expression
     * @return the result field
     */
    @Nonnull
    public static ResultFieldExpr of(@Nonnull Expr expr) {
        return new ResultFieldExpr(expr.toString(), expr);
    }

    @Nonnull
    public Expr getExpr() {
        return expr;
    }

    @Nonnull
    @Override
    public String getName() {
        return name;
    }

    @Override
    public void iterate(@Nonnull EvalStack stack, @Nonnull FieldVisitor visitor) {
        final Value value;
        try {
            value = expr.eval(stack);
        } catch (FieldNotFoundException e) {
            return;
        }
        visitor.visit(name, value);
    }

    @Override
    public String toString() {
        return name;
    }
}

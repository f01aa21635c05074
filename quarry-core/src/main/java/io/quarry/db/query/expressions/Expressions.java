/*
 * Expressions.java
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

import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static factories for building expression trees in code, for example
 * {@code Expressions.and(field("age").gt(7), field("name").neq(param("skip")))}.
 */
@API(API.Status.STABLE)
public final class Expressions {
    private Expressions() {
    }

    @Nonnull
    public static FieldSelector field(@Nonnull String path) {
        return new FieldSelector(FieldPath.parse(path));
    }

    @Nonnull
    public static LiteralValue literal(@Nullable Object value) {
        return new LiteralValue(Value.of(value));
    }

    @Nonnull
    public static NamedParam param(@Nonnull String name) {
        return new NamedParam(name);
    }

    @Nonnull
    public static PositionalParam param(int position) {
        return new PositionalParam(position);
    }

    @Nonnull
    public static Expr and(@Nonnull Expr... children) {
        return children.length == 1 ? children[0] : new AndOperator(ImmutableList.copyOf(children));
    }

    @Nonnull
    public static Expr or(@Nonnull Expr... children) {
        return children.length == 1 ? children[0] : new OrOperator(ImmutableList.copyOf(children));
    }

    @Nonnull
    public static NotOperator not(@Nonnull Expr child) {
        return new NotOperator(child);
    }

    @Nonnull
    public static ComparisonOperator compare(@Nonnull ComparisonOperator.Type type, @Nullable Object left, @Nullable Object right) {
        return new ComparisonOperator(type, toExpr(left), toExpr(right));
    }

    @Nonnull
    public static ArithmeticOperator arithmetic(@Nonnull ArithmeticOperator.Type type, @Nullable Object left, @Nullable Object right) {
        return new ArithmeticOperator(type, toExpr(left), toExpr(right));
    }

    @Nonnull
    public static ArithmeticOperator add(@Nullable Object left, @Nullable Object right) {
        return arithmetic(ArithmeticOperator.Type.ADD, left, right);
    }

    @Nonnull
    public static ArithmeticOperator sub(@Nullable Object left, @Nullable Object right) {
        return arithmetic(ArithmeticOperator.Type.SUB, left, right);
    }

    @Nonnull
    public static ArithmeticOperator mul(@Nullable Object left, @Nullable Object right) {
        return arithmetic(ArithmeticOperator.Type.MUL, left, right);
    }

    @Nonnull
    public static ArithmeticOperator div(@Nullable Object left, @Nullable Object right) {
        return arithmetic(ArithmeticOperator.Type.DIV, left, right);
    }

    @Nonnull
    public static ArithmeticOperator mod(@Nullable Object left, @Nullable Object right) {
        return arithmetic(ArithmeticOperator.Type.MOD, left, right);
    }

    /**
     * Build a document expression from alternating field names and values.
     * @param namesAndValues alternating names and expressions or plain values
     * @return the document expression
     */
    @Nonnull
    public static DocumentExpr document(@Nonnull Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new QuarryArgumentException("unbalanced field names and values");
        }
        final Map<String, Expr> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put(String.valueOf(namesAndValues[i]), toExpr(namesAndValues[i + 1]));
        }
        return new DocumentExpr(fields);
    }

    /**
     * Use an expression as is, or wrap any other object in a {@link LiteralValue}.
     * @param object an expression or a plain value
     * @return an expression
     */
    @Nonnull
    public static Expr toExpr(@Nullable Object object) {
        if (object instanceof Expr) {
            return (Expr) object;
        }
        return literal(object);
    }
}

/*
 * ComparisonOperator.java
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
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;

/**
 * A comparison between two expressions, evaluating to a boolean.
 *
 * <p>
 * If either operand refers to a missing field the comparison is {@code false}; a row without the field never
 * matches a predicate on it. Equality follows {@link Value#isEqualTo(Value)} and ordering follows
 * {@link Value#compareWith(Value)}: values that are not ordered with respect to each other make every ordering
 * comparison false.
 * </p>
 */
@API(API.Status.STABLE)
public final class ComparisonOperator implements Expr {
    /**
     * The comparison operators.
     */
    public enum Type {
        EQ("="),
        NEQ("!="),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<=");

        @Nonnull
        private final String symbol;

        Type(@Nonnull String symbol) {
            this.symbol = symbol;
        }

        @Nonnull
        public String getSymbol() {
            return symbol;
        }

        /**
         * Get the operator that gives the same result with the operands swapped.
         * @return the flipped operator
         */
        @Nonnull
        public Type flip() {
            switch (this) {
                case GT:
                    return LT;
                case GTE:
                    return LTE;
                case LT:
                    return GT;
                case LTE:
                    return GTE;
                default:
                    return this;
            }
        }

        public boolean compare(@Nonnull Value left, @Nonnull Value right) {
            if (this == EQ) {
                return left.isEqualTo(right);
            }
            if (this == NEQ) {
                return !left.isEqualTo(right);
            }
            final Integer cmp = left.compareWith(right);
            if (cmp == null) {
                return false;
            }
            switch (this) {
                case GT:
                    return cmp > 0;
                case GTE:
                    return cmp >= 0;
                case LT:
                    return cmp < 0;
                case LTE:
                    return cmp <= 0;
                default:
                    throw new IllegalStateException("unknown comparison " + this);
            }
        }
    }

    @Nonnull
    private final Type type;
    @Nonnull
    private final Expr left;
    @Nonnull
    private final Expr right;

    public ComparisonOperator(@Nonnull Type type, @Nonnull Expr left, @Nonnull Expr right) {
        this.type = type;
        this.left = left;
        this.right = right;
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    @Nonnull
    public Expr getLeft() {
        return left;
    }

    @Nonnull
    public Expr getRight() {
        return right;
    }

    @Nonnull
    @Override
    public Value eval(@Nonnull EvalStack stack) {
        final Value l;
        final Value r;
        try {
            l = left.eval(stack);
            r = right.eval(stack);
        } catch (FieldNotFoundException e) {
            return Value.FALSE;
        }
        return Value.ofBool(type.compare(l, r));
    }

    @Override
    public String toString() {
        return left + " " + type.getSymbol() + " " + right;
    }
}

/*
 * ArithmeticOperator.java
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
import io.quarry.db.ConversionFailedException;
import io.quarry.db.TypeMismatchException;
import io.quarry.db.document.Value;
import io.quarry.db.document.ValueType;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Arithmetic on two numbers.
 *
 * <p>
 * Two integers give an {@code int64}; anything involving a {@code float64} gives a {@code float64}. Integer
 * overflow fails with {@link ConversionFailedException}. Division or modulo by zero, and any {@code NULL}
 * operand, give {@code NULL}. Other non-numeric operands fail with {@link TypeMismatchException}.
 * </p>
 */
@API(API.Status.STABLE)
public final class ArithmeticOperator implements Expr {
    /**
     * The arithmetic operators.
     */
    public enum Type {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%");

        @Nonnull
        private final String symbol;

        Type(@Nonnull String symbol) {
            this.symbol = symbol;
        }

        @Nonnull
        public String getSymbol() {
            return symbol;
        }
    }

    @Nonnull
    private final Type type;
    @Nonnull
    private final Expr left;
    @Nonnull
    private final Expr right;

    public ArithmeticOperator(@Nonnull Type type, @Nonnull Expr left, @Nonnull Expr right) {
        this.type = type;
        this.left = left;
        this.right = right;
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
        final Value l = left.eval(stack);
        final Value r = right.eval(stack);
        if (l.isNull() || r.isNull()) {
            return Value.NULL;
        }
        if (!l.isNumber() || !r.isNumber()) {
            throw new TypeMismatchException("arithmetic operands must be numbers",
                    LogMessageKeys.EXPECTED_TYPE, ValueType.FLOAT64,
                    LogMessageKeys.ACTUAL_TYPE, l.isNumber() ? r.getType() : l.getType());
        }
        if (l.isInteger() && r.isInteger()) {
            return evalLong(l.asLong(), r.asLong());
        }
        return evalDouble(l.asDouble(), r.asDouble());
    }

    @Nonnull
    private Value evalLong(long a, long b) {
        try {
            switch (type) {
                case ADD:
                    return Value.ofInt64(Math.addExact(a, b));
                case SUB:
                    return Value.ofInt64(Math.subtractExact(a, b));
                case MUL:
                    return Value.ofInt64(Math.multiplyExact(a, b));
                case DIV:
                    if (b == 0) {
                        return Value.NULL;
                    }
                    if (a == Long.MIN_VALUE && b == -1) {
                        throw new ArithmeticException("long overflow");
                    }
                    return Value.ofInt64(a / b);
                case MOD:
                    return b == 0 ? Value.NULL : Value.ofInt64(a % b);
                default:
                    throw new IllegalStateException("unknown operator " + type);
            }
        } catch (ArithmeticException e) {
            throw new ConversionFailedException("integer overflow",
                    LogMessageKeys.EXPECTED_TYPE, ValueType.INT64,
                    LogMessageKeys.VALUE, this);
        }
    }

    @Nonnull
    private Value evalDouble(double a, double b) {
        switch (type) {
            case ADD:
                return Value.ofDouble(a + b);
            case SUB:
                return Value.ofDouble(a - b);
            case MUL:
                return Value.ofDouble(a * b);
            case DIV:
                return b == 0.0 ? Value.NULL : Value.ofDouble(a / b);
            case MOD:
                return b == 0.0 ? Value.NULL : Value.ofDouble(a % b);
            default:
                throw new IllegalStateException("unknown operator " + type);
        }
    }

    @Override
    public String toString() {
        return left + " " + type.getSymbol() + " " + right;
    }
}

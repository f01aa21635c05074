/*
 * ExprUtils.java
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
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.TypeMismatchException;
import io.quarry.db.document.Value;
import io.quarry.db.document.ValueType;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Helpers for evaluating expressions in fixed roles.
 */
@API(API.Status.INTERNAL)
public final class ExprUtils {
    private ExprUtils() {
    }

    /**
     * Evaluate a {@code LIMIT} or {@code OFFSET} style expression. The result must be a number; it is then
     * converted to an {@code int} without truncation.
     * @param expr the expression
     * @param stack the evaluation context
     * @param what the role of the expression, used in error messages, such as {@code "limit"}
     * @return the value as a non-negative int
     * @throws TypeMismatchException if the expression does not evaluate to a number
     * @throws io.quarry.db.ConversionFailedException if the number is not an integer or does not fit an int
     * @throws QuarryArgumentException if the number is negative
     */
    public static int evalInteger(@Nonnull Expr expr, @Nonnull EvalStack stack, @Nonnull String what) {
        final Value value = expr.eval(stack);
        if (!value.isNumber()) {
            throw new TypeMismatchException(what + " expression must evaluate to a number, got " + value.getType(),
                    LogMessageKeys.EXPECTED_TYPE, ValueType.INT32,
                    LogMessageKeys.ACTUAL_TYPE, value.getType());
        }
        final int i = value.convertToInt();
        if (i < 0) {
            throw new QuarryArgumentException(what + " must not be negative", LogMessageKeys.VALUE, i);
        }
        return i;
    }

    /**
     * Whether an expression can be evaluated without a document: literals, parameters and arithmetic over them.
     * @param expr the expression
     * @return whether the expression is constant for a statement execution
     */
    public static boolean isConstant(@Nonnull Expr expr) {
        if (expr instanceof LiteralValue || expr instanceof NamedParam || expr instanceof PositionalParam) {
            return true;
        }
        if (expr instanceof ArithmeticOperator) {
            final ArithmeticOperator arithmetic = (ArithmeticOperator) expr;
            return isConstant(arithmetic.getLeft()) && isConstant(arithmetic.getRight());
        }
        return false;
    }
}

/*
 * ExpressionsTest.java
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

import io.quarry.db.ConversionFailedException;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.TypeMismatchException;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.Value;
import io.quarry.db.document.ValueType;
import org.junit.jupiter.api.Test;

import static io.quarry.db.query.expressions.Expressions.add;
import static io.quarry.db.query.expressions.Expressions.and;
import static io.quarry.db.query.expressions.Expressions.div;
import static io.quarry.db.query.expressions.Expressions.document;
import static io.quarry.db.query.expressions.Expressions.field;
import static io.quarry.db.query.expressions.Expressions.literal;
import static io.quarry.db.query.expressions.Expressions.mod;
import static io.quarry.db.query.expressions.Expressions.mul;
import static io.quarry.db.query.expressions.Expressions.not;
import static io.quarry.db.query.expressions.Expressions.or;
import static io.quarry.db.query.expressions.Expressions.param;
import static io.quarry.db.query.expressions.Expressions.sub;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for expression evaluation.
 */
public class ExpressionsTest {
    private static final FieldBuffer DOC = FieldBuffer.of(
            "age", 10,
            "score", 2.5,
            "name", "ada",
            "address", FieldBuffer.of("city", "london"),
            "nothing", null);

    private static final EvalStack STACK = EvalStack.newBuilder()
            .setDocument(DOC)
            .setParams(Params.of(Param.named("min", 5), Param.named("city", "london")))
            .build();

    private static boolean test(Expr expr) {
        return expr.eval(STACK).isTruthy();
    }

    @Test
    public void fieldSelectors() {
        assertEquals(Value.ofInt32(10), field("age").eval(STACK));
        assertEquals(Value.ofText("london"), field("address.city").eval(STACK));
        assertThrows(FieldNotFoundException.class, () -> field("missing").eval(STACK));
        assertThrows(FieldNotFoundException.class, () -> field("age").eval(EvalStack.EMPTY));
    }

    @Test
    public void comparisons() {
        assertTrue(test(field("age").eq(10)));
        assertTrue(test(field("age").eq(10.0)));
        assertTrue(test(field("age").neq(11)));
        assertTrue(test(field("age").gt(9)));
        assertTrue(test(field("age").gte(10)));
        assertFalse(test(field("age").lt(10)));
        assertTrue(test(field("score").lte(2.5)));
        assertTrue(test(field("name").gt("ab")));
        assertTrue(test(field("address.city").eq(param("city"))));
    }

    @Test
    public void missingFieldMakesComparisonFalse() {
        assertFalse(test(field("missing").eq(1)));
        assertFalse(test(field("missing").neq(1)));
        assertFalse(test(field("missing").lt(1)));
        assertTrue(test(not(field("missing").eq(1))));
    }

    @Test
    public void nullAndUnrelatedTypes() {
        assertTrue(test(field("nothing").eq(null)));
        assertFalse(test(field("age").eq(null)));
        assertFalse(test(field("name").gt(1)));
        assertFalse(test(field("name").lt(1)));
        assertTrue(test(field("name").neq(1)));
    }

    @Test
    public void logic() {
        assertTrue(test(and(field("age").gt(param("min")), field("name").eq("ada"))));
        assertFalse(test(and(field("age").gt(param("min")), field("name").eq("bob"))));
        assertTrue(test(or(field("name").eq("bob"), field("age").eq(10))));
        assertFalse(test(or(field("name").eq("bob"), field("age").eq(11))));
    }

    @Test
    public void andShortCircuits() {
        Expr exploding = stack -> {
            throw new IllegalStateException("evaluated");
        };
        assertFalse(test(and(field("age").eq(0), exploding)));
        assertTrue(test(or(field("age").eq(10), exploding)));
    }

    @Test
    public void arithmetic() {
        assertEquals(Value.ofInt64(15), add(field("age"), 5).eval(STACK));
        assertEquals(Value.ofInt64(7), sub(field("age"), 3).eval(STACK));
        assertEquals(Value.ofDouble(25.0), mul(field("age"), field("score")).eval(STACK));
        assertEquals(Value.ofInt64(3), div(field("age"), 3).eval(STACK));
        assertEquals(Value.ofInt64(1), mod(field("age"), 3).eval(STACK));
        assertEquals(Value.ofDouble(4.0), div(field("age"), 2.5).eval(STACK));
    }

    @Test
    public void arithmeticEdgeCases() {
        assertEquals(Value.NULL, div(field("age"), 0).eval(STACK));
        assertEquals(Value.NULL, mod(field("age"), 0).eval(STACK));
        assertEquals(Value.NULL, add(field("nothing"), 1).eval(STACK));
        assertThrows(TypeMismatchException.class, () -> add(field("name"), 1).eval(STACK));
        assertThrows(ConversionFailedException.class, () -> add(Long.MAX_VALUE, 1).eval(STACK));
    }

    @Test
    public void parameters() {
        Params positional = Params.positional(1, "two");
        EvalStack stack = EvalStack.ofParams(positional);
        assertEquals(Value.ofInt32(1), param(1).eval(stack));
        assertEquals(Value.ofText("two"), param(2).eval(stack));
        assertThrows(QuarryArgumentException.class, () -> param(3).eval(stack));
        assertThrows(QuarryArgumentException.class, () -> param("nope").eval(stack));
    }

    @Test
    public void documents() {
        Value value = document("a", 1, "b", add(param("min"), 1)).eval(STACK);
        assertEquals(ValueType.DOCUMENT, value.getType());
        assertEquals(Value.ofInt64(6), value.asDocument().getByField("b"));
    }

    @Test
    public void evalInteger() {
        assertEquals(3, ExprUtils.evalInteger(literal(3), EvalStack.EMPTY, "limit"));
        assertEquals(3, ExprUtils.evalInteger(literal(3.0), EvalStack.EMPTY, "limit"));
        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> ExprUtils.evalInteger(literal("3"), EvalStack.EMPTY, "limit"));
        assertEquals("limit expression must evaluate to a number, got text", e.getMessage());
        assertThrows(ConversionFailedException.class,
                () -> ExprUtils.evalInteger(literal(2.5), EvalStack.EMPTY, "offset"));
        assertThrows(QuarryArgumentException.class,
                () -> ExprUtils.evalInteger(literal(-1), EvalStack.EMPTY, "offset"));
    }

    @Test
    public void constants() {
        assertTrue(ExprUtils.isConstant(literal(1)));
        assertTrue(ExprUtils.isConstant(add(param("min"), param(1))));
        assertFalse(ExprUtils.isConstant(field("age")));
        assertFalse(ExprUtils.isConstant(add(field("age"), 1)));
    }
}

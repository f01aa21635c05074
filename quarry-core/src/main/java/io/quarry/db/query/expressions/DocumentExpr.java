/*
 * DocumentExpr.java
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

import com.google.common.collect.ImmutableMap;
import io.quarry.annotation.API;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Builds a document value from named expressions, such as the documents of an {@code INSERT ... VALUES}.
 */
@API(API.Status.STABLE)
public final class DocumentExpr implements Expr {
    @Nonnull
    private final Map<String, Expr> fields;

    public DocumentExpr(@Nonnull Map<String, ? extends Expr> fields) {
        this.fields = ImmutableMap.copyOf(fields);
    }

    @Nonnull
    @Override
    public Value eval(@Nonnull EvalStack stack) {
        final FieldBuffer buffer = new FieldBuffer();
        for (Map.Entry<String, Expr> field : fields.entrySet()) {
            buffer.add(field.getKey(), field.getValue().eval(stack));
        }
        return Value.ofDocument(buffer);
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(", ", "{", "}");
        fields.forEach((name, expr) -> joiner.add(name + ": " + expr));
        return joiner.toString();
    }
}

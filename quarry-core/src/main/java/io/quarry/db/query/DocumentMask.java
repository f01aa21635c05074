/*
 * DocumentMask.java
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

import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.document.Document;
import io.quarry.db.document.Documents;
import io.quarry.db.document.FieldVisitor;
import io.quarry.db.document.Value;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.db.query.expressions.EvalStack;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A source document seen through the result fields of a {@code SELECT}.
 *
 * <p>
 * Iteration runs every result field in order. A lookup by name only evaluates the result fields that
 * {@linkplain ResultField#mayEmit may emit} that name; fields of the source document that no result field emits
 * are not visible.
 * </p>
 */
@API(API.Status.STABLE)
public class DocumentMask implements Document {
    @Nonnull
    private final EvalStack stack;
    @Nonnull
    private final List<ResultField> resultFields;

    /**
     * Create a mask.
     * @param stack the statement's evaluation context; it is rebound to {@code source}
     * @param source the source document
     * @param resultFields the result fields
     */
    public DocumentMask(@Nonnull EvalStack stack, @Nonnull Document source, @Nonnull List<? extends ResultField> resultFields) {
        this.stack = stack.withDocument(source);
        this.resultFields = ImmutableList.copyOf(resultFields);
    }

    @Nonnull
    @Override
    public Value getByField(@Nonnull String field) {
        final Value[] found = new Value[1];
        for (ResultField resultField : resultFields) {
            if (!resultField.mayEmit(field)) {
                continue;
            }
            resultField.iterate(stack, (name, value) -> {
                if (found[0] == null && name.equals(field)) {
                    found[0] = value;
                }
            });
            if (found[0] != null) {
                return found[0];
            }
        }
        throw new FieldNotFoundException("field not found", LogMessageKeys.FIELD_NAME, field);
    }

    @Override
    public void iterate(@Nonnull FieldVisitor visitor) {
        for (ResultField resultField : resultFields) {
            resultField.iterate(stack, visitor);
        }
    }

    @Override
    public String toString() {
        return Documents.toString(this);
    }
}

/*
 * ResultField.java
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
import io.quarry.db.document.FieldVisitor;
import io.quarry.db.query.expressions.EvalStack;

import javax.annotation.Nonnull;

/**
 * One entry of the field list of a {@code SELECT}. For each source document it emits zero or more named values
 * into the projected document.
 */
@API(API.Status.STABLE)
public interface ResultField {
    /**
     * Get the declared name of this field.
     * @return the name
     */
    @Nonnull
    String getName();

    /**
     * Whether this field can emit a value named {@code field}. Lookups on a projected document only evaluate the
     * result fields that may emit the requested name.
     * @param field the requested name
     * @return whether evaluating this result field could produce it
     */
    default boolean mayEmit(@Nonnull String field) {
        return getName().equals(field);
    }

    /**
     * Emit the values of this field for the document of {@code stack}.
     * @param stack the evaluation context, bound to the source document
     * @param visitor receives each emitted name and value
     */
    void iterate(@Nonnull EvalStack stack, @Nonnull FieldVisitor visitor);
}

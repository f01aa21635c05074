/*
 * Wildcard.java
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
 * {@code *}: every field of the source document under its own name.
 */
@API(API.Status.STABLE)
public final class Wildcard implements ResultField {
    public static final String NAME = "*";

    @Nonnull
    public static final Wildcard INSTANCE = new Wildcard();

    private Wildcard() {
    }

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean mayEmit(@Nonnull String field) {
        return true;
    }

    @Override
    public void iterate(@Nonnull EvalStack stack, @Nonnull FieldVisitor visitor) {
        stack.requireDocument().iterate(visitor);
    }

    @Override
    public String toString() {
        return NAME;
    }
}

/*
 * LiteralValue.java
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
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;

/**
 * A constant.
 */
@API(API.Status.STABLE)
public final class LiteralValue implements Expr {
    @Nonnull
    private final Value value;

    public LiteralValue(@Nonnull Value value) {
        this.value = value;
    }

    @Nonnull
    public Value getValue() {
        return value;
    }

    @Nonnull
    @Override
    public Value eval(@Nonnull EvalStack stack) {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}

/*
 * Param.java
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
import javax.annotation.Nullable;

/**
 * A bound statement parameter, optionally named.
 */
@API(API.Status.STABLE)
public final class Param {
    @Nullable
    private final String name;
    @Nonnull
    private final Value value;

    private Param(@Nullable String name, @Nonnull Value value) {
        this.name = name;
        this.value = value;
    }

    @Nonnull
    public static Param named(@Nonnull String name, @Nullable Object value) {
        return new Param(name, Value.of(value));
    }

    @Nonnull
    public static Param positional(@Nullable Object value) {
        return new Param(null, Value.of(value));
    }

    @Nullable
    public String getName() {
        return name;
    }

    @Nonnull
    public Value getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name == null ? value.toString() : "$" + name + "=" + value;
    }
}

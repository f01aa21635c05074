/*
 * Params.java
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

import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.document.Value;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * The parameters bound to a statement execution. Parameters are addressed by name or by 1-based position.
 */
@API(API.Status.STABLE)
public final class Params {
    @Nonnull
    public static final Params EMPTY = new Params(ImmutableList.of());

    @Nonnull
    private final List<Param> params;

    private Params(@Nonnull List<Param> params) {
        this.params = params;
    }

    @Nonnull
    public static Params of(@Nonnull Param... params) {
        return new Params(ImmutableList.copyOf(params));
    }

    @Nonnull
    public static Params positional(@Nullable Object... values) {
        if (values == null) {
            return EMPTY;
        }
        final ImmutableList.Builder<Param> params = ImmutableList.builder();
        for (Object value : values) {
            params.add(Param.positional(value));
        }
        return new Params(params.build());
    }

    @Nonnull
    public Value getNamed(@Nonnull String name) {
        for (Param param : params) {
            if (name.equals(param.getName())) {
                return param.getValue();
            }
        }
        throw new QuarryArgumentException("parameter not found", LogMessageKeys.PARAMETER, "$" + name);
    }

    /**
     * Get a parameter by position.
     * @param position the 1-based position
     * @return the value of the parameter
     * @throws QuarryArgumentException if there is no parameter at that position
     */
    @Nonnull
    public Value getPositional(int position) {
        if (position < 1 || position > params.size()) {
            throw new QuarryArgumentException("parameter not found", LogMessageKeys.PARAMETER, position);
        }
        return params.get(position - 1).getValue();
    }

    public int size() {
        return params.size();
    }

    @Override
    public String toString() {
        return params.toString();
    }
}

/*
 * OrOperator.java
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
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;

/**
 * True if any child is truthy. Evaluation stops at the first truthy child.
 */
@API(API.Status.STABLE)
public final class OrOperator implements Expr {
    @Nonnull
    private final List<Expr> children;

    public OrOperator(@Nonnull List<? extends Expr> children) {
        this.children = ImmutableList.copyOf(children);
    }

    @Nonnull
    public List<Expr> getChildren() {
        return children;
    }

    @Nonnull
    @Override
    public Value eval(@Nonnull EvalStack stack) {
        for (Expr child : children) {
            if (child.eval(stack).isTruthy()) {
                return Value.TRUE;
            }
        }
        return Value.FALSE;
    }

    @Override
    public String toString() {
        return children.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
    }
}

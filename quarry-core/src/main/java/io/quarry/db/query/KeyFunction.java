/*
 * KeyFunction.java
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
import io.quarry.db.QuarryCoreException;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.FieldVisitor;
import io.quarry.db.document.Keyer;
import io.quarry.db.document.Value;
import io.quarry.db.query.expressions.EvalStack;
import io.quarry.db.store.Table;
import io.quarry.db.store.TableConfig;

import javax.annotation.Nonnull;

/**
 * {@code key()}: the primary key of the document.
 *
 * <p>
 * For a table with a primary key path this emits the value at that path, under the path as name. For any other
 * table it emits the integer the document was keyed by, under the name {@code key()}.
 * </p>
 */
@API(API.Status.STABLE)
public final class KeyFunction implements ResultField {
    public static final String NAME = "key()";

    @Nonnull
    public static final KeyFunction INSTANCE = new KeyFunction();

    private KeyFunction() {
    }

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    /**
     * The emitted name depends on the table, so any name may match.
     */
    @Override
    public boolean mayEmit(@Nonnull String field) {
        return true;
    }

    @Override
    public void iterate(@Nonnull EvalStack stack, @Nonnull FieldVisitor visitor) {
        final Document document = stack.requireDocument();
        final TableConfig config = stack.getTableConfig();
        if (config != null && config.hasPrimaryKey()) {
            final FieldPath primaryKey = config.getPrimaryKey();
            visitor.visit(primaryKey.toString(), primaryKey.getValue(document));
            return;
        }
        if (!(document instanceof Keyer)) {
            throw new QuarryCoreException("document has no storage key");
        }
        visitor.visit(NAME, Value.ofInt64(Table.decodeSequenceKey(((Keyer) document).getKey())));
    }

    @Override
    public String toString() {
        return NAME;
    }
}

/*
 * Document.java
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

package io.quarry.db.document;

import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;

import javax.annotation.Nonnull;

/**
 * A read-only view of named fields. Field lookup is deterministic and has no side effects. The absence of a
 * field is reported with {@link FieldNotFoundException}, which callers may treat as an ordinary outcome.
 */
@API(API.Status.STABLE)
public interface Document {
    /**
     * Get a top-level field.
     * @param field the name of the field
     * @return the value of the field
     * @throws FieldNotFoundException if the document has no such field
     */
    @Nonnull
    Value getByField(@Nonnull String field);

    /**
     * Visit every top-level field in document order.
     * @param visitor the visitor
     */
    void iterate(@Nonnull FieldVisitor visitor);
}

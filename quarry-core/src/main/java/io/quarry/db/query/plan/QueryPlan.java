/*
 * QueryPlan.java
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

package io.quarry.db.query.plan;

import io.quarry.annotation.API;
import io.quarry.db.cursors.Cursor;
import io.quarry.db.document.EncodedDocument;
import io.quarry.db.document.FieldPath;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An access path: the way the documents of one table are read before any filtering, sorting or paging.
 */
@API(API.Status.STABLE)
public interface QueryPlan {
    /**
     * Open a cursor over the documents this plan reads.
     * @param table the table, bound to the executing transaction
     * @return a cursor of documents
     */
    @Nonnull
    Cursor<EncodedDocument> execute(@Nonnull Table table);

    /**
     * Get the field path the documents come back ordered by.
     * @return the path, or {@code null} if the order is not that of any field
     */
    @Nullable
    FieldPath getOrderPath();

    boolean isReverse();

    /**
     * Whether this plan already yields documents in the order of {@code path} in the given direction.
     * @param path the path to order by
     * @param direction the sort direction
     * @return whether no sort is needed
     */
    default boolean isOrderedBy(@Nonnull FieldPath path, @Nonnull SortDirection direction) {
        return path.equals(getOrderPath()) && isReverse() == direction.isDescending();
    }
}

/*
 * TableScanPlan.java
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
 * Reads every document of a table in key order.
 */
@API(API.Status.STABLE)
public final class TableScanPlan implements QueryPlan {
    @Nullable
    private final FieldPath primaryKey;
    private final boolean reverse;

    /**
     * Create a table scan.
     * @param primaryKey the primary key path of the table, if it has one, since key order is then its order
     * @param reverse whether to scan backwards
     */
    public TableScanPlan(@Nullable FieldPath primaryKey, boolean reverse) {
        this.primaryKey = primaryKey;
        this.reverse = reverse;
    }

    @Nonnull
    @Override
    public Cursor<EncodedDocument> execute(@Nonnull Table table) {
        return table.scanKeyRange(null, null, reverse);
    }

    @Nullable
    @Override
    public FieldPath getOrderPath() {
        return primaryKey;
    }

    @Override
    public boolean isReverse() {
        return reverse;
    }

    @Override
    public String toString() {
        return "TableScan(" + (reverse ? "reverse" : "forward") + ")";
    }
}

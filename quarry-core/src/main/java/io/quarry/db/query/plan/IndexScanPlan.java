/*
 * IndexScanPlan.java
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
import io.quarry.db.store.IndexConfig;
import io.quarry.db.store.ScanRange;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;

/**
 * Reads the documents a secondary index points to for a range of values, in index order.
 */
@API(API.Status.STABLE)
public final class IndexScanPlan implements QueryPlan {
    @Nonnull
    private final IndexConfig index;
    @Nonnull
    private final ScanRange range;
    private final boolean reverse;

    public IndexScanPlan(@Nonnull IndexConfig index, @Nonnull ScanRange range, boolean reverse) {
        this.index = index;
        this.range = range;
        this.reverse = reverse;
    }

    @Nonnull
    public IndexConfig getIndex() {
        return index;
    }

    @Nonnull
    public ScanRange getRange() {
        return range;
    }

    @Nonnull
    @Override
    public Cursor<EncodedDocument> execute(@Nonnull Table table) {
        return table.scanIndex(table.getIndex(index.getIndexName()), range, reverse);
    }

    @Nonnull
    @Override
    public FieldPath getOrderPath() {
        return index.getPath();
    }

    @Override
    public boolean isReverse() {
        return reverse;
    }

    @Override
    public String toString() {
        return "IndexScan(" + index.getIndexName() + " " + range + (reverse ? " reverse" : "") + ")";
    }
}

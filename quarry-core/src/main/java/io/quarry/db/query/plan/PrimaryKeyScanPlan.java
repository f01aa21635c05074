/*
 * PrimaryKeyScanPlan.java
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
import io.quarry.db.store.ScanRange;
import io.quarry.db.store.Table;

import javax.annotation.Nonnull;

/**
 * Reads the documents whose declared primary key falls in a range.
 */
@API(API.Status.STABLE)
public final class PrimaryKeyScanPlan implements QueryPlan {
    @Nonnull
    private final FieldPath primaryKey;
    @Nonnull
    private final ScanRange range;
    private final boolean reverse;

    public PrimaryKeyScanPlan(@Nonnull FieldPath primaryKey, @Nonnull ScanRange range, boolean reverse) {
        this.primaryKey = primaryKey;
        this.range = range;
        this.reverse = reverse;
    }

    @Nonnull
    public ScanRange getRange() {
        return range;
    }

    @Nonnull
    @Override
    public Cursor<EncodedDocument> execute(@Nonnull Table table) {
        return table.scanPrimaryKey(range, reverse);
    }

    @Nonnull
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
        return "PrimaryKeyScan(" + primaryKey + " " + range + (reverse ? " reverse" : "") + ")";
    }
}

/*
 * Index.java
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

package io.quarry.db.store;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import io.quarry.annotation.API;
import io.quarry.db.DuplicateDocumentException;
import io.quarry.db.QuarryCoreException;
import io.quarry.db.cursors.Cursor;
import io.quarry.db.cursors.StoreCursor;
import io.quarry.db.document.DocumentCodec;
import io.quarry.db.document.Value;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreItem;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * A secondary index, mapping the values of one field path to the primary keys of the documents holding them.
 *
 * <p>
 * Entries are keyed by the sort key encoding of the value, so a scan of the index store yields primary keys in
 * value order. Every entry stores the primary key as its value. Entries of a non-unique index append the
 * primary key to the encoded value so that equal values do not collide. A unique index stores one entry per
 * value, except for {@code NULL}, which any number of documents may share.
 * </p>
 */
@API(API.Status.STABLE)
public class Index {
    @Nonnull
    private final IndexConfig config;
    @Nonnull
    private final Store store;

    Index(@Nonnull IndexConfig config, @Nonnull Store store) {
        this.config = config;
        this.store = store;
    }

    @Nonnull
    public IndexConfig getConfig() {
        return config;
    }

    @Nonnull
    public String getName() {
        return config.getIndexName();
    }

    /**
     * Add an entry.
     * @param value the indexed value
     * @param primaryKey the primary key of the document holding it
     * @throws DuplicateDocumentException if the index is unique and another document holds the value
     */
    public void set(@Nonnull Value value, @Nonnull byte[] primaryKey) {
        checkUnique(value, primaryKey);
        store.put(entryKey(value, primaryKey), primaryKey);
    }

    /**
     * Remove an entry.
     * @param value the indexed value
     * @param primaryKey the primary key of the document holding it
     */
    public void delete(@Nonnull Value value, @Nonnull byte[] primaryKey) {
        final byte[] key = entryKey(value, primaryKey);
        try {
            if (!Arrays.equals(store.get(key), primaryKey)) {
                throw missingEntry(value, primaryKey, null);
            }
            store.delete(key);
        } catch (KeyNotFoundException e) {
            throw missingEntry(value, primaryKey, e);
        }
    }

    /**
     * Check that adding an entry would not break uniqueness. Does nothing for a non-unique index.
     * @param value the value to be indexed
     * @param primaryKey the primary key of the document that will hold it
     * @throws DuplicateDocumentException if another document holds the value in a unique index
     */
    public void checkUnique(@Nonnull Value value, @Nonnull byte[] primaryKey) {
        if (!usesUniqueEntry(value)) {
            return;
        }
        final byte[] existing;
        try {
            existing = store.get(entryKey(value, primaryKey));
        } catch (KeyNotFoundException e) {
            return;
        }
        if (!Arrays.equals(existing, primaryKey)) {
            throw new DuplicateDocumentException("duplicate value in unique index",
                    LogMessageKeys.INDEX_NAME, getName(),
                    LogMessageKeys.FIELD_PATH, config.getPath(),
                    LogMessageKeys.VALUE, value);
        }
    }

    /**
     * Scan the primary keys of the documents whose indexed value falls in a range.
     * @param range the values to scan
     * @param reverse whether to scan in descending value order
     * @return a cursor of primary keys
     */
    @Nonnull
    public Cursor<byte[]> scan(@Nonnull ScanRange range, boolean reverse) {
        return new StoreCursor(store, range.getLowKey(), range.getHighKeyExclusive(), reverse)
                .map(StoreItem::getValue);
    }

    public void truncate() {
        store.truncate();
    }

    private boolean usesUniqueEntry(@Nonnull Value value) {
        return config.isUnique() && !value.isNull();
    }

    @Nonnull
    private byte[] entryKey(@Nonnull Value value, @Nonnull byte[] primaryKey) {
        if (usesUniqueEntry(value)) {
            return DocumentCodec.encodeSortKey(value).pack();
        }
        return DocumentCodec.encodeSortKey(value).add(primaryKey).pack();
    }

    @Nonnull
    private QuarryCoreException missingEntry(@Nonnull Value value, @Nonnull byte[] primaryKey,
                                             @Nullable Throwable cause) {
        final QuarryCoreException ex = new QuarryCoreException("index entry missing", cause);
        ex.addLogInfo(LogMessageKeys.INDEX_NAME, getName(),
                LogMessageKeys.VALUE, value,
                LogMessageKeys.PRIMARY_KEY, ByteArrayUtil.printable(primaryKey));
        return ex;
    }

    @Override
    public String toString() {
        return config.toString();
    }
}

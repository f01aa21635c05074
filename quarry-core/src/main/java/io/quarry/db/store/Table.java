/*
 * Table.java
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
import com.apple.foundationdb.tuple.Tuple;
import io.quarry.annotation.API;
import io.quarry.db.DocumentNotFoundException;
import io.quarry.db.DuplicateDocumentException;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.IndexNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.QuarryCoreException;
import io.quarry.db.cursors.Cursor;
import io.quarry.db.cursors.DocumentStream;
import io.quarry.db.cursors.StoreCursor;
import io.quarry.db.document.Document;
import io.quarry.db.document.DocumentCodec;
import io.quarry.db.document.EncodedDocument;
import io.quarry.db.document.FieldPath;
import io.quarry.db.document.Value;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.Store;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * A table of documents bound to one transaction.
 *
 * <p>
 * Documents are stored under their primary key. If the table declares a primary key path, the key is the sort
 * key encoding of the value at that path, so a scan of the table returns documents in primary key order.
 * Otherwise the key is a tuple holding the next value of the table's sequence and documents come back in
 * insertion order.
 * </p>
 *
 * <p>
 * Every mutation keeps the table's indexes in step. Unique indexes are checked before anything is written, so
 * a rejected insert or replace leaves the table unchanged.
 * </p>
 */
@API(API.Status.STABLE)
public class Table {
    @Nonnull
    private final Catalog catalog;
    @Nonnull
    private final String name;
    @Nonnull
    private final TableConfig config;
    @Nonnull
    private final Store store;

    Table(@Nonnull Catalog catalog, @Nonnull String name, @Nonnull TableConfig config, @Nonnull Store store) {
        this.catalog = catalog;
        this.name = name;
        this.config = config;
        this.store = store;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public TableConfig getConfig() {
        return config;
    }

    @Nonnull
    public List<Index> getIndexes() {
        return catalog.getIndexes(name);
    }

    /**
     * Get an index of this table by name.
     * @param indexName the index name
     * @return the index
     * @throws IndexNotFoundException if there is no such index on this table
     */
    @Nonnull
    public Index getIndex(@Nonnull String indexName) {
        final Index index = catalog.getIndex(indexName);
        if (!index.getConfig().getTableName().equals(name)) {
            throw new IndexNotFoundException("index not found",
                    LogMessageKeys.INDEX_NAME, indexName,
                    LogMessageKeys.TABLE_NAME, name);
        }
        return index;
    }

    /**
     * Insert a document.
     * @param document the document
     * @return the key the document was stored under
     * @throws QuarryArgumentException if the table has a primary key path and the document lacks it
     * @throws DuplicateDocumentException if a document with the same primary key, or the same value in a unique
     * index, already exists
     */
    @Nonnull
    public byte[] insert(@Nonnull Document document) {
        final List<Index> indexes = getIndexes();
        final byte[] key;
        if (config.hasPrimaryKey()) {
            key = encodePrimaryKey(primaryKeyValue(document));
            if (exists(key)) {
                throw new DuplicateDocumentException("duplicate primary key",
                        LogMessageKeys.TABLE_NAME, name,
                        LogMessageKeys.PRIMARY_KEY, config.getPrimaryKey());
            }
            checkUnique(indexes, document, key);
        } else {
            checkUnique(indexes, document, null);
            key = encodeSequenceKey(store.nextSequence());
        }
        store.put(key, DocumentCodec.encode(document));
        for (Index index : indexes) {
            index.set(indexedValue(index, document), key);
        }
        return key;
    }

    /**
     * Get a document by key.
     * @param key the key
     * @return the document, bound to its key
     * @throws DocumentNotFoundException if there is no document under the key
     */
    @Nonnull
    public EncodedDocument get(@Nonnull byte[] key) {
        try {
            return new EncodedDocument(key, store.get(key));
        } catch (KeyNotFoundException e) {
            throw notFound(key, e);
        }
    }

    /**
     * Delete a document and its index entries.
     * @param key the key
     * @throws DocumentNotFoundException if there is no document under the key
     */
    public void delete(@Nonnull byte[] key) {
        final EncodedDocument old = get(key);
        for (Index index : getIndexes()) {
            index.delete(indexedValue(index, old), key);
        }
        store.delete(key);
    }

    /**
     * Replace the document stored under a key.
     * @param key the key
     * @param document the new document
     * @throws DocumentNotFoundException if there is no document under the key
     * @throws QuarryArgumentException if the new document has a different primary key
     */
    public void replace(@Nonnull byte[] key, @Nonnull Document document) {
        final EncodedDocument old = get(key);
        if (config.hasPrimaryKey() && !Arrays.equals(key, encodePrimaryKey(primaryKeyValue(document)))) {
            throw new QuarryArgumentException("replacement must not change the primary key",
                    LogMessageKeys.TABLE_NAME, name,
                    LogMessageKeys.PRIMARY_KEY, config.getPrimaryKey());
        }
        final List<Index> indexes = getIndexes();
        checkUnique(indexes, document, key);
        for (Index index : indexes) {
            index.delete(indexedValue(index, old), key);
        }
        store.put(key, DocumentCodec.encode(document));
        for (Index index : indexes) {
            index.set(indexedValue(index, document), key);
        }
    }

    /**
     * Remove every document and every index entry. The sequence keeps counting from where it was.
     */
    public void truncate() {
        store.truncate();
        for (Index index : getIndexes()) {
            index.truncate();
        }
    }

    @Nonnull
    public DocumentStream stream() {
        return stream(false);
    }

    @Nonnull
    public DocumentStream stream(boolean reverse) {
        return DocumentStream.of(scanKeyRange(null, null, reverse));
    }

    /**
     * Scan the documents whose keys fall in {@code [low, highExclusive)}.
     * @param low the first key, or {@code null} to start at the beginning
     * @param highExclusive the key after the last one, or {@code null} to run to the end
     * @param reverse whether to scan in descending key order
     * @return a cursor of documents
     */
    @Nonnull
    public Cursor<EncodedDocument> scanKeyRange(@Nullable byte[] low, @Nullable byte[] highExclusive, boolean reverse) {
        return new StoreCursor(store, low, highExclusive, reverse)
                .map(item -> new EncodedDocument(item.getKey(), item.getValue()));
    }

    /**
     * Scan the documents whose primary key value falls in a range. Only meaningful for a table with a primary
     * key path.
     * @param range the primary key values
     * @param reverse whether to scan in descending order
     * @return a cursor of documents
     */
    @Nonnull
    public Cursor<EncodedDocument> scanPrimaryKey(@Nonnull ScanRange range, boolean reverse) {
        if (!config.hasPrimaryKey()) {
            throw new QuarryArgumentException("table has no primary key path", LogMessageKeys.TABLE_NAME, name);
        }
        return scanKeyRange(range.getLowKey(), range.getHighKeyExclusive(), reverse);
    }

    /**
     * Scan the documents an index points to, in index order.
     * @param index an index of this table
     * @param range the indexed values
     * @param reverse whether to scan in descending order
     * @return a cursor of documents
     */
    @Nonnull
    public Cursor<EncodedDocument> scanIndex(@Nonnull Index index, @Nonnull ScanRange range, boolean reverse) {
        return index.scan(range, reverse).map(this::get);
    }

    /**
     * Encode a primary key value as a storage key.
     * @param value the value of the primary key path
     * @return the storage key
     */
    @Nonnull
    public static byte[] encodePrimaryKey(@Nonnull Value value) {
        return DocumentCodec.encodeSortKey(value).pack();
    }

    @Nonnull
    public static byte[] encodeSequenceKey(long sequence) {
        return Tuple.from(sequence).pack();
    }

    /**
     * Decode a key assigned from a table's sequence.
     * @param key the storage key
     * @return the sequence value
     */
    public static long decodeSequenceKey(@Nonnull byte[] key) {
        try {
            return Tuple.fromBytes(key).getLong(0);
        } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
            throw new QuarryCoreException("key is not a sequence key", e)
                    .addLogInfo(LogMessageKeys.KEY, ByteArrayUtil.printable(key));
        }
    }

    @Nonnull
    private Value primaryKeyValue(@Nonnull Document document) {
        final FieldPath path = config.getPrimaryKey();
        try {
            return path.getValue(document);
        } catch (FieldNotFoundException e) {
            throw new QuarryArgumentException("document is missing its primary key",
                    LogMessageKeys.TABLE_NAME, name,
                    LogMessageKeys.PRIMARY_KEY, path);
        }
    }

    @Nonnull
    static Value indexedValue(@Nonnull Index index, @Nonnull Document document) {
        try {
            return index.getConfig().getPath().getValue(document);
        } catch (FieldNotFoundException e) {
            return Value.NULL;
        }
    }

    private static void checkUnique(@Nonnull List<Index> indexes, @Nonnull Document document, @Nullable byte[] key) {
        // a fresh sequence key can never equal an existing entry, so an empty key stands in for it
        final byte[] candidate = key == null ? new byte[0] : key;
        for (Index index : indexes) {
            index.checkUnique(indexedValue(index, document), candidate);
        }
    }

    private boolean exists(@Nonnull byte[] key) {
        try {
            store.get(key);
            return true;
        } catch (KeyNotFoundException e) {
            return false;
        }
    }

    @Nonnull
    private DocumentNotFoundException notFound(@Nonnull byte[] key, @Nonnull KeyNotFoundException cause) {
        final DocumentNotFoundException ex = new DocumentNotFoundException("document not found",
                LogMessageKeys.TABLE_NAME, name,
                LogMessageKeys.KEY, ByteArrayUtil.printable(key));
        ex.initCause(cause);
        return ex;
    }

    @Override
    public String toString() {
        return "Table{" + name + ", " + config + "}";
    }
}

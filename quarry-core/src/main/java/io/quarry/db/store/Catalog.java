/*
 * Catalog.java
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

import com.apple.foundationdb.tuple.Tuple;
import com.google.common.base.Strings;
import io.quarry.annotation.API;
import io.quarry.db.IndexAlreadyExistsException;
import io.quarry.db.IndexNotFoundException;
import io.quarry.db.QuarryArgumentException;
import io.quarry.db.TableAlreadyExistsException;
import io.quarry.db.TableNotFoundException;
import io.quarry.db.cursors.Cursor;
import io.quarry.db.cursors.StoreCursor;
import io.quarry.db.document.DocumentCodec;
import io.quarry.db.document.EncodedDocument;
import io.quarry.db.logging.KeyValueLogMessage;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.KeyNotFoundException;
import io.quarry.engine.Store;
import io.quarry.engine.StoreItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * The tables and indexes of a database, as seen from one engine transaction.
 *
 * <p>
 * Table configurations live in the {@value #TABLES_STORE} store keyed by table name, index configurations in
 * the {@value #INDEXES_STORE} store keyed by index name. Each table and each index owns a store of its own,
 * named after it with a {@code table:} or {@code index:} prefix.
 * </p>
 */
@API(API.Status.INTERNAL)
public class Catalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(Catalog.class);

    public static final String TABLES_STORE = "__quarry_tables";
    public static final String INDEXES_STORE = "__quarry_indexes";
    private static final String TABLE_STORE_PREFIX = "table:";
    private static final String INDEX_STORE_PREFIX = "index:";

    @Nonnull
    private final EngineTransaction transaction;

    public Catalog(@Nonnull EngineTransaction transaction) {
        this.transaction = transaction;
    }

    /**
     * Create the catalog stores if they do not exist yet.
     * @param transaction a writable transaction
     * @return whether anything was created
     */
    public static boolean bootstrap(@Nonnull EngineTransaction transaction) {
        final List<String> stores = transaction.listStores();
        boolean created = false;
        for (String name : List.of(TABLES_STORE, INDEXES_STORE)) {
            if (!stores.contains(name)) {
                transaction.createStore(name);
                created = true;
            }
        }
        return created;
    }

    @Nonnull
    public Table createTable(@Nonnull String name, @Nonnull TableConfig config) {
        checkName(name, LogMessageKeys.TABLE_NAME);
        final Store tables = transaction.getStore(TABLES_STORE);
        final byte[] key = nameKey(name);
        if (contains(tables, key)) {
            throw new TableAlreadyExistsException("table already exists", LogMessageKeys.TABLE_NAME, name);
        }
        tables.put(key, DocumentCodec.encode(config.toDocument()));
        transaction.createStore(TABLE_STORE_PREFIX + name);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("created table",
                    LogMessageKeys.TABLE_NAME, name,
                    LogMessageKeys.PRIMARY_KEY, config.getPrimaryKey()));
        }
        return new Table(this, name, config, transaction.getStore(TABLE_STORE_PREFIX + name));
    }

    @Nonnull
    public Table getTable(@Nonnull String name) {
        final TableConfig config;
        try {
            config = TableConfig.fromDocument(DocumentCodec.decode(
                    transaction.getStore(TABLES_STORE).get(nameKey(name))));
        } catch (KeyNotFoundException e) {
            throw new TableNotFoundException("table not found", LogMessageKeys.TABLE_NAME, name);
        }
        return new Table(this, name, config, transaction.getStore(TABLE_STORE_PREFIX + name));
    }

    /**
     * Drop a table together with its indexes.
     * @param name the table name
     */
    public void dropTable(@Nonnull String name) {
        final Store tables = transaction.getStore(TABLES_STORE);
        final byte[] key = nameKey(name);
        if (!contains(tables, key)) {
            throw new TableNotFoundException("table not found", LogMessageKeys.TABLE_NAME, name);
        }
        for (IndexConfig index : listIndexes(name)) {
            dropIndex(index.getIndexName());
        }
        tables.delete(key);
        transaction.dropStore(TABLE_STORE_PREFIX + name);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("dropped table", LogMessageKeys.TABLE_NAME, name));
        }
    }

    @Nonnull
    public List<String> listTables() {
        final List<String> names = new ArrayList<>();
        try (Cursor<StoreItem> cursor = StoreCursor.all(transaction.getStore(TABLES_STORE), false)) {
            cursor.forEach(item -> names.add(Tuple.fromBytes(item.getKey()).getString(0)));
        }
        return names;
    }

    /**
     * Create an index and fill it from the documents already in its table.
     * @param config the index definition
     * @return the index
     */
    @Nonnull
    public Index createIndex(@Nonnull IndexConfig config) {
        final String name = config.getIndexName();
        checkName(name, LogMessageKeys.INDEX_NAME);
        final Table table = getTable(config.getTableName());
        final Store indexes = transaction.getStore(INDEXES_STORE);
        final byte[] key = nameKey(name);
        if (contains(indexes, key)) {
            throw new IndexAlreadyExistsException("index already exists", LogMessageKeys.INDEX_NAME, name);
        }
        indexes.put(key, DocumentCodec.encode(config.toDocument()));
        transaction.createStore(INDEX_STORE_PREFIX + name);
        final Index index = openIndex(config);
        build(table, index);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("created index",
                    LogMessageKeys.INDEX_NAME, name,
                    LogMessageKeys.TABLE_NAME, config.getTableName(),
                    LogMessageKeys.FIELD_PATH, config.getPath(),
                    LogMessageKeys.UNIQUE, config.isUnique()));
        }
        return index;
    }

    @Nonnull
    public Index getIndex(@Nonnull String name) {
        final IndexConfig config;
        try {
            config = IndexConfig.fromDocument(DocumentCodec.decode(
                    transaction.getStore(INDEXES_STORE).get(nameKey(name))));
        } catch (KeyNotFoundException e) {
            throw new IndexNotFoundException("index not found", LogMessageKeys.INDEX_NAME, name);
        }
        return openIndex(config);
    }

    public void dropIndex(@Nonnull String name) {
        final Store indexes = transaction.getStore(INDEXES_STORE);
        final byte[] key = nameKey(name);
        if (!contains(indexes, key)) {
            throw new IndexNotFoundException("index not found", LogMessageKeys.INDEX_NAME, name);
        }
        indexes.delete(key);
        transaction.dropStore(INDEX_STORE_PREFIX + name);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("dropped index", LogMessageKeys.INDEX_NAME, name));
        }
    }

    /**
     * List every index of the database, ordered by name.
     * @return the index definitions
     */
    @Nonnull
    public List<IndexConfig> listIndexes() {
        final List<IndexConfig> configs = new ArrayList<>();
        try (Cursor<StoreItem> cursor = StoreCursor.all(transaction.getStore(INDEXES_STORE), false)) {
            cursor.forEach(item -> configs.add(IndexConfig.fromDocument(DocumentCodec.decode(item.getValue()))));
        }
        return configs;
    }

    @Nonnull
    public List<IndexConfig> listIndexes(@Nonnull String tableName) {
        final List<IndexConfig> configs = new ArrayList<>();
        for (IndexConfig config : listIndexes()) {
            if (config.getTableName().equals(tableName)) {
                configs.add(config);
            }
        }
        return configs;
    }

    /**
     * Empty an index and refill it from its table.
     * @param name the index name
     */
    public void reIndex(@Nonnull String name) {
        final Index index = getIndex(name);
        index.truncate();
        build(getTable(index.getConfig().getTableName()), index);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("rebuilt index", LogMessageKeys.INDEX_NAME, name));
        }
    }

    public void reIndexAll() {
        for (IndexConfig config : listIndexes()) {
            reIndex(config.getIndexName());
        }
    }

    @Nonnull
    List<Index> getIndexes(@Nonnull String tableName) {
        final List<Index> indexes = new ArrayList<>();
        for (IndexConfig config : listIndexes(tableName)) {
            indexes.add(openIndex(config));
        }
        return indexes;
    }

    @Nonnull
    private Index openIndex(@Nonnull IndexConfig config) {
        return new Index(config, transaction.getStore(INDEX_STORE_PREFIX + config.getIndexName()));
    }

    private static void build(@Nonnull Table table, @Nonnull Index index) {
        try (Cursor<EncodedDocument> cursor = table.scanKeyRange(null, null, false)) {
            cursor.forEach(document -> index.set(Table.indexedValue(index, document), document.getKey()));
        }
    }

    @Nonnull
    private static byte[] nameKey(@Nonnull String name) {
        return Tuple.from(name).pack();
    }

    private static boolean contains(@Nonnull Store store, @Nonnull byte[] key) {
        try {
            store.get(key);
            return true;
        } catch (KeyNotFoundException e) {
            return false;
        }
    }

    private static void checkName(@Nonnull String name, @Nonnull LogMessageKeys key) {
        if (Strings.isNullOrEmpty(name)) {
            throw new QuarryArgumentException("name must not be empty", key, name);
        }
    }
}

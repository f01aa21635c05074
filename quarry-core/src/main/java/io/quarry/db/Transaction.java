/*
 * Transaction.java
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

package io.quarry.db;

import io.quarry.annotation.API;
import io.quarry.db.store.Catalog;
import io.quarry.db.store.Index;
import io.quarry.db.store.IndexConfig;
import io.quarry.db.store.Table;
import io.quarry.db.store.TableConfig;
import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineTransaction;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A database transaction. Gives access to tables and indexes and to the schema operations that create and
 * drop them. A transaction that is closed without being committed is rolled back.
 */
@API(API.Status.STABLE)
public class Transaction implements AutoCloseable {
    @Nonnull
    private final EngineTransaction engineTransaction;
    @Nonnull
    private final Catalog catalog;

    Transaction(@Nonnull EngineTransaction engineTransaction) {
        this.engineTransaction = engineTransaction;
        this.catalog = new Catalog(engineTransaction);
    }

    public boolean isWritable() {
        return engineTransaction.isWritable();
    }

    @Nonnull
    public CancellationToken getCancellationToken() {
        return engineTransaction.getCancellationToken();
    }

    @Nonnull
    @API(API.Status.INTERNAL)
    public EngineTransaction getEngineTransaction() {
        return engineTransaction;
    }

    @Nonnull
    public Table createTable(@Nonnull String name) {
        return createTable(name, TableConfig.DEFAULT);
    }

    /**
     * Create a table.
     * @param name the table name
     * @param config the table configuration
     * @return the new table
     * @throws TableAlreadyExistsException if a table of that name exists
     */
    @Nonnull
    public Table createTable(@Nonnull String name, @Nonnull TableConfig config) {
        return catalog.createTable(name, config);
    }

    /**
     * Get a table.
     * @param name the table name
     * @return the table
     * @throws TableNotFoundException if there is no such table
     */
    @Nonnull
    public Table getTable(@Nonnull String name) {
        return catalog.getTable(name);
    }

    public void dropTable(@Nonnull String name) {
        catalog.dropTable(name);
    }

    @Nonnull
    public List<String> listTables() {
        return catalog.listTables();
    }

    /**
     * Create an index and build it from the documents already in the table.
     * @param config the index definition
     * @return the new index
     * @throws IndexAlreadyExistsException if an index of that name exists
     * @throws TableNotFoundException if the indexed table does not exist
     */
    @Nonnull
    public Index createIndex(@Nonnull IndexConfig config) {
        return catalog.createIndex(config);
    }

    @Nonnull
    public Index getIndex(@Nonnull String name) {
        return catalog.getIndex(name);
    }

    public void dropIndex(@Nonnull String name) {
        catalog.dropIndex(name);
    }

    @Nonnull
    public List<IndexConfig> listIndexes() {
        return catalog.listIndexes();
    }

    @Nonnull
    public List<IndexConfig> listIndexes(@Nonnull String tableName) {
        return catalog.listIndexes(tableName);
    }

    public void reIndex(@Nonnull String indexName) {
        catalog.reIndex(indexName);
    }

    public void reIndexAll() {
        catalog.reIndexAll();
    }

    public void commit() {
        engineTransaction.commit();
    }

    public void rollback() {
        engineTransaction.rollback();
    }

    @Override
    public void close() {
        engineTransaction.close();
    }
}

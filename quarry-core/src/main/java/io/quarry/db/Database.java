/*
 * Database.java
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
import io.quarry.db.logging.KeyValueLogMessage;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.db.store.Catalog;
import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineConfig;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.StorageEngineRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * A document database over a {@link StorageEngine}. The database owns the engine and closes it when it is
 * closed itself.
 *
 * <pre><code>
 * try (Database db = Database.open(EngineConfig.defaults());
 *      Transaction tx = db.begin(true)) {
 *     tx.createTable("users").insert(FieldBuffer.of("name", "ada"));
 *     tx.commit();
 * }
 * </code></pre>
 */
@API(API.Status.STABLE)
public class Database implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);

    @Nonnull
    private final StorageEngine engine;

    public Database(@Nonnull StorageEngine engine) {
        this.engine = engine;
        try (EngineTransaction tx = engine.begin(true)) {
            if (Catalog.bootstrap(tx)) {
                tx.commit();
            }
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("opened database", LogMessageKeys.ENGINE, engine.getName()));
        }
    }

    /**
     * Open a database on the engine named in a configuration.
     * @param config the engine configuration
     * @return the database
     */
    @Nonnull
    public static Database open(@Nonnull EngineConfig config) {
        return new Database(StorageEngineRegistry.open(config));
    }

    @Nonnull
    public StorageEngine getEngine() {
        return engine;
    }

    @Nonnull
    public Transaction begin(boolean writable) {
        return begin(writable, CancellationToken.NONE);
    }

    /**
     * Begin a transaction bound to a cancellation signal. Every storage operation of the transaction fails once
     * the signal fires.
     * @param writable whether the transaction may write
     * @param cancellationToken the cancellation signal
     * @return a new transaction
     */
    @Nonnull
    public Transaction begin(boolean writable, @Nonnull CancellationToken cancellationToken) {
        return new Transaction(engine.begin(writable, cancellationToken));
    }

    @Override
    public void close() {
        engine.close();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("closed database", LogMessageKeys.ENGINE, engine.getName()));
        }
    }
}

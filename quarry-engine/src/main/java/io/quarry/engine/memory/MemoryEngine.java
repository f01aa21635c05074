/*
 * MemoryEngine.java
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

package io.quarry.engine.memory;

import com.google.common.collect.ImmutableMap;
import io.quarry.annotation.API;
import io.quarry.engine.CancellationToken;
import io.quarry.engine.EngineTransaction;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.StorageException;
import io.quarry.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link StorageEngine} that keeps every store in a sorted map in memory.
 *
 * <p>
 * Read-only transactions see the catalog as it was committed when they began. A writable transaction copies each
 * store the first time it touches it and publishes all of its copies at once on commit, so a rollback only has
 * to drop them. Writable transactions are serialized: {@link #begin} blocks while another one is open.
 * </p>
 */
@API(API.Status.STABLE)
public class MemoryEngine implements StorageEngine {
    public static final String NAME = "memory";

    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryEngine.class);

    @Nonnull
    private final Object lock = new Object();
    @Nonnull
    private final Semaphore writer = new Semaphore(1, true);
    @Nonnull
    private final AtomicLong transactionIds = new AtomicLong();
    @Nonnull
    private Map<String, MemoryStoreState> committed = ImmutableMap.of();
    private volatile boolean closed;

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    @Nonnull
    @Override
    public EngineTransaction begin(boolean writable, @Nonnull CancellationToken cancellationToken) {
        checkOpen();
        cancellationToken.throwIfCancelled();
        if (writable) {
            try {
                writer.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageException("interrupted waiting for the writer lock", e);
            }
        }
        final Map<String, MemoryStoreState> snapshot;
        synchronized (lock) {
            snapshot = committed;
        }
        final long id = transactionIds.incrementAndGet();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("begin memory transaction {} writable={}", id, writable);
        }
        return new MemoryTransaction(this, id, writable, cancellationToken, snapshot);
    }

    void publish(long transactionId, @Nonnull Map<String, MemoryStoreState> stores) {
        synchronized (lock) {
            checkOpen();
            committed = ImmutableMap.copyOf(stores);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("committed memory transaction {} with {} stores", transactionId, stores.size());
        }
    }

    void release(boolean writable) {
        if (writable) {
            writer.release();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new StorageException("engine is closed", LogMessageKeys.ENGINE, NAME);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            committed = ImmutableMap.of();
        }
    }
}

/*
 * StorageEngineRegistry.java
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

package io.quarry.engine;

import io.quarry.annotation.API;
import io.quarry.util.LogMessageKeys;
import io.quarry.util.ServiceLoaderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.TreeMap;

/**
 * A singleton registry of the {@link StorageEngineFactory} implementations found on the class path.
 */
@API(API.Status.INTERNAL)
public class StorageEngineRegistry {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageEngineRegistry.class);
    @Nonnull
    private static final StorageEngineRegistry INSTANCE = new StorageEngineRegistry();

    @Nonnull
    private final Map<String, StorageEngineFactory> factories;

    @Nonnull
    public static StorageEngineRegistry instance() {
        return INSTANCE;
    }

    protected StorageEngineRegistry() {
        factories = new TreeMap<>();
        for (StorageEngineFactory factory : ServiceLoaderProvider.load(StorageEngineFactory.class)) {
            if (factories.containsKey(factory.getName())) {
                LOGGER.warn("duplicate storage engine factory {} ignored: {}", factory.getName(), factory.getClass().getName());
            } else {
                factories.put(factory.getName(), factory);
            }
        }
    }

    @Nonnull
    public StorageEngineFactory getFactory(@Nonnull String name) {
        final StorageEngineFactory factory = factories.get(name);
        if (factory == null) {
            throw new StorageException("unknown storage engine",
                    LogMessageKeys.ENGINE, name,
                    LogMessageKeys.VALUE, factories.keySet());
        }
        return factory;
    }

    /**
     * Open the engine named by the configuration.
     * @param config the engine configuration
     * @return a newly opened engine
     */
    @Nonnull
    public static StorageEngine open(@Nonnull EngineConfig config) {
        return instance().getFactory(config.getEngineName()).open(config);
    }
}

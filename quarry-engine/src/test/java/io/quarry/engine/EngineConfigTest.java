/*
 * EngineConfigTest.java
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

import io.quarry.engine.memory.MemoryEngine;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link EngineConfig} and {@link StorageEngineRegistry}.
 */
public class EngineConfigTest {
    @Test
    public void defaults() {
        EngineConfig config = EngineConfig.fromProperties(new Properties());
        assertEquals("memory", config.getEngineName());
        assertNull(config.getClusterFile());
        assertEquals(EngineConfig.DEFAULT_API_VERSION, config.getApiVersion());
        assertEquals("quarry", config.getKeyPrefix());
    }

    @Test
    public void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty("quarry.engine", "foundationdb");
        properties.setProperty("quarry.fdb.cluster-file", "/etc/foundationdb/fdb.cluster");
        properties.setProperty("quarry.fdb.api-version", " 630 ");
        properties.setProperty("quarry.fdb.key-prefix", "app");
        EngineConfig config = EngineConfig.fromProperties(properties);
        assertEquals("foundationdb", config.getEngineName());
        assertEquals("/etc/foundationdb/fdb.cluster", config.getClusterFile());
        assertEquals(630, config.getApiVersion());
        assertEquals("app", config.getKeyPrefix());
        assertEquals(config.toString(), config.toBuilder().build().toString());
    }

    @Test
    public void badApiVersion() {
        Properties properties = new Properties();
        properties.setProperty("quarry.fdb.api-version", "seven");
        StorageException e = assertThrows(StorageException.class, () -> EngineConfig.fromProperties(properties));
        assertEquals("quarry.fdb.api-version", e.getLogInfo().get("property"));
    }

    @Test
    public void registryOpensMemoryEngine() {
        try (StorageEngine engine = StorageEngineRegistry.open(EngineConfig.defaults())) {
            assertThat(engine, instanceOf(MemoryEngine.class));
        }
    }

    @Test
    public void registryRejectsUnknownEngine() {
        EngineConfig config = EngineConfig.newBuilder().setEngineName("bolt").build();
        StorageException e = assertThrows(StorageException.class, () -> StorageEngineRegistry.open(config));
        assertEquals("bolt", e.getLogInfo().get("engine"));
    }
}

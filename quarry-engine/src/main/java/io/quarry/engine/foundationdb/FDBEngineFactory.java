/*
 * FDBEngineFactory.java
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

package io.quarry.engine.foundationdb;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.FDB;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import com.google.auto.service.AutoService;
import io.quarry.annotation.API;
import io.quarry.engine.EngineConfig;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.StorageEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Opens an {@link FDBEngine} on the cluster named by {@link EngineConfig#getClusterFile()}.
 */
@AutoService(StorageEngineFactory.class)
@API(API.Status.INTERNAL)
public class FDBEngineFactory implements StorageEngineFactory {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(FDBEngineFactory.class);

    @Nonnull
    @Override
    public String getName() {
        return FDBEngine.NAME;
    }

    @Nonnull
    @Override
    public StorageEngine open(@Nonnull EngineConfig config) {
        final FDB fdb = FDB.isAPIVersionSelected() ? FDB.instance() : FDB.selectAPIVersion(config.getApiVersion());
        final Database database = config.getClusterFile() == null ? fdb.open() : fdb.open(config.getClusterFile());
        LOGGER.info("opened foundationdb engine cluster_file={} key_prefix={}", config.getClusterFile(), config.getKeyPrefix());
        return new FDBEngine(database, new Subspace(Tuple.from(config.getKeyPrefix())), true);
    }
}

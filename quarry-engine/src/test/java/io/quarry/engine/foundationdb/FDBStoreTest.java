/*
 * FDBStoreTest.java
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
import io.quarry.engine.EngineConfig;
import io.quarry.engine.StorageEngine;
import io.quarry.engine.StoreContractTest;
import io.quarry.test.Tags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;

import javax.annotation.Nonnull;
import java.util.UUID;

/**
 * Runs the store contract against a live FoundationDB cluster, each test in its own subspace.
 */
@Tag(Tags.RequiresFDB)
public class FDBStoreTest extends StoreContractTest {
    private Database database;
    private Subspace root;

    @Nonnull
    @Override
    protected StorageEngine createEngine() {
        FDB fdb = FDB.isAPIVersionSelected() ? FDB.instance() : FDB.selectAPIVersion(EngineConfig.DEFAULT_API_VERSION);
        database = fdb.open();
        root = new Subspace(Tuple.from("quarry-test", UUID.randomUUID().toString()));
        return new FDBEngine(database, root, false);
    }

    @AfterEach
    public void clearSubspace() {
        if (database != null) {
            database.run(tr -> {
                tr.clear(root.range());
                return null;
            });
            database.close();
        }
    }
}

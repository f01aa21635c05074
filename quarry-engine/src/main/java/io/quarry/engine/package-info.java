/*
 * package-info.java
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

/**
 * The transactional ordered key-value storage contract.
 *
 * <p>
 * A {@link io.quarry.engine.StorageEngine} begins {@link io.quarry.engine.EngineTransaction}s, which hand out
 * named {@link io.quarry.engine.Store}s. Stores are iterated with {@link io.quarry.engine.StoreIterator}s in either
 * direction. Every operation observes the transaction's {@link io.quarry.engine.CancellationToken}. Engines are
 * looked up by name through {@link io.quarry.engine.StorageEngineRegistry}.
 * </p>
 */
package io.quarry.engine;

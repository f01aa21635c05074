/*
 * StorageEngineFactory.java
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

import javax.annotation.Nonnull;

/**
 * Creates {@link StorageEngine}s of one kind. Implementations are discovered with
 * {@link io.quarry.util.ServiceLoaderProvider} and selected by {@link #getName()} matching
 * {@link EngineConfig#getEngineName()}.
 */
@API(API.Status.UNSTABLE)
public interface StorageEngineFactory {
    @Nonnull
    String getName();

    @Nonnull
    StorageEngine open(@Nonnull EngineConfig config);
}

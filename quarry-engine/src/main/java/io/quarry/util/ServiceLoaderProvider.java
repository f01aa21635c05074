/*
 * ServiceLoaderProvider.java
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

package io.quarry.util;

import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import java.util.ServiceLoader;
import java.util.function.Function;

/**
 * Indirection over {@link ServiceLoader} so that an embedding application can supply service implementations
 * some other way, such as from a dependency injection container.
 */
@API(API.Status.INTERNAL)
public final class ServiceLoaderProvider {
    @Nonnull
    public static final Function<Class<?>, Iterable<?>> DEFAULT_LOADER = ServiceLoader::load;
    @Nonnull
    private static Function<Class<?>, Iterable<?>> pending = DEFAULT_LOADER;

    private static final class Holder {
        static final Function<Class<?>, Iterable<?>> loader = ServiceLoaderProvider.pending;
    }

    private ServiceLoaderProvider() {
        // utility class
    }

    /**
     * Replace the loader. Must happen before the first {@link #load(Class)}.
     * @param loader the replacement loader
     * @throws IllegalStateException if services were already loaded through a different loader
     */
    public static void initialize(@Nonnull Function<Class<?>, Iterable<?>> loader) {
        pending = loader;
        if (!Holder.loader.equals(loader)) {
            throw new IllegalStateException("ServiceLoaderProvider already initialized");
        }
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <T> Iterable<T> load(@Nonnull Class<T> clazz) {
        return (Iterable<T>) Holder.loader.apply(clazz);
    }
}

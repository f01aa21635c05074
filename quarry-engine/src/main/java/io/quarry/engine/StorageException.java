/*
 * StorageException.java
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
import io.quarry.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of every error raised through the storage contract.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class StorageException extends LoggableException {
    public StorageException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public StorageException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}

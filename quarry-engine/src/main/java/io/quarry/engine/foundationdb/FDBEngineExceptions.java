/*
 * FDBEngineExceptions.java
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

import com.apple.foundationdb.FDBException;
import io.quarry.annotation.API;
import io.quarry.engine.StorageException;
import io.quarry.util.LoggableException;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Translation of FoundationDB client failures into {@link StorageException}s.
 */
@API(API.Status.INTERNAL)
public final class FDBEngineExceptions {
    private FDBEngineExceptions() {
    }

    /**
     * Exceptions reported by the FoundationDB client.
     */
    @SuppressWarnings("serial")
    public static class FDBStoreException extends StorageException {
        public FDBStoreException(@Nonnull FDBException cause) {
            super(cause.getMessage(), cause);
            addLogInfo("fdb_error_code", cause.getCode());
            addLogInfo("retryable", cause.isRetryable());
        }
    }

    @Nonnull
    public static RuntimeException wrapException(@Nonnull Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof LoggableException) {
            return (LoggableException) cause;
        }
        if (cause instanceof FDBException) {
            return new FDBStoreException((FDBException) cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new StorageException(cause.getMessage() == null ? "storage failure" : cause.getMessage(), cause);
    }

    /**
     * Wait for a future, translating any failure.
     * @param future the future to wait on
     * @param <T> the result type
     * @return the result of the future
     */
    public static <T> T join(@Nonnull CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException | FDBException e) {
            throw wrapException(e);
        }
    }
}

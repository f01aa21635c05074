/*
 * CloseableUtils.java
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

import javax.annotation.Nullable;

/**
 * Helpers for closing several {@link AutoCloseable} resources on one exit path.
 */
@API(API.Status.INTERNAL)
public final class CloseableUtils {
    /**
     * Close every resource in order, even when an earlier one fails. {@code null} entries are skipped.
     * @param closeables the resources to close
     * @throws CloseException wrapping the first failure, with any later failures suppressed
     */
    @SuppressWarnings("PMD.CloseResource")
    public static void closeAll(@Nullable AutoCloseable... closeables) throws CloseException {
        if (closeables == null) {
            return;
        }
        CloseException accumulated = null;
        for (AutoCloseable closeable : closeables) {
            if (closeable == null) {
                continue;
            }
            try {
                closeable.close();
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                if (accumulated == null) {
                    accumulated = new CloseException(e);
                } else {
                    accumulated.addSuppressed(e);
                }
            }
        }
        if (accumulated != null) {
            throw accumulated;
        }
    }

    private CloseableUtils() {
        // utility class
    }
}

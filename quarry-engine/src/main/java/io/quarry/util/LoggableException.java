/*
 * LoggableException.java
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
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception that carries key/value pairs describing the failure. Log statements and callers can read
 * them back through {@link #getLogInfo()} instead of parsing the message, which keeps the message itself a
 * static, searchable title.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a static message and a flattened list of key/value pairs.
     * @param msg the static message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nullable Throwable cause) {
        super(cause);
    }

    /**
     * Get the key/value pairs attached to this exception, in insertion order.
     * @return an unmodifiable view of the log info
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Attach a single key/value pair.
     * @param key the key, usually a {@code LogMessageKeys} constant
     * @param value the value
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object key, @Nullable Object value) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(key.toString(), value);
        return this;
    }

    /**
     * Attach alternating keys and values, for example {@code addLogInfo("store", name, "key", key)}.
     * @param keyValues alternating keys and values
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            addLogInfo(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log info into alternating keys and values, the shape accepted by SLF4J-style key/value loggers
     * and by {@link #addLogInfo(Object...)}.
     * @return alternating keys and values
     */
    @Nonnull
    public Object[] exportLogInfo() {
        Map<String, Object> info = getLogInfo();
        Object[] flattened = new Object[info.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }
}

/*
 * LogMessageKeys.java
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

package io.quarry.db.logging;

import io.quarry.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys and exception log info keys.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE,
    ENGINE,
    TABLE_NAME,
    INDEX_NAME,
    FIELD_NAME,
    FIELD_PATH,
    PRIMARY_KEY,
    KEY,
    VALUE,
    EXPECTED_TYPE,
    ACTUAL_TYPE,
    PLAN,
    WHERE,
    ORDER_BY,
    LIMIT,
    OFFSET,
    PARAMETER,
    STATEMENT,
    ROWS_AFFECTED,
    UNIQUE,
    ;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}

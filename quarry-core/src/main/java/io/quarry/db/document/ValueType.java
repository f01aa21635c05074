/*
 * ValueType.java
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

package io.quarry.db.document;

import io.quarry.annotation.API;

import javax.annotation.Nonnull;

/**
 * The type of a {@link Value}.
 */
@API(API.Status.STABLE)
public enum ValueType {
    NULL(0x00, "null"),
    BOOL(0x10, "bool"),
    INT8(0x20, "int8"),
    INT16(0x21, "int16"),
    INT32(0x22, "int32"),
    INT64(0x23, "int64"),
    FLOAT64(0x30, "float64"),
    TEXT(0x40, "text"),
    BLOB(0x50, "blob"),
    ARRAY(0x60, "array"),
    DOCUMENT(0x70, "document");

    private final int code;
    @Nonnull
    private final String typeName;

    ValueType(int code, @Nonnull String typeName) {
        this.code = code;
        this.typeName = typeName;
    }

    /**
     * Get the code used for this type in encoded documents. Codes are stable across releases.
     * @return the type code
     */
    public int getCode() {
        return code;
    }

    public boolean isNumber() {
        return isInteger() || this == FLOAT64;
    }

    public boolean isInteger() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }

    @Nonnull
    public static ValueType fromCode(int code) {
        for (ValueType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown value type code " + code);
    }

    @Override
    public String toString() {
        return typeName;
    }
}

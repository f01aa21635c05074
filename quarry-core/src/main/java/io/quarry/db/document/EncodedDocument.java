/*
 * EncodedDocument.java
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
import javax.annotation.Nullable;

/**
 * A document read from storage, bound to its storage key. The value bytes are decoded on first access.
 */
@API(API.Status.STABLE)
public class EncodedDocument implements Document, Keyer {
    @Nonnull
    private final byte[] key;
    @Nonnull
    private final byte[] encoded;
    @Nullable
    private Document decoded;

    public EncodedDocument(@Nonnull byte[] key, @Nonnull byte[] encoded) {
        this.key = key;
        this.encoded = encoded;
    }

    @Nonnull
    @Override
    public byte[] getKey() {
        return key.clone();
    }

    @Nonnull
    private Document decoded() {
        if (decoded == null) {
            decoded = DocumentCodec.decode(encoded);
        }
        return decoded;
    }

    @Nonnull
    @Override
    public Value getByField(@Nonnull String field) {
        return decoded().getByField(field);
    }

    @Override
    public void iterate(@Nonnull FieldVisitor visitor) {
        decoded().iterate(visitor);
    }

    @Override
    public String toString() {
        return Documents.toString(this);
    }
}

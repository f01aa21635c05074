/*
 * ScanRange.java
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

package io.quarry.db.store;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import io.quarry.annotation.API;
import io.quarry.db.document.DocumentCodec;
import io.quarry.db.document.Value;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An inclusive range of values to scan in a primary key or a secondary index.
 *
 * <p>
 * A range with only one bound stays within the type family of that bound: {@code atLeast(5)} covers every
 * number from 5 upwards but no text. Bounds are inclusive because the filter applied after the scan decides
 * strict comparisons.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class ScanRange {
    @Nonnull
    public static final ScanRange ALL = new ScanRange(null, null);

    @Nullable
    private final Value low;
    @Nullable
    private final Value high;

    private ScanRange(@Nullable Value low, @Nullable Value high) {
        this.low = low;
        this.high = high;
    }

    @Nonnull
    public static ScanRange between(@Nullable Value low, @Nullable Value high) {
        if (low == null && high == null) {
            return ALL;
        }
        return new ScanRange(low, high);
    }

    @Nonnull
    public static ScanRange exactly(@Nonnull Value value) {
        return new ScanRange(value, value);
    }

    @Nonnull
    public static ScanRange atLeast(@Nonnull Value value) {
        return new ScanRange(value, null);
    }

    @Nonnull
    public static ScanRange atMost(@Nonnull Value value) {
        return new ScanRange(null, value);
    }

    @Nullable
    public Value getLow() {
        return low;
    }

    @Nullable
    public Value getHigh() {
        return high;
    }

    public boolean isAll() {
        return low == null && high == null;
    }

    /**
     * Get the first key of the range in sort key encoding.
     * @return the inclusive low key, or {@code null} for the start of the keyspace
     */
    @Nullable
    public byte[] getLowKey() {
        if (low != null) {
            return DocumentCodec.encodeSortKey(low).pack();
        }
        if (high != null) {
            return DocumentCodec.sortRankPrefix(high).pack();
        }
        return null;
    }

    /**
     * Get the first key after the range in sort key encoding. Every key that starts with the encoding of the
     * high bound is inside the range, so entries that append a primary key to the value are covered.
     * @return the exclusive high key, or {@code null} for the end of the keyspace
     */
    @Nullable
    public byte[] getHighKeyExclusive() {
        if (high != null) {
            return ByteArrayUtil.strinc(DocumentCodec.encodeSortKey(high).pack());
        }
        if (low != null) {
            return ByteArrayUtil.strinc(DocumentCodec.sortRankPrefix(low).pack());
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ScanRange that = (ScanRange) o;
        return Objects.equals(low, that.low) && Objects.equals(high, that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        if (isAll()) {
            return "[*]";
        }
        return "[" + (low == null ? "" : low) + ", " + (high == null ? "" : high) + "]";
    }
}

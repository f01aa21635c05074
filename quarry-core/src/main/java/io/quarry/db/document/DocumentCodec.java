/*
 * DocumentCodec.java
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

import com.apple.foundationdb.tuple.Tuple;
import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.QuarryCoreException;
import io.quarry.db.logging.LogMessageKeys;

import javax.annotation.Nonnull;
/**
 * Encodes documents and values with the FoundationDB tuple layer.
 *
 * <p>
 * A document is packed as a flat tuple of alternating field names and encoded values. Each value is a nested
 * tuple whose first element is the {@linkplain ValueType#getCode() type code}, followed by the payload: nothing
 * for {@code NULL}, a boolean, a long for every integer width, a double, a string, a byte string, a nested tuple
 * of encoded elements for arrays, or a nested document tuple for documents.
 * </p>
 *
 * <p>
 * This encoding round-trips exactly, including the integer width, but it is not order-preserving across types.
 * Keys that must sort by value use {@link #encodeSortKey(Value)} instead.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class DocumentCodec {
    private DocumentCodec() {
    }

    @Nonnull
    public static byte[] encode(@Nonnull Document document) {
        return toTuple(document).pack();
    }

    @Nonnull
    public static Document decode(@Nonnull byte[] bytes) {
        try {
            return fromTuple(Tuple.fromBytes(bytes));
        } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
            throw new QuarryCoreException("corrupt document encoding", e);
        }
    }

    @Nonnull
    public static byte[] encodeValue(@Nonnull Value value) {
        return valueToTuple(value).pack();
    }

    @Nonnull
    public static Value decodeValue(@Nonnull byte[] bytes) {
        try {
            return valueFromTuple(Tuple.fromBytes(bytes));
        } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
            throw new QuarryCoreException("corrupt value encoding", e);
        }
    }

    @Nonnull
    private static Tuple toTuple(@Nonnull Document document) {
        final Tuple[] tuple = {new Tuple()};
        document.iterate((field, value) -> tuple[0] = tuple[0].add(field).add(valueToTuple(value)));
        return tuple[0];
    }

    @Nonnull
    private static FieldBuffer fromTuple(@Nonnull Tuple tuple) {
        final FieldBuffer buffer = new FieldBuffer();
        for (int i = 0; i + 1 < tuple.size(); i += 2) {
            buffer.add(tuple.getString(i), valueFromTuple(tuple.getNestedTuple(i + 1)));
        }
        return buffer;
    }

    @Nonnull
    private static Tuple valueToTuple(@Nonnull Value value) {
        final Tuple head = Tuple.from((long) value.getType().getCode());
        switch (value.getType()) {
            case NULL:
                return head;
            case BOOL:
                return head.add(value.asBool());
            case INT8:
            case INT16:
            case INT32:
            case INT64:
                return head.add(value.asLong());
            case FLOAT64:
                return head.add(value.asDouble());
            case TEXT:
                return head.add(value.asText());
            case BLOB:
                return head.add(value.asBlob());
            case ARRAY:
                Tuple elements = new Tuple();
                for (Value element : value.asArray()) {
                    elements = elements.add(valueToTuple(element));
                }
                return head.add(elements);
            case DOCUMENT:
                return head.add(toTuple(value.asDocument()));
            default:
                throw new QuarryCoreException("unknown value type", LogMessageKeys.ACTUAL_TYPE, value.getType());
        }
    }

    @Nonnull
    private static Value valueFromTuple(@Nonnull Tuple tuple) {
        final ValueType type = ValueType.fromCode((int) tuple.getLong(0));
        switch (type) {
            case NULL:
                return Value.NULL;
            case BOOL:
                return Value.ofBool(tuple.getBoolean(1));
            case INT8:
            case INT16:
            case INT32:
            case INT64:
                return Value.ofInteger(type, tuple.getLong(1));
            case FLOAT64:
                return Value.ofDouble(tuple.getDouble(1));
            case TEXT:
                return Value.ofText(tuple.getString(1));
            case BLOB:
                return Value.ofBlob(tuple.getBytes(1));
            case ARRAY:
                final Tuple elements = tuple.getNestedTuple(1);
                final ImmutableList.Builder<Value> values = ImmutableList.builder();
                for (int i = 0; i < elements.size(); i++) {
                    values.add(valueFromTuple(elements.getNestedTuple(i)));
                }
                return Value.ofArray(values.build());
            case DOCUMENT:
                return Value.ofDocument(fromTuple(tuple.getNestedTuple(1)));
            default:
                throw new QuarryCoreException("unknown value type", LogMessageKeys.ACTUAL_TYPE, type);
        }
    }

    /**
     * Encode a value as an order-preserving tuple element list: the {@linkplain Value#getSortRank() sort rank}
     * followed by a normalized payload. All numbers are normalized to doubles so that integers and floats that
     * compare equal also encode equally. The packed bytes of this tuple sort the same way as
     * {@link Value#SORT_ORDER} for scalars.
     * @param value the value to encode
     * @return the sort key tuple
     */
    @Nonnull
    public static Tuple encodeSortKey(@Nonnull Value value) {
        final Tuple rank = Tuple.from((long) value.getSortRank());
        switch (value.getType()) {
            case NULL:
                return rank;
            case BOOL:
                return rank.add(value.asBool());
            case INT8:
            case INT16:
            case INT32:
            case INT64:
            case FLOAT64:
                // adding 0.0 folds -0.0 into 0.0, which compare equal
                return rank.add(value.asDouble() + 0.0);
            case TEXT:
                return rank.add(value.asText());
            case BLOB:
                return rank.add(value.asBlob());
            case ARRAY:
                Tuple elements = new Tuple();
                for (Value element : value.asArray()) {
                    elements = elements.add(encodeSortKey(element));
                }
                return rank.add(elements);
            case DOCUMENT:
                return rank.add(toTuple(value.asDocument()));
            default:
                throw new QuarryCoreException("unknown value type", LogMessageKeys.ACTUAL_TYPE, value.getType());
        }
    }

    /**
     * Get the rank-only prefix shared by every sort key of values in the same type family as {@code value}.
     * @param value a value of the family
     * @return the rank prefix
     */
    @Nonnull
    public static Tuple sortRankPrefix(@Nonnull Value value) {
        return Tuple.from((long) value.getSortRank());
    }
}

/*
 * DocumentStream.java
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

package io.quarry.db.cursors;

import io.quarry.annotation.API;
import io.quarry.db.StreamConsumedException;
import io.quarry.db.document.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A lazy, single-use sequence of documents.
 *
 * <p>
 * A stream owns the {@link Cursor} it reads from. Each combinator ({@link #filter}, {@link #map},
 * {@link #offset}, {@link #limit}, {@link #sort}) hands that cursor to the stream it returns, and each terminal
 * operation ({@link #count}, {@link #iterate}, {@link #first}, {@link #toList}) consumes it and closes it on every
 * exit path. After either, this stream is spent and any further use throws {@link StreamConsumedException}.
 * </p>
 *
 * <p>
 * Exceptions thrown by a predicate, a mapping function or the consumer given to {@link #iterate} abort the
 * stream: they propagate to the caller after the cursor is closed.
 * </p>
 */
@API(API.Status.STABLE)
public class DocumentStream implements AutoCloseable {
    @Nullable
    private Cursor<Document> cursor;

    protected DocumentStream(@Nonnull Cursor<Document> cursor) {
        this.cursor = cursor;
    }

    @Nonnull
    public static DocumentStream of(@Nonnull Cursor<? extends Document> cursor) {
        return new DocumentStream(cursor.map(Function.<Document>identity()));
    }

    @Nonnull
    public static DocumentStream of(@Nonnull List<? extends Document> documents) {
        return new DocumentStream(Cursor.fromList(documents));
    }

    @Nonnull
    public static DocumentStream empty() {
        return new DocumentStream(Cursor.empty());
    }

    @Nonnull
    private Cursor<Document> take() {
        if (cursor == null) {
            throw new StreamConsumedException("stream already consumed");
        }
        final Cursor<Document> taken = cursor;
        cursor = null;
        return taken;
    }

    public boolean isConsumed() {
        return cursor == null;
    }

    @Nonnull
    public DocumentStream filter(@Nonnull Predicate<? super Document> predicate) {
        return new DocumentStream(take().filter(predicate));
    }

    @Nonnull
    public DocumentStream map(@Nonnull Function<? super Document, ? extends Document> function) {
        return new DocumentStream(take().map(function));
    }

    /**
     * Skip the first {@code n} documents.
     * @param n the number of documents to skip; zero or less skips nothing
     * @return a stream of the remaining documents
     */
    @Nonnull
    public DocumentStream offset(int n) {
        return new DocumentStream(take().skip(n));
    }

    /**
     * Stop after {@code n} documents. The underlying cursor is closed as soon as the {@code n}th document has been
     * read from it.
     * @param n the maximum number of documents
     * @return a stream of at most {@code n} documents
     */
    @Nonnull
    public DocumentStream limit(int n) {
        return new DocumentStream(take().limitRowsTo(n));
    }

    @Nonnull
    public DocumentStream sort(@Nonnull Comparator<? super Document> comparator) {
        return new DocumentStream(take().sort(comparator));
    }

    /**
     * Consume the stream, counting the documents without keeping them.
     * @return the number of documents
     */
    public long count() {
        try (Cursor<Document> c = take()) {
            long count = 0;
            while (c.getNext().hasNext()) {
                count++;
            }
            return count;
        }
    }

    /**
     * Consume the stream, passing each document to {@code consumer}. The first exception stops the iteration.
     * @param consumer the consumer
     */
    public void iterate(@Nonnull Consumer<? super Document> consumer) {
        try (Cursor<Document> c = take()) {
            c.forEach(consumer);
        }
    }

    /**
     * Consume the stream, returning its first document and closing the rest.
     * @return the first document, or {@code null} if the stream is empty
     */
    @Nullable
    public Document first() {
        try (Cursor<Document> c = take()) {
            final CursorResult<Document> result = c.getNext();
            return result.hasNext() ? result.get() : null;
        }
    }

    @Nonnull
    public List<Document> toList() {
        try (Cursor<Document> c = take()) {
            return c.asList();
        }
    }

    /**
     * Release the cursor of a stream that will not be consumed. Does nothing if the stream was already consumed
     * or handed on.
     */
    @Override
    public void close() {
        if (cursor != null) {
            take().close();
        }
    }
}

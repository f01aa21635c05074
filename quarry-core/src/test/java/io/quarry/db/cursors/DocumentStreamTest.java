/*
 * DocumentStreamTest.java
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

import io.quarry.db.StreamConsumedException;
import io.quarry.db.document.Document;
import io.quarry.db.document.FieldBuffer;
import io.quarry.db.document.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentStream}.
 */
public class DocumentStreamTest {

    @Test
    public void limitStopsWithoutOverReading() {
        TrackingCursor source = new TrackingCursor(10);
        List<Document> documents = DocumentStream.of(source).limit(3).toList();
        assertEquals(3, documents.size());
        assertEquals(3, source.getPulled());
        assertTrue(source.isClosed());
    }

    @Test
    public void limitClosesBeforeTheConsumerAsksAgain() {
        TrackingCursor source = new TrackingCursor(10);
        List<Boolean> closedWhenSeen = new ArrayList<>();
        DocumentStream.of(source).limit(2).iterate(document -> closedWhenSeen.add(source.isClosed()));
        assertThat(closedWhenSeen, contains(false, true));
    }

    @Test
    public void limitZero() {
        TrackingCursor source = new TrackingCursor(10);
        assertEquals(0, DocumentStream.of(source).limit(0).count());
        assertEquals(0, source.getPulled());
        assertTrue(source.isClosed());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 3, 0, 3",
            "2, 3, 2, 5",
            "8, 5, 8, 10",
            "10, 3, 0, 0",
            "15, 1, 0, 0"
    })
    public void offsetThenLimit(int offset, int limit, int from, int to) {
        List<Integer> expected = new ArrayList<>();
        for (int i = from; i < to; i++) {
            expected.add(i);
        }
        TrackingCursor source = new TrackingCursor(10);
        List<Document> documents = DocumentStream.of(source).offset(offset).limit(limit).toList();
        assertEquals(expected, TrackingCursor.numbers(documents));
        assertTrue(source.isClosed());
    }

    @Test
    public void filterAndMap() {
        List<Document> documents = DocumentStream.of(new TrackingCursor(10))
                .filter(document -> document.getByField("n").convertToInt() % 2 == 0)
                .map(document -> FieldBuffer.of("n", document.getByField("n").convertToInt() * 10))
                .toList();
        assertThat(TrackingCursor.numbers(documents), contains(0, 20, 40, 60, 80));
    }

    @Test
    public void countDoesNotKeepDocuments() {
        TrackingCursor source = new TrackingCursor(1000);
        assertEquals(1000, DocumentStream.of(source).count());
        assertTrue(source.isClosed());
    }

    @Test
    public void sortIsStable() {
        List<Document> input = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            input.add(FieldBuffer.of("group", i % 2, "n", i));
        }
        List<Document> sorted = DocumentStream.of(input)
                .sort(Comparator.comparing((Document document) -> document.getByField("group"), Value.SORT_ORDER))
                .toList();
        assertThat(TrackingCursor.numbers(sorted), contains(0, 2, 4, 1, 3, 5));
    }

    @Test
    public void consumedOnlyOnce() {
        DocumentStream stream = DocumentStream.of(new TrackingCursor(3));
        assertEquals(3, stream.count());
        assertTrue(stream.isConsumed());
        assertThrows(StreamConsumedException.class, stream::count);
        assertThrows(StreamConsumedException.class, stream::toList);
        assertThrows(StreamConsumedException.class, () -> stream.limit(1));
    }

    @Test
    public void combinatorsHandOverTheCursor() {
        DocumentStream stream = DocumentStream.of(new TrackingCursor(3));
        DocumentStream limited = stream.limit(2);
        assertThrows(StreamConsumedException.class, stream::count);
        assertEquals(2, limited.count());
    }

    @Test
    public void errorsCloseTheCursor() {
        TrackingCursor source = new TrackingCursor(10);
        IllegalStateException boom = new IllegalStateException("boom");
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> DocumentStream.of(source).iterate(document -> {
                    if (document.getByField("n").convertToInt() == 4) {
                        throw boom;
                    }
                }));
        assertSame(boom, thrown);
        assertEquals(5, source.getPulled());
        assertTrue(source.isClosed());
    }

    @Test
    public void predicateErrorsAbort() {
        TrackingCursor source = new TrackingCursor(10);
        assertThrows(ArithmeticException.class, () -> DocumentStream.of(source)
                .filter(document -> 1 / (3 - document.getByField("n").convertToInt()) > 0)
                .count());
        assertTrue(source.isClosed());
    }

    @Test
    public void firstClosesTheRest() {
        TrackingCursor source = new TrackingCursor(10);
        Document first = DocumentStream.of(source).first();
        assertEquals(0, first.getByField("n").convertToInt());
        assertEquals(1, source.getPulled());
        assertTrue(source.isClosed());
        assertNull(DocumentStream.empty().first());
    }

    @Test
    public void closeReleasesAnUnconsumedStream() {
        TrackingCursor source = new TrackingCursor(10);
        try (DocumentStream stream = DocumentStream.of(source).offset(2)) {
            assertFalse(stream.isConsumed());
        }
        assertTrue(source.isClosed());
        assertThat(DocumentStream.empty().toList(), empty());
    }
}

/*
 * CloseableUtilsTest.java
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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayWithSize;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link CloseableUtils} and {@link LoggableException}.
 */
public class CloseableUtilsTest {
    @Test
    public void closesEverythingDespiteFailures() {
        List<String> closed = new ArrayList<>();
        AutoCloseable first = () -> {
            closed.add("first");
            throw new IllegalStateException("first failed");
        };
        AutoCloseable second = () -> closed.add("second");
        AutoCloseable third = () -> {
            closed.add("third");
            throw new IllegalStateException("third failed");
        };
        CloseException e = assertThrows(CloseException.class, () -> CloseableUtils.closeAll(first, null, second, third));
        assertThat(closed, contains("first", "second", "third"));
        assertEquals("first failed", e.getCause().getMessage());
        assertThat(e.getSuppressed(), arrayWithSize(1));
    }

    @Test
    public void logInfo() {
        LoggableException e = new LoggableException("failed", LogMessageKeys.STORE_NAME, "docs");
        e.addLogInfo(LogMessageKeys.KEY, 3);
        assertEquals("docs", e.getLogInfo().get("store_name"));
        assertEquals(3, e.getLogInfo().get("key"));
        assertThat(e.exportLogInfo(), arrayWithSize(4));
        assertThrows(IllegalArgumentException.class, () -> e.addLogInfo("a", 1, "b"));
    }
}

/*
 * CancellationTokenTest.java
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

package io.quarry.engine;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CancellationToken}.
 */
public class CancellationTokenTest {
    private static class ManualTicker extends Ticker {
        private long nanos = 1000L;

        @Override
        public long read() {
            return nanos;
        }

        void advance(Duration duration) {
            nanos += duration.toNanos();
        }
    }

    @Test
    public void cancelFires() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancelled);
        token.cancel();
        assertTrue(token.isCancelled());
        assertThrows(OperationCancelledException.class, token::throwIfCancelled);
    }

    @Test
    public void deadlineFires() {
        ManualTicker ticker = new ManualTicker();
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(5), ticker);
        assertTrue(token.hasDeadline());
        ticker.advance(Duration.ofSeconds(4));
        assertFalse(token.isCancelled());
        ticker.advance(Duration.ofSeconds(1));
        assertTrue(token.isCancelled());
        OperationCancelledException e = assertThrows(OperationCancelledException.class, token::throwIfCancelled);
        assertTrue((Boolean) e.getLogInfo().get("deadline"));
    }

    @Test
    public void hugeTimeoutDoesNotOverflow() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(Long.MAX_VALUE));
        assertFalse(token.isCancelled());
    }

    @Test
    public void noneNeverFires() {
        assertFalse(CancellationToken.NONE.isCancelled());
        assertFalse(CancellationToken.NONE.hasDeadline());
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
    }

    @Test
    public void engineRefusesCancelledBegin() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        try (StorageEngine engine = new io.quarry.engine.memory.MemoryEngine()) {
            assertThrows(OperationCancelledException.class, () -> engine.begin(true, token));
            // the writer permit must not leak
            engine.begin(true).close();
        }
    }
}

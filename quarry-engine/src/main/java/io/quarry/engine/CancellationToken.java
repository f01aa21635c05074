/*
 * CancellationToken.java
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

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import io.quarry.annotation.API;
import io.quarry.util.LogMessageKeys;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Cooperative cancellation signal bound to an engine transaction.
 *
 * <p>
 * Every {@link Store} operation, and every {@link StoreIterator#seek} and {@link StoreIterator#next}, calls
 * {@link #throwIfCancelled()} before doing any work. A token fires either because {@link #cancel()} was called
 * or because its deadline passed. Work that is already running is never interrupted; the next operation fails
 * with {@link OperationCancelledException} instead.
 * </p>
 *
 * <p>
 * To put a deadline on a query, create the token with {@link #withTimeout(Duration)} and pass it when the
 * transaction is begun. There is no separate per-query timeout.
 * </p>
 */
@API(API.Status.STABLE)
public class CancellationToken {
    /**
     * A token that never fires. {@link #cancel()} is not supported on it.
     */
    @Nonnull
    public static final CancellationToken NONE = new CancellationToken(Ticker.systemTicker(), Long.MAX_VALUE) {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("the shared NONE token cannot be cancelled");
        }

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public String toString() {
            return "CancellationToken.NONE";
        }
    };

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    @Nonnull
    private final Ticker ticker;
    private final long deadlineNanos;
    private volatile boolean cancelled;

    protected CancellationToken(@Nonnull Ticker ticker, long deadlineNanos) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Create a token that only fires when {@link #cancel()} is called.
     * @return a new token
     */
    @Nonnull
    public static CancellationToken create() {
        return new CancellationToken(Ticker.systemTicker(), NO_DEADLINE);
    }

    /**
     * Create a token that fires once {@code timeout} has elapsed, or earlier if cancelled.
     * @param timeout how long until the token fires
     * @return a new token
     */
    @Nonnull
    public static CancellationToken withTimeout(@Nonnull Duration timeout) {
        return withTimeout(timeout, Ticker.systemTicker());
    }

    @Nonnull
    public static CancellationToken withTimeout(@Nonnull Duration timeout, @Nonnull Ticker ticker) {
        Preconditions.checkArgument(!timeout.isNegative(), "timeout must not be negative");
        long now = ticker.read();
        long nanos = timeout.toNanos();
        long deadline = nanos >= NO_DEADLINE - now ? NO_DEADLINE - 1 : now + nanos;
        return new CancellationToken(ticker, deadline);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && ticker.read() - deadlineNanos >= 0) {
            cancelled = true;
            return true;
        }
        return false;
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    /**
     * Fail if the token has fired.
     * @throws OperationCancelledException if cancelled or past the deadline
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("operation cancelled",
                    LogMessageKeys.DEADLINE, hasDeadline());
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled + ", deadline=" + hasDeadline() + "}";
    }
}

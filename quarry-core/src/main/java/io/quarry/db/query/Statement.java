/*
 * Statement.java
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

package io.quarry.db.query;

import io.quarry.annotation.API;
import io.quarry.db.Transaction;
import io.quarry.db.query.expressions.Params;

import javax.annotation.Nonnull;

/**
 * A parsed statement, ready to run in a transaction.
 */
@API(API.Status.STABLE)
public interface Statement {
    /**
     * Run the statement.
     * @param transaction the transaction to run in; must be writable unless {@link #isReadOnly()}
     * @param params the bound parameters
     * @return the result, which the caller must close
     */
    @Nonnull
    Result run(@Nonnull Transaction transaction, @Nonnull Params params);

    boolean isReadOnly();
}

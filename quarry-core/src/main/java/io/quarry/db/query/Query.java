/*
 * Query.java
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

import com.google.common.collect.ImmutableList;
import io.quarry.annotation.API;
import io.quarry.db.Database;
import io.quarry.db.Transaction;
import io.quarry.db.logging.KeyValueLogMessage;
import io.quarry.db.logging.LogMessageKeys;
import io.quarry.db.query.expressions.Params;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * An ordered list of statements.
 */
@API(API.Status.STABLE)
public class Query {
    private static final Logger LOGGER = LoggerFactory.getLogger(Query.class);

    @Nonnull
    private final List<Statement> statements;

    public Query(@Nonnull Statement... statements) {
        this(ImmutableList.copyOf(statements));
    }

    public Query(@Nonnull List<? extends Statement> statements) {
        this.statements = ImmutableList.copyOf(statements);
    }

    @Nonnull
    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * Run each statement in a transaction of its own, committing it before the next statement starts.
     * Read-only statements get a read-only transaction. If the last statement is read-only, its transaction stays
     * open inside the returned result until the result is closed.
     * @param database the database
     * @param params the bound parameters
     * @return the result of the last statement
     */
    @Nonnull
    public Result run(@Nonnull Database database, @Nonnull Params params) {
        Result result = Result.empty();
        for (int i = 0; i < statements.size(); i++) {
            final Statement statement = statements.get(i);
            final boolean last = i == statements.size() - 1;
            final Transaction transaction = database.begin(!statement.isReadOnly());
            boolean handedOff = false;
            try {
                result = run(statement, transaction, params);
                if (last && statement.isReadOnly()) {
                    handedOff = true;
                    return result.withTransaction(transaction);
                }
                if (!last) {
                    result.close();
                }
                if (transaction.isWritable()) {
                    transaction.commit();
                }
            } finally {
                if (!handedOff) {
                    transaction.close();
                }
            }
        }
        return result;
    }

    /**
     * Run every statement inside a caller-owned transaction. Nothing is committed.
     * @param transaction the transaction
     * @param params the bound parameters
     * @return the result of the last statement
     */
    @Nonnull
    public Result exec(@Nonnull Transaction transaction, @Nonnull Params params) {
        Result result = Result.empty();
        for (int i = 0; i < statements.size(); i++) {
            result = run(statements.get(i), transaction, params);
            if (i < statements.size() - 1) {
                result.close();
            }
        }
        return result;
    }

    @Nonnull
    private static Result run(@Nonnull Statement statement, @Nonnull Transaction transaction,
                              @Nonnull Params params) {
        final Result result = statement.run(transaction, params);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("ran statement",
                    LogMessageKeys.STATEMENT, statement,
                    LogMessageKeys.ROWS_AFFECTED, result.getRowsAffected()));
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (Statement statement : statements) {
            sb.append(statement).append(';');
        }
        return sb.toString();
    }
}

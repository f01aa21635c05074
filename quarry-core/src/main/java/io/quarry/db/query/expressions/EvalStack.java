/*
 * EvalStack.java
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

package io.quarry.db.query.expressions;

import io.quarry.annotation.API;
import io.quarry.db.FieldNotFoundException;
import io.quarry.db.Transaction;
import io.quarry.db.document.Document;
import io.quarry.db.store.TableConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The context an {@link Expr} is evaluated in: the current document, the transaction, the configuration of the
 * table being read and the bound parameters.
 *
 * <p>
 * An {@code EvalStack} only references these; it owns nothing and needs no cleanup. Statements build one per
 * execution and derive a new one for every document with {@link #withDocument(Document)}, so no evaluation ever
 * sees another document's state.
 * </p>
 */
@API(API.Status.STABLE)
public final class EvalStack {
    @Nonnull
    public static final EvalStack EMPTY = newBuilder().build();

    @Nullable
    private final Document document;
    @Nullable
    private final Transaction transaction;
    @Nullable
    private final TableConfig tableConfig;
    @Nonnull
    private final Params params;

    private EvalStack(@Nullable Document document, @Nullable Transaction transaction,
                      @Nullable TableConfig tableConfig, @Nonnull Params params) {
        this.document = document;
        this.transaction = transaction;
        this.tableConfig = tableConfig;
        this.params = params;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public static EvalStack ofParams(@Nonnull Params params) {
        return newBuilder().setParams(params).build();
    }

    @Nonnull
    public EvalStack withDocument(@Nullable Document newDocument) {
        return new EvalStack(newDocument, transaction, tableConfig, params);
    }

    @Nullable
    public Document getDocument() {
        return document;
    }

    /**
     * Get the current document.
     * @return the document
     * @throws FieldNotFoundException if there is no current document, so fields cannot be resolved
     */
    @Nonnull
    public Document requireDocument() {
        if (document == null) {
            throw new FieldNotFoundException("no document to evaluate fields against");
        }
        return document;
    }

    @Nullable
    public Transaction getTransaction() {
        return transaction;
    }

    @Nullable
    public TableConfig getTableConfig() {
        return tableConfig;
    }

    @Nonnull
    public Params getParams() {
        return params;
    }

    /**
     * Builder for {@link EvalStack}.
     */
    public static final class Builder {
        @Nullable
        private Document document;
        @Nullable
        private Transaction transaction;
        @Nullable
        private TableConfig tableConfig;
        @Nonnull
        private Params params = Params.EMPTY;

        private Builder() {
        }

        @Nonnull
        public Builder setDocument(@Nullable Document document) {
            this.document = document;
            return this;
        }

        @Nonnull
        public Builder setTransaction(@Nullable Transaction transaction) {
            this.transaction = transaction;
            return this;
        }

        @Nonnull
        public Builder setTableConfig(@Nullable TableConfig tableConfig) {
            this.tableConfig = tableConfig;
            return this;
        }

        @Nonnull
        public Builder setParams(@Nonnull Params params) {
            this.params = params;
            return this;
        }

        @Nonnull
        public EvalStack build() {
            return new EvalStack(document, transaction, tableConfig, params);
        }
    }
}

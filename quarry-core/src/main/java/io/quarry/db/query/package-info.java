/*
 * package-info.java
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

/**
 * Statements, their results and the projection of selected documents.
 *
 * <p>
 * A {@link io.quarry.db.query.Query} holds already parsed statements. Each statement checks its target table,
 * asks the {@link io.quarry.db.query.plan.QueryOptimizer} for a stream, and either hands the stream back
 * through {@link io.quarry.db.query.DocumentMask} projection or consumes it to mutate the table.
 * </p>
 */
package io.quarry.db.query;

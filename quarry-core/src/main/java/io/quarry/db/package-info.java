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
 * The document database: {@link io.quarry.db.Database}, {@link io.quarry.db.Transaction} and the exceptions
 * raised by the query layer.
 *
 * <p>
 * Every exception extends {@link io.quarry.db.QuarryCoreException} and carries structured log info. Storage
 * errors from the engine module propagate unchanged.
 * </p>
 */
package io.quarry.db;

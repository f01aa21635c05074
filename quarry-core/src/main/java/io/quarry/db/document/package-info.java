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
 * Documents and the values they hold.
 *
 * <p>
 * A {@link io.quarry.db.document.Document} is a read-only view of named {@link io.quarry.db.document.Value}s.
 * Documents read from a table are {@link io.quarry.db.document.EncodedDocument}s, which also implement
 * {@link io.quarry.db.document.Keyer}. New documents are built with {@link io.quarry.db.document.FieldBuffer}.
 * </p>
 */
package io.quarry.db.document;

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
 * Synchronous pull cursors and the {@link io.quarry.db.cursors.DocumentStream} built on them.
 *
 * <p>
 * Every cursor wraps at most one inner cursor and closes it when it is closed itself, so a pipeline is
 * released by closing its outermost cursor. {@link io.quarry.db.cursors.StoreCursor} is the leaf that reads a
 * key range of a store.
 * </p>
 */
package io.quarry.db.cursors;

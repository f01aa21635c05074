/*
 * API.java
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

package io.quarry.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method or field is for code built on top of Quarry.
 *
 * <p>
 * A member without its own annotation inherits the status of the enclosing type. A status may be raised at any
 * time; lowering it is only allowed in the releases named by the status itself.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Only public so that other Quarry packages can reach it. May change in any build.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. Callers should expect breaking changes without notice.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly in the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Kept backwards compatible until the next major release.
         */
        STABLE
    }
}

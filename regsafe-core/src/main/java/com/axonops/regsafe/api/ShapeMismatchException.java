/*
 * Copyright 2025 AxonOps
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

package com.axonops.regsafe.api;

/**
 * Thrown when the number of groups reported by the engine differs from the schema's slot count.
 *
 * @since 1.0.0
 */
public final class ShapeMismatchException extends SchemaViolationException {

    private final int expected;
    private final int actual;

    public ShapeMismatchException(String pattern, int expected, int actual) {
        super(pattern, "expected " + expected + " capturing groups but found " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

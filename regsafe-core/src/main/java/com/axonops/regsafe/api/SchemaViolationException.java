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
 * Thrown when a match disagrees with the schema derived for its pattern.
 *
 * <p>This is a defect, not an input error: a schema is derived once and is supposed to describe
 * every successful match of its pattern. Seeing one of these means the structure analyzer has a
 * gap or the pattern uses a construct outside the supported grammar. The library never catches
 * or retries these.
 *
 * @since 1.0.0
 */
public abstract class SchemaViolationException extends RegsafeException {

    private final String pattern;

    protected SchemaViolationException(String pattern, String message) {
        super("Regsafe: Schema violation: " + message + " (pattern: " + truncate(pattern) + ")");
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }

    private static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}

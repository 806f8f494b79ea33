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

import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a regex pattern fails to compile.
 *
 * <p>The message, description and index are taken verbatim from the
 * {@link PatternSyntaxException} raised by {@code java.util.regex}, so callers
 * see exactly the diagnostics the JDK engine produces. The original exception
 * is kept as the cause.
 *
 * @since 1.0.0
 */
public final class PatternCompilationException extends RegsafeException {

    private final String pattern;
    private final String description;
    private final int index;

    public PatternCompilationException(String pattern, PatternSyntaxException cause) {
        super(Objects.requireNonNull(cause, "cause cannot be null").getMessage(), cause);
        this.pattern = pattern;
        this.description = cause.getDescription();
        this.index = cause.getIndex();
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Engine description of the error, without the pattern echo and caret line.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Offset of the error in the pattern text, or -1 if the engine did not report one.
     */
    public int getIndex() {
        return index;
    }
}

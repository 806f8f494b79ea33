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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static convenience methods over {@link Regex}.
 *
 * <p>Every method registers its pattern through the global cache, so repeated calls with the same
 * pattern text compile once.
 *
 * <pre>{@code
 * Regsafe.extract("(\\d{4})-(\\d{2})-(\\d{2})", "2004-01-20")
 *     .map(m -> m.required(1));   // Optional[2004]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Regsafe {

    private Regsafe() {
        // Utility class
    }

    public static Regex compile(String regex, String... groupNames) {
        return Regex.compile(regex, groupNames);
    }

    /**
     * Tests whether the whole input matches.
     */
    public static boolean matches(String regex, CharSequence input) {
        return Regex.compile(regex).matches(input);
    }

    public static Optional<String> findFirstIn(String regex, CharSequence input) {
        return Regex.compile(regex).findFirstIn(input);
    }

    /**
     * Matches the whole input and returns its shape-checked groups.
     *
     * @see Regex#extract(CharSequence)
     */
    public static Optional<ShapedMatch> extract(String regex, CharSequence input) {
        return Regex.compile(regex).extract(input);
    }

    /**
     * Quotes text so that it matches literally when used as a pattern.
     */
    public static String quote(String text) {
        return Pattern.quote(text);
    }

    /**
     * Quotes text so that it is inserted literally when used as a replacement string.
     */
    public static String quoteReplacement(String text) {
        return Matcher.quoteReplacement(text);
    }
}

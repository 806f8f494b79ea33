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

package com.axonops.regsafe.schema;

/**
 * Classifies a parenthesized group from the characters around its delimiters.
 *
 * @since 1.0.0
 */
public final class GroupClassifier {

    private GroupClassifier() {
        // Utility class
    }

    /**
     * Decides whether the group opening just before {@code pos} captures.
     *
     * <ul>
     *   <li>{@code (x} - plain group, capturing
     *   <li>{@code (?<name>x} - named group, capturing
     *   <li>{@code (?<=x}, {@code (?<!x} - lookbehind, not capturing
     *   <li>{@code (?:x}, {@code (?=x}, {@code (?!x}, {@code (?>x}, {@code (?i)}, {@code (?i:x} - not capturing
     * </ul>
     *
     * @param pattern regex source
     * @param pos index just after the opening {@code (}
     * @return true if the engine assigns this group a number
     */
    public static boolean isCapturing(String pattern, int pos) {
        if (charAt(pattern, pos) != '?') {
            return true;
        }
        if (charAt(pattern, pos + 1) != '<') {
            return false;
        }
        char afterAngle = charAt(pattern, pos + 2);
        return afterAngle != '=' && afterAngle != '!';
    }

    /**
     * Returns the inline name of a {@code (?<name>...)} group.
     *
     * @param pattern regex source
     * @param pos index just after the opening {@code (}
     * @return the group name, or null if the group is not a named capturing group
     */
    public static String inlineName(String pattern, int pos) {
        if (charAt(pattern, pos) != '?' || charAt(pattern, pos + 1) != '<' || !isCapturing(pattern, pos)) {
            return null;
        }
        int close = pattern.indexOf('>', pos + 2);
        return close < 0 ? null : pattern.substring(pos + 2, close);
    }

    /**
     * Checks whether the group ending just before {@code pos} carries a quantifier that admits zero
     * occurrences.
     *
     * <p>{@code ?} and {@code *} (greedy, lazy or possessive) qualify. A braced bound qualifies when
     * its lower bound starts with {@code 0}, which covers {@code {0}}, {@code {0,}} and
     * {@code {0,n}}. Only the first digit is examined, so a malformed bound such as {@code {0,abc}}
     * also counts as zero-occurrence.
     *
     * @param pattern regex source
     * @param pos index just after the closing {@code )}
     * @param bound exclusive upper limit of the scan
     * @return true if the whole group may be skipped
     */
    public static boolean hasZeroOccurrenceQuantifier(String pattern, int pos, int bound) {
        if (pos >= bound) {
            return false;
        }
        switch (charAt(pattern, pos)) {
            case '?':
            case '*':
                return true;
            case '{':
                return charAt(pattern, pos + 1) == '0';
            default:
                return false;
        }
    }

    private static char charAt(String pattern, int pos) {
        return pos < pattern.length() ? pattern.charAt(pos) : '\0';
    }
}

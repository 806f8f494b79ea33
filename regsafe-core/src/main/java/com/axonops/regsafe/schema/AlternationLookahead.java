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
 * Detects alternation at the current nesting level of a pattern.
 *
 * @since 1.0.0
 */
public final class AlternationLookahead {

    private AlternationLookahead() {
        // Utility class
    }

    /**
     * Checks whether a {@code |} occurs between {@code from} and the end of the enclosing group.
     *
     * <p>Nested groups, character classes, escapes and quotations are stepped over whole, so only
     * an alternation operator that belongs to the scope being scanned counts. The scan stops with
     * {@code false} at the first unmatched {@code )} (the end of the enclosing group) or at
     * {@code bound}.
     *
     * <p>Examples, scanning from 0 over the whole text:
     * <pre>
     * a|b          true
     * (a|b)c       false   alternation is nested
     * [|]x         false   inside a character class
     * \Q|\E        false   inside a quotation
     * </pre>
     *
     * @param pattern regex source
     * @param from index to start scanning at
     * @param bound exclusive upper limit of the scan
     * @return true if the scope offers more than one alternative
     */
    public static boolean hasTopLevelAlternation(String pattern, int from, int bound) {
        int end = Math.min(bound, pattern.length());
        int pos = from;
        while (pos < end) {
            char c = pattern.charAt(pos);
            switch (c) {
                case '\\':
                    pos = PatternCursor.skipEscape(pattern, pos);
                    break;
                case '[':
                    pos = PatternCursor.skipBracketClass(pattern, pos + 1);
                    break;
                case '(':
                    pos = PatternCursor.matchingParenEnd(pattern, pos + 1);
                    break;
                case '|':
                    return true;
                case ')':
                    return false;
                default:
                    pos++;
            }
        }
        return false;
    }
}

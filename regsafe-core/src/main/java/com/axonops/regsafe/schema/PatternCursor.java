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
 * Position-advancing primitives over regex source text.
 *
 * <p>Each method takes the pattern and a position and returns the position just past the construct
 * that starts there. None of them validates the pattern: callers only scan text that
 * {@code java.util.regex} has already compiled, and every result is clamped to the pattern length so
 * that a construct left open at the end of the text simply ends the scan.
 *
 * @since 1.0.0
 */
public final class PatternCursor {

    private PatternCursor() {
        // Utility class
    }

    /**
     * Skips an escape sequence.
     *
     * @param pattern regex source
     * @param pos index of the backslash
     * @return index after the escaped character, or after the closing {@code \E} for {@code \Q}
     */
    public static int skipEscape(String pattern, int pos) {
        if (pos + 1 < pattern.length() && pattern.charAt(pos + 1) == 'Q') {
            return skipQuotedLiteral(pattern, pos + 2);
        }
        return Math.min(pos + 2, pattern.length());
    }

    /**
     * Skips the body of a {@code \Q...\E} quotation.
     *
     * <p>Inside a quotation every character is literal, so the region ends at the first {@code \E}
     * regardless of any backslashes before it. An unterminated quotation runs to the end of the
     * pattern, which is what the engine does too.
     *
     * @param pattern regex source
     * @param pos index just after {@code \Q}
     * @return index just after the next {@code \E}, or the pattern length
     */
    public static int skipQuotedLiteral(String pattern, int pos) {
        int close = pattern.indexOf("\\E", pos);
        return close < 0 ? pattern.length() : close + 2;
    }

    /**
     * Skips a bracketed character class, including nested classes such as {@code [a-z&&[^aeiou]]}.
     *
     * @param pattern regex source
     * @param pos index just after the opening {@code [}
     * @return index just after the matching {@code ]}, or the pattern length
     */
    public static int skipBracketClass(String pattern, int pos) {
        int length = pattern.length();
        int level = 0;
        while (pos < length) {
            char c = pattern.charAt(pos);
            if (c == '\\') {
                pos = skipEscape(pattern, pos);
            } else if (c == '[') {
                level++;
                pos++;
            } else if (c == ']') {
                if (level == 0) {
                    return pos + 1;
                }
                level--;
                pos++;
            } else {
                pos++;
            }
        }
        return length;
    }

    /**
     * Finds the end of a parenthesized group.
     *
     * <p>Escapes, quotations, character classes and nested groups are skipped as units, so a
     * {@code )} inside any of them does not close the group.
     *
     * @param pattern regex source
     * @param pos index just after the opening {@code (}
     * @return index just after the matching {@code )}, or the pattern length
     */
    public static int matchingParenEnd(String pattern, int pos) {
        int length = pattern.length();
        int level = 0;
        while (pos < length) {
            char c = pattern.charAt(pos);
            switch (c) {
                case '\\':
                    pos = skipEscape(pattern, pos);
                    break;
                case '[':
                    pos = skipBracketClass(pattern, pos + 1);
                    break;
                case '(':
                    level++;
                    pos++;
                    break;
                case ')':
                    if (level == 0) {
                        return pos + 1;
                    }
                    level--;
                    pos++;
                    break;
                default:
                    pos++;
            }
        }
        return length;
    }
}

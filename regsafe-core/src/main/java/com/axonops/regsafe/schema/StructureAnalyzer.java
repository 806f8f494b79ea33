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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives the {@link Schema} of a pattern from its source text.
 *
 * <p>The analyzer makes one left-to-right pass and keeps a single optionality counter instead of a
 * stack of scopes. While the counter is zero, a capturing group that opens is guaranteed to
 * participate in any successful match. The counter becomes positive when the scan enters a region
 * that may be skipped: a group quantified with {@code ?}, {@code *} or {@code {0...}}, or a scope
 * containing alternation. Every group opened inside such a region is optional.
 *
 * <p>The counter is decremented once per {@code )}, clamped at zero. Lookaround groups are scanned
 * like ordinary groups, so a capturing group inside a negative lookahead such as {@code (?!(a))b}
 * is reported required although it never participates. Extraction then fails with
 * {@link com.axonops.regsafe.api.RequiredGroupAbsentException} instead of returning a wrong shape.
 *
 * <p>The input must already be accepted by {@link java.util.regex.Pattern#compile(String)}. The
 * analyzer does not validate anything and never fails; all scans are bounded by the pattern
 * length so it terminates on any input.
 *
 * <p>Thread-safe: all methods are pure.
 *
 * @since 1.0.0
 */
public final class StructureAnalyzer {

    private StructureAnalyzer() {
        // Utility class
    }

    /**
     * Analyzes a compiled pattern.
     *
     * @param pattern regex source text that the engine has accepted
     * @return one slot per capturing group, in the order the groups open
     */
    public static Schema analyze(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        if (pattern.isEmpty()) {
            return Schema.EMPTY;
        }

        int length = pattern.length();
        List<Slot> slots = new ArrayList<>();
        int depth = AlternationLookahead.hasTopLevelAlternation(pattern, 0, length) ? 1 : 0;
        int pos = 0;

        while (pos < length) {
            char c = pattern.charAt(pos);
            switch (c) {
                case '\\':
                    pos = PatternCursor.skipEscape(pattern, pos);
                    break;
                case '[':
                    pos = PatternCursor.skipBracketClass(pattern, pos + 1);
                    break;
                case ')':
                    depth = Math.max(0, depth - 1);
                    pos++;
                    break;
                case '(':
                    depth = openGroup(pattern, pos, depth, slots);
                    pos++;
                    break;
                default:
                    pos++;
            }
        }
        return new Schema(slots);
    }

    /**
     * Classifies the group opening at {@code pos} and returns the new optionality depth.
     */
    private static int openGroup(String pattern, int pos, int depth, List<Slot> slots) {
        int length = pattern.length();
        int bodyStart = pos + 1;
        boolean capturing = GroupClassifier.isCapturing(pattern, bodyStart);
        Presence presence;
        int nextDepth;

        if (depth == 0) {
            int end = PatternCursor.matchingParenEnd(pattern, bodyStart);
            if (GroupClassifier.hasZeroOccurrenceQuantifier(pattern, end, length)) {
                presence = Presence.OPTIONAL;
                nextDepth = 1;
            } else {
                presence = Presence.REQUIRED;
                nextDepth = AlternationLookahead.hasTopLevelAlternation(pattern, bodyStart, length) ? 1 : 0;
            }
        } else {
            presence = Presence.OPTIONAL;
            nextDepth = depth + 1;
        }

        if (capturing) {
            slots.add(new Slot(slots.size() + 1, presence, GroupClassifier.inlineName(pattern, bodyStart)));
        }
        return nextDepth;
    }
}

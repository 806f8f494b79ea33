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

package com.axonops.regsafe.util;

import java.util.List;

/**
 * Utility for hashing pattern strings for logging purposes.
 *
 * <p>Pattern hashing provides privacy and readability in logs:
 * <ul>
 *   <li>Privacy: Don't log potentially sensitive regex patterns</li>
 *   <li>Readability: Logs aren't cluttered with long pattern strings</li>
 *   <li>Debuggability: Same pattern always gets same hash, easy to grep/trace</li>
 * </ul>
 *
 * <p>Example: Pattern ".*ERROR.*DATABASE.*" → hash "7a3f2b1c"
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern string for logging.
     *
     * <p>Uses {@link String#hashCode()} for consistency and simplicity.
     * The hash is deterministic - same pattern always produces same hash.
     *
     * @param pattern the regex pattern string
     * @return hex string of up to 8 characters (e.g., "7a3f2b1c")
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Creates a hash with the number of caller-declared group names appended.
     *
     * @param pattern the regex pattern string
     * @param groupNames names declared at registration
     * @return hash with a name-count suffix (e.g., "7a3f2b1c[N0]" or "7a3f2b1c[N3]")
     */
    public static String hashWithNames(String pattern, List<String> groupNames) {
        return hash(pattern) + "[N" + (groupNames == null ? 0 : groupNames.size()) + "]";
    }
}

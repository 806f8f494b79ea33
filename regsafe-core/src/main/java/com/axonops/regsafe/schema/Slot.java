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

import java.util.Objects;

/**
 * Classification of one capturing group.
 *
 * @param ordinal 1-based group number, identical to the number {@code java.util.regex} assigns
 * @param presence whether the group always participates in a successful match
 * @param name inline name from a {@code (?<name>...)} group, or null for an unnamed group
 * @since 1.0.0
 */
public record Slot(int ordinal, Presence presence, String name) {

    public Slot {
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be positive: " + ordinal);
        }
        Objects.requireNonNull(presence, "presence cannot be null");
    }

    public boolean isRequired() {
        return presence == Presence.REQUIRED;
    }

    public boolean isOptional() {
        return presence == Presence.OPTIONAL;
    }

    /** Java type a field for this slot carries in a {@link com.axonops.regsafe.api.ShapedMatch}. */
    public String typeName() {
        return isRequired() ? "String" : "Optional<String>";
    }
}

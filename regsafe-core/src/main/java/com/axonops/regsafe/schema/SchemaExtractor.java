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

import com.axonops.regsafe.api.RequiredGroupAbsentException;
import com.axonops.regsafe.api.ShapeMismatchException;
import com.axonops.regsafe.api.ShapedMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns raw engine group values into a {@link ShapedMatch} that conforms to a {@link Schema}.
 *
 * <p>A violation means the schema and the engine disagree about the pattern. That is a defect in
 * the analyzer, not a property of the input, so it is reported by throwing a
 * {@link com.axonops.regsafe.api.SchemaViolationException} subtype and never converted into
 * "no match".
 *
 * @since 1.0.0
 */
public final class SchemaExtractor {

    private SchemaExtractor() {
        // Utility class
    }

    /**
     * Checks raw group values against a schema that is not tied to a registered pattern.
     *
     * @see #extract(String, Schema, String[])
     */
    public static ShapedMatch extract(Schema schema, String[] raw) {
        return extract("<unknown>", schema, raw);
    }

    /**
     * Checks raw group values against a schema.
     *
     * @param pattern regex source, used in violation messages
     * @param schema schema of the pattern
     * @param raw value of groups 1..n in order, null where a group did not participate
     * @return shaped result with one field per slot
     * @throws ShapeMismatchException if the number of values differs from the slot count
     * @throws RequiredGroupAbsentException if a required slot has no value
     */
    public static ShapedMatch extract(String pattern, Schema schema, String[] raw) {
        Objects.requireNonNull(schema, "schema cannot be null");
        Objects.requireNonNull(raw, "raw cannot be null");

        if (raw.length != schema.count()) {
            throw new ShapeMismatchException(pattern, schema.count(), raw.length);
        }

        List<Object> fields = new ArrayList<>(raw.length);
        for (Slot slot : schema.slots()) {
            String value = raw[slot.ordinal() - 1];
            if (slot.isRequired()) {
                if (value == null) {
                    throw new RequiredGroupAbsentException(pattern, slot.ordinal());
                }
                fields.add(value);
            } else {
                fields.add(Optional.ofNullable(value));
            }
        }
        return new ShapedMatch(schema, fields);
    }

    /**
     * Checks the groups of a successful engine match against a schema.
     *
     * @param pattern regex source, used in violation messages
     * @param schema schema of the pattern
     * @param matcher matcher positioned on a successful match
     * @return shaped result with one field per slot
     */
    public static ShapedMatch fromMatcher(String pattern, Schema schema, Matcher matcher) {
        return extract(pattern, schema, rawGroups(matcher));
    }

    /**
     * Copies groups 1..groupCount of a successful match.
     */
    public static String[] rawGroups(java.util.regex.MatchResult result) {
        String[] raw = new String[result.groupCount()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = result.group(i + 1);
        }
        return raw;
    }
}

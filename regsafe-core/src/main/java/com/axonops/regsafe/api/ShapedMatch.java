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

import com.axonops.regsafe.schema.Presence;
import com.axonops.regsafe.schema.Schema;
import com.axonops.regsafe.schema.Slot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shape-checked groups of one successful match.
 *
 * <p>A ShapedMatch has exactly one field per capturing group of its pattern. Field {@code k}
 * (1-based, same numbering as {@link Match#group(int)}) is a {@code String} when slot {@code k} is
 * {@link Presence#REQUIRED} and an {@code Optional<String>} when it is {@link Presence#OPTIONAL}.
 * Use {@link #required(int)} and {@link #optional(int)} to read fields with their static type.
 *
 * <pre>{@code
 * Regex decimal = Regex.compile("(\\d+)(?:\\.(\\d+))?");
 *
 * ShapedMatch m = decimal.extract("3.1415").orElseThrow();
 * String whole = m.required(1);                // "3"
 * Optional<String> fraction = m.optional(2);   // Optional[1415]
 *
 * decimal.extract("3").orElseThrow().optional(2);  // Optional.empty
 * }</pre>
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
public final class ShapedMatch {

    private final Schema schema;
    private final List<Object> fields;

    /**
     * Creates a shaped match.
     *
     * @param schema schema the fields conform to
     * @param fields one value per slot: a non-null {@code String} for a required slot, an
     *               {@code Optional<String>} for an optional slot
     * @throws IllegalArgumentException if the fields do not conform to the schema
     */
    public ShapedMatch(Schema schema, List<Object> fields) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        Objects.requireNonNull(fields, "fields cannot be null");
        if (fields.size() != schema.count()) {
            throw new IllegalArgumentException(
                "Expected " + schema.count() + " fields but got " + fields.size());
        }
        for (Slot slot : schema.slots()) {
            Object field = fields.get(slot.ordinal() - 1);
            boolean conforms = slot.isRequired() ? field instanceof String : field instanceof Optional;
            if (!conforms) {
                throw new IllegalArgumentException(
                    "Field " + slot.ordinal() + " must be " + slot.typeName() + " but was " + field);
            }
        }
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Number of fields, equal to the number of capturing groups.
     */
    public int arity() {
        return fields.size();
    }

    /**
     * All fields in group order, each a {@code String} or an {@code Optional<String>}.
     */
    public List<Object> fields() {
        return fields;
    }

    /**
     * Gets a field without regard to its type.
     *
     * @param ordinal 1-based group number
     * @throws IndexOutOfBoundsException if ordinal is out of range
     */
    public Object get(int ordinal) {
        schema.slot(ordinal);
        return fields.get(ordinal - 1);
    }

    /**
     * Gets the value of a required group.
     *
     * @param ordinal 1-based group number
     * @return the group's text, never null
     * @throws IllegalArgumentException if the slot is optional
     * @throws IndexOutOfBoundsException if ordinal is out of range
     */
    public String required(int ordinal) {
        Slot slot = schema.slot(ordinal);
        if (!slot.isRequired()) {
            throw new IllegalArgumentException("Group " + ordinal + " is optional, use optional(" + ordinal + ")");
        }
        return (String) fields.get(ordinal - 1);
    }

    /**
     * Gets the value of an optional group.
     *
     * @param ordinal 1-based group number
     * @return the group's text, or empty if the group did not participate
     * @throws IllegalArgumentException if the slot is required
     * @throws IndexOutOfBoundsException if ordinal is out of range
     */
    @SuppressWarnings("unchecked")
    public Optional<String> optional(int ordinal) {
        Slot slot = schema.slot(ordinal);
        if (!slot.isOptional()) {
            throw new IllegalArgumentException("Group " + ordinal + " is required, use required(" + ordinal + ")");
        }
        return (Optional<String>) fields.get(ordinal - 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ShapedMatch other)) {
            return false;
        }
        return schema.equals(other.schema) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, fields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ShapedMatch(");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields.get(i));
        }
        return sb.append(')').toString();
    }
}

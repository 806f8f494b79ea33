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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered classification of every capturing group of a pattern.
 *
 * <p>Immutable and thread-safe. A schema is derived once per compiled
 * {@link com.axonops.regsafe.api.Regex} and shared by all of its matches.
 *
 * <p>Slot {@code k} (1-based) describes the group {@code java.util.regex.Matcher#group(k)}
 * returns. {@link #toString()} renders the shape as a tuple type, for example
 * {@code (String, Optional<String>)}.
 *
 * @since 1.0.0
 */
public final class Schema {

    /** Schema of a pattern without capturing groups. */
    public static final Schema EMPTY = new Schema(Collections.emptyList());

    private final List<Slot> slots;

    Schema(List<Slot> slots) {
        Objects.requireNonNull(slots, "slots cannot be null");
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).ordinal() != i + 1) {
                throw new IllegalArgumentException(
                    "slot ordinals must be contiguous from 1, found " + slots.get(i).ordinal() + " at position " + i);
            }
        }
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    /**
     * Builds a schema from presences listed in group order, without inline names.
     */
    public static Schema of(Presence... presences) {
        List<Slot> slots = new ArrayList<>(presences.length);
        for (int i = 0; i < presences.length; i++) {
            slots.add(new Slot(i + 1, presences[i], null));
        }
        return new Schema(slots);
    }

    /**
     * Number of capturing groups.
     */
    public int count() {
        return slots.size();
    }

    public List<Slot> slots() {
        return slots;
    }

    /**
     * Gets the slot for a 1-based group ordinal.
     *
     * @throws IndexOutOfBoundsException if ordinal is not between 1 and {@link #count()}
     */
    public Slot slot(int ordinal) {
        if (ordinal < 1 || ordinal > slots.size()) {
            throw new IndexOutOfBoundsException(
                "Group ordinal " + ordinal + " out of bounds (1 to " + slots.size() + ")");
        }
        return slots.get(ordinal - 1);
    }

    public long requiredCount() {
        return slots.stream().filter(Slot::isRequired).count();
    }

    public long optionalCount() {
        return slots.stream().filter(Slot::isOptional).count();
    }

    /**
     * Presences in group order, handy for assertions and logging.
     */
    public List<Presence> presences() {
        List<Presence> result = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            result.add(slot.presence());
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Schema other)) {
            return false;
        }
        return slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < slots.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(slots.get(i).typeName());
        }
        return sb.append(')').toString();
    }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for addressing groups by name.
 */
@DisplayName("Group Names")
class GroupNamesTest {

    private static final String TEXT = "stuff abbbc more abc and so on";

    @Test
    @DisplayName("inline group names")
    void inlineNames() {
        MatchIterator ms = Regex.compile("a(?<Bee>b*)c").findAllIn(TEXT);

        assertThat(ms.hasNext()).isTrue();
        assertThat(ms.next()).isEqualTo("abbbc");
        assertThat(ms.group("Bee")).isEqualTo("bbb");
        assertThat(ms.hasNext()).isTrue();
        assertThat(ms.next()).isEqualTo("abc");
        assertThat(ms.group("Bee")).isEqualTo("b");
        assertThat(ms.hasNext()).isFalse();
    }

    @Test
    @DisplayName("declared group names")
    void declaredNames() {
        MatchIterator ms = Regex.compile("a(b*)c", "Bee").findAllIn(TEXT);

        assertThat(ms.next()).isEqualTo("abbbc");
        assertThat(ms.group("Bee")).isEqualTo("bbb");
        assertThat(ms.next()).isEqualTo("abc");
        assertThat(ms.group("Bee")).isEqualTo("b");
        assertThat(ms.hasNext()).isFalse();
    }

    @Test
    @DisplayName("declared and inline names both resolve")
    void declaredAndInlineNames() {
        Regex r = Regex.compile("a(?<Bar>b*)c", "Bee");
        MatchIterator ms = r.findAllIn(TEXT);

        assertThat(ms.next()).isEqualTo("abbbc");
        assertThat(ms.group("Bee")).isEqualTo("bbb");
        assertThat(ms.group("Bar")).isEqualTo("bbb");
        assertThat(ms.next()).isEqualTo("abc");
        assertThat(ms.group("Bee")).isEqualTo("b");
        assertThat(ms.group("Bar")).isEqualTo("b");
        assertThat(ms.hasNext()).isFalse();

        assertThat(r.namedGroups()).containsEntry("Bee", 1).containsEntry("Bar", 1).hasSize(2);
        assertThat(r.groupNames()).containsExactly("Bee");
    }

    @Test
    @DisplayName("inline name wins over a declared name on clash")
    void inlineNameWins() {
        Regex r = Regex.compile("(a)(?<x>b)", "x");

        assertThat(r.namedGroups()).containsEntry("x", 2);
        assertThat(r.findFirstMatchIn("ab").orElseThrow().group("x")).isEqualTo("b");
    }

    @Test
    @DisplayName("unknown names are rejected")
    void unknownName_throws() {
        MatchIterator inline = Regex.compile("a(?<Bar>b*)c").findAllIn(TEXT);
        assertThat(inline.hasNext()).isTrue();
        assertThatThrownBy(() -> inline.group("Bee"))
            .isInstanceOf(UnknownGroupNameException.class)
            .hasMessage("Regsafe: No group with name <Bee>");

        MatchIterator both = Regex.compile("a(?<Bar>b*)c", "Bar").findAllIn(TEXT);
        assertThat(both.hasNext()).isTrue();
        assertThatThrownBy(() -> both.group("Bee")).isInstanceOf(UnknownGroupNameException.class);

        MatchIterator declared = Regex.compile("a(b*)c", "Bar").findAllIn(TEXT);
        assertThat(declared.hasNext()).isTrue();
        assertThatThrownBy(() -> declared.group("Bee"))
            .isInstanceOf(UnknownGroupNameException.class)
            .extracting(e -> ((UnknownGroupNameException) e).getGroupName())
            .isEqualTo("Bee");
    }

    @Test
    @DisplayName("declared name beyond the last group is rejected")
    void surplusDeclaredName_throws() {
        Regex r = Regex.compile("a(b)c", "first", "second");
        Match m = r.findFirstMatchIn("abc").orElseThrow();

        assertThat(m.group("first")).isEqualTo("b");
        assertThatThrownBy(() -> m.group("second")).isInstanceOf(UnknownGroupNameException.class);
        assertThatThrownBy(() -> r.findAllIn("abc").group("second"))
            .isInstanceOf(UnknownGroupNameException.class);
    }

    @Test
    @DisplayName("group names are part of the registration identity")
    void namesDistinguishRegistrations() {
        assertThat(Regex.compile("a(b)c", "x")).isNotSameAs(Regex.compile("a(b)c", "y"));
        assertThat(Regex.compile("a(b)c", "x")).isSameAs(Regex.compile("a(b)c", "x"));
    }
}

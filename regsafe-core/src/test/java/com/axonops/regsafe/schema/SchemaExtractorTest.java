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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.axonops.regsafe.schema.Presence.OPTIONAL;
import static com.axonops.regsafe.schema.Presence.REQUIRED;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for checking raw group values against a schema.
 */
@DisplayName("Schema Extractor")
class SchemaExtractorTest {

    @Test
    @DisplayName("required values are passed through, optional values wrapped")
    void conformingValues_shaped() {
        Schema schema = Schema.of(REQUIRED, OPTIONAL, OPTIONAL);
        ShapedMatch shaped = SchemaExtractor.extract(schema, new String[] {"3", "1415", null});

        assertThat(shaped.arity()).isEqualTo(3);
        assertThat(shaped.required(1)).isEqualTo("3");
        assertThat(shaped.optional(2)).contains("1415");
        assertThat(shaped.optional(3)).isEmpty();
        assertThat(shaped.fields()).containsExactly("3", Optional.of("1415"), Optional.empty());
    }

    @Test
    @DisplayName("empty schema with no values yields an empty result")
    void emptySchema_emptyResult() {
        ShapedMatch shaped = SchemaExtractor.extract(Schema.EMPTY, new String[0]);
        assertThat(shaped.arity()).isZero();
        assertThat(shaped.fields()).isEmpty();
    }

    @Test
    @DisplayName("wrong number of values is a shape mismatch")
    void arityMismatch_throws() {
        Schema schema = Schema.of(REQUIRED, REQUIRED);

        assertThatThrownBy(() -> SchemaExtractor.extract("(a)(b)", schema, new String[] {"a"}))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("expected 2 capturing groups but found 1")
            .satisfies(e -> {
                ShapeMismatchException sme = (ShapeMismatchException) e;
                assertThat(sme.getExpected()).isEqualTo(2);
                assertThat(sme.getActual()).isEqualTo(1);
                assertThat(sme.getPattern()).isEqualTo("(a)(b)");
            });
    }

    @Test
    @DisplayName("absent value in a required slot is reported")
    void requiredAbsent_throws() {
        Schema schema = Schema.of(OPTIONAL, REQUIRED);

        assertThatThrownBy(() -> SchemaExtractor.extract("x", schema, new String[] {"a", null}))
            .isInstanceOf(RequiredGroupAbsentException.class)
            .hasMessageContaining("required group 2 did not participate")
            .extracting(e -> ((RequiredGroupAbsentException) e).getOrdinal())
            .isEqualTo(2);
    }

    @Test
    @DisplayName("groups are read from a successful engine match")
    void fromMatcher_readsGroups() {
        Pattern pattern = Pattern.compile("(\\d+)(?:\\.(\\d+))?");
        Matcher m = pattern.matcher("42");
        assertThat(m.matches()).isTrue();

        ShapedMatch shaped = SchemaExtractor.fromMatcher(pattern.pattern(), Schema.of(REQUIRED, OPTIONAL), m);
        assertThat(shaped.required(1)).isEqualTo("42");
        assertThat(shaped.optional(2)).isEmpty();
    }

    @Test
    @DisplayName("long patterns are truncated in violation messages")
    void violationMessage_truncatesPattern() {
        String longPattern = "a".repeat(150);
        assertThatThrownBy(() -> SchemaExtractor.extract(longPattern, Schema.EMPTY, new String[] {"x"}))
            .hasMessageContaining("...")
            .hasMessageNotContaining(longPattern);
    }
}

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

import com.axonops.regsafe.schema.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.axonops.regsafe.schema.Presence.OPTIONAL;
import static com.axonops.regsafe.schema.Presence.REQUIRED;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Shaped Match")
class ShapedMatchTest {

    private static final Schema RO = Schema.of(REQUIRED, OPTIONAL);

    @Test
    @DisplayName("typed access by ordinal")
    void typedAccess() {
        ShapedMatch m = new ShapedMatch(RO, List.of("a", Optional.of("b")));

        assertThat(m.get(1)).isEqualTo("a");
        assertThat(m.get(2)).isEqualTo(Optional.of("b"));
        assertThat(m.required(1)).isEqualTo("a");
        assertThat(m.optional(2)).contains("b");
        assertThat(m.schema()).isEqualTo(RO);
        assertThat(m).hasToString("ShapedMatch(a, Optional[b])");
    }

    @Test
    @DisplayName("accessor must agree with the slot presence")
    void wrongAccessor_throws() {
        ShapedMatch m = new ShapedMatch(RO, List.of("a", Optional.empty()));

        assertThatIllegalArgumentException().isThrownBy(() -> m.optional(1));
        assertThatIllegalArgumentException().isThrownBy(() -> m.required(2));
        assertThatThrownBy(() -> m.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @DisplayName("fields must conform to the schema")
    void nonConformingFields_rejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> new ShapedMatch(RO, List.of("a")));
        assertThatIllegalArgumentException().isThrownBy(() -> new ShapedMatch(RO, List.of("a", "b")));
        assertThatIllegalArgumentException().isThrownBy(() -> new ShapedMatch(RO, List.of(Optional.of("a"), Optional.empty())));
        assertThatIllegalArgumentException().isThrownBy(() -> new ShapedMatch(RO, Arrays.asList(null, Optional.empty())));
    }

    @Test
    @DisplayName("value equality")
    void equality() {
        assertThat(new ShapedMatch(RO, List.of("a", Optional.empty())))
            .isEqualTo(new ShapedMatch(RO, List.of("a", Optional.empty())))
            .hasSameHashCodeAs(new ShapedMatch(RO, List.of("a", Optional.empty())))
            .isNotEqualTo(new ShapedMatch(RO, List.of("a", Optional.of("b"))));
    }
}

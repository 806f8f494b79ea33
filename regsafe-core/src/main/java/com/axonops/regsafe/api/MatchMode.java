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

/**
 * How a match attempt relates the pattern to the input.
 *
 * @since 1.0.0
 */
public enum MatchMode {
    /** The pattern must match the entire input. */
    FULL,

    /** The pattern must match starting at the beginning of the input, but need not consume all of it. */
    PREFIX,

    /** The pattern may match anywhere in the input; the leftmost match is used. */
    FIND
}

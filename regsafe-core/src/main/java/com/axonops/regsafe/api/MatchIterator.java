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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

/**
 * Iterator over the occurrences of a {@link Regex} in an input, yielding the matched text.
 *
 * <p>Besides iterating, the iterator exposes the data of its current match. After {@link #next()}
 * the current match is the one just returned. Calling {@link #hasNext()} moves on to the upcoming
 * match, and querying data before the first {@code next()} looks ahead to the first match:
 *
 * <pre>{@code
 * MatchIterator it = Regex.compile("(ab)(cd)").findAllIn("xxxabcdyyyabcdzzz");
 * it.start();      // 3, first match
 * it.next();       // "abcd"
 * it.start();      // 3
 * it.hasNext();    // true
 * it.start();      // 10, second match
 * }</pre>
 *
 * <p>Not thread-safe: confine an instance to one thread.
 *
 * @since 1.0.0
 */
public final class MatchIterator implements Iterator<String> {

    private enum State {
        /** Nothing looked up since the last consumed match. */
        FRESH,
        /** Matcher holds a match that {@link #next()} has not returned yet. */
        PEEKED,
        /** Matcher holds the match {@link #next()} just returned. */
        CONSUMED,
        /** No further matches. */
        EXHAUSTED
    }

    private final CharSequence source;
    private final Regex regex;
    private final Matcher matcher;
    private State state = State.FRESH;

    MatchIterator(CharSequence source, Regex regex) {
        this.source = source;
        this.regex = regex;
        this.matcher = regex.pattern().matcher(source);
    }

    public CharSequence source() {
        return source;
    }

    public Regex regex() {
        return regex;
    }

    @Override
    public boolean hasNext() {
        switch (state) {
            case FRESH:
                state = matcher.find() ? State.PEEKED : State.EXHAUSTED;
                break;
            case CONSUMED:
                state = State.FRESH;
                return hasNext();
            default:
                break;
        }
        return state == State.PEEKED;
    }

    /**
     * Advances to the next occurrence.
     *
     * @return the matched text
     * @throws NoSuchElementException if there are no further occurrences
     */
    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No further matches");
        }
        state = State.CONSUMED;
        return matcher.group();
    }

    /**
     * Start index of the current match.
     *
     * @throws IllegalStateException if there is no current match
     */
    public int start() {
        ensureData();
        return matcher.start();
    }

    public int start(int group) {
        ensureData();
        return matcher.start(group);
    }

    /**
     * End index (exclusive) of the current match.
     *
     * @throws IllegalStateException if there is no current match
     */
    public int end() {
        ensureData();
        return matcher.end();
    }

    public int end(int group) {
        ensureData();
        return matcher.end(group);
    }

    public String group() {
        ensureData();
        return matcher.group();
    }

    /**
     * Gets a group of the current match, or null if it did not participate.
     */
    public String group(int group) {
        ensureData();
        return matcher.group(group);
    }

    /**
     * Gets a named group of the current match.
     *
     * @throws UnknownGroupNameException if no group has this name
     * @throws IllegalStateException if there is no current match
     */
    public String group(String name) {
        int ordinal = regex.resolveGroup(name);
        ensureData();
        return matcher.group(ordinal);
    }

    public int groupCount() {
        ensureData();
        return matcher.groupCount();
    }

    /**
     * Continues the iteration as detached {@link Match} snapshots.
     *
     * <p>The returned iterator shares this iterator's position; advancing one advances the other.
     */
    public Iterator<Match> matchData() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return MatchIterator.this.hasNext();
            }

            @Override
            public Match next() {
                MatchIterator.this.next();
                return Match.of(source, regex.pattern(), matcher, regex.nameTable());
            }
        };
    }

    private void ensureData() {
        if (state == State.FRESH && !hasNext()) {
            throw new IllegalStateException("No match available");
        }
        if (state == State.EXHAUSTED) {
            throw new IllegalStateException("No match available");
        }
    }

    @Override
    public String toString() {
        return "MatchIterator{regex=" + regex + ", state=" + state + "}";
    }
}

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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.regex.MatchResult;

/**
 * One successful match of a {@link Regex} against an input.
 *
 * <p>A Match is a detached snapshot: it copies the spans and group texts out of the engine's
 * {@link java.util.regex.Matcher}, so it stays valid after the matcher moves on and can be shared
 * between threads.
 *
 * <pre>{@code
 * Regex date = Regex.compile("(\\d{4})-(\\d{2})-(\\d{2})", "year", "month", "day");
 * Match m = date.findFirstMatchIn("due 2004-01-20.").orElseThrow();
 *
 * m.group();          // "2004-01-20"
 * m.group(1);         // "2004"
 * m.group("month");   // "01"
 * m.before();         // "due "
 * m.after();          // "."
 * }</pre>
 *
 * <p>Group 0 is the whole match. A group that did not participate has value null and start and end
 * -1, as in {@link java.util.regex.Matcher}.
 *
 * @since 1.0.0
 */
public final class Match implements MatchResult {

  private final CharSequence source;
  private final java.util.regex.Pattern owner;
  private final int[] starts;
  private final int[] ends;
  private final String[] groups;
  private final Map<String, Integer> names;

  private Match(
      CharSequence source,
      java.util.regex.Pattern owner,
      int[] starts,
      int[] ends,
      String[] groups,
      Map<String, Integer> names) {
    this.source = source;
    this.owner = owner;
    this.starts = starts;
    this.ends = ends;
    this.groups = groups;
    this.names = names;
  }

  /**
   * Snapshots the current state of a matcher that has just matched.
   *
   * @param source the input the matcher was reset to
   * @param owner the compiled pattern that produced the match
   * @param result the engine's match state
   * @param names group name table of the owning {@link Regex}
   */
  static Match of(
      CharSequence source,
      java.util.regex.Pattern owner,
      MatchResult result,
      Map<String, Integer> names) {
    Objects.requireNonNull(source, "source cannot be null");
    int n = result.groupCount() + 1;
    int[] starts = new int[n];
    int[] ends = new int[n];
    String[] groups = new String[n];
    for (int i = 0; i < n; i++) {
      starts[i] = result.start(i);
      ends[i] = result.end(i);
      groups[i] = result.group(i);
    }
    return new Match(
        source,
        owner,
        starts,
        ends,
        groups,
        names != null ? Collections.unmodifiableMap(names) : Collections.emptyMap());
  }

  /**
   * The whole input the match was found in.
   */
  public CharSequence source() {
    return source;
  }

  /**
   * The compiled engine pattern that produced this match.
   */
  java.util.regex.Pattern owner() {
    return owner;
  }

  /**
   * Gets the text of the whole match, same as {@code group(0)}.
   */
  public String matched() {
    return groups[0];
  }

  @Override
  public int start() {
    return starts[0];
  }

  @Override
  public int start(int group) {
    checkGroup(group);
    return starts[group];
  }

  /**
   * Gets the start of a named group.
   *
   * @throws UnknownGroupNameException if no group has this name
   */
  public int start(String name) {
    return starts[resolve(name)];
  }

  @Override
  public int end() {
    return ends[0];
  }

  @Override
  public int end(int group) {
    checkGroup(group);
    return ends[group];
  }

  /**
   * Gets the end of a named group.
   *
   * @throws UnknownGroupNameException if no group has this name
   */
  public int end(String name) {
    return ends[resolve(name)];
  }

  @Override
  public String group() {
    return groups[0];
  }

  /**
   * Gets a captured group by ordinal.
   *
   * @param group 0 for the whole match, 1+ for capturing groups
   * @return the captured text, or null if the group did not participate
   * @throws IndexOutOfBoundsException if group is negative or greater than {@link #groupCount()}
   */
  @Override
  public String group(int group) {
    checkGroup(group);
    return groups[group];
  }

  /**
   * Gets a captured group by name.
   *
   * <p>Names come from inline {@code (?<name>...)} groups and from the names given to
   * {@link Regex#compile(String, String...)}; the first declared name labels group 1, the second
   * group 2, and so on.
   *
   * @param name group name
   * @return the captured text, or null if the group did not participate
   * @throws UnknownGroupNameException if no group has this name
   */
  public String group(String name) {
    return groups[resolve(name)];
  }

  @Override
  public int groupCount() {
    return groups.length - 1;
  }

  /**
   * Gets the input before the match.
   */
  public CharSequence before() {
    return source.subSequence(0, starts[0]);
  }

  /**
   * Gets the input before a group, or null if the group did not participate.
   */
  public CharSequence before(int group) {
    int start = start(group);
    return start < 0 ? null : source.subSequence(0, start);
  }

  /**
   * Gets the input after the match.
   */
  public CharSequence after() {
    return source.subSequence(ends[0], source.length());
  }

  /**
   * Gets the input after a group, or null if the group did not participate.
   */
  public CharSequence after(int group) {
    int end = end(group);
    return end < 0 ? null : source.subSequence(end, source.length());
  }

  /**
   * Gets the group name table, mapping each known name to its ordinal.
   */
  public Map<String, Integer> namedGroups() {
    return names;
  }

  /**
   * Gets capturing groups 1..n as an array, null where a group did not participate.
   */
  public String[] subgroups() {
    return Arrays.copyOfRange(groups, 1, groups.length);
  }

  private int resolve(String name) {
    Objects.requireNonNull(name, "Group name cannot be null");
    Integer ordinal = names.get(name);
    if (ordinal == null || ordinal >= groups.length) {
      throw new UnknownGroupNameException(name);
    }
    return ordinal;
  }

  private void checkGroup(int group) {
    if (group < 0 || group >= groups.length) {
      throw new IndexOutOfBoundsException(
          "Group index " + group + " out of bounds (0 to " + (groups.length - 1) + ")");
    }
  }

  @Override
  public String toString() {
    return groups[0] != null ? groups[0] : "";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Match other)) {
      return false;
    }
    return source.toString().equals(other.source.toString())
        && Arrays.equals(starts, other.starts)
        && Arrays.equals(ends, other.ends);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source.toString(), Arrays.hashCode(starts), Arrays.hashCode(ends));
  }
}

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

import com.axonops.regsafe.cache.CacheStatistics;
import com.axonops.regsafe.cache.RegexCache;
import com.axonops.regsafe.cache.RegsafeConfig;
import com.axonops.regsafe.metrics.MetricNames;
import com.axonops.regsafe.metrics.RegsafeMetricsRegistry;
import com.axonops.regsafe.schema.Schema;
import com.axonops.regsafe.schema.SchemaExtractor;
import com.axonops.regsafe.schema.Slot;
import com.axonops.regsafe.schema.StructureAnalyzer;
import com.axonops.regsafe.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A registered regular expression together with the shape of its capturing groups.
 *
 * <p>Registration compiles the pattern with {@code java.util.regex} and derives a {@link Schema}:
 * the number of capturing groups and, for each, whether it is guaranteed to hold a value after a
 * successful match. {@link #extract(CharSequence)} then hands back a {@link ShapedMatch} whose
 * fields follow that schema, so callers never index into a raw array of possibly-null strings.
 *
 * <pre>{@code
 * Regex decimal = Regex.compile("(\\d+)(?:\\.(\\d+))?");
 * decimal.schema();                 // (String, Optional<String>)
 *
 * decimal.extract("3.1415")         // Optional[ShapedMatch(3, Optional[1415])]
 * decimal.extract("3")              // Optional[ShapedMatch(3, Optional.empty)]
 * decimal.extract("x")              // Optional.empty
 * }</pre>
 *
 * <p>Thread-safe: Regex instances are immutable and can be shared between threads. Every match
 * operation uses its own {@link Matcher}.
 *
 * <p>Instances from {@link #compile(String, String...)} are cached per distinct pattern text and
 * group names; see {@link RegexCache}.
 *
 * <p>By default a Regex is anchored: {@link #matches(CharSequence)} and
 * {@link #extract(CharSequence)} require the whole input to match. {@link #unanchored()} returns a
 * view that searches instead.
 *
 * @since 1.0.0
 */
public final class Regex {
    private static final Logger logger = LoggerFactory.getLogger(Regex.class);

    // Global registration cache (replaceable for testing)
    private static volatile RegexCache cache = new RegexCache(RegsafeConfig.DEFAULT);

    /**
     * Gets the global registration cache (for internal use).
     */
    public static RegexCache getGlobalCache() {
        return cache;
    }

    private final String regex;
    private final Pattern pattern;
    private final Schema schema;
    private final List<String> groupNames;
    private final Map<String, Integer> nameTable;
    private final MatchMode defaultMode;
    private final Regex anchoredView;
    private final Regex unanchoredView;

    private Regex(String regex, Pattern pattern, Schema schema, List<String> groupNames) {
        this.regex = regex;
        this.pattern = pattern;
        this.schema = schema;
        this.groupNames = groupNames;
        this.nameTable = buildNameTable(schema, groupNames);
        this.defaultMode = MatchMode.FULL;
        this.anchoredView = null;
        this.unanchoredView = new Regex(this);
    }

    /**
     * Creates the unanchored view of an anchored instance.
     */
    private Regex(Regex anchored) {
        this.regex = anchored.regex;
        this.pattern = anchored.pattern;
        this.schema = anchored.schema;
        this.groupNames = anchored.groupNames;
        this.nameTable = anchored.nameTable;
        this.defaultMode = MatchMode.FIND;
        this.anchoredView = anchored;
        this.unanchoredView = this;
    }

    /**
     * Registers a pattern, reusing a cached registration when one exists.
     *
     * <p>Group names, when given, label capturing groups by position: the first name labels group
     * 1, the second group 2, and so on. Inline {@code (?<name>...)} names are always available too.
     *
     * @param regex pattern text in {@code java.util.regex} syntax
     * @param groupNames optional names for groups 1, 2, ...
     * @return registered pattern
     * @throws PatternCompilationException if the engine rejects the pattern
     * @throws ShapeMismatchException if the pattern uses a construct whose groups cannot be
     *     classified from its text
     * @throws NullPointerException if regex or any group name is null
     */
    public static Regex compile(String regex, String... groupNames) {
        Objects.requireNonNull(regex, "regex cannot be null");
        List<String> names = List.of(groupNames);
        return cache.getOrCompile(regex, names, () -> doCompile(regex, names));
    }

    /**
     * Registers a pattern without consulting or populating the cache.
     *
     * @see #compile(String, String...)
     */
    public static Regex compileWithoutCache(String regex, String... groupNames) {
        Objects.requireNonNull(regex, "regex cannot be null");
        return doCompile(regex, List.of(groupNames));
    }

    private static Regex doCompile(String regex, List<String> groupNames) {
        RegsafeMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        String hash = PatternHasher.hashWithNames(regex, groupNames);

        long startNanos = System.nanoTime();
        Pattern compiled;
        try {
            compiled = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("Regsafe: Pattern compilation failed - hash: {}, error: {}, index: {}",
                hash, e.getDescription(), e.getIndex());
            throw new PatternCompilationException(regex, e);
        }
        long compileNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, compileNanos);

        long analysisStart = System.nanoTime();
        Schema schema = StructureAnalyzer.analyze(regex);
        long analysisNanos = System.nanoTime() - analysisStart;
        metrics.recordTimer(MetricNames.SCHEMA_ANALYSIS_LATENCY, analysisNanos);

        int engineCount = compiled.matcher("").groupCount();
        if (engineCount != schema.count()) {
            metrics.incrementCounter(MetricNames.ERRORS_SCHEMA_VIOLATION);
            logger.error("Regsafe: Schema disagrees with engine at registration - hash: {}, schema groups: {}, engine groups: {}",
                hash, schema.count(), engineCount);
            throw new ShapeMismatchException(regex, schema.count(), engineCount);
        }

        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
        Regex result = new Regex(regex, compiled, schema, groupNames);
        logger.trace("Regsafe: Regex registered - hash: {}, schema: {}, compileNs: {}, analysisNs: {}",
            hash, schema, compileNanos, analysisNanos);
        return result;
    }

    /**
     * Builds the name lookup table: declared names first, then inline names, which win on clash.
     */
    private static Map<String, Integer> buildNameTable(Schema schema, List<String> groupNames) {
        Map<String, Integer> table = new HashMap<>();
        for (int i = 0; i < groupNames.size(); i++) {
            table.put(groupNames.get(i), i + 1);
        }
        for (Slot slot : schema.slots()) {
            if (slot.name() != null) {
                table.put(slot.name(), slot.ordinal());
            }
        }
        return Collections.unmodifiableMap(table);
    }

    // ========== Accessors ==========

    /**
     * The pattern text this instance was registered with.
     */
    public String regex() {
        return regex;
    }

    /**
     * The compiled engine pattern.
     */
    public Pattern pattern() {
        return pattern;
    }

    /**
     * The shape of this pattern's capturing groups.
     */
    public Schema schema() {
        return schema;
    }

    /**
     * The group names declared at registration, possibly empty.
     */
    public List<String> groupNames() {
        return groupNames;
    }

    /**
     * Every name that {@link Match#group(String)} accepts, mapped to its group ordinal.
     */
    public Map<String, Integer> namedGroups() {
        return nameTable;
    }

    /**
     * Mode used by {@link #matches(CharSequence)} and {@link #extract(CharSequence)}: {@link
     * MatchMode#FULL} for an anchored instance, {@link MatchMode#FIND} for an unanchored view.
     */
    public MatchMode defaultMode() {
        return defaultMode;
    }

    /**
     * Returns a view that searches for the pattern anywhere in the input.
     */
    public Regex unanchored() {
        return unanchoredView;
    }

    /**
     * Returns the view that requires the pattern to match the whole input.
     */
    public Regex anchored() {
        return anchoredView != null ? anchoredView : this;
    }

    // ========== Matching ==========

    /**
     * Attempts a single match.
     *
     * @param input text to match against
     * @param mode how the pattern must relate to the input
     * @return the match, or empty if there is none
     */
    public Optional<Match> match(CharSequence input, MatchMode mode) {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        Matcher m = pattern.matcher(input);
        if (run(m, mode)) {
            return Optional.of(Match.of(input, pattern, m, nameTable));
        }
        return Optional.empty();
    }

    /**
     * Tests the input using the default mode.
     *
     * @return true if the whole input matches (anchored) or the pattern occurs in it (unanchored)
     */
    public boolean matches(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        return run(pattern.matcher(input), defaultMode);
    }

    /**
     * Finds the first occurrence of the pattern.
     */
    public Optional<String> findFirstIn(CharSequence input) {
        return findFirstMatchIn(input).map(Match::matched);
    }

    public Optional<Match> findFirstMatchIn(CharSequence input) {
        return match(input, MatchMode.FIND);
    }

    /**
     * Matches the pattern against a prefix of the input.
     */
    public Optional<String> findPrefixOf(CharSequence input) {
        return findPrefixMatchOf(input).map(Match::matched);
    }

    public Optional<Match> findPrefixMatchOf(CharSequence input) {
        return match(input, MatchMode.PREFIX);
    }

    /**
     * Iterates over every non-overlapping occurrence of the pattern.
     */
    public MatchIterator findAllIn(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        return new MatchIterator(input, this);
    }

    /**
     * Iterates over every non-overlapping occurrence of the pattern, as detached matches.
     */
    public Iterator<Match> findAllMatchIn(CharSequence input) {
        return findAllIn(input).matchData();
    }

    // ========== Shape-checked extraction ==========

    /**
     * Matches the input using the default mode and returns its groups shaped by {@link #schema()}.
     *
     * @param input text to match against
     * @return shaped groups, or empty if the input does not match
     * @throws SchemaViolationException if the match disagrees with the schema (a library defect)
     */
    public Optional<ShapedMatch> extract(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        long startNanos = System.nanoTime();
        Matcher m = pattern.matcher(input);
        if (!run(m, defaultMode)) {
            return Optional.empty();
        }
        ShapedMatch shaped = shape(SchemaExtractor.rawGroups(m));
        recordExtraction(startNanos);
        return Optional.of(shaped);
    }

    /**
     * Shapes the groups of an existing match.
     *
     * <p>A match produced by this pattern (or its anchored or unanchored view) is shaped from its
     * own groups. A match produced by any other pattern is treated as text: this pattern is run
     * against {@link Match#matched()} in the default mode.
     *
     * @param match a successful match
     * @return shaped groups, or empty if a foreign match's text does not match this pattern
     * @throws SchemaViolationException if the match disagrees with the schema (a library defect)
     */
    public Optional<ShapedMatch> extract(Match match) {
        Objects.requireNonNull(match, "match cannot be null");
        if (match.owner() != pattern) {
            return extract(match.matched());
        }
        long startNanos = System.nanoTime();
        ShapedMatch shaped = shape(match.subgroups());
        recordExtraction(startNanos);
        return Optional.of(shaped);
    }

    private ShapedMatch shape(String[] raw) {
        try {
            return SchemaExtractor.extract(regex, schema, raw);
        } catch (SchemaViolationException e) {
            cache.getConfig().metricsRegistry().incrementCounter(MetricNames.ERRORS_SCHEMA_VIOLATION);
            logger.error("Regsafe: Schema violation during extraction - hash: {}, schema: {}, reason: {}",
                PatternHasher.hash(regex), schema, e.getMessage());
            throw e;
        }
    }

    private void recordExtraction(long startNanos) {
        RegsafeMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.EXTRACTION_OPERATIONS);
        metrics.recordTimer(MetricNames.EXTRACTION_LATENCY, System.nanoTime() - startNanos);
    }

    // ========== Replacement and splitting ==========

    /**
     * Replaces every occurrence with a replacement string, which may refer to groups as {@code $n}
     * or {@code ${name}}.
     */
    public String replaceAllIn(CharSequence target, String replacement) {
        Objects.requireNonNull(target, "target cannot be null");
        countReplace();
        return pattern.matcher(target).replaceAll(replacement);
    }

    /**
     * Replaces the first occurrence with a replacement string.
     */
    public String replaceFirstIn(CharSequence target, String replacement) {
        Objects.requireNonNull(target, "target cannot be null");
        countReplace();
        return pattern.matcher(target).replaceFirst(replacement);
    }

    /**
     * Replaces every occurrence with the string computed from its match.
     *
     * <p>The computed string is a replacement string: {@code $} and {@code \} keep their special
     * meaning. Pass it through {@link Regsafe#quoteReplacement(String)} to insert it literally.
     */
    public String replaceAllIn(CharSequence target, Function<Match, String> replacer) {
        Objects.requireNonNull(replacer, "replacer cannot be null");
        return replaceSomeIn(target, m -> Optional.of(replacer.apply(m)));
    }

    /**
     * Replaces the occurrences for which the replacer returns a value; the others are kept as is.
     */
    public String replaceSomeIn(CharSequence target, Function<Match, Optional<String>> replacer) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(replacer, "replacer cannot be null");
        countReplace();

        Matcher m = pattern.matcher(target);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Optional<String> replacement = replacer.apply(Match.of(target, pattern, m, nameTable));
            if (replacement.isPresent()) {
                m.appendReplacement(sb, replacement.get());
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Splits the input around occurrences of the pattern, as {@link Pattern#split(CharSequence)}.
     */
    public String[] split(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        return pattern.split(input);
    }

    private void countReplace() {
        cache.getConfig().metricsRegistry().incrementCounter(MetricNames.REPLACE_OPERATIONS);
    }

    /**
     * Runs the matcher in the given mode, recording matching metrics.
     */
    private boolean run(Matcher m, MatchMode mode) {
        long startNanos = System.nanoTime();
        boolean found;
        String modeLatency;
        switch (mode) {
            case FULL:
                found = m.matches();
                modeLatency = MetricNames.MATCHING_FULL_MATCH_LATENCY;
                break;
            case PREFIX:
                found = m.lookingAt();
                modeLatency = MetricNames.MATCHING_PREFIX_MATCH_LATENCY;
                break;
            case FIND:
                found = m.find();
                modeLatency = MetricNames.MATCHING_FIND_LATENCY;
                break;
            default:
                throw new IllegalArgumentException("Unknown match mode: " + mode);
        }
        long durationNanos = System.nanoTime() - startNanos;

        RegsafeMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);
        metrics.recordTimer(modeLatency, durationNanos);
        return found;
    }

    /**
     * Resolves a group name against this pattern's name table.
     *
     * @throws UnknownGroupNameException if the name is unknown or labels a group the pattern lacks
     */
    int resolveGroup(String name) {
        Objects.requireNonNull(name, "Group name cannot be null");
        Integer ordinal = nameTable.get(name);
        if (ordinal == null || ordinal > schema.count()) {
            throw new UnknownGroupNameException(name);
        }
        return ordinal;
    }

    Map<String, Integer> nameTable() {
        return nameTable;
    }

    @Override
    public String toString() {
        return regex;
    }

    // ========== Global cache management ==========

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the registration cache. Instances already handed out stay valid.
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Reconfigures the cache with new settings. All cached entries are cleared.
     *
     * @param config the new configuration
     */
    public static void configureCache(RegsafeConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        cache.reconfigure(config);
    }

    /**
     * Sets a new global cache (for testing only).
     *
     * <p>The previous cache is not shut down; callers that replace it own its lifecycle.
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(RegexCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Gets the current cache configuration.
     */
    public static RegsafeConfig getCacheConfig() {
        return cache.getConfig();
    }
}

package org.aimux.distribution.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A requirement expression over {@link SemanticVersion semantic versions}.
 *
 * <p>Supported syntax:
 * <ul>
 * <li>Plain or exact versions: <code>1.2.3</code>, <code>=1.2.3</code>, <code>==1.2.3</code></li>
 * <li>Comparators: <code>&gt;1.2.3</code>, <code>&gt;=1.2.3</code>, <code>&lt;1.2.3</code>, <code>&lt;=1.2.3</code></li>
 * <li>Compatible ranges: <code>^1.2.3</code> (same major, or same minor while in 0.x) and <code>~1.2.3</code> (same minor)</li>
 * <li>Wildcards: <code>*</code>, <code>1.*</code>, <code>1.2.x</code>, or partial versions such as <code>1.2</code></li>
 * <li>Hyphen ranges: <code>1.0.0 - 2.0.0</code> (both ends inclusive)</li>
 * <li>Conjunctions, separated by whitespace, commas or <code>&amp;&amp;</code>: <code>&gt;=1.0.0,&lt;2.0.0</code></li>
 * <li>Disjunctions, separated by <code>||</code>: <code>^1.0.0 || ^3.0.0</code></li>
 * <li>The sentinels <code>latest</code> and <code>minimum</code>, see {@link #LATEST} and {@link #MINIMUM}</li>
 * </ul>
 *
 * <p>Internally any constraint is normalised into a union of intervals, which means that intersections
 * and emptiness checks are exact and do not depend on which versions happen to be published.
 */
public class VersionConstraint {

    // Lower and upper bounds are null when the interval is unbounded in that direction.
    private static final class Interval {
        @Nullable
        private final SemanticVersion lower;
        private final boolean lowerInclusive;
        @Nullable
        private final SemanticVersion upper;
        private final boolean upperInclusive;

        private Interval(@Nullable SemanticVersion lower, boolean lowerInclusive, @Nullable SemanticVersion upper, boolean upperInclusive) {
            this.lower = lower;
            this.lowerInclusive = lowerInclusive;
            this.upper = upper;
            this.upperInclusive = upperInclusive;
        }

        boolean contains(@NotNull SemanticVersion version) {
            SemanticVersion lower = this.lower;
            if (lower != null) {
                int cmp = version.compareTo(lower);
                if (cmp < 0 || (cmp == 0 && !this.lowerInclusive)) {
                    return false;
                }
            }
            SemanticVersion upper = this.upper;
            if (upper != null) {
                int cmp = version.compareTo(upper);
                if (cmp > 0 || (cmp == 0 && !this.upperInclusive)) {
                    return false;
                }
            }
            return true;
        }

        boolean isEmpty() {
            if (this.lower == null || this.upper == null) {
                return false;
            }
            int cmp = this.lower.compareTo(this.upper);
            return cmp > 0 || (cmp == 0 && !(this.lowerInclusive && this.upperInclusive));
        }

        @Nullable
        Interval intersect(@NotNull Interval other) {
            SemanticVersion lower = this.lower;
            boolean lowerInclusive = this.lowerInclusive;
            if (other.lower != null) {
                int cmp = lower == null ? -1 : lower.compareTo(other.lower);
                if (cmp < 0) {
                    lower = other.lower;
                    lowerInclusive = other.lowerInclusive;
                } else if (cmp == 0) {
                    lowerInclusive &= other.lowerInclusive;
                }
            }

            SemanticVersion upper = this.upper;
            boolean upperInclusive = this.upperInclusive;
            if (other.upper != null) {
                int cmp = upper == null ? 1 : upper.compareTo(other.upper);
                if (cmp > 0) {
                    upper = other.upper;
                    upperInclusive = other.upperInclusive;
                } else if (cmp == 0) {
                    upperInclusive &= other.upperInclusive;
                }
            }

            Interval intersection = new Interval(lower, lowerInclusive, upper, upperInclusive);
            return intersection.isEmpty() ? null : intersection;
        }

        @Override
        public String toString() {
            return (this.lowerInclusive ? "[" : "(")
                    + (this.lower == null ? "" : this.lower.toString())
                    + ','
                    + (this.upper == null ? "" : this.upper.toString())
                    + (this.upperInclusive ? "]" : ")");
        }
    }

    private static final Interval UNBOUNDED = new Interval(null, false, null, false);
    private static final Pattern HYPHEN_RANGE = Pattern.compile("^(\\S+)\\s+-\\s+(\\S+)$");
    private static final Pattern AND_SEPARATOR = Pattern.compile("(?:\\s*,\\s*|\\s*&&\\s*|\\s+)");
    private static final Pattern PARTIAL_VERSION = Pattern.compile("^v?(\\d+|[*xX])(?:\\.(\\d+|[*xX]))?(?:\\.(\\d+|[*xX]))?$");

    /**
     * Sentinel constraint accepting any version, corresponding to the string 'latest'.
     * When selecting a version for this constraint alone, the newest eligible version is picked.
     *
     * @implNote The difference between {@link #LATEST} and {@link #MINIMUM} is wholly based on identity.
     * Both instances accept any version through {@link #containsVersion(SemanticVersion)}.
     */
    @NotNull
    public static final VersionConstraint LATEST = new VersionConstraint(Collections.singletonList(VersionConstraint.UNBOUNDED), "latest");

    /**
     * Sentinel constraint accepting any version, corresponding to the string 'minimum'.
     * When selecting a version for this constraint alone, the oldest eligible version is picked
     * regardless of the strategy in use.
     *
     * @implNote The difference between {@link #LATEST} and {@link #MINIMUM} is wholly based on identity.
     */
    @NotNull
    public static final VersionConstraint MINIMUM = new VersionConstraint(Collections.singletonList(VersionConstraint.UNBOUNDED), "minimum");

    @NotNull
    public static VersionConstraint exactly(@NotNull SemanticVersion version) {
        return new VersionConstraint(Collections.singletonList(new Interval(version, true, version, true)), "=" + version.toString());
    }

    @NotNull
    public static VersionConstraint parse(@NotNull String string) {
        String text = string.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("A version constraint may not be empty.");
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (lowered.equals("latest")) {
            return VersionConstraint.LATEST;
        } else if (lowered.equals("minimum")) {
            return VersionConstraint.MINIMUM;
        }

        List<@NotNull Interval> union = new ArrayList<>();
        for (String alternative : text.split("\\|\\|", -1)) {
            alternative = alternative.trim();
            if (alternative.isEmpty()) {
                throw new IllegalArgumentException("Empty alternative in version constraint \"" + string + "\".");
            }
            List<@NotNull Interval> conjunction = Collections.singletonList(VersionConstraint.UNBOUNDED);
            for (Interval interval : VersionConstraint.parseConjunction(alternative, string)) {
                conjunction = VersionConstraint.intersect(conjunction, Collections.singletonList(interval));
            }
            union.addAll(conjunction);
        }
        return new VersionConstraint(union, text);
    }

    @NotNull
    private static List<@NotNull Interval> parseConjunction(@NotNull String alternative, @NotNull String source) {
        Matcher hyphen = VersionConstraint.HYPHEN_RANGE.matcher(alternative);
        if (hyphen.matches()) {
            return Collections.singletonList(new Interval(VersionConstraint.parseFull(hyphen.group(1), source), true,
                    VersionConstraint.parseFull(hyphen.group(2), source), true));
        }

        List<String> tokens = new ArrayList<>();
        String pendingOperator = null;
        for (String token : VersionConstraint.AND_SEPARATOR.split(alternative)) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.matches("^(==|>=|<=|=|>|<|\\^|~)$")) {
                // Operator separated from its version by whitespace, such as '>= 1.0.0'
                if (pendingOperator != null) {
                    throw new IllegalArgumentException("Dangling operator \"" + pendingOperator + "\" in version constraint \"" + source + "\".");
                }
                pendingOperator = token;
                continue;
            }
            if (pendingOperator != null) {
                token = pendingOperator + token;
                pendingOperator = null;
            }
            tokens.add(token);
        }
        if (pendingOperator != null) {
            throw new IllegalArgumentException("Dangling operator \"" + pendingOperator + "\" in version constraint \"" + source + "\".");
        }

        List<@NotNull Interval> intervals = new ArrayList<>();
        for (String token : tokens) {
            intervals.add(VersionConstraint.parseComparator(token, source));
        }
        return intervals;
    }

    @NotNull
    private static Interval parseComparator(@NotNull String token, @NotNull String source) {
        if (token.startsWith("==")) {
            SemanticVersion version = VersionConstraint.parseFull(token.substring(2), source);
            return new Interval(version, true, version, true);
        } else if (token.startsWith(">=")) {
            return new Interval(VersionConstraint.parseFull(token.substring(2), source), true, null, false);
        } else if (token.startsWith("<=")) {
            return new Interval(null, false, VersionConstraint.parseFull(token.substring(2), source), true);
        } else if (token.startsWith("=")) {
            SemanticVersion version = VersionConstraint.parseFull(token.substring(1), source);
            return new Interval(version, true, version, true);
        } else if (token.startsWith(">")) {
            return new Interval(VersionConstraint.parseFull(token.substring(1), source), false, null, false);
        } else if (token.startsWith("<")) {
            return new Interval(null, false, VersionConstraint.parseFull(token.substring(1), source), false);
        } else if (token.startsWith("^")) {
            SemanticVersion version = VersionConstraint.parseFull(token.substring(1), source);
            SemanticVersion upper;
            if (version.getMajor() != 0) {
                upper = VersionConstraint.lowestOf(version.getMajor() + 1, 0);
            } else {
                upper = VersionConstraint.lowestOf(0, version.getMinor() + 1);
            }
            return new Interval(version, true, upper, false);
        } else if (token.startsWith("~")) {
            SemanticVersion version = VersionConstraint.parseFull(token.substring(1), source);
            SemanticVersion upper;
            if (version.getMinor() == 0 && version.getPatch() == 0) {
                upper = VersionConstraint.lowestOf(version.getMajor() + 1, 0);
            } else {
                upper = VersionConstraint.lowestOf(version.getMajor(), version.getMinor() + 1);
            }
            return new Interval(version, true, upper, false);
        }

        SemanticVersion exact = SemanticVersion.tryParse(token);
        if (exact != null) {
            return new Interval(exact, true, exact, true);
        }

        Matcher partial = VersionConstraint.PARTIAL_VERSION.matcher(token);
        if (!partial.matches()) {
            throw new IllegalArgumentException("Unable to parse \"" + token + "\" within version constraint \"" + source + "\".");
        }
        String major = partial.group(1);
        String minor = partial.group(2);
        if (VersionConstraint.isWildcard(major)) {
            return VersionConstraint.UNBOUNDED;
        }
        int majorValue = Integer.parseInt(major);
        if (minor == null || VersionConstraint.isWildcard(minor)) {
            return new Interval(new SemanticVersion(majorValue, 0, 0), true, VersionConstraint.lowestOf(majorValue + 1, 0), false);
        }
        int minorValue = Integer.parseInt(minor);
        String patch = partial.group(3);
        if (patch == null || VersionConstraint.isWildcard(patch)) {
            return new Interval(new SemanticVersion(majorValue, minorValue, 0), true, VersionConstraint.lowestOf(majorValue, minorValue + 1), false);
        }
        // Unreachable in practice as a complete version would have been caught by SemanticVersion.tryParse
        SemanticVersion version = new SemanticVersion(majorValue, minorValue, Integer.parseInt(patch));
        return new Interval(version, true, version, true);
    }

    @NotNull
    private static SemanticVersion parseFull(@NotNull String text, @NotNull String source) {
        SemanticVersion version = SemanticVersion.tryParse(text);
        if (version != null) {
            return version;
        }
        // Operators also accept partial versions, which are padded with zeros ('>=1.2' equals '>=1.2.0')
        Matcher partial = VersionConstraint.PARTIAL_VERSION.matcher(text.trim());
        if (partial.matches() && !VersionConstraint.isWildcard(partial.group(1))
                && (partial.group(2) == null || !VersionConstraint.isWildcard(partial.group(2)))
                && partial.group(3) == null) {
            int major = Integer.parseInt(partial.group(1));
            int minor = partial.group(2) == null ? 0 : Integer.parseInt(partial.group(2));
            return new SemanticVersion(major, minor, 0);
        }
        throw new IllegalArgumentException("\"" + text + "\" is not a valid version within version constraint \"" + source + "\".");
    }

    private static boolean isWildcard(@NotNull String component) {
        return component.equals("*") || component.equalsIgnoreCase("x");
    }

    // The lowest possible version of a given major.minor line, prereleases included.
    @NotNull
    private static SemanticVersion lowestOf(int major, int minor) {
        return SemanticVersion.parse(major + "." + minor + ".0-0");
    }

    @NotNull
    private static List<@NotNull Interval> intersect(@NotNull List<@NotNull Interval> a, @NotNull List<@NotNull Interval> b) {
        List<@NotNull Interval> result = new ArrayList<>();
        for (Interval left : a) {
            for (Interval right : b) {
                Interval intersection = left.intersect(right);
                if (intersection != null) {
                    result.add(intersection);
                }
            }
        }
        return result;
    }

    @NotNull
    private final List<@NotNull Interval> intervals;
    @NotNull
    private final String text;

    private VersionConstraint(@NotNull List<@NotNull Interval> intervals, @NotNull String text) {
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
        this.text = Objects.requireNonNull(text);
    }

    public boolean containsVersion(@NotNull SemanticVersion version) {
        for (Interval interval : this.intervals) {
            if (interval.contains(version)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Obtains the constraint all versions of which are accepted by both this and the other constraint.
     *
     * <p>Intersecting with one of the sentinels {@link #LATEST} or {@link #MINIMUM} returns the other constraint
     * unchanged, which means that the selection preference of the sentinel is lost.
     *
     * @param other The other constraint
     * @return The intersection, which may be {@link #isEmpty() empty}
     */
    @NotNull
    public VersionConstraint intersect(@NotNull VersionConstraint other) {
        if (this == VersionConstraint.LATEST || this == VersionConstraint.MINIMUM) {
            return other;
        } else if (other == VersionConstraint.LATEST || other == VersionConstraint.MINIMUM) {
            return this;
        }
        return new VersionConstraint(VersionConstraint.intersect(this.intervals, other.intervals),
                VersionConstraint.wrap(this.text) + " && " + VersionConstraint.wrap(other.text));
    }

    @NotNull
    private static String wrap(@NotNull String text) {
        return text.contains("||") ? "(" + text + ")" : text;
    }

    /**
     * Checks whether no version whatsoever can satisfy this constraint.
     *
     * @return True if the constraint is unsatisfiable
     */
    @Contract(pure = true)
    public boolean isEmpty() {
        return this.intervals.isEmpty();
    }

    /**
     * Obtains a description of the normalised intervals of this constraint, mainly for debugging purposes.
     *
     * @return The interval notation of this constraint
     */
    @NotNull
    public String toIntervalString() {
        if (this.intervals.isEmpty()) {
            return "{}";
        }
        StringBuilder builder = new StringBuilder();
        for (Interval interval : this.intervals) {
            builder.append(interval).append(" u ");
        }
        builder.setLength(builder.length() - 3);
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.text;
    }
}

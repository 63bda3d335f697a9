package org.aimux.distribution.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A semantic version as published by plugin releases, that is a version of the form
 * <code>MAJOR.MINOR.PATCH</code> with optional prerelease and build qualifiers.
 * A leading 'v' as commonly used by release tags is accepted and stripped.
 *
 * <p>Ordering follows the semver precedence rules: build metadata is ignored,
 * a prerelease is older than the release it precedes and prerelease identifiers are compared
 * one by one, numeric identifiers being older than alphanumeric ones.
 * As build metadata does not partake in precedence, two versions may compare as equal
 * while still having a different {@link #getOriginText() origin text}. {@link #equals(Object)}
 * is consistent with {@link #compareTo(SemanticVersion)} and thus ignores build metadata too.
 * Use {@link #PRECEDENCE_THEN_ORIGIN} where a strict total order over distinct tags is required.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    /**
     * Orders versions by precedence, breaking ties between versions of equal precedence
     * (e.g. versions that only differ by their build metadata) by lexical order of their origin text.
     */
    @NotNull
    public static final Comparator<SemanticVersion> PRECEDENCE_THEN_ORIGIN = Comparator.<SemanticVersion>naturalOrder()
            .thenComparing(SemanticVersion::getOriginText);

    @NotNull
    public static SemanticVersion parse(@NotNull String string) {
        SemanticVersion version = SemanticVersion.tryParse(string);
        if (version == null) {
            throw new IllegalArgumentException("\"" + string + "\" is not a valid semantic version.");
        }
        return version;
    }

    @Nullable
    public static SemanticVersion tryParse(@Nullable String string) {
        if (string == null) {
            return null;
        }
        String trimmed = string.trim();
        Matcher matcher = SemanticVersion.VERSION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return null;
        }
        try {
            int major = Integer.parseInt(matcher.group(1));
            int minor = Integer.parseInt(matcher.group(2));
            int patch = Integer.parseInt(matcher.group(3));
            return new SemanticVersion(major, minor, patch, matcher.group(4), matcher.group(5), trimmed);
        } catch (NumberFormatException e) {
            // Components which overflow an int are not something any sane release would use
            return null;
        }
    }

    private final int major;
    private final int minor;
    private final int patch;
    @Nullable
    private final String prerelease;
    @NotNull
    private final List<@NotNull Object> prereleaseIdentifiers;
    @Nullable
    private final String build;
    @NotNull
    private final String originText;

    public SemanticVersion(int major, int minor, int patch) {
        this(major, minor, patch, null, null, null);
    }

    private SemanticVersion(int major, int minor, int patch, @Nullable String prerelease, @Nullable String build, @Nullable String originText) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components may not be negative: " + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
        this.build = build;

        if (prerelease == null) {
            this.prereleaseIdentifiers = Collections.emptyList();
        } else {
            List<Object> identifiers = new ArrayList<>();
            for (String identifier : prerelease.split("\\.")) {
                // Numeric identifiers are unbounded
                if (!identifier.isEmpty() && identifier.chars().allMatch(Character::isDigit)) {
                    identifiers.add(new BigInteger(identifier));
                } else {
                    identifiers.add(identifier);
                }
            }
            this.prereleaseIdentifiers = Collections.unmodifiableList(identifiers);
        }

        if (originText == null) {
            StringBuilder builder = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
            if (prerelease != null) {
                builder.append('-').append(prerelease);
            }
            if (build != null) {
                builder.append('+').append(build);
            }
            this.originText = builder.toString();
        } else {
            this.originText = originText;
        }
    }

    @Override
    public int compareTo(@NotNull SemanticVersion other) {
        if (this.major != other.major) {
            return Integer.compare(this.major, other.major);
        } else if (this.minor != other.minor) {
            return Integer.compare(this.minor, other.minor);
        } else if (this.patch != other.patch) {
            return Integer.compare(this.patch, other.patch);
        }

        boolean thisPre = this.isPrerelease();
        boolean otherPre = other.isPrerelease();
        if (!thisPre) {
            return otherPre ? 1 : 0;
        } else if (!otherPre) {
            return -1;
        }

        int length = Math.min(this.prereleaseIdentifiers.size(), other.prereleaseIdentifiers.size());
        for (int i = 0; i < length; i++) {
            Object a = this.prereleaseIdentifiers.get(i);
            Object b = other.prereleaseIdentifiers.get(i);
            if (a instanceof BigInteger) {
                if (b instanceof BigInteger) {
                    int cmp = ((BigInteger) a).compareTo((BigInteger) b);
                    if (cmp != 0) {
                        return cmp;
                    }
                } else {
                    return -1; // Numeric identifiers always have lower precedence
                }
            } else if (b instanceof BigInteger) {
                return 1;
            } else {
                int cmp = ((String) a).compareTo((String) b);
                if (cmp != 0) {
                    return cmp;
                }
            }
        }
        return Integer.compare(this.prereleaseIdentifiers.size(), other.prereleaseIdentifiers.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof SemanticVersion) {
            return this.compareTo((SemanticVersion) obj) == 0;
        }
        return false;
    }

    @Nullable
    @Contract(pure = true)
    public String getBuild() {
        return this.build;
    }

    @Contract(pure = true)
    public int getMajor() {
        return this.major;
    }

    @Contract(pure = true)
    public int getMinor() {
        return this.minor;
    }

    /**
     * Obtains the string this version was parsed from, including a leading 'v' if it was present.
     * Release lookups should use this string instead of {@link #toString()} as tags are matched literally.
     *
     * @return The origin text
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Contract(pure = true)
    public int getPatch() {
        return this.patch;
    }

    @Nullable
    @Contract(pure = true)
    public String getPrerelease() {
        return this.prerelease;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.major, this.minor, this.patch, this.prereleaseIdentifiers);
    }

    /**
     * Checks whether this version is API-compatible with the required version.
     * The major version must match, and while in initial development (major version 0)
     * any change is considered to be breaking, in which case the versions must be equal.
     *
     * @param required The version which is required
     * @return True if this version can stand in for the required version
     */
    @Contract(pure = true)
    public boolean isCompatibleWith(@NotNull SemanticVersion required) {
        if (this.major != required.major) {
            return false;
        } else if (this.major == 0) {
            return this.equals(required);
        }
        return this.compareTo(required) >= 0;
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull SemanticVersion other) {
        return this.compareTo(other) > 0;
    }

    @Contract(pure = true)
    public boolean isPrerelease() {
        return this.prerelease != null;
    }

    /**
     * Returns the lowest version whose major component is one higher than the major component of this version.
     *
     * @return The next major version, without prerelease or build qualifiers
     */
    @NotNull
    @Contract(pure = true)
    public SemanticVersion nextMajor() {
        return new SemanticVersion(this.major + 1, 0, 0);
    }

    @NotNull
    @Contract(pure = true)
    public SemanticVersion nextMinor() {
        return new SemanticVersion(this.major, this.minor + 1, 0);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder().append(this.major).append('.').append(this.minor).append('.').append(this.patch);
        if (this.prerelease != null) {
            builder.append('-').append(this.prerelease);
        }
        if (this.build != null) {
            builder.append('+').append(this.build);
        }
        return builder.toString();
    }
}

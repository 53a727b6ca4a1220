package com.lwcmobile.versioning;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A three-component version (major.minor.patch).
 *
 * <p>Ordering uses a fixed decimal weighting, {@code major * 100 + minor * 10 + patch}, so a
 * minor or patch of 10 or more carries into the next component: {@code 1.10.0} compares equal
 * to {@code 2.0.0}. Because that ordering is not consistent with {@link #equals(Object)} this
 * type does not implement {@link Comparable}.
 *
 * @param major the major component
 * @param minor the minor component
 * @param patch the patch component
 */
public record Version(int major, int minor, int patch) {
    private static final Pattern ACCEPTED_CHARACTERS = Pattern.compile("[0-9.\\-]*");

    public Version {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative: "
                    + major + "." + minor + "." + patch);
        }
    }

    /**
     * Parses a version such as {@code 13.0.4}, {@code 13-0-4} or {@code 13}.
     * Missing trailing components default to zero and anything after the patch is ignored.
     */
    public static Version parse(String input) {
        if (input == null) {
            throw new VersionParseException(null);
        }
        String normalized = trimWhitespace(input).toLowerCase(Locale.ROOT);
        if (!ACCEPTED_CHARACTERS.matcher(normalized).matches()) {
            throw new VersionParseException(input);
        }

        // keep trailing empty segments so "13.0." is rejected
        String[] parts = normalized.replace('-', '.').split("\\.", -1);
        int major = component(parts, 0, input);
        int minor = component(parts, 1, input);
        int patch = component(parts, 2, input);
        return new Version(major, minor, patch);
    }

    // strip() alone keeps no-break spaces and the byte order mark
    private static String trimWhitespace(String input) {
        int start = 0;
        int end = input.length();
        while (start < end && isTrimmable(input.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(input.charAt(end - 1))) {
            end--;
        }
        return input.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    private static int component(String[] parts, int index, String input) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index], 10);
        } catch (NumberFormatException e) {
            throw new VersionParseException(input, e);
        }
    }

    // -1 older, 0 same, 1 newer
    public int compare(Version other) {
        long mine = scalar();
        long theirs = other.scalar();
        if (mine == theirs) {
            return 0;
        }
        return mine < theirs ? -1 : 1;
    }

    public boolean same(Version other) {
        return compare(other) == 0;
    }

    public boolean sameOrNewer(Version other) {
        return compare(other) > -1;
    }

    private long scalar() {
        return major * 100L + minor * 10L + patch;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}

package de.bsommerfeld.feedupdate.version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed semantic version with Semantic Versioning 2.0 precedence.
 *
 * <h3>Accepted input</h3>
 * <ul>
 * <li>optional leading {@code v} or {@code V} ({@code v2.1.0})</li>
 * <li>one to three numeric components; missing minor and patch default to 0
 * ({@code 2} equals {@code 2.0.0})</li>
 * <li>optional pre-release tag after {@code -} ({@code 2.0.0-beta.2})</li>
 * <li>optional build metadata after {@code +}, ignored for ordering</li>
 * </ul>
 *
 * <h3>Ordering</h3>
 * Numeric components compare as numbers, never as strings, so
 * {@code 10.0.0 > 9.0.0}. A pre-release sorts before its release. Pre-release
 * identifiers compare numerically when both are numeric, lexically otherwise,
 * and a numeric identifier sorts before an alphanumeric one.
 *
 * @param major      major component
 * @param minor      minor component
 * @param patch      patch component
 * @param preRelease dot-separated pre-release identifiers, empty for a release
 * @param build      build metadata, or {@code null}
 */
public record SemanticVersion(long major, long minor, long patch, List<String> preRelease, String build)
        implements Comparable<SemanticVersion> {

    private static final Pattern PATTERN = Pattern.compile(
            "[vV]?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?"
                    + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
                    + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?");

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
        preRelease = preRelease == null ? List.of() : List.copyOf(preRelease);
    }

    public static SemanticVersion of(long major, long minor, long patch) {
        return new SemanticVersion(major, minor, patch, List.of(), null);
    }

    /**
     * Parses a version string.
     *
     * @throws IllegalArgumentException if {@code text} is not a semantic version
     */
    public static SemanticVersion parse(String text) {
        return tryParse(text).orElseThrow(
                () -> new IllegalArgumentException("Not a semantic version: '" + text + "'"));
    }

    /** Parses a version string, returning empty instead of throwing on bad input. */
    public static Optional<SemanticVersion> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(text.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long major = Long.parseLong(matcher.group(1));
            long minor = matcher.group(2) == null ? 0 : Long.parseLong(matcher.group(2));
            long patch = matcher.group(3) == null ? 0 : Long.parseLong(matcher.group(3));
            List<String> preRelease = matcher.group(4) == null
                    ? List.of()
                    : List.of(matcher.group(4).split("\\."));
            return Optional.of(new SemanticVersion(major, minor, patch, preRelease, matcher.group(5)));
        } catch (NumberFormatException e) {
            // component overflows a long
            return Optional.empty();
        }
    }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    public boolean isNewerThan(SemanticVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(major, other.major);
        if (result != 0)
            return result;
        result = Long.compare(minor, other.minor);
        if (result != 0)
            return result;
        result = Long.compare(patch, other.patch);
        if (result != 0)
            return result;
        return comparePreRelease(preRelease, other.preRelease);
    }

    /**
     * Equality follows precedence: build metadata does not distinguish versions.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SemanticVersion))
            return false;
        SemanticVersion that = (SemanticVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch
                && preRelease.equals(that.preRelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (!preRelease.isEmpty()) {
            sb.append('-').append(String.join(".", preRelease));
        }
        if (build != null) {
            sb.append('+').append(build);
        }
        return sb.toString();
    }

    private static int comparePreRelease(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            // a release outranks any of its pre-releases
            return Boolean.compare(a.isEmpty(), b.isEmpty());
        }
        int shared = Math.min(a.size(), b.size());
        for (int i = 0; i < shared; i++) {
            int result = compareIdentifier(a.get(i), b.get(i));
            if (result != 0)
                return result;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareIdentifier(String a, String b) {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            // compare by length first so arbitrarily long identifiers never overflow
            String x = stripLeadingZeros(a);
            String y = stripLeadingZeros(b);
            return x.length() != y.length() ? Integer.compare(x.length(), y.length()) : x.compareTo(y);
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String identifier) {
        for (int i = 0; i < identifier.length(); i++) {
            if (!Character.isDigit(identifier.charAt(i)))
                return false;
        }
        return !identifier.isEmpty();
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0')
            i++;
        return digits.substring(i);
    }
}

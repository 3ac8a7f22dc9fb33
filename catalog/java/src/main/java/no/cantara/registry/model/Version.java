package no.cantara.registry.model;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import no.cantara.registry.MalformedVersionException;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A semantic version {@code major.minor.patch[-prerelease][+build]}.
 *
 * <p>Ordering follows semver precedence: major, minor and patch compare numerically,
 * and a version carrying a pre-release tag sorts before the same release without one.
 * Build metadata takes no part in ordering or equality.
 */
public final class Version implements Comparable<Version> {

    // semver.org 2.0.0: no leading zeros, no empty identifiers, [0-9A-Za-z-] only.
    private static final Pattern SEMVER = Pattern.compile(
            "(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
                    + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    private final Semver semver;
    private final int major;
    private final int minor;
    private final int patch;
    private final List<String> preRelease;

    private Version(Semver semver, int major, int minor, int patch, List<String> preRelease) {
        this.semver = semver;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.preRelease = preRelease;
    }

    /**
     * Parses a strict semantic version.
     *
     * @throws MalformedVersionException if {@code value} is null, blank or not a full semver
     */
    public static Version parse(String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedVersionException(String.valueOf(value), null);
        }
        String text = value.trim();
        Matcher m = SEMVER.matcher(text);
        if (!m.matches()) {
            throw new MalformedVersionException(value, null);
        }
        try {
            return new Version(
                    new Semver(text, Semver.SemverType.STRICT),
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    m.group(4) != null ? List.of(m.group(4).split("\\.")) : List.of());
        } catch (SemverException e) {
            throw new MalformedVersionException(value, e);
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            throw new MalformedVersionException(value, e);
        }
    }

    public int major() { return major; }
    public int minor() { return minor; }
    public int patch() { return patch; }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    /** {@code true} when this version has strictly greater precedence than {@code other}. */
    public boolean isNewerThan(Version other) {
        return compareTo(other) > 0;
    }

    Semver semver() {
        return semver;
    }

    @Override
    public int compareTo(Version other) {
        int c = Integer.compare(major, other.major);
        if (c == 0) c = Integer.compare(minor, other.minor);
        if (c == 0) c = Integer.compare(patch, other.patch);
        return c != 0 ? c : comparePreRelease(preRelease, other.preRelease);
    }

    // A release outranks its pre-releases; identifiers compare left to right.
    private static int comparePreRelease(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return Boolean.compare(a.isEmpty(), b.isEmpty());
        }
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = compareIdentifier(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    // Numeric identifiers have no leading zeros, so length orders them before digits do.
    private static int compareIdentifier(String a, String b) {
        boolean numericA = NUMERIC.matcher(a).matches();
        boolean numericB = NUMERIC.matcher(b).matches();
        if (numericA && numericB) {
            int c = Integer.compare(a.length(), b.length());
            return c != 0 ? c : a.compareTo(b);
        }
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Version that)) return false;
        return compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    /** The version text as it was parsed. */
    @Override
    public String toString() {
        return semver.getValue();
    }
}

package no.cantara.registry.model;

import no.cantara.registry.MalformedVersionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionTest {

    private static final List<String> ORDERED = List.of(
            "0.9.9", "1.0.0-alpha", "1.0.0-beta", "1.0.0", "1.0.1", "1.2.0", "1.10.0", "2.0.0-rc.1", "2.0.0", "10.0.0");

    @Test
    void parsesComponents() {
        Version v = Version.parse("7.6.2");
        assertEquals(7, v.major());
        assertEquals(6, v.minor());
        assertEquals(2, v.patch());
        assertFalse(v.isPreRelease());
        assertEquals("7.6.2", v.toString());
    }

    @Test
    void comparesNumericallyNotTextually() {
        assertTrue(Version.parse("1.10.0").isNewerThan(Version.parse("1.2.0")));
        assertTrue(Version.parse("10.0.0").isNewerThan(Version.parse("9.9.9")));
    }

    @Test
    void preReleaseSortsBeforeRelease() {
        Version rc = Version.parse("2.0.0-rc.1");
        Version ga = Version.parse("2.0.0");
        assertTrue(rc.isPreRelease());
        assertTrue(rc.compareTo(ga) < 0);
        assertTrue(ga.isNewerThan(rc));
        assertTrue(rc.isNewerThan(Version.parse("1.9.9")));
    }

    @Test
    void isNewerThanIsStrict() {
        Version v = Version.parse("1.0.0");
        assertFalse(v.isNewerThan(Version.parse("1.0.0")));
    }

    @Test
    void buildMetadataDoesNotAffectEquality() {
        Version a = Version.parse("1.0.0+build.1");
        Version b = Version.parse("1.0.0+build.2");
        assertEquals(0, a.compareTo(b));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void sortingShuffledVersionsRestoresPrecedence() {
        List<Version> shuffled = new ArrayList<>(ORDERED.stream().map(Version::parse).toList());
        Collections.shuffle(shuffled, new java.util.Random(42));
        Collections.sort(shuffled);
        assertEquals(ORDERED, shuffled.stream().map(Version::toString).toList());
    }

    @Test
    void comparisonIsATotalOrder() {
        List<Version> versions = ORDERED.stream().map(Version::parse).toList();
        for (Version a : versions) {
            for (Version b : versions) {
                int ab = Integer.signum(a.compareTo(b));
                int ba = Integer.signum(b.compareTo(a));
                assertEquals(-ab, ba, a + " vs " + b);
                assertEquals(a.equals(b), ab == 0, a + " vs " + b);
                for (Version c : versions) {
                    if (a.compareTo(b) < 0 && b.compareTo(c) < 0) {
                        assertTrue(a.compareTo(c) < 0, a + " < " + b + " < " + c);
                    }
                }
            }
        }
    }

    @Test
    void rejectsMalformedVersions() {
        assertThrows(MalformedVersionException.class, () -> Version.parse("1.0"));
        assertThrows(MalformedVersionException.class, () -> Version.parse("latest"));
        assertThrows(MalformedVersionException.class, () -> Version.parse(""));
        assertThrows(MalformedVersionException.class, () -> Version.parse(null));
    }

    @Test
    void rejectsVersionsOutsideSemverGrammar() {
        for (String s : List.of("1.0.0-", "01.0.0", "1.01.0", "1.0.0-alpha..1", "1.0.0-a_b", "1.0.0-01",
                "1.0.0+", "v1.0.0", "1.0.0.0")) {
            assertThrows(MalformedVersionException.class, () -> Version.parse(s), s);
        }
    }

    @Test
    void hyphenatedIdentifierIsAlphanumeric() {
        Version hyphen = Version.parse("1.0.0-rc.-5");
        assertTrue(hyphen.isPreRelease());
        assertTrue(hyphen.isNewerThan(Version.parse("1.0.0-rc.5")));
        assertTrue(hyphen.isNewerThan(Version.parse("1.0.0-rc.99999999999")));
        assertTrue(Version.parse("1.0.0").isNewerThan(hyphen));
    }

    @Test
    void numericIdentifiersCompareByValue() {
        assertTrue(Version.parse("1.0.0-rc.10").isNewerThan(Version.parse("1.0.0-rc.9")));
        assertTrue(Version.parse("1.0.0-rc.99999999999").isNewerThan(Version.parse("1.0.0-rc.2147483647")));
        assertTrue(Version.parse("1.0.0-alpha").isNewerThan(Version.parse("1.0.0-1")));
        assertTrue(Version.parse("1.0.0-alpha.1").isNewerThan(Version.parse("1.0.0-alpha")));
    }

    @Test
    void malformedVersionKeepsInput() {
        MalformedVersionException e = assertThrows(MalformedVersionException.class, () -> Version.parse("seven"));
        assertEquals("seven", e.input());
        assertTrue(e.getMessage().contains("seven"));
    }
}

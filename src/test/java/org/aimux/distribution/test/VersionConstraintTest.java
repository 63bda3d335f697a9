package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.junit.jupiter.api.Test;

public class VersionConstraintTest {

    private static boolean contains(String constraint, String version) {
        return VersionConstraint.parse(constraint).containsVersion(SemanticVersion.parse(version));
    }

    @Test
    public void testComparators() {
        assertTrue(contains(">=1.0.0", "1.0.0"));
        assertFalse(contains(">1.0.0", "1.0.0"));
        assertTrue(contains("<2.0.0", "1.9.9"));
        assertFalse(contains("<2.0.0", "2.0.0"));
        assertTrue(contains("<=2.0.0", "2.0.0"));
        assertTrue(contains("=1.2.3", "1.2.3"));
        assertTrue(contains("==1.2.3", "1.2.3"));
        assertTrue(contains("1.2.3", "1.2.3"));
        assertFalse(contains("1.2.3", "1.2.4"));
        assertTrue(contains(">= 1.0.0", "1.5.0"));
    }

    @Test
    public void testCompatibleRanges() {
        assertTrue(contains("^1.2.3", "1.2.3"));
        assertTrue(contains("^1.2.3", "1.9.0"));
        assertFalse(contains("^1.2.3", "2.0.0"));
        assertFalse(contains("^1.2.3", "1.2.2"));
        assertTrue(contains("^0.2.3", "0.2.9"));
        assertFalse(contains("^0.2.3", "0.3.0"));

        assertTrue(contains("~1.2.3", "1.2.9"));
        assertFalse(contains("~1.2.3", "1.3.0"));
    }

    @Test
    public void testWildcardsAndHyphens() {
        assertTrue(contains("*", "0.0.1"));
        assertTrue(contains("1.*", "1.4.0"));
        assertFalse(contains("1.*", "2.0.0"));
        assertTrue(contains("1.2.x", "1.2.7"));
        assertFalse(contains("1.2.x", "1.3.0"));
        assertTrue(contains("1.2", "1.2.5"));
        assertTrue(contains("1.0.0 - 2.0.0", "2.0.0"));
        assertTrue(contains("1.0.0 - 2.0.0", "1.0.0"));
        assertFalse(contains("1.0.0 - 2.0.0", "2.0.1"));
    }

    @Test
    public void testConjunctionsAndDisjunctions() {
        assertTrue(contains(">=1.0.0,<2.0.0", "1.5.0"));
        assertFalse(contains(">=1.0.0,<2.0.0", "2.0.0"));
        assertTrue(contains(">=1.0.0 && <2.0.0", "1.0.0"));
        assertTrue(contains(">=1.0.0 <2.0.0", "1.0.0"));
        assertTrue(contains("^1.0.0 || ^3.0.0", "3.1.0"));
        assertFalse(contains("^1.0.0 || ^3.0.0", "2.1.0"));
    }

    @Test
    public void testIntersection() {
        VersionConstraint a = VersionConstraint.parse(">=1.0.0,<2.0.0");
        VersionConstraint b = VersionConstraint.parse(">=2.0.0");
        assertTrue(a.intersect(b).isEmpty());
        assertTrue(b.intersect(a).isEmpty());

        VersionConstraint c = VersionConstraint.parse("^1.2.0").intersect(VersionConstraint.parse("<1.5.0"));
        assertFalse(c.isEmpty());
        assertTrue(c.containsVersion(SemanticVersion.parse("1.4.9")));
        assertFalse(c.containsVersion(SemanticVersion.parse("1.5.0")));
        assertFalse(c.containsVersion(SemanticVersion.parse("1.1.0")));

        // Touching bounds are only non-empty if both ends are inclusive
        assertTrue(VersionConstraint.parse("<=1.0.0").intersect(VersionConstraint.parse(">1.0.0")).isEmpty());
        assertFalse(VersionConstraint.parse("<=1.0.0").intersect(VersionConstraint.parse(">=1.0.0")).isEmpty());
    }

    @Test
    public void testSentinels() {
        assertSame(VersionConstraint.LATEST, VersionConstraint.parse("latest"));
        assertSame(VersionConstraint.MINIMUM, VersionConstraint.parse("MINIMUM"));
        assertTrue(VersionConstraint.LATEST.containsVersion(SemanticVersion.parse("0.0.1")));
        assertTrue(VersionConstraint.MINIMUM.containsVersion(SemanticVersion.parse("99.0.0")));

        VersionConstraint range = VersionConstraint.parse("^1.0.0");
        assertSame(range, VersionConstraint.LATEST.intersect(range));
        assertSame(range, range.intersect(VersionConstraint.MINIMUM));
    }

    @Test
    public void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> VersionConstraint.parse(""));
        assertThrows(IllegalArgumentException.class, () -> VersionConstraint.parse(">="));
        assertThrows(IllegalArgumentException.class, () -> VersionConstraint.parse("^1.0.0 ||"));
        assertThrows(IllegalArgumentException.class, () -> VersionConstraint.parse("abc"));
    }
}

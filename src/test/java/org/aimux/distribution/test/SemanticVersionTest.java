package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.aimux.distribution.version.SemanticVersion;
import org.junit.jupiter.api.Test;

public class SemanticVersionTest {

    private static int signum(int value) {
        return Integer.signum(value);
    }

    @Test
    public void testOrdering() {
        assertTrue(SemanticVersion.parse("1.0.0").compareTo(SemanticVersion.parse("1.0.1")) < 0);
        assertTrue(SemanticVersion.parse("1.0.1").compareTo(SemanticVersion.parse("1.1.0")) < 0);
        assertTrue(SemanticVersion.parse("1.1.0").compareTo(SemanticVersion.parse("2.0.0")) < 0);
        assertTrue(SemanticVersion.parse("1.10.0").compareTo(SemanticVersion.parse("1.9.0")) > 0);
        assertTrue(SemanticVersion.parse("2.0.0").compareTo(SemanticVersion.parse("1.99.99")) > 0);
    }

    @Test
    public void testPrereleasePrecedence() {
        String[] ascending = {"1.0.0-alpha", "1.0.0-alpha.1", "1.0.0-alpha.beta", "1.0.0-beta", "1.0.0-beta.2", "1.0.0-beta.11", "1.0.0-rc.1", "1.0.0"};
        for (int i = 0; i < ascending.length - 1; i++) {
            SemanticVersion lower = SemanticVersion.parse(ascending[i]);
            SemanticVersion higher = SemanticVersion.parse(ascending[i + 1]);
            assertTrue(lower.compareTo(higher) < 0, ascending[i] + " < " + ascending[i + 1]);
            assertTrue(higher.compareTo(lower) > 0, ascending[i + 1] + " > " + ascending[i]);
        }
        assertTrue(SemanticVersion.parse("1.0.0-rc.1").isPrerelease());
        assertFalse(SemanticVersion.parse("1.0.0").isPrerelease());
    }

    @Test
    public void testLongNumericPrereleaseIdentifiers() {
        // Beyond the range of a long, numeric identifiers still compare by value
        SemanticVersion nine = SemanticVersion.parse("1.0.0-rc.9");
        SemanticVersion huge = SemanticVersion.parse("1.0.0-rc.10000000000000000000");
        SemanticVersion huger = SemanticVersion.parse("1.0.0-rc.20000000000000000000");
        assertTrue(nine.compareTo(huge) < 0);
        assertTrue(huge.compareTo(huger) < 0);
        assertTrue(SemanticVersion.parse("1.0.0-rc.99999999999999999999").compareTo(SemanticVersion.parse("1.0.0-rc.100000000000000000000")) < 0);
        // Numeric identifiers still precede alphanumeric ones
        assertTrue(huger.compareTo(SemanticVersion.parse("1.0.0-rc.a")) < 0);
        assertEquals(huge, SemanticVersion.parse("1.0.0-rc.10000000000000000000"));
        assertEquals(huge.hashCode(), SemanticVersion.parse("1.0.0-rc.10000000000000000000").hashCode());
    }

    @Test
    public void testTotalOrder() {
        List<SemanticVersion> versions = new ArrayList<>();
        for (String text : new String[] {"0.0.1", "0.1.0", "1.0.0-0", "1.0.0-alpha", "1.0.0", "1.0.0+build.5", "1.0.1", "1.2.0-rc.1", "1.2.0", "10.0.0"}) {
            versions.add(SemanticVersion.parse(text));
        }
        for (SemanticVersion a : versions) {
            for (SemanticVersion b : versions) {
                assertEquals(signum(a.compareTo(b)), -signum(b.compareTo(a)), a + " vs " + b);
                for (SemanticVersion c : versions) {
                    if (a.compareTo(b) <= 0 && b.compareTo(c) <= 0) {
                        assertTrue(a.compareTo(c) <= 0, a + " <= " + b + " <= " + c);
                    }
                }
            }
        }
    }

    @Test
    public void testBuildMetadata() {
        SemanticVersion plain = SemanticVersion.parse("1.0.0");
        SemanticVersion build = SemanticVersion.parse("1.0.0+20240101");
        assertEquals(0, plain.compareTo(build));
        assertEquals(plain, build);
        assertEquals("20240101", build.getBuild());

        List<SemanticVersion> versions = new ArrayList<>(List.of(SemanticVersion.parse("1.0.0+b"), SemanticVersion.parse("1.0.0+a")));
        Collections.sort(versions, SemanticVersion.PRECEDENCE_THEN_ORIGIN);
        assertEquals("1.0.0+a", versions.get(0).getOriginText());
    }

    @Test
    public void testParsing() {
        SemanticVersion version = SemanticVersion.parse("v2.3.4-beta.1");
        assertEquals(2, version.getMajor());
        assertEquals(3, version.getMinor());
        assertEquals(4, version.getPatch());
        assertEquals("beta.1", version.getPrerelease());
        assertEquals("2.3.4-beta.1", version.toString());
        assertEquals("v2.3.4-beta.1", version.getOriginText());
        assertEquals(SemanticVersion.parse("2.3.4-beta.1"), version);

        assertNull(SemanticVersion.tryParse("1.0"));
        assertNull(SemanticVersion.tryParse("latest"));
        assertNull(SemanticVersion.tryParse(null));
        assertNull(SemanticVersion.tryParse("99999999999.0.0"));
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("1.0.0.0"));
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse(""));
        assertNotEquals(SemanticVersion.parse("1.0.0"), SemanticVersion.parse("1.0.0-rc.1"));
    }
}

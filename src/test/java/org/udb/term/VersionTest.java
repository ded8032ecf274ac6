package org.udb.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class VersionTest {

    @Test
    @DisplayName("Le componenti mancanti valgono zero")
    void missingComponentsAreZero() {
        assertEquals(Version.parse("1.0"), Version.parse("1.0.0"));
        assertEquals(Version.parse("1.0").hashCode(), Version.parse("1.0.0").hashCode());
        assertEquals(0, Version.parse("2").compareTo(Version.parse("2.0.0")));
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 1.1, -1",
            "1.10, 1.9, 1",
            "2.0.1, 2.0.0, 1",
            "0.9.9, 1.0, -1"
    })
    void ordering(String a, String b, int expectedSign) {
        assertEquals(expectedSign, Integer.signum(Version.parse(a).compareTo(Version.parse(b))));
    }

    @Test
    void patchArithmetic() {
        assertEquals(Version.parse("1.2.4"), Version.parse("1.2.3").incrementPatch());
        assertEquals(Version.parse("1.2.2"), Version.parse("1.2.3").decrementPatch());
        assertTrue(Version.parse("1.0").decrementPatch().compareTo(Version.parse("1.0")) < 0);
        assertTrue(Version.parse("1.0").decrementPatch().compareTo(Version.parse("0.9")) > 0);
        assertTrue(Version.ZERO.isZero());
        assertTrue(Version.parse("0.0.0").isZero());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "1.x", "a.b", "1.-2"})
    @DisplayName("Versioni non valide sono rifiutate")
    void rejectsMalformed(String text) {
        assertThrows(IllegalArgumentException.class, () -> Version.parse(text));
    }
}

package org.udb.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionTermTest {

    @Nested
    @DisplayName("Interpretazione dei requisiti")
    class Requirements {

        @Test
        void missingRequirementMeansAnyVersion() {
            ExtensionTerm any = ExtensionTerm.fromRequirement("C", null);
            assertEquals(ExtensionTerm.ComparisonOp.GREATER_THAN_OR_EQUAL, any.comparison());
            assertTrue(any.matchesAnyVersion());
            assertEquals(any, ExtensionTerm.fromRequirement("C", "  "));
        }

        @Test
        void bareVersionIsExact() {
            ExtensionTerm t = ExtensionTerm.fromRequirement("Zba", "1.0");
            assertTrue(t.isExact());
            assertEquals(ExtensionTerm.exact("Zba", "1.0.0"), t);
        }

        @Test
        void operatorsAreRecognised() {
            assertEquals(ExtensionTerm.ComparisonOp.COMPATIBLE, ExtensionTerm.fromRequirement("A", "~> 1.1").comparison());
            assertEquals(ExtensionTerm.ComparisonOp.LESS_THAN, ExtensionTerm.fromRequirement("A", "<2.0").comparison());
            assertEquals(">= 1.0", ExtensionTerm.fromRequirement("A", ">=1.0").requirement());
        }

        @Test
        void unknownOperatorIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> ExtensionTerm.fromRequirement("A", "=> 1.0"));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "'= 1.0',  1.0,   true",
            "'= 1.0',  1.1,   false",
            "'>= 1.1', 1.1,   true",
            "'>= 1.1', 1.0,   false",
            "'> 1.1',  1.1,   false",
            "'< 2.0',  1.9.9, true",
            "'<= 2.0', 2.0,   true",
            "'~> 1.1', 1.5,   true",
            "'~> 1.1', 1.0,   false",
            "'~> 1.1', 2.0,   false"
    })
    void satisfiedBy(String requirement, String candidate, boolean expected) {
        assertEquals(expected, ExtensionTerm.fromRequirement("A", requirement).satisfiedBy(Version.parse(candidate)));
    }

    @Test
    void otherExtensionNeverSatisfies() {
        assertFalse(ExtensionTerm.fromRequirement("A", ">= 0").satisfiedBy("B", Version.parse("1.0")));
    }

    @Test
    @DisplayName("Versioni possibili agli estremi")
    void possibleVersionBounds() {
        assertEquals(Version.parse("1.0.1"), ExtensionTerm.fromRequirement("A", "> 1.0").minPossibleVersion());
        assertTrue(ExtensionTerm.fromRequirement("A", ">= 1.0").maxPossibleVersion().isZero());
        assertNull(ExtensionTerm.fromRequirement("A", "< 0").maxPossibleVersion());
        assertEquals(Version.parse("1.2"), ExtensionTerm.fromRequirement("A", "~> 1.2").maxPossibleVersion());
    }

    @Test
    @DisplayName("Ordinamento: per nome, poi per versione")
    void ordering() {
        List<Term> terms = new ArrayList<>(List.of(
                ExtensionTerm.exact("B", "1.0"),
                ExtensionTerm.exact("A", "2.0"),
                ExtensionTerm.exact("A", "1.0")));
        Collections.sort(terms);
        assertEquals(List.of(
                ExtensionTerm.exact("A", "1.0"),
                ExtensionTerm.exact("A", "2.0"),
                ExtensionTerm.exact("B", "1.0")), terms);
    }

    @Test
    void renderings() {
        ExtensionTerm exact = ExtensionTerm.exact("Zicsr", "2.0");
        ExtensionTerm range = ExtensionTerm.fromRequirement("Zicsr", ">= 2.0");
        assertEquals("Zicsr@2.0", exact.toString());
        assertEquals("Zicsr>=2.0", range.toString());
        assertEquals("implemented?(ExtensionName::Zicsr)", ExtensionTerm.fromRequirement("Zicsr", null).toIdl());
        assertEquals("implemented_version?(ExtensionName::Zicsr, \">= 2.0\")", range.toIdl());
        assertEquals("`Zicsr`", range.toAsciidoc(false));
        assertEquals(Map.of("name", "Zicsr", "version", "= 2.0"), exact.toDeclarative());
    }
}

package org.udb.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterTermTest {

    private static ParameterTerm param(Object... keyValues) {
        java.util.LinkedHashMap<String, Object> record = new java.util.LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new ParameterTerm(record);
    }

    @Nested
    @DisplayName("Validazione del record")
    class Validation {

        @Test
        void requiresName() {
            assertThrows(IllegalArgumentException.class, () -> new ParameterTerm(Map.of("equal", 1)));
        }

        @Test
        void requiresExactlyOneComparison() {
            assertThrows(IllegalArgumentException.class, () -> param("name", "X"));
            assertThrows(IllegalArgumentException.class, () -> param("name", "X", "equal", 1, "less_than", 3));
        }

        @Test
        void rejectsUnknownKeys() {
            assertThrows(IllegalArgumentException.class, () -> param("name", "X", "equal", 1, "colour", "red"));
        }
    }

    @Nested
    @DisplayName("Valutazione")
    class Evaluation {

        @Test
        void scalarComparisons() {
            Map<String, Object> values = Map.of("MXLEN", 64, "MODE", "direct");
            assertEquals(SatisfiedResult.YES, param("name", "MXLEN", "equal", 64).evaluate(values));
            assertEquals(SatisfiedResult.NO, param("name", "MXLEN", "less_than", 64).evaluate(values));
            assertEquals(SatisfiedResult.YES, param("name", "MXLEN", "greater_than_or_equal", 32L).evaluate(values));
            assertEquals(SatisfiedResult.YES, param("name", "MODE", "oneOf", List.of("direct", "vectored")).evaluate(values));
            assertEquals(SatisfiedResult.NO, param("name", "MODE", "not_equal", "direct").evaluate(values));
        }

        @Test
        void unknownParameterIsMaybe() {
            assertEquals(SatisfiedResult.MAYBE, param("name", "VLEN", "equal", 128).evaluate(Map.of()));
        }

        @Test
        void arrayComparisons() {
            Map<String, Object> values = Map.of("HPM", List.of(3, 4, 5));
            assertEquals(SatisfiedResult.YES, param("name", "HPM", "index", 1, "equal", 4).evaluate(values));
            assertEquals(SatisfiedResult.YES, param("name", "HPM", "includes", 5).evaluate(values));
            assertEquals(SatisfiedResult.NO, param("name", "HPM", "includes", 7).evaluate(values));
            assertEquals(SatisfiedResult.YES, param("name", "HPM", "size", true, "equal", 3).evaluate(values));
        }

        @Test
        void listWithoutArrayScopeIsAnError() {
            Map<String, Object> values = Map.of("HPM", List.of(3, 4, 5));
            assertThrows(IllegalArgumentException.class, () -> param("name", "HPM", "equal", 3).evaluate(values));
            assertThrows(IllegalArgumentException.class,
                    () -> param("name", "HPM", "index", 9, "equal", 3).evaluate(values));
        }

        @Test
        void bitRangeOfScalar() {
            Map<String, Object> values = Map.of("MISA", 0b1010_0000);
            assertEquals(SatisfiedResult.YES, param("name", "MISA", "range", "7-4", "equal", 0b1010).evaluate(values));
        }
    }

    @Test
    @DisplayName("Negazione sintattica dei confronti scalari")
    void negation() {
        assertEquals(param("name", "X", "greater_than_or_equal", 4), param("name", "X", "less_than", 4).negate());
        assertEquals(param("name", "X", "equal", 1), param("name", "X", "not_equal", 1).negate());
        assertNull(param("name", "X", "includes", 1).negate());
        assertNull(param("name", "X", "oneOf", List.of(1, 2)).negate());
    }

    @Nested
    @DisplayName("Relazioni tra confronti sullo stesso parametro")
    class Relations {

        @Test
        void equalityImpliesWiderRange() {
            assertEquals(ParameterTerm.Relation.IMPLIES,
                    param("name", "X", "equal", 5).relationTo(param("name", "X", "greater_than", 3)));
        }

        @Test
        void disjointRangesExclude() {
            assertEquals(ParameterTerm.Relation.EXCLUDES,
                    param("name", "X", "less_than", 3).relationTo(param("name", "X", "greater_than", 5)));
            assertEquals(ParameterTerm.Relation.EXCLUDES,
                    param("name", "X", "equal", 5).relationTo(param("name", "X", "equal", 6)));
            assertEquals(ParameterTerm.Relation.EXCLUDES,
                    param("name", "B", "equal", true).relationTo(param("name", "B", "equal", false)));
        }

        @Test
        void overlappingRangesAreIndependent() {
            assertNull(param("name", "X", "less_than", 10).relationTo(param("name", "X", "greater_than", 5)));
        }

        @Test
        void differentParametersAreUnrelated() {
            assertNull(param("name", "X", "equal", 5).relationTo(param("name", "Y", "equal", 5)));
        }

        @Test
        void includesAndEmptySize() {
            assertEquals(ParameterTerm.Relation.EXCLUDES,
                    param("name", "A", "includes", 3).relationTo(param("name", "A", "size", true, "equal", 0)));
        }
    }

    @Test
    @DisplayName("Uguaglianza sul contenuto, con interi normalizzati")
    void structuralEquality() {
        ParameterTerm a = param("name", "X", "equal", 5);
        ParameterTerm b = param("name", "X", "equal", 5L);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, param("name", "X", "equal", 6));
    }

    @Test
    @DisplayName("Ordinamento coerente con l'uguaglianza")
    void orderingConsistentWithEquals() {
        ParameterTerm integral = param("name", "X", "equal", 5);
        ParameterTerm floating = param("name", "X", "equal", 5.0);
        assertEquals(integral, floating);
        assertEquals(0, integral.compareTo(floating));

        ParameterTerm whole = param("name", "X", "equal", 3);
        ParameterTerm field = param("name", "X", "range", "3-0", "equal", 3);
        assertNotEquals(whole, field);
        assertNotEquals(0, whole.compareTo(field));
        assertEquals(-Integer.signum(whole.compareTo(field)), Integer.signum(field.compareTo(whole)));

        ParameterTerm explained = param("name", "X", "equal", 5, "reason", "documentazione");
        assertEquals(0, integral.compareTo(explained));
    }

    @Test
    void renderings() {
        assertEquals("(X=5)", param("name", "X", "equal", 5).toString());
        assertEquals("(MODE==\"direct\")", param("name", "MODE", "equal", "direct").toIdl());
        assertEquals("$array_includes?(A, 3)", param("name", "A", "includes", 3).toIdl());
        assertEquals("Parameter X is less than 4", param("name", "X", "less_than", 4).toPrettyString());
    }
}

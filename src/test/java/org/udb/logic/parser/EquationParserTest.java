package org.udb.logic.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;
import org.udb.term.Term;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.udb.logic.LogicNode.*;

class EquationParserTest {

    private static final Term TA = ExtensionTerm.exact("A", "1.0");
    private static final Term TB = ExtensionTerm.exact("B", "1.0");
    private static final Term TC = ExtensionTerm.exact("C", "1.0");
    private static final Map<String, Term> TERMS = Map.of("a", TA, "b", TB, "c", TC);

    @Test
    @DisplayName("AND lega più di OR")
    void precedence() {
        assertEquals(or(term(TA), and(term(TB), term(TC))), EquationParser.parse("a | b & c", TERMS));
        assertEquals(and(or(term(TA), term(TB)), term(TC)), EquationParser.parse("(a | b) & c", TERMS));
    }

    @Test
    void negation() {
        assertEquals(not(term(TA)), EquationParser.parse("!a", TERMS));
        assertEquals(not(or(term(TA), term(TB))), EquationParser.parse("!(a | b)", TERMS));
    }

    @Test
    @DisplayName("Intestazione e punto e virgola sono facoltativi")
    void optionalHeaderAndTerminator() {
        LogicNode expected = and(term(TA), term(TB));
        assertEquals(expected, EquationParser.parse("out = a & b;", TERMS));
        assertEquals(expected, EquationParser.parse("a & b", TERMS));
    }

    @Test
    void constants() {
        assertEquals(LogicNode.TRUE, EquationParser.parse("ONE", TERMS));
        assertEquals(LogicNode.FALSE, EquationParser.parse("0", TERMS));
        assertEquals(LogicNode.TRUE, EquationParser.parse("()", TERMS));
        assertEquals(and(term(TA), LogicNode.FALSE), EquationParser.parse("a & ZERO", TERMS));
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EquationParser.parse("a & d", TERMS));
        assertTrue(e.getMessage().contains("'d'"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a &", "(a | b", "a b", "| a", "a # b"})
    void syntaxErrorsAreRejected(String text) {
        assertThrows(IllegalArgumentException.class, () -> EquationParser.parse(text, TERMS));
    }
}

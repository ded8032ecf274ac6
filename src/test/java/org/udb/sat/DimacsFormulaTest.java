package org.udb.sat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;
import org.udb.term.Term;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.udb.logic.LogicNode.*;

class DimacsFormulaTest {

    private static final Term TA = ExtensionTerm.exact("A", "1.0");
    private static final Term TB = ExtensionTerm.exact("B", "1.0");

    @Test
    void fromCnfNumbersTermsInOrderOfAppearance() {
        DimacsFormula f = DimacsFormula.fromCnf(and(or(term(TB), not(term(TA))), term(TA)));
        assertEquals(List.of(TB, TA), f.getVariables());
        assertEquals(List.of(List.of(1, -2), List.of(2)), f.getClauses());
        assertSame(TB, f.getVariable(1));
    }

    @Test
    void nestedCnfIsFlattened() {
        DimacsFormula f = DimacsFormula.fromCnf(and(term(TA), and(term(TB), or(term(TA), term(TB)))));
        assertEquals(3, f.getClauseCount());
    }

    @Test
    @DisplayName("Costanti e formule non in CNF non sono rappresentabili")
    void rejectsNonCnf() {
        assertThrows(IllegalStateException.class, () -> DimacsFormula.fromCnf(LogicNode.TRUE));
        assertThrows(IllegalStateException.class, () -> DimacsFormula.fromCnf(xor(term(TA), term(TB))));
    }

    @Test
    void parseIgnoresCommentsAndHeader() {
        String text = "c generato a mano\np cnf 2 2\n1 -2 0\n  2 0\n";
        DimacsFormula f = DimacsFormula.parse(text, List.of(TA, TB));
        assertEquals(List.of(List.of(1, -2), List.of(2)), f.getClauses());
        assertEquals("p cnf 2 2\n1 -2 0\n2 0\n", f.toDimacs());
    }

    @Test
    void integrityIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> new DimacsFormula(List.of(TA), List.of(List.of(2))));
        assertThrows(IllegalArgumentException.class, () -> new DimacsFormula(List.of(TA), List.of(List.of())));
    }

    @Test
    void subsetKeepsVariables() {
        DimacsFormula f = new DimacsFormula(List.of(TA, TB), List.of(List.of(1), List.of(-1, 2), List.of(-2)));
        DimacsFormula sub = f.subset(List.of(0, 2));
        assertEquals(2, sub.getVariableCount());
        assertEquals(List.of(List.of(1), List.of(-2)), sub.getClauses());
        assertEquals(and(term(TA), not(term(TB))), sub.toLogicNode());
    }
}

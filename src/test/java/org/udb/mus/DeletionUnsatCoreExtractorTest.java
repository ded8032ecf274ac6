package org.udb.mus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.udb.sat.CdclSolver;
import org.udb.sat.DimacsFormula;
import org.udb.sat.SatResult;
import org.udb.sat.SatSolver;
import org.udb.sat.SolverStatistics;
import org.udb.term.ExtensionTerm;
import org.udb.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeletionUnsatCoreExtractorTest {

    private static final List<Term> VARIABLES = List.of(
            ExtensionTerm.exact("A", "1.0"), ExtensionTerm.exact("B", "1.0"), ExtensionTerm.exact("C", "1.0"));

    @Mock
    private SatSolver solver;

    @Test
    @DisplayName("Le clausole estranee al conflitto vengono scartate")
    void extractsTheConflictingClauses() {
        // A, A → B, ¬B sono in conflitto; C e (A ∨ C) non c'entrano
        DimacsFormula formula = new DimacsFormula(VARIABLES, List.of(
                List.of(3), List.of(1), List.of(1, 3), List.of(-1, 2), List.of(-2)));

        List<DimacsFormula> subsets = new DeletionUnsatCoreExtractor(new CdclSolver()).minimalUnsatSubsets(formula);

        assertEquals(1, subsets.size());
        assertEquals(List.of(List.of(1), List.of(-1, 2), List.of(-2)), subsets.get(0).getClauses());
        assertEquals(VARIABLES, subsets.get(0).getVariables());
    }

    @Test
    void resultIsMinimal() {
        DimacsFormula formula = new DimacsFormula(VARIABLES, List.of(
                List.of(1, 2), List.of(-1, 2), List.of(1, -2), List.of(-1, -2), List.of(3)));
        DimacsFormula mus = new DeletionUnsatCoreExtractor(new CdclSolver()).minimalUnsatSubsets(formula).get(0);

        CdclSolver check = new CdclSolver();
        assertFalse(check.solve(mus).isSatisfiable());
        for (int i = 0; i < mus.getClauseCount(); i++) {
            final int removed = i;
            List<Integer> rest = new ArrayList<>();
            for (int j = 0; j < mus.getClauseCount(); j++) {
                if (j != removed) {
                    rest.add(j);
                }
            }
            assertTrue(check.solve(mus.subset(rest)).isSatisfiable());
        }
    }

    @Test
    void satisfiableFormulaIsRejected() {
        when(solver.solve(any())).thenReturn(SatResult.satisfiable(Map.of(1, true), new SolverStatistics()));
        DimacsFormula formula = new DimacsFormula(VARIABLES, List.of(List.of(1)));

        assertThrows(IllegalArgumentException.class,
                () -> new DeletionUnsatCoreExtractor(solver).minimalUnsatSubsets(formula));
        verify(solver, times(1)).solve(formula);
    }

    @Test
    @DisplayName("Una chiamata al solutore per clausola, più la verifica iniziale")
    void oneSolverCallPerClause() {
        when(solver.solve(any())).thenReturn(SatResult.unsatisfiable(new SolverStatistics()));
        DimacsFormula formula = new DimacsFormula(VARIABLES, List.of(List.of(1), List.of(-1), List.of(2)));

        DimacsFormula mus = new DeletionUnsatCoreExtractor(solver).minimalUnsatSubsets(formula).get(0);

        // il solutore simulato dichiara tutto insoddisfacibile: resta una sola clausola
        assertEquals(1, mus.getClauseCount());
        verify(solver, times(3)).solve(any());
    }
}

package org.udb.logic;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.udb.minimize.EspressoMinimizer;
import org.udb.minimize.QuineMcCluskeyMinimizer;
import org.udb.mus.DeletionUnsatCoreExtractor;
import org.udb.mus.MustExtractor;
import org.udb.sat.CdclSolver;
import org.udb.sat.DimacsFormula;
import org.udb.sat.DimacsProcessSolver;
import org.udb.sat.SatResult;
import org.udb.sat.SatSolver;
import org.udb.sat.SolverStatistics;
import org.udb.term.ExtensionTerm;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.udb.logic.LogicNode.*;

@ExtendWith(MockitoExtension.class)
class LogicEngineTest {

    private static final LogicNode A = term(ExtensionTerm.exact("A", "1.0"));
    private static final LogicNode B = term(ExtensionTerm.exact("B", "1.0"));
    private static final LogicNode C = term(ExtensionTerm.exact("C", "1.0"));

    private static final EngineConfiguration SOLVER_ONLY = EngineConfiguration.builder()
            .bruteForceMaxTerms(1)
            .bruteForceMaxLiterals(1)
            .build();

    @Mock
    private SatSolver solver;

    @AfterEach
    void restoreDefault() {
        LogicEngine.resetDefault();
    }

    @Nested
    @DisplayName("Cache dei verdetti")
    class Cache {

        @Test
        @DisplayName("Alberi strutturalmente identici interrogano il solutore una sola volta")
        void solverIsCalledAtMostOncePerStructure() {
            when(solver.solve(any(DimacsFormula.class)))
                    .thenReturn(SatResult.satisfiable(Map.of(1, true, 2, true, 3, true), new SolverStatistics()));
            LogicEngine engine = LogicEngine.builder().configuration(SOLVER_ONLY).satSolver(solver).build();

            assertTrue(and(or(A, B), or(B, C)).satisfiable(engine));
            assertTrue(and(or(A, B), or(B, C)).satisfiable(engine));

            verify(solver, times(1)).solve(any(DimacsFormula.class));
            assertEquals(1, engine.getStatistics().getSolverSolves());
            assertEquals(1, engine.getStatistics().getCacheHits());
            assertEquals(1, engine.getCache().size());
        }

        @Test
        void resetClearsVerdictsAndStatistics() {
            when(solver.solve(any(DimacsFormula.class))).thenReturn(SatResult.unsatisfiable(new SolverStatistics()));
            LogicEngine engine = LogicEngine.builder().configuration(SOLVER_ONLY).satSolver(solver).build();

            assertFalse(and(or(A, B), not(A), not(B)).satisfiable(engine));
            engine.resetCaches();
            assertEquals(0, engine.getCache().size());
            assertEquals(0, engine.getStatistics().getSolverSolves());

            assertFalse(and(or(A, B), not(A), not(B)).satisfiable(engine));
            verify(solver, times(2)).solve(any(DimacsFormula.class));
        }

        @Test
        @DisplayName("Le costanti non arrivano al solutore")
        void constantsSkipTheSolver() {
            LogicEngine engine = LogicEngine.builder().configuration(SOLVER_ONLY).satSolver(solver).build();
            assertFalse(and(A, not(A), B).satisfiable(engine));
            assertTrue(or(A, not(A), B).satisfiable(engine));
            verifyNoInteractions(solver);
        }
    }

    @Test
    @DisplayName("Le formule piccole si risolvono per forza bruta")
    void smallFormulasUseBruteForce() {
        LogicEngine engine = LogicEngine.builder().satSolver(solver).build();
        assertTrue(or(A, B).satisfiable(engine));
        assertEquals(1, engine.getStatistics().getBruteForceSolves());
        verifyNoInteractions(solver);
    }

    @Nested
    @DisplayName("Adattatori predefiniti")
    class Adapters {

        @Test
        void internalImplementations() {
            LogicEngine engine = LogicEngine.builder().configuration(EngineConfiguration.defaults()).build();
            assertInstanceOf(CdclSolver.class, engine.getSatSolver());
            assertInstanceOf(QuineMcCluskeyMinimizer.class, engine.getMinimizer());
            assertInstanceOf(DeletionUnsatCoreExtractor.class, engine.getUnsatCoreExtractor());
        }

        @Test
        void externalTools() {
            EngineConfiguration external = EngineConfiguration.builder().externalTools(true).timeoutSeconds(5).build();
            LogicEngine engine = LogicEngine.builder().configuration(external).build();
            assertInstanceOf(DimacsProcessSolver.class, engine.getSatSolver());
            assertInstanceOf(EspressoMinimizer.class, engine.getMinimizer());
            assertInstanceOf(MustExtractor.class, engine.getUnsatCoreExtractor());
        }
    }

    @Test
    @DisplayName("Il motore predefinito è sostituibile")
    void defaultEngineCanBeReplaced() {
        LogicEngine custom = LogicEngine.builder().configuration(SOLVER_ONLY).satSolver(solver).build();
        LogicEngine.setDefault(custom);
        assertSame(custom, LogicEngine.getDefault());
        LogicEngine.resetDefault();
        assertNotSame(custom, LogicEngine.getDefault());
    }
}

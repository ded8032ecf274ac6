package org.udb.sat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SOLUTORE CDCL - Risoluzione in-process di formule DIMACS
 *
 * Implementazione dell'algoritmo CDCL con:
 * - propagazione unitaria sulle clausole originali e apprese
 * - analisi dei conflitti al primo UIP con backjump non cronologico
 * - euristica VSIDS per la scelta delle variabili di decisione
 * - restart periodici con intervallo crescente
 *
 * Ogni chiamata a {@link #solve(DimacsFormula)} lavora su stato locale: lo stesso
 * solutore può essere usato da più thread.
 */
public class CdclSolver implements SatSolver {

    private static final Logger LOGGER = Logger.getLogger(CdclSolver.class.getName());

    //region PARAMETRI

    /** Conflitti prima del primo restart. */
    private static final int INITIAL_RESTART_INTERVAL = 100;

    /** Fattore di crescita dell'intervallo dopo ogni restart. */
    private static final double RESTART_GROWTH = 1.5;

    /** Decadimento VSIDS applicato a ogni conflitto. */
    private static final double VSIDS_DECAY = 0.95;

    private final boolean restartEnabled;

    //endregion

    public CdclSolver() {
        this(true);
    }

    /**
     * @param restartEnabled true per abilitare i restart periodici
     */
    public CdclSolver(boolean restartEnabled) {
        this.restartEnabled = restartEnabled;
    }

    @Override
    public SatResult solve(DimacsFormula formula) {
        SolverStatistics statistics = new SolverStatistics();
        Search search = new Search(formula, statistics);
        boolean satisfiable = search.run();
        statistics.stopTimer();
        LOGGER.fine(() -> (satisfiable ? "SAT" : "UNSAT") + " | " + statistics);
        if (!satisfiable) {
            return SatResult.unsatisfiable(statistics);
        }
        return SatResult.satisfiable(search.model(), statistics);
    }

    /**
     * Stato di una singola risoluzione.
     */
    private final class Search {

        private final int variableCount;
        private final List<List<Integer>> clauses = new ArrayList<>();
        private final int[] values;
        private final int[] levels;
        private final List<Integer>[] reasons;
        private final double[] activity;
        private final DecisionStack stack = new DecisionStack();
        private final SolverStatistics statistics;

        private double activityIncrement = 1.0;
        private int conflictsSinceRestart = 0;
        private double restartInterval = INITIAL_RESTART_INTERVAL;

        @SuppressWarnings("unchecked")
        Search(DimacsFormula formula, SolverStatistics statistics) {
            this.variableCount = formula.getVariableCount();
            this.values = new int[variableCount + 1];
            this.levels = new int[variableCount + 1];
            this.reasons = new List[variableCount + 1];
            this.activity = new double[variableCount + 1];
            this.statistics = statistics;
            for (List<Integer> clause : formula.getClauses()) {
                // Letterali ripetuti e tautologie non cambiano il significato della clausola
                Set<Integer> literals = new HashSet<>(clause);
                boolean tautology = literals.stream().anyMatch(l -> literals.contains(-l));
                if (!tautology) {
                    clauses.add(new ArrayList<>(literals));
                    for (int literal : literals) {
                        activity[Math.abs(literal)] += 1.0;
                    }
                }
            }
        }

        boolean run() {
            while (true) {
                List<Integer> conflict = propagate();
                if (conflict != null) {
                    statistics.incrementConflicts();
                    if (stack.getLevel() == 0) {
                        return false;
                    }
                    handleConflict(conflict);
                    continue;
                }
                if (restartEnabled && conflictsSinceRestart >= restartInterval) {
                    restart();
                    continue;
                }
                int variable = pickBranchVariable();
                if (variable == 0) {
                    return true;
                }
                statistics.incrementDecisions();
                stack.addDecision(variable, false);
                assign(variable, false, null);
            }
        }

        //region PROPAGAZIONE

        private void assign(int variable, boolean value, List<Integer> reason) {
            values[variable] = value ? 1 : -1;
            levels[variable] = stack.getLevel();
            reasons[variable] = reason;
        }

        private int literalValue(int literal) {
            int value = values[Math.abs(literal)];
            return literal > 0 ? value : -value;
        }

        /**
         * Propaga fino al punto fisso.
         *
         * @return clausola in conflitto, oppure null
         */
        private List<Integer> propagate() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (List<Integer> clause : clauses) {
                    int unassigned = 0;
                    int lastUnassigned = 0;
                    boolean satisfied = false;
                    for (int literal : clause) {
                        int value = literalValue(literal);
                        if (value > 0) {
                            satisfied = true;
                            break;
                        }
                        if (value == 0) {
                            unassigned++;
                            lastUnassigned = literal;
                        }
                    }
                    if (satisfied) {
                        continue;
                    }
                    if (unassigned == 0) {
                        return clause;
                    }
                    if (unassigned == 1) {
                        int variable = Math.abs(lastUnassigned);
                        stack.addImpliedLiteral(variable, lastUnassigned > 0, clause);
                        assign(variable, lastUnassigned > 0, clause);
                        statistics.incrementPropagations();
                        changed = true;
                    }
                }
            }
            return null;
        }

        //endregion

        //region ANALISI CONFLITTI

        /**
         * Analisi al primo UIP: risolve la clausola in conflitto con le ragioni dei
         * letterali del livello corrente finché ne resta uno solo.
         */
        private void handleConflict(List<Integer> conflict) {
            int currentLevel = stack.getLevel();
            boolean[] seen = new boolean[variableCount + 1];
            List<Integer> learned = new ArrayList<>();
            List<AssignedLiteral> trail = stack.trail();
            int index = trail.size() - 1;
            int pending = 0;
            List<Integer> clause = conflict;
            AssignedLiteral pivot = null;

            do {
                for (int literal : clause) {
                    int variable = Math.abs(literal);
                    if (pivot != null && variable == pivot.getVariable()) {
                        continue;
                    }
                    if (!seen[variable] && levels[variable] > 0) {
                        seen[variable] = true;
                        bump(variable);
                        if (levels[variable] == currentLevel) {
                            pending++;
                        } else {
                            learned.add(literal);
                        }
                    }
                }
                while (!seen[trail.get(index).getVariable()]) {
                    index--;
                }
                pivot = trail.get(index);
                index--;
                pending--;
                clause = reasons[pivot.getVariable()];
            } while (pending > 0);

            learned.add(-pivot.toDimacsLiteral());
            int backjumpLevel = 0;
            for (int literal : learned) {
                int variable = Math.abs(literal);
                if (variable != pivot.getVariable()) {
                    backjumpLevel = Math.max(backjumpLevel, levels[variable]);
                }
            }

            clauses.add(learned);
            statistics.incrementLearnedClauses();
            backtrack(backjumpLevel);
            statistics.incrementBackjumps();
            decayActivity();
            conflictsSinceRestart++;
        }

        private void backtrack(int level) {
            for (AssignedLiteral removed : stack.backtrackToLevel(level)) {
                values[removed.getVariable()] = 0;
                reasons[removed.getVariable()] = null;
            }
        }

        private void restart() {
            statistics.incrementRestarts();
            backtrack(0);
            conflictsSinceRestart = 0;
            restartInterval *= RESTART_GROWTH;
            LOGGER.finest(() -> "Restart, prossimo intervallo " + (int) restartInterval);
        }

        //endregion

        //region EURISTICA VSIDS

        private void bump(int variable) {
            activity[variable] += activityIncrement;
            if (activity[variable] > 1e100) {
                for (int v = 1; v <= variableCount; v++) {
                    activity[v] *= 1e-100;
                }
                activityIncrement *= 1e-100;
            }
        }

        private void decayActivity() {
            activityIncrement /= VSIDS_DECAY;
        }

        /** Variabile non assegnata con attività massima, 0 se tutte assegnate. */
        private int pickBranchVariable() {
            int best = 0;
            for (int v = 1; v <= variableCount; v++) {
                if (values[v] == 0 && (best == 0 || activity[v] > activity[best])) {
                    best = v;
                }
            }
            return best;
        }

        //endregion

        Map<Integer, Boolean> model() {
            Map<Integer, Boolean> model = new LinkedHashMap<>();
            for (int v = 1; v <= variableCount; v++) {
                // Variabili assenti da ogni clausola restano libere: false è un valore valido
                model.put(v, values[v] > 0);
            }
            return model;
        }
    }
}

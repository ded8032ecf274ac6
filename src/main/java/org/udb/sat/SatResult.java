package org.udb.sat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RISULTATO SAT - Contenitore immutabile per l'esito di una risoluzione
 *
 * Per formule soddisfacibili contiene un modello (identificativo variabile → valore);
 * il modello può essere parziale se lo strumento che l'ha prodotto non lo riporta
 * per intero. Per formule insoddisfacibili il modello è assente.
 */
public class SatResult {

    private final boolean satisfiable;
    private final Map<Integer, Boolean> assignment;
    private final SolverStatistics statistics;

    private SatResult(boolean satisfiable, Map<Integer, Boolean> assignment, SolverStatistics statistics) {
        if (satisfiable && assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento (anche vuoto)");
        }
        if (!satisfiable && assignment != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere assegnamento variabili");
        }
        this.satisfiable = satisfiable;
        this.assignment = assignment == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.statistics = statistics != null ? statistics : new SolverStatistics();
    }

    public static SatResult satisfiable(Map<Integer, Boolean> assignment, SolverStatistics statistics) {
        return new SatResult(true, assignment, statistics);
    }

    public static SatResult unsatisfiable(SolverStatistics statistics) {
        return new SatResult(false, null, statistics);
    }

    public boolean isSatisfiable() {
        return satisfiable;
    }

    /** Modello per formule SAT, null per UNSAT. */
    public Map<Integer, Boolean> getAssignment() {
        return assignment;
    }

    public SolverStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return satisfiable ? "SAT " + assignment : "UNSAT";
    }
}

package org.udb.mus;

import org.udb.sat.DimacsFormula;
import org.udb.sat.SatSolver;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Estrazione di un MUS per cancellazione.
 *
 * Si prova a togliere una clausola alla volta: se il resto è ancora insoddisfacibile
 * la clausola viene scartata, altrimenti fa parte del nucleo. Richiede una chiamata
 * al solutore per clausola e restituisce un solo sottoinsieme.
 */
public class DeletionUnsatCoreExtractor implements UnsatCoreExtractor {

    private static final Logger LOGGER = Logger.getLogger(DeletionUnsatCoreExtractor.class.getName());

    private final SatSolver solver;

    public DeletionUnsatCoreExtractor(SatSolver solver) {
        this.solver = solver;
    }

    /**
     * @throws IllegalArgumentException se la formula è soddisfacibile
     */
    @Override
    public List<DimacsFormula> minimalUnsatSubsets(DimacsFormula formula) {
        if (solver.solve(formula).isSatisfiable()) {
            throw new IllegalArgumentException("La formula è soddisfacibile: nessun sottoinsieme insoddisfacibile");
        }
        List<Integer> core = new ArrayList<>();
        for (int i = 0; i < formula.getClauseCount(); i++) {
            core.add(i);
        }
        int position = 0;
        while (position < core.size()) {
            List<Integer> candidate = new ArrayList<>(core);
            candidate.remove(position);
            if (!candidate.isEmpty() && !solver.solve(formula.subset(candidate)).isSatisfiable()) {
                core = candidate;
            } else {
                position++;
            }
        }
        List<Integer> mus = core;
        LOGGER.fine(() -> "MUS di " + mus.size() + " clausole su " + formula.getClauseCount());
        return List.of(formula.subset(mus));
    }
}

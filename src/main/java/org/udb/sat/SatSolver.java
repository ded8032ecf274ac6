package org.udb.sat;

/**
 * Solutore SAT su formule in forma DIMACS.
 *
 * Le implementazioni sono funzioni pure dalla formula al verdetto: nessuno stato
 * condiviso tra chiamate successive.
 */
public interface SatSolver {

    /**
     * @param formula formula in CNF numerica
     * @return verdetto, con modello se soddisfacibile
     * @throws org.udb.tools.ExternalToolException se lo strumento delegato fallisce
     */
    SatResult solve(DimacsFormula formula);
}

package org.udb.mus;

import org.udb.sat.DimacsFormula;

import java.util.List;

/**
 * Estrattore di sottoinsiemi minimi insoddisfacibili (MUS) di una formula in CNF.
 */
public interface UnsatCoreExtractor {

    /**
     * Ogni formula restituita è un sottoinsieme delle clausole di partenza,
     * insoddisfacibile e minimo: togliendo una qualsiasi clausola diventa soddisfacibile.
     *
     * @param formula formula insoddisfacibile
     */
    List<DimacsFormula> minimalUnsatSubsets(DimacsFormula formula);
}

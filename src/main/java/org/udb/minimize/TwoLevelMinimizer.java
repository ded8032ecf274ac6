package org.udb.minimize;

import org.udb.logic.CanonicalizationType;
import org.udb.logic.LogicNode;

/**
 * Minimizzatore a due livelli: produce una somma di prodotti o un prodotto di somme
 * logicamente equivalente all'albero dato.
 */
public interface TwoLevelMinimizer {

    /**
     * @param node albero da minimizzare
     * @param resultType forma richiesta
     * @param exact se true richiede il minimo esatto, altrimenti basta un'euristica veloce
     */
    LogicNode minimize(LogicNode node, CanonicalizationType resultType, boolean exact);
}

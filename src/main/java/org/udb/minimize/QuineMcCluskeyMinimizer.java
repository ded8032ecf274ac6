package org.udb.minimize;

import org.udb.logic.CanonicalizationType;
import org.udb.logic.LogicNode;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Minimizzatore interno: Quine-McCluskey esatto fino a {@value QuineMcCluskey#MAX_TERMS}
 * termini. Oltre, restituisce la CNF (o la DNF) equivalente senza minimizzarla.
 */
public class QuineMcCluskeyMinimizer implements TwoLevelMinimizer {

    private static final Logger LOGGER = Logger.getLogger(QuineMcCluskeyMinimizer.class.getName());

    @Override
    public LogicNode minimize(LogicNode node, CanonicalizationType resultType, boolean exact) {
        int termCount = node.terms().size();
        if (termCount <= QuineMcCluskey.MAX_TERMS) {
            return QuineMcCluskey.minimize(node, resultType);
        }
        LOGGER.log(Level.WARNING, "{0} termini oltre il limite di Quine-McCluskey: forma a due livelli non minima",
                termCount);
        if (resultType == CanonicalizationType.PRODUCT_OF_SUMS) {
            return node.equivCnf(false);
        }
        // DNF(x) = ¬CNF(¬x) con De Morgan
        return LogicNode.not(LogicNode.not(node).equivCnf(false)).distributeNot().reduce();
    }
}

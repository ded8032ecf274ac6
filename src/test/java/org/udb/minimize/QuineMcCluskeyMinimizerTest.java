package org.udb.minimize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.udb.logic.CanonicalizationType;
import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.udb.logic.LogicNode.*;

class QuineMcCluskeyMinimizerTest {

    private final QuineMcCluskeyMinimizer minimizer = new QuineMcCluskeyMinimizer();

    private static List<LogicNode> terms(int n) {
        List<LogicNode> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(term(ExtensionTerm.exact("X" + i, "1.0")));
        }
        return out;
    }

    @Test
    void exactBelowLimit() {
        List<LogicNode> x = terms(3);
        LogicNode f = or(and(x.get(0), x.get(1)), and(x.get(0), not(x.get(1))), x.get(2));
        LogicNode sop = minimizer.minimize(f, CanonicalizationType.SUM_OF_PRODUCTS, true);
        assertTrue(sop.isDnf());
        assertEquals(2, sop.literals().size());
        assertTrue(sop.equivalent(or(x.get(0), x.get(2))));
    }

    @Test
    @DisplayName("Oltre il limite si ripiega sulle forme equivalenti non minime")
    void fallbackAboveLimit() {
        List<LogicNode> x = terms(QuineMcCluskey.MAX_TERMS + 1);
        LogicNode f = or(x);

        LogicNode pos = minimizer.minimize(f, CanonicalizationType.PRODUCT_OF_SUMS, true);
        assertTrue(pos.isCnf());
        assertEquals(x.size(), pos.literals().size());

        LogicNode sop = minimizer.minimize(f, CanonicalizationType.SUM_OF_PRODUCTS, true);
        assertTrue(sop.isDnf());
        assertEquals(x.size(), sop.literals().size());
    }
}

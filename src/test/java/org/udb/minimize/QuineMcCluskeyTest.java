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

class QuineMcCluskeyTest {

    private static final LogicNode A = term(ExtensionTerm.exact("A", "1.0"));
    private static final LogicNode B = term(ExtensionTerm.exact("B", "1.0"));
    private static final LogicNode C = term(ExtensionTerm.exact("C", "1.0"));

    @Test
    void implicantCombination() {
        QuineMcCluskey.Implicant a = new QuineMcCluskey.Implicant(0b010, 0);
        QuineMcCluskey.Implicant b = new QuineMcCluskey.Implicant(0b011, 0);
        QuineMcCluskey.Implicant merged = a.combine(b);
        assertEquals(new QuineMcCluskey.Implicant(0b010, 0b001), merged);
        assertTrue(merged.covers(0b010));
        assertTrue(merged.covers(0b011));
        assertFalse(merged.covers(0b110));
        assertNull(a.combine(new QuineMcCluskey.Implicant(0b101, 0)));
    }

    @Test
    @DisplayName("Implicanti primi della funzione maggioranza")
    void primeImplicantsOfMajority() {
        // righe con almeno due bit a 1
        List<QuineMcCluskey.Implicant> primes = QuineMcCluskey.primeImplicants(List.of(3, 5, 6, 7));
        assertEquals(3, primes.size());
        assertEquals(3, QuineMcCluskey.selectCover(primes, List.of(3, 5, 6, 7)).size());
    }

    @Test
    void sumOfProducts() {
        LogicNode majority = or(and(A, B), and(A, C), and(B, C), and(A, B, C));
        LogicNode sop = QuineMcCluskey.minimize(majority, CanonicalizationType.SUM_OF_PRODUCTS);
        assertTrue(sop.isDnf());
        assertEquals(6, sop.literals().size());
        assertTrue(sop.equivalent(majority));
    }

    @Test
    void productOfSums() {
        LogicNode f = and(or(A, B), or(A, not(B)));
        assertEquals(A, QuineMcCluskey.minimize(f, CanonicalizationType.PRODUCT_OF_SUMS));
        LogicNode g = or(and(A, B), C);
        LogicNode pos = QuineMcCluskey.minimize(g, CanonicalizationType.PRODUCT_OF_SUMS);
        assertTrue(pos.isCnf());
        assertEquals(4, pos.literals().size());
        assertTrue(pos.equivalent(g));
    }

    @Test
    void tooManyTermsIsRejected() {
        List<LogicNode> many = new ArrayList<>();
        for (int i = 0; i <= QuineMcCluskey.MAX_TERMS; i++) {
            many.add(term(ExtensionTerm.exact("X" + i, "1.0")));
        }
        assertThrows(IllegalArgumentException.class,
                () -> QuineMcCluskey.minimize(or(many), CanonicalizationType.SUM_OF_PRODUCTS));
    }
}

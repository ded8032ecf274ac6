package org.udb.minimize;

import org.udb.logic.CanonicalizationType;
import org.udb.logic.LogicNode;
import org.udb.term.SatisfiedResult;
import org.udb.term.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * QUINE-McCLUSKEY - Minimizzazione esatta a due livelli
 *
 * Algoritmo:
 * 1. Tabella di verità sui termini dell'albero (bit i = termine i)
 * 2. Mintermini (righe vere) per la somma di prodotti, maxtermini (righe false)
 *    per il prodotto di somme
 * 3. Implicanti primi: fusione iterativa di implicanti che differiscono in un solo bit
 * 4. Copertura: prima gli implicanti essenziali, poi scelta golosa di quello che
 *    copre più righe scoperte
 *
 * Un implicante è una coppia (bits, mask): i bit in mask sono indifferenti.
 * Per il prodotto di somme si copre la funzione negata e ogni cubo diventa una
 * clausola di letterali negati.
 */
public final class QuineMcCluskey {

    private static final Logger LOGGER = Logger.getLogger(QuineMcCluskey.class.getName());

    /** Oltre questa soglia la tabella di verità diventa troppo grande. */
    public static final int MAX_TERMS = 12;

    private QuineMcCluskey() {
    }

    /**
     * Cubo della tabella di verità.
     * • bits: valori dei termini rilevanti (bit i = termine i)
     * • mask: termini indifferenti; i loro bit in bits sono ignorati
     */
    static final class Implicant {

        private final int bits;
        private final int mask;

        Implicant(int bits, int mask) {
            this.bits = bits;
            this.mask = mask;
        }

        int bits() {
            return bits;
        }

        int mask() {
            return mask;
        }

        boolean covers(int row) {
            return (row & ~mask) == (bits & ~mask);
        }

        /** Fusione con un implicante che differisce in un solo bit rilevante, altrimenti null. */
        Implicant combine(Implicant other) {
            if (mask != other.mask) {
                return null;
            }
            int diff = (bits ^ other.bits) & ~mask;
            if (Integer.bitCount(diff) != 1) {
                return null;
            }
            return new Implicant(bits & ~diff, mask | diff);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Implicant)) {
                return false;
            }
            Implicant o = (Implicant) obj;
            return bits == o.bits && mask == o.mask;
        }

        @Override
        public int hashCode() {
            return 31 * bits + mask;
        }

        @Override
        public String toString() {
            return "Implicant[bits=" + Integer.toBinaryString(bits) + ", mask=" + Integer.toBinaryString(mask) + "]";
        }
    }

    /**
     * @throws IllegalArgumentException se l'albero ha più di {@value #MAX_TERMS} termini
     */
    public static LogicNode minimize(LogicNode node, CanonicalizationType resultType) {
        List<Term> terms = node.terms();
        int n = terms.size();
        if (n > MAX_TERMS) {
            throw new IllegalArgumentException("Quine-McCluskey supporta al più " + MAX_TERMS
                    + " termini, trovati " + n);
        }
        Map<Term, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(terms.get(i), i);
        }

        boolean sop = resultType == CanonicalizationType.SUM_OF_PRODUCTS;
        List<Integer> rows = new ArrayList<>();
        int total = 1 << n;
        for (int row = 0; row < total; row++) {
            final int assignment = row;
            boolean value = node.evaluate(t -> SatisfiedResult.of(((assignment >> index.get(t)) & 1) != 0))
                    == SatisfiedResult.YES;
            if (value == sop) {
                rows.add(row);
            }
        }

        // nessuna riga da coprire / tutte le righe da coprire
        if (rows.isEmpty()) {
            return sop ? LogicNode.FALSE : LogicNode.TRUE;
        }
        if (rows.size() == total) {
            return sop ? LogicNode.TRUE : LogicNode.FALSE;
        }

        List<Implicant> primes = primeImplicants(rows);
        List<Implicant> cover = selectCover(primes, rows);
        LOGGER.fine(() -> String.format("Quine-McCluskey: %d righe, %d implicanti primi, copertura di %d",
                rows.size(), primes.size(), cover.size()));

        List<LogicNode> parts = new ArrayList<>();
        for (Implicant imp : cover) {
            parts.add(sop ? product(imp, terms) : clause(imp, terms));
        }
        return sop ? LogicNode.disjunction(parts) : LogicNode.conjunction(parts);
    }

    static List<Implicant> primeImplicants(List<Integer> rows) {
        Set<Implicant> current = new LinkedHashSet<>();
        for (int row : rows) {
            current.add(new Implicant(row, 0));
        }
        List<Implicant> primes = new ArrayList<>();
        while (!current.isEmpty()) {
            Set<Implicant> next = new LinkedHashSet<>();
            Set<Implicant> combined = new LinkedHashSet<>();
            List<Implicant> list = new ArrayList<>(current);
            for (int i = 0; i < list.size(); i++) {
                for (int j = i + 1; j < list.size(); j++) {
                    Implicant merged = list.get(i).combine(list.get(j));
                    if (merged != null) {
                        next.add(merged);
                        combined.add(list.get(i));
                        combined.add(list.get(j));
                    }
                }
            }
            for (Implicant imp : list) {
                if (!combined.contains(imp)) {
                    primes.add(imp);
                }
            }
            current = next;
        }
        return primes;
    }

    static List<Implicant> selectCover(List<Implicant> primes, List<Integer> rows) {
        List<Implicant> cover = new ArrayList<>();
        Set<Integer> uncovered = new LinkedHashSet<>(rows);

        // essenziali: unici a coprire una riga
        for (int row : rows) {
            Implicant only = null;
            int count = 0;
            for (Implicant p : primes) {
                if (p.covers(row)) {
                    only = p;
                    count++;
                }
            }
            if (count == 1 && !cover.contains(only)) {
                cover.add(only);
            }
        }
        for (Implicant p : cover) {
            uncovered.removeIf(p::covers);
        }

        while (!uncovered.isEmpty()) {
            Implicant best = null;
            long bestCount = 0;
            for (Implicant p : primes) {
                long count = uncovered.stream().filter(p::covers).count();
                if (count > bestCount) {
                    best = p;
                    bestCount = count;
                }
            }
            if (best == null) {
                throw new IllegalStateException("Implicanti primi insufficienti a coprire " + uncovered);
            }
            cover.add(best);
            Implicant chosen = best;
            uncovered.removeIf(chosen::covers);
        }
        return cover;
    }

    private static LogicNode product(Implicant imp, List<Term> terms) {
        List<LogicNode> literals = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            if ((imp.mask() >> i & 1) != 0) {
                continue;
            }
            LogicNode t = LogicNode.term(terms.get(i));
            literals.add((imp.bits() >> i & 1) != 0 ? t : LogicNode.not(t));
        }
        return LogicNode.conjunction(literals);
    }

    /** Clausola falsa esattamente sulle righe del cubo. */
    private static LogicNode clause(Implicant imp, List<Term> terms) {
        List<LogicNode> literals = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            if ((imp.mask() >> i & 1) != 0) {
                continue;
            }
            LogicNode t = LogicNode.term(terms.get(i));
            literals.add((imp.bits() >> i & 1) != 0 ? LogicNode.not(t) : t);
        }
        return LogicNode.disjunction(literals);
    }
}

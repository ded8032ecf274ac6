package org.udb.logic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.udb.term.ExtensionTerm;
import org.udb.term.SatisfiedResult;
import org.udb.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Proprietà verificate su un corpus deterministico di alberi di profondità al più 3
 * su tre termini, generati con seme fisso.
 */
class LogicNodePropertiesTest {

    private static final int CORPUS_SIZE = 150;
    private static final long SEED = 0x5EED_2024L;

    private static final List<Term> TERMS = List.of(
            ExtensionTerm.exact("A", "1.0"),
            ExtensionTerm.exact("B", "1.0"),
            ExtensionTerm.exact("C", "1.0"));

    static IntStream corpus() {
        return IntStream.range(0, CORPUS_SIZE);
    }

    /** Ogni chiamata costruisce istanze nuove, senza risultati memorizzati. */
    static LogicNode tree(int index) {
        return randomTree(new Random(SEED + index), 3);
    }

    private static LogicNode randomTree(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) {
            int k = random.nextInt(8);
            if (k == 6) {
                return LogicNode.TRUE;
            }
            if (k == 7) {
                return LogicNode.FALSE;
            }
            LogicNode leaf = LogicNode.term(TERMS.get(k / 2));
            return k % 2 == 0 ? leaf : LogicNode.not(leaf);
        }
        LogicNodeType type = List.of(LogicNodeType.NOT, LogicNodeType.AND, LogicNodeType.OR,
                LogicNodeType.XOR, LogicNodeType.NONE, LogicNodeType.IF).get(random.nextInt(6));
        int arity = switch (type) {
            case NOT -> 1;
            case IF -> 2;
            default -> 2 + random.nextInt(2);
        };
        List<LogicNode> children = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
            children.add(randomTree(random, depth - 1));
        }
        return new LogicNode(type, children);
    }

    /** Tabella di verità sui tre termini; riga i: bit j = valore del termine j. */
    private static List<Boolean> truthTable(LogicNode node) {
        List<Boolean> table = new ArrayList<>();
        for (int row = 0; row < 1 << TERMS.size(); row++) {
            final int assignment = row;
            SatisfiedResult r = node.evaluate(t -> SatisfiedResult.of((assignment >> TERMS.indexOf(t) & 1) != 0));
            assertNotEquals(SatisfiedResult.MAYBE, r, "valutazione completa indeterminata per " + node);
            table.add(r == SatisfiedResult.YES);
        }
        return table;
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("Semplificazione e NNF preservano la tabella di verità")
    void reduceAndNnfPreserveTruthTable(int index) {
        LogicNode f = tree(index);
        List<Boolean> expected = truthTable(f);
        assertEquals(expected, truthTable(f.reduce()));
        assertEquals(expected, truthTable(f.nnf()));
        assertEquals(expected, truthTable(f.groupBy2()));
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("NNF è idempotente")
    void nnfIsIdempotent(int index) {
        LogicNode nnf = tree(index).nnf();
        assertTrue(nnf.isNnf());
        assertEquals(nnf, nnf.nnf());
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("La CNF equivalente è in CNF e ha la stessa tabella di verità")
    void equivalentCnfIsSound(int index) {
        LogicNode f = tree(index);
        LogicNode cnf = f.equivCnf(false);
        assertTrue(cnf.isCnf(), () -> "non in CNF: " + cnf);
        assertEquals(truthTable(f), truthTable(cnf));
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("Tseytin produce una CNF equisoddisfacibile")
    void tseytinIsEquisatisfiable(int index) {
        LogicNode f = tree(index);
        LogicNode cnf = tree(index).tseytin();
        assertTrue(cnf.isCnf());
        assertEquals(truthTable(f).contains(true), cnf.satisfiable());
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("Le forme minime sono equivalenti e a due livelli")
    void minimizationIsSound(int index) {
        LogicNode f = tree(index);
        LogicNode sop = f.minimize(CanonicalizationType.SUM_OF_PRODUCTS);
        LogicNode pos = f.minimize(CanonicalizationType.PRODUCT_OF_SUMS);
        assertTrue(sop.isDnf(), () -> "non in DNF: " + sop);
        assertTrue(pos.isCnf(), () -> "non in CNF: " + pos);
        assertEquals(truthTable(f), truthTable(sop));
        assertEquals(truthTable(f), truthTable(pos));
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("Forza bruta e solutore concordano")
    void bruteForceAgreesWithSolver(int index) {
        LogicEngine solverOnly = LogicEngine.builder()
                .configuration(EngineConfiguration.builder().bruteForceMaxTerms(1).bruteForceMaxLiterals(1).build())
                .build();
        boolean expected = truthTable(tree(index)).contains(true);
        assertEquals(expected, tree(index).satisfiable());
        assertEquals(expected, tree(index).satisfiable(solverOnly));
    }

    @ParameterizedTest
    @MethodSource("corpus")
    @DisplayName("Interpretazione dell'equazione eqntott restituisce una formula equivalente")
    void eqntottPreservesTruthTable(int index) {
        LogicNode f = tree(index);
        assertEquals(truthTable(f), truthTable(f.toEqntott().toLogicNode()));
    }
}

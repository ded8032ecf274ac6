package org.udb.logic;

import org.udb.term.FreeTerm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEYTIN - CNF equisoddisfacibile in tempo lineare
 *
 * Ogni sottoformula interna riceve una variabile sintetica ({@link FreeTerm}) p
 * vincolata da clausole di equivalenza:
 * - p ↔ (a ∧ b):  (¬a ∨ ¬b ∨ p) ∧ (a ∨ ¬p) ∧ (b ∨ ¬p)
 * - p ↔ (a ∨ b):  (a ∨ b ∨ ¬p) ∧ (¬a ∨ p) ∧ (¬b ∨ p)
 * - p ↔ ¬a:       (a ∨ p) ∧ (¬a ∨ ¬p)
 *
 * La variabile della radice viene sempre asserita come clausola unitaria.
 * Sottoformule strutturalmente identiche condividono la stessa variabile.
 *
 * Il risultato non è equivalente alla formula di partenza: le variabili sintetiche
 * non devono mai comparire in output mostrato all'utente.
 */
class TseytinConverter {

    private static final Logger LOGGER = Logger.getLogger(TseytinConverter.class.getName());

    //region STATO CONVERSIONE

    /** Sottoformula → variabile sintetica associata */
    private final Map<LogicNode, LogicNode> substructureToVariable = new HashMap<>();

    /** Clausole di equivalenza generate */
    private final List<LogicNode> generatedClauses = new ArrayList<>();

    //endregion

    /**
     * Converte un albero qualsiasi in CNF equisoddisfacibile, già appiattita.
     * Letterali e costanti sono restituiti invariati.
     */
    LogicNode convert(LogicNode formula) {
        LogicNode reduced = formula.reduce();
        if (isAtomic(reduced)) {
            return reduced;
        }
        LogicNode root = encode(reduced.groupBy2());
        generatedClauses.add(root);
        LogicNode result = LogicNode.conjunction(generatedClauses).flattenCnf().reduce();
        LOGGER.fine(() -> String.format("Tseytin: %d variabili sintetiche, %d clausole",
                substructureToVariable.size(), generatedClauses.size()));
        return result;
    }

    /**
     * Restituisce il letterale che rappresenta il nodo, generando le clausole
     * di equivalenza per i nodi interni.
     */
    private LogicNode encode(LogicNode node) {
        if (isAtomic(node)) {
            return node;
        }
        LogicNode existing = substructureToVariable.get(node);
        if (existing != null) {
            return existing;
        }
        LogicNode p = LogicNode.term(new FreeTerm());
        substructureToVariable.put(node, p);
        switch (node.type()) {
            case AND -> {
                LogicNode a = encode(node.children().get(0));
                LogicNode b = encode(node.children().get(1));
                generatedClauses.add(LogicNode.or(negate(a), negate(b), p));
                generatedClauses.add(LogicNode.or(a, negate(p)));
                generatedClauses.add(LogicNode.or(b, negate(p)));
            }
            case OR -> {
                LogicNode a = encode(node.children().get(0));
                LogicNode b = encode(node.children().get(1));
                generatedClauses.add(LogicNode.or(a, b, negate(p)));
                generatedClauses.add(LogicNode.or(negate(a), p));
                generatedClauses.add(LogicNode.or(negate(b), p));
            }
            case NOT -> {
                LogicNode a = encode(node.children().get(0));
                generatedClauses.add(LogicNode.or(a, p));
                generatedClauses.add(LogicNode.or(negate(a), negate(p)));
            }
            default -> throw new IllegalStateException(
                    "Nodo " + node.type() + " inatteso dopo il raggruppamento binario");
        }
        LOGGER.finest(() -> "Tseytin: " + p + " ↔ " + node);
        return p;
    }

    private static boolean isAtomic(LogicNode node) {
        return switch (node.type()) {
            case TERM, TRUE, FALSE -> true;
            case NOT -> node.children().get(0).type() == LogicNodeType.TERM;
            default -> false;
        };
    }

    private static LogicNode negate(LogicNode literal) {
        if (literal.type() == LogicNodeType.NOT) {
            return literal.children().get(0);
        }
        return LogicNode.not(literal);
    }
}

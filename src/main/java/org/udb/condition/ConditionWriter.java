package org.udb.condition;

import org.udb.logic.LogicNode;
import org.udb.logic.LogicNodeType;
import org.udb.term.ExtensionTerm;
import org.udb.term.FreeTerm;
import org.udb.term.ParameterTerm;
import org.udb.term.Term;
import org.udb.term.XlenTerm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forma dichiarativa di un albero logico, rileggibile con {@link ClauseParser}.
 *
 * Un sotto-albero i cui termini (esclusi gli antecedenti degli IF) sono tutti estensioni
 * viene raccolto sotto un unico {@code extension:}; lo stesso per i parametri con
 * {@code param:}. Gli alberi misti usano le chiavi generiche.
 */
public final class ConditionWriter {

    private enum Scope {
        GENERIC,
        EXTENSION,
        PARAM
    }

    private ConditionWriter() {
    }

    /**
     * @return Boolean per le costanti, altrimenti una mappa
     * @throws IllegalStateException se l'albero contiene variabili sintetiche
     */
    public static Object toDeclarative(LogicNode node) {
        return write(node, Scope.GENERIC);
    }

    private static Object write(LogicNode node, Scope scope) {
        if (node.type() == LogicNodeType.TRUE || node.type() == LogicNodeType.FALSE) {
            return node.type() == LogicNodeType.TRUE;
        }
        if (scope == Scope.GENERIC) {
            Scope inner = scopeOf(node);
            if (inner != Scope.GENERIC) {
                return single(inner == Scope.EXTENSION ? "extension" : "param", write(node, inner));
            }
        }
        return switch (node.type()) {
            case TERM -> writeTerm(node.term(), scope);
            case NOT -> single("not", write(node.children().get(0), scope));
            case AND -> list("allOf", node.children(), scope);
            case OR -> list("anyOf", node.children(), scope);
            case XOR -> list("oneOf", node.children(), scope);
            case NONE -> list("noneOf", node.children(), scope);
            case IF -> {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("if", write(node.children().get(0), Scope.GENERIC));
                out.put("then", write(node.children().get(1), scope));
                yield out;
            }
            default -> throw new IllegalStateException("Nodo inatteso: " + node.type());
        };
    }

    /** Ambito più stretto che può contenere il nodo. */
    private static Scope scopeOf(LogicNode node) {
        if (containsConstant(node)) {
            return Scope.GENERIC;
        }
        List<Term> terms = node.termsExcludingAntecedents();
        if (terms.isEmpty()) {
            return Scope.GENERIC;
        }
        if (terms.stream().allMatch(t -> t instanceof ExtensionTerm)) {
            return Scope.EXTENSION;
        }
        if (terms.stream().allMatch(t -> t instanceof ParameterTerm)) {
            return Scope.PARAM;
        }
        return Scope.GENERIC;
    }

    private static boolean containsConstant(LogicNode node) {
        if (node.type() == LogicNodeType.TRUE || node.type() == LogicNodeType.FALSE) {
            return true;
        }
        for (int i = 0; i < node.children().size(); i++) {
            // gli antecedenti sono scritti in ambito generico
            if (node.type() == LogicNodeType.IF && i == 0) {
                continue;
            }
            if (containsConstant(node.children().get(i))) {
                return true;
            }
        }
        return false;
    }

    private static Object writeTerm(Term term, Scope scope) {
        if (term instanceof FreeTerm) {
            throw new IllegalStateException("Variabile sintetica " + term + " non rappresentabile in forma dichiarativa");
        }
        if (term instanceof XlenTerm) {
            return single("xlen", ((XlenTerm) term).xlen());
        }
        Map<String, Object> body = new LinkedHashMap<>(term.toDeclarative());
        if (scope != Scope.GENERIC) {
            return body;
        }
        return single(term instanceof ExtensionTerm ? "extension" : "param", body);
    }

    private static Map<String, Object> list(String key, List<LogicNode> children, Scope scope) {
        List<Object> items = new ArrayList<>();
        for (LogicNode c : children) {
            items.add(write(c, scope));
        }
        return single(key, items);
    }

    private static Map<String, Object> single(String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(key, value);
        return out;
    }
}

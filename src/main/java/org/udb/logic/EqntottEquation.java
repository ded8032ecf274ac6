package org.udb.logic;

import org.udb.term.Term;

import java.util.Map;
import java.util.Objects;

/**
 * Equazione in formato eqntott ("out = (a & !(b))") con la mappa nome → termine
 * necessaria per reinterpretare l'output dello strumento.
 */
public final class EqntottEquation {

    private final String equation;
    private final Map<String, Term> termMap;

    public EqntottEquation(String equation, Map<String, Term> termMap) {
        this.equation = Objects.requireNonNull(equation, "equation");
        this.termMap = Map.copyOf(termMap);
    }

    public String equation() {
        return equation;
    }

    public Map<String, Term> termMap() {
        return termMap;
    }

    /** Riconverte l'equazione in albero logico. */
    public LogicNode toLogicNode() {
        return LogicNode.fromEqntott(equation, termMap);
    }

    @Override
    public String toString() {
        return equation;
    }
}

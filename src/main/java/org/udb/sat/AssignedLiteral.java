package org.udb.sat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assegnamento di una variabile nella traccia del solutore CDCL.
 *
 * Una decisione non ha clausola ancestrale; un'implicazione ricorda la clausola
 * che l'ha forzata, usata dall'analisi dei conflitti.
 */
public class AssignedLiteral {

    private final int variable;
    private final boolean value;
    private final boolean decision;
    private final List<Integer> ancestorClause;

    /**
     * @throws IllegalArgumentException se variable ≤ 0 o se la clausola ancestrale
     *         non è coerente con il tipo di assegnamento
     */
    public AssignedLiteral(int variable, boolean value, boolean decision, List<Integer> ancestorClause) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        if (!decision && (ancestorClause == null || ancestorClause.isEmpty())) {
            throw new IllegalArgumentException("Implicazioni richiedono clausola ancestrale non vuota");
        }
        if (decision && ancestorClause != null) {
            throw new IllegalArgumentException("Decisioni non hanno clausola ancestrale");
        }
        this.variable = variable;
        this.value = value;
        this.decision = decision;
        this.ancestorClause = ancestorClause == null ? null
                : Collections.unmodifiableList(new ArrayList<>(ancestorClause));
    }

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public boolean isDecision() {
        return decision;
    }

    public List<Integer> getAncestorClause() {
        return ancestorClause;
    }

    /** Letterale DIMACS reso vero dall'assegnamento. */
    public int toDimacsLiteral() {
        return value ? variable : -variable;
    }

    @Override
    public String toString() {
        return (decision ? "D" : "I") + toDimacsLiteral() + (decision ? "" : " <- " + ancestorClause);
    }
}

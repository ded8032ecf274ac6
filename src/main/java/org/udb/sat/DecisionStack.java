package org.udb.sat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Pila dei livelli di decisione del solutore CDCL.
 *
 * Il livello 0 contiene le implicazioni indipendenti da ogni decisione ed è sempre
 * presente; ogni decisione apre un nuovo livello che raccoglie la decisione e le
 * sue implicazioni in ordine cronologico.
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    private final List<List<AssignedLiteral>> levels = new ArrayList<>();

    public DecisionStack() {
        levels.add(new ArrayList<>());
    }

    /** Apre un nuovo livello con la decisione come primo elemento. */
    public void addDecision(int variable, boolean value) {
        List<AssignedLiteral> level = new ArrayList<>();
        level.add(new AssignedLiteral(variable, value, true, null));
        levels.add(level);
    }

    /** Aggiunge un'implicazione al livello corrente. */
    public void addImpliedLiteral(int variable, boolean value, List<Integer> ancestorClause) {
        levels.get(levels.size() - 1).add(new AssignedLiteral(variable, value, false, ancestorClause));
    }

    /**
     * Rimuove tutti i livelli sopra quello indicato.
     *
     * @return assegnamenti rimossi
     * @throws IllegalArgumentException se il livello non esiste
     */
    public List<AssignedLiteral> backtrackToLevel(int targetLevel) {
        if (targetLevel < 0 || targetLevel > getLevel()) {
            throw new IllegalArgumentException("Livello di backtrack non valido: " + targetLevel + " (corrente " + getLevel() + ")");
        }
        List<AssignedLiteral> removed = new ArrayList<>();
        while (getLevel() > targetLevel) {
            removed.addAll(levels.remove(levels.size() - 1));
        }
        LOGGER.finest(() -> "Backtrack al livello " + targetLevel + ", rimossi " + removed.size() + " assegnamenti");
        return removed;
    }

    /** Livello corrente (0 se nessuna decisione). */
    public int getLevel() {
        return levels.size() - 1;
    }

    /** Tutti gli assegnamenti in ordine cronologico. */
    public List<AssignedLiteral> trail() {
        List<AssignedLiteral> trail = new ArrayList<>();
        for (List<AssignedLiteral> level : levels) {
            trail.addAll(level);
        }
        return trail;
    }

    public int getTotalAssignments() {
        int total = 0;
        for (List<AssignedLiteral> level : levels) {
            total += level.size();
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DecisionStack{");
        for (int i = 0; i < levels.size(); i++) {
            sb.append(i == 0 ? "" : ", ").append("L").append(i).append('=').append(levels.get(i));
        }
        return sb.append('}').toString();
    }
}

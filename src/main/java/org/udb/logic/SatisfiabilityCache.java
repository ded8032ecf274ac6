package org.udb.logic;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache dei verdetti del solutore SAT, indicizzata per struttura dell'albero.
 *
 * Due alberi distinti ma strutturalmente identici condividono la stessa voce.
 * La cache appartiene a un {@link LogicEngine} e si svuota esplicitamente.
 */
public class SatisfiabilityCache {

    private final Map<LogicNode, Boolean> verdicts = new ConcurrentHashMap<>();

    public Boolean lookup(LogicNode node) {
        return verdicts.get(node);
    }

    public void store(LogicNode node, boolean satisfiable) {
        verdicts.put(node, satisfiable);
    }

    public int size() {
        return verdicts.size();
    }

    public void clear() {
        verdicts.clear();
    }
}

package org.udb.sat;

/**
 * STATISTICHE SAT - Metriche di esecuzione del solutore CDCL
 *
 * Contatori di decisioni, propagazioni, conflitti, clausole apprese, backjump e restart,
 * più il tempo di esecuzione misurato dalla costruzione a {@link #stopTimer()}.
 */
public class SolverStatistics {

    //region CONTATORI

    private int decisions = 0;
    private int propagations = 0;
    private int conflicts = 0;
    private int learnedClauses = 0;
    private int backjumps = 0;
    private int restarts = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public SolverStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementPropagations() {
        propagations++;
    }

    public synchronized void incrementConflicts() {
        conflicts++;
    }

    public synchronized void incrementLearnedClauses() {
        learnedClauses++;
    }

    public synchronized void incrementBackjumps() {
        backjumps++;
    }

    public synchronized void incrementRestarts() {
        restarts++;
    }

    /**
     * Ferma la misurazione del tempo. Chiamate successive non hanno effetto.
     */
    public synchronized void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    public synchronized long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    public synchronized int getDecisions() {
        return decisions;
    }

    public synchronized int getPropagations() {
        return propagations;
    }

    public synchronized int getConflicts() {
        return conflicts;
    }

    public synchronized int getLearnedClauses() {
        return learnedClauses;
    }

    public synchronized int getBackjumps() {
        return backjumps;
    }

    public synchronized int getRestarts() {
        return restarts;
    }

    @Override
    public synchronized String toString() {
        return String.format("Decisioni: %d | Propagazioni: %d | Conflitti: %d | Apprese: %d | Backjump: %d | Restart: %d | Tempo: %d ms",
                decisions, propagations, conflicts, learnedClauses, backjumps, restarts, getExecutionTimeMs());
    }
}

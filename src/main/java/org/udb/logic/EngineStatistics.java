package org.udb.logic;

/**
 * Contatori delle interrogazioni di soddisfacibilità eseguite da un motore.
 *
 * Distingue le risoluzioni a forza bruta, quelle delegate al solutore SAT e i
 * risultati serviti dalla cache. I contatori si azzerano con {@link #reset()}.
 */
public class EngineStatistics {

    //region CONTATORI

    private long bruteForceSolves = 0;
    private long bruteForceTimeMs = 0;
    private long solverSolves = 0;
    private long solverTimeMs = 0;
    private long cacheHits = 0;

    //endregion

    //region INCREMENTI

    public synchronized void recordBruteForceSolve(long elapsedMs) {
        bruteForceSolves++;
        bruteForceTimeMs += elapsedMs;
    }

    public synchronized void recordSolverSolve(long elapsedMs) {
        solverSolves++;
        solverTimeMs += elapsedMs;
    }

    public synchronized void recordCacheHit() {
        cacheHits++;
    }

    public synchronized void reset() {
        bruteForceSolves = 0;
        bruteForceTimeMs = 0;
        solverSolves = 0;
        solverTimeMs = 0;
        cacheHits = 0;
    }

    //endregion

    //region ACCESSORS

    public synchronized long getBruteForceSolves() {
        return bruteForceSolves;
    }

    public synchronized long getBruteForceTimeMs() {
        return bruteForceTimeMs;
    }

    public synchronized long getSolverSolves() {
        return solverSolves;
    }

    public synchronized long getSolverTimeMs() {
        return solverTimeMs;
    }

    public synchronized long getCacheHits() {
        return cacheHits;
    }

    //endregion

    @Override
    public synchronized String toString() {
        return String.format("Forza bruta: %d (%d ms) | Solutore: %d (%d ms) | Cache: %d",
                bruteForceSolves, bruteForceTimeMs, solverSolves, solverTimeMs, cacheHits);
    }
}

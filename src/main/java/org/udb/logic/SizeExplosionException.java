package org.udb.logic;

/**
 * Segnala che la conversione in CNF equivalente ha superato il limite di clausole.
 * Viene intercettata per ripiegare sulla trasformazione di Tseytin.
 */
public class SizeExplosionException extends RuntimeException {

    private final int clauseCount;

    public SizeExplosionException(int clauseCount, int threshold) {
        super("Conversione CNF oltre il limite: " + clauseCount + " clausole (soglia " + threshold + ")");
        this.clauseCount = clauseCount;
    }

    public int getClauseCount() {
        return clauseCount;
    }
}

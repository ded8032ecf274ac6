package org.udb.term;

/**
 * Esito a tre valori della valutazione di un termine o di un albero logico.
 *
 * YES e NO rappresentano conoscenza certa, MAYBE indica che la configurazione
 * corrente non contiene informazioni sufficienti per decidere.
 */
public enum SatisfiedResult {
    YES,
    NO,
    MAYBE;

    /**
     * Negazione a tre valori: scambia YES e NO, MAYBE resta MAYBE.
     */
    public SatisfiedResult negate() {
        return switch (this) {
            case YES -> NO;
            case NO -> YES;
            case MAYBE -> MAYBE;
        };
    }

    public static SatisfiedResult of(boolean value) {
        return value ? YES : NO;
    }
}

package org.udb.logic;

/**
 * Forma a due livelli richiesta alla minimizzazione.
 */
public enum CanonicalizationType {
    /** OR di AND (DNF) */
    SUM_OF_PRODUCTS,
    /** AND di OR (CNF) */
    PRODUCT_OF_SUMS
}

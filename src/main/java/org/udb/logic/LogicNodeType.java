package org.udb.logic;

/**
 * Tipi di nodo dell'albero logico.
 */
public enum LogicNodeType {
    TRUE,   // costante vera
    FALSE,  // costante falsa
    TERM,   // foglia: un termine
    NOT,    // negazione
    AND,    // congiunzione n-aria
    OR,     // disgiunzione n-aria
    XOR,    // esattamente uno dei figli
    NONE,   // nessuno dei figli (NOR n-ario)
    IF      // implicazione materiale antecedente -> conseguente
}

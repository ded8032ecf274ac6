package org.udb.condition;

/**
 * Clausola dichiarativa non valida: chiave sconosciuta, struttura errata o
 * confronto malformato. Riporta il testo della clausola incriminata.
 */
public class MalformedConditionException extends IllegalArgumentException {

    private final String clauseText;

    public MalformedConditionException(String message, Object clause) {
        super(message + ": " + clause);
        this.clauseText = String.valueOf(clause);
    }

    public MalformedConditionException(String message, Object clause, Throwable cause) {
        super(message + ": " + clause, cause);
        this.clauseText = String.valueOf(clause);
    }

    public String getClauseText() {
        return clauseText;
    }
}

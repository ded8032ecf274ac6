package org.udb.condition;

/**
 * Grado di conoscenza di una configurazione.
 */
public enum ConfigurationType {
    /** Elenco completo di estensioni e parametri: ciò che manca non è implementato. */
    FULLY_CONFIGURED,
    /** Estensioni obbligatorie e possibili note, il resto è aperto. */
    PARTIALLY_CONFIGURED,
    /** Nessuna informazione. */
    UNCONFIGURED
}

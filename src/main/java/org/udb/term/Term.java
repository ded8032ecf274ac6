package org.udb.term;

import java.util.Map;

/**
 * Foglia di un albero logico: un predicato atomico sul dominio dell'architettura.
 *
 * Le implementazioni sono immutabili, con uguaglianza e hash strutturali, così da
 * poter essere usate come chiavi di mappa e deduplicate. L'ordinamento totale
 * confronta prima il tipo di termine, poi il contenuto specifico del tipo.
 */
public interface Term extends Comparable<Term> {

    /** Tipi di termine, nell'ordine usato per il confronto tra tipi diversi. */
    enum Kind {
        EXTENSION,
        PARAMETER,
        XLEN,
        FREE
    }

    Kind kind();

    /** Forma leggibile, anche approssimata. */
    String toPrettyString();

    /** Forma per documentazione asciidoc. */
    String toAsciidoc();

    /** Espressione IDL equivalente. */
    String toIdl();

    /**
     * Corpo dichiarativo del termine, senza la chiave che ne identifica il tipo
     * (es. {name, version} per un'estensione).
     */
    Map<String, Object> toDeclarative();

    /**
     * Confronto con un termine dello stesso tipo.
     */
    int compareSameKind(Term other);

    @Override
    default int compareTo(Term other) {
        int byKind = kind().compareTo(other.kind());
        return byKind != 0 ? byKind : compareSameKind(other);
    }
}

package org.udb.condition;

import org.udb.term.ExtensionTerm;
import org.udb.term.Version;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collaboratore che dà significato ai termini: versioni esistenti delle estensioni,
 * requisiti dichiarati e stato di conoscenza della configurazione.
 *
 * Le clausole assenti sono restituite come null.
 */
public interface ConfigurationContext {

    ConfigurationType configurationType();

    /** Versioni note dell'estensione, in ordine crescente; vuota se l'estensione è sconosciuta. */
    List<Version> versions(String extension);

    /** Requisiti di una versione specifica, o null. */
    Clause requirements(String extension, Version version);

    /** Estensioni in conflitto con l'estensione, o null. */
    Clause conflicts(String extension);

    /** Requisiti del parametro, o null. */
    Clause parameterRequirements(String parameter);

    /** Versioni implementate (configurazione completa), come termini esatti. */
    Set<ExtensionTerm> implementedVersions();

    /** Requisiti obbligatori (configurazione parziale). */
    Set<ExtensionTerm> mandatoryRequirements();

    /** Versioni ancora ammissibili (configurazione parziale), come termini esatti. */
    Set<ExtensionTerm> possibleVersions();

    /** Valori noti dei parametri. */
    Map<String, Object> parameterValues();

    /** Valori di XLEN ammissibili. */
    Set<Integer> possibleXlens();

    /**
     * Termini esatti per ogni versione nota che soddisfa il requisito.
     */
    default List<ExtensionTerm> satisfyingVersions(ExtensionTerm requirement) {
        List<ExtensionTerm> out = new ArrayList<>();
        for (Version v : versions(requirement.name())) {
            if (requirement.satisfiedBy(v)) {
                out.add(new ExtensionTerm(requirement.name(), ExtensionTerm.ComparisonOp.EQUAL, v));
            }
        }
        return out;
    }
}

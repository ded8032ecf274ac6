package org.udb.condition;

import org.udb.term.ExtensionTerm;

import java.util.Objects;

/**
 * Versione esatta richiesta da un blocco di requisiti, sotto la condizione
 * accumulata lungo i rami if/then.
 *
 * • extensionVersion: termine esatto (operatore "=")
 * • condition: congiunzione degli antecedenti attraversati, Constant(true) se incondizionata
 */
public final class ConditionalExtensionVersion {

    private final ExtensionTerm extensionVersion;
    private final Clause condition;

    public ConditionalExtensionVersion(ExtensionTerm extensionVersion, Clause condition) {
        this.extensionVersion = Objects.requireNonNull(extensionVersion, "extensionVersion");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public ExtensionTerm extensionVersion() {
        return extensionVersion;
    }

    public Clause condition() {
        return condition;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConditionalExtensionVersion)) {
            return false;
        }
        ConditionalExtensionVersion o = (ConditionalExtensionVersion) obj;
        return extensionVersion.equals(o.extensionVersion) && condition.equals(o.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(extensionVersion, condition);
    }

    @Override
    public String toString() {
        return extensionVersion + " se " + condition;
    }
}

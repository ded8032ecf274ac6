package org.udb.condition;

import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;

import java.util.Objects;

/**
 * Estensione implicata (o esclusa) da una condizione, quando vale la condizione residua.
 * Una condizione residua TRUE indica un'implicazione incondizionata.
 */
public final class ImpliedExtension {

    private final ExtensionTerm extension;
    private final LogicNode condition;

    public ImpliedExtension(ExtensionTerm extension, LogicNode condition) {
        this.extension = Objects.requireNonNull(extension, "extension");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public ExtensionTerm extension() {
        return extension;
    }

    public LogicNode condition() {
        return condition;
    }

    public boolean isUnconditional() {
        return condition.equals(LogicNode.TRUE);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ImpliedExtension)) {
            return false;
        }
        ImpliedExtension o = (ImpliedExtension) obj;
        return extension.equals(o.extension) && condition.equals(o.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(extension, condition);
    }

    @Override
    public String toString() {
        return isUnconditional() ? extension.toString() : extension + " se " + condition;
    }
}

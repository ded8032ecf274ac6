package org.udb.condition;

import org.udb.term.ExtensionTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * Estrae da un blocco di requisiti le versioni esatte certamente richieste.
 *
 * Si scende solo attraverso allOf e if/then dentro {@code extension:}; i rami
 * anyOf, oneOf e noneOf non contengono nulla di certo e interrompono la visita.
 */
public final class RequirementsWalker {

    private RequirementsWalker() {
    }

    public static List<ConditionalExtensionVersion> impliedExtensionVersions(Clause requirements) {
        List<ConditionalExtensionVersion> result = new ArrayList<>();
        walk(requirements, null, result);
        return result;
    }

    private static void walk(Clause clause, Clause condThusFar, List<ConditionalExtensionVersion> result) {
        if (clause instanceof Clause.AllOf) {
            for (Clause c : ((Clause.AllOf) clause).clauses()) {
                walk(c, condThusFar, result);
            }
        } else if (clause instanceof Clause.IfThen) {
            Clause.IfThen ifThen = (Clause.IfThen) clause;
            Clause cond = condThusFar == null
                    ? ifThen.condition()
                    : new Clause.AllOf(List.of(condThusFar, ifThen.condition()));
            walk(ifThen.consequent(), cond, result);
        } else if (clause instanceof Clause.ExtensionClause) {
            Clause.ExtensionClause ext = (Clause.ExtensionClause) clause;
            ExtensionTerm term = ExtensionTerm.fromRequirement(ext.name(), ext.requirement());
            if (term.isExact()) {
                result.add(new ConditionalExtensionVersion(term,
                        condThusFar == null ? new Clause.Constant(true) : condThusFar));
            }
        }
        // anyOf, oneOf, noneOf, not e foglie non estensione: niente di certo
    }
}

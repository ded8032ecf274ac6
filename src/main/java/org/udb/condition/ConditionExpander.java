package org.udb.condition;

import org.udb.logic.LogicNode;
import org.udb.term.ExtensionTerm;
import org.udb.term.ParameterTerm;
import org.udb.term.Term;
import org.udb.term.Version;
import org.udb.term.XlenTerm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESPANSIONE - Vincoli derivati aggiunti all'albero di una condizione
 *
 * Famiglie di clausole, congiunte all'albero di partenza:
 * 1. requisiti transitivi: v → requisiti(v) per ogni versione e parametro incontrato,
 *    e v → ¬conflitti(estensione)
 * 2. intervalli di versione: r ↔ (v1 ∨ v2 ∨ ...) sulle versioni concrete che soddisfano r
 * 3. esclusività: al più una versione concreta per estensione
 * 4. relazioni tra confronti sullo stesso parametro, e XLEN esattamente 32 o 64
 *
 * La chiusura transitiva visita ogni termine una sola volta, quindi termina anche
 * con requisiti ciclici.
 */
final class ConditionExpander {

    private static final Logger LOGGER = Logger.getLogger(ConditionExpander.class.getName());

    private final ConfigurationContext context;
    private final List<LogicNode> derived = new ArrayList<>();
    private final Set<Term> visited = new LinkedHashSet<>();
    private final Set<String> conflictsVisited = new LinkedHashSet<>();
    private final Deque<Term> pending = new ArrayDeque<>();

    private ConditionExpander(ConfigurationContext context) {
        this.context = context;
    }

    static LogicNode expand(LogicNode tree, ConfigurationContext context) {
        return new ConditionExpander(context).run(tree);
    }

    private LogicNode run(LogicNode tree) {
        enqueueAll(tree);
        while (!pending.isEmpty()) {
            Term term = pending.poll();
            if (term instanceof ExtensionTerm) {
                expandExtension((ExtensionTerm) term);
            } else if (term instanceof ParameterTerm) {
                expandParameter((ParameterTerm) term);
            }
        }

        List<Term> allTerms = new ArrayList<>(visited);
        addExclusivity(allTerms);
        addParameterRelations(allTerms);
        if (allTerms.stream().anyMatch(t -> t instanceof XlenTerm)) {
            derived.add(LogicNode.xor(LogicNode.XLEN32, LogicNode.XLEN64));
        }

        LOGGER.fine(() -> String.format("Espansione: %d termini, %d clausole derivate", visited.size(), derived.size()));
        if (derived.isEmpty()) {
            return tree;
        }
        List<LogicNode> conjuncts = new ArrayList<>();
        conjuncts.add(tree);
        conjuncts.addAll(derived);
        return LogicNode.and(conjuncts);
    }

    private void enqueueAll(LogicNode node) {
        for (Term t : node.terms()) {
            if (visited.add(t)) {
                pending.add(t);
            }
        }
    }

    //region REQUISITI E INTERVALLI

    private void expandExtension(ExtensionTerm term) {
        LogicNode self = LogicNode.term(term);
        if (!term.isExact()) {
            List<ExtensionTerm> versions = context.satisfyingVersions(term);
            if (versions.isEmpty()) {
                // nessuna versione concreta: il requisito non può valere
                derived.add(LogicNode.not(self));
                return;
            }
            List<LogicNode> exact = new ArrayList<>();
            for (ExtensionTerm v : versions) {
                exact.add(LogicNode.term(v));
            }
            LogicNode any = LogicNode.disjunction(exact);
            derived.add(LogicNode.implies(self, any));
            derived.add(LogicNode.implies(any, self));
            enqueueAll(any);
            return;
        }

        List<Version> known = context.versions(term.name());
        if (!known.isEmpty() && !known.contains(term.version())) {
            derived.add(LogicNode.not(self));
            return;
        }
        Clause requirements = context.requirements(term.name(), term.version());
        if (requirements != null) {
            LogicNode required = ClauseCompiler.compile(requirements);
            derived.add(LogicNode.implies(self, required));
            enqueueAll(required);
        }
        Clause conflicts = context.conflicts(term.name());
        if (conflicts != null) {
            LogicNode conflicting = ClauseCompiler.compile(conflicts);
            derived.add(LogicNode.implies(self, LogicNode.not(conflicting)));
            if (conflictsVisited.add(term.name())) {
                enqueueAll(conflicting);
            }
        }
    }

    private void expandParameter(ParameterTerm term) {
        Clause requirements = context.parameterRequirements(term.name());
        if (requirements != null) {
            LogicNode required = ClauseCompiler.compile(requirements);
            derived.add(LogicNode.implies(LogicNode.term(term), required));
            enqueueAll(required);
        }
    }

    //endregion

    //region ESCLUSIVITA' E RELAZIONI

    private void addExclusivity(List<Term> terms) {
        Map<String, List<LogicNode>> byName = new LinkedHashMap<>();
        for (Term t : terms) {
            if (t instanceof ExtensionTerm && ((ExtensionTerm) t).isExact()) {
                byName.computeIfAbsent(((ExtensionTerm) t).name(), k -> new ArrayList<>()).add(LogicNode.term(t));
            }
        }
        for (List<LogicNode> versions : byName.values()) {
            if (versions.size() > 1) {
                // nessuna versione, oppure esattamente una
                derived.add(LogicNode.or(LogicNode.none(versions), LogicNode.xor(versions)));
            }
        }
    }

    private void addParameterRelations(List<Term> terms) {
        List<ParameterTerm> params = new ArrayList<>();
        for (Term t : terms) {
            if (t instanceof ParameterTerm) {
                params.add((ParameterTerm) t);
            }
        }
        for (ParameterTerm a : params) {
            for (ParameterTerm b : params) {
                if (a == b) {
                    continue;
                }
                ParameterTerm.Relation relation = a.relationTo(b);
                if (relation == ParameterTerm.Relation.IMPLIES) {
                    derived.add(LogicNode.implies(LogicNode.term(a), LogicNode.term(b)));
                } else if (relation == ParameterTerm.Relation.EXCLUDES) {
                    derived.add(LogicNode.implies(LogicNode.term(a), LogicNode.not(LogicNode.term(b))));
                }
            }
        }
    }

    //endregion
}

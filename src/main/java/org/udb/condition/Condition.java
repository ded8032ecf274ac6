package org.udb.condition;

import org.udb.logic.CanonicalizationType;
import org.udb.logic.LogicNode;
import org.udb.logic.LogicNodeType;
import org.udb.logic.TermEvaluator;
import org.udb.term.ExtensionTerm;
import org.udb.term.FreeTerm;
import org.udb.term.ParameterTerm;
import org.udb.term.SatisfiedResult;
import org.udb.term.Term;
import org.udb.term.XlenTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * CONDIZIONE - Clausola dichiarativa compilata in albero logico
 *
 * Produce su richiesta due alberi, entrambi memorizzati:
 * - non espanso: traduzione letterale delle clausole
 * - espanso: l'albero non espanso congiunto ai vincoli derivati dal contesto
 *   (requisiti transitivi, intervalli di versione, esclusività, relazioni tra parametri)
 *
 * Le interrogazioni di soddisfacibilità lavorano sull'albero espanso; la valutazione
 * rispetto a una configurazione usa l'albero non espanso.
 */
public final class Condition {

    private static final Logger LOGGER = Logger.getLogger(Condition.class.getName());

    private final Clause clause;
    private final ConfigurationContext context;

    private volatile LogicNode unexpanded;
    private volatile LogicNode expanded;

    public Condition(Clause clause, ConfigurationContext context) {
        this.clause = Objects.requireNonNull(clause, "clause");
        this.context = Objects.requireNonNull(context, "context");
    }

    //region COSTRUZIONE

    /** Condizione dai dati dichiarativi (mappa YAML o booleano). */
    public static Condition fromData(Object data, ConfigurationContext context) {
        return new Condition(ClauseParser.parse(data), context);
    }

    public static Condition fromYaml(String yaml, ConfigurationContext context) {
        return new Condition(ClauseYaml.parse(yaml), context);
    }

    public static Condition alwaysTrue(ConfigurationContext context) {
        return new Condition(new Clause.Constant(true), context);
    }

    public static Condition alwaysFalse(ConfigurationContext context) {
        return new Condition(new Clause.Constant(false), context);
    }

    public Condition and(Condition other) {
        return new Condition(new Clause.AllOf(List.of(clause, other.clause)), context);
    }

    public Condition or(Condition other) {
        return new Condition(new Clause.AnyOf(List.of(clause, other.clause)), context);
    }

    public Condition not() {
        return new Condition(new Clause.Not(clause), context);
    }

    /** Congiunzione di più condizioni; sempre vera se la lista è vuota. */
    public static Condition join(List<Condition> conditions, ConfigurationContext context) {
        if (conditions.isEmpty()) {
            return alwaysTrue(context);
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        List<Clause> clauses = new ArrayList<>();
        for (Condition c : conditions) {
            clauses.add(c.clause);
        }
        return new Condition(new Clause.AllOf(clauses), context);
    }

    //endregion

    //region ALBERI LOGICI

    /**
     * @param expand se true congiunge i vincoli derivati dal contesto
     * @throws MalformedConditionException se un termine della clausola non è valido
     */
    public LogicNode toLogicTree(boolean expand) {
        return expand ? expandedTree() : unexpandedTree();
    }

    private LogicNode unexpandedTree() {
        LogicNode tree = unexpanded;
        if (tree == null) {
            synchronized (this) {
                tree = unexpanded;
                if (tree == null) {
                    tree = ClauseCompiler.compile(clause);
                    unexpanded = tree;
                }
            }
        }
        return tree;
    }

    private LogicNode expandedTree() {
        LogicNode tree = expanded;
        if (tree == null) {
            synchronized (this) {
                tree = expanded;
                if (tree == null) {
                    tree = ConditionExpander.expand(unexpandedTree(), context);
                    expanded = tree;
                }
            }
        }
        return tree;
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valutazione a tre valori rispetto a una configurazione:
     * - completa: ciò che non è implementato è falso
     * - parziale: obbligatorio → YES, possibile → MAYBE, impossibile → NO
     * - assente: tutto MAYBE, salvo le condizioni costanti
     */
    public SatisfiedResult satisfiedByConfiguration(ConfigurationContext configuration) {
        LogicNode tree = toLogicTree(false);
        if (tree.type() == LogicNodeType.TRUE) {
            return SatisfiedResult.YES;
        }
        if (tree.type() == LogicNodeType.FALSE) {
            return SatisfiedResult.NO;
        }
        if (configuration.configurationType() == ConfigurationType.UNCONFIGURED) {
            return SatisfiedResult.MAYBE;
        }
        SatisfiedResult result = tree.evaluate(evaluatorFor(configuration));
        LOGGER.fine(() -> "Condizione " + this + " su configurazione "
                + configuration.configurationType() + ": " + result);
        return result;
    }

    /** Vero se la configurazione non esclude la condizione. */
    public boolean couldBeTrue(ConfigurationContext configuration) {
        return satisfiedByConfiguration(configuration) != SatisfiedResult.NO;
    }

    /**
     * Albero espanso semplificato sostituendo i termini che il callback sa risolvere.
     */
    public LogicNode partiallyEvaluate(TermEvaluator knownFacts) {
        return toLogicTree(true).partialEvaluate(knownFacts).reduce();
    }

    public LogicNode partiallyEvaluate(ConfigurationContext configuration) {
        return partiallyEvaluate(evaluatorFor(configuration));
    }

    /** Callback di valutazione dei termini per lo stato di conoscenza della configurazione. */
    public static TermEvaluator evaluatorFor(ConfigurationContext configuration) {
        return switch (configuration.configurationType()) {
            case UNCONFIGURED -> t -> SatisfiedResult.MAYBE;
            case FULLY_CONFIGURED -> t -> evaluateFully(t, configuration);
            case PARTIALLY_CONFIGURED -> t -> evaluatePartially(t, configuration);
        };
    }

    private static SatisfiedResult evaluateFully(Term term, ConfigurationContext cfg) {
        if (term instanceof ExtensionTerm) {
            ExtensionTerm ext = (ExtensionTerm) term;
            for (ExtensionTerm implemented : cfg.implementedVersions()) {
                if (ext.satisfiedBy(implemented.name(), implemented.version())) {
                    return SatisfiedResult.YES;
                }
            }
            return SatisfiedResult.NO;
        }
        return evaluateCommon(term, cfg);
    }

    private static SatisfiedResult evaluatePartially(Term term, ConfigurationContext cfg) {
        if (term instanceof ExtensionTerm) {
            ExtensionTerm ext = (ExtensionTerm) term;
            for (ExtensionTerm mandatory : cfg.mandatoryRequirements()) {
                if (guarantees(mandatory, ext, cfg)) {
                    return SatisfiedResult.YES;
                }
            }
            for (ExtensionTerm possible : cfg.possibleVersions()) {
                if (ext.satisfiedBy(possible.name(), possible.version())) {
                    return SatisfiedResult.MAYBE;
                }
            }
            return SatisfiedResult.NO;
        }
        return evaluateCommon(term, cfg);
    }

    /**
     * Vero se ogni versione ammessa dal requisito obbligatorio soddisfa anche il termine.
     */
    private static boolean guarantees(ExtensionTerm mandatory, ExtensionTerm term, ConfigurationContext cfg) {
        if (!mandatory.name().equals(term.name())) {
            return false;
        }
        if (mandatory.isExact()) {
            return term.satisfiedBy(mandatory.version());
        }
        List<ExtensionTerm> versions = cfg.satisfyingVersions(mandatory);
        if (versions.isEmpty()) {
            return false;
        }
        for (ExtensionTerm v : versions) {
            if (!term.satisfiedBy(v.version())) {
                return false;
            }
        }
        return true;
    }

    private static SatisfiedResult evaluateCommon(Term term, ConfigurationContext cfg) {
        if (term instanceof ParameterTerm) {
            return ((ParameterTerm) term).evaluate(cfg.parameterValues());
        }
        if (term instanceof XlenTerm) {
            Set<Integer> xlens = cfg.possibleXlens();
            int xlen = ((XlenTerm) term).xlen();
            if (!xlens.contains(xlen)) {
                return SatisfiedResult.NO;
            }
            return xlens.size() == 1 ? SatisfiedResult.YES : SatisfiedResult.MAYBE;
        }
        if (term instanceof FreeTerm) {
            return SatisfiedResult.MAYBE;
        }
        throw new IllegalStateException("Tipo di termine sconosciuto: " + term);
    }

    //endregion

    //region INTERROGAZIONI LOGICHE

    public boolean isSatisfiable() {
        return toLogicTree(true).satisfiable();
    }

    public boolean equivalentTo(Condition other) {
        return toLogicTree(true).equivalent(other.toLogicTree(true));
    }

    /** Vero se ogni configurazione che soddisfa questa condizione soddisfa anche other. */
    public boolean alwaysImplies(Condition other) {
        return toLogicTree(true).alwaysImplies(other.toLogicTree(true));
    }

    /**
     * Spiegazione di un'insoddisfacibilità: insiemi minimi di clausole in conflitto.
     * Vuota se la condizione è soddisfacibile.
     */
    public List<LogicNode> minimalUnsatSubsets() {
        return toLogicTree(true).minimalUnsatSubsets();
    }

    //endregion

    //region ESTENSIONI IMPLICATE

    /**
     * Estensioni richieste dalla condizione: per ogni clausola del prodotto di somme con
     * un solo letterale positivo di estensione e tutti gli altri negati, l'estensione è
     * implicata quando valgono i termini negati.
     */
    public List<ImpliedExtension> impliedExtensionRequirements() {
        List<ImpliedExtension> result = new ArrayList<>();
        for (LogicNode clauseNode : productOfSums()) {
            List<LogicNode> positives = new ArrayList<>();
            List<LogicNode> residual = new ArrayList<>();
            for (LogicNode literal : literalsOf(clauseNode)) {
                if (literal.type() == LogicNodeType.NOT) {
                    residual.add(literal.children().get(0));
                } else {
                    positives.add(literal);
                }
            }
            if (positives.size() == 1 && positives.get(0).term() instanceof ExtensionTerm) {
                result.add(new ImpliedExtension((ExtensionTerm) positives.get(0).term(),
                        LogicNode.conjunction(residual)));
            }
        }
        return result;
    }

    /**
     * Estensioni escluse dalla condizione: in una clausola di soli letterali negati,
     * ogni estensione è esclusa quando valgono gli altri termini della clausola.
     */
    public List<ImpliedExtension> impliedExtensionConflicts() {
        List<ImpliedExtension> result = new ArrayList<>();
        for (LogicNode clauseNode : productOfSums()) {
            List<LogicNode> literals = literalsOf(clauseNode);
            if (!literals.stream().allMatch(l -> l.type() == LogicNodeType.NOT)) {
                continue;
            }
            for (LogicNode literal : literals) {
                Term t = literal.children().get(0).term();
                if (!(t instanceof ExtensionTerm)) {
                    continue;
                }
                List<LogicNode> others = new ArrayList<>();
                for (LogicNode other : literals) {
                    if (other != literal) {
                        others.add(other.children().get(0));
                    }
                }
                result.add(new ImpliedExtension((ExtensionTerm) t, LogicNode.conjunction(others)));
            }
        }
        return result;
    }

    private List<LogicNode> productOfSums() {
        LogicNode pos = toLogicTree(false).minimize(CanonicalizationType.PRODUCT_OF_SUMS);
        return switch (pos.type()) {
            case TRUE, FALSE -> List.of();
            case AND -> pos.children();
            default -> List.of(pos);
        };
    }

    private static List<LogicNode> literalsOf(LogicNode clauseNode) {
        return clauseNode.type() == LogicNodeType.OR ? clauseNode.children() : List.of(clauseNode);
    }

    //endregion

    //region RAPPRESENTAZIONI

    public Clause getClause() {
        return clause;
    }

    public ConfigurationContext getContext() {
        return context;
    }

    /** Forma dichiarativa dell'albero non espanso. */
    public Object toDeclarative() {
        return ConditionWriter.toDeclarative(toLogicTree(false));
    }

    public String toPrettyString() {
        return toLogicTree(false).toPrettyString();
    }

    @Override
    public String toString() {
        return toLogicTree(false).toString();
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Condition && clause.equals(((Condition) obj).clause);
    }

    @Override
    public int hashCode() {
        return clause.hashCode();
    }
}

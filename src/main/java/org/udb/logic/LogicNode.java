package org.udb.logic;

import org.udb.logic.parser.EquationParser;
import org.udb.minimize.QuineMcCluskey;
import org.udb.sat.DimacsFormula;
import org.udb.term.ExtensionTerm;
import org.udb.term.FreeTerm;
import org.udb.term.ParameterTerm;
import org.udb.term.SatisfiedResult;
import org.udb.term.Term;
import org.udb.term.XlenTerm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * NODO LOGICO - Albero immutabile di connettivi booleani su termini tipizzati
 *
 * Invarianti di costruzione:
 * - TERM e NOT hanno esattamente un figlio (il termine, o il sotto-albero negato)
 * - AND, OR, XOR e NONE (NOR n-ario) hanno almeno due figli
 * - IF (implicazione antecedente → conseguente) ha esattamente due figli
 * - TRUE e FALSE non hanno figli
 *
 * Un nodo non viene mai modificato dopo la costruzione: ogni trasformazione restituisce
 * un nuovo albero. Le proprietà costose (termini, letterali, forme normali, verdetto di
 * soddisfacibilità) vengono calcolate al più una volta per nodo.
 *
 * Uguaglianza e hash sono strutturali: due alberi costruiti separatamente con la stessa
 * forma sono uguali e condividono la voce nella cache di soddisfacibilità.
 */
public final class LogicNode {

    private static final Logger LOGGER = Logger.getLogger(LogicNode.class.getName());

    public static final LogicNode TRUE = new LogicNode(LogicNodeType.TRUE, List.of());
    public static final LogicNode FALSE = new LogicNode(LogicNodeType.FALSE, List.of());
    public static final LogicNode XLEN32 = term(new XlenTerm(32));
    public static final LogicNode XLEN64 = term(new XlenTerm(64));

    //region STRUTTURA

    private final LogicNodeType type;
    private final Term term;
    private final List<LogicNode> children;

    //endregion

    //region MEMOIZZAZIONE

    private final Lazy<List<Term>> terms = Lazy.of(this::collectTerms);
    private final Lazy<List<Term>> literals = Lazy.of(this::collectLiterals);
    private final Lazy<Boolean> cnf = Lazy.of(this::checkCnf);
    private final Lazy<Boolean> nestedCnf = Lazy.of(this::checkNestedCnf);
    private final Lazy<LogicNode> reduced = Lazy.of(this::doReduce);
    private final Lazy<LogicNode> nnf = Lazy.of(() -> doNnf(this));
    private final Lazy<Integer> hash = Lazy.of(this::computeHash);

    private volatile LogicNode equivCnf;
    private volatile LogicNode equisatCnf;
    private volatile Boolean satisfiable;
    private final Map<CanonicalizationType, LogicNode> minimized = Collections.synchronizedMap(
            new EnumMap<>(CanonicalizationType.class));

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce un nodo interno o una costante.
     *
     * @throws IllegalArgumentException se il numero di figli non rispetta il tipo,
     *         o se si tenta di costruire un TERM (usare {@link #term(Term)})
     */
    public LogicNode(LogicNodeType type, List<LogicNode> children) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(children, "children");
        if (type == LogicNodeType.TERM) {
            throw new IllegalArgumentException("Un nodo TERM si costruisce con LogicNode.term(Term)");
        }
        for (LogicNode child : children) {
            if (child == null) {
                throw new IllegalArgumentException("Figlio null in un nodo " + type);
            }
        }
        switch (type) {
            case TRUE, FALSE -> {
                if (!children.isEmpty()) {
                    throw new IllegalArgumentException("Un nodo " + type + " non può avere figli");
                }
            }
            case NOT -> {
                if (children.size() != 1) {
                    throw new IllegalArgumentException("Un nodo NOT richiede esattamente un figlio, trovati " + children.size());
                }
            }
            case IF -> {
                if (children.size() != 2) {
                    throw new IllegalArgumentException("Un nodo IF richiede esattamente due figli, trovati " + children.size());
                }
            }
            default -> {
                if (children.size() < 2) {
                    throw new IllegalArgumentException("Un nodo " + type + " richiede almeno due figli, trovati " + children.size());
                }
            }
        }
        this.type = type;
        this.term = null;
        this.children = List.copyOf(children);
    }

    private LogicNode(Term term) {
        this.type = LogicNodeType.TERM;
        this.term = Objects.requireNonNull(term, "term");
        this.children = List.of();
    }

    public static LogicNode term(Term term) {
        return new LogicNode(term);
    }

    public static LogicNode not(LogicNode child) {
        return new LogicNode(LogicNodeType.NOT, List.of(child));
    }

    public static LogicNode and(List<LogicNode> children) {
        return new LogicNode(LogicNodeType.AND, children);
    }

    public static LogicNode and(LogicNode... children) {
        return and(Arrays.asList(children));
    }

    public static LogicNode or(List<LogicNode> children) {
        return new LogicNode(LogicNodeType.OR, children);
    }

    public static LogicNode or(LogicNode... children) {
        return or(Arrays.asList(children));
    }

    public static LogicNode xor(List<LogicNode> children) {
        return new LogicNode(LogicNodeType.XOR, children);
    }

    public static LogicNode xor(LogicNode... children) {
        return xor(Arrays.asList(children));
    }

    public static LogicNode none(List<LogicNode> children) {
        return new LogicNode(LogicNodeType.NONE, children);
    }

    public static LogicNode none(LogicNode... children) {
        return none(Arrays.asList(children));
    }

    public static LogicNode implies(LogicNode antecedent, LogicNode consequent) {
        return new LogicNode(LogicNodeType.IF, List.of(antecedent, consequent));
    }

    /** AND dei nodi; TRUE se vuota, il nodo stesso se singolo. */
    public static LogicNode conjunction(List<LogicNode> nodes) {
        if (nodes.isEmpty()) {
            return TRUE;
        }
        return nodes.size() == 1 ? nodes.get(0) : and(nodes);
    }

    /** OR dei nodi; FALSE se vuota, il nodo stesso se singolo. */
    public static LogicNode disjunction(List<LogicNode> nodes) {
        if (nodes.isEmpty()) {
            return FALSE;
        }
        return nodes.size() == 1 ? nodes.get(0) : or(nodes);
    }

    //endregion

    //region ACCESSORS

    public LogicNodeType type() {
        return type;
    }

    /** Figli del nodo; vuota per TERM e per le costanti. */
    public List<LogicNode> children() {
        return children;
    }

    /**
     * @throws IllegalStateException se il nodo non è un TERM
     */
    public Term term() {
        if (type != LogicNodeType.TERM) {
            throw new IllegalStateException("Nodo " + type + " non ha un termine");
        }
        return term;
    }

    private LogicNode child(int index) {
        return children.get(index);
    }

    private boolean isLiteral() {
        return type == LogicNodeType.TERM || (type == LogicNodeType.NOT && child(0).type == LogicNodeType.TERM);
    }

    private boolean isConstant() {
        return type == LogicNodeType.TRUE || type == LogicNodeType.FALSE;
    }

    /** Termini distinti, nell'ordine della prima occorrenza in profondità. */
    public List<Term> terms() {
        return terms.get();
    }

    /** Tutte le occorrenze di termini, ripetizioni comprese. */
    public List<Term> literals() {
        return literals.get();
    }

    private List<Term> collectTerms() {
        return List.copyOf(new LinkedHashSet<>(literals()));
    }

    private List<Term> collectLiterals() {
        if (type == LogicNodeType.TERM) {
            return List.of(term);
        }
        List<Term> out = new ArrayList<>();
        for (LogicNode c : children) {
            out.addAll(c.literals());
        }
        return Collections.unmodifiableList(out);
    }

    /** Termini distinti escludendo gli antecedenti di ogni IF. */
    public List<Term> termsExcludingAntecedents() {
        Set<Term> out = new LinkedHashSet<>();
        collectTermsExcludingAntecedents(out);
        return List.copyOf(out);
    }

    private void collectTermsExcludingAntecedents(Set<Term> out) {
        switch (type) {
            case TERM -> out.add(term);
            case IF -> child(1).collectTermsExcludingAntecedents(out);
            default -> children.forEach(c -> c.collectTermsExcludingAntecedents(out));
        }
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valutazione a tre valori: le foglie vengono risolte dal callback.
     */
    public SatisfiedResult evaluate(TermEvaluator evaluator) {
        switch (type) {
            case TRUE:
                return SatisfiedResult.YES;
            case FALSE:
                return SatisfiedResult.NO;
            case TERM:
                return evaluator.evaluate(term);
            case NOT:
                return child(0).evaluate(evaluator).negate();
            case AND: {
                boolean allYes = true;
                for (LogicNode c : children) {
                    SatisfiedResult r = c.evaluate(evaluator);
                    if (r == SatisfiedResult.NO) {
                        return SatisfiedResult.NO;
                    }
                    allYes &= r == SatisfiedResult.YES;
                }
                return allYes ? SatisfiedResult.YES : SatisfiedResult.MAYBE;
            }
            case OR: {
                boolean allNo = true;
                for (LogicNode c : children) {
                    SatisfiedResult r = c.evaluate(evaluator);
                    if (r == SatisfiedResult.YES) {
                        return SatisfiedResult.YES;
                    }
                    allNo &= r == SatisfiedResult.NO;
                }
                return allNo ? SatisfiedResult.NO : SatisfiedResult.MAYBE;
            }
            case NONE: {
                boolean allNo = true;
                for (LogicNode c : children) {
                    SatisfiedResult r = c.evaluate(evaluator);
                    if (r == SatisfiedResult.YES) {
                        return SatisfiedResult.NO;
                    }
                    allNo &= r == SatisfiedResult.NO;
                }
                return allNo ? SatisfiedResult.YES : SatisfiedResult.MAYBE;
            }
            case XOR: {
                int yes = 0;
                boolean maybe = false;
                for (LogicNode c : children) {
                    SatisfiedResult r = c.evaluate(evaluator);
                    if (r == SatisfiedResult.YES && ++yes > 1) {
                        return SatisfiedResult.NO;
                    }
                    maybe |= r == SatisfiedResult.MAYBE;
                }
                if (maybe) {
                    return SatisfiedResult.MAYBE;
                }
                return yes == 1 ? SatisfiedResult.YES : SatisfiedResult.NO;
            }
            case IF: {
                SatisfiedResult antecedent = child(0).evaluate(evaluator);
                if (antecedent == SatisfiedResult.NO) {
                    return SatisfiedResult.YES;
                }
                SatisfiedResult consequent = child(1).evaluate(evaluator);
                if (consequent == SatisfiedResult.YES) {
                    return SatisfiedResult.YES;
                }
                if (antecedent == SatisfiedResult.YES && consequent == SatisfiedResult.NO) {
                    return SatisfiedResult.NO;
                }
                return SatisfiedResult.MAYBE;
            }
            default:
                throw new IllegalStateException("Tipo di nodo sconosciuto: " + type);
        }
    }

    /**
     * Sostituisce con TRUE/FALSE i termini che il callback sa risolvere, lasciando
     * intatti gli altri. Non semplifica: vedi {@link #reduce()}.
     */
    public LogicNode partialEvaluate(TermEvaluator evaluator) {
        if (type == LogicNodeType.TERM) {
            SatisfiedResult r = evaluator.evaluate(term);
            if (r == SatisfiedResult.YES) {
                return TRUE;
            }
            return r == SatisfiedResult.NO ? FALSE : this;
        }
        if (isConstant()) {
            return this;
        }
        return new LogicNode(type, children.stream().map(c -> c.partialEvaluate(evaluator)).collect(Collectors.toList()));
    }

    /**
     * Ricostruisce l'albero sostituendo i termini; se la funzione restituisce null
     * il termine resta invariato.
     */
    public LogicNode replaceTerms(Function<Term, LogicNode> replacement) {
        if (type == LogicNodeType.TERM) {
            LogicNode r = replacement.apply(term);
            return r == null ? this : r;
        }
        if (isConstant()) {
            return this;
        }
        return new LogicNode(type, children.stream().map(c -> c.replaceTerms(replacement)).collect(Collectors.toList()));
    }

    //endregion

    //region SEMPLIFICAZIONE

    /**
     * Semplificazione locale: costanti eliminate o propagate, contraddizioni e tautologie
     * tra un termine e la sua negazione, doppia negazione, IF con costanti.
     */
    public LogicNode reduce() {
        return reduced.get();
    }

    private LogicNode doReduce() {
        switch (type) {
            case TRUE:
            case FALSE:
            case TERM:
                return this;
            case NOT: {
                LogicNode c = child(0).reduce();
                return switch (c.type) {
                    case NOT -> c.child(0);
                    case TRUE -> FALSE;
                    case FALSE -> TRUE;
                    default -> c == child(0) ? this : not(c);
                };
            }
            case AND: {
                List<LogicNode> kids = reducedChildren();
                if (kids.stream().anyMatch(k -> k.type == LogicNodeType.FALSE) || hasComplementaryPair(kids)) {
                    return FALSE;
                }
                kids.removeIf(k -> k.type == LogicNodeType.TRUE);
                return conjunction(kids);
            }
            case OR: {
                List<LogicNode> kids = reducedChildren();
                if (kids.stream().anyMatch(k -> k.type == LogicNodeType.TRUE) || hasComplementaryPair(kids)) {
                    return TRUE;
                }
                kids.removeIf(k -> k.type == LogicNodeType.FALSE);
                return disjunction(kids);
            }
            case XOR: {
                List<LogicNode> kids = reducedChildren();
                kids.removeIf(k -> k.type == LogicNodeType.FALSE);
                long trues = kids.stream().filter(k -> k.type == LogicNodeType.TRUE).count();
                if (trues > 1) {
                    return FALSE;
                }
                kids.removeIf(k -> k.type == LogicNodeType.TRUE);
                if (trues == 1) {
                    // uno è già vero: tutti gli altri devono essere falsi
                    return negatedDisjunction(kids);
                }
                if (kids.isEmpty()) {
                    return FALSE;
                }
                if (kids.size() == 1) {
                    return kids.get(0);
                }
                if (kids.size() == 2 && kids.get(0).type == LogicNodeType.TERM && kids.get(0).equals(kids.get(1))) {
                    return FALSE;
                }
                return xor(kids);
            }
            case NONE: {
                List<LogicNode> kids = reducedChildren();
                if (kids.stream().anyMatch(k -> k.type == LogicNodeType.TRUE)) {
                    return FALSE;
                }
                kids.removeIf(k -> k.type == LogicNodeType.FALSE);
                return negatedDisjunction(kids);
            }
            case IF: {
                LogicNode antecedent = child(0).reduce();
                LogicNode consequent = child(1).reduce();
                if (antecedent.type == LogicNodeType.TRUE) {
                    return consequent;
                }
                if (antecedent.type == LogicNodeType.FALSE || consequent.type == LogicNodeType.TRUE) {
                    return TRUE;
                }
                if (consequent.type == LogicNodeType.FALSE) {
                    return not(antecedent).reduce();
                }
                return implies(antecedent, consequent);
            }
            default:
                throw new IllegalStateException("Tipo di nodo sconosciuto: " + type);
        }
    }

    private List<LogicNode> reducedChildren() {
        List<LogicNode> out = new ArrayList<>(children.size());
        for (LogicNode c : children) {
            out.add(c.reduce());
        }
        return out;
    }

    /** NOR dei nodi, già semplificato per 0 e 1 elementi. */
    private static LogicNode negatedDisjunction(List<LogicNode> kids) {
        if (kids.isEmpty()) {
            return TRUE;
        }
        if (kids.size() == 1) {
            return not(kids.get(0)).reduce();
        }
        return none(kids);
    }

    private static boolean hasComplementaryPair(List<LogicNode> kids) {
        Set<Term> positive = new HashSet<>();
        Set<Term> negative = new HashSet<>();
        for (LogicNode k : kids) {
            if (k.type == LogicNodeType.TERM) {
                positive.add(k.term);
            } else if (k.type == LogicNodeType.NOT && k.child(0).type == LogicNodeType.TERM) {
                negative.add(k.child(0).term);
            }
        }
        positive.retainAll(negative);
        return !positive.isEmpty();
    }

    //endregion

    //region FORMA NORMALE NEGATIVA

    /**
     * Negazione spinta fino alle foglie: XOR, NONE e IF vengono espansi in AND/OR.
     */
    public LogicNode nnf() {
        return nnf.get();
    }

    public boolean isNnf() {
        return switch (type) {
            case TRUE, FALSE, TERM -> true;
            case NOT -> child(0).type == LogicNodeType.TERM;
            case AND, OR -> children.stream().allMatch(LogicNode::isNnf);
            default -> false;
        };
    }

    private static LogicNode doNnf(LogicNode node) {
        switch (node.type) {
            case TRUE:
            case FALSE:
            case TERM:
                return node;
            case NOT:
                return doNnfForNot(node.child(0));
            case AND:
            case OR:
                return new LogicNode(node.type, mapChildren(node.children, LogicNode::doNnf));
            case NONE:
                // NOR(A, B) = ¬A ∧ ¬B
                return and(mapChildren(node.children, LogicNode::doNnfForNot));
            case XOR: {
                // esattamente uno: (A ∧ ¬B ∧ ¬C) ∨ (¬A ∧ B ∧ ¬C) ∨ ...
                List<LogicNode> products = new ArrayList<>();
                for (int i = 0; i < node.children.size(); i++) {
                    List<LogicNode> product = new ArrayList<>();
                    for (int j = 0; j < node.children.size(); j++) {
                        LogicNode c = node.child(j);
                        product.add(i == j ? doNnf(c) : doNnfForNot(c));
                    }
                    products.add(and(product));
                }
                return or(products);
            }
            case IF:
                return or(doNnfForNot(node.child(0)), doNnf(node.child(1)));
            default:
                throw new IllegalStateException("Tipo di nodo sconosciuto: " + node.type);
        }
    }

    /** NNF di ¬child. */
    private static LogicNode doNnfForNot(LogicNode child) {
        return switch (child.type) {
            case TERM -> not(child);
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case NOT -> doNnf(child.child(0));
            case AND -> or(mapChildren(child.children, LogicNode::doNnfForNot));
            case OR -> and(mapChildren(child.children, LogicNode::doNnfForNot));
            case XOR, NONE, IF -> doNnfForNot(doNnf(child));
        };
    }

    private static List<LogicNode> mapChildren(List<LogicNode> nodes, Function<LogicNode, LogicNode> f) {
        List<LogicNode> out = new ArrayList<>(nodes.size());
        for (LogicNode n : nodes) {
            out.add(f.apply(n));
        }
        return out;
    }

    //endregion

    //region RAGGRUPPAMENTO

    /**
     * Riscrive AND/OR n-ari in catene binarie associate a sinistra:
     * (A ∨ B ∨ C) diventa ((A ∨ B) ∨ C). XOR passa per la NNF, NONE diventa ¬(∨),
     * IF diventa ¬A ∨ B.
     */
    public LogicNode groupBy2() {
        switch (type) {
            case TRUE:
            case FALSE:
            case TERM:
                return this;
            case NOT:
                return not(child(0).groupBy2());
            case AND:
            case OR:
                return chain(type, mapChildren(children, LogicNode::groupBy2));
            case XOR:
                return nnf().groupBy2();
            case NONE:
                return not(chain(LogicNodeType.OR, mapChildren(children, LogicNode::groupBy2)));
            case IF:
                return or(not(child(0).groupBy2()), child(1).groupBy2());
            default:
                throw new IllegalStateException("Tipo di nodo sconosciuto: " + type);
        }
    }

    private static LogicNode chain(LogicNodeType type, List<LogicNode> nodes) {
        LogicNode root = new LogicNode(type, List.of(nodes.get(0), nodes.get(1)));
        for (int i = 2; i < nodes.size(); i++) {
            root = new LogicNode(type, List.of(root, nodes.get(i)));
        }
        return root;
    }

    /**
     * Come {@link #groupBy2()} per AND e OR, lasciando invariati gli altri connettivi.
     */
    public LogicNode parenthesize() {
        if (type == LogicNodeType.AND || type == LogicNodeType.OR) {
            return chain(type, mapChildren(children, LogicNode::parenthesize));
        }
        if (type == LogicNodeType.TERM || isConstant()) {
            return this;
        }
        return new LogicNode(type, mapChildren(children, LogicNode::parenthesize));
    }

    //endregion

    //region FORME CANONICHE

    /** Vero se l'albero è un AND di clausole OR di letterali (o una sua parte). */
    public boolean isCnf() {
        return cnf.get();
    }

    private boolean checkCnf() {
        return switch (type) {
            case TRUE, FALSE, TERM -> true;
            case NOT -> child(0).type == LogicNodeType.TERM;
            case OR -> children.stream().allMatch(c -> c.isLiteral() || c.isConstant());
            case AND -> children.stream().allMatch(c -> c.isLiteral() || c.isConstant()
                    || (c.type == LogicNodeType.OR && c.isCnf()));
            default -> false;
        };
    }

    /** Vero se l'albero è un OR di prodotti AND di letterali (o una sua parte). */
    public boolean isDnf() {
        return switch (type) {
            case TRUE, FALSE, TERM -> true;
            case NOT -> child(0).type == LogicNodeType.TERM;
            case AND -> children.stream().allMatch(c -> c.isLiteral() || c.isConstant());
            case OR -> children.stream().allMatch(c -> c.isLiteral() || c.isConstant()
                    || (c.type == LogicNodeType.AND && c.isDnf()));
            default -> false;
        };
    }

    /**
     * Vero se l'albero, appiattito, sarebbe in CNF: AND annidati senza OR antenati,
     * OR annidati senza AND discendenti.
     */
    public boolean isNestedCnf() {
        return nestedCnf.get();
    }

    private boolean checkNestedCnf() {
        return switch (type) {
            case TRUE, FALSE, TERM -> true;
            case NOT -> child(0).type == LogicNodeType.TERM;
            case AND -> children.stream().allMatch(LogicNode::isNestedCnf);
            case OR -> children.stream().allMatch(LogicNode::isNestedClause);
            default -> false;
        };
    }

    private boolean isNestedClause() {
        if (isLiteral() || isConstant()) {
            return true;
        }
        return type == LogicNodeType.OR && children.stream().allMatch(LogicNode::isNestedClause);
    }

    /**
     * Appiattisce AND e OR annidati per associatività, eliminando le costanti neutre
     * e propagando quelle assorbenti.
     */
    public LogicNode flattenCnf() {
        if (type != LogicNodeType.AND && type != LogicNodeType.OR) {
            return this;
        }
        LogicNodeType absorbing = type == LogicNodeType.AND ? LogicNodeType.FALSE : LogicNodeType.TRUE;
        LogicNodeType neutral = type == LogicNodeType.AND ? LogicNodeType.TRUE : LogicNodeType.FALSE;
        List<LogicNode> flat = new ArrayList<>();
        for (LogicNode c : children) {
            LogicNode f = c.flattenCnf();
            if (f.type == absorbing) {
                return f;
            }
            if (f.type == neutral) {
                continue;
            }
            if (f.type == type) {
                flat.addAll(f.children);
            } else {
                flat.add(f);
            }
        }
        if (flat.isEmpty()) {
            return neutral == LogicNodeType.TRUE ? TRUE : FALSE;
        }
        return flat.size() == 1 ? flat.get(0) : new LogicNode(type, flat);
    }

    /**
     * Applica De Morgan a una negazione di una forma CNF o DNF, fino alle foglie.
     *
     * @throws IllegalStateException se il nodo non è una negazione o contiene XOR, NONE o IF
     */
    public LogicNode distributeNot() {
        if (type != LogicNodeType.NOT) {
            throw new IllegalStateException("distributeNot richiede una negazione, trovato " + type);
        }
        LogicNode c = child(0);
        return switch (c.type) {
            case AND -> or(mapChildren(c.children, k -> not(k).distributeNot()));
            case OR -> and(mapChildren(c.children, k -> not(k).distributeNot()));
            case NOT -> c.child(0);
            case TERM -> this;
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case XOR, NONE, IF -> throw new IllegalStateException(
                    "distributeNot richiede una forma CNF o DNF, trovato " + c.type);
        };
    }

    /**
     * CNF logicamente equivalente, ottenuta distribuendo OR su AND.
     *
     * @param raiseOnExplosion se true interrompe la conversione oltre la soglia di clausole
     * @throws SizeExplosionException se la soglia viene superata e raiseOnExplosion è true
     */
    public LogicNode equivCnf(boolean raiseOnExplosion) {
        return equivCnf(raiseOnExplosion, LogicEngine.getDefault().getConfiguration());
    }

    LogicNode equivCnf(boolean raiseOnExplosion, EngineConfiguration config) {
        LogicNode memo = equivCnf;
        if (memo != null) {
            return memo;
        }
        LogicNode result;
        if (isCnf()) {
            result = this;
        } else if (isNestedCnf()) {
            result = flattenCnf().reduce();
        } else {
            LogicNode r = reduce();
            if (r.isConstant()) {
                result = r;
            } else {
                LogicNode grouped = r.nnf().groupBy2();
                int[] clauseCount = {0};
                LogicNode unflattened = doEquivCnf(grouped, clauseCount, raiseOnExplosion,
                        config.getCnfExplosionThreshold());
                result = unflattened.flattenCnf().reduce();
                LOGGER.finest(() -> "CNF equivalente con " + clauseCount[0] + " clausole distribuite: " + result);
            }
        }
        equivCnf = result;
        return result;
    }

    private static LogicNode doEquivCnf(LogicNode node, int[] clauseCount, boolean raise, int threshold) {
        if (node.isNestedCnf()) {
            return node;
        }
        if (raise && clauseCount[0] > threshold) {
            throw new SizeExplosionException(clauseCount[0], threshold);
        }
        switch (node.type) {
            case AND:
                return and(mapChildren(node.children, c -> doEquivCnf(c, clauseCount, raise, threshold).reduce())).reduce();
            case OR: {
                LogicNode acc = doEquivCnf(node.child(0), clauseCount, raise, threshold).reduce();
                for (int i = 1; i < node.children.size(); i++) {
                    LogicNode next = doEquivCnf(node.child(i), clauseCount, raise, threshold).reduce();
                    acc = distributeOr(acc, next, clauseCount, raise, threshold);
                }
                return acc;
            }
            default:
                if (node.isLiteral() || node.isConstant()) {
                    return node.reduce();
                }
                throw new IllegalStateException("Nodo inatteso nella conversione CNF: " + node.toString(LogicSymbolFormat.C));
        }
    }

    /**
     * (A ∧ B) ∨ C = (A ∨ C) ∧ (B ∨ C), con left e right già in CNF annidata.
     */
    private static LogicNode distributeOr(LogicNode left, LogicNode right, int[] clauseCount,
                                          boolean raise, int threshold) {
        if (left.type == LogicNodeType.AND) {
            clauseCount[0] += left.children.size();
            return and(mapChildren(left.children,
                    c -> doEquivCnf(or(c, right), clauseCount, raise, threshold))).reduce();
        }
        if (right.type == LogicNodeType.AND) {
            clauseCount[0] += right.children.size();
            return and(mapChildren(right.children,
                    c -> doEquivCnf(or(left, c), clauseCount, raise, threshold))).reduce();
        }
        return or(left, right).reduce();
    }

    /**
     * CNF equisoddisfacibile: Tseytin per formule grandi, altrimenti CNF equivalente
     * con ripiego su Tseytin se la conversione esplode.
     */
    public LogicNode equisatCnf() {
        return equisatCnf(LogicEngine.getDefault().getConfiguration());
    }

    LogicNode equisatCnf(EngineConfiguration config) {
        LogicNode memo = equisatCnf;
        if (memo != null) {
            return memo;
        }
        LogicNode result;
        if (isConstant()) {
            result = this;
        } else if (equivCnf != null) {
            result = equivCnf;
        } else if (terms().size() > config.getTseytinTermThreshold()
                || literals().size() > config.getTseytinLiteralThreshold()) {
            result = tseytin();
        } else {
            try {
                result = equivCnf(true, config);
            } catch (SizeExplosionException e) {
                LOGGER.log(Level.WARNING, "Conversione CNF equivalente esplosa ({0} clausole), uso Tseytin",
                        e.getClauseCount());
                result = tseytin();
            }
        }
        equisatCnf = result;
        return result;
    }

    /**
     * CNF equisoddisfacibile con variabili sintetiche ({@link FreeTerm}).
     */
    public LogicNode tseytin() {
        return new TseytinConverter().convert(this);
    }

    //endregion

    //region MINIMIZZAZIONE

    /**
     * Forma a due livelli minima equivalente (somma di prodotti o prodotto di somme).
     */
    public LogicNode minimize(CanonicalizationType resultType) {
        return minimize(resultType, LogicEngine.getDefault());
    }

    public LogicNode minimize(CanonicalizationType resultType, LogicEngine engine) {
        LogicNode memo = minimized.get(resultType);
        if (memo != null) {
            return memo;
        }
        EngineConfiguration config = engine.getConfiguration();
        int termCount = terms().size();
        LogicNode result;
        if (termCount <= config.getQuineMcCluskeyMaxTerms()) {
            result = QuineMcCluskey.minimize(this, resultType);
        } else if (resultType == CanonicalizationType.PRODUCT_OF_SUMS
                && termCount > config.getNestedCnfTermThreshold()
                && nnf().isNestedCnf()
                && termCount == literals().size()) {
            // già minima: ogni termine compare una sola volta
            result = equivCnf(false, config);
        } else {
            result = engine.getMinimizer().minimize(this, resultType, true);
        }
        minimized.put(resultType, result);
        return result;
    }

    //endregion

    //region SODDISFACIBILITA'

    public boolean satisfiable() {
        return satisfiable(LogicEngine.getDefault());
    }

    /**
     * Forza bruta per formule piccole, altrimenti solutore SAT sulla CNF equisoddisfacibile
     * con cache strutturale del motore.
     */
    public boolean satisfiable(LogicEngine engine) {
        Boolean memo = satisfiable;
        if (memo != null) {
            return memo;
        }
        EngineConfiguration config = engine.getConfiguration();
        boolean result;
        if (terms().size() <= config.getBruteForceMaxTerms() && literals().size() <= config.getBruteForceMaxLiterals()) {
            long start = System.currentTimeMillis();
            result = bruteForceSatisfiable();
            engine.getStatistics().recordBruteForceSolve(System.currentTimeMillis() - start);
        } else {
            result = engine.solverSatisfiable(this);
        }
        satisfiable = result;
        return result;
    }

    private boolean bruteForceSatisfiable() {
        List<Term> t = terms();
        Map<Term, Integer> index = new HashMap<>();
        for (int i = 0; i < t.size(); i++) {
            index.put(t.get(i), i);
        }
        long rows = 1L << t.size();
        for (long row = 0; row < rows; row++) {
            final long assignment = row;
            if (evaluate(x -> SatisfiedResult.of(((assignment >> index.get(x)) & 1) != 0)) == SatisfiedResult.YES) {
                return true;
            }
        }
        return false;
    }

    public boolean unsatisfiable() {
        return !satisfiable();
    }

    public boolean unsatisfiable(LogicEngine engine) {
        return !satisfiable(engine);
    }

    public boolean equisatisfiable(LogicNode other) {
        return equisatisfiable(other, LogicEngine.getDefault());
    }

    public boolean equisatisfiable(LogicNode other, LogicEngine engine) {
        return satisfiable(engine) == other.satisfiable(engine);
    }

    /** Vero se le due formule hanno la stessa tabella di verità. */
    public boolean equivalent(LogicNode other) {
        return equivalent(other, LogicEngine.getDefault());
    }

    public boolean equivalent(LogicNode other, LogicEngine engine) {
        // ¬((¬A ∨ B) ∧ (¬B ∨ A)) insoddisfacibile
        LogicNode biconditional = and(or(not(this), other), or(not(other), this));
        return not(biconditional).unsatisfiable(engine);
    }

    /** Vero se ogni assegnamento che rende vera questa formula rende vera anche other. */
    public boolean alwaysImplies(LogicNode other) {
        return alwaysImplies(other, LogicEngine.getDefault());
    }

    public boolean alwaysImplies(LogicNode other, LogicEngine engine) {
        return and(this, not(other)).unsatisfiable(engine);
    }

    /**
     * Vero se la formula diventa sicuramente falsa quando i termini selezionati sono
     * falsi (gli altri restano indeterminati).
     */
    public boolean satisfiabilityDependsOn(Predicate<Term> selected) {
        TermEvaluator evaluator = t -> {
            if (t instanceof FreeTerm || selected.test(t)) {
                return SatisfiedResult.NO;
            }
            return SatisfiedResult.MAYBE;
        };
        return evaluate(evaluator) == SatisfiedResult.NO;
    }

    /**
     * Sottoinsiemi minimi di clausole insoddisfacibili; lista vuota se la formula è
     * soddisfacibile.
     *
     * Procedura:
     * • forma normale congiuntiva equivalente dell'albero semplificato
     * • codifica DIMACS, una clausola per sotto-albero di primo livello
     * • estrazione affidata all'estrattore del motore (interno: un solo sottoinsieme)
     * • ogni sottoinsieme torna albero, con i termini originali
     */
    public List<LogicNode> minimalUnsatSubsets() {
        return minimalUnsatSubsets(LogicEngine.getDefault());
    }

    public List<LogicNode> minimalUnsatSubsets(LogicEngine engine) {
        if (satisfiable(engine)) {
            return List.of();
        }
        LogicNode cnfForm = reduce().equivCnf(false, engine.getConfiguration());
        if (cnfForm.isConstant()) {
            return List.of(cnfForm);
        }
        DimacsFormula formula = DimacsFormula.fromCnf(cnfForm);
        List<LogicNode> subsets = new ArrayList<>();
        for (DimacsFormula mus : engine.getUnsatCoreExtractor().minimalUnsatSubsets(formula)) {
            subsets.add(mus.toLogicNode());
        }
        LOGGER.fine(() -> subsets.size() + " sottoinsiemi insoddisfacibili minimi per " + this);
        return subsets;
    }

    //endregion

    //region SERIALIZZAZIONE

    /**
     * Equazione per eqntott ("out = ..."), con i termini rinominati a, b, ..., z, aa, ...
     */
    public EqntottEquation toEqntott() {
        Map<Term, String> names = new LinkedHashMap<>();
        String next = "a";
        for (Term t : terms()) {
            names.put(t, next);
            next = nextName(next);
        }
        Map<String, Term> byName = new LinkedHashMap<>();
        names.forEach((t, n) -> byName.put(n, t));
        return new EqntottEquation("out = " + eqntott(this, names), byName);
    }

    static String nextName(String name) {
        char[] chars = name.toCharArray();
        for (int i = chars.length - 1; i >= 0; i--) {
            if (chars[i] != 'z') {
                chars[i]++;
                return new String(chars);
            }
            chars[i] = 'a';
        }
        return "a" + new String(chars);
    }

    private static String eqntott(LogicNode node, Map<Term, String> names) {
        return switch (node.type) {
            case TRUE -> "1";
            case FALSE -> "0";
            case TERM -> names.get(node.term);
            case NOT -> "!(" + eqntott(node.child(0), names) + ")";
            case AND -> node.children.stream().map(c -> eqntott(c, names)).collect(Collectors.joining(" & ", "(", ")"));
            case OR -> node.children.stream().map(c -> eqntott(c, names)).collect(Collectors.joining(" | ", "(", ")"));
            case NONE -> eqntott(not(or(node.children)), names);
            case XOR, IF -> eqntott(node.nnf(), names);
        };
    }

    /**
     * Interpreta un'equazione eqntott/espresso sui termini indicati.
     */
    public static LogicNode fromEqntott(String equation, Map<String, Term> termMap) {
        return EquationParser.parse(equation, termMap);
    }

    /**
     * Testo DIMACS dell'albero, che deve essere in CNF.
     *
     * @throws IllegalStateException se l'albero non è in CNF o è una costante
     */
    public String toDimacs() {
        return DimacsFormula.fromCnf(this).toDimacs();
    }

    /**
     * Ricostruisce un albero da testo DIMACS, con le variabili numerate secondo
     * i termini di questo albero.
     */
    public LogicNode fromDimacs(String dimacs) {
        return DimacsFormula.parse(dimacs, terms()).toLogicNode();
    }

    //endregion

    //region RESA TESTUALE

    @Override
    public String toString() {
        return toString(LogicSymbolFormat.PREDICATE);
    }

    public String toString(LogicSymbolFormat format) {
        return render(format, t -> t.toString());
    }

    /**
     * Come {@link #toString(LogicSymbolFormat)}, annotando ogni termine con il suo valore.
     */
    public String toStringWithValue(TermEvaluator evaluator, LogicSymbolFormat format) {
        return render(format, t -> {
            String value = switch (evaluator.evaluate(t)) {
                case YES -> "{true}";
                case NO -> "{false}";
                case MAYBE -> "{unknown}";
            };
            return "`" + t + "`" + value;
        });
    }

    private String render(LogicSymbolFormat f, Function<Term, String> leaf) {
        return switch (type) {
            case TRUE -> f.trueSymbol();
            case FALSE -> f.falseSymbol();
            case TERM -> leaf.apply(term);
            case NOT -> f.not() + child(0).render(f, leaf);
            case AND -> join(f, leaf, " " + f.and() + " ");
            case OR -> join(f, leaf, " " + f.or() + " ");
            case XOR -> join(f, leaf, " " + f.xor() + " ");
            case NONE -> f.not() + join(f, leaf, " " + f.or() + " ");
            case IF -> "(" + child(0).render(f, leaf) + " " + f.implies() + " " + child(1).render(f, leaf) + ")";
        };
    }

    private String join(LogicSymbolFormat f, Function<Term, String> leaf, String separator) {
        return children.stream().map(c -> c.render(f, leaf)).collect(Collectors.joining(separator, "(", ")"));
    }

    /** Forma discorsiva, che può tralasciare dettagli. */
    public String toPrettyString() {
        return switch (type) {
            case TRUE -> "true";
            case FALSE -> "false";
            case TERM -> term.toPrettyString();
            case NOT -> "not " + child(0).toPrettyString();
            case AND -> prettyJoin(" and ", "(", ")");
            case OR -> prettyJoin(" or ", "(", ")");
            case XOR -> prettyJoin(" xor ", "(", ")");
            case NONE -> prettyJoin(", ", "none of (", ")");
            case IF -> "if " + child(0).toPrettyString() + " then " + child(1).toPrettyString();
        };
    }

    private String prettyJoin(String separator, String prefix, String suffix) {
        return children.stream().map(LogicNode::toPrettyString).collect(Collectors.joining(separator, prefix, suffix));
    }

    /**
     * Forma asciidoc con segnaposto per i riferimenti incrociati.
     *
     * @throws IllegalStateException se l'albero contiene variabili sintetiche
     */
    public String toAsciidoc(boolean includeVersions) {
        return switch (type) {
            case TRUE -> "true";
            case FALSE -> "false";
            case TERM -> term instanceof ExtensionTerm
                    ? ((ExtensionTerm) term).toAsciidoc(includeVersions)
                    : term.toAsciidoc();
            case NOT -> {
                LogicNode c = child(0);
                if (c.type == LogicNodeType.TERM && c.term instanceof ParameterTerm) {
                    ParameterTerm negation = ((ParameterTerm) c.term).negate();
                    if (negation != null) {
                        yield negation.toAsciidoc();
                    }
                }
                yield "!" + c.toAsciidoc(includeVersions);
            }
            case AND -> asciidocJoin(includeVersions, " && ", "++(++");
            case OR -> asciidocJoin(includeVersions, " pass:[||] ", "++(++");
            case XOR -> asciidocJoin(includeVersions, " &#2295; ", "++(++");
            case NONE -> asciidocJoin(includeVersions, " pass:[||] ", "!++(++");
            case IF -> "++(++" + child(0).toAsciidoc(includeVersions) + " -> " + child(1).toAsciidoc(includeVersions) + ")";
        };
    }

    private String asciidocJoin(boolean includeVersions, String separator, String prefix) {
        return children.stream().map(c -> c.toAsciidoc(includeVersions))
                .collect(Collectors.joining(separator, prefix, ")"));
    }

    /** Espressione IDL equivalente. */
    public String toIdl() {
        return switch (type) {
            case TRUE -> "true";
            case FALSE -> "false";
            case TERM -> term.toIdl();
            case NOT -> "!" + child(0).toIdl();
            case AND -> children.stream().map(LogicNode::toIdl).collect(Collectors.joining(" && ", "(", ")"));
            case OR -> children.stream().map(LogicNode::toIdl).collect(Collectors.joining(" || ", "(", ")"));
            case XOR, NONE -> nnf().toIdl();
            case IF -> "(!(" + child(0).toIdl() + ") || (" + child(1).toIdl() + "))";
        };
    }

    //endregion

    //region UGUAGLIANZA

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LogicNode)) {
            return false;
        }
        LogicNode o = (LogicNode) obj;
        if (type != o.type || hashCode() != o.hashCode()) {
            return false;
        }
        return type == LogicNodeType.TERM ? term.equals(o.term) : children.equals(o.children);
    }

    @Override
    public int hashCode() {
        return hash.get();
    }

    private int computeHash() {
        return type == LogicNodeType.TERM ? Objects.hash(type, term) : Objects.hash(type, children);
    }

    //endregion
}

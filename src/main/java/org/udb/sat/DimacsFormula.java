package org.udb.sat;

import org.udb.logic.LogicNode;
import org.udb.logic.LogicNodeType;
import org.udb.term.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FORMULA DIMACS - Rappresentazione numerica di un albero logico in CNF
 *
 * Converte un LogicNode in forma normale congiuntiva (AND di clausole OR di letterali)
 * nella rappresentazione a interi usata dai solutori SAT e dagli estrattori di
 * sottoinsiemi insoddisfacibili:
 * - ogni termine distinto riceve un identificativo ≥ 1, nell'ordine di {@link LogicNode#terms()}
 * - un letterale positivo è +ID, uno negato -ID
 * - ogni clausola è una lista di letterali
 *
 * La mappa identificativo → termine permette di ricostruire un albero dalle clausole
 * restituite dagli strumenti esterni.
 */
public class DimacsFormula {

    private static final Logger LOGGER = Logger.getLogger(DimacsFormula.class.getName());

    private static final Pattern CLAUSE_LINE = Pattern.compile("^\\s*((-?\\d+\\s+)+)0\\s*$");

    //region STRUTTURE DATI

    /** Clausole in formato numerico, immutabili dopo la costruzione. */
    private final List<List<Integer>> clauses;

    /** Termini indicizzati da 0: la variabile i corrisponde a variables.get(i - 1). */
    private final List<Term> variables;

    //endregion

    //region COSTRUZIONE

    /**
     * @param variables termini delle variabili, in ordine di identificativo
     * @param clauses clausole numeriche
     * @throws IllegalArgumentException se una clausola è vuota o riferisce variabili inesistenti
     */
    public DimacsFormula(List<Term> variables, List<List<Integer>> clauses) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        List<List<Integer>> copy = new ArrayList<>();
        for (List<Integer> clause : clauses) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(clause)));
        }
        this.clauses = Collections.unmodifiableList(copy);
        validateIntegrity();
    }

    /**
     * Converte un albero in CNF (annidata o piatta) nella forma numerica.
     *
     * @throws IllegalStateException se l'albero non è in CNF o è una costante
     */
    public static DimacsFormula fromCnf(LogicNode cnf) {
        LogicNode flat = cnf.flattenCnf();
        if (flat.type() == LogicNodeType.TRUE || flat.type() == LogicNodeType.FALSE) {
            throw new IllegalStateException("Impossibile rappresentare una costante in DIMACS: " + flat);
        }
        if (!flat.isCnf()) {
            throw new IllegalStateException("Formula non in CNF: " + flat);
        }
        List<Term> terms = flat.terms();
        Map<Term, Integer> ids = new LinkedHashMap<>();
        for (Term t : terms) {
            ids.computeIfAbsent(t, k -> ids.size() + 1);
        }
        List<List<Integer>> clauses = new ArrayList<>();
        if (flat.type() == LogicNodeType.AND) {
            for (LogicNode clause : flat.children()) {
                clauses.add(convertClause(clause, ids));
            }
        } else {
            clauses.add(convertClause(flat, ids));
        }
        DimacsFormula formula = new DimacsFormula(terms, clauses);
        LOGGER.fine(() -> String.format("DIMACS: %d variabili, %d clausole", formula.getVariableCount(),
                formula.getClauseCount()));
        return formula;
    }

    private static List<Integer> convertClause(LogicNode clause, Map<Term, Integer> ids) {
        List<Integer> literals = new ArrayList<>();
        switch (clause.type()) {
            case OR -> {
                for (LogicNode literal : clause.children()) {
                    literals.add(convertLiteral(literal, ids));
                }
            }
            case TERM, NOT -> literals.add(convertLiteral(clause, ids));
            default -> throw new IllegalStateException("Clausola non valida in CNF: " + clause);
        }
        return literals;
    }

    private static int convertLiteral(LogicNode literal, Map<Term, Integer> ids) {
        return switch (literal.type()) {
            case TERM -> ids.get(literal.term());
            case NOT -> -ids.get(literal.children().get(0).term());
            default -> throw new IllegalStateException("Letterale non valido in CNF: " + literal);
        };
    }

    /**
     * Interpreta testo DIMACS (righe "1 -2 0"); commenti, intestazioni e righe
     * non riconosciute vengono ignorati.
     *
     * @param text testo DIMACS
     * @param variables termini corrispondenti agli identificativi 1..n
     */
    public static DimacsFormula parse(String text, List<Term> variables) {
        List<List<Integer>> clauses = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher m = CLAUSE_LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            List<Integer> clause = new ArrayList<>();
            for (String token : m.group(1).trim().split("\\s+")) {
                clause.add(Integer.parseInt(token));
            }
            clauses.add(clause);
        }
        return new DimacsFormula(variables, clauses);
    }

    //endregion

    //region VALIDAZIONE

    private void validateIntegrity() {
        int max = variables.size();
        for (List<Integer> clause : clauses) {
            if (clause.isEmpty()) {
                throw new IllegalArgumentException("Clausola vuota nella formula DIMACS");
            }
            for (Integer literal : clause) {
                if (literal == null || literal == 0 || Math.abs(literal) > max) {
                    throw new IllegalArgumentException("Letterale " + literal + " fuori dall'intervallo 1.." + max);
                }
            }
        }
    }

    //endregion

    //region CONVERSIONI

    /** Testo DIMACS con intestazione "p cnf variabili clausole". */
    public String toDimacs() {
        StringBuilder out = new StringBuilder();
        out.append("p cnf ").append(variables.size()).append(' ').append(clauses.size()).append('\n');
        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                out.append(literal).append(' ');
            }
            out.append("0\n");
        }
        return out.toString();
    }

    /** Formula con le sole clausole indicate, sulle stesse variabili. */
    public DimacsFormula subset(List<Integer> clauseIndices) {
        List<List<Integer>> selected = new ArrayList<>();
        for (int index : clauseIndices) {
            selected.add(clauses.get(index));
        }
        return new DimacsFormula(variables, selected);
    }

    /**
     * Ricostruisce l'albero: AND di clausole, oppure la singola clausola.
     */
    public LogicNode toLogicNode() {
        List<LogicNode> nodes = new ArrayList<>();
        for (List<Integer> clause : clauses) {
            List<LogicNode> literals = new ArrayList<>();
            for (int literal : clause) {
                LogicNode term = LogicNode.term(variables.get(Math.abs(literal) - 1));
                literals.add(literal < 0 ? LogicNode.not(term) : term);
            }
            nodes.add(literals.size() == 1 ? literals.get(0) : LogicNode.or(literals));
        }
        if (nodes.isEmpty()) {
            return LogicNode.TRUE;
        }
        return nodes.size() == 1 ? nodes.get(0) : LogicNode.and(nodes);
    }

    //endregion

    //region ACCESSORS

    public List<List<Integer>> getClauses() {
        return clauses;
    }

    public List<Term> getVariables() {
        return variables;
    }

    public Term getVariable(int id) {
        return variables.get(id - 1);
    }

    public int getVariableCount() {
        return variables.size();
    }

    public int getClauseCount() {
        return clauses.size();
    }

    //endregion

    @Override
    public String toString() {
        return toDimacs();
    }
}

package org.udb.minimize;

import org.udb.logic.CanonicalizationType;
import org.udb.logic.EngineConfiguration;
import org.udb.logic.EqntottEquation;
import org.udb.logic.LogicNode;
import org.udb.term.SatisfiedResult;
import org.udb.term.Term;
import org.udb.tools.ExternalTool;
import org.udb.tools.ExternalToolException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimizzatore esterno basato su espresso.
 *
 * Formule piccole vengono codificate come tabella di verità PLA; quelle grandi come
 * equazione, convertita in PLA da eqntott. Per il prodotto di somme si minimizza la
 * negazione e si applica De Morgan al risultato.
 */
public class EspressoMinimizer implements TwoLevelMinimizer {

    private static final Logger LOGGER = Logger.getLogger(EspressoMinimizer.class.getName());

    private static final Pattern EMPTY_PLA = Pattern.compile("(?m)^\\.p\\s+0\\s*$");
    private static final Pattern INPUT_LABELS = Pattern.compile("(?m)^\\.ilb\\s+(.*)$");

    private final EngineConfiguration configuration;
    private final List<String> espressoCommand;
    private final List<String> eqntottCommand;
    private final ExternalTool espresso;
    private final ExternalTool eqntott;

    public EspressoMinimizer(EngineConfiguration configuration) {
        this.configuration = configuration;
        this.espressoCommand = split(configuration.getEspressoCommand());
        this.eqntottCommand = split(configuration.getEqntottCommand());
        this.espresso = new ExternalTool(espressoCommand.get(0), configuration.getTimeoutSeconds());
        this.eqntott = new ExternalTool(eqntottCommand.get(0), configuration.getTimeoutSeconds());
    }

    private static List<String> split(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Comando del minimizzatore non può essere vuoto");
        }
        return Arrays.asList(command.trim().split("\\s+"));
    }

    @Override
    public LogicNode minimize(LogicNode node, CanonicalizationType resultType, boolean exact) {
        boolean pos = resultType == CanonicalizationType.PRODUCT_OF_SUMS;
        LogicNode target = pos ? LogicNode.not(node) : node;
        if (node.terms().isEmpty()) {
            return node.reduce();
        }

        String pla;
        List<Term> columns;
        if (node.terms().size() > configuration.getEquationTermThreshold()
                || node.literals().size() >= configuration.getEquationLiteralThreshold()) {
            EqntottEquation equation = target.toEqntott();
            String input = "NAME=f;\n" + equation.equation() + ";\n";
            pla = runEqntott(input);
            if (EMPTY_PLA.matcher(pla).find()) {
                // funzione identicamente falsa
                return pos ? LogicNode.TRUE : LogicNode.FALSE;
            }
            columns = inputColumns(pla, equation.termMap(), input);
        } else {
            columns = node.terms();
            pla = truthTable(target, columns);
        }

        LogicNode sop = parseCover(runEspresso(pla, exact), columns);
        LogicNode result = pos ? LogicNode.not(sop).distributeNot() : sop;
        LOGGER.fine(() -> "espresso: " + node + " → " + result);
        return result.reduce();
    }

    //region CODIFICA

    static String truthTable(LogicNode target, List<Term> columns) {
        int n = columns.size();
        Map<Term, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(columns.get(i), i);
        }
        StringBuilder pla = new StringBuilder();
        pla.append(".i ").append(n).append('\n');
        pla.append(".o 1\n");
        pla.append(".ob out\n");
        pla.append(".p ").append(1 << n).append('\n');
        for (int row = 0; row < (1 << n); row++) {
            final int assignment = row;
            StringBuilder bits = new StringBuilder();
            for (int i = 0; i < n; i++) {
                bits.append((row >> i & 1) != 0 ? '1' : '0');
            }
            boolean value = target.evaluate(t -> SatisfiedResult.of(((assignment >> index.get(t)) & 1) != 0))
                    == SatisfiedResult.YES;
            pla.append(bits).append(' ').append(value ? '1' : '0').append('\n');
        }
        pla.append(".e\n");
        return pla.toString();
    }

    /** Colonne del PLA prodotto da eqntott, nell'ordine della riga ".ilb". */
    private List<Term> inputColumns(String pla, Map<String, Term> termMap, String input) {
        Matcher m = INPUT_LABELS.matcher(pla);
        if (!m.find()) {
            throw new ExternalToolException(eqntott.getName(), "<risultato>", "riga .ilb assente", input, null);
        }
        List<Term> columns = new ArrayList<>();
        for (String label : m.group(1).trim().split("\\s+")) {
            Term t = termMap.get(label);
            if (t == null) {
                throw new ExternalToolException(eqntott.getName(), "<risultato>",
                        "colonna sconosciuta '" + label + "'", input, null);
            }
            columns.add(t);
        }
        return columns;
    }

    //endregion

    //region INVOCAZIONE

    private String runEqntott(String equation) {
        Path file = eqntott.writeTempFile(".eqn", equation);
        try {
            List<String> invocation = new ArrayList<>(eqntottCommand);
            invocation.add("-l");
            invocation.add(file.toString());
            return eqntott.run(invocation, equation).output();
        } finally {
            eqntott.deleteQuietly(file);
        }
    }

    private String runEspresso(String pla, boolean exact) {
        Path file = espresso.writeTempFile(".pla", pla);
        try {
            List<String> invocation = new ArrayList<>(espressoCommand);
            invocation.add(exact ? "-Dsignature" : "-efast");
            invocation.add(file.toString());
            return espresso.run(invocation, pla).output();
        } finally {
            espresso.deleteQuietly(file);
        }
    }

    //endregion

    /**
     * Interpreta le righe "[01-]{n} 1" del PLA minimizzato come somma di prodotti.
     */
    static LogicNode parseCover(String output, List<Term> columns) {
        Pattern row = Pattern.compile("^([01-]{" + columns.size() + "})\\s+1\\s*$");
        List<LogicNode> products = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher m = row.matcher(line.trim());
            if (!m.matches()) {
                continue;
            }
            String cube = m.group(1);
            List<LogicNode> literals = new ArrayList<>();
            for (int i = 0; i < cube.length(); i++) {
                char c = cube.charAt(i);
                if (c == '-') {
                    continue;
                }
                LogicNode t = LogicNode.term(columns.get(i));
                literals.add(c == '1' ? t : LogicNode.not(t));
            }
            // prodotto vuoto: sempre vero
            products.add(LogicNode.conjunction(literals));
        }
        return LogicNode.disjunction(products);
    }
}

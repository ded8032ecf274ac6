package org.udb.sat;

import org.udb.tools.ExternalTool;
import org.udb.tools.ExternalToolException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Solutore SAT esterno con interfaccia DIMACS in stile minisat.
 *
 * La formula viene scritta in un file temporaneo e lo strumento è invocato come
 * {@code <comando> input output}. Il file di output contiene "SAT" seguito dal modello
 * oppure "UNSAT". I codici di uscita 10 (SAT) e 20 (UNSAT) sono successi.
 */
public class DimacsProcessSolver implements SatSolver {

    private static final Logger LOGGER = Logger.getLogger(DimacsProcessSolver.class.getName());

    private static final Set<Integer> ACCEPTED_EXIT_CODES = Set.of(0, 10, 20);

    private final List<String> command;
    private final ExternalTool tool;

    /**
     * @param command comando del solutore, eventualmente con opzioni separate da spazi
     * @param timeoutSeconds limite di attesa, 0 = nessun limite
     */
    public DimacsProcessSolver(String command, long timeoutSeconds) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Comando del solutore SAT non può essere vuoto");
        }
        this.command = Arrays.asList(command.trim().split("\\s+"));
        this.tool = new ExternalTool(this.command.get(0), timeoutSeconds, ACCEPTED_EXIT_CODES);
    }

    @Override
    public SatResult solve(DimacsFormula formula) {
        SolverStatistics statistics = new SolverStatistics();
        String dimacs = formula.toDimacs();
        Path input = tool.writeTempFile(".cnf", dimacs);
        Path output = null;
        try {
            output = tool.createTempFile(".out");
            List<String> invocation = new ArrayList<>(command);
            invocation.add(input.toString());
            invocation.add(output.toString());
            tool.run(invocation, dimacs);
            SatResult result = parseResult(tool.readFile(output, dimacs), statistics, tool.getName(), dimacs);
            statistics.stopTimer();
            LOGGER.fine(() -> tool.getName() + ": " + (result.isSatisfiable() ? "SAT" : "UNSAT"));
            return result;
        } finally {
            tool.deleteQuietly(input, output);
        }
    }

    /**
     * Interpreta il file di risultato: prima riga SAT/UNSAT, poi i letterali del modello
     * terminati da 0.
     *
     * @throws ExternalToolException se il risultato non è riconoscibile
     */
    static SatResult parseResult(String text, SolverStatistics statistics, String toolName, String input) {
        String[] lines = text.strip().split("\\R");
        String verdict = lines.length == 0 ? "" : lines[0].trim();
        if (verdict.equals("UNSAT")) {
            return SatResult.unsatisfiable(statistics);
        }
        if (!verdict.equals("SAT")) {
            throw new ExternalToolException(toolName, "<risultato>", "verdetto non riconosciuto: '" + verdict + "'",
                    input, null);
        }
        Map<Integer, Boolean> model = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            for (String token : lines[i].trim().split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                int literal;
                try {
                    literal = Integer.parseInt(token);
                } catch (NumberFormatException e) {
                    throw new ExternalToolException(toolName, "<risultato>", "letterale non valido: '" + token + "'",
                            input, e);
                }
                if (literal != 0) {
                    model.put(Math.abs(literal), literal > 0);
                }
            }
        }
        return SatResult.satisfiable(model, statistics);
    }
}

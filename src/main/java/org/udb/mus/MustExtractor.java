package org.udb.mus;

import org.udb.sat.DimacsFormula;
import org.udb.tools.ExternalTool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Estrattore esterno basato su must: {@code must -o risultato formula.cnf}.
 *
 * Il file di risultato elenca i sottoinsiemi in formato DIMACS, separati da righe
 * "MUS #n".
 */
public class MustExtractor implements UnsatCoreExtractor {

    private static final Logger LOGGER = Logger.getLogger(MustExtractor.class.getName());

    private final List<String> command;
    private final ExternalTool tool;

    public MustExtractor(String command, long timeoutSeconds) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Comando dell'estrattore MUS non può essere vuoto");
        }
        this.command = Arrays.asList(command.trim().split("\\s+"));
        this.tool = new ExternalTool(this.command.get(0), timeoutSeconds);
    }

    @Override
    public List<DimacsFormula> minimalUnsatSubsets(DimacsFormula formula) {
        String dimacs = formula.toDimacs();
        Path input = tool.writeTempFile(".cnf", dimacs);
        Path output = null;
        try {
            output = tool.createTempFile(".mus");
            List<String> invocation = new ArrayList<>(command);
            invocation.add("-o");
            invocation.add(output.toString());
            invocation.add(input.toString());
            tool.run(invocation, dimacs);
            List<DimacsFormula> subsets = parseResult(tool.readFile(output, dimacs), formula);
            LOGGER.fine(() -> tool.getName() + ": " + subsets.size() + " sottoinsiemi insoddisfacibili minimi");
            return subsets;
        } finally {
            tool.deleteQuietly(input, output);
        }
    }

    static List<DimacsFormula> parseResult(String text, DimacsFormula formula) {
        List<DimacsFormula> subsets = new ArrayList<>();
        for (String section : text.split("(?m)^.*MUS #\\d+.*$")) {
            DimacsFormula subset = DimacsFormula.parse(section, formula.getVariables());
            if (subset.getClauseCount() > 0) {
                subsets.add(subset);
            }
        }
        return subsets;
    }
}

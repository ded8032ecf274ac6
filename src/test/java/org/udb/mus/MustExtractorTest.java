package org.udb.mus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.udb.sat.DimacsFormula;
import org.udb.term.ExtensionTerm;
import org.udb.term.Term;
import org.udb.tools.ExternalToolException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MustExtractorTest {

    private static final List<Term> VARIABLES = List.of(ExtensionTerm.exact("A", "1.0"), ExtensionTerm.exact("B", "1.0"));

    private static final DimacsFormula FORMULA = new DimacsFormula(VARIABLES, List.of(
            List.of(1), List.of(-1), List.of(2), List.of(-2)));

    private static final String TWO_SUBSETS = "c must 1.0\nMUS #1\n1 0\n-1 0\nMUS #2\n2 0\n-2 0\n";

    @Test
    @DisplayName("Ogni sezione 'MUS #n' è un sottoinsieme")
    void parsesSections() {
        List<DimacsFormula> subsets = MustExtractor.parseResult(TWO_SUBSETS, FORMULA);
        assertEquals(2, subsets.size());
        assertEquals(List.of(List.of(1), List.of(-1)), subsets.get(0).getClauses());
        assertEquals(List.of(List.of(2), List.of(-2)), subsets.get(1).getClauses());
        assertEquals(VARIABLES, subsets.get(1).getVariables());
    }

    @Test
    void emptyResultHasNoSubsets() {
        assertTrue(MustExtractor.parseResult("", FORMULA).isEmpty());
    }

    @Test
    void blankCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MustExtractor(" ", 0));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runsTheToolWithOutputFile(@TempDir Path dir) throws IOException {
        // invocazione: must -o <risultato> <formula>
        Path must = dir.resolve("must.sh");
        Files.writeString(must, "#!/bin/sh\ngrep -q 'p cnf 2 4' \"$3\" || exit 1\n"
                + "printf 'MUS #1\\n1 0\\n-1 0\\n' > \"$2\"\n");

        List<DimacsFormula> subsets = new MustExtractor("sh " + must, 5).minimalUnsatSubsets(FORMULA);

        assertEquals(1, subsets.size());
        assertEquals(List.of(List.of(1), List.of(-1)), subsets.get(0).getClauses());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void failureCarriesTheEncodedInput(@TempDir Path dir) throws IOException {
        Path must = dir.resolve("must.sh");
        Files.writeString(must, "#!/bin/sh\nexit 2\n");

        ExternalToolException e = assertThrows(ExternalToolException.class,
                () -> new MustExtractor("sh " + must, 5).minimalUnsatSubsets(FORMULA));
        assertEquals(2, e.getExitCode());
        assertEquals(FORMULA.toDimacs(), e.getInput());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("I file temporanei sono rimossi anche quando lo strumento fallisce")
    void temporaryFilesAreRemovedOnFailure(@TempDir Path dir) throws IOException {
        Path seen = dir.resolve("seen.txt");
        Path must = dir.resolve("must.sh");
        Files.writeString(must, "#!/bin/sh\nprintf '%s\\n%s\\n' \"$2\" \"$3\" > '" + seen + "'\nexit 2\n");

        assertThrows(ExternalToolException.class,
                () -> new MustExtractor("sh " + must, 5).minimalUnsatSubsets(FORMULA));
        List<String> paths = Files.readAllLines(seen);
        assertEquals(2, paths.size());
        for (String path : paths) {
            assertFalse(Files.exists(Path.of(path)), path);
        }
    }
}

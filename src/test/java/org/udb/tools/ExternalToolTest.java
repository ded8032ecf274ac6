package org.udb.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalToolTest {

    @Test
    void capturesStandardOutput() {
        ExternalTool.Result result = new ExternalTool("echo", 0).run(List.of("echo", "ciao"), "");
        assertEquals(0, result.exitCode());
        assertEquals("ciao\n", result.output());
    }

    @Test
    void standardErrorIsMerged() {
        ExternalTool.Result result = new ExternalTool("sh", 0).run(List.of("sh", "-c", "echo errore >&2"), "");
        assertEquals("errore\n", result.output());
    }

    @Test
    @DisplayName("Codice di uscita non accettato: eccezione con codice e output")
    void rejectedExitCode() {
        ExternalToolException e = assertThrows(ExternalToolException.class,
                () -> new ExternalTool("sh", 0).run(List.of("sh", "-c", "echo parziale; exit 1"), "input"));
        assertEquals("sh", e.getTool());
        assertEquals("sh -c echo parziale; exit 1", e.getCommand());
        assertEquals(1, e.getExitCode());
        assertEquals("parziale\n", e.getOutput());
        assertEquals("input", e.getInput());
        assertTrue(e.getMessage().contains("codice di uscita 1"));
    }

    @Test
    void additionalExitCodesCanBeAccepted() {
        ExternalTool tool = new ExternalTool("sh", 0, Set.of(0, 10, 20));
        assertEquals(20, tool.run(List.of("sh", "-c", "exit 20"), "").exitCode());
    }

    @Test
    void timeoutKillsTheProcess() {
        ExternalToolException e = assertThrows(ExternalToolException.class,
                () -> new ExternalTool("sleep", 1).run(List.of("sleep", "30"), ""));
        assertEquals(-1, e.getExitCode());
        assertTrue(e.getMessage().contains("timeout"));
    }

    @Test
    @DisplayName("Il timeout vale anche dopo la chiusura dell'output")
    void timeoutCoversProcessTermination() {
        List<String> command = List.of("sh", "-c", "exec >/dev/null 2>&1; sleep 30");
        long start = System.nanoTime();
        ExternalToolException e = assertThrows(ExternalToolException.class,
                () -> new ExternalTool("sh", 1).run(command, ""));
        assertTrue(e.getMessage().contains("timeout"));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(20));
    }

    @Test
    void missingExecutable() {
        ExternalToolException e = assertThrows(ExternalToolException.class,
                () -> new ExternalTool("inesistente", 0).run(List.of("udb-strumento-inesistente"), ""));
        assertNotNull(e.getCause());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalTool("", 0));
    }

    @Test
    void temporaryFiles() {
        ExternalTool tool = new ExternalTool("cat", 0);
        Path file = tool.writeTempFile(".txt", "p cnf 1 1\n1 0\n");
        try {
            assertEquals("p cnf 1 1\n1 0\n", tool.readFile(file, ""));
            assertEquals("p cnf 1 1\n1 0\n", tool.run(List.of("cat", file.toString()), "").output());
        } finally {
            tool.deleteQuietly(file, null);
        }
        assertFalse(Files.exists(file));
        assertThrows(ExternalToolException.class, () -> tool.readFile(file, ""));
    }
}

package org.udb.tools;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Esecuzione sincrona di uno strumento a riga di comando.
 *
 * L'output viene letto in un executor a thread singolo. Con timeout positivo sia la
 * lettura sia l'attesa della terminazione sono limitate, e allo scadere il processo
 * viene terminato. Un codice di uscita non accettato è un errore fatale per
 * l'interrogazione: nessun nuovo tentativo.
 */
public class ExternalTool {

    private static final Logger LOGGER = Logger.getLogger(ExternalTool.class.getName());

    private final String name;
    private final long timeoutSeconds;
    private final Set<Integer> acceptedExitCodes;

    /**
     * @param name nome dello strumento, usato nei messaggi
     * @param timeoutSeconds limite di attesa in secondi, 0 = nessun limite
     * @param acceptedExitCodes codici di uscita considerati successo
     */
    public ExternalTool(String name, long timeoutSeconds, Set<Integer> acceptedExitCodes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome strumento non può essere vuoto");
        }
        this.name = name;
        this.timeoutSeconds = timeoutSeconds;
        this.acceptedExitCodes = Set.copyOf(acceptedExitCodes);
    }

    public ExternalTool(String name, long timeoutSeconds) {
        this(name, timeoutSeconds, Set.of(0));
    }

    /**
     * Esito di un'esecuzione riuscita: codice di uscita (tra quelli accettati) e
     * output catturato, stdout e stderr uniti.
     */
    public static final class Result {

        private final int exitCode;
        private final String output;

        public Result(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }

        public int exitCode() {
            return exitCode;
        }

        public String output() {
            return output;
        }

        @Override
        public String toString() {
            return "Result[exitCode=" + exitCode + ", " + output.length() + " caratteri]";
        }
    }

    /**
     * Esegue il comando e restituisce l'output (stdout e stderr uniti).
     *
     * @param command comando e argomenti
     * @param input descrizione dell'input, riportata negli errori
     * @throws ExternalToolException se il processo non parte, scade o esce con codice non accettato
     */
    public Result run(List<String> command, String input) {
        String commandLine = String.join(" ", command);
        LOGGER.fine(() -> "Esecuzione " + name + ": " + commandLine);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            executor.shutdownNow();
            LOGGER.log(Level.SEVERE, "Avvio di " + name + " fallito", e);
            throw new ExternalToolException(name, commandLine, "avvio fallito", input, e);
        }

        try {
            Future<String> output = executor.submit(() -> readAll(process.getInputStream()));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
            String text = timeoutSeconds > 0
                    ? output.get(timeoutSeconds, TimeUnit.SECONDS)
                    : output.get();
            // stdout chiuso non implica processo terminato: anche l'attesa è limitata
            if (timeoutSeconds > 0
                    && !process.waitFor(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                throw new TimeoutException();
            }
            int exitCode = process.waitFor();
            if (!acceptedExitCodes.contains(exitCode)) {
                LOGGER.severe(() -> name + " terminato con codice " + exitCode);
                throw new ExternalToolException(name, commandLine, exitCode, text, input);
            }
            return new Result(exitCode, text);
        } catch (TimeoutException e) {
            process.destroyForcibly();
            LOGGER.severe(() -> "Timeout di " + name + " dopo " + timeoutSeconds + " secondi");
            throw new ExternalToolException(name, commandLine, "timeout dopo " + timeoutSeconds + "s", input, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalToolException(name, commandLine, "interrotto", input, e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new ExternalToolException(name, commandLine, "lettura output fallita", input, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static String readAll(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    //region FILE TEMPORANEI

    /**
     * Scrive il contenuto in un file temporaneo.
     *
     * @throws ExternalToolException se la scrittura fallisce
     */
    public Path writeTempFile(String suffix, String content) {
        try {
            Path file = Files.createTempFile("udb-" + name + "-", suffix);
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new ExternalToolException(name, "<file temporaneo>", "scrittura input fallita", content, e);
        }
    }

    /**
     * Crea un file temporaneo vuoto per l'output dello strumento.
     */
    public Path createTempFile(String suffix) {
        return writeTempFile(suffix, "");
    }

    public String readFile(Path file, String input) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExternalToolException(name, "<lettura " + file + ">", "lettura risultato fallita", input, e);
        }
    }

    /**
     * Elimina i file temporanei; un errore di cancellazione viene solo registrato.
     */
    public void deleteQuietly(Path... files) {
        for (Path file : files) {
            if (file == null) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Impossibile eliminare il file temporaneo " + file, e);
            }
        }
    }

    //endregion

    public String getName() {
        return name;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}

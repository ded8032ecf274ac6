package org.udb.tools;

/**
 * Fallimento di uno strumento esterno (solutore SAT, minimizzatore, estrattore di
 * sottoinsiemi insoddisfacibili). Non è recuperabile per l'interrogazione corrente.
 *
 * Conserva il nome dello strumento, la riga di comando, il codice di uscita, l'output
 * catturato e l'input codificato, così che il chiamante possa diagnosticare il problema.
 */
public class ExternalToolException extends RuntimeException {

    private final String tool;
    private final String command;
    private final int exitCode;
    private final String output;
    private final String input;

    public ExternalToolException(String tool, String command, int exitCode, String output, String input) {
        super(buildMessage(tool, command, "codice di uscita " + exitCode, output, input));
        this.tool = tool;
        this.command = command;
        this.exitCode = exitCode;
        this.output = output;
        this.input = input;
    }

    public ExternalToolException(String tool, String command, String reason, String input, Throwable cause) {
        super(buildMessage(tool, command, reason, null, input), cause);
        this.tool = tool;
        this.command = command;
        this.exitCode = -1;
        this.output = null;
        this.input = input;
    }

    private static String buildMessage(String tool, String command, String reason, String output, String input) {
        StringBuilder sb = new StringBuilder();
        sb.append("Strumento '").append(tool).append("' fallito (").append(reason).append(")");
        sb.append("\nComando: ").append(command);
        if (output != null && !output.isBlank()) {
            sb.append("\nOutput:\n").append(output);
        }
        if (input != null) {
            sb.append("\nInput:\n").append(input);
        }
        return sb.toString();
    }

    public String getTool() {
        return tool;
    }

    public String getCommand() {
        return command;
    }

    /** Codice di uscita, -1 se il processo non è terminato normalmente. */
    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public String getInput() {
        return input;
    }
}

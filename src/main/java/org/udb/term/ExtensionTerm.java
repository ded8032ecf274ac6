package org.udb.term;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Termine "estensione implementata con versione compatibile con il requisito".
 *
 * Un termine con operatore {@code =} identifica una singola versione concreta;
 * gli altri operatori descrivono un intervallo di versioni, che l'espansione
 * delle condizioni riscrive come disgiunzione delle versioni concrete.
 */
public final class ExtensionTerm implements Term {

    /**
     * Operatori di confronto sulle versioni.
     */
    public enum ComparisonOp {
        EQUAL("="),
        GREATER_THAN_OR_EQUAL(">="),
        GREATER_THAN(">"),
        LESS_THAN_OR_EQUAL("<="),
        LESS_THAN("<"),
        COMPATIBLE("~>");

        private final String symbol;

        ComparisonOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * @throws IllegalArgumentException se il simbolo non è un operatore noto
         */
        public static ComparisonOp fromSymbol(String symbol) {
            for (ComparisonOp op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Operatore di versione sconosciuto: '" + symbol + "'");
        }
    }

    private final String name;
    private final ComparisonOp op;
    private final Version version;

    public ExtensionTerm(String name, ComparisonOp op, Version version) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome estensione non può essere null o vuoto");
        }
        this.name = name.trim();
        this.op = Objects.requireNonNull(op, "op");
        this.version = Objects.requireNonNull(version, "version");
    }

    public ExtensionTerm(String name, String op, String version) {
        this(name, ComparisonOp.fromSymbol(op), Version.parse(version));
    }

    /** Termine esatto {@code name = version}. */
    public static ExtensionTerm exact(String name, String version) {
        return new ExtensionTerm(name, ComparisonOp.EQUAL, Version.parse(version));
    }

    /**
     * Interpreta un requisito nella forma "&gt;= 1.0", "= 2.0", "~&gt; 1.1" o "1.0"
     * (senza operatore vale uguaglianza). Requisito assente o vuoto vale "&gt;= 0".
     */
    public static ExtensionTerm fromRequirement(String name, String requirement) {
        if (requirement == null || requirement.trim().isEmpty()) {
            return new ExtensionTerm(name, ComparisonOp.GREATER_THAN_OR_EQUAL, Version.ZERO);
        }
        String text = requirement.trim();
        int split = 0;
        while (split < text.length() && "=<>~".indexOf(text.charAt(split)) >= 0) {
            split++;
        }
        String opText = text.substring(0, split);
        String versionText = text.substring(split).trim();
        ComparisonOp parsedOp = opText.isEmpty() ? ComparisonOp.EQUAL : ComparisonOp.fromSymbol(opText);
        return new ExtensionTerm(name, parsedOp, Version.parse(versionText));
    }

    public String name() {
        return name;
    }

    public ComparisonOp comparison() {
        return op;
    }

    public Version version() {
        return version;
    }

    public boolean isExact() {
        return op == ComparisonOp.EQUAL;
    }

    /** Vero per il requisito "qualunque versione". */
    public boolean matchesAnyVersion() {
        return (op == ComparisonOp.GREATER_THAN_OR_EQUAL || op == ComparisonOp.EQUAL) && version.isZero();
    }

    /** Requisito in forma testuale, es. "&gt;= 1.0". */
    public String requirement() {
        return op.symbol() + " " + version;
    }

    /**
     * Verifica se una versione concreta soddisfa il requisito.
     * Per {@code ~>} si richiede la stessa major e versione non inferiore.
     */
    public boolean satisfiedBy(Version candidate) {
        int cmp = candidate.compareTo(version);
        return switch (op) {
            case EQUAL -> cmp == 0;
            case GREATER_THAN_OR_EQUAL -> cmp >= 0;
            case GREATER_THAN -> cmp > 0;
            case LESS_THAN_OR_EQUAL -> cmp <= 0;
            case LESS_THAN -> cmp < 0;
            case COMPATIBLE -> candidate.major() == version.major() && cmp >= 0;
        };
    }

    public boolean satisfiedBy(String extensionName, Version candidate) {
        return name.equals(extensionName) && satisfiedBy(candidate);
    }

    /** Versione minima che soddisfa il termine. */
    public Version minPossibleVersion() {
        return switch (op) {
            case EQUAL, GREATER_THAN_OR_EQUAL, COMPATIBLE -> version;
            case GREATER_THAN -> version.incrementPatch();
            case LESS_THAN_OR_EQUAL, LESS_THAN -> Version.ZERO;
        };
    }

    /**
     * Versione massima che soddisfa il termine; zero per intervalli illimitati
     * superiormente, null se nessuna versione può soddisfarlo ("&lt; 0").
     */
    public Version maxPossibleVersion() {
        return switch (op) {
            case EQUAL, LESS_THAN_OR_EQUAL, COMPATIBLE -> version;
            case LESS_THAN -> version.isZero() ? null : version.decrementPatch();
            case GREATER_THAN_OR_EQUAL, GREATER_THAN -> Version.ZERO;
        };
    }

    @Override
    public Kind kind() {
        return Kind.EXTENSION;
    }

    @Override
    public int compareSameKind(Term other) {
        ExtensionTerm o = (ExtensionTerm) other;
        int byName = name.compareTo(o.name);
        if (byName != 0) {
            return byName;
        }
        if (isExact() && o.isExact()) {
            return version.compareTo(o.version);
        }
        int byMin = minPossibleVersion().compareTo(o.minPossibleVersion());
        if (byMin != 0) {
            return byMin;
        }
        int byMax = compareNullable(maxPossibleVersion(), o.maxPossibleVersion());
        if (byMax != 0) {
            return byMax;
        }
        int byOp = op.compareTo(o.op);
        return byOp != 0 ? byOp : version.compareTo(o.version);
    }

    private static int compareNullable(Version a, Version b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? -1 : 1);
        }
        return a.compareTo(b);
    }

    @Override
    public String toPrettyString() {
        return "Extension " + name + ", version " + version;
    }

    @Override
    public String toAsciidoc() {
        return toAsciidoc(true);
    }

    public String toAsciidoc(boolean includeVersions) {
        return includeVersions ? "`" + name + "`" + op.symbol() + version : "`" + name + "`";
    }

    @Override
    public String toIdl() {
        if (matchesAnyVersion()) {
            return "implemented?(ExtensionName::" + name + ")";
        }
        return "implemented_version?(ExtensionName::" + name + ", \"" + requirement() + "\")";
    }

    @Override
    public Map<String, Object> toDeclarative() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("version", requirement());
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ExtensionTerm)) {
            return false;
        }
        ExtensionTerm o = (ExtensionTerm) obj;
        return name.equals(o.name) && op == o.op && version.equals(o.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, op, version);
    }

    @Override
    public String toString() {
        return isExact() ? name + "@" + version : name + op.symbol() + version;
    }
}

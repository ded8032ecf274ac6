package org.udb.logic;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configurazione immutabile del motore logico: soglie degli algoritmi e comandi
 * degli strumenti esterni.
 *
 * I valori si leggono dalla risorsa {@value #RESOURCE} se presente nel classpath,
 * altrimenti valgono i default.
 */
public final class EngineConfiguration {

    private static final Logger LOGGER = Logger.getLogger(EngineConfiguration.class.getName());

    public static final String RESOURCE = "udb-logic.properties";

    //region PARAMETRI

    private final int cnfExplosionThreshold;
    private final int tseytinTermThreshold;
    private final int tseytinLiteralThreshold;
    private final int bruteForceMaxTerms;
    private final int bruteForceMaxLiterals;
    private final int quineMcCluskeyMaxTerms;
    private final int equationTermThreshold;
    private final int equationLiteralThreshold;
    private final int nestedCnfTermThreshold;
    private final boolean externalTools;
    private final String satCommand;
    private final String espressoCommand;
    private final String eqntottCommand;
    private final String mustCommand;
    private final long timeoutSeconds;

    //endregion

    private EngineConfiguration(Builder b) {
        this.cnfExplosionThreshold = positive("cnf.explosion.threshold", b.cnfExplosionThreshold);
        this.tseytinTermThreshold = positive("tseytin.term.threshold", b.tseytinTermThreshold);
        this.tseytinLiteralThreshold = positive("tseytin.literal.threshold", b.tseytinLiteralThreshold);
        this.bruteForceMaxTerms = positive("bruteforce.max.terms", b.bruteForceMaxTerms);
        this.bruteForceMaxLiterals = positive("bruteforce.max.literals", b.bruteForceMaxLiterals);
        this.quineMcCluskeyMaxTerms = positive("quine.mccluskey.max.terms", b.quineMcCluskeyMaxTerms);
        this.equationTermThreshold = positive("espresso.equation.term.threshold", b.equationTermThreshold);
        this.equationLiteralThreshold = positive("espresso.equation.literal.threshold", b.equationLiteralThreshold);
        this.nestedCnfTermThreshold = positive("minimize.nested.cnf.term.threshold", b.nestedCnfTermThreshold);
        this.externalTools = b.externalTools;
        this.satCommand = b.satCommand;
        this.espressoCommand = b.espressoCommand;
        this.eqntottCommand = b.eqntottCommand;
        this.mustCommand = b.mustCommand;
        if (b.timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout non può essere negativo: " + b.timeoutSeconds);
        }
        this.timeoutSeconds = b.timeoutSeconds;
    }

    private static int positive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Valore non valido per " + key + ": " + value);
        }
        return value;
    }

    //region CARICAMENTO

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    /**
     * Legge la configurazione dal classpath; in assenza della risorsa usa i default.
     *
     * @throws IllegalStateException se la risorsa esiste ma non è leggibile
     */
    public static EngineConfiguration load() {
        try (InputStream in = EngineConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOGGER.fine("Risorsa " + RESOURCE + " assente, uso configurazione di default");
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Lettura di " + RESOURCE + " fallita", e);
        }
    }

    public static EngineConfiguration fromProperties(Properties p) {
        Builder b = builder();
        b.cnfExplosionThreshold(intValue(p, "cnf.explosion.threshold", b.cnfExplosionThreshold));
        b.tseytinTermThreshold(intValue(p, "tseytin.term.threshold", b.tseytinTermThreshold));
        b.tseytinLiteralThreshold(intValue(p, "tseytin.literal.threshold", b.tseytinLiteralThreshold));
        b.bruteForceMaxTerms(intValue(p, "bruteforce.max.terms", b.bruteForceMaxTerms));
        b.bruteForceMaxLiterals(intValue(p, "bruteforce.max.literals", b.bruteForceMaxLiterals));
        b.quineMcCluskeyMaxTerms(intValue(p, "quine.mccluskey.max.terms", b.quineMcCluskeyMaxTerms));
        b.equationTermThreshold(intValue(p, "espresso.equation.term.threshold", b.equationTermThreshold));
        b.equationLiteralThreshold(intValue(p, "espresso.equation.literal.threshold", b.equationLiteralThreshold));
        b.nestedCnfTermThreshold(intValue(p, "minimize.nested.cnf.term.threshold", b.nestedCnfTermThreshold));
        b.externalTools(Boolean.parseBoolean(p.getProperty("tools.external", String.valueOf(b.externalTools))));
        b.satCommand(p.getProperty("tools.sat.command", b.satCommand));
        b.espressoCommand(p.getProperty("tools.espresso.command", b.espressoCommand));
        b.eqntottCommand(p.getProperty("tools.eqntott.command", b.eqntottCommand));
        b.mustCommand(p.getProperty("tools.must.command", b.mustCommand));
        b.timeoutSeconds(intValue(p, "tools.timeout.seconds", (int) b.timeoutSeconds));
        EngineConfiguration config = b.build();
        LOGGER.log(Level.FINE, "Configurazione caricata: {0}", config);
        return config;
    }

    private static int intValue(Properties p, String key, int fallback) {
        String raw = p.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valore non numerico per " + key + ": '" + raw + "'", e);
        }
    }

    //endregion

    //region ACCESSORS

    public int getCnfExplosionThreshold() {
        return cnfExplosionThreshold;
    }

    public int getTseytinTermThreshold() {
        return tseytinTermThreshold;
    }

    public int getTseytinLiteralThreshold() {
        return tseytinLiteralThreshold;
    }

    public int getBruteForceMaxTerms() {
        return bruteForceMaxTerms;
    }

    public int getBruteForceMaxLiterals() {
        return bruteForceMaxLiterals;
    }

    public int getQuineMcCluskeyMaxTerms() {
        return quineMcCluskeyMaxTerms;
    }

    public int getEquationTermThreshold() {
        return equationTermThreshold;
    }

    public int getEquationLiteralThreshold() {
        return equationLiteralThreshold;
    }

    public int getNestedCnfTermThreshold() {
        return nestedCnfTermThreshold;
    }

    public boolean useExternalTools() {
        return externalTools;
    }

    public String getSatCommand() {
        return satCommand;
    }

    public String getEspressoCommand() {
        return espressoCommand;
    }

    public String getEqntottCommand() {
        return eqntottCommand;
    }

    public String getMustCommand() {
        return mustCommand;
    }

    /** Timeout degli strumenti esterni in secondi, 0 = nessun limite. */
    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    //endregion

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("EngineConfiguration{cnf=%d, tseytin=%d/%d, bruteForce=%d/%d, qm=%d, external=%s, timeout=%ds}",
                cnfExplosionThreshold, tseytinTermThreshold, tseytinLiteralThreshold,
                bruteForceMaxTerms, bruteForceMaxLiterals, quineMcCluskeyMaxTerms, externalTools, timeoutSeconds);
    }

    /**
     * Costruttore incrementale con i valori di default.
     */
    public static final class Builder {
        private int cnfExplosionThreshold = 10;
        private int tseytinTermThreshold = 4;
        private int tseytinLiteralThreshold = 10;
        private int bruteForceMaxTerms = 8;
        private int bruteForceMaxLiterals = 32;
        private int quineMcCluskeyMaxTerms = 4;
        private int equationTermThreshold = 4;
        private int equationLiteralThreshold = 32;
        private int nestedCnfTermThreshold = 32;
        private boolean externalTools = false;
        private String satCommand = "minisat";
        private String espressoCommand = "espresso";
        private String eqntottCommand = "eqntott";
        private String mustCommand = "must";
        private long timeoutSeconds = 0;

        private Builder() {
        }

        public Builder cnfExplosionThreshold(int value) {
            this.cnfExplosionThreshold = value;
            return this;
        }

        public Builder tseytinTermThreshold(int value) {
            this.tseytinTermThreshold = value;
            return this;
        }

        public Builder tseytinLiteralThreshold(int value) {
            this.tseytinLiteralThreshold = value;
            return this;
        }

        public Builder bruteForceMaxTerms(int value) {
            this.bruteForceMaxTerms = value;
            return this;
        }

        public Builder bruteForceMaxLiterals(int value) {
            this.bruteForceMaxLiterals = value;
            return this;
        }

        public Builder quineMcCluskeyMaxTerms(int value) {
            this.quineMcCluskeyMaxTerms = value;
            return this;
        }

        public Builder equationTermThreshold(int value) {
            this.equationTermThreshold = value;
            return this;
        }

        public Builder equationLiteralThreshold(int value) {
            this.equationLiteralThreshold = value;
            return this;
        }

        public Builder nestedCnfTermThreshold(int value) {
            this.nestedCnfTermThreshold = value;
            return this;
        }

        public Builder externalTools(boolean value) {
            this.externalTools = value;
            return this;
        }

        public Builder satCommand(String value) {
            this.satCommand = value;
            return this;
        }

        public Builder espressoCommand(String value) {
            this.espressoCommand = value;
            return this;
        }

        public Builder eqntottCommand(String value) {
            this.eqntottCommand = value;
            return this;
        }

        public Builder mustCommand(String value) {
            this.mustCommand = value;
            return this;
        }

        public Builder timeoutSeconds(long value) {
            this.timeoutSeconds = value;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(this);
        }
    }
}

package org.udb.logic;

import org.udb.minimize.EspressoMinimizer;
import org.udb.minimize.QuineMcCluskeyMinimizer;
import org.udb.minimize.TwoLevelMinimizer;
import org.udb.mus.DeletionUnsatCoreExtractor;
import org.udb.mus.MustExtractor;
import org.udb.mus.UnsatCoreExtractor;
import org.udb.sat.CdclSolver;
import org.udb.sat.DimacsFormula;
import org.udb.sat.DimacsProcessSolver;
import org.udb.sat.SatResult;
import org.udb.sat.SatSolver;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE LOGICO - Punto di raccordo tra gli alberi e gli algoritmi delegati
 *
 * Possiede la configurazione, i tre adattatori (solutore SAT, minimizzatore a due
 * livelli, estrattore di sottoinsiemi insoddisfacibili), la cache dei verdetti e le
 * statistiche. Con {@code tools.external=true} gli adattatori invocano processi
 * esterni, altrimenti si usano le implementazioni interne.
 *
 * Esiste un motore predefinito di processo, sostituibile nei test.
 */
public class LogicEngine {

    private static final Logger LOGGER = Logger.getLogger(LogicEngine.class.getName());

    private static volatile LogicEngine defaultEngine;

    //region COMPONENTI

    private final EngineConfiguration configuration;
    private final SatSolver satSolver;
    private final TwoLevelMinimizer minimizer;
    private final UnsatCoreExtractor unsatCoreExtractor;
    private final SatisfiabilityCache cache;
    private final EngineStatistics statistics;

    //endregion

    private LogicEngine(Builder b) {
        this.configuration = b.configuration;
        boolean external = configuration.useExternalTools();
        this.satSolver = b.satSolver != null ? b.satSolver
                : external ? new DimacsProcessSolver(configuration.getSatCommand(), configuration.getTimeoutSeconds())
                : new CdclSolver();
        this.minimizer = b.minimizer != null ? b.minimizer
                : external ? new EspressoMinimizer(configuration)
                : new QuineMcCluskeyMinimizer();
        this.unsatCoreExtractor = b.unsatCoreExtractor != null ? b.unsatCoreExtractor
                : external ? new MustExtractor(configuration.getMustCommand(), configuration.getTimeoutSeconds())
                : new DeletionUnsatCoreExtractor(satSolver);
        this.cache = b.cache != null ? b.cache : new SatisfiabilityCache();
        this.statistics = new EngineStatistics();
        LOGGER.fine(() -> "Motore logico creato: " + configuration);
    }

    //region MOTORE PREDEFINITO

    /**
     * Motore predefinito, costruito alla prima richiesta dalla configurazione nel classpath.
     */
    public static LogicEngine getDefault() {
        LogicEngine engine = defaultEngine;
        if (engine == null) {
            synchronized (LogicEngine.class) {
                engine = defaultEngine;
                if (engine == null) {
                    engine = builder().configuration(EngineConfiguration.load()).build();
                    defaultEngine = engine;
                }
            }
        }
        return engine;
    }

    public static void setDefault(LogicEngine engine) {
        defaultEngine = Objects.requireNonNull(engine, "engine");
    }

    /** Scarta il motore predefinito: il prossimo accesso ne crea uno nuovo. */
    public static void resetDefault() {
        defaultEngine = null;
    }

    //endregion

    //region SODDISFACIBILITA'

    /**
     * Verdetto del solutore SAT sulla CNF equisoddisfacibile del nodo, passando per la cache.
     */
    boolean solverSatisfiable(LogicNode node) {
        Boolean cached = cache.lookup(node);
        if (cached != null) {
            statistics.recordCacheHit();
            return cached;
        }
        long start = System.currentTimeMillis();
        LogicNode cnf = node.isCnf() ? node.reduce() : node.equisatCnf(configuration);
        boolean result;
        if (cnf.type() == LogicNodeType.TRUE) {
            result = true;
        } else if (cnf.type() == LogicNodeType.FALSE) {
            result = false;
        } else {
            DimacsFormula formula = DimacsFormula.fromCnf(cnf);
            SatResult outcome = satSolver.solve(formula);
            result = outcome.isSatisfiable();
            LOGGER.log(Level.INFO, "Solutore SAT: {0} ({1} variabili, {2} clausole)",
                    new Object[]{result ? "SAT" : "UNSAT", formula.getVariableCount(), formula.getClauseCount()});
        }
        cache.store(node, result);
        statistics.recordSolverSolve(System.currentTimeMillis() - start);
        return result;
    }

    //endregion

    /** Svuota la cache dei verdetti e azzera le statistiche. */
    public void resetCaches() {
        cache.clear();
        statistics.reset();
    }

    //region ACCESSORS

    public EngineConfiguration getConfiguration() {
        return configuration;
    }

    public SatSolver getSatSolver() {
        return satSolver;
    }

    public TwoLevelMinimizer getMinimizer() {
        return minimizer;
    }

    public UnsatCoreExtractor getUnsatCoreExtractor() {
        return unsatCoreExtractor;
    }

    public SatisfiabilityCache getCache() {
        return cache;
    }

    public EngineStatistics getStatistics() {
        return statistics;
    }

    //endregion

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Costruttore del motore: gli adattatori non indicati seguono la configurazione.
     */
    public static final class Builder {
        private EngineConfiguration configuration = EngineConfiguration.defaults();
        private SatSolver satSolver;
        private TwoLevelMinimizer minimizer;
        private UnsatCoreExtractor unsatCoreExtractor;
        private SatisfiabilityCache cache;

        private Builder() {
        }

        public Builder configuration(EngineConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        public Builder satSolver(SatSolver satSolver) {
            this.satSolver = satSolver;
            return this;
        }

        public Builder minimizer(TwoLevelMinimizer minimizer) {
            this.minimizer = minimizer;
            return this;
        }

        public Builder unsatCoreExtractor(UnsatCoreExtractor unsatCoreExtractor) {
            this.unsatCoreExtractor = unsatCoreExtractor;
            return this;
        }

        public Builder cache(SatisfiabilityCache cache) {
            this.cache = cache;
            return this;
        }

        public LogicEngine build() {
            return new LogicEngine(this);
        }
    }
}

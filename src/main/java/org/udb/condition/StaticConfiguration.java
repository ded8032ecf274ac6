package org.udb.condition;

import org.udb.term.ExtensionTerm;
import org.udb.term.Version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configurazione in memoria, costruita con {@link #builder(ConfigurationType)}.
 *
 * In una configurazione parziale, se non si dichiarano versioni possibili in modo
 * esplicito, sono possibili tutte le versioni note delle estensioni non proibite.
 */
public final class StaticConfiguration implements ConfigurationContext {

    private final ConfigurationType type;
    private final Map<String, List<Version>> versions;
    private final Map<String, Map<Version, Clause>> requirements;
    private final Map<String, Clause> conflicts;
    private final Map<String, Clause> parameterRequirements;
    private final Set<ExtensionTerm> implemented;
    private final Set<ExtensionTerm> mandatory;
    private final Set<ExtensionTerm> possible;
    private final Map<String, Object> parameterValues;
    private final Set<Integer> xlens;

    private StaticConfiguration(Builder b) {
        this.type = b.type;
        Map<String, List<Version>> sorted = new LinkedHashMap<>();
        b.versions.forEach((name, set) -> sorted.put(name, List.copyOf(set)));
        this.versions = Collections.unmodifiableMap(sorted);
        this.requirements = Collections.unmodifiableMap(new HashMap<>(b.requirements));
        this.conflicts = Map.copyOf(b.conflicts);
        this.parameterRequirements = Map.copyOf(b.parameterRequirements);
        this.implemented = Collections.unmodifiableSet(new LinkedHashSet<>(b.implemented));
        this.mandatory = Collections.unmodifiableSet(new LinkedHashSet<>(b.mandatory));
        this.parameterValues = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameterValues));
        this.xlens = Set.copyOf(b.xlens);

        Set<ExtensionTerm> candidates = new LinkedHashSet<>(b.possible);
        if (candidates.isEmpty()) {
            versions.forEach((name, list) -> {
                if (!b.prohibited.contains(name)) {
                    for (Version v : list) {
                        candidates.add(new ExtensionTerm(name, ExtensionTerm.ComparisonOp.EQUAL, v));
                    }
                }
            });
        }
        this.possible = Collections.unmodifiableSet(candidates);
    }

    public static Builder builder(ConfigurationType type) {
        return new Builder(type);
    }

    //region CONTESTO

    @Override
    public ConfigurationType configurationType() {
        return type;
    }

    @Override
    public List<Version> versions(String extension) {
        return versions.getOrDefault(extension, List.of());
    }

    @Override
    public Clause requirements(String extension, Version version) {
        Map<Version, Clause> byVersion = requirements.get(extension);
        return byVersion == null ? null : byVersion.get(version);
    }

    @Override
    public Clause conflicts(String extension) {
        return conflicts.get(extension);
    }

    @Override
    public Clause parameterRequirements(String parameter) {
        return parameterRequirements.get(parameter);
    }

    @Override
    public Set<ExtensionTerm> implementedVersions() {
        return implemented;
    }

    @Override
    public Set<ExtensionTerm> mandatoryRequirements() {
        return mandatory;
    }

    @Override
    public Set<ExtensionTerm> possibleVersions() {
        return possible;
    }

    @Override
    public Map<String, Object> parameterValues() {
        return parameterValues;
    }

    @Override
    public Set<Integer> possibleXlens() {
        return xlens;
    }

    //endregion

    public static final class Builder {
        private final ConfigurationType type;
        private final Map<String, TreeSet<Version>> versions = new LinkedHashMap<>();
        private final Map<String, Map<Version, Clause>> requirements = new HashMap<>();
        private final Map<String, Clause> conflicts = new HashMap<>();
        private final Map<String, Clause> parameterRequirements = new HashMap<>();
        private final List<ExtensionTerm> implemented = new ArrayList<>();
        private final List<ExtensionTerm> mandatory = new ArrayList<>();
        private final List<ExtensionTerm> possible = new ArrayList<>();
        private final Set<String> prohibited = new LinkedHashSet<>();
        private final Map<String, Object> parameterValues = new LinkedHashMap<>();
        private Set<Integer> xlens = Set.of(32, 64);

        private Builder(ConfigurationType type) {
            this.type = type;
        }

        /** Dichiara le versioni esistenti di un'estensione. */
        public Builder extension(String name, String... versionList) {
            TreeSet<Version> set = versions.computeIfAbsent(name, k -> new TreeSet<>());
            for (String v : versionList) {
                set.add(Version.parse(v));
            }
            return this;
        }

        public Builder requires(String name, String version, Clause clause) {
            Version v = Version.parse(version);
            extension(name, version);
            requirements.computeIfAbsent(name, k -> new HashMap<>()).put(v, clause);
            return this;
        }

        public Builder conflicts(String name, Clause clause) {
            conflicts.put(name, clause);
            return this;
        }

        public Builder parameterRequires(String parameter, Clause clause) {
            parameterRequirements.put(parameter, clause);
            return this;
        }

        public Builder implemented(String name, String version) {
            extension(name, version);
            implemented.add(ExtensionTerm.exact(name, version));
            return this;
        }

        /** Requisito obbligatorio, es. ("A", "&gt;= 1.0"). */
        public Builder mandatory(String name, String requirement) {
            mandatory.add(ExtensionTerm.fromRequirement(name, requirement));
            return this;
        }

        public Builder possible(String name, String version) {
            extension(name, version);
            possible.add(ExtensionTerm.exact(name, version));
            return this;
        }

        /** Esclude tutte le versioni dell'estensione dalle possibili. */
        public Builder prohibited(String name) {
            prohibited.add(name);
            return this;
        }

        public Builder parameter(String name, Object value) {
            parameterValues.put(name, value);
            return this;
        }

        public Builder xlens(Integer... values) {
            xlens = Set.of(values);
            return this;
        }

        public StaticConfiguration build() {
            return new StaticConfiguration(this);
        }
    }
}

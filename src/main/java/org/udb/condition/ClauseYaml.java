package org.udb.condition;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lettura e scrittura delle clausole in testo YAML.
 */
public final class ClauseYaml {

    private ClauseYaml() {
    }

    /**
     * @throws MalformedConditionException se il testo non è YAML valido o non descrive una clausola
     */
    public static Clause parse(String text) {
        Object data;
        try {
            data = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
        } catch (YAMLException e) {
            throw new MalformedConditionException("YAML non valido", text, e);
        }
        return ClauseParser.parse(data);
    }

    public static String dump(Clause clause) {
        return dumpData(toData(clause));
    }

    /** Scrive in YAML a blocchi dati dichiarativi (mappe, liste, booleani). */
    public static String dumpData(Object data) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(data);
    }

    /** Forma dichiarativa della clausola, rileggibile con {@link ClauseParser#parse(Object)}. */
    public static Object toData(Clause clause) {
        return clause.accept(new DataWriter());
    }

    /**
     * Riscrive una clausola nei dati dichiarativi, con le chiavi generiche:
     * ogni foglia ha il proprio involucro extension/param/xlen.
     */
    private static final class DataWriter implements ClauseVisitor<Object> {

        private Map<String, Object> list(String key, List<Clause> clauses) {
            List<Object> items = new ArrayList<>();
            for (Clause c : clauses) {
                items.add(c.accept(this));
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(key, items);
            return out;
        }

        private static Map<String, Object> single(String key, Object value) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(key, value);
            return out;
        }

        @Override
        public Object visitAllOf(Clause.AllOf clause) {
            return list("allOf", clause.clauses());
        }

        @Override
        public Object visitAnyOf(Clause.AnyOf clause) {
            return list("anyOf", clause.clauses());
        }

        @Override
        public Object visitOneOf(Clause.OneOf clause) {
            return list("oneOf", clause.clauses());
        }

        @Override
        public Object visitNoneOf(Clause.NoneOf clause) {
            return list("noneOf", clause.clauses());
        }

        @Override
        public Object visitNot(Clause.Not clause) {
            return single("not", clause.clause().accept(this));
        }

        @Override
        public Object visitIfThen(Clause.IfThen clause) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("if", clause.condition().accept(this));
            out.put("then", clause.consequent().accept(this));
            return out;
        }

        @Override
        public Object visitExtension(Clause.ExtensionClause clause) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", clause.name());
            if (clause.requirement() != null) {
                entry.put("version", clause.requirement());
            }
            return single("extension", entry);
        }

        @Override
        public Object visitParam(Clause.ParamClause clause) {
            return single("param", new LinkedHashMap<>(clause.comparison()));
        }

        @Override
        public Object visitXlen(Clause.XlenClause clause) {
            return single("xlen", clause.xlen());
        }

        @Override
        public Object visitConstant(Clause.Constant clause) {
            return clause.value();
        }
    }
}

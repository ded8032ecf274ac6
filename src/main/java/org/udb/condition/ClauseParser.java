package org.udb.condition;

import org.udb.term.ParameterTerm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PARSER CLAUSOLE - Da dati dichiarativi (mappe YAML) a {@link Clause}
 *
 * Tre contesti di interpretazione:
 * - generico: allOf, anyOf, oneOf, noneOf, not, if/then, extension, param, xlen, booleani
 * - extension: combinatori su voci {name, version}
 * - param: combinatori su record di confronto {name, equal, ...}
 *
 * Ogni chiave non riconosciuta nel contesto corrente è un errore.
 */
public final class ClauseParser {

    private static final Logger LOGGER = Logger.getLogger(ClauseParser.class.getName());

    private static final Set<String> COMBINATORS = Set.of("allOf", "anyOf", "oneOf", "noneOf", "not", "if");

    private enum Context {
        GENERIC,
        EXTENSION,
        PARAM
    }

    private ClauseParser() {
    }

    /**
     * @throws MalformedConditionException se la struttura non è una clausola valida
     */
    public static Clause parse(Object data) {
        Clause clause = parse(data, Context.GENERIC);
        LOGGER.finest(() -> "Clausola interpretata: " + clause);
        return clause;
    }

    /** Interpreta direttamente il corpo di un blocco {@code extension:}. */
    public static Clause parseExtension(Object data) {
        return parse(data, Context.EXTENSION);
    }

    private static Clause parse(Object data, Context context) {
        if (data instanceof Boolean) {
            return new Clause.Constant((Boolean) data);
        }
        if (!(data instanceof Map)) {
            throw new MalformedConditionException("Clausola non è una mappa", data);
        }
        Map<String, Object> map = asStringMap(data);
        if (map.isEmpty()) {
            throw new MalformedConditionException("Clausola vuota", data);
        }

        // un record di confronto può contenere chiavi come oneOf
        if (context == Context.PARAM && map.containsKey("name")) {
            return parseParamEntry(map);
        }

        String combinator = null;
        for (String key : map.keySet()) {
            if (COMBINATORS.contains(key)) {
                combinator = key;
                break;
            }
        }
        if (combinator != null) {
            return parseCombinator(combinator, map, context);
        }

        return switch (context) {
            case GENERIC -> parseGenericLeaf(map);
            case EXTENSION -> parseExtensionEntry(map);
            case PARAM -> parseParamEntry(map);
        };
    }

    private static Clause parseCombinator(String key, Map<String, Object> map, Context context) {
        if (key.equals("if")) {
            checkKeys(map, Set.of("if", "then"));
            if (!map.containsKey("then")) {
                throw new MalformedConditionException("'if' senza 'then'", map);
            }
            // l'antecedente è sempre una condizione generica
            return new Clause.IfThen(parse(map.get("if"), Context.GENERIC), parse(map.get("then"), context));
        }
        checkKeys(map, Set.of(key));
        if (key.equals("not")) {
            return new Clause.Not(parse(map.get("not"), context));
        }
        Object value = map.get(key);
        if (!(value instanceof List)) {
            throw new MalformedConditionException("'" + key + "' richiede una lista", map);
        }
        List<Clause> children = new ArrayList<>();
        for (Object child : (List<?>) value) {
            children.add(parse(child, context));
        }
        if (children.isEmpty()) {
            throw new MalformedConditionException("'" + key + "' con lista vuota", map);
        }
        return switch (key) {
            case "allOf" -> new Clause.AllOf(children);
            case "anyOf" -> new Clause.AnyOf(children);
            case "oneOf" -> new Clause.OneOf(children);
            default -> new Clause.NoneOf(children);
        };
    }

    private static Clause parseGenericLeaf(Map<String, Object> map) {
        if (map.size() != 1) {
            throw new MalformedConditionException("Chiavi inattese " + map.keySet(), map);
        }
        Map.Entry<String, Object> entry = map.entrySet().iterator().next();
        return switch (entry.getKey()) {
            case "extension" -> parse(entry.getValue(), Context.EXTENSION);
            case "param" -> parse(entry.getValue(), Context.PARAM);
            case "xlen" -> {
                if (!(entry.getValue() instanceof Integer)) {
                    throw new MalformedConditionException("'xlen' richiede un intero", map);
                }
                try {
                    yield new Clause.XlenClause((Integer) entry.getValue());
                } catch (IllegalArgumentException e) {
                    throw new MalformedConditionException("XLEN non valido", map, e);
                }
            }
            default -> throw new MalformedConditionException("Chiave sconosciuta '" + entry.getKey() + "'", map);
        };
    }

    private static Clause parseExtensionEntry(Map<String, Object> map) {
        checkKeys(map, Set.of("name", "version"));
        Object name = map.get("name");
        if (!(name instanceof String)) {
            throw new MalformedConditionException("Estensione senza nome", map);
        }
        Object version = map.get("version");
        return new Clause.ExtensionClause((String) name, version == null ? null : String.valueOf(version));
    }

    private static Clause parseParamEntry(Map<String, Object> map) {
        try {
            new ParameterTerm(map);
        } catch (IllegalArgumentException e) {
            throw new MalformedConditionException("Confronto su parametro non valido", map, e);
        }
        return new Clause.ParamClause(map);
    }

    private static void checkKeys(Map<String, Object> map, Set<String> allowed) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new MalformedConditionException("Chiave sconosciuta '" + key + "'", map);
            }
        }
    }

    private static Map<String, Object> asStringMap(Object data) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) data).entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }
}

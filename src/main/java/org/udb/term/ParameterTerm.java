package org.udb.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Termine "il parametro soddisfa un confronto".
 *
 * Il contenuto è il record dichiarativo del confronto: {@code name}, esattamente una
 * chiave di confronto ({@code equal}, {@code not_equal}, {@code less_than},
 * {@code greater_than}, {@code less_than_or_equal}, {@code greater_than_or_equal},
 * {@code includes}, {@code oneOf}) e, opzionalmente, {@code index}, {@code size},
 * {@code range} e {@code reason}.
 *
 * Uguaglianza e hash dipendono dal contenuto normalizzato (interi confrontati come long),
 * non dall'identità del record.
 */
public final class ParameterTerm implements Term {

    /**
     * Tipi di confronto, con la chiave dichiarativa corrispondente.
     */
    public enum ComparisonType {
        EQUAL("equal"),
        NOT_EQUAL("not_equal"),
        LESS_THAN("less_than"),
        GREATER_THAN("greater_than"),
        LESS_THAN_OR_EQUAL("less_than_or_equal"),
        GREATER_THAN_OR_EQUAL("greater_than_or_equal"),
        INCLUDES("includes"),
        ONE_OF("oneOf");

        private final String key;

        ComparisonType(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    /**
     * Relazione statica tra due confronti sullo stesso parametro.
     */
    public enum Relation {
        /** this → other */
        IMPLIES,
        /** this → ¬other */
        EXCLUDES
    }

    private static final Set<String> SCOPE_KEYS = Set.of("name", "index", "size", "range", "reason");

    private final Map<String, Object> record;
    private final ComparisonType type;
    private final Object normalizedValue;

    /**
     * @param record record dichiarativo del confronto
     * @throws IllegalArgumentException se manca il nome o se il numero di chiavi di confronto non è uno
     */
    public ParameterTerm(Map<String, ?> record) {
        if (record == null || !(record.get("name") instanceof String)) {
            throw new IllegalArgumentException("Termine parametro senza nome: " + record);
        }
        ComparisonType found = null;
        for (ComparisonType candidate : ComparisonType.values()) {
            if (record.containsKey(candidate.key)) {
                if (found != null) {
                    throw new IllegalArgumentException("Più confronti nello stesso termine parametro: " + record.keySet());
                }
                found = candidate;
            }
        }
        if (found == null) {
            throw new IllegalArgumentException("Nessun confronto trovato in " + record.keySet());
        }
        for (String key : record.keySet()) {
            if (!SCOPE_KEYS.contains(key) && !key.equals(found.key)) {
                throw new IllegalArgumentException("Chiave sconosciuta '" + key + "' nel termine parametro " + record);
            }
        }
        if (found == ComparisonType.ONE_OF && !(record.get(found.key) instanceof List)) {
            throw new IllegalArgumentException("oneOf richiede una lista di valori: " + record);
        }
        this.record = Collections.unmodifiableMap(new LinkedHashMap<>(record));
        this.type = found;
        this.normalizedValue = normalize(record.get(found.key));
    }

    public String name() {
        return (String) record.get("name");
    }

    public ComparisonType comparisonType() {
        return type;
    }

    public Object comparisonValue() {
        return record.get(type.key);
    }

    /** Indice dell'elemento confrontato, o null se il confronto non è su un elemento. */
    public Integer index() {
        Object index = record.get("index");
        return index == null ? null : ((Number) index).intValue();
    }

    public boolean isSizeComparison() {
        return record.containsKey("size");
    }

    public String reason() {
        return (String) record.get("reason");
    }

    public boolean isArrayComparison() {
        return record.containsKey("index") || record.containsKey("size") || record.containsKey("includes");
    }

    //region NEGAZIONE

    /**
     * Termine logicamente opposto, o null se non esiste una negazione sintattica
     * semplice ({@code includes}, {@code oneOf}).
     */
    public ParameterTerm negate() {
        ComparisonType inverse = switch (type) {
            case EQUAL -> ComparisonType.NOT_EQUAL;
            case NOT_EQUAL -> ComparisonType.EQUAL;
            case LESS_THAN -> ComparisonType.GREATER_THAN_OR_EQUAL;
            case GREATER_THAN -> ComparisonType.LESS_THAN_OR_EQUAL;
            case LESS_THAN_OR_EQUAL -> ComparisonType.GREATER_THAN;
            case GREATER_THAN_OR_EQUAL -> ComparisonType.LESS_THAN;
            case INCLUDES, ONE_OF -> null;
        };
        if (inverse == null) {
            return null;
        }
        Map<String, Object> negated = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : record.entrySet()) {
            negated.put(e.getKey().equals(type.key) ? inverse.key : e.getKey(), e.getValue());
        }
        return new ParameterTerm(negated);
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta il confronto su un valore concreto (già estratto da indice o dimensione).
     *
     * @throws IllegalArgumentException se il valore non è confrontabile col tipo di confronto
     */
    public SatisfiedResult evaluateValue(Object value) {
        Object v = normalize(value);
        boolean result = switch (type) {
            case EQUAL -> Objects.equals(v, normalizedValue);
            case NOT_EQUAL -> !Objects.equals(v, normalizedValue);
            case LESS_THAN -> compareNumbers(v, normalizedValue) < 0;
            case GREATER_THAN -> compareNumbers(v, normalizedValue) > 0;
            case LESS_THAN_OR_EQUAL -> compareNumbers(v, normalizedValue) <= 0;
            case GREATER_THAN_OR_EQUAL -> compareNumbers(v, normalizedValue) >= 0;
            case INCLUDES -> {
                if (!(v instanceof List)) {
                    throw new IllegalArgumentException("includes richiede un parametro lista, trovato " + value);
                }
                yield ((List<?>) v).contains(normalizedValue);
            }
            case ONE_OF -> ((List<?>) normalizedValue).contains(v);
        };
        return SatisfiedResult.of(result);
    }

    /**
     * Valuta il termine sui valori noti dei parametri.
     * Parametro senza valore noto: MAYBE.
     */
    public SatisfiedResult evaluate(Map<String, ?> parameterValues) {
        Object value = parameterValues.get(name());
        if (value == null) {
            return SatisfiedResult.MAYBE;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            if (!isArrayComparison()) {
                throw new IllegalArgumentException("Manca index, includes o size per il parametro lista " + name());
            }
            if (record.containsKey("index")) {
                int i = index();
                if (i < 0 || i >= list.size()) {
                    throw new IllegalArgumentException("Indice " + i + " fuori intervallo per " + name());
                }
                return evaluateValue(list.get(i));
            }
            if (type == ComparisonType.INCLUDES) {
                return evaluateValue(list);
            }
            return evaluateValue(list.size());
        }
        if (value instanceof Number && record.containsKey("range")) {
            String[] bounds = String.valueOf(record.get("range")).split("-");
            int msb = Integer.parseInt(bounds[0].trim());
            int lsb = Integer.parseInt(bounds[1].trim());
            long field = (((Number) value).longValue() >> lsb) & ((1L << (msb - lsb + 1)) - 1);
            return evaluateValue(field);
        }
        return evaluateValue(value);
    }

    //endregion

    //region RELAZIONI TRA CONFRONTI

    /**
     * Relazione derivabile staticamente tra questo confronto e un altro sullo stesso
     * parametro, o null se i due confronti sono indipendenti (o su parametri diversi).
     *
     * Per confronti scalari la relazione si decide valutando entrambi i termini sui
     * punti di discontinuità delle loro costanti: tra due costanti consecutive
     * il valore di verità di ciascun confronto è costante.
     */
    public Relation relationTo(ParameterTerm other) {
        if (!name().equals(other.name())) {
            return null;
        }
        if (equals(other)) {
            return Relation.IMPLIES;
        }
        if (type == ComparisonType.INCLUDES) {
            return includesRelationTo(other);
        }
        if (record.containsKey("index") && other.type == ComparisonType.INCLUDES) {
            return type == ComparisonType.EQUAL && Objects.equals(normalizedValue, other.normalizedValue)
                    ? Relation.IMPLIES : null;
        }
        if (isArrayComparison() || other.isArrayComparison()) {
            boolean sameScope = (isSizeComparison() && other.isSizeComparison())
                    || (index() != null && index().equals(other.index()));
            if (!sameScope) {
                return null;
            }
        }
        return scalarRelationTo(other);
    }

    private Relation includesRelationTo(ParameterTerm other) {
        if (!other.isSizeComparison()) {
            return null;
        }
        Object size = other.normalizedValue;
        if (!(size instanceof Long) || (Long) size != 0L) {
            return null;
        }
        return switch (other.type) {
            case EQUAL -> Relation.EXCLUDES;
            case NOT_EQUAL, GREATER_THAN -> Relation.IMPLIES;
            default -> null;
        };
    }

    private Relation scalarRelationTo(ParameterTerm other) {
        List<Object> samples = samplePoints(other);
        if (samples == null) {
            return null;
        }
        boolean implies = true;
        boolean excludes = true;
        boolean selfEverTrue = false;
        for (Object point : samples) {
            if (!holdsAt(point)) {
                continue;
            }
            selfEverTrue = true;
            boolean otherHolds = other.holdsAt(point);
            implies &= otherHolds;
            excludes &= !otherHolds;
        }
        if (!selfEverTrue) {
            return null;
        }
        if (implies) {
            return Relation.IMPLIES;
        }
        return excludes ? Relation.EXCLUDES : null;
    }

    private boolean holdsAt(Object point) {
        return evaluateValue(point) == SatisfiedResult.YES;
    }

    /**
     * Punti rappresentativi del dominio comune ai due confronti, o null se il dominio
     * non è trattabile (es. ordinamento su stringhe).
     */
    private List<Object> samplePoints(ParameterTerm other) {
        Set<Object> constants = new LinkedHashSet<>();
        constants.addAll(constantsOf(this));
        constants.addAll(constantsOf(other));
        if (constants.stream().allMatch(c -> c instanceof Boolean)) {
            return List.of(Boolean.TRUE, Boolean.FALSE);
        }
        if (constants.stream().allMatch(c -> c instanceof Long)) {
            Set<Object> points = new LinkedHashSet<>();
            for (Object c : constants) {
                long value = (Long) c;
                points.add(value - 1);
                points.add(value);
                points.add(value + 1);
            }
            return new ArrayList<>(points);
        }
        Predicate<ParameterTerm> ordered = t -> t.type != ComparisonType.EQUAL
                && t.type != ComparisonType.NOT_EQUAL && t.type != ComparisonType.ONE_OF;
        if (ordered.test(this) || ordered.test(other)) {
            return null;
        }
        List<Object> points = new ArrayList<>(constants);
        points.add(new Object()); // valore diverso da ogni costante
        return points;
    }

    private static List<Object> constantsOf(ParameterTerm term) {
        if (term.normalizedValue instanceof List) {
            return new ArrayList<>((List<?>) term.normalizedValue);
        }
        return List.of(term.normalizedValue);
    }

    //endregion

    //region NORMALIZZAZIONE

    private static Object normalize(Object value) {
        if (value instanceof Number) {
            Number n = (Number) value;
            if (n.doubleValue() == Math.rint(n.doubleValue())) {
                return n.longValue();
            }
            return n.doubleValue();
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object item : (List<?>) value) {
                out.add(normalize(item));
            }
            return out;
        }
        return value;
    }

    private int compareNumbers(Object value, Object constant) {
        if (!(value instanceof Number) || !(constant instanceof Number)) {
            throw new IllegalArgumentException("Confronto " + type.key + " richiede valori numerici: "
                    + value + " vs " + constant);
        }
        return Double.compare(((Number) value).doubleValue(), ((Number) constant).doubleValue());
    }

    private Map<String, Object> normalizedRecord() {
        Map<String, Object> out = new LinkedHashMap<>();
        record.forEach((k, v) -> {
            if (!k.equals("reason")) {
                out.put(k, normalize(v));
            }
        });
        return out;
    }

    /**
     * Chiave d'ordinamento coerente con equals: chiavi ordinate, valori normalizzati
     * marcati col tipo, stringhe prefissate dalla lunghezza.
     */
    private String sortKey() {
        StringBuilder key = new StringBuilder();
        new TreeMap<>(normalizedRecord()).forEach((k, v) -> {
            key.append(k).append('=');
            appendSortKey(key, v);
            key.append(';');
        });
        return key.toString();
    }

    private static void appendSortKey(StringBuilder key, Object value) {
        if (value instanceof List) {
            key.append('[');
            for (Object item : (List<?>) value) {
                appendSortKey(key, item);
                key.append(',');
            }
            key.append(']');
        } else if (value instanceof Long) {
            key.append('L').append(value);
        } else if (value instanceof Double) {
            key.append('D').append(value);
        } else if (value instanceof Boolean) {
            key.append('B').append(value);
        } else {
            String text = String.valueOf(value);
            key.append('S').append(text.length()).append(':').append(text);
        }
    }

    //endregion

    //region RAPPRESENTAZIONI

    private String subject() {
        if (record.containsKey("index")) {
            return name() + "[" + index() + "]";
        }
        if (isSizeComparison()) {
            return "$array_size(" + name() + ")";
        }
        return name();
    }

    private static String literal(Object value) {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }

    @Override
    public String toIdl() {
        String s = subject();
        Object v = comparisonValue();
        return switch (type) {
            case EQUAL -> "(" + s + "==" + literal(v) + ")";
            case NOT_EQUAL -> "(" + s + "!=" + literal(v) + ")";
            case LESS_THAN -> "(" + s + "<" + v + ")";
            case GREATER_THAN -> "(" + s + ">" + v + ")";
            case LESS_THAN_OR_EQUAL -> "(" + s + "<=" + v + ")";
            case GREATER_THAN_OR_EQUAL -> "(" + s + ">=" + v + ")";
            case INCLUDES -> "$array_includes?(" + s + ", " + literal(v) + ")";
            case ONE_OF -> {
                List<String> alternatives = new ArrayList<>();
                for (Object item : (List<?>) v) {
                    alternatives.add(s + "==" + literal(item));
                }
                yield "(" + String.join("||", alternatives) + ")";
            }
        };
    }

    @Override
    public String toAsciidoc() {
        String p = record.containsKey("index") ? name() + "[" + index() + "]" : name();
        Object v = comparisonValue();
        return switch (type) {
            case EQUAL -> "`" + p + "` == " + v;
            case NOT_EQUAL -> "`" + p + "` != " + v;
            case LESS_THAN -> "`" + p + "` < " + v;
            case GREATER_THAN -> "`" + p + "` > " + v;
            case LESS_THAN_OR_EQUAL -> "`" + p + "` <= " + v;
            case GREATER_THAN_OR_EQUAL -> "`" + p + "` >= " + v;
            case INCLUDES -> v + " in `" + p + "`";
            case ONE_OF -> "`" + p + "` in " + v;
        };
    }

    @Override
    public String toPrettyString() {
        String subject = index() == null
                ? "Parameter " + name()
                : "Element " + index() + " of parameter " + name();
        Object v = comparisonValue();
        return subject + switch (type) {
            case EQUAL -> " equals " + v;
            case NOT_EQUAL -> " does not equal " + v;
            case LESS_THAN -> " is less than " + v;
            case GREATER_THAN -> " is greater than " + v;
            case LESS_THAN_OR_EQUAL -> " is less than or equal to " + v;
            case GREATER_THAN_OR_EQUAL -> " is greater than or equal to " + v;
            case INCLUDES -> " includes the value " + v;
            case ONE_OF -> " is one of the following values: " + v;
        };
    }

    @Override
    public Map<String, Object> toDeclarative() {
        return new LinkedHashMap<>(record);
    }

    //endregion

    @Override
    public Kind kind() {
        return Kind.PARAMETER;
    }

    @Override
    public int compareSameKind(Term other) {
        ParameterTerm o = (ParameterTerm) other;
        int byName = name().compareTo(o.name());
        return byName != 0 ? byName : sortKey().compareTo(o.sortKey());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof ParameterTerm && normalizedRecord().equals(((ParameterTerm) obj).normalizedRecord());
    }

    @Override
    public int hashCode() {
        return normalizedRecord().hashCode();
    }

    @Override
    public String toString() {
        // forma compatta, con "=" al posto di "=="
        return toIdl().replace("==", "=");
    }
}

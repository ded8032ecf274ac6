package org.udb.condition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CLAUSOLA - Forma dichiarativa di una condizione, come scritta nel database delle specifiche
 *
 * Tipi di clausola:
 * • Combinatori: AllOf, AnyOf, OneOf, NoneOf (NOR), Not, IfThen
 * • Foglie: ExtensionClause (nome + requisito di versione), ParamClause (record di
 *   confronto su un parametro), XlenClause (32 o 64), Constant (vero/falso)
 *
 * L'insieme dei tipi è chiuso: ogni elaborazione passa per un {@link ClauseVisitor},
 * così aggiungere un tipo di clausola rompe la compilazione di tutti i visitatori.
 * Tutte le clausole sono immutabili e confrontabili per struttura.
 */
public interface Clause {

    <R> R accept(ClauseVisitor<R> visitor);

    //region COMBINATORI N-ARI

    /**
     * Base dei combinatori su una lista di clausole figlie.
     * Invariante: lista immutabile, uguaglianza per tipo e figli.
     */
    abstract class Combination implements Clause {

        private final List<Clause> clauses;

        Combination(List<Clause> clauses) {
            this.clauses = List.copyOf(clauses);
        }

        public List<Clause> clauses() {
            return clauses;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            return obj != null && obj.getClass() == getClass() && clauses.equals(((Combination) obj).clauses);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass().getSimpleName(), clauses);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + clauses;
        }
    }

    /** Tutte le clausole devono valere. */
    final class AllOf extends Combination {
        public AllOf(List<Clause> clauses) {
            super(clauses);
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitAllOf(this);
        }
    }

    /** Almeno una clausola deve valere. */
    final class AnyOf extends Combination {
        public AnyOf(List<Clause> clauses) {
            super(clauses);
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitAnyOf(this);
        }
    }

    /** Esattamente una clausola deve valere. */
    final class OneOf extends Combination {
        public OneOf(List<Clause> clauses) {
            super(clauses);
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitOneOf(this);
        }
    }

    /** Nessuna clausola deve valere (NOR). */
    final class NoneOf extends Combination {
        public NoneOf(List<Clause> clauses) {
            super(clauses);
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitNoneOf(this);
        }
    }

    //endregion

    //region COMBINATORI FISSI

    final class Not implements Clause {

        private final Clause clause;

        public Not(Clause clause) {
            this.clause = Objects.requireNonNull(clause, "clause");
        }

        public Clause clause() {
            return clause;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public boolean equals(Object obj) {
            return this == obj || (obj instanceof Not && clause.equals(((Not) obj).clause));
        }

        @Override
        public int hashCode() {
            return Objects.hash("Not", clause);
        }

        @Override
        public String toString() {
            return "Not[" + clause + "]";
        }
    }

    /**
     * Se condition vale, deve valere anche consequent.
     * • condition: sempre una clausola generica, anche dentro extension/param
     * • consequent: interpretato nel contesto del blocco che contiene l'if
     */
    final class IfThen implements Clause {

        private final Clause condition;
        private final Clause consequent;

        public IfThen(Clause condition, Clause consequent) {
            this.condition = Objects.requireNonNull(condition, "condition");
            this.consequent = Objects.requireNonNull(consequent, "consequent");
        }

        public Clause condition() {
            return condition;
        }

        public Clause consequent() {
            return consequent;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitIfThen(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof IfThen)) {
                return false;
            }
            IfThen o = (IfThen) obj;
            return condition.equals(o.condition) && consequent.equals(o.consequent);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, consequent);
        }

        @Override
        public String toString() {
            return "IfThen[" + condition + " -> " + consequent + "]";
        }
    }

    //endregion

    //region FOGLIE

    /**
     * Estensione implementata in una versione compatibile col requisito
     * ("= 1.0", "&gt;= 2.0", ...; null vale qualunque versione).
     * Il requisito resta testuale: la sua validità si verifica alla compilazione.
     */
    final class ExtensionClause implements Clause {

        private final String name;
        private final String requirement;

        public ExtensionClause(String name, String requirement) {
            this.name = Objects.requireNonNull(name, "name");
            this.requirement = requirement;
        }

        public String name() {
            return name;
        }

        public String requirement() {
            return requirement;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitExtension(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof ExtensionClause)) {
                return false;
            }
            ExtensionClause o = (ExtensionClause) obj;
            return name.equals(o.name) && Objects.equals(requirement, o.requirement);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, requirement);
        }

        @Override
        public String toString() {
            return "Extension[" + name + (requirement == null ? "" : " " + requirement) + "]";
        }
    }

    /** Confronto su un parametro, nella forma del record dichiarativo. */
    final class ParamClause implements Clause {

        private final Map<String, Object> comparison;

        public ParamClause(Map<String, Object> comparison) {
            this.comparison = Map.copyOf(comparison);
        }

        public Map<String, Object> comparison() {
            return comparison;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitParam(this);
        }

        @Override
        public boolean equals(Object obj) {
            return this == obj || (obj instanceof ParamClause && comparison.equals(((ParamClause) obj).comparison));
        }

        @Override
        public int hashCode() {
            return comparison.hashCode();
        }

        @Override
        public String toString() {
            return "Param" + new LinkedHashMap<>(comparison);
        }
    }

    final class XlenClause implements Clause {

        private final int xlen;

        public XlenClause(int xlen) {
            if (xlen != 32 && xlen != 64) {
                throw new IllegalArgumentException("XLEN deve essere 32 o 64, trovato " + xlen);
            }
            this.xlen = xlen;
        }

        public int xlen() {
            return xlen;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitXlen(this);
        }

        @Override
        public boolean equals(Object obj) {
            return this == obj || (obj instanceof XlenClause && xlen == ((XlenClause) obj).xlen);
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(xlen);
        }

        @Override
        public String toString() {
            return "Xlen[" + xlen + "]";
        }
    }

    final class Constant implements Clause {

        private final boolean value;

        public Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public boolean equals(Object obj) {
            return this == obj || (obj instanceof Constant && value == ((Constant) obj).value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    //endregion
}

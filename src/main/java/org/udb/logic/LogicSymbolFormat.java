package org.udb.logic;

/**
 * Insiemi di simboli per la resa testuale degli alberi logici.
 */
public enum LogicSymbolFormat {
    C("1", "0", "!", "&&", "||", "^", "->"),
    EQN("ONE", "ZERO", "!", "&", "|", "DOES NOT EXIST", "DOES NOT EXIST"),
    ENGLISH("true", "false", "NOT ", "AND", "OR", "XOR", "IMPLIES"),
    PREDICATE("true", "false", "¬", "∧", "∨", "⊕", "→");

    private final String trueSymbol;
    private final String falseSymbol;
    private final String not;
    private final String and;
    private final String or;
    private final String xor;
    private final String implies;

    LogicSymbolFormat(String trueSymbol, String falseSymbol, String not, String and, String or,
                      String xor, String implies) {
        this.trueSymbol = trueSymbol;
        this.falseSymbol = falseSymbol;
        this.not = not;
        this.and = and;
        this.or = or;
        this.xor = xor;
        this.implies = implies;
    }

    public String trueSymbol() {
        return trueSymbol;
    }

    public String falseSymbol() {
        return falseSymbol;
    }

    public String not() {
        return not;
    }

    public String and() {
        return and;
    }

    public String or() {
        return or;
    }

    public String xor() {
        return xor;
    }

    public String implies() {
        return implies;
    }
}

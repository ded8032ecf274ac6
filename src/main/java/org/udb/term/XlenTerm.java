package org.udb.term;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Termine "XLEN vale N", con N in {32, 64}.
 */
public final class XlenTerm implements Term {

    private final int xlen;

    /**
     * @throws IllegalArgumentException se xlen non è 32 o 64
     */
    public XlenTerm(int xlen) {
        if (xlen != 32 && xlen != 64) {
            throw new IllegalArgumentException("XLEN deve essere 32 o 64, trovato " + xlen);
        }
        this.xlen = xlen;
    }

    public int xlen() {
        return xlen;
    }

    @Override
    public Kind kind() {
        return Kind.XLEN;
    }

    @Override
    public int compareSameKind(Term other) {
        return Integer.compare(xlen, ((XlenTerm) other).xlen);
    }

    @Override
    public String toPrettyString() {
        return toString();
    }

    @Override
    public String toAsciidoc() {
        return "xlen+++()+++ == " + xlen;
    }

    @Override
    public String toIdl() {
        return "(xlen() == " + xlen + ")";
    }

    @Override
    public Map<String, Object> toDeclarative() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("xlen", xlen);
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof XlenTerm && ((XlenTerm) obj).xlen == xlen;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(xlen);
    }

    @Override
    public String toString() {
        return "xlen=" + xlen;
    }
}

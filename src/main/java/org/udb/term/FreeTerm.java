package org.udb.term;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Variabile sintetica senza significato di dominio, introdotta dalla trasformazione
 * di Tseytin. Ogni istanza ha un identificativo unico nel processo.
 */
public final class FreeTerm implements Term {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;

    public FreeTerm() {
        this.id = NEXT_ID.getAndIncrement();
    }

    public long id() {
        return id;
    }

    @Override
    public Kind kind() {
        return Kind.FREE;
    }

    @Override
    public int compareSameKind(Term other) {
        return Long.compare(id, ((FreeTerm) other).id);
    }

    @Override
    public String toPrettyString() {
        return toString();
    }

    @Override
    public String toAsciidoc() {
        throw new IllegalStateException("Variabile sintetica " + this + " non rappresentabile in documentazione");
    }

    @Override
    public String toIdl() {
        return "FreeTerm";
    }

    @Override
    public Map<String, Object> toDeclarative() {
        return Map.of("free", id);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FreeTerm && ((FreeTerm) obj).id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "t" + id;
    }
}

package org.udb.term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Versione numerica puntata (es. "1.0", "2.1.3") di un'estensione.
 *
 * Le componenti mancanti valgono zero: "1.0" e "1.0.0" sono la stessa versione.
 * L'ordinamento è lessicografico sulle componenti numeriche.
 */
public final class Version implements Comparable<Version> {

    public static final Version ZERO = new Version(new int[] {0});

    private final int[] parts;

    private Version(int[] parts) {
        this.parts = parts;
    }

    /**
     * Interpreta una stringa di versione.
     *
     * @param text versione puntata, eventualmente con prefisso "v"
     * @throws IllegalArgumentException se il testo non è una versione valida
     */
    public static Version parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Versione non può essere null o vuota");
        }
        String clean = text.trim();
        if (clean.startsWith("v") || clean.startsWith("V")) {
            clean = clean.substring(1);
        }
        String[] tokens = clean.split("\\.");
        int[] parsed = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                parsed[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Versione non valida: '" + text + "'", e);
            }
            if (parsed[i] < 0) {
                throw new IllegalArgumentException("Versione non valida: '" + text + "'");
            }
        }
        return new Version(parsed);
    }

    public int major() {
        return part(0);
    }

    public int minor() {
        return part(1);
    }

    public int patch() {
        return part(2);
    }

    private int part(int index) {
        return index < parts.length ? parts[index] : 0;
    }

    public boolean isZero() {
        return Arrays.stream(parts).allMatch(p -> p == 0);
    }

    /** Versione immediatamente successiva nella componente patch. */
    public Version incrementPatch() {
        return new Version(new int[] {major(), minor(), patch() + 1});
    }

    /**
     * Versione immediatamente precedente: se la patch è zero si scende
     * sulla minor, poi sulla major.
     *
     * @throws IllegalStateException se la versione è zero
     */
    public Version decrementPatch() {
        if (isZero()) {
            throw new IllegalStateException("Impossibile decrementare la versione 0");
        }
        if (patch() > 0) {
            return new Version(new int[] {major(), minor(), patch() - 1});
        }
        if (minor() > 0) {
            return new Version(new int[] {major(), minor() - 1, Integer.MAX_VALUE});
        }
        return new Version(new int[] {major() - 1, Integer.MAX_VALUE, Integer.MAX_VALUE});
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(parts.length, other.parts.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(part(i), other.part(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Version && compareTo((Version) obj) == 0;
    }

    @Override
    public int hashCode() {
        // le componenti zero finali non contano
        int last = parts.length - 1;
        while (last > 0 && parts[last] == 0) {
            last--;
        }
        return Arrays.hashCode(Arrays.copyOf(parts, last + 1));
    }

    @Override
    public String toString() {
        List<String> out = new ArrayList<>();
        for (int p : parts) {
            out.add(String.valueOf(p));
        }
        return String.join(".", out);
    }
}

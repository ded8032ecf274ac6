package org.udb.logic;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Valore calcolato al primo accesso e poi conservato per sempre.
 * Il calcolo avviene al più una volta anche con accessi concorrenti.
 */
final class Lazy<T> implements Supplier<T> {

    private Supplier<? extends T> supplier;
    private volatile boolean computed;
    private T value;

    private Lazy(Supplier<? extends T> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    static <T> Lazy<T> of(Supplier<? extends T> supplier) {
        return new Lazy<>(supplier);
    }

    @Override
    public T get() {
        if (!computed) {
            synchronized (this) {
                if (!computed) {
                    value = supplier.get();
                    supplier = null;
                    computed = true;
                }
            }
        }
        return value;
    }

    boolean isComputed() {
        return computed;
    }
}

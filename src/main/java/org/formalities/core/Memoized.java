package org.formalities.core;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * MEMOIZZAZIONE ESPLICITA - Calcolo differito eseguito al più una volta
 *
 * Il valore calcolato resta in cache per tutta la vita dell'istanza; l'unico modo
 * per ricalcolare è costruire una nuova istanza. Il calcolo incapsulato è assunto
 * puro e deterministico.
 */
public final class Memoized<T> implements Supplier<T> {

    private final Supplier<T> computation;
    private boolean computed = false;
    private T value;

    public Memoized(Supplier<T> computation) {
        this.computation = Objects.requireNonNull(computation, "computation");
    }

    @Override
    public synchronized T get() {
        if (!computed) {
            value = computation.get();
            computed = true;
        }
        return value;
    }

    public synchronized boolean isComputed() {
        return computed;
    }
}

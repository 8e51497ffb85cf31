package org.formalities.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Contesto immutabile di valutazione: associa simboli liberi a valori di verità o numeri.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = builder().build();

    private final EvaluationMode mode;
    private final Map<String, Boolean> truths;
    private final Map<String, Double> numbers;

    private EvaluationContext(EvaluationMode mode, Map<String, Boolean> truths, Map<String, Double> numbers) {
        this.mode = mode;
        this.truths = Collections.unmodifiableMap(new HashMap<>(truths));
        this.numbers = Collections.unmodifiableMap(new HashMap<>(numbers));
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Boolean> truthOf(String symbol) {
        return Optional.ofNullable(truths.get(symbol));
    }

    public Optional<Double> numberOf(String symbol) {
        return Optional.ofNullable(numbers.get(symbol));
    }

    public EvaluationMode mode() {
        return mode;
    }

    public Map<String, Boolean> truths() {
        return truths;
    }

    public static final class Builder {

        private EvaluationMode mode = EvaluationMode.STRICT;
        private final Map<String, Boolean> truths = new HashMap<>();
        private final Map<String, Double> numbers = new HashMap<>();

        private Builder() {
        }

        public Builder mode(EvaluationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder bind(String symbol, boolean value) {
            truths.put(symbol, value);
            return this;
        }

        public Builder bind(String symbol, double value) {
            numbers.put(symbol, value);
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(mode, truths, numbers);
        }
    }
}

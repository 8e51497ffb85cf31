package org.formalities.core;

import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.Supplier;

/**
 * PROPOSIZIONE NUMERICA - Calcolo differito con valore memoizzato
 *
 * Una volta valutata restituisce sempre lo stesso valore: la cache vive in un
 * {@link Memoized} privato dell'istanza. Il calcolo incapsulato è assunto puro.
 *
 * OPERAZIONI:
 * - aritmetica (plus, minus, times, dividedBy): nuova NumericProposition
 * - confronto (gt, lt, ge, le, eq): CompoundProposition booleana su operatori COMPARISON
 *
 * UGUAGLIANZA: per simbolo. Le proposizioni derivate hanno simbolo canonico
 * costruito dagli operandi, es. "(a + 2)".
 */
public final class NumericProposition extends Proposition implements Atomic {

    private final String symbol;
    private final Memoized<Double> value;

    private NumericProposition(String symbol, Supplier<Double> computation) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Simbolo numerico non può essere null o vuoto");
        }
        this.symbol = symbol;
        this.value = new Memoized<>(computation);
    }

    public static NumericProposition constant(double value) {
        return new NumericProposition(formatNumber(value), () -> value);
    }

    public static NumericProposition named(String symbol, Supplier<Double> computation) {
        return new NumericProposition(symbol, computation);
    }

    /**
     * Rende un numero senza parte decimale quando è intero ("3" e non "3.0").
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    //region ARITMETICA

    public NumericProposition plus(NumericProposition other) {
        return combine("+", other, Double::sum);
    }

    public NumericProposition minus(NumericProposition other) {
        return combine("-", other, (a, b) -> a - b);
    }

    public NumericProposition times(NumericProposition other) {
        return combine("*", other, (a, b) -> a * b);
    }

    public NumericProposition dividedBy(NumericProposition other) {
        return combine("/", other, (a, b) -> {
            if (b == 0.0) {
                throw new ArithmeticException("divisione per zero");
            }
            return a / b;
        });
    }

    public NumericProposition negated() {
        NumericProposition self = this;
        return new NumericProposition("-" + symbol, () -> -self.value.get());
    }

    private NumericProposition combine(String sign, NumericProposition other, DoubleBinaryOperator function) {
        NumericProposition left = this;
        return new NumericProposition("(" + symbol + " " + sign + " " + other.symbol + ")",
                () -> function.applyAsDouble(left.value.get(), other.value.get()));
    }

    //endregion

    //region CONFRONTI

    public CompoundProposition gt(NumericProposition other) {
        return compare(OperatorRegistry.GT, other);
    }

    public CompoundProposition lt(NumericProposition other) {
        return compare(OperatorRegistry.LT, other);
    }

    public CompoundProposition ge(NumericProposition other) {
        return compare(OperatorRegistry.GE, other);
    }

    public CompoundProposition le(NumericProposition other) {
        return compare(OperatorRegistry.LE, other);
    }

    public CompoundProposition eq(NumericProposition other) {
        return compare(OperatorRegistry.EQ, other);
    }

    public CompoundProposition compare(String operatorName, NumericProposition other) {
        return CompoundProposition.of(OperatorRegistry.standard().require(operatorName), this, other);
    }

    //endregion

    @Override
    public PropositionKind kind() {
        return PropositionKind.NUMERIC;
    }

    /**
     * Il contesto non influenza il risultato: il calcolo è chiuso sui propri operandi.
     */
    @Override
    public Evaluation evaluate(EvaluationContext context) {
        try {
            Double result = value.get();
            if (result == null || result.isNaN() || result.isInfinite()) {
                return Evaluation.failed("valore numerico non definito per " + symbol);
            }
            return Evaluation.number(result);
        } catch (ArithmeticException e) {
            return Evaluation.failed(e.getMessage() + " in " + symbol);
        }
    }

    public boolean isComputed() {
        return value.isComputed();
    }

    @Override
    void collectAtoms(Set<Proposition> into) {
        into.add(this);
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public String toCanonicalString() {
        return symbol;
    }

    @Override
    public LogicType logicType() {
        return LogicType.TERM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericProposition)) return false;
        return symbol.equals(((NumericProposition) o).symbol);
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }
}

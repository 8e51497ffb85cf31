package org.formalities.core;

import org.formalities.error.ArityMismatchException;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * OPERATORE LOGICO - Funzione con nome e arità fissa sulle proposizioni
 *
 * Gli operatori sono immutabili, registrati una sola volta in un {@link OperatorRegistry}
 * e recuperati per nome: il codice di valutazione non ne costruisce mai di nuovi.
 *
 * COMPONENTI:
 * - nome di registrazione (chiave di lookup, es. "IMPLIES")
 * - simbolo canonico per il rendering (es. "→")
 * - arità e famiglia semantica
 * - funzione di verità (BOOLEAN) oppure relazione numerica (COMPARISON);
 *   le famiglie MODAL e TEMPORAL non hanno semantica verofunzionale
 */
public final class Operator implements LogicEntity {

    private final String name;
    private final String symbol;
    private final Arity arity;
    private final OperatorKind kind;
    private final TruthFunction truthFunction;
    private final BiPredicate<Double, Double> relation;

    private Operator(String name, String symbol, Arity arity, OperatorKind kind,
                     TruthFunction truthFunction, BiPredicate<Double, Double> relation) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome operatore non può essere null o vuoto");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Simbolo operatore non può essere null o vuoto");
        }
        this.name = name;
        this.symbol = symbol;
        this.arity = Objects.requireNonNull(arity, "arity");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.truthFunction = truthFunction;
        this.relation = relation;
    }

    //region FACTORY

    public static Operator booleanOperator(String name, String symbol, Arity arity, TruthFunction function) {
        return new Operator(name, symbol, arity, OperatorKind.BOOLEAN,
                Objects.requireNonNull(function, "function"), null);
    }

    public static Operator modalOperator(String name, String symbol, Arity arity) {
        return new Operator(name, symbol, arity, OperatorKind.MODAL, null, null);
    }

    public static Operator temporalOperator(String name, String symbol, Arity arity) {
        return new Operator(name, symbol, arity, OperatorKind.TEMPORAL, null, null);
    }

    public static Operator comparisonOperator(String name, String symbol, BiPredicate<Double, Double> relation) {
        return new Operator(name, symbol, Arity.BINARY, OperatorKind.COMPARISON, null,
                Objects.requireNonNull(relation, "relation"));
    }

    //endregion

    /**
     * Verifica che il numero di operandi rispetti l'arità dichiarata.
     *
     * @throws ArityMismatchException se il conteggio non è ammesso
     */
    public void checkArity(int operandCount) {
        if (!arity.accepts(operandCount)) {
            throw new ArityMismatchException(name, arity.describe(), operandCount);
        }
    }

    /**
     * Applica la funzione di verità.
     *
     * @throws IllegalStateException se l'operatore non è verofunzionale
     */
    public boolean applyTruth(List<Boolean> operands) {
        if (truthFunction == null) {
            throw new IllegalStateException("Operatore " + name + " non ha semantica verofunzionale");
        }
        checkArity(operands.size());
        return truthFunction.apply(operands);
    }

    public boolean compare(double left, double right) {
        if (relation == null) {
            throw new IllegalStateException("Operatore " + name + " non è un confronto numerico");
        }
        return relation.test(left, right);
    }

    public boolean isTruthFunctional() {
        return truthFunction != null;
    }

    public String name() {
        return name;
    }

    public String symbol() {
        return symbol;
    }

    public Arity arity() {
        return arity;
    }

    public OperatorKind kind() {
        return kind;
    }

    @Override
    public String toCanonicalString() {
        return symbol;
    }

    @Override
    public LogicType logicType() {
        return LogicType.OPERATOR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operator)) return false;
        Operator other = (Operator) o;
        return name.equals(other.name) && arity == other.arity && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity, kind);
    }

    @Override
    public String toString() {
        return name + "(" + symbol + ")";
    }
}

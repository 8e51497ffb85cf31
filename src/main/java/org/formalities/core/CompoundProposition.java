package org.formalities.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PROPOSIZIONE COMPOSTA - Operatore applicato a proposizioni operando
 *
 * L'arità viene verificata in costruzione: una composta malformata non esiste mai.
 *
 * VALUTAZIONE:
 * - BOOLEAN: valuta gli operandi e applica la funzione di verità
 * - COMPARISON: confronta i valori numerici degli operandi
 * - MODAL, TEMPORAL: FAILED, nessuna semantica a mondi possibili
 * Un operando FAILED rende FAILED il risultato; altrimenti un operando UNBOUND lo rende UNBOUND.
 */
public final class CompoundProposition extends Proposition implements Compound {

    private final Operator operator;
    private final List<Proposition> operands;
    private final int hash;

    private CompoundProposition(Operator operator, List<Proposition> operands) {
        if (operator == null) {
            throw new IllegalArgumentException("Operatore non può essere null");
        }
        if (operands == null || operands.contains(null)) {
            throw new IllegalArgumentException("Operandi non possono essere null");
        }
        operator.checkArity(operands.size());
        if (operator.kind() == OperatorKind.COMPARISON) {
            for (Proposition operand : operands) {
                if (operand.kind() != PropositionKind.NUMERIC) {
                    throw new IllegalArgumentException("Confronto " + operator.name()
                            + " richiede operandi numerici: " + operand);
                }
            }
        }
        this.operator = operator;
        this.operands = List.copyOf(operands);
        this.hash = Objects.hash(operator, this.operands);
    }

    public static CompoundProposition of(Operator operator, Proposition... operands) {
        return new CompoundProposition(operator, Arrays.asList(operands));
    }

    public static CompoundProposition of(Operator operator, List<? extends Proposition> operands) {
        return new CompoundProposition(operator, new ArrayList<>(operands));
    }

    @Override
    public PropositionKind kind() {
        return PropositionKind.COMPOUND;
    }

    @Override
    public Evaluation evaluate(EvaluationContext context) {
        return switch (operator.kind()) {
            case MODAL, TEMPORAL -> Evaluation.failed("operatore " + operator.name()
                    + " richiede semantica non verofunzionale");
            case COMPARISON -> evaluateComparison(context);
            case BOOLEAN -> evaluateBoolean(context);
        };
    }

    private Evaluation evaluateBoolean(EvaluationContext context) {
        List<Boolean> values = new ArrayList<>(operands.size());
        Evaluation unbound = null;
        for (Proposition operand : operands) {
            Evaluation result = operand.evaluate(context);
            switch (result.kind()) {
                case FAILED -> {
                    return result;
                }
                case UNBOUND -> {
                    if (unbound == null) unbound = result;
                }
                case NUMBER -> {
                    return Evaluation.failed("operando numerico in connettivo " + operator.name() + ": " + operand);
                }
                case TRUTH -> values.add(result.truthValue());
            }
        }
        if (unbound != null) {
            return unbound;
        }
        return Evaluation.truth(operator.applyTruth(values));
    }

    private Evaluation evaluateComparison(EvaluationContext context) {
        Evaluation left = operands.get(0).evaluate(context);
        Evaluation right = operands.get(1).evaluate(context);
        if (left.kind() == Evaluation.Kind.FAILED) return left;
        if (right.kind() == Evaluation.Kind.FAILED) return right;
        if (!left.isNumber()) return left;
        if (!right.isNumber()) return right;
        return Evaluation.truth(operator.compare(left.numberValue(), right.numberValue()));
    }

    @Override
    void collectAtoms(Set<Proposition> into) {
        for (Proposition operand : operands) {
            operand.collectAtoms(into);
        }
    }

    @Override
    public int depth() {
        int max = 0;
        for (Proposition operand : operands) {
            max = Math.max(max, operand.depth());
        }
        return max + 1;
    }

    @Override
    public Proposition negatedOperand() {
        return OperatorRegistry.NOT.equals(operator.name()) ? operands.get(0) : null;
    }

    @Override
    public Operator operator() {
        return operator;
    }

    @Override
    public List<Proposition> components() {
        return operands;
    }

    public Proposition operand(int index) {
        return operands.get(index);
    }

    /**
     * Rendering canonico:
     * - unario: ¬p, □p, ALWAYS p
     * - binario: (p → q)
     * - n-ario: ∧(p, q, r)
     */
    @Override
    public String toCanonicalString() {
        String symbol = operator.symbol();
        return switch (operator.arity()) {
            case UNARY -> {
                String operand = operands.get(0).toCanonicalString();
                yield Character.isLetter(symbol.charAt(symbol.length() - 1))
                        ? symbol + " " + operand
                        : symbol + operand;
            }
            case BINARY -> "(" + operands.get(0).toCanonicalString() + " " + symbol + " "
                    + operands.get(1).toCanonicalString() + ")";
            case NARY -> symbol + operands.stream()
                    .map(Proposition::toCanonicalString)
                    .collect(Collectors.joining(", ", "(", ")"));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompoundProposition)) return false;
        CompoundProposition other = (CompoundProposition) o;
        return hash == other.hash && operator.equals(other.operator) && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}

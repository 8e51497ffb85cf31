package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.Evaluation;
import org.formalities.core.EvaluationContext;
import org.formalities.core.OperatorKind;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;
import org.formalities.framework.EquivalenceNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RISOLUZIONE QUERY - Risposta a tre valori sulle proposizioni note
 *
 * ORDINE DI VALUTAZIONE:
 * 1. presenza strutturale (o equivalente, se il normalizzatore è attivo): TRUE
 * 2. presenza del complemento: FALSE
 * 3. composizione sui connettivi booleani a partire dagli operandi
 * 4. costanti e confronti numerici valutabili
 * 5. altrimenti UNKNOWN
 *
 * Non cerca dimostrazioni: deriva soltanto ciò che segue dalla tavola di verità
 * dei connettivi sugli operandi già noti. Non solleva mai per un fatto assente.
 */
final class QueryResolver {

    /**
     * Risposta con l'insieme di proposizioni note che la sostengono.
     */
    static final class Answer {

        private static final Answer UNKNOWN = new Answer(TriState.UNKNOWN, List.of());

        private final TriState value;
        private final List<Proposition> support;

        private Answer(TriState value, Collection<Proposition> support) {
            this.value = value;
            this.support = List.copyOf(new LinkedHashSet<>(support));
        }

        TriState value() {
            return value;
        }

        List<Proposition> support() {
            return support;
        }

        private Answer negate() {
            return new Answer(value.negate(), support);
        }
    }

    private final Set<Proposition> known;
    private final EquivalenceNormalizer normalizer;

    /**
     * @param normalizer normalizzatore per l'equivalenza, null per il solo confronto strutturale
     */
    QueryResolver(Collection<Proposition> known, EquivalenceNormalizer normalizer) {
        this.known = new LinkedHashSet<>(known);
        this.normalizer = normalizer;
    }

    TriState resolve(Proposition query) {
        return answer(query).value();
    }

    Answer answer(Proposition query) {
        Proposition witness = find(query);
        if (witness != null) {
            return new Answer(TriState.TRUE, List.of(witness));
        }
        Proposition counter = find(Propositions.complement(query));
        if (counter != null) {
            return new Answer(TriState.FALSE, List.of(counter));
        }
        if (query instanceof AtomicProposition) {
            Boolean fixed = ((AtomicProposition) query).fixedValue();
            return fixed != null ? new Answer(TriState.of(fixed), List.of()) : Answer.UNKNOWN;
        }
        if (query instanceof CompoundProposition) {
            return compose((CompoundProposition) query);
        }
        return Answer.UNKNOWN;
    }

    private Proposition find(Proposition candidate) {
        if (known.contains(candidate)) {
            return candidate;
        }
        if (normalizer != null) {
            for (Proposition fact : known) {
                if (normalizer.equivalent(fact, candidate)) {
                    return fact;
                }
            }
        }
        return null;
    }

    private Answer compose(CompoundProposition query) {
        if (query.operator().kind() == OperatorKind.COMPARISON) {
            Evaluation evaluation = query.evaluate(EvaluationContext.empty());
            return evaluation.isTruth() ? new Answer(TriState.of(evaluation.truthValue()), List.of()) : Answer.UNKNOWN;
        }
        if (query.operator().kind() != OperatorKind.BOOLEAN) {
            return Answer.UNKNOWN;
        }

        List<Answer> operands = new ArrayList<>();
        for (Proposition operand : query.components()) {
            operands.add(answer(operand));
        }

        return switch (query.operator().name()) {
            case OperatorRegistry.NOT -> operands.get(0).negate();
            case OperatorRegistry.AND, OperatorRegistry.ANDN -> conjunction(operands);
            case OperatorRegistry.OR, OperatorRegistry.ORN -> disjunction(operands);
            case OperatorRegistry.NAND, OperatorRegistry.NANDN -> conjunction(operands).negate();
            case OperatorRegistry.NOR, OperatorRegistry.NORN -> disjunction(operands).negate();
            case OperatorRegistry.IMPLIES -> disjunction(List.of(operands.get(0).negate(), operands.get(1)));
            case OperatorRegistry.IFF -> biconditional(operands.get(0), operands.get(1), false);
            case OperatorRegistry.XOR -> biconditional(operands.get(0), operands.get(1), true);
            default -> Answer.UNKNOWN;
        };
    }

    private static Answer conjunction(List<Answer> operands) {
        List<Proposition> support = new ArrayList<>();
        for (Answer operand : operands) {
            if (operand.value() == TriState.FALSE) {
                return new Answer(TriState.FALSE, operand.support());
            }
        }
        for (Answer operand : operands) {
            if (operand.value() == TriState.UNKNOWN) {
                return Answer.UNKNOWN;
            }
            support.addAll(operand.support());
        }
        return new Answer(TriState.TRUE, support);
    }

    private static Answer disjunction(List<Answer> operands) {
        List<Answer> negated = new ArrayList<>();
        for (Answer operand : operands) {
            negated.add(operand.negate());
        }
        return conjunction(negated).negate();
    }

    private static Answer biconditional(Answer left, Answer right, boolean exclusive) {
        if (!left.value().isDefinite() || !right.value().isDefinite()) {
            return Answer.UNKNOWN;
        }
        List<Proposition> support = new ArrayList<>(left.support());
        support.addAll(right.support());
        boolean same = left.value() == right.value();
        return new Answer(TriState.of(exclusive != same), support);
    }
}

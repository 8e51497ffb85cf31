package org.formalities.framework;

import org.formalities.core.AtomicProposition;
import org.formalities.core.Evaluation;
import org.formalities.core.EvaluationContext;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;

import java.util.ArrayList;
import java.util.List;

/**
 * COERENZA LOGICA - Confronto del candidato con il contesto già asserito
 *
 * CONTROLLI:
 * 1. il complemento del candidato (¬X per X, X per ¬X) è già asserito
 * 2. altrimenti, il candidato risulta falso valutandolo con i letterali asseriti
 *
 * Sotto un framework che impone NON_CONTRADICTION l'esito è ERROR,
 * altrimenti la contraddizione è accettata come FLAGGED.
 */
public final class LogicalConsistencyStrategy implements ValidationStrategy {

    @Override
    public String name() {
        return "logical-consistency";
    }

    @Override
    public ValidationStage stage() {
        return ValidationStage.LOGICAL_CONSISTENCY;
    }

    @Override
    public List<Diagnostic> check(Proposition candidate, ValidationContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Framework framework = context.framework();

        Proposition complement = Propositions.complement(candidate);
        if (context.asserted().contains(complement) || context.asserted().contains(candidate.negate())) {
            diagnostics.add(Diagnostic.byLaw(this, framework, Law.NON_CONTRADICTION,
                    "contraddizione: " + candidate + " e " + complement + " entrambe asserite"));
            return diagnostics;
        }

        Evaluation evaluation = candidate.evaluate(literalContext(context));
        if (evaluation.isTruth() && !evaluation.truthValue()) {
            diagnostics.add(Diagnostic.byLaw(this, framework, Law.NON_CONTRADICTION,
                    candidate + " è falsa rispetto ai fatti asseriti"));
        }
        return diagnostics;
    }

    /**
     * Letterali asseriti come legami: p vero per p, p falso per ¬p.
     */
    private EvaluationContext literalContext(ValidationContext context) {
        EvaluationContext.Builder builder = EvaluationContext.builder();
        for (Proposition fact : context.asserted()) {
            if (fact instanceof AtomicProposition) {
                builder.bind(((AtomicProposition) fact).symbol(), true);
            } else if (fact.isNegation() && fact.negatedOperand() instanceof AtomicProposition) {
                builder.bind(((AtomicProposition) fact.negatedOperand()).symbol(), false);
            }
        }
        return builder.build();
    }
}

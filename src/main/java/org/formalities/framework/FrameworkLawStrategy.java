package org.formalities.framework;

import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * LEGGI DEL FRAMEWORK - Controlli specifici del framework attivo
 *
 * CONTROLLI:
 * - ogni operatore appartiene a una famiglia accettata dal framework
 * - contraddizione interna A ∧ ¬A: ERROR sotto NON_CONTRADICTION, altrimenti FLAGGED
 * - terzo escluso A ∨ ¬A sotto un framework che rifiuta EXCLUDED_MIDDLE: FLAGGED
 */
public final class FrameworkLawStrategy implements ValidationStrategy {

    @Override
    public String name() {
        return "framework-laws";
    }

    @Override
    public ValidationStage stage() {
        return ValidationStage.FRAMEWORK_LAWS;
    }

    @Override
    public List<Diagnostic> check(Proposition candidate, ValidationContext context) {
        Framework framework = context.framework();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> reportedOperators = new HashSet<>();

        Propositions.walk(candidate, node -> {
            if (!(node instanceof CompoundProposition)) {
                return;
            }
            CompoundProposition compound = (CompoundProposition) node;

            if (!framework.accepts(compound.operator().kind())
                    && reportedOperators.add(compound.operator().name())) {
                diagnostics.add(Diagnostic.error(this, null, "operatore " + compound.operator().name()
                        + " (" + compound.operator().kind() + ") non supportato dal framework " + framework.id()));
            }

            if (Propositions.hasOperator(compound, OperatorRegistry.AND, OperatorRegistry.ANDN)
                    && containsComplementaryPair(compound.components())) {
                diagnostics.add(Diagnostic.byLaw(this, framework, Law.NON_CONTRADICTION,
                        "contraddizione interna in " + compound));
            }

            if (framework.rejects(Law.EXCLUDED_MIDDLE)
                    && Propositions.hasOperator(compound, OperatorRegistry.OR, OperatorRegistry.ORN)
                    && containsComplementaryPair(compound.components())) {
                diagnostics.add(Diagnostic.flagged(this, Law.EXCLUDED_MIDDLE,
                        "terzo escluso non garantito nel framework " + framework.id() + ": " + compound));
            }
        });
        return diagnostics;
    }

    private static boolean containsComplementaryPair(List<Proposition> operands) {
        Set<Proposition> seen = new HashSet<>(operands);
        for (Proposition operand : operands) {
            if (operand.isNegation() && seen.contains(operand.negatedOperand())) {
                return true;
            }
        }
        return false;
    }
}

package org.formalities.framework;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;

import java.util.ArrayList;
import java.util.List;

/**
 * Buona formazione: operatori registrati, simboli non vuoti, profondità limitata.
 */
public final class SyntacticStrategy implements ValidationStrategy {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final OperatorRegistry operators;
    private final int maxDepth;

    public SyntacticStrategy(OperatorRegistry operators, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Profondità massima deve essere positiva: " + maxDepth);
        }
        this.operators = operators;
        this.maxDepth = maxDepth;
    }

    @Override
    public String name() {
        return "syntactic";
    }

    @Override
    public ValidationStage stage() {
        return ValidationStage.SYNTACTIC;
    }

    @Override
    public List<Diagnostic> check(Proposition candidate, ValidationContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (candidate == null) {
            diagnostics.add(Diagnostic.error(this, null, "proposizione assente"));
            return diagnostics;
        }

        if (candidate.depth() > maxDepth) {
            diagnostics.add(Diagnostic.error(this, null,
                    "profondità " + candidate.depth() + " oltre il limite " + maxDepth));
        }

        Propositions.walk(candidate, node -> {
            if (node instanceof CompoundProposition) {
                CompoundProposition compound = (CompoundProposition) node;
                if (!operators.contains(compound.operator())) {
                    diagnostics.add(Diagnostic.error(this, null,
                            "operatore non registrato: " + compound.operator()));
                }
            } else if (node instanceof AtomicProposition && ((AtomicProposition) node).symbol().isBlank()) {
                diagnostics.add(Diagnostic.error(this, null, "simbolo atomico vuoto"));
            }
        });
        return diagnostics;
    }
}

package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;
import org.formalities.error.CollaboratorTimeoutException;
import org.formalities.error.ErrorHandlers;
import org.formalities.error.ErrorReport;
import org.formalities.error.FallException;
import org.formalities.error.FrameworkIncompatibleException;
import org.formalities.error.UnjustifiedInferenceException;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.ast.ProofBlock;
import org.formalities.fall.ast.ProofStep;
import org.formalities.framework.Diagnostic;
import org.formalities.framework.EquivalenceNormalizer;
import org.formalities.framework.Framework;
import org.formalities.framework.Law;
import org.formalities.framework.ValidationEngine;
import org.formalities.framework.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESECUTORE DI PROVE - Verifica passo per passo di un blocco BEGIN PROOF
 *
 * PREAMBOLO:
 * - fatti di primo livello nello stato come FACT
 * - clausole GIVEN come premesse (mai asserite)
 * - risoluzione del goal e dell'eventuale restrizione USING
 *
 * ASSERT n:
 * 1. risoluzione dei nomi
 * 2. la proposizione deve essere nota (TRUE) rispetto allo stato
 * 3. validazione sotto i framework attivi
 * 4. ingresso nello stato citando il supporto
 *
 * INFER n:
 * 1. assioma esistente e ammesso da USING
 * 2. premesse citate presenti nello stato
 * 3. leggi richieste dall'assioma imposte dai framework attivi
 * 4. confronto degli slot con backtracking
 * 5. corrispondenza della conclusione
 * 6. validazione e ingresso nello stato
 *
 * Il primo passo rifiutato chiude il blocco: lo stato resta quello del passo precedente.
 */
final class ProofExecutor {

    private static final Logger LOGGER = Logger.getLogger(ProofExecutor.class.getName());

    private final SymbolTable symbols;
    private final ExpressionResolver resolver;
    private final ValidationEngine engine;
    private final ErrorHandlers errors;
    private final ExecutionStatistics statistics;
    private final boolean equivalenceMatching;
    private final long timeoutMillis;

    ProofExecutor(SymbolTable symbols, ExpressionResolver resolver, ValidationEngine engine, ErrorHandlers errors,
                  ExecutionStatistics statistics, boolean equivalenceMatching, long timeoutMillis) {
        this.symbols = symbols;
        this.resolver = resolver;
        this.engine = engine;
        this.errors = errors;
        this.statistics = statistics;
        this.equivalenceMatching = equivalenceMatching;
        this.timeoutMillis = timeoutMillis;
    }

    ProofOutcome execute(ProofBlock block, Collection<Proposition> facts, List<Framework> frameworks) {
        LOGGER.fine("Inizio blocco di prova: " + block.describe());

        ProofState state = new ProofState();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Proposition goal = null;
        Set<String> allowedAxioms;

        try {
            for (Proposition fact : facts) {
                state.establish(fact, Justification.fact());
            }
            for (Expression given : block.givens()) {
                state.establish(resolver.resolve(given), Justification.given());
            }
            goal = resolver.resolve(block.goal());
            allowedAxioms = allowedAxioms(block.usingAxioms());
        } catch (FallException e) {
            return ProofOutcome.failed(goal, state, 0,
                    errors.dispatch(e, "BEGIN PROOF", state.snapshot()), diagnostics);
        }

        for (ProofStep step : block.steps()) {
            statistics.incrementSteps();
            String prior = state.snapshot();
            try {
                switch (step.kind()) {
                    case ASSERT -> executeAssert(step, state, frameworks, diagnostics);
                    case INFER -> executeInfer(step, goal, allowedAxioms, state, frameworks, diagnostics);
                }
            } catch (FallException e) {
                ErrorReport report = errors.dispatch(e, "STEP " + step.number() + ": " + step.describe(), prior);
                LOGGER.warning("Passo " + step.number() + " rifiutato: " + report.describe());
                return ProofOutcome.failed(goal, state, step.number(), report, diagnostics);
            }
        }

        ProofOutcome.GoalMatch match = matchGoal(goal, state, frameworks.get(0));
        if (match == ProofOutcome.GoalMatch.NONE) {
            String rendering = goal.toCanonicalString();
            UnjustifiedInferenceException missingGoal = new UnjustifiedInferenceException(
                    "Goal non stabilito alla fine del blocco: " + rendering, rendering);
            return ProofOutcome.failed(goal, state, 0,
                    errors.dispatch(missingGoal, "PROVE " + rendering, state.snapshot()), diagnostics);
        }

        LOGGER.fine("Goal " + goal.toCanonicalString() + " stabilito (" + match + ")");
        return ProofOutcome.proved(goal, state, match, diagnostics);
    }

    //region PASSI

    private void executeAssert(ProofStep step, ProofState state, List<Framework> frameworks,
                               List<Diagnostic> diagnostics) {
        Proposition proposition = resolver.resolve(step.expression());
        String rendering = proposition.toCanonicalString();

        QueryResolver.Answer known = new QueryResolver(state.propositions(), normalizerFor(frameworks))
                .answer(proposition);
        if (known.value() != TriState.TRUE) {
            throw new UnjustifiedInferenceException(
                    "ASSERT di una proposizione non stabilita (" + known.value() + "): " + rendering, rendering);
        }

        diagnostics.addAll(validate(proposition, frameworks, state.asserted()));
        state.establish(proposition, Justification.asserted(step.number(), known.support()));
    }

    private void executeInfer(ProofStep step, Proposition blockGoal, Set<String> allowedAxioms, ProofState state,
                              List<Framework> frameworks, List<Diagnostic> diagnostics) {
        Axiom axiom = symbols.requireAxiom(step.axiomName());
        if (allowedAxioms != null && !allowedAxioms.contains(axiom.name())) {
            throw new UnjustifiedInferenceException("Assioma " + axiom.name() + " escluso dalla clausola USING",
                    axiom.name());
        }

        List<Proposition> cited = new ArrayList<>();
        for (Expression premise : step.premises()) {
            Proposition proposition = resolver.resolve(premise);
            if (!state.contains(proposition)) {
                String rendering = proposition.toCanonicalString();
                throw new UnjustifiedInferenceException("Premessa citata non stabilita: " + rendering, rendering);
            }
            cited.add(proposition);
        }

        for (Law law : axiom.requiredLaws()) {
            for (Framework framework : frameworks) {
                if (!framework.enforces(law)) {
                    throw new FrameworkIncompatibleException("Assioma " + axiom.name() + " richiede la legge "
                            + law + ", non valida in " + framework.id(), List.of(law + " @ " + framework.id()));
                }
            }
        }

        PatternMatcher.Match match = PatternMatcher.matchSlots(axiom.premises(), cited, axiom.metavariables());
        if (!match.succeeded()) {
            String slot = match.failedSlot().toCanonicalString();
            throw new UnjustifiedInferenceException("Nessuna premessa citata soddisfa lo slot " + slot
                    + " di " + axiom.name(), slot);
        }

        Proposition derived = resolver.resolve(step.expression());
        if (axiom.concludesGoalOnly()) {
            if (!derived.equals(blockGoal)) {
                throw new UnjustifiedInferenceException("Assioma " + axiom.name()
                        + " conclude solo il goal del blocco", blockGoal.toCanonicalString());
            }
        } else {
            Map<String, Proposition> bindings = new HashMap<>(match.bindings());
            if (!PatternMatcher.matches(axiom.conclusion(), derived, axiom.metavariables(), bindings)) {
                Proposition expected = PatternMatcher.instantiate(axiom.conclusion(), match.bindings(),
                        axiom.metavariables());
                throw new UnjustifiedInferenceException("Conclusione " + derived.toCanonicalString()
                        + " non prevista da " + axiom.name(), expected.toCanonicalString());
            }
        }

        diagnostics.addAll(validate(derived, frameworks, state.asserted()));
        state.establish(derived, Justification.inferred(step.number(), axiom.name(), match.premises()));
    }

    //endregion

    /**
     * Valida sotto tutti i framework attivi.
     *
     * @return diagnostiche non bloccanti
     * @throws CollaboratorTimeoutException se il validatore esterno non ha risposto
     * @throws FrameworkIncompatibleException se la pipeline rifiuta la proposizione
     */
    List<Diagnostic> validate(Proposition proposition, List<Framework> frameworks,
                              Collection<Proposition> asserted) {
        ValidationResult result = engine.validateAll(proposition, frameworks, asserted);
        if (result.hasTimeout()) {
            throw new CollaboratorTimeoutException("validatore esterno", timeoutMillis);
        }
        if (!result.isValid()) {
            throw new FrameworkIncompatibleException("Validazione rifiutata per "
                    + proposition.toCanonicalString(), result.messages());
        }
        if (result.isFlagged()) {
            LOGGER.info("Proposizione accettata con segnalazioni: " + result.messages());
        }
        return result.flags();
    }

    EquivalenceNormalizer normalizerFor(List<Framework> frameworks) {
        return equivalenceMatching ? new EquivalenceNormalizer(frameworks.get(0)) : null;
    }

    private ProofOutcome.GoalMatch matchGoal(Proposition goal, ProofState state, Framework primary) {
        if (state.contains(goal)) {
            return ProofOutcome.GoalMatch.STRUCTURAL;
        }
        if (equivalenceMatching) {
            EquivalenceNormalizer normalizer = new EquivalenceNormalizer(primary);
            for (Proposition established : state.propositions()) {
                if (normalizer.equivalent(established, goal)) {
                    return ProofOutcome.GoalMatch.EQUIVALENT;
                }
            }
        }
        return ProofOutcome.GoalMatch.NONE;
    }

    private Set<String> allowedAxioms(List<String> using) {
        if (using.isEmpty()) {
            return null;
        }
        Set<String> allowed = new LinkedHashSet<>();
        for (String name : using) {
            allowed.add(symbols.requireAxiom(name).name());
        }
        return allowed;
    }
}

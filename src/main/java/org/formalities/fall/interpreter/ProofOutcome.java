package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;
import org.formalities.error.ErrorReport;
import org.formalities.framework.Diagnostic;

import java.util.List;
import java.util.Locale;

/**
 * ESITO DI UN BLOCCO DI PROVA
 *
 * Successo solo se ogni passo è stato accettato e il goal è presente nello stato
 * (strutturalmente o per equivalenza). In caso di fallimento lo stato resta quello
 * valido fino al passo precedente a quello rifiutato.
 */
public final class ProofOutcome {

    /** Modo in cui il goal è stato riconosciuto nello stato finale */
    public enum GoalMatch {
        STRUCTURAL,
        EQUIVALENT,
        NONE
    }

    private final Proposition goal;
    private final ProofState state;
    private final GoalMatch goalMatch;
    private final int failedStep;
    private final ErrorReport error;
    private final List<Diagnostic> diagnostics;

    private ProofOutcome(Proposition goal, ProofState state, GoalMatch goalMatch, int failedStep,
                         ErrorReport error, List<Diagnostic> diagnostics) {
        this.goal = goal;
        this.state = state;
        this.goalMatch = goalMatch;
        this.failedStep = failedStep;
        this.error = error;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static ProofOutcome proved(Proposition goal, ProofState state, GoalMatch goalMatch,
                               List<Diagnostic> diagnostics) {
        if (goalMatch == GoalMatch.NONE) {
            throw new IllegalArgumentException("Una prova riuscita richiede il goal nello stato");
        }
        return new ProofOutcome(goal, state, goalMatch, 0, null, diagnostics);
    }

    /**
     * @param failedStep numero del passo rifiutato, 0 se il fallimento riguarda il goal o il preambolo
     */
    static ProofOutcome failed(Proposition goal, ProofState state, int failedStep, ErrorReport error,
                               List<Diagnostic> diagnostics) {
        return new ProofOutcome(goal, state, GoalMatch.NONE, failedStep, error, diagnostics);
    }

    public boolean isProved() {
        return error == null;
    }

    /** Goal risolto, null se la risoluzione stessa è fallita */
    public Proposition goal() {
        return goal;
    }

    public ProofState state() {
        return state;
    }

    public GoalMatch goalMatch() {
        return goalMatch;
    }

    public int failedStep() {
        return failedStep;
    }

    public ErrorReport error() {
        return error;
    }

    /** Diagnostiche non bloccanti raccolte durante i passi (es. contraddizioni tollerate) */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean isFlagged() {
        return !diagnostics.isEmpty();
    }

    public String describe() {
        String target = goal != null ? goal.toCanonicalString() : "?";
        if (isProved()) {
            return "PROVA RIUSCITA: " + target + " (" + goalMatch.name().toLowerCase(Locale.ROOT) + ", "
                    + state.size() + " proposizioni)" + (isFlagged() ? " [segnalata]" : "");
        }
        return "PROVA FALLITA: " + target + (failedStep > 0 ? " al passo " + failedStep : "")
                + " - " + error.describe();
    }

    @Override
    public String toString() {
        return describe();
    }
}

package org.formalities.fall.interpreter;

import org.formalities.error.ErrorReport;
import org.formalities.fall.ast.StatementKind;
import org.formalities.framework.Diagnostic;

import java.util.List;

/**
 * RISULTATO DI ISTRUZIONE - Esito strutturato di ogni istruzione di primo livello
 *
 * COMPONENTI:
 * - tipo di istruzione e costrutto di origine
 * - successo o fallimento, con il report d'errore instradato
 * - diagnostiche di validazione (anche per istruzioni accettate ma segnalate)
 * - risposta a tre valori per QUERY, forma simbolica per SYMBOLIZE
 * - esito del blocco per PROOF
 */
public final class StatementResult {

    private final StatementKind kind;
    private final String construct;
    private final boolean success;
    private final List<Diagnostic> diagnostics;
    private final TriState answer;
    private final String rendering;
    private final ProofOutcome proof;
    private final ErrorReport error;

    private StatementResult(StatementKind kind, String construct, boolean success, List<Diagnostic> diagnostics,
                            TriState answer, String rendering, ProofOutcome proof, ErrorReport error) {
        this.kind = kind;
        this.construct = construct;
        this.success = success;
        this.diagnostics = List.copyOf(diagnostics);
        this.answer = answer;
        this.rendering = rendering;
        this.proof = proof;
        this.error = error;
    }

    //region FACTORY

    static StatementResult completed(StatementKind kind, String construct, List<Diagnostic> diagnostics) {
        return new StatementResult(kind, construct, true, diagnostics, null, null, null, null);
    }

    static StatementResult answered(String construct, TriState answer) {
        return new StatementResult(StatementKind.QUERY, construct, true, List.of(), answer, null, null, null);
    }

    static StatementResult rendered(String construct, String rendering) {
        return new StatementResult(StatementKind.SYMBOLIZE, construct, true, List.of(), null, rendering, null, null);
    }

    static StatementResult ofProof(String construct, ProofOutcome outcome) {
        return new StatementResult(StatementKind.PROOF_BLOCK, construct, outcome.isProved(), outcome.diagnostics(),
                null, null, outcome, outcome.error());
    }

    static StatementResult failed(StatementKind kind, String construct, ErrorReport error,
                                  List<Diagnostic> diagnostics) {
        return new StatementResult(kind, construct, false, diagnostics, null, null, null, error);
    }

    //endregion

    public StatementKind kind() {
        return kind;
    }

    public String construct() {
        return construct;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /** Risposta della QUERY, null per le altre istruzioni */
    public TriState answer() {
        return answer;
    }

    /** Forma simbolica di SYMBOLIZE, null per le altre istruzioni */
    public String rendering() {
        return rendering;
    }

    public ProofOutcome proof() {
        return proof;
    }

    public ErrorReport error() {
        return error;
    }

    public boolean isFlagged() {
        return success && !diagnostics.isEmpty();
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(success ? (isFlagged() ? "SEGNALATA " : "OK ") : "ERRORE ").append(construct);
        if (answer != null) {
            sb.append(" => ").append(answer);
        }
        if (rendering != null) {
            sb.append(" => ").append(rendering);
        }
        if (proof != null) {
            sb.append(" => ").append(proof.describe());
        } else if (error != null) {
            sb.append(" => ").append(error.describe());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}

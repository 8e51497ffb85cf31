package org.formalities.fall.interpreter;

import org.formalities.error.ErrorReport;

import java.util.ArrayList;
import java.util.List;

/**
 * REPORT DI ESECUZIONE - Risultati di tutte le istruzioni di un programma
 *
 * Un programma interrotto da un errore lessicale o sintattico non ha risultati:
 * nessuna istruzione viene eseguita su un AST incompleto.
 */
public final class RunReport {

    private final List<StatementResult> results;
    private final ErrorReport haltReport;
    private final ProofOutcome lastProof;
    private final ExecutionStatistics statistics;

    private RunReport(List<StatementResult> results, ErrorReport haltReport, ProofOutcome lastProof,
                      ExecutionStatistics statistics) {
        this.results = List.copyOf(results);
        this.haltReport = haltReport;
        this.lastProof = lastProof;
        this.statistics = statistics;
    }

    static RunReport completed(List<StatementResult> results, ProofOutcome lastProof,
                               ExecutionStatistics statistics) {
        return new RunReport(results, null, lastProof, statistics);
    }

    static RunReport halted(ErrorReport haltReport, ExecutionStatistics statistics) {
        return new RunReport(List.of(), haltReport, null, statistics);
    }

    public List<StatementResult> results() {
        return results;
    }

    public StatementResult result(int index) {
        return results.get(index);
    }

    public boolean isHalted() {
        return haltReport != null;
    }

    public ErrorReport haltReport() {
        return haltReport;
    }

    /** Esito dell'ultimo blocco di prova eseguito, null se nessuno */
    public ProofOutcome lastProof() {
        return lastProof;
    }

    public ExecutionStatistics statistics() {
        return statistics;
    }

    public boolean isSuccessful() {
        return !isHalted() && results.stream().allMatch(StatementResult::isSuccess);
    }

    public List<StatementResult> failures() {
        List<StatementResult> failures = new ArrayList<>();
        for (StatementResult result : results) {
            if (!result.isSuccess()) {
                failures.add(result);
            }
        }
        return failures;
    }

    /** Risposte delle QUERY in ordine di esecuzione */
    public List<TriState> answers() {
        List<TriState> answers = new ArrayList<>();
        for (StatementResult result : results) {
            if (result.answer() != null) {
                answers.add(result.answer());
            }
        }
        return answers;
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (isHalted()) {
            output.append("INTERROTTO: ").append(haltReport.describe()).append("\n");
        }
        for (StatementResult result : results) {
            output.append(result.describe()).append("\n");
        }
        return output.toString();
    }
}

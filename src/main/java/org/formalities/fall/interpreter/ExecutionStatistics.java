package org.formalities.fall.interpreter;

/**
 * STATISTICHE DI ESECUZIONE - Contatori e tempi di una sessione FALL
 *
 * Il timer parte alla costruzione e si ferma con {@link #stopTimer()}.
 */
public class ExecutionStatistics {

    //region CONTATORI

    private int statements = 0;
    private int definitions = 0;
    private int assertions = 0;
    private int proofs = 0;
    private int provedProofs = 0;
    private int steps = 0;
    private int queries = 0;
    private int failures = 0;
    private int timeouts = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    //endregion

    public ExecutionStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region INCREMENTI

    public synchronized void incrementStatements() {
        statements++;
    }

    public synchronized void incrementDefinitions() {
        definitions++;
    }

    public synchronized void incrementAssertions() {
        assertions++;
    }

    /**
     * Registra un blocco di prova concluso.
     */
    public synchronized void recordProof(boolean proved) {
        proofs++;
        if (proved) {
            provedProofs++;
        }
    }

    public synchronized void incrementSteps() {
        steps++;
    }

    public synchronized void incrementQueries() {
        queries++;
    }

    public synchronized void incrementFailures() {
        failures++;
    }

    public synchronized void incrementTimeouts() {
        timeouts++;
    }

    //endregion

    //region TIMING

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public int getStatements() {
        return statements;
    }

    public int getDefinitions() {
        return definitions;
    }

    public int getAssertions() {
        return assertions;
    }

    public int getProofs() {
        return proofs;
    }

    public int getProvedProofs() {
        return provedProofs;
    }

    public int getSteps() {
        return steps;
    }

    public int getQueries() {
        return queries;
    }

    public int getFailures() {
        return failures;
    }

    public int getTimeouts() {
        return timeouts;
    }

    /** @return frazione di blocchi riusciti (0.0 se nessun blocco) */
    public double getProofSuccessRate() {
        return proofs > 0 ? (double) provedProofs / proofs : 0.0;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("===========================[ EXECUTION COMPLETED: PROGRAM STATS ]============================\n");
        output.append("    Istruzioni:  ").append(statements).append("\n");
        output.append("    Definizioni: ").append(definitions).append("\n");
        output.append("    Asserzioni:  ").append(assertions).append("\n");
        output.append("=======================================[ PROOF STATS ]=======================================\n");
        output.append("    Prove:       ").append(provedProofs).append("/").append(proofs).append("\n");
        output.append("    Passi:       ").append(steps).append("\n");
        output.append("    Query:       ").append(queries).append("\n");
        output.append("    Errori:      ").append(failures).append("\n");

        if (timeouts > 0) {
            output.append("    Timeout:     ").append(timeouts).append("\n");
        }

        output.append("    Tempo:       ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=============================================================================================\n");

        return output.toString();
    }

    /**
     * Riepilogo su singola riga per il log.
     */
    public String toCompactString() {
        return String.format("Stats[Stmt:%d, Proof:%d/%d, Step:%d, Query:%d, Err:%d, Time:%dms]",
                statements, provedProofs, proofs, steps, queries, failures, getExecutionTimeMs());
    }

    //endregion
}

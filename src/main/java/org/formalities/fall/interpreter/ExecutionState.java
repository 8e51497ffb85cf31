package org.formalities.fall.interpreter;

/**
 * Stati dell'interprete durante l'esecuzione di un programma.
 *
 * IDLE → EXECUTING_TOP_LEVEL → EXECUTING_PROOF → EXECUTING_TOP_LEVEL → IDLE.
 * HALTED è terminale e si raggiunge solo per errori lessicali o sintattici.
 */
public enum ExecutionState {
    IDLE,
    EXECUTING_TOP_LEVEL,
    EXECUTING_PROOF,
    HALTED
}

package org.formalities.framework;

/**
 * Fasi della pipeline di validazione, nell'ordine fisso di esecuzione.
 */
public enum ValidationStage {
    SYNTACTIC,
    LOGICAL_CONSISTENCY,
    FRAMEWORK_LAWS,
    EXTERNAL
}

package org.formalities.core;

/**
 * Famiglia semantica di un operatore; i framework dichiarano quali famiglie accettano.
 */
public enum OperatorKind {
    BOOLEAN,     // Connettivi verofunzionali
    MODAL,       // Necessità e possibilità
    TEMPORAL,    // Sempre, prima o poi, finché
    COMPARISON   // Relazioni tra quantità numeriche
}

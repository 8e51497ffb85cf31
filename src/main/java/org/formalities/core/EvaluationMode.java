package org.formalities.core;

/**
 * Modalità del contesto di valutazione, inoltrata ai collaboratori esterni.
 */
public enum EvaluationMode {
    STRICT,      // Solo valori espliciti
    STRUCTURAL,  // Confronto sulla struttura
    SEMANTIC     // Confronto sul significato (a carico del collaboratore)
}

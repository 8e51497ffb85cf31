package org.formalities.error;

/**
 * Politica di propagazione associata a una categoria di errore.
 */
public enum ErrorPolicy {
    HALT,       // Interrompe l'intero programma
    CONTINUE    // Fallisce l'istruzione corrente, le successive proseguono
}

package org.formalities.error;

/**
 * CATEGORIE DI ERRORE - Enumerazione chiusa di tutti gli errori del sistema
 *
 * Ogni eccezione di dominio dichiara esattamente una categoria; la tabella
 * {@link ErrorHandlers} associa a ciascuna categoria la politica di propagazione.
 *
 * POLITICA:
 * - LEXICAL, SYNTAX: fatali per l'intera esecuzione del programma
 * - tutte le altre: locali all'istruzione o al passo di prova che le ha prodotte
 */
public enum ErrorKind {
    LEXICAL,                // Carattere o sequenza non riconosciuta
    SYNTAX,                 // Violazione della grammatica
    UNKNOWN_REFERENCE,      // Nome non definito
    ARITY_MISMATCH,         // Numero operandi diverso dall'arità dichiarata
    UNJUSTIFIED_INFERENCE,  // Premesse mancanti o non corrispondenti allo schema
    FRAMEWORK_INCOMPATIBLE, // Rifiuto della pipeline di validazione
    TIMEOUT,                // Collaboratore esterno oltre il tempo concesso
    AMBIGUOUS_QUERY,        // Nome registrato in più tabelle
    INVALID_DEFINITION;     // Ridefinizione o definizione malformata

    /**
     * @return true se l'errore interrompe l'intero programma
     */
    public boolean isFatal() {
        return this == LEXICAL || this == SYNTAX;
    }
}

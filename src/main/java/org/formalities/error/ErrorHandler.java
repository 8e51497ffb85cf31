package org.formalities.error;

/**
 * Gestore di una singola categoria di errore nella tabella di dispatch.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param error eccezione sollevata
     * @param construct costrutto incriminato (istruzione o passo) in forma leggibile
     * @param priorState descrizione dell'ultimo stato valido
     * @return report strutturato per l'utente
     */
    ErrorReport handle(FallException error, String construct, String priorState);
}

package org.formalities.error;

/**
 * Numero di operandi diverso dall'arità dichiarata. Sollevata solo in costruzione.
 */
public class ArityMismatchException extends FallException {

    public ArityMismatchException(String operatorName, String declared, int actual) {
        super(ErrorKind.ARITY_MISMATCH, "Operatore " + operatorName + " richiede arità " + declared
                + " ma ha ricevuto " + actual + " operandi");
    }
}

package org.formalities.error;

/**
 * Definizione rifiutata: nome già registrato, tag mancanti o vincoli di regola violati.
 */
public class InvalidDefinitionException extends FallException {

    public InvalidDefinitionException(String message) {
        super(ErrorKind.INVALID_DEFINITION, message);
    }
}

package org.formalities.error;

/**
 * Riferimento a un nome non definito (proposizione, assioma, operatore o framework).
 */
public class UnknownReferenceException extends FallException {

    private final String name;

    public UnknownReferenceException(String name, String message) {
        super(ErrorKind.UNKNOWN_REFERENCE, message);
        this.name = name;
    }

    public String name() {
        return name;
    }
}

package org.formalities.error;

/**
 * PASSO NON GIUSTIFICATO - Premessa mancante o schema dell'assioma non soddisfatto
 *
 * Il campo {@code missing} nomina esattamente la premessa citata assente
 * oppure lo slot dello schema che non ha trovato corrispondenza.
 */
public class UnjustifiedInferenceException extends FallException {

    private final String missing;

    public UnjustifiedInferenceException(String message, String missing) {
        super(ErrorKind.UNJUSTIFIED_INFERENCE, message);
        this.missing = missing;
    }

    public String missing() {
        return missing;
    }
}

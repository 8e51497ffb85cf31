package org.formalities.error;

/**
 * Un collaboratore esterno (bridge NLP, validatore) non ha risposto entro il timeout.
 */
public class CollaboratorTimeoutException extends FallException {

    private final String collaborator;
    private final long timeoutMillis;

    public CollaboratorTimeoutException(String collaborator, long timeoutMillis) {
        super(ErrorKind.TIMEOUT, "Collaboratore " + collaborator + " non ha risposto entro "
                + timeoutMillis + " ms");
        this.collaborator = collaborator;
        this.timeoutMillis = timeoutMillis;
    }

    public String collaborator() {
        return collaborator;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }
}

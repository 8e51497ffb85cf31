package org.formalities.error;

import org.formalities.fall.lexer.SourcePosition;

/**
 * Radice della gerarchia di eccezioni di dominio.
 *
 * Eccezione non controllata: ogni sottoclasse fissa la propria {@link ErrorKind},
 * così che il dispatch avvenga sulla categoria e mai sul tipo a runtime.
 */
public abstract class FallException extends RuntimeException {

    private final ErrorKind kind;

    /** Posizione nel sorgente, null se l'errore non nasce dal testo FALL */
    private final SourcePosition position;

    protected FallException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    protected FallException(ErrorKind kind, String message, SourcePosition position) {
        this(kind, message, position, null);
    }

    protected FallException(ErrorKind kind, String message, SourcePosition position, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("Categoria errore non può essere null");
        }
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind kind() {
        return kind;
    }

    public SourcePosition position() {
        return position;
    }

    @Override
    public String toString() {
        String where = position != null ? " @" + position : "";
        return kind + where + ": " + getMessage();
    }
}

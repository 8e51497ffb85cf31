package org.formalities.error;

import org.formalities.fall.lexer.SourcePosition;

/**
 * VIOLAZIONE GRAMMATICALE - Errore fatale di parsing
 *
 * Trasporta il token incriminato, i token attesi in quel punto e il costrutto
 * grammaticale in corso di riconoscimento. Nessun AST parziale viene restituito.
 */
public class SyntaxException extends FallException {

    /** Lessema del token che ha causato l'errore ("<EOF>" a fine input) */
    private final String offendingToken;

    /** Insieme dei token attesi, in forma leggibile (può essere null) */
    private final String expected;

    /** Regola grammaticale in corso (es. "proofStep") */
    private final String construct;

    public SyntaxException(String message, String offendingToken, String expected,
                           String construct, SourcePosition position) {
        super(ErrorKind.SYNTAX, message, position);
        this.offendingToken = offendingToken;
        this.expected = expected;
        this.construct = construct;
    }

    public String offendingToken() {
        return offendingToken;
    }

    public String expected() {
        return expected;
    }

    public String construct() {
        return construct;
    }
}

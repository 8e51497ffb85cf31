package org.formalities.error;

import org.formalities.fall.lexer.SourcePosition;

/**
 * Sequenza di caratteri non riconosciuta dal lexer. La tokenizzazione non tenta recupero.
 */
public class LexicalException extends FallException {

    private final String offendingText;

    public LexicalException(String message, String offendingText, SourcePosition position) {
        super(ErrorKind.LEXICAL, message, position);
        this.offendingText = offendingText;
    }

    public String offendingText() {
        return offendingText;
    }
}

package org.formalities.fall.lexer;

import org.formalities.fall.grammar.FallLexer;

/**
 * Token FALL: tipo, lessema e posizione. Incapsula il token ANTLR da cui deriva.
 */
public final class Token {

    private final org.antlr.v4.runtime.Token source;
    private final String kind;
    private final SourcePosition position;

    Token(org.antlr.v4.runtime.Token source) {
        this.source = source;
        this.kind = source.getType() == org.antlr.v4.runtime.Token.EOF
                ? "EOF"
                : FallLexer.VOCABULARY.getSymbolicName(source.getType());
        this.position = new SourcePosition(source.getLine(), source.getCharPositionInLine());
    }

    /** Nome simbolico del tipo, es. "IDENTIFIER", "TERMINATOR", "EOF" */
    public String kind() {
        return kind;
    }

    public int type() {
        return source.getType();
    }

    public String lexeme() {
        return source.getType() == org.antlr.v4.runtime.Token.EOF ? "<EOF>" : source.getText();
    }

    public SourcePosition position() {
        return position;
    }

    public boolean isEof() {
        return source.getType() == org.antlr.v4.runtime.Token.EOF;
    }

    /**
     * Token ANTLR originale, consumato dal parser.
     */
    public org.antlr.v4.runtime.Token antlrToken() {
        return source;
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme() + "')@" + position;
    }
}

package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.Objects;

/**
 * Istruzione FALL immutabile. Le varianti sono le classi finali di questo package.
 */
public abstract class Statement {

    private final SourcePosition position;

    Statement(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public abstract StatementKind kind();

    public abstract <R> R accept(StatementVisitor<R> visitor);

    /**
     * Forma testuale sintetica, usata nei report di errore.
     */
    public abstract String describe();

    public SourcePosition position() {
        return position;
    }

    @Override
    public String toString() {
        return describe();
    }
}

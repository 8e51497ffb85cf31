package org.formalities.fall.lexer;

/**
 * Posizione nel sorgente: riga da 1, colonna da 0 come nel lexer ANTLR.
 */
public final class SourcePosition {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    private final int line;
    private final int column;

    public SourcePosition(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition other = (SourcePosition) o;
        return line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * line + column;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

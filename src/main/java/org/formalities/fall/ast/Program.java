package org.formalities.fall.ast;

import java.util.List;

/**
 * Radice dell'AST: sequenza ordinata di istruzioni di primo livello.
 */
public final class Program {

    private final List<Statement> statements;

    public Program(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Statement> statements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    @Override
    public String toString() {
        return "Program" + statements;
    }
}

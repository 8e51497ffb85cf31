package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

/**
 * ASSERT di primo livello: aggiunge un fatto permanente.
 */
public final class Assertion extends Statement {

    private final Expression expression;

    public Assertion(Expression expression, SourcePosition position) {
        super(position);
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ASSERTION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssertion(this);
    }

    @Override
    public String describe() {
        return "ASSERT " + expression.render();
    }
}

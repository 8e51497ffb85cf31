package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

public final class Query extends Statement {

    private final Expression expression;

    public Query(Expression expression, SourcePosition position) {
        super(position);
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.QUERY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }

    @Override
    public String describe() {
        return "QUERY " + expression.render();
    }
}

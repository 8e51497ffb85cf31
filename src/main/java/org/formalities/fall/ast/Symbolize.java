package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

public final class Symbolize extends Statement {

    private final Expression expression;

    public Symbolize(Expression expression, SourcePosition position) {
        super(position);
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.SYMBOLIZE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSymbolize(this);
    }

    @Override
    public String describe() {
        return "SYMBOLIZE " + expression.render();
    }
}

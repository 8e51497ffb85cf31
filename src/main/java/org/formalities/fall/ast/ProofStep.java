package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Passo numerato di una prova: ASSERT oppure INFER ... FROM [...] VIA assioma.
 */
public final class ProofStep {

    public enum Kind {
        ASSERT,
        INFER
    }

    private final Kind kind;
    private final int number;
    private final Expression expression;
    private final List<Expression> premises;
    private final String axiomName;
    private final SourcePosition position;

    private ProofStep(Kind kind, int number, Expression expression, List<Expression> premises,
                      String axiomName, SourcePosition position) {
        this.kind = kind;
        this.number = number;
        this.expression = expression;
        this.premises = List.copyOf(premises);
        this.axiomName = axiomName;
        this.position = position;
    }

    public static ProofStep assertion(int number, Expression expression, SourcePosition position) {
        return new ProofStep(Kind.ASSERT, number, expression, List.of(), null, position);
    }

    public static ProofStep inference(int number, Expression goal, List<Expression> premises,
                                      String axiomName, SourcePosition position) {
        return new ProofStep(Kind.INFER, number, goal, premises, axiomName, position);
    }

    public Kind kind() {
        return kind;
    }

    public int number() {
        return number;
    }

    /** Espressione asserita (ASSERT) oppure goal del passo (INFER) */
    public Expression expression() {
        return expression;
    }

    public List<Expression> premises() {
        return premises;
    }

    public String axiomName() {
        return axiomName;
    }

    public SourcePosition position() {
        return position;
    }

    public String describe() {
        if (kind == Kind.ASSERT) {
            return "STEP " + number + ": ASSERT " + expression.render();
        }
        return "STEP " + number + ": INFER " + expression.render() + " FROM "
                + premises.stream().map(Expression::render).collect(Collectors.joining(", ", "[", "]"))
                + " VIA " + axiomName;
    }

    @Override
    public String toString() {
        return describe();
    }
}

package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DEFINE AXIOM: condizioni richieste (premesse) e conclusione opzionale.
 * Una condizione "X IS FALSE" richiede la premessa ¬X.
 */
public final class AxiomDefinition extends Statement {

    private final String name;
    private final List<Condition> conditions;
    private final Expression conclusion;

    public AxiomDefinition(String name, List<Condition> conditions, Expression conclusion, SourcePosition position) {
        super(position);
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("Assioma " + name + " senza condizioni");
        }
        this.name = name;
        this.conditions = List.copyOf(conditions);
        this.conclusion = conclusion;
    }

    public String name() {
        return name;
    }

    public List<Condition> conditions() {
        return conditions;
    }

    /** @return conclusione dichiarata, null se l'assioma conclude il goal della prova */
    public Expression conclusion() {
        return conclusion;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.AXIOM_DEFINITION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAxiomDefinition(this);
    }

    @Override
    public String describe() {
        return "DEFINE AXIOM " + name + " WHERE "
                + conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND "))
                + (conclusion != null ? " INFER " + conclusion.render() : "");
    }

    public static final class Condition {

        private final Expression pattern;
        private final boolean expectedTrue;

        public Condition(Expression pattern, boolean expectedTrue) {
            this.pattern = pattern;
            this.expectedTrue = expectedTrue;
        }

        public Expression pattern() {
            return pattern;
        }

        public boolean expectedTrue() {
            return expectedTrue;
        }

        @Override
        public String toString() {
            return pattern.render() + (expectedTrue ? " IS TRUE" : " IS FALSE");
        }
    }
}

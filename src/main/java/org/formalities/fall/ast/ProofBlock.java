package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;

/**
 * BEGIN PROOF ... END PROOF: premesse, goal, assiomi ammessi e passi ordinati.
 */
public final class ProofBlock extends Statement {

    private final List<Expression> givens;
    private final Expression goal;
    private final List<String> usingAxioms;
    private final List<ProofStep> steps;

    public ProofBlock(List<Expression> givens, Expression goal, List<String> usingAxioms,
                      List<ProofStep> steps, SourcePosition position) {
        super(position);
        this.givens = List.copyOf(givens);
        this.goal = goal;
        this.usingAxioms = List.copyOf(usingAxioms);
        this.steps = List.copyOf(steps);
    }

    public List<Expression> givens() {
        return givens;
    }

    public Expression goal() {
        return goal;
    }

    /** Assiomi ammessi; lista vuota se la clausola USING è assente */
    public List<String> usingAxioms() {
        return usingAxioms;
    }

    public List<ProofStep> steps() {
        return steps;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PROOF_BLOCK;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitProofBlock(this);
    }

    @Override
    public String describe() {
        return "PROOF di " + goal.render() + " (" + givens.size() + " premesse, " + steps.size() + " passi)";
    }
}

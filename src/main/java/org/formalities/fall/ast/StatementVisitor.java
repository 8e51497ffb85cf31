package org.formalities.fall.ast;

/**
 * Visitatore sulle varianti di {@link Statement}.
 */
public interface StatementVisitor<R> {

    R visitRuleDefinition(RuleDefinition statement);

    R visitAxiomDefinition(AxiomDefinition statement);

    R visitPropositionDefinition(PropositionDefinition statement);

    R visitAssertion(Assertion statement);

    R visitProofBlock(ProofBlock statement);

    R visitQuery(Query statement);

    R visitSymbolize(Symbolize statement);

    R visitPragma(Pragma statement);
}

package org.formalities.fall.ast;

/**
 * Varianti chiuse delle istruzioni di primo livello.
 */
public enum StatementKind {
    RULE_DEFINITION,
    AXIOM_DEFINITION,
    PROPOSITION_DEFINITION,
    ASSERTION,
    PROOF_BLOCK,
    QUERY,
    SYMBOLIZE,
    PRAGMA
}

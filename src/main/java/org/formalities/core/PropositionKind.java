package org.formalities.core;

/**
 * Varianti chiuse di {@link Proposition}.
 */
public enum PropositionKind {
    ATOMIC,
    COMPOUND,
    NUMERIC
}

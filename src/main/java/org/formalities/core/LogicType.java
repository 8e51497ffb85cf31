package org.formalities.core;

/**
 * Etichetta di tipo logico esposta da ogni {@link LogicEntity}.
 */
public enum LogicType {
    PROPOSITION,
    PREDICATE,
    TERM,
    SYMBOL,
    OPERATOR,
    QUANTIFIER
}

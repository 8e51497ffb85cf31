package org.formalities.framework;

/**
 * Leggi logiche che un framework può imporre o rifiutare esplicitamente.
 */
public enum Law {
    EXCLUDED_MIDDLE,        // p ∨ ¬p
    NON_CONTRADICTION,      // ¬(p ∧ ¬p)
    DOUBLE_NEGATION,        // ¬¬p ↔ p
    DE_MORGAN,              // ¬(p ∧ q) ↔ (¬p ∨ ¬q)
    MATERIAL_IMPLICATION,   // (p → q) ↔ (¬p ∨ q)
    NECESSITATION,          // ⊢ p implica ⊢ □p
    MODAL_DUALITY           // ◇p ↔ ¬□¬p
}

package org.formalities.framework;

/**
 * Varianti chiuse di framework logico.
 */
public enum FrameworkKind {
    CLASSICAL,
    PARACONSISTENT,
    INTUITIONISTIC,
    MODAL,
    TEMPORAL
}

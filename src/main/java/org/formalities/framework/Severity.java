package org.formalities.framework;

/**
 * Gravità di una diagnostica: ERROR rifiuta, FLAGGED accetta segnalando.
 */
public enum Severity {
    ERROR,
    FLAGGED
}

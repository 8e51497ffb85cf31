package org.formalities.fall.interpreter;

/**
 * Risposta di una QUERY: stabilita, negata oppure non determinabile.
 */
public enum TriState {
    TRUE,
    FALSE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public TriState negate() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public boolean isDefinite() {
        return this != UNKNOWN;
    }
}

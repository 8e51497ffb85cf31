package org.formalities.core;

/**
 * Classi di arità degli operatori. NARY è variadica con almeno un operando.
 */
public enum Arity {
    UNARY,
    BINARY,
    NARY;

    public boolean accepts(int operandCount) {
        return switch (this) {
            case UNARY -> operandCount == 1;
            case BINARY -> operandCount == 2;
            case NARY -> operandCount >= 1;
        };
    }

    public String describe() {
        return switch (this) {
            case UNARY -> "1";
            case BINARY -> "2";
            case NARY -> ">=1";
        };
    }
}

package org.formalities.core;

import java.util.Objects;

/**
 * ESITO DI VALUTAZIONE - Risultato sempre definito di {@link Proposition#evaluate}
 *
 * VARIANTI:
 * - TRUTH: valore di verità
 * - NUMBER: valore numerico
 * - UNBOUND: simbolo libero non presente nel contesto
 * - FAILED: valutazione impossibile (semantica assente, divisione per zero, ...)
 */
public final class Evaluation {

    public enum Kind {
        TRUTH,
        NUMBER,
        UNBOUND,
        FAILED
    }

    private final Kind kind;
    private final Boolean truth;
    private final Double number;
    private final String reason;

    private Evaluation(Kind kind, Boolean truth, Double number, String reason) {
        this.kind = kind;
        this.truth = truth;
        this.number = number;
        this.reason = reason;
    }

    public static Evaluation truth(boolean value) {
        return new Evaluation(Kind.TRUTH, value, null, null);
    }

    public static Evaluation number(double value) {
        return new Evaluation(Kind.NUMBER, null, value, null);
    }

    public static Evaluation unbound(String symbol) {
        return new Evaluation(Kind.UNBOUND, null, null, "simbolo non legato: " + symbol);
    }

    public static Evaluation failed(String reason) {
        return new Evaluation(Kind.FAILED, null, null, reason);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTruth() {
        return kind == Kind.TRUTH;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isDefinite() {
        return kind == Kind.TRUTH || kind == Kind.NUMBER;
    }

    /**
     * @throws IllegalStateException se l'esito non è un valore di verità
     */
    public boolean truthValue() {
        if (kind != Kind.TRUTH) {
            throw new IllegalStateException("Esito " + kind + " non è un valore di verità");
        }
        return truth;
    }

    /**
     * @throws IllegalStateException se l'esito non è numerico
     */
    public double numberValue() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Esito " + kind + " non è numerico");
        }
        return number;
    }

    public String reason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Evaluation)) return false;
        Evaluation other = (Evaluation) o;
        return kind == other.kind && Objects.equals(truth, other.truth)
                && Objects.equals(number, other.number) && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, truth, number, reason);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TRUTH -> String.valueOf(truth);
            case NUMBER -> String.valueOf(number);
            case UNBOUND, FAILED -> kind + "(" + reason + ")";
        };
    }
}

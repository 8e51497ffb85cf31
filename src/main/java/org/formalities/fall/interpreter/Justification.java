package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * GIUSTIFICAZIONE - Motivo per cui una proposizione è entrata nello stato di prova
 *
 * TIPI:
 * - FACT: fatto di primo livello (ASSERT fuori dai blocchi)
 * - GIVEN: premessa del blocco, mai considerata asserita
 * - ASSERTED: ASSERT al passo N, con il supporto che la rende nota
 * - INFERRED: INFER al passo N tramite un assioma sulle premesse citate
 *
 * Le premesse citate formano la catena di derivazione verificabile.
 */
public final class Justification {

    public enum Kind {
        FACT,
        GIVEN,
        ASSERTED,
        INFERRED
    }

    private static final Justification FACT = new Justification(Kind.FACT, 0, null, List.of());
    private static final Justification GIVEN = new Justification(Kind.GIVEN, 0, null, List.of());

    private final Kind kind;
    private final int step;
    private final String axiom;
    private final List<Proposition> premises;

    private Justification(Kind kind, int step, String axiom, List<Proposition> premises) {
        this.kind = kind;
        this.step = step;
        this.axiom = axiom;
        this.premises = List.copyOf(premises);
    }

    public static Justification fact() {
        return FACT;
    }

    public static Justification given() {
        return GIVEN;
    }

    public static Justification asserted(int step, List<Proposition> support) {
        return new Justification(Kind.ASSERTED, step, null, support);
    }

    public static Justification inferred(int step, String axiom, List<Proposition> premises) {
        return new Justification(Kind.INFERRED, step, Objects.requireNonNull(axiom, "axiom"), premises);
    }

    public Kind kind() {
        return kind;
    }

    /** Numero del passo, 0 per fatti e premesse */
    public int step() {
        return step;
    }

    public String axiom() {
        return axiom;
    }

    public List<Proposition> premises() {
        return premises;
    }

    /**
     * Conta come asserzione per i controlli di consistenza: le premesse GIVEN no.
     */
    public boolean isAssertion() {
        return kind != Kind.GIVEN;
    }

    public String describe() {
        return switch (kind) {
            case FACT -> "fatto";
            case GIVEN -> "premessa";
            case ASSERTED -> "asserita al passo " + step + supportSuffix();
            case INFERRED -> "dedotta al passo " + step + " via " + axiom + supportSuffix();
        };
    }

    private String supportSuffix() {
        if (premises.isEmpty()) {
            return "";
        }
        return premises.stream().map(Proposition::toCanonicalString)
                .collect(Collectors.joining(", ", " da [", "]"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Justification)) return false;
        Justification other = (Justification) o;
        return kind == other.kind && step == other.step
                && Objects.equals(axiom, other.axiom) && premises.equals(other.premises);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, step, axiom, premises);
    }

    @Override
    public String toString() {
        return describe();
    }
}

package org.formalities.core;

import java.util.Objects;
import java.util.Set;

/**
 * PROPOSIZIONE ATOMICA - Simbolo indivisibile con valore fisso o risolto dal contesto
 *
 * VALUTAZIONE:
 * 1. valore di verità fisso, se presente
 * 2. legame del simbolo nel contesto
 * 3. altrimenti UNBOUND (mai un esito indefinito)
 *
 * UGUAGLIANZA: simbolo + valore fisso. Testo naturale e tag sono metadati
 * e non partecipano all'identità.
 */
public final class AtomicProposition extends Proposition implements Atomic {

    public static final AtomicProposition TRUE = new AtomicProposition("TRUE", Boolean.TRUE, null, TagSet.empty());
    public static final AtomicProposition FALSE = new AtomicProposition("FALSE", Boolean.FALSE, null, TagSet.empty());

    private final String symbol;
    private final Boolean fixedValue;
    private final String text;
    private final TagSet tags;

    private AtomicProposition(String symbol, Boolean fixedValue, String text, TagSet tags) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Simbolo atomico non può essere null o vuoto");
        }
        this.symbol = symbol.trim();
        this.fixedValue = fixedValue;
        this.text = text;
        this.tags = tags != null ? tags : TagSet.empty();
    }

    public static AtomicProposition named(String symbol) {
        return new AtomicProposition(symbol, null, null, TagSet.empty());
    }

    public static AtomicProposition valued(String symbol, boolean value) {
        return new AtomicProposition(symbol, value, null, TagSet.empty());
    }

    public static AtomicProposition constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Proposizione con testo in linguaggio naturale e struttura grammaticale.
     */
    public static AtomicProposition described(String symbol, String text, TagSet tags) {
        return new AtomicProposition(symbol, null, text, tags);
    }

    @Override
    public PropositionKind kind() {
        return PropositionKind.ATOMIC;
    }

    @Override
    public Evaluation evaluate(EvaluationContext context) {
        if (fixedValue != null) {
            return Evaluation.truth(fixedValue);
        }
        return context.truthOf(symbol)
                .map(Evaluation::truth)
                .orElseGet(() -> Evaluation.unbound(symbol));
    }

    @Override
    void collectAtoms(Set<Proposition> into) {
        into.add(this);
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public boolean isConstant() {
        return this.equals(TRUE) || this.equals(FALSE);
    }

    /** @return valore fisso, null se risolto dal contesto */
    public Boolean fixedValue() {
        return fixedValue;
    }

    /** @return testo naturale originale, null se assente */
    public String text() {
        return text;
    }

    public TagSet tags() {
        return tags;
    }

    @Override
    public String toCanonicalString() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AtomicProposition)) return false;
        AtomicProposition other = (AtomicProposition) o;
        return symbol.equals(other.symbol) && Objects.equals(fixedValue, other.fixedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, fixedValue);
    }
}

package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.Proposition;
import org.formalities.core.TagSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * SIMBOLIZZAZIONE - Forma simbolica canonica con atomi etichettati in forma predicativa
 *
 * QUANTIFICATORI:
 * - ALL, EVERY, EACH: ∀x(S(x) → P(x))
 * - SOME, A, AN:      ∃x(S(x) ∧ P(x))
 * - NO, NONE:         ∀x(S(x) → ¬P(x))
 * - assente:          P(S)
 *
 * I nomi dei predicati si ottengono dai frammenti etichettati: parole in
 * CamelCase, articoli iniziali rimossi. Gli atomi senza soggetto e predicato
 * restano nella forma canonica.
 */
final class PredicateRenderer {

    private static final Set<String> UNIVERSAL = Set.of("all", "every", "each");
    private static final Set<String> EXISTENTIAL = Set.of("some", "a", "an");
    private static final Set<String> NEGATIVE = Set.of("no", "none");
    private static final Set<String> ARTICLES = Set.of("a", "an", "the");

    private PredicateRenderer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static String render(Proposition proposition) {
        if (proposition instanceof AtomicProposition) {
            return renderAtom((AtomicProposition) proposition);
        }
        if (!(proposition instanceof CompoundProposition)) {
            return proposition.toCanonicalString();
        }

        CompoundProposition compound = (CompoundProposition) proposition;
        String symbol = compound.operator().symbol();
        List<String> operands = new ArrayList<>();
        for (Proposition operand : compound.components()) {
            operands.add(render(operand));
        }
        return switch (compound.operator().arity()) {
            case UNARY -> Character.isLetter(symbol.charAt(symbol.length() - 1))
                    ? symbol + " " + operands.get(0)
                    : symbol + operands.get(0);
            case BINARY -> "(" + operands.get(0) + " " + symbol + " " + operands.get(1) + ")";
            case NARY -> symbol + "(" + String.join(", ", operands) + ")";
        };
    }

    private static String renderAtom(AtomicProposition atom) {
        TagSet tags = atom.tags();
        Optional<String> subject = tags.subject();
        Optional<String> predicate = tags.predicate();
        if (subject.isEmpty() || predicate.isEmpty()) {
            return atom.toCanonicalString();
        }

        String s = predicateName(subject.get());
        String p = predicateName(predicate.get());
        String quantifier = tags.quantifier().map(q -> q.trim().toLowerCase(Locale.ROOT)).orElse("");

        if (UNIVERSAL.contains(quantifier)) {
            return "∀x(" + s + "(x) → " + p + "(x))";
        }
        if (EXISTENTIAL.contains(quantifier)) {
            return "∃x(" + s + "(x) ∧ " + p + "(x))";
        }
        if (NEGATIVE.contains(quantifier)) {
            return "∀x(" + s + "(x) → ¬" + p + "(x))";
        }
        return p + "(" + s + ")";
    }

    static String predicateName(String phrase) {
        String[] words = phrase.trim().split("[^\\p{L}\\p{N}]+");
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            String word = words[i];
            if (word.isEmpty() || (i == 0 && words.length > 1 && ARTICLES.contains(word.toLowerCase(Locale.ROOT)))) {
                continue;
            }
            name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return name.length() > 0 ? name.toString() : phrase.trim();
    }
}

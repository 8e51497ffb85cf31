package org.formalities.selection;

import org.formalities.framework.Feature;
import org.formalities.framework.Framework;

import java.util.Set;

/**
 * Voce della classifica: framework, punteggio e requisiti non soddisfatti.
 */
public final class FrameworkSuggestion {

    private final Framework framework;
    private final int score;
    private final Set<Feature> missing;

    FrameworkSuggestion(Framework framework, int score, Set<Feature> missing) {
        this.framework = framework;
        this.score = score;
        this.missing = Set.copyOf(missing);
    }

    public Framework framework() {
        return framework;
    }

    public int score() {
        return score;
    }

    public Set<Feature> missing() {
        return missing;
    }

    @Override
    public String toString() {
        return framework.id() + " (punteggio " + score + (missing.isEmpty() ? "" : ", mancano " + missing) + ")";
    }
}

package org.formalities.selection;

import org.formalities.framework.Framework;

import java.util.List;
import java.util.Optional;

/**
 * Esito della selezione: un framework scelto oppure l'esplicito "nessun framework compatibile".
 * I chiamanti devono gestire entrambi i casi.
 */
public final class Selection {

    private final FrameworkSuggestion chosen;
    private final List<FrameworkSuggestion> ranking;

    private Selection(FrameworkSuggestion chosen, List<FrameworkSuggestion> ranking) {
        this.chosen = chosen;
        this.ranking = List.copyOf(ranking);
    }

    static Selection of(FrameworkSuggestion chosen, List<FrameworkSuggestion> ranking) {
        return new Selection(chosen, ranking);
    }

    static Selection none(List<FrameworkSuggestion> ranking) {
        return new Selection(null, ranking);
    }

    public boolean isNone() {
        return chosen == null;
    }

    public Optional<Framework> framework() {
        return chosen == null ? Optional.empty() : Optional.of(chosen.framework());
    }

    /**
     * @throws IllegalStateException se nessun framework è compatibile
     */
    public Framework require() {
        if (chosen == null) {
            throw new IllegalStateException("Nessun framework compatibile");
        }
        return chosen.framework();
    }

    public int score() {
        return chosen == null ? 0 : chosen.score();
    }

    public List<FrameworkSuggestion> ranking() {
        return ranking;
    }

    @Override
    public String toString() {
        return chosen == null ? "NESSUN FRAMEWORK COMPATIBILE" : "selezionato " + chosen;
    }
}

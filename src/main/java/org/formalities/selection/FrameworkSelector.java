package org.formalities.selection;

import org.formalities.framework.Feature;
import org.formalities.framework.Framework;
import org.formalities.framework.FrameworkRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SELETTORE DI FRAMEWORK - Abbina i requisiti di una proposizione ai framework registrati
 *
 * PUNTEGGIO: requisiti soddisfatti - requisiti che il framework dichiara incompatibili.
 *
 * REGOLE:
 * - idoneo se il punteggio è positivo e nessun requisito è dichiarato incompatibile;
 *   con requisiti vuoti tutti sono idonei a punteggio 0
 * - vince il punteggio più alto, a parità l'identificatore lessicalmente minore
 * - senza idonei il risultato è {@link Selection#isNone()}, mai un default silenzioso
 *
 * Il selettore legge soltanto: nessun framework viene modificato.
 */
public final class FrameworkSelector {

    private static final Logger LOGGER = Logger.getLogger(FrameworkSelector.class.getName());

    private static final Comparator<FrameworkSuggestion> RANK_ORDER =
            Comparator.comparingInt(FrameworkSuggestion::score).reversed()
                    .thenComparing(s -> s.framework().id());

    private final FrameworkRegistry registry;

    public FrameworkSelector(FrameworkRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registro framework non può essere null");
        }
        this.registry = registry;
    }

    public Selection select(FrameworkRequirement requirement) {
        List<FrameworkSuggestion> ranking = rank(requirement);
        for (FrameworkSuggestion suggestion : ranking) {
            if (requirement.isEmpty() || isEligible(suggestion, requirement)) {
                LOGGER.fine("Framework selezionato per " + requirement + ": " + suggestion);
                return Selection.of(suggestion, ranking);
            }
        }
        LOGGER.info("Nessun framework compatibile per " + requirement);
        return Selection.none(ranking);
    }

    private static boolean isEligible(FrameworkSuggestion suggestion, FrameworkRequirement requirement) {
        if (suggestion.score() <= 0) {
            return false;
        }
        for (Feature feature : requirement.features()) {
            if (suggestion.framework().declaresIncompatible(feature)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Classifica completa di tutti i framework registrati.
     */
    public List<FrameworkSuggestion> rank(FrameworkRequirement requirement) {
        List<FrameworkSuggestion> ranking = new ArrayList<>();
        for (Framework framework : registry.all()) {
            ranking.add(score(framework, requirement));
        }
        ranking.sort(RANK_ORDER);
        return ranking;
    }

    FrameworkSuggestion score(Framework framework, FrameworkRequirement requirement) {
        int satisfied = 0;
        int incompatible = 0;
        Set<Feature> missing = EnumSet.noneOf(Feature.class);
        for (Feature feature : requirement.features()) {
            if (framework.offers(feature)) {
                satisfied++;
            } else {
                missing.add(feature);
            }
            if (framework.declaresIncompatible(feature)) {
                incompatible++;
            }
        }
        return new FrameworkSuggestion(framework, satisfied - incompatible, missing);
    }
}

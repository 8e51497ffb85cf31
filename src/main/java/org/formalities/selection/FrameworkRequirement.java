package org.formalities.selection;

import org.formalities.core.Operator;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;
import org.formalities.error.InvalidDefinitionException;
import org.formalities.framework.Feature;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Requisiti dichiarati (o dedotti) di una proposizione per la scelta del framework.
 */
public final class FrameworkRequirement {

    private final Set<Feature> features;

    private FrameworkRequirement(Set<Feature> features) {
        this.features = Collections.unmodifiableSet(features.isEmpty()
                ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features));
    }

    public static FrameworkRequirement of(Feature... features) {
        EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
        Collections.addAll(set, features);
        return new FrameworkRequirement(set);
    }

    /**
     * Interpreta tag testuali come "modal" o "needs temporal ordering".
     *
     * @throws InvalidDefinitionException se un tag non corrisponde ad alcuna capacità
     */
    public static FrameworkRequirement fromTags(Collection<String> tags) {
        EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
        for (String tag : tags) {
            Feature feature = Feature.fromTag(tag).orElseThrow(() ->
                    new InvalidDefinitionException("Requisito sconosciuto: '" + tag + "'"));
            set.add(feature);
        }
        return new FrameworkRequirement(set);
    }

    /**
     * Deduce i requisiti dalle famiglie degli operatori usati. I connettivi
     * booleani non aggiungono requisiti: ogni framework li offre.
     */
    public static FrameworkRequirement inferredFrom(Proposition proposition) {
        EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
        for (Operator operator : Propositions.operators(proposition)) {
            switch (operator.kind()) {
                case MODAL -> set.add(Feature.MODAL);
                case TEMPORAL -> set.add(Feature.TEMPORAL);
                case COMPARISON -> set.add(Feature.NUMERIC);
                case BOOLEAN -> {
                    // sempre disponibile
                }
            }
        }
        return new FrameworkRequirement(set);
    }

    public FrameworkRequirement union(FrameworkRequirement other) {
        EnumSet<Feature> set = EnumSet.noneOf(Feature.class);
        set.addAll(features);
        set.addAll(other.features);
        return new FrameworkRequirement(set);
    }

    public Set<Feature> features() {
        return features;
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FrameworkRequirement && features.equals(((FrameworkRequirement) o).features));
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        return "requisiti" + features;
    }
}

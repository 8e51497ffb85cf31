package org.formalities.framework;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * CAPACITÀ E REQUISITI - Etichette condivise tra framework e proposizioni
 *
 * Un framework dichiara le capacità che offre e quelle incompatibili;
 * una proposizione dichiara (o lascia dedurre dai suoi operatori) i requisiti.
 */
public enum Feature {
    PROPOSITIONAL,
    NUMERIC,
    MODAL,
    TEMPORAL,
    CONTRADICTION_TOLERANCE,
    CONSTRUCTIVE;

    private static final Map<String, Feature> ALIASES = Map.ofEntries(
            Map.entry("modality", MODAL),
            Map.entry("modal_accessibility", MODAL),
            Map.entry("modal_accessibility_reasoning", MODAL),
            Map.entry("temporal_ordering", TEMPORAL),
            Map.entry("time", TEMPORAL),
            Map.entry("paraconsistent", CONTRADICTION_TOLERANCE),
            Map.entry("paraconsistency", CONTRADICTION_TOLERANCE),
            Map.entry("contradiction", CONTRADICTION_TOLERANCE),
            Map.entry("intuitionistic", CONSTRUCTIVE),
            Map.entry("arithmetic", NUMERIC),
            Map.entry("classical", PROPOSITIONAL),
            Map.entry("boolean", PROPOSITIONAL)
    );

    /**
     * Interpreta un tag testuale: nome della capacità o alias, senza distinzione
     * di maiuscole, con prefisso "needs" opzionale.
     */
    public static Optional<Feature> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^needs\\s+", "")
                .replaceAll("[\\s-]+", "_");
        for (Feature feature : values()) {
            if (feature.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(feature);
            }
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }
}

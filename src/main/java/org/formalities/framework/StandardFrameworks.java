package org.formalities.framework;

/**
 * Definizioni dei framework forniti con il sistema.
 */
public final class StandardFrameworks {

    public static final String CLASSICAL = "classical";
    public static final String PARACONSISTENT = "paraconsistent";
    public static final String INTUITIONISTIC = "intuitionistic";
    public static final String MODAL = "modal";
    public static final String TEMPORAL = "temporal";

    private StandardFrameworks() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static Framework classical() {
        return Framework.builder(CLASSICAL, FrameworkKind.CLASSICAL)
                .description("Logica proposizionale classica a due valori")
                .capabilities(Feature.PROPOSITIONAL, Feature.NUMERIC)
                .incompatibleWith(Feature.MODAL, Feature.TEMPORAL,
                        Feature.CONTRADICTION_TOLERANCE, Feature.CONSTRUCTIVE)
                .laws(Law.EXCLUDED_MIDDLE, Law.NON_CONTRADICTION, Law.DOUBLE_NEGATION,
                        Law.DE_MORGAN, Law.MATERIAL_IMPLICATION)
                .build();
    }

    /**
     * Logica del paradosso: le contraddizioni sono registrate ma non rifiutate.
     */
    public static Framework paraconsistent() {
        return Framework.builder(PARACONSISTENT, FrameworkKind.PARACONSISTENT)
                .description("Logica paraconsistente tollerante alle contraddizioni")
                .capabilities(Feature.PROPOSITIONAL, Feature.NUMERIC, Feature.CONTRADICTION_TOLERANCE)
                .incompatibleWith(Feature.MODAL, Feature.TEMPORAL, Feature.CONSTRUCTIVE)
                .laws(Law.EXCLUDED_MIDDLE, Law.DOUBLE_NEGATION, Law.DE_MORGAN)
                .rejects(Law.NON_CONTRADICTION)
                .build();
    }

    public static Framework intuitionistic() {
        return Framework.builder(INTUITIONISTIC, FrameworkKind.INTUITIONISTIC)
                .description("Logica intuizionista senza terzo escluso")
                .capabilities(Feature.PROPOSITIONAL, Feature.NUMERIC, Feature.CONSTRUCTIVE)
                .incompatibleWith(Feature.MODAL, Feature.TEMPORAL, Feature.CONTRADICTION_TOLERANCE)
                .laws(Law.NON_CONTRADICTION)
                .rejects(Law.EXCLUDED_MIDDLE, Law.DOUBLE_NEGATION)
                .build();
    }

    public static Framework modal() {
        return Framework.builder(MODAL, FrameworkKind.MODAL)
                .description("Logica modale normale con necessità e possibilità")
                .capabilities(Feature.PROPOSITIONAL, Feature.NUMERIC, Feature.MODAL)
                .incompatibleWith(Feature.TEMPORAL, Feature.CONTRADICTION_TOLERANCE, Feature.CONSTRUCTIVE)
                .laws(Law.EXCLUDED_MIDDLE, Law.NON_CONTRADICTION, Law.DOUBLE_NEGATION,
                        Law.DE_MORGAN, Law.MATERIAL_IMPLICATION, Law.NECESSITATION, Law.MODAL_DUALITY)
                .build();
    }

    public static Framework temporal() {
        return Framework.builder(TEMPORAL, FrameworkKind.TEMPORAL)
                .description("Logica temporale lineare")
                .capabilities(Feature.PROPOSITIONAL, Feature.NUMERIC, Feature.TEMPORAL)
                .incompatibleWith(Feature.MODAL, Feature.CONTRADICTION_TOLERANCE, Feature.CONSTRUCTIVE)
                .laws(Law.EXCLUDED_MIDDLE, Law.NON_CONTRADICTION, Law.DOUBLE_NEGATION,
                        Law.DE_MORGAN, Law.MATERIAL_IMPLICATION)
                .build();
    }

    /**
     * Registro con tutti i framework standard.
     */
    public static FrameworkRegistry registry() {
        return FrameworkRegistry.builder()
                .register(classical())
                .register(paraconsistent())
                .register(intuitionistic())
                .register(modal())
                .register(temporal())
                .build();
    }
}

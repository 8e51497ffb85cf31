package org.formalities.framework;

import org.formalities.core.OperatorKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * FRAMEWORK LOGICO - Insieme immutabile di leggi e regole di accettazione
 *
 * COMPONENTI:
 * - identificatore e variante ({@link FrameworkKind})
 * - capacità offerte: determinano le famiglie di operatori accettate
 * - capacità dichiarate incompatibili: pesano negativamente nella selezione
 * - leggi imposte e leggi esplicitamente rifiutate
 *
 * Dopo la costruzione nessun campo cambia: selezione e validazione non lo mutano mai.
 */
public final class Framework {

    private final String id;
    private final FrameworkKind kind;
    private final String description;
    private final Set<Feature> capabilities;
    private final Set<Feature> incompatibilities;
    private final Set<Law> laws;
    private final Set<Law> rejectedLaws;

    private Framework(Builder builder) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.description = builder.description;
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(builder.capabilities));
        this.incompatibilities = builder.incompatibilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.incompatibilities));
        this.laws = builder.laws.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.laws));
        this.rejectedLaws = builder.rejectedLaws.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.rejectedLaws));
    }

    public static Builder builder(String id, FrameworkKind kind) {
        return new Builder(id, kind);
    }

    /**
     * Famiglia di operatori accettata in base alle capacità dichiarate.
     */
    public boolean accepts(OperatorKind operatorKind) {
        return switch (operatorKind) {
            case BOOLEAN -> capabilities.contains(Feature.PROPOSITIONAL);
            case COMPARISON -> capabilities.contains(Feature.NUMERIC);
            case MODAL -> capabilities.contains(Feature.MODAL);
            case TEMPORAL -> capabilities.contains(Feature.TEMPORAL);
        };
    }

    public boolean enforces(Law law) {
        return laws.contains(law);
    }

    public boolean rejects(Law law) {
        return rejectedLaws.contains(law);
    }

    public boolean offers(Feature feature) {
        return capabilities.contains(feature);
    }

    public boolean declaresIncompatible(Feature feature) {
        return incompatibilities.contains(feature);
    }

    public String id() {
        return id;
    }

    public FrameworkKind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public Set<Feature> capabilities() {
        return capabilities;
    }

    public Set<Feature> incompatibilities() {
        return incompatibilities;
    }

    public Set<Law> laws() {
        return laws;
    }

    public Set<Law> rejectedLaws() {
        return rejectedLaws;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Framework)) return false;
        Framework other = (Framework) o;
        return id.equals(other.id) && kind == other.kind && capabilities.equals(other.capabilities)
                && laws.equals(other.laws) && rejectedLaws.equals(other.rejectedLaws);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return id + "[" + kind + "]";
    }

    public static final class Builder {

        private final String id;
        private final FrameworkKind kind;
        private String description = "";
        private final Set<Feature> capabilities = EnumSet.noneOf(Feature.class);
        private final Set<Feature> incompatibilities = EnumSet.noneOf(Feature.class);
        private final Set<Law> laws = EnumSet.noneOf(Law.class);
        private final Set<Law> rejectedLaws = EnumSet.noneOf(Law.class);

        private Builder(String id, FrameworkKind kind) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Identificatore framework non può essere vuoto");
            }
            this.id = id;
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder capabilities(Feature... features) {
            Collections.addAll(capabilities, features);
            return this;
        }

        public Builder incompatibleWith(Feature... features) {
            Collections.addAll(incompatibilities, features);
            return this;
        }

        public Builder laws(Law... enforced) {
            Collections.addAll(laws, enforced);
            return this;
        }

        public Builder rejects(Law... rejected) {
            Collections.addAll(rejectedLaws, rejected);
            return this;
        }

        /**
         * @throws IllegalStateException se una legge è sia imposta sia rifiutata,
         *         o se una capacità è anche dichiarata incompatibile
         */
        public Framework build() {
            if (capabilities.isEmpty()) {
                throw new IllegalStateException("Framework " + id + " senza capacità dichiarate");
            }
            for (Law law : laws) {
                if (rejectedLaws.contains(law)) {
                    throw new IllegalStateException("Legge " + law + " sia imposta sia rifiutata in " + id);
                }
            }
            for (Feature feature : capabilities) {
                if (incompatibilities.contains(feature)) {
                    throw new IllegalStateException("Capacità " + feature + " anche incompatibile in " + id);
                }
            }
            return new Framework(this);
        }
    }
}

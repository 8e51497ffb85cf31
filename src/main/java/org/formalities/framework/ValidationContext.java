package org.formalities.framework;

import org.formalities.core.Proposition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Contesto della validazione: framework attivo e proposizioni già asserite.
 * Le premesse GIVEN non fanno parte dell'insieme asserito.
 */
public final class ValidationContext {

    private final Framework framework;
    private final Set<Proposition> asserted;

    private ValidationContext(Framework framework, Collection<? extends Proposition> asserted) {
        this.framework = Objects.requireNonNull(framework, "framework");
        this.asserted = Collections.unmodifiableSet(new LinkedHashSet<>(asserted));
    }

    public static ValidationContext of(Framework framework) {
        return new ValidationContext(framework, Set.of());
    }

    public static ValidationContext of(Framework framework, Collection<? extends Proposition> asserted) {
        return new ValidationContext(framework, asserted);
    }

    public Framework framework() {
        return framework;
    }

    public Set<Proposition> asserted() {
        return asserted;
    }

    public ValidationContext withFramework(Framework other) {
        return new ValidationContext(other, asserted);
    }
}

package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;
import org.formalities.framework.Law;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ASSIOMA - Schema di inferenza risolto
 *
 * Gli slot delle premesse sono proposizioni schema: gli atomi il cui simbolo è
 * una metavariabile si legano a qualunque proposizione durante il confronto.
 * Una conclusione null significa che l'assioma conclude solo il goal del blocco.
 */
public final class Axiom {

    private final String name;
    private final List<Proposition> premises;
    private final Proposition conclusion;
    private final Set<String> metavariables;
    private final Set<Law> requiredLaws;
    private final boolean builtIn;

    Axiom(String name, List<Proposition> premises, Proposition conclusion, Set<String> metavariables,
          Set<Law> requiredLaws, boolean builtIn) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome assioma non può essere vuoto");
        }
        if (premises.isEmpty()) {
            throw new IllegalArgumentException("Assioma " + name + " senza premesse");
        }
        this.name = name;
        this.premises = List.copyOf(premises);
        this.conclusion = conclusion;
        this.metavariables = Set.copyOf(metavariables);
        this.requiredLaws = requiredLaws.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(requiredLaws));
        this.builtIn = builtIn;
    }

    public String name() {
        return name;
    }

    public List<Proposition> premises() {
        return premises;
    }

    /** Schema della conclusione, oppure null */
    public Proposition conclusion() {
        return conclusion;
    }

    public boolean concludesGoalOnly() {
        return conclusion == null;
    }

    public Set<String> metavariables() {
        return metavariables;
    }

    public Set<Law> requiredLaws() {
        return requiredLaws;
    }

    public boolean isBuiltIn() {
        return builtIn;
    }

    public String describe() {
        String slots = premises.stream().map(Proposition::toCanonicalString).collect(Collectors.joining(", "));
        return name + ": [" + slots + "] ⊢ " + (conclusion != null ? conclusion.toCanonicalString() : "goal");
    }

    @Override
    public String toString() {
        return describe();
    }
}

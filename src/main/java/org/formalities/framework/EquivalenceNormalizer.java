package org.formalities.framework;

import org.formalities.core.CompoundProposition;
import org.formalities.core.Operator;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.core.Propositions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * NORMALIZZATORE DI EQUIVALENZA - Forma normale sotto le leggi del framework
 *
 * Due proposizioni sono equivalenti se hanno la stessa forma normale.
 * Si applicano solo le riscritture autorizzate dalle leggi del framework,
 * mai l'equivalenza proposizionale completa.
 *
 * PIPELINE DI RISCRITTURA (dal basso verso l'alto):
 * 1. MATERIAL_IMPLICATION: (A → B) diventa ¬A ∨ B
 * 2. MODAL_DUALITY: ◇A diventa ¬□¬A
 * 3. DOUBLE_NEGATION: ¬¬A diventa A
 * 4. DE_MORGAN: ¬(A ∧ B) diventa ¬A ∨ ¬B, ¬(A ∨ B) diventa ¬A ∧ ¬B
 * 5. congiunzioni e disgiunzioni appiattite, senza duplicati, ordinate (sempre valide)
 */
public final class EquivalenceNormalizer {

    private static final Logger LOGGER = Logger.getLogger(EquivalenceNormalizer.class.getName());

    private final Framework framework;
    private final OperatorRegistry operators;

    public EquivalenceNormalizer(Framework framework) {
        this(framework, OperatorRegistry.standard());
    }

    public EquivalenceNormalizer(Framework framework, OperatorRegistry operators) {
        this.framework = framework;
        this.operators = operators;
    }

    public boolean equivalent(Proposition a, Proposition b) {
        if (a.equals(b)) {
            return true;
        }
        boolean result = normalize(a).equals(normalize(b));
        LOGGER.finest("Equivalenza " + a + " ~ " + b + " sotto " + framework.id() + ": " + result);
        return result;
    }

    public Proposition normalize(Proposition proposition) {
        if (!(proposition instanceof CompoundProposition)) {
            return proposition;
        }
        CompoundProposition compound = (CompoundProposition) proposition;
        List<Proposition> operands = new ArrayList<>();
        for (Proposition operand : compound.components()) {
            operands.add(normalize(operand));
        }
        String name = compound.operator().name();

        if (OperatorRegistry.IMPLIES.equals(name) && framework.enforces(Law.MATERIAL_IMPLICATION)) {
            return normalize(build(OperatorRegistry.OR, operands.get(0).negate(), operands.get(1)));
        }
        if (OperatorRegistry.POSSIBLY.equals(name) && framework.enforces(Law.MODAL_DUALITY)) {
            Proposition inner = build(OperatorRegistry.NECESSARILY, operands.get(0).negate());
            return normalize(inner.negate());
        }
        if (OperatorRegistry.NOT.equals(name)) {
            return normalizeNegation(operands.get(0));
        }
        if (Propositions.hasOperator(compound, OperatorRegistry.AND, OperatorRegistry.ANDN)) {
            return flatten(OperatorRegistry.ANDN, operands);
        }
        if (Propositions.hasOperator(compound, OperatorRegistry.OR, OperatorRegistry.ORN)) {
            return flatten(OperatorRegistry.ORN, operands);
        }
        return CompoundProposition.of(compound.operator(), operands);
    }

    /**
     * Spinge la negazione verso l'interno quando le leggi lo consentono.
     */
    private Proposition normalizeNegation(Proposition operand) {
        if (operand.isNegation() && framework.enforces(Law.DOUBLE_NEGATION)) {
            return operand.negatedOperand();
        }
        if (framework.enforces(Law.DE_MORGAN) && operand instanceof CompoundProposition) {
            CompoundProposition inner = (CompoundProposition) operand;
            if (Propositions.hasOperator(inner, OperatorRegistry.ANDN, OperatorRegistry.AND)) {
                return flatten(OperatorRegistry.ORN, negateAll(inner.components()));
            }
            if (Propositions.hasOperator(inner, OperatorRegistry.ORN, OperatorRegistry.OR)) {
                return flatten(OperatorRegistry.ANDN, negateAll(inner.components()));
            }
        }
        return operand.negate();
    }

    private List<Proposition> negateAll(List<Proposition> operands) {
        List<Proposition> negated = new ArrayList<>();
        for (Proposition operand : operands) {
            negated.add(normalizeNegation(operand));
        }
        return negated;
    }

    /**
     * Appiattisce, elimina duplicati e ordina per forma canonica.
     */
    private Proposition flatten(String naryName, List<Proposition> operands) {
        String binaryName = OperatorRegistry.ANDN.equals(naryName) ? OperatorRegistry.AND : OperatorRegistry.OR;
        Set<Proposition> collected = new LinkedHashSet<>();
        for (Proposition operand : operands) {
            if (Propositions.hasOperator(operand, naryName, binaryName)) {
                collected.addAll(((CompoundProposition) operand).components());
            } else {
                collected.add(operand);
            }
        }
        if (collected.size() == 1) {
            return collected.iterator().next();
        }
        List<Proposition> sorted = new ArrayList<>(collected);
        sorted.sort(Comparator.comparing(Proposition::toCanonicalString));
        return CompoundProposition.of(operators.require(naryName), sorted);
    }

    private Proposition build(String name, Proposition... operands) {
        Operator operator = operators.require(name);
        return CompoundProposition.of(operator, operands);
    }
}

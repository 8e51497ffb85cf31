package org.formalities.framework;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EquivalenceNormalizerTest {

    private final OperatorRegistry operators = OperatorRegistry.standard();
    private final AtomicProposition p = AtomicProposition.named("p");
    private final AtomicProposition q = AtomicProposition.named("q");

    private Proposition op(String name, Proposition... operands) {
        return CompoundProposition.of(operators.require(name), operands);
    }

    @Test
    public void doubleNegationDependsOnFramework() {
        Proposition doubled = p.negate().negate();
        assertTrue(new EquivalenceNormalizer(StandardFrameworks.classical()).equivalent(doubled, p));
        assertFalse(new EquivalenceNormalizer(StandardFrameworks.intuitionistic()).equivalent(doubled, p));
    }

    @Test
    public void conjunctionIsCommutative() {
        EquivalenceNormalizer normalizer = new EquivalenceNormalizer(StandardFrameworks.intuitionistic());
        assertTrue(normalizer.equivalent(op(OperatorRegistry.AND, p, q), op(OperatorRegistry.AND, q, p)));
        assertTrue(normalizer.equivalent(op(OperatorRegistry.AND, p, p), p));
    }

    @Test
    public void deMorganUnderClassicalLogic() {
        EquivalenceNormalizer normalizer = new EquivalenceNormalizer(StandardFrameworks.classical());
        Proposition negatedConjunction = op(OperatorRegistry.AND, p, q).negate();
        Proposition disjunctionOfNegations = op(OperatorRegistry.OR, p.negate(), q.negate());
        assertTrue(normalizer.equivalent(negatedConjunction, disjunctionOfNegations));
    }

    @Test
    public void materialImplication() {
        Proposition implication = op(OperatorRegistry.IMPLIES, p, q);
        Proposition disjunction = op(OperatorRegistry.OR, p.negate(), q);
        assertTrue(new EquivalenceNormalizer(StandardFrameworks.classical()).equivalent(implication, disjunction));
        assertFalse(new EquivalenceNormalizer(StandardFrameworks.paraconsistent())
                .equivalent(implication, disjunction));
    }

    @Test
    public void modalDuality() {
        Proposition possibly = op(OperatorRegistry.POSSIBLY, p);
        Proposition dual = op(OperatorRegistry.NECESSARILY, p.negate()).negate();
        assertTrue(new EquivalenceNormalizer(StandardFrameworks.modal()).equivalent(possibly, dual));
    }

    @Test
    public void normalFormIsStable() {
        EquivalenceNormalizer normalizer = new EquivalenceNormalizer(StandardFrameworks.classical());
        Proposition formula = op(OperatorRegistry.IMPLIES, op(OperatorRegistry.OR, q, p), p.negate().negate());
        Proposition once = normalizer.normalize(formula);
        assertEquals(once, normalizer.normalize(once));
    }
}

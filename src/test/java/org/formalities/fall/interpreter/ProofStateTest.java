package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.Proposition;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProofStateTest {

    private final Proposition p = AtomicProposition.named("p");
    private final Proposition q = AtomicProposition.named("q");

    @Test
    public void givenIsPromotedByAssertion() {
        ProofState state = new ProofState();
        assertTrue(state.establish(p, Justification.given()));
        assertTrue(state.asserted().isEmpty());

        assertTrue(state.establish(p, Justification.asserted(1, List.of(p))));
        assertEquals(Justification.Kind.ASSERTED, state.justificationOf(p).kind());
        assertEquals(Set.of(p), state.asserted());
        assertEquals(1, state.lastStep());
        assertEquals(1, state.size());
    }

    @Test
    public void firstAssertionIsKept() {
        ProofState state = new ProofState();
        state.establish(p, Justification.fact());

        assertFalse(state.establish(p, Justification.inferred(2, "ModusPonens", List.of())));
        assertEquals(Justification.Kind.FACT, state.justificationOf(p).kind());
        assertEquals(0, state.lastStep());
    }

    @Test(expected = IllegalStateException.class)
    public void citedPremiseMustBePresent() {
        new ProofState().establish(q, Justification.inferred(1, "Syllogism", List.of(p)));
    }

    @Test
    public void derivationListsEveryProposition() {
        ProofState state = new ProofState();
        state.establish(p, Justification.given());
        state.establish(q, Justification.inferred(1, "Syllogism", List.of(p)));

        assertEquals(List.of("p : premessa", "q : dedotta al passo 1 via Syllogism da [p]"), state.derivation());
        assertEquals("passo 1, stabilite 2: p : premessa; q : dedotta al passo 1 via Syllogism da [p]",
                state.snapshot());
    }
}

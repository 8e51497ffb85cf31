package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.Operator;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PatternMatcherTest {

    private static final OperatorRegistry OPERATORS = OperatorRegistry.standard();
    private static final Operator IMPLIES = OPERATORS.require(OperatorRegistry.IMPLIES);
    private static final Operator AND = OPERATORS.require(OperatorRegistry.AND);
    private static final Set<String> METAVARIABLES = Set.of("P", "Q");

    private final Proposition p = AtomicProposition.named("p");
    private final Proposition q = AtomicProposition.named("q");
    private final Proposition r = AtomicProposition.named("r");
    private final Proposition schemaP = AtomicProposition.named("P");
    private final Proposition schemaQ = AtomicProposition.named("Q");

    @Test
    public void slotsAreFilledRegardlessOfCitationOrder() {
        Proposition implication = CompoundProposition.of(IMPLIES, p, q);
        PatternMatcher.Match match = PatternMatcher.matchSlots(
                List.of(schemaP, CompoundProposition.of(IMPLIES, schemaP, schemaQ)),
                List.of(implication, p), METAVARIABLES);

        assertTrue(match.succeeded());
        assertEquals(Map.of("P", p, "Q", q), match.bindings());
        assertEquals(List.of(p, implication), match.premises());
    }

    @Test
    public void boundMetavariableMustMatchStructurally() {
        Proposition schema = CompoundProposition.of(IMPLIES, schemaP, schemaQ);
        PatternMatcher.Match match = PatternMatcher.matchSlots(
                List.of(schemaP, schema),
                List.of(p, CompoundProposition.of(IMPLIES, r, q)), METAVARIABLES);

        assertFalse(match.succeeded());
        assertEquals(schema, match.failedSlot());
    }

    @Test
    public void eachCitationFillsOneSlot() {
        PatternMatcher.Match match = PatternMatcher.matchSlots(List.of(schemaP, schemaQ), List.of(p), METAVARIABLES);

        assertFalse(match.succeeded());
        assertEquals(schemaQ, match.failedSlot());
    }

    @Test
    public void concreteAtomsMatchOnlyThemselves() {
        PatternMatcher.Match match = PatternMatcher.matchSlots(List.of(p, q), List.of(q, p), Set.of());
        assertTrue(match.succeeded());
        assertEquals(List.of(p, q), match.premises());

        assertFalse(PatternMatcher.matchSlots(List.of(p), List.of(r), Set.of()).succeeded());
    }

    @Test
    public void instantiateLeavesFreeMetavariables() {
        Proposition pattern = CompoundProposition.of(AND, schemaP, schemaQ);
        Proposition instance = PatternMatcher.instantiate(pattern, Map.of("P", p), METAVARIABLES);

        assertEquals("(p ∧ Q)", instance.toCanonicalString());
    }
}

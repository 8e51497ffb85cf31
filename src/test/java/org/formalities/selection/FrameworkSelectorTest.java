package org.formalities.selection;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.error.InvalidDefinitionException;
import org.formalities.framework.Feature;
import org.formalities.framework.FrameworkRegistry;
import org.formalities.framework.StandardFrameworks;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FrameworkSelectorTest {

    private final FrameworkSelector selector = new FrameworkSelector(StandardFrameworks.registry());

    @Test
    public void modalRequirementSelectsModalFramework() {
        Selection selection = selector.select(FrameworkRequirement.fromTags(List.of("modal accessibility")));

        assertFalse(selection.isNone());
        assertEquals(StandardFrameworks.MODAL, selection.require().id());
        assertEquals(1, selection.score());
    }

    @Test
    public void modalRequirementWithoutModalFrameworkSelectsNothing() {
        FrameworkSelector classicalOnly = new FrameworkSelector(FrameworkRegistry.builder()
                .register(StandardFrameworks.classical())
                .build());

        Selection selection = classicalOnly.select(FrameworkRequirement.fromTags(List.of("modal accessibility")));

        assertTrue(selection.isNone());
        assertEquals(1, selection.ranking().size());
    }

    @Test
    public void frameworkRulingOutARequiredFeatureIsNotEligible() {
        FrameworkSelector classicalOnly = new FrameworkSelector(FrameworkRegistry.builder()
                .register(StandardFrameworks.classical())
                .build());
        FrameworkRequirement requirement = FrameworkRequirement.of(Feature.PROPOSITIONAL, Feature.NUMERIC, Feature.MODAL);

        Selection selection = classicalOnly.select(requirement);

        assertTrue(selection.isNone());
        assertEquals(1, selection.ranking().get(0).score());
        assertEquals(Set.of(Feature.MODAL), selection.ranking().get(0).missing());
        assertEquals(StandardFrameworks.MODAL, selector.select(requirement).require().id());
    }

    @Test
    public void contradictionToleranceSelectsParaconsistent() {
        Selection selection = selector.select(FrameworkRequirement.of(Feature.CONTRADICTION_TOLERANCE));
        assertEquals(StandardFrameworks.PARACONSISTENT, selection.require().id());
    }

    @Test
    public void emptyRequirementFallsBackToFirstById() {
        Selection selection = selector.select(FrameworkRequirement.of());
        assertEquals(StandardFrameworks.CLASSICAL, selection.require().id());
        assertEquals(0, selection.score());
    }

    @Test
    public void conflictingRequirementsSelectNothing() {
        Selection selection = selector.select(FrameworkRequirement.of(Feature.MODAL, Feature.TEMPORAL));

        assertTrue(selection.isNone());
        assertFalse(selection.framework().isPresent());
        assertEquals(StandardFrameworks.registry().size(), selection.ranking().size());
    }

    @Test
    public void rankingIsOrderedByScoreThenId() {
        List<FrameworkSuggestion> ranking = selector.rank(FrameworkRequirement.of(Feature.TEMPORAL));

        assertEquals(StandardFrameworks.TEMPORAL, ranking.get(0).framework().id());
        for (int i = 1; i < ranking.size(); i++) {
            assertTrue(ranking.get(i - 1).score() >= ranking.get(i).score());
        }
        assertEquals(Set.of(Feature.TEMPORAL), ranking.get(1).missing());
    }

    @Test
    public void requirementsInferredFromOperators() {
        OperatorRegistry operators = OperatorRegistry.standard();
        Proposition formula = CompoundProposition.of(operators.require(OperatorRegistry.AND),
                CompoundProposition.of(operators.require(OperatorRegistry.ALWAYS), AtomicProposition.named("p")),
                AtomicProposition.named("q"));

        assertEquals(Set.of(Feature.TEMPORAL), FrameworkRequirement.inferredFrom(formula).features());
        assertTrue(FrameworkRequirement.inferredFrom(AtomicProposition.named("p")).isEmpty());
    }

    @Test
    public void tagAliasesAreNormalized() {
        FrameworkRequirement requirement = FrameworkRequirement.fromTags(
                List.of("needs temporal ordering", "Paraconsistency"));
        assertEquals(Set.of(Feature.TEMPORAL, Feature.CONTRADICTION_TOLERANCE), requirement.features());
    }

    @Test(expected = InvalidDefinitionException.class)
    public void unknownTagIsRejected() {
        FrameworkRequirement.fromTags(List.of("quantum superposition"));
    }
}

package org.formalities.fall.interpreter;

import org.formalities.bridge.NlpBridge;
import org.formalities.core.TagSet;
import org.formalities.error.ErrorKind;
import org.formalities.error.ErrorPolicy;
import org.formalities.framework.StandardFrameworks;
import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FallRuntimeTest {

    private static final String SOCRATES =
            "DEFINE PROPOSITION p AS \"Socrates is a man\" "
                    + "WHERE \"Socrates\" IS SUBJECT AND \"man\" IS PREDICATE //\n"
                    + "DEFINE PROPOSITION q AS \"All men are mortal\" "
                    + "WHERE \"All\" IS QUANTIFIER AND \"men\" IS SUBJECT AND \"mortal\" IS PREDICATE //\n"
                    + "DEFINE PROPOSITION r AS \"Socrates is mortal\" "
                    + "WHERE \"Socrates\" IS SUBJECT AND \"mortal\" IS PREDICATE //\n";

    private static final String SYLLOGISM = "DEFINE AXIOM Syllogism WHERE p IS TRUE AND q IS TRUE INFER r //\n";

    private static RunReport run(String source) {
        return new FallRuntime().execute(source);
    }

    private static RunReport run(String source, String framework) {
        return new FallRuntime(InterpreterOptions.builder().initialFrameworks(framework).build()).execute(source);
    }

    //region BLOCCHI DI PROVA

    @Test
    public void syllogismIsProved() {
        RunReport report = run(SOCRATES + SYLLOGISM
                + "BEGIN PROOF\n"
                + "  GIVEN p\n"
                + "  GIVEN q\n"
                + "  PROVE r\n"
                + "  STEP 1: ASSERT p AND q\n"
                + "  STEP 2: INFER r FROM [p, q] VIA Syllogism\n"
                + "END PROOF //\n"
                + "QUERY r //");

        assertTrue(report.isSuccessful());
        StatementResult proof = report.result(4);
        assertTrue(proof.isSuccess());
        assertTrue(proof.proof().isProved());
        assertEquals(ProofOutcome.GoalMatch.STRUCTURAL, proof.proof().goalMatch());
        assertEquals(2, proof.proof().state().lastStep());
        assertTrue(proof.proof().state().derivation().contains("r : dedotta al passo 2 via Syllogism da [p, q]"));

        assertEquals(TriState.TRUE, report.result(5).answer());

        ExecutionStatistics statistics = report.statistics();
        assertEquals(6, statistics.getStatements());
        assertEquals(4, statistics.getDefinitions());
        assertEquals(1, statistics.getProvedProofs());
        assertEquals(2, statistics.getSteps());
        assertEquals(1.0, statistics.getProofSuccessRate(), 0.0);
    }

    @Test
    public void missingPremiseFailsTheStepAndKeepsPriorState() {
        RunReport report = run(SOCRATES + SYLLOGISM
                + "BEGIN PROOF GIVEN p GIVEN q PROVE r\n"
                + "  STEP 1: ASSERT p AND q\n"
                + "  STEP 2: INFER r FROM [p] VIA Syllogism\n"
                + "END PROOF //\n"
                + "QUERY r //");

        StatementResult proof = report.result(4);
        assertFalse(proof.isSuccess());
        ProofOutcome outcome = proof.proof();
        assertEquals(2, outcome.failedStep());
        assertEquals(ErrorKind.UNJUSTIFIED_INFERENCE, outcome.error().kind());
        assertEquals(ErrorPolicy.CONTINUE, outcome.error().policy());
        assertTrue(outcome.error().detail().endsWith("q"));
        assertTrue(outcome.error().construct().startsWith("STEP 2"));

        assertEquals(1, outcome.state().lastStep());
        assertEquals(3, outcome.state().size());

        assertEquals(TriState.UNKNOWN, report.result(5).answer());
        assertFalse(report.isSuccessful());
        assertEquals(1, report.failures().size());
    }

    @Test
    public void builtInModusPonens() {
        RunReport report = run(SOCRATES
                + "BEGIN PROOF GIVEN p GIVEN p -> r PROVE r USING ModusPonens\n"
                + "  STEP 1: INFER r FROM [p -> r, p] VIA ModusPonens\n"
                + "END PROOF //");

        assertTrue(report.result(3).proof().isProved());
        Justification justification = report.result(3).proof().state().justificationOf(
                report.result(3).proof().goal());
        assertEquals(Justification.Kind.INFERRED, justification.kind());
        assertEquals("ModusPonens", justification.axiom());
    }

    @Test
    public void usingClauseRestrictsAxioms() {
        RunReport report = run(SOCRATES
                + "BEGIN PROOF GIVEN p GIVEN p -> r PROVE r USING ModusTollens\n"
                + "  STEP 1: INFER r FROM [p, p -> r] VIA ModusPonens\n"
                + "END PROOF //");

        ProofOutcome outcome = report.result(3).proof();
        assertFalse(outcome.isProved());
        assertEquals(1, outcome.failedStep());
        assertEquals(ErrorKind.UNJUSTIFIED_INFERENCE, outcome.error().kind());
    }

    @Test
    public void conclusionMustFollowTheAxiom() {
        RunReport report = run(SOCRATES
                + "BEGIN PROOF GIVEN p GIVEN p -> r PROVE q\n"
                + "  STEP 1: INFER q FROM [p, p -> r] VIA ModusPonens\n"
                + "END PROOF //");

        ProofOutcome outcome = report.result(3).proof();
        assertFalse(outcome.isProved());
        assertTrue(outcome.error().detail().endsWith("r"));
    }

    @Test
    public void assertingAnUnestablishedPropositionFails() {
        RunReport report = run(SOCRATES + "BEGIN PROOF GIVEN p PROVE q STEP 1: ASSERT q END PROOF //");

        ProofOutcome outcome = report.result(3).proof();
        assertEquals(1, outcome.failedStep());
        assertEquals(ErrorKind.UNJUSTIFIED_INFERENCE, outcome.error().kind());
        assertEquals(0, outcome.state().lastStep());
    }

    @Test
    public void unreachedGoalFailsTheBlock() {
        RunReport report = run(SOCRATES + "BEGIN PROOF GIVEN p PROVE r STEP 1: ASSERT p END PROOF //");

        ProofOutcome outcome = report.result(3).proof();
        assertFalse(outcome.isProved());
        assertEquals(0, outcome.failedStep());
        assertTrue(outcome.error().detail().endsWith("r"));
    }

    @Test
    public void topLevelFactsSeedTheProof() {
        RunReport report = run(SOCRATES + "ASSERT p //\nBEGIN PROOF PROVE p END PROOF //");
        assertTrue(report.result(4).proof().isProved());
        assertEquals(Justification.Kind.FACT,
                report.result(4).proof().state().justificationOf(report.result(4).proof().goal()).kind());
    }

    @Test
    public void goalMatchedUpToEquivalence() {
        String program = SOCRATES + "BEGIN PROOF GIVEN NOT NOT p PROVE p END PROOF //";

        ProofOutcome classical = run(program).result(3).proof();
        assertTrue(classical.isProved());
        assertEquals(ProofOutcome.GoalMatch.EQUIVALENT, classical.goalMatch());

        ProofOutcome intuitionistic = run(program, StandardFrameworks.INTUITIONISTIC).result(3).proof();
        assertFalse(intuitionistic.isProved());

        RunReport structuralOnly = new FallRuntime(InterpreterOptions.builder()
                .equivalenceMatching(false).build()).execute(program);
        assertFalse(structuralOnly.result(3).proof().isProved());
    }

    @Test
    public void axiomRequiringAnAbsentLawIsRejected() {
        String program = SOCRATES
                + "BEGIN PROOF GIVEN NOT NOT p PROVE p\n"
                + "  STEP 1: INFER p FROM [NOT NOT p] VIA DoubleNegationElimination\n"
                + "END PROOF //";

        assertTrue(run(program).result(3).proof().isProved());

        ProofOutcome outcome = run(program, StandardFrameworks.INTUITIONISTIC).result(3).proof();
        assertFalse(outcome.isProved());
        assertEquals(ErrorKind.FRAMEWORK_INCOMPATIBLE, outcome.error().kind());
    }

    //endregion

    //region CONTRADDIZIONI

    @Test
    public void contradictoryAssertionRejectedUnderClassicalLogic() {
        RunReport report = run(SOCRATES + "ASSERT p //\nASSERT NOT p //");

        assertTrue(report.result(3).isSuccess());
        StatementResult second = report.result(4);
        assertFalse(second.isSuccess());
        assertEquals(ErrorKind.FRAMEWORK_INCOMPATIBLE, second.error().kind());
    }

    @Test
    public void contradictoryAssertionFlaggedUnderParaconsistentLogic() {
        RunReport report = run(SOCRATES + "ASSERT p //\nASSERT NOT p //", StandardFrameworks.PARACONSISTENT);

        StatementResult second = report.result(4);
        assertTrue(second.isSuccess());
        assertTrue(second.isFlagged());
        assertTrue(report.isSuccessful());
    }

    @Test
    public void contradictionInsideProofDependsOnFramework() {
        String program = SOCRATES
                + "BEGIN PROOF GIVEN p GIVEN NOT p PROVE NOT p\n"
                + "  STEP 1: ASSERT p\n"
                + "  STEP 2: ASSERT NOT p\n"
                + "END PROOF //";

        ProofOutcome classical = run(program).result(3).proof();
        assertFalse(classical.isProved());
        assertEquals(2, classical.failedStep());
        assertEquals(ErrorKind.FRAMEWORK_INCOMPATIBLE, classical.error().kind());

        ProofOutcome paraconsistent = run(program, StandardFrameworks.PARACONSISTENT).result(3).proof();
        assertTrue(paraconsistent.isProved());
        assertTrue(paraconsistent.isFlagged());
    }

    //endregion

    //region QUERY

    @Test
    public void queriesAnswerWithThreeValues() {
        RunReport report = run(SOCRATES
                + "ASSERT p //\n"
                + "ASSERT NOT q //\n"
                + "QUERY p //\n"
                + "QUERY q //\n"
                + "QUERY p AND q //\n"
                + "QUERY p OR q //\n"
                + "QUERY r //\n"
                + "QUERY p AND r //\n"
                + "QUERY q -> r //");

        assertEquals(List.of(TriState.TRUE, TriState.FALSE, TriState.FALSE, TriState.TRUE,
                TriState.UNKNOWN, TriState.UNKNOWN, TriState.TRUE), report.answers());
    }

    @Test
    public void numericPropositionsInComparisons() {
        RunReport report = run("DEFINE PROPOSITION x AS 2 + 3 //\n"
                + "DEFINE PROPOSITION y AS x * 2 //\n"
                + "DEFINE PROPOSITION z AS 1 / 0 //\n"
                + "QUERY y > 9 //\n"
                + "QUERY x = 4 //\n"
                + "QUERY z > 0 //");

        assertEquals(List.of(TriState.TRUE, TriState.FALSE, TriState.UNKNOWN), report.answers());
    }

    @Test
    public void numericNameInBooleanPositionIsUnknownReference() {
        RunReport report = run("DEFINE PROPOSITION x AS 2 //\nASSERT x //");
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, report.result(1).error().kind());
    }

    @Test
    public void nameInSeveralNamespacesIsAmbiguous() {
        RunReport report = run("DEFINE RULE p WHERE SUBJECT IS noun //\n"
                + "DEFINE PROPOSITION p AS \"Socrates runs\" WHERE \"Socrates\" IS SUBJECT AS noun //\n"
                + "QUERY p //");

        assertTrue(report.result(1).isSuccess());
        StatementResult query = report.result(2);
        assertFalse(query.isSuccess());
        assertEquals(ErrorKind.AMBIGUOUS_QUERY, query.error().kind());
    }

    @Test
    public void undefinedNameIsUnknownReference() {
        RunReport report = run("QUERY nessuno //\nASSERT nessuno //");
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, report.result(0).error().kind());
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, report.result(1).error().kind());
        assertEquals(2, report.statistics().getFailures());
    }

    //endregion

    //region DEFINIZIONI

    @Test
    public void redefinitionIsRejected() {
        RunReport report = run(SOCRATES
                + "DEFINE PROPOSITION p AS \"Plato is a man\" WHERE \"Plato\" IS SUBJECT //");

        StatementResult redefinition = report.result(3);
        assertEquals(ErrorKind.INVALID_DEFINITION, redefinition.error().kind());
        assertTrue(redefinition.error().message().contains("già definito"));
    }

    @Test
    public void axiomConclusionMustBeBoundByPremises() {
        RunReport report = run(SOCRATES
                + "DEFINE AXIOM Anything WHERE X IS TRUE INFER Y //\n"
                + "BEGIN PROOF GIVEN p PROVE r\n"
                + "  STEP 1: INFER r FROM [p] VIA Anything\n"
                + "END PROOF //");

        StatementResult definition = report.result(3);
        assertEquals(ErrorKind.INVALID_DEFINITION, definition.error().kind());
        assertTrue(definition.error().message().contains("[Y]"));
        ProofOutcome outcome = report.result(4).proof();
        assertFalse(outcome.isProved());
        assertEquals(1, outcome.failedStep());
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, outcome.error().kind());
    }

    @Test
    public void axiomNamingUndefinedPropositionIsRejected() {
        RunReport report = run(SYLLOGISM + SOCRATES
                + "BEGIN PROOF GIVEN p GIVEN q PROVE NOT r\n"
                + "  STEP 1: INFER NOT r FROM [p, q] VIA Syllogism\n"
                + "END PROOF //");

        StatementResult definition = report.result(0);
        assertEquals(ErrorKind.INVALID_DEFINITION, definition.error().kind());
        assertTrue(definition.error().message().contains("'p' non definita"));
        assertFalse(report.result(4).proof().isProved());
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, report.result(4).proof().error().kind());
    }

    @Test
    public void userAxiomWithBoundMetavariables() {
        RunReport report = run(SOCRATES
                + "DEFINE AXIOM Detach WHERE A, A -> B INFER B //\n"
                + "BEGIN PROOF GIVEN p GIVEN p -> r PROVE r\n"
                + "  STEP 1: INFER r FROM [p, p -> r] VIA Detach\n"
                + "END PROOF //");

        assertTrue(report.result(3).isSuccess());
        assertTrue(report.result(4).proof().isProved());
    }

    @Test
    public void ruleConstraintsAreEnforced() {
        RunReport report = run("DEFINE RULE Grammar WHERE SUBJECT CAN BE noun | pronoun //\n"
                + "DEFINE PROPOSITION ok AS \"He runs\" WHERE \"He\" IS SUBJECT AS pronoun //\n"
                + "DEFINE PROPOSITION ko AS \"Running is fun\" WHERE \"Running\" IS SUBJECT AS verb //");

        assertTrue(report.result(1).isSuccess());
        assertEquals(ErrorKind.INVALID_DEFINITION, report.result(2).error().kind());
    }

    @Test
    public void untaggedSentenceNeedsTheBridge() {
        RunReport report = run("DEFINE PROPOSITION s AS \"Socrates runs\" //");
        assertEquals(ErrorKind.INVALID_DEFINITION, report.result(0).error().kind());
    }

    @Test
    public void unknownRequirementTagIsInvalid() {
        RunReport report = run("DEFINE PROPOSITION s AS \"x\" WHERE \"quantum superposition\" IS REQUIREMENT //");
        assertEquals(ErrorKind.INVALID_DEFINITION, report.result(0).error().kind());
    }

    //endregion

    //region BRIDGE E SIMBOLIZZAZIONE

    @Test
    public void symbolizeUsesQuantifiedPredicateForm() {
        RunReport report = run(SOCRATES + "SYMBOLIZE q //\nSYMBOLIZE p AND NOT r //");

        assertEquals("∀x(Men(x) → Mortal(x))", report.result(3).rendering());
        assertEquals("(Man(Socrates) ∧ ¬Mortal(Socrates))", report.result(4).rendering());
    }

    @Test
    public void bridgeSuppliesTags() {
        NlpBridge bridge = sentence -> TagSet.builder()
                .tag(TagSet.SUBJECT, "Socrates", "noun")
                .tag(TagSet.PREDICATE, "runs", "verb")
                .build();
        RunReport report = new FallRuntime(InterpreterOptions.builder().nlpBridge(bridge).build())
                .execute("BRIDGE NLP ON //\n"
                        + "DEFINE PROPOSITION s AS \"Socrates runs\" //\n"
                        + "SYMBOLIZE s //");

        assertTrue(report.isSuccessful());
        assertEquals("Runs(Socrates)", report.result(2).rendering());
    }

    @Test
    public void slowBridgeTimesOutOnlyItsStatement() {
        NlpBridge slow = sentence -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TagSet.empty();
        };
        RunReport report = new FallRuntime(InterpreterOptions.builder()
                .nlpBridge(slow)
                .collaboratorTimeout(Duration.ofMillis(100))
                .build())
                .execute("BRIDGE NLP ON //\n"
                        + "DEFINE PROPOSITION s AS \"Socrates runs\" //\n"
                        + "BRIDGE NLP OFF //\n"
                        + "DEFINE PROPOSITION t AS \"Plato walks\" WHERE \"Plato\" IS SUBJECT //");

        assertEquals(ErrorKind.TIMEOUT, report.result(1).error().kind());
        assertTrue(report.result(2).isSuccess());
        assertTrue(report.result(3).isSuccess());
        assertEquals(1, report.statistics().getTimeouts());
    }

    @Test
    public void bridgePragmaWithoutBridgeFails() {
        RunReport report = run("BRIDGE NLP ON //");
        assertEquals(ErrorKind.UNKNOWN_REFERENCE, report.result(0).error().kind());
    }

    //endregion

    //region ERRORI FATALI

    @Test
    public void lexicalErrorHaltsBeforeAnyStatement() {
        RunReport report = run("ASSERT p //\nQUERY p # //");

        assertTrue(report.isHalted());
        assertTrue(report.results().isEmpty());
        assertEquals(ErrorKind.LEXICAL, report.haltReport().kind());
        assertEquals(ErrorPolicy.HALT, report.haltReport().policy());
        assertNull(report.lastProof());
        assertEquals(0, report.statistics().getStatements());
    }

    @Test
    public void syntaxErrorHaltsBeforeAnyStatement() {
        RunReport report = run(SOCRATES + "QUERY //");

        assertTrue(report.isHalted());
        assertEquals(ErrorKind.SYNTAX, report.haltReport().kind());
        assertFalse(report.isSuccessful());
    }

    @Test
    public void oversizedStepNumberHaltsWithSyntaxError() {
        RunReport report = run(SOCRATES + "BEGIN PROOF GIVEN p PROVE p STEP 99999999999: ASSERT p END PROOF //");

        assertTrue(report.isHalted());
        assertEquals(ErrorKind.SYNTAX, report.haltReport().kind());
        assertTrue(report.results().isEmpty());
    }

    //endregion
}

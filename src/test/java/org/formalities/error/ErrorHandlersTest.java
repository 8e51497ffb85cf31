package org.formalities.error;

import org.formalities.fall.lexer.SourcePosition;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ErrorHandlersTest {

    private final ErrorHandlers handlers = ErrorHandlers.standard();

    @Test
    public void onlyLexicalAndSyntaxErrorsHalt() {
        for (ErrorKind kind : ErrorKind.values()) {
            ErrorPolicy expected = kind == ErrorKind.LEXICAL || kind == ErrorKind.SYNTAX
                    ? ErrorPolicy.HALT : ErrorPolicy.CONTINUE;
            assertEquals(kind.name(), expected, handlers.policyOf(kind));
        }
    }

    @Test
    public void syntaxReportNamesTokenAndConstruct() {
        SyntaxException error = new SyntaxException("Errore di sintassi", "//", "{IDENTIFIER}",
                "expression", new SourcePosition(3, 7));
        ErrorReport report = handlers.dispatch(error, "programma", "nessuna istruzione eseguita");

        assertEquals(ErrorKind.SYNTAX, report.kind());
        assertEquals(ErrorPolicy.HALT, report.policy());
        assertTrue(report.isHalting());
        assertTrue(report.detail().contains("'//'"));
        assertTrue(report.detail().contains("expression"));
    }

    @Test
    public void unjustifiedInferenceReportsMissingPremise() {
        ErrorReport report = handlers.dispatch(new UnjustifiedInferenceException("Premessa mancante", "q"),
                "STEP 2: INFER r", "p [GIVEN]");

        assertEquals(ErrorPolicy.CONTINUE, report.policy());
        assertEquals("STEP 2: INFER r", report.construct());
        assertEquals("p [GIVEN]", report.priorState());
        assertTrue(report.detail().endsWith("q"));
        assertTrue(report.describe().contains("ultimo stato valido: p [GIVEN]"));
    }

    @Test
    public void everyKindHasAHandler() {
        List<FallException> samples = List.of(
                new LexicalException("x", "#", new SourcePosition(1, 1)),
                new SyntaxException("x", "y", null, null, new SourcePosition(1, 1)),
                new UnknownReferenceException("z", "x"),
                new ArityMismatchException("NOT", "1", 2),
                new UnjustifiedInferenceException("x", "p"),
                new FrameworkIncompatibleException("x", List.of("d")),
                new CollaboratorTimeoutException("bridge", 100),
                new AmbiguousQueryException("p", List.of("RULE", "PROPOSITION")),
                new InvalidDefinitionException("x"));

        assertEquals(ErrorKind.values().length, samples.size());
        for (FallException sample : samples) {
            assertEquals(sample.kind(), handlers.dispatch(sample, "c", "s").kind());
        }
    }

    @Test
    public void timeoutReportNamesCollaborator() {
        ErrorReport report = handlers.dispatch(new CollaboratorTimeoutException("nlp-bridge", 250), "c", "s");
        assertEquals(ErrorKind.TIMEOUT, report.kind());
        assertTrue(report.detail().contains("nlp-bridge"));
    }
}

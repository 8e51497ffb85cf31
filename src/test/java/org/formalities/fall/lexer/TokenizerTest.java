package org.formalities.fall.lexer;

import org.formalities.error.ErrorKind;
import org.formalities.error.LexicalException;
import org.junit.Test;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TokenizerTest {

    private static List<String> kinds(String source) {
        return Tokenizer.tokenize(source).toList().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    public void keywordsIdentifiersAndTerminator() {
        assertEquals(List.of("ASSERT", "IDENTIFIER", "AND", "IDENTIFIER", "TERMINATOR", "EOF"),
                kinds("ASSERT p AND q //"));
    }

    @Test
    public void commentsAndWhitespaceAreSkipped() {
        List<String> kinds = kinds("!- commento iniziale\nQUERY   socrate\t//  !- coda\n");
        assertEquals(List.of("QUERY", "IDENTIFIER", "TERMINATOR", "EOF"), kinds);
    }

    @Test
    public void symbolicConnectivesAndNumbers() {
        assertEquals(List.of("NEG", "IDENTIFIER", "ARROW_SYM", "IDENTIFIER", "ARROW", "NUMBER", "GE", "NUMBER", "EOF"),
                kinds("¬p → q -> 3.5 >= 2"));
    }

    @Test
    public void stringLiteralKeepsQuotes() {
        List<Token> tokens = Tokenizer.tokenize("\"Socrate è un uomo\"").toList();
        assertEquals("STRING", tokens.get(0).kind());
        assertEquals("\"Socrate è un uomo\"", tokens.get(0).lexeme());
    }

    @Test
    public void positionsAreLineAndColumn() {
        List<Token> tokens = Tokenizer.tokenize("ASSERT p //\n  QUERY q //").toList();
        assertEquals(new SourcePosition(1, 0), tokens.get(0).position());
        assertEquals(new SourcePosition(2, 2), tokens.get(3).position());
        assertEquals("QUERY", tokens.get(3).kind());
    }

    @Test
    public void unknownCharacterRaisesLexicalError() {
        try {
            Tokenizer.tokenize("ASSERT p # q //").toList();
            fail("carattere non riconosciuto accettato");
        } catch (LexicalException e) {
            assertEquals(ErrorKind.LEXICAL, e.kind());
            assertEquals(1, e.position().line());
            assertEquals(9, e.position().column());
            assertEquals("#", e.offendingText());
        }
    }

    @Test
    public void tokensBeforeTheErrorAreProducedLazily() {
        Iterator<Token> iterator = Tokenizer.tokenize("ASSERT p # q //").iterator();
        assertEquals("ASSERT", iterator.next().kind());
        assertEquals("IDENTIFIER", iterator.next().kind());
        try {
            iterator.next();
            fail("errore lessicale atteso");
        } catch (LexicalException expected) {
            assertTrue(expected.getMessage().startsWith("Sequenza non riconosciuta"));
        }
    }

    @Test
    public void sequenceRestartsFromTheBeginning() {
        TokenSequence sequence = Tokenizer.tokenize("QUERY p //");
        List<Token> first = sequence.toList();
        List<Token> second = sequence.toList();

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).kind(), second.get(i).kind());
            assertEquals(first.get(i).lexeme(), second.get(i).lexeme());
        }
    }

    @Test
    public void iterationEndsAfterEof() {
        Iterator<Token> iterator = Tokenizer.tokenize("").iterator();
        assertTrue(iterator.hasNext());
        assertTrue(iterator.next().isEof());
        assertFalse(iterator.hasNext());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullSourceIsRejected() {
        Tokenizer.tokenize(null);
    }
}

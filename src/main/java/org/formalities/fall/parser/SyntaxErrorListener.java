package org.formalities.fall.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.formalities.error.SyntaxException;
import org.formalities.fall.lexer.SourcePosition;

import java.util.List;

/**
 * Converte il primo errore del parser ANTLR in {@link SyntaxException}:
 * nessun tentativo di recupero, nessun AST parziale.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        String offending = "?";
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            offending = token.getType() == Token.EOF ? "<EOF>" : token.getText();
        }

        String expected = null;
        String construct = null;
        if (recognizer instanceof Parser) {
            Parser parser = (Parser) recognizer;
            expected = (e != null ? e.getExpectedTokens() : parser.getExpectedTokens())
                    .toString(parser.getVocabulary());
            List<String> stack = parser.getRuleInvocationStack();
            construct = stack.isEmpty() ? null : stack.get(0);
        }

        throw new SyntaxException("Errore di sintassi: " + msg, offending, expected, construct,
                new SourcePosition(line, charPositionInLine));
    }
}

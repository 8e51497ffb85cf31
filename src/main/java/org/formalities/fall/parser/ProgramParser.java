package org.formalities.fall.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.ast.Program;
import org.formalities.fall.grammar.FallParser;
import org.formalities.fall.lexer.Token;
import org.formalities.fall.lexer.TokenSequence;
import org.formalities.fall.lexer.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FALL - Dalla sequenza di token all'AST del programma
 *
 * PIPELINE:
 * 1. consumo completo della {@link TokenSequence} (eventuale errore lessicale)
 * 2. ListTokenSource -> CommonTokenStream -> FallParser
 * 3. visitor {@link StatementBuilder} / {@link ExpressionBuilder}
 *
 * Il primo errore grammaticale diventa SyntaxException; la sequenza di token
 * non è più referenziata dopo il parsing.
 */
public final class ProgramParser {

    private static final Logger LOGGER = Logger.getLogger(ProgramParser.class.getName());

    public Program parse(TokenSequence tokens) {
        FallParser parser = newParser(tokens);
        FallParser.ProgramContext tree = parser.program();
        Program program = new StatementBuilder(new ExpressionBuilder()).buildProgram(tree);
        LOGGER.fine("Parsing completato: " + program.size() + " istruzioni");
        return program;
    }

    public Program parse(String source) {
        return parse(Tokenizer.tokenize(source));
    }

    /**
     * Analizza un'espressione isolata, usata per il round trip della forma canonica.
     */
    public Expression parseExpression(TokenSequence tokens) {
        FallParser parser = newParser(tokens);
        return new ExpressionBuilder().visitStandaloneExpression(parser.standaloneExpression());
    }

    public Expression parseExpression(String source) {
        return parseExpression(Tokenizer.tokenize(source));
    }

    private static FallParser newParser(TokenSequence tokens) {
        List<org.antlr.v4.runtime.Token> antlrTokens = new ArrayList<>();
        for (Token token : tokens) {
            antlrTokens.add(token.antlrToken());
        }
        FallParser parser = new FallParser(new CommonTokenStream(new ListTokenSource(antlrTokens)));
        parser.removeErrorListeners();
        parser.addErrorListener(new SyntaxErrorListener());
        return parser;
    }
}

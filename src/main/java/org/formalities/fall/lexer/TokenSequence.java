package org.formalities.fall.lexer;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;
import org.formalities.error.LexicalException;
import org.formalities.fall.grammar.FallLexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * SEQUENZA DI TOKEN - Pigra, finita, riavviabile solo dall'inizio
 *
 * Ogni chiamata a {@link #iterator()} crea un nuovo lexer sul sorgente e produce
 * i token su richiesta fino a EOF compreso. Non esiste posizionamento a metà flusso.
 * Un carattere non riconosciuto solleva {@link LexicalException} durante l'iterazione.
 */
public final class TokenSequence implements Iterable<Token> {

    private final String source;

    TokenSequence(String source) {
        this.source = source;
    }

    public String source() {
        return source;
    }

    @Override
    public Iterator<Token> iterator() {
        FallLexer lexer = new FallLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(LexicalErrorListener.INSTANCE);
        return new LexerIterator(lexer);
    }

    /**
     * Materializza l'intera sequenza; solleva al primo errore lessicale.
     */
    public List<Token> toList() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    private static final class LexerIterator implements Iterator<Token> {

        private final FallLexer lexer;
        private boolean finished = false;

        LexerIterator(FallLexer lexer) {
            this.lexer = lexer;
        }

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException("Sequenza di token esaurita");
            }
            Token token = new Token(lexer.nextToken());
            if (token.isEof()) {
                finished = true;
            }
            return token;
        }
    }

    /**
     * Trasforma ogni errore del lexer ANTLR in errore lessicale fatale.
     */
    private static final class LexicalErrorListener extends BaseErrorListener {

        static final LexicalErrorListener INSTANCE = new LexicalErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            String offending = "";
            if (recognizer instanceof FallLexer) {
                FallLexer lexer = (FallLexer) recognizer;
                int start = lexer._tokenStartCharIndex;
                int stop = Math.min(lexer.getInputStream().index(), lexer.getInputStream().size() - 1);
                if (start >= 0 && stop >= start) {
                    offending = lexer.getInputStream().getText(
                            Interval.of(start, stop));
                }
            }
            throw new LexicalException("Sequenza non riconosciuta: " + msg, offending,
                    new SourcePosition(line, charPositionInLine));
        }
    }
}

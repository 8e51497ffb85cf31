package org.formalities.fall.lexer;

import java.util.logging.Logger;

/**
 * Punto d'ingresso del lexer FALL.
 */
public final class Tokenizer {

    private static final Logger LOGGER = Logger.getLogger(Tokenizer.class.getName());

    private Tokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Restituisce la sequenza pigra di token: il sorgente viene analizzato
     * solo durante l'iterazione.
     */
    public static TokenSequence tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Sorgente FALL non può essere null");
        }
        LOGGER.finest("Tokenizzazione richiesta per " + source.length() + " caratteri");
        return new TokenSequence(source);
    }
}

package org.formalities.bridge;

import org.formalities.core.TagSet;

/**
 * CONFINE NLP - Collaboratore esterno per l'etichettatura strutturale
 *
 * Riceve la frase grezza tra virgolette e restituisce soggetto, predicato,
 * copula e quantificatore. L'implementazione vive fuori da questo progetto:
 * qui si consuma soltanto il risultato.
 */
public interface NlpBridge {

    default String name() {
        return "nlp-bridge";
    }

    /**
     * @param sentence frase in linguaggio naturale, senza virgolette
     * @return struttura grammaticale estratta (mai null)
     */
    TagSet extract(String sentence);
}

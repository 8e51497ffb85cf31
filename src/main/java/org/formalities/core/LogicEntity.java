package org.formalities.core;

/**
 * ENTITÀ LOGICA - Capacità comune a ogni valore che partecipa alla logica
 *
 * CONTRATTO:
 * - forma canonica testuale stabile
 * - uguaglianza strutturale (mai referenziale) coerente con hashCode
 * - etichetta di tipo logico
 */
public interface LogicEntity {

    /**
     * @return forma canonica in notazione simbolica
     */
    String toCanonicalString();

    LogicType logicType();
}

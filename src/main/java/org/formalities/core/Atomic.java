package org.formalities.core;

/**
 * Entità indivisibile: simbolo, letterale o costante con nome.
 */
public interface Atomic extends LogicEntity {

    String symbol();
}

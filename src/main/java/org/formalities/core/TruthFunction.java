package org.formalities.core;

import java.util.List;

/**
 * Funzione di verità di un connettivo booleano sui valori già valutati degli operandi.
 */
@FunctionalInterface
public interface TruthFunction {

    boolean apply(List<Boolean> operands);
}

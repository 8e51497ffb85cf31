package org.formalities.framework;

import org.formalities.core.Proposition;

import java.util.List;

/**
 * STRATEGIA DI VALIDAZIONE - Controllo componibile della pipeline
 *
 * Una strategia lascia passare la proposizione (lista vuota) oppure restituisce
 * le proprie diagnostiche. Non interrompe mai la pipeline: se solleva un'eccezione
 * il motore la converte in diagnostica.
 */
public interface ValidationStrategy {

    String name();

    ValidationStage stage();

    List<Diagnostic> check(Proposition candidate, ValidationContext context);
}

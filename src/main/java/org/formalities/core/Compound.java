package org.formalities.core;

import java.util.List;

/**
 * Entità composta: operatore applicato a una sequenza ordinata di componenti.
 * Uguaglianza e hash dipendono da identità dell'operatore e sequenza dei componenti.
 */
public interface Compound extends LogicEntity {

    Operator operator();

    List<? extends LogicEntity> components();
}

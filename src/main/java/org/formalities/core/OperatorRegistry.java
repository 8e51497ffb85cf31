package org.formalities.core;

import org.formalities.error.UnknownReferenceException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * REGISTRO OPERATORI - Tabella esplicita popolata una volta all'avvio
 *
 * Costruito tramite {@link Builder}; dopo build() è in sola lettura.
 * La registrazione duplicata di un nome è rifiutata in costruzione.
 *
 * INSIEME STANDARD:
 * - booleani: NOT, AND, OR, IMPLIES, XOR, NAND, NOR, IFF
 * - n-ari: ANDN, ORN, NANDN, NORN
 * - modali: NECESSARILY (□), POSSIBLY (◇)
 * - temporali: ALWAYS, EVENTUALLY, UNTIL
 * - confronti: GT, LT, GE, LE, EQ
 */
public final class OperatorRegistry {

    private static final Logger LOGGER = Logger.getLogger(OperatorRegistry.class.getName());

    public static final String NOT = "NOT";
    public static final String AND = "AND";
    public static final String OR = "OR";
    public static final String IMPLIES = "IMPLIES";
    public static final String XOR = "XOR";
    public static final String NAND = "NAND";
    public static final String NOR = "NOR";
    public static final String IFF = "IFF";
    public static final String ANDN = "ANDN";
    public static final String ORN = "ORN";
    public static final String NANDN = "NANDN";
    public static final String NORN = "NORN";
    public static final String NECESSARILY = "NECESSARILY";
    public static final String POSSIBLY = "POSSIBLY";
    public static final String ALWAYS = "ALWAYS";
    public static final String EVENTUALLY = "EVENTUALLY";
    public static final String UNTIL = "UNTIL";
    public static final String GT = "GT";
    public static final String LT = "LT";
    public static final String GE = "GE";
    public static final String LE = "LE";
    public static final String EQ = "EQ";

    private static final OperatorRegistry STANDARD = buildStandard();

    private final Map<String, Operator> operators;

    private OperatorRegistry(Map<String, Operator> operators) {
        this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
    }

    /**
     * @return registro condiviso con l'insieme standard di operatori
     */
    public static OperatorRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static OperatorRegistry buildStandard() {
        OperatorRegistry registry = builder()
                .register(Operator.booleanOperator(NOT, "¬", Arity.UNARY, v -> !v.get(0)))
                .register(Operator.booleanOperator(AND, "∧", Arity.BINARY, v -> v.get(0) && v.get(1)))
                .register(Operator.booleanOperator(OR, "∨", Arity.BINARY, v -> v.get(0) || v.get(1)))
                .register(Operator.booleanOperator(IMPLIES, "→", Arity.BINARY, v -> !v.get(0) || v.get(1)))
                .register(Operator.booleanOperator(XOR, "⊕", Arity.BINARY, v -> v.get(0) ^ v.get(1)))
                .register(Operator.booleanOperator(NAND, "↑", Arity.BINARY, v -> !(v.get(0) && v.get(1))))
                .register(Operator.booleanOperator(NOR, "↓", Arity.BINARY, v -> !(v.get(0) || v.get(1))))
                .register(Operator.booleanOperator(IFF, "↔", Arity.BINARY, v -> v.get(0).equals(v.get(1))))
                .register(Operator.booleanOperator(ANDN, "∧", Arity.NARY, v -> !v.contains(Boolean.FALSE)))
                .register(Operator.booleanOperator(ORN, "∨", Arity.NARY, v -> v.contains(Boolean.TRUE)))
                .register(Operator.booleanOperator(NANDN, "↑", Arity.NARY, v -> v.contains(Boolean.FALSE)))
                .register(Operator.booleanOperator(NORN, "↓", Arity.NARY, v -> !v.contains(Boolean.TRUE)))
                .register(Operator.modalOperator(NECESSARILY, "□", Arity.UNARY))
                .register(Operator.modalOperator(POSSIBLY, "◇", Arity.UNARY))
                .register(Operator.temporalOperator(ALWAYS, "ALWAYS", Arity.UNARY))
                .register(Operator.temporalOperator(EVENTUALLY, "EVENTUALLY", Arity.UNARY))
                .register(Operator.temporalOperator(UNTIL, "UNTIL", Arity.BINARY))
                .register(Operator.comparisonOperator(GT, ">", (a, b) -> a > b))
                .register(Operator.comparisonOperator(LT, "<", (a, b) -> a < b))
                .register(Operator.comparisonOperator(GE, ">=", (a, b) -> a >= b))
                .register(Operator.comparisonOperator(LE, "<=", (a, b) -> a <= b))
                .register(Operator.comparisonOperator(EQ, "=", (a, b) -> Double.compare(a, b) == 0))
                .build();
        LOGGER.fine("Registro operatori standard costruito: " + registry.operators.size() + " operatori");
        return registry;
    }

    /**
     * @throws UnknownReferenceException se il nome non è registrato
     */
    public Operator require(String name) {
        Operator operator = operators.get(name);
        if (operator == null) {
            throw new UnknownReferenceException(name, "Operatore non registrato: " + name);
        }
        return operator;
    }

    public Optional<Operator> find(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public boolean contains(Operator operator) {
        return operator != null && operator.equals(operators.get(operator.name()));
    }

    public Collection<Operator> all() {
        return operators.values();
    }

    /**
     * Costruttore del registro: unico punto in cui gli operatori vengono aggiunti.
     */
    public static final class Builder {

        private final Map<String, Operator> operators = new LinkedHashMap<>();
        private boolean built = false;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException se il nome è già registrato
         * @throws IllegalStateException se il registro è già stato costruito
         */
        public Builder register(Operator operator) {
            if (built) {
                throw new IllegalStateException("Registro già costruito: registrazioni non più ammesse");
            }
            if (operator == null) {
                throw new IllegalArgumentException("Operatore non può essere null");
            }
            if (operators.containsKey(operator.name())) {
                throw new IllegalArgumentException("Operatore già registrato: " + operator.name());
            }
            operators.put(operator.name(), operator);
            return this;
        }

        public OperatorRegistry build() {
            built = true;
            return new OperatorRegistry(operators);
        }
    }
}

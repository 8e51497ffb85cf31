package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.NumericProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.error.UnknownReferenceException;
import org.formalities.fall.ast.Expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RISOLUZIONE DEI NOMI - Da espressioni AST a proposizioni del modello logico
 *
 * CORRISPONDENZE:
 * - REFERENCE → proposizione registrata (o metavariabile negli schemi)
 * - CONSTANT → {@link AtomicProposition#TRUE} / {@link AtomicProposition#FALSE}
 * - OPERATION → CompoundProposition sull'operatore registrato con quel nome
 * - COMPARISON → confronto tra NumericProposition
 * - NUMBER, ARITHMETIC → NumericProposition
 *
 * La costruzione delle composte verifica l'arietà: gli errori emergono qui,
 * non durante la valutazione.
 */
final class ExpressionResolver {

    private final SymbolTable symbols;
    private final OperatorRegistry operators;

    ExpressionResolver(SymbolTable symbols, OperatorRegistry operators) {
        this.symbols = symbols;
        this.operators = operators;
    }

    Proposition resolve(Expression expression) {
        return resolvePattern(expression, Set.of());
    }

    /**
     * Come {@link #resolve} ma i nomi in {@code metavariables} diventano atomi schema.
     */
    Proposition resolvePattern(Expression expression, Set<String> metavariables) {
        return switch (expression.kind()) {
            case REFERENCE -> reference(expression.name(), metavariables);
            case CONSTANT -> expression.constantValue() ? AtomicProposition.TRUE : AtomicProposition.FALSE;
            case OPERATION -> {
                List<Proposition> operands = new ArrayList<>();
                for (Expression operand : expression.operands()) {
                    operands.add(resolvePattern(operand, metavariables));
                }
                yield CompoundProposition.of(operators.require(expression.name()), operands);
            }
            case COMPARISON -> CompoundProposition.of(operators.require(expression.name()),
                    numeric(expression.operand(0)), numeric(expression.operand(1)));
            case NUMBER, ARITHMETIC -> numeric(expression);
        };
    }

    private Proposition reference(String name, Set<String> metavariables) {
        if (metavariables.contains(name)) {
            return AtomicProposition.named(name);
        }
        Proposition proposition = symbols.requireProposition(name);
        if (proposition instanceof NumericProposition) {
            throw new UnknownReferenceException(name,
                    "'" + name + "' è numerica e non può comparire come proposizione booleana");
        }
        return proposition;
    }

    NumericProposition numeric(Expression expression) {
        switch (expression.kind()) {
            case NUMBER:
                return NumericProposition.constant(expression.numberValue());
            case REFERENCE: {
                Proposition proposition = symbols.requireProposition(expression.name());
                if (!(proposition instanceof NumericProposition)) {
                    throw new UnknownReferenceException(expression.name(),
                            "'" + expression.name() + "' non è una proposizione numerica");
                }
                return (NumericProposition) proposition;
            }
            case ARITHMETIC: {
                NumericProposition left = numeric(expression.operand(0));
                if (expression.operands().size() == 1) {
                    return left.negated();
                }
                NumericProposition right = numeric(expression.operand(1));
                return switch (expression.name()) {
                    case "+" -> left.plus(right);
                    case "-" -> left.minus(right);
                    case "*" -> left.times(right);
                    case "/" -> left.dividedBy(right);
                    default -> throw new IllegalArgumentException("Segno aritmetico sconosciuto: " + expression.name());
                };
            }
            default:
                throw new IllegalArgumentException("Espressione non numerica: " + expression.render());
        }
    }

    /**
     * Nomi referenziati, in ordine di apparizione.
     */
    static Set<String> references(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        collect(expression, names);
        return names;
    }

    private static void collect(Expression expression, Set<String> into) {
        if (expression.isReference()) {
            into.add(expression.name());
        }
        for (Expression operand : expression.operands()) {
            collect(operand, into);
        }
    }
}

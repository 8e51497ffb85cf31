package org.formalities.fall.interpreter;

import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.parser.ProgramParser;
import org.formalities.framework.Law;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ASSIOMI PREDEFINITI - Regole di inferenza registrate all'avvio di ogni sessione
 *
 * Gli schemi sono scritti in FALL: ogni identificatore è una metavariabile.
 */
final class AxiomLibrary {

    private AxiomLibrary() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static List<Axiom> standard(OperatorRegistry operators) {
        ProgramParser parser = new ProgramParser();
        ExpressionResolver resolver = new ExpressionResolver(new SymbolTable(), operators);
        List<Axiom> axioms = new ArrayList<>();

        axioms.add(define(parser, resolver, "ModusPonens", "Q", "P", "P -> Q"));
        axioms.add(define(parser, resolver, "ModusTollens", "NOT P", "P -> Q", "NOT Q"));
        axioms.add(define(parser, resolver, "HypotheticalSyllogism", "P -> R", "P -> Q", "Q -> R"));
        axioms.add(define(parser, resolver, "DisjunctiveSyllogism", "Q", "P OR Q", "NOT P"));
        axioms.add(define(parser, resolver, "ConjunctionIntroduction", "P AND Q", "P", "Q"));
        axioms.add(define(parser, resolver, "SimplificationLeft", "P", "P AND Q"));
        axioms.add(define(parser, resolver, "SimplificationRight", "Q", "P AND Q"));
        axioms.add(define(parser, resolver, EnumSet.of(Law.DOUBLE_NEGATION),
                "DoubleNegationElimination", "P", "NOT NOT P"));

        return axioms;
    }

    private static Axiom define(ProgramParser parser, ExpressionResolver resolver, String name,
                                String conclusion, String... premises) {
        return define(parser, resolver, EnumSet.noneOf(Law.class), name, conclusion, premises);
    }

    private static Axiom define(ProgramParser parser, ExpressionResolver resolver, Set<Law> laws,
                                String name, String conclusion, String... premises) {
        Set<String> metavariables = new LinkedHashSet<>();
        List<Expression> premiseExpressions = new ArrayList<>();
        for (String premise : premises) {
            Expression expression = parser.parseExpression(premise);
            metavariables.addAll(ExpressionResolver.references(expression));
            premiseExpressions.add(expression);
        }
        Expression conclusionExpression = parser.parseExpression(conclusion);
        metavariables.addAll(ExpressionResolver.references(conclusionExpression));

        List<Proposition> slots = new ArrayList<>();
        for (Expression expression : premiseExpressions) {
            slots.add(resolver.resolvePattern(expression, metavariables));
        }
        return new Axiom(name, slots, resolver.resolvePattern(conclusionExpression, metavariables),
                metavariables, laws, true);
    }
}

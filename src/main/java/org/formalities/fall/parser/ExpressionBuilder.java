package org.formalities.fall.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.formalities.core.OperatorRegistry;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.grammar.FallBaseVisitor;
import org.formalities.fall.grammar.FallParser;
import org.formalities.fall.grammar.FallParser.ArithmeticContext;
import org.formalities.fall.grammar.FallParser.ArithmeticNegationContext;
import org.formalities.fall.grammar.FallParser.ArithmeticParensContext;
import org.formalities.fall.grammar.FallParser.BiconditionalContext;
import org.formalities.fall.grammar.FallParser.ComparisonContext;
import org.formalities.fall.grammar.FallParser.ConjunctionContext;
import org.formalities.fall.grammar.FallParser.DisjunctionContext;
import org.formalities.fall.grammar.FallParser.ExpressionContext;
import org.formalities.fall.grammar.FallParser.FalseLiteralContext;
import org.formalities.fall.grammar.FallParser.ImplicationContext;
import org.formalities.fall.grammar.FallParser.ModalContext;
import org.formalities.fall.grammar.FallParser.NaryApplicationContext;
import org.formalities.fall.grammar.FallParser.NegationContext;
import org.formalities.fall.grammar.FallParser.NumberLiteralContext;
import org.formalities.fall.grammar.FallParser.NumericReferenceContext;
import org.formalities.fall.grammar.FallParser.ParenthesizedContext;
import org.formalities.fall.grammar.FallParser.ProductContext;
import org.formalities.fall.grammar.FallParser.ReferenceContext;
import org.formalities.fall.grammar.FallParser.StandaloneExpressionContext;
import org.formalities.fall.grammar.FallParser.SumContext;
import org.formalities.fall.grammar.FallParser.TrueLiteralContext;
import org.formalities.fall.grammar.FallParser.UntilContext;
import org.formalities.fall.lexer.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * COSTRUTTORE DI ESPRESSIONI - Visitor dall'albero ANTLR ai nodi {@link Expression}
 *
 * La precedenza è già risolta dalla grammatica; qui ogni alternativa etichettata
 * diventa un nodo con il nome di registrazione dell'operatore.
 *
 * CORRISPONDENZE:
 * - AND ∧ / NAND ↑ binari: AND, NAND
 * - OR ∨ / XOR ⊕ / NOR ↓ binari: OR, XOR, NOR
 * - forma applicativa ∧(a, b, c): ANDN, ORN, NANDN, NORN
 * - NOT ¬: NOT; □ ◇ ALWAYS EVENTUALLY UNTIL: operatori modali e temporali
 * - -> → / <-> ↔: IMPLIES, IFF (associativi a destra)
 * - > < >= <= =: GT LT GE LE EQ sull'aritmetica
 */
public final class ExpressionBuilder extends FallBaseVisitor<Expression> {

    private static final Logger LOGGER = Logger.getLogger(ExpressionBuilder.class.getName());

    //region PUNTI DI INGRESSO

    public Expression build(ExpressionContext ctx) {
        Expression expression = visit(ctx);
        LOGGER.finest("Espressione costruita: " + expression.render());
        return expression;
    }

    public Expression buildArithmetic(ArithmeticContext ctx) {
        return visit(ctx);
    }

    @Override
    public Expression visitStandaloneExpression(StandaloneExpressionContext ctx) {
        return build(ctx.expression());
    }

    //endregion

    //region CONNETTIVI

    @Override
    public Expression visitParenthesized(ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Expression visitNaryApplication(NaryApplicationContext ctx) {
        String operator = switch (ctx.op.getType()) {
            case FallParser.AND, FallParser.CONJ -> OperatorRegistry.ANDN;
            case FallParser.OR, FallParser.DISJ -> OperatorRegistry.ORN;
            case FallParser.NAND, FallParser.NAND_SYM -> OperatorRegistry.NANDN;
            case FallParser.NOR, FallParser.NOR_SYM -> OperatorRegistry.NORN;
            default -> throw new IllegalStateException("Operatore n-ario inatteso: " + ctx.op.getText());
        };
        List<Expression> operands = new ArrayList<>();
        for (ExpressionContext operand : ctx.expression()) {
            operands.add(visit(operand));
        }
        return Expression.operation(operator, operands, positionOf(ctx));
    }

    @Override
    public Expression visitNegation(NegationContext ctx) {
        return Expression.operation(OperatorRegistry.NOT, List.of(visit(ctx.expression())), positionOf(ctx));
    }

    @Override
    public Expression visitModal(ModalContext ctx) {
        String operator = switch (ctx.op.getType()) {
            case FallParser.NECESSARILY, FallParser.BOX -> OperatorRegistry.NECESSARILY;
            case FallParser.POSSIBLY, FallParser.DIAMOND -> OperatorRegistry.POSSIBLY;
            case FallParser.ALWAYS -> OperatorRegistry.ALWAYS;
            case FallParser.EVENTUALLY -> OperatorRegistry.EVENTUALLY;
            default -> throw new IllegalStateException("Operatore modale inatteso: " + ctx.op.getText());
        };
        return Expression.operation(operator, List.of(visit(ctx.expression())), positionOf(ctx));
    }

    @Override
    public Expression visitConjunction(ConjunctionContext ctx) {
        String operator = switch (ctx.op.getType()) {
            case FallParser.NAND, FallParser.NAND_SYM -> OperatorRegistry.NAND;
            default -> OperatorRegistry.AND;
        };
        return binary(operator, ctx.expression(0), ctx.expression(1), ctx);
    }

    @Override
    public Expression visitDisjunction(DisjunctionContext ctx) {
        String operator = switch (ctx.op.getType()) {
            case FallParser.XOR, FallParser.XOR_SYM -> OperatorRegistry.XOR;
            case FallParser.NOR, FallParser.NOR_SYM -> OperatorRegistry.NOR;
            default -> OperatorRegistry.OR;
        };
        return binary(operator, ctx.expression(0), ctx.expression(1), ctx);
    }

    @Override
    public Expression visitUntil(UntilContext ctx) {
        return binary(OperatorRegistry.UNTIL, ctx.expression(0), ctx.expression(1), ctx);
    }

    @Override
    public Expression visitImplication(ImplicationContext ctx) {
        return binary(OperatorRegistry.IMPLIES, ctx.expression(0), ctx.expression(1), ctx);
    }

    @Override
    public Expression visitBiconditional(BiconditionalContext ctx) {
        return binary(OperatorRegistry.IFF, ctx.expression(0), ctx.expression(1), ctx);
    }

    private Expression binary(String operator, ExpressionContext left, ExpressionContext right,
                              ParserRuleContext ctx) {
        return Expression.operation(operator, List.of(visit(left), visit(right)), positionOf(ctx));
    }

    //endregion

    //region FOGLIE

    @Override
    public Expression visitTrueLiteral(TrueLiteralContext ctx) {
        return Expression.constant(true, positionOf(ctx));
    }

    @Override
    public Expression visitFalseLiteral(FalseLiteralContext ctx) {
        return Expression.constant(false, positionOf(ctx));
    }

    @Override
    public Expression visitReference(ReferenceContext ctx) {
        return Expression.reference(ctx.IDENTIFIER().getText(), positionOf(ctx));
    }

    //endregion

    //region CONFRONTI E ARITMETICA

    @Override
    public Expression visitComparison(ComparisonContext ctx) {
        String operator = switch (ctx.op.getType()) {
            case FallParser.GT -> OperatorRegistry.GT;
            case FallParser.LT -> OperatorRegistry.LT;
            case FallParser.GE -> OperatorRegistry.GE;
            case FallParser.LE -> OperatorRegistry.LE;
            case FallParser.EQUALS -> OperatorRegistry.EQ;
            default -> throw new IllegalStateException("Confronto inatteso: " + ctx.op.getText());
        };
        return Expression.comparison(operator, visit(ctx.left), visit(ctx.right), positionOf(ctx));
    }

    @Override
    public Expression visitArithmeticParens(ArithmeticParensContext ctx) {
        return visit(ctx.arithmetic());
    }

    @Override
    public Expression visitArithmeticNegation(ArithmeticNegationContext ctx) {
        return Expression.arithmetic("neg", List.of(visit(ctx.arithmetic())), positionOf(ctx));
    }

    @Override
    public Expression visitProduct(ProductContext ctx) {
        return Expression.arithmetic(ctx.op.getText(),
                List.of(visit(ctx.arithmetic(0)), visit(ctx.arithmetic(1))), positionOf(ctx));
    }

    @Override
    public Expression visitSum(SumContext ctx) {
        return Expression.arithmetic(ctx.op.getText(),
                List.of(visit(ctx.arithmetic(0)), visit(ctx.arithmetic(1))), positionOf(ctx));
    }

    @Override
    public Expression visitNumberLiteral(NumberLiteralContext ctx) {
        return Expression.number(Double.parseDouble(ctx.NUMBER().getText()), positionOf(ctx));
    }

    @Override
    public Expression visitNumericReference(NumericReferenceContext ctx) {
        return Expression.reference(ctx.IDENTIFIER().getText(), positionOf(ctx));
    }

    //endregion

    static SourcePosition positionOf(ParserRuleContext ctx) {
        return new SourcePosition(ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine());
    }
}

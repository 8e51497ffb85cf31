package org.formalities.fall.parser;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.formalities.error.SyntaxException;
import org.formalities.fall.ast.Assertion;
import org.formalities.fall.ast.AxiomDefinition;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.ast.Pragma;
import org.formalities.fall.ast.Program;
import org.formalities.fall.ast.ProofBlock;
import org.formalities.fall.ast.ProofStep;
import org.formalities.fall.ast.PropositionDefinition;
import org.formalities.fall.ast.Query;
import org.formalities.fall.ast.RuleDefinition;
import org.formalities.fall.ast.Statement;
import org.formalities.fall.ast.Symbolize;
import org.formalities.fall.grammar.FallBaseVisitor;
import org.formalities.fall.grammar.FallParser;
import org.formalities.fall.grammar.FallParser.AssertStatementContext;
import org.formalities.fall.grammar.FallParser.AssertStepContext;
import org.formalities.fall.grammar.FallParser.AxiomConditionContext;
import org.formalities.fall.grammar.FallParser.AxiomDefinitionContext;
import org.formalities.fall.grammar.FallParser.BridgePragmaContext;
import org.formalities.fall.grammar.FallParser.ExpressionContext;
import org.formalities.fall.grammar.FallParser.FrameworkPragmaContext;
import org.formalities.fall.grammar.FallParser.GivenClauseContext;
import org.formalities.fall.grammar.FallParser.InferStepContext;
import org.formalities.fall.grammar.FallParser.NumericDefinitionContext;
import org.formalities.fall.grammar.FallParser.ProgramContext;
import org.formalities.fall.grammar.FallParser.ProofBlockContext;
import org.formalities.fall.grammar.FallParser.ProofStepContext;
import org.formalities.fall.grammar.FallParser.QueryStatementContext;
import org.formalities.fall.grammar.FallParser.RuleConstraintContext;
import org.formalities.fall.grammar.FallParser.RuleDefinitionContext;
import org.formalities.fall.grammar.FallParser.SelectFrameworkPragmaContext;
import org.formalities.fall.grammar.FallParser.StatementContext;
import org.formalities.fall.grammar.FallParser.SymbolizeStatementContext;
import org.formalities.fall.grammar.FallParser.TagAnnotationContext;
import org.formalities.fall.grammar.FallParser.TextualDefinitionContext;
import org.formalities.fall.lexer.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.formalities.fall.parser.ExpressionBuilder.positionOf;

/**
 * COSTRUTTORE DI ISTRUZIONI - Visitor dall'albero ANTLR alle istruzioni dell'AST
 *
 * VALIDAZIONI STRUTTURALI (oltre alla grammatica):
 * - numeri dei passi di prova strettamente crescenti
 * - stringhe private delle virgolette e delle sequenze di escape
 */
public final class StatementBuilder extends FallBaseVisitor<Statement> {

    private static final Logger LOGGER = Logger.getLogger(StatementBuilder.class.getName());

    private final ExpressionBuilder expressions;

    public StatementBuilder(ExpressionBuilder expressions) {
        this.expressions = expressions;
    }

    public Program buildProgram(ProgramContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (StatementContext statement : ctx.statement()) {
            statements.add(visit(statement));
        }
        LOGGER.fine("Programma costruito: " + statements.size() + " istruzioni");
        return new Program(statements);
    }

    @Override
    public Statement visitStatement(StatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    //region DEFINIZIONI

    @Override
    public Statement visitRuleDefinition(RuleDefinitionContext ctx) {
        List<RuleDefinition.Constraint> constraints = new ArrayList<>();
        for (RuleConstraintContext constraint : ctx.ruleConstraint()) {
            List<String> categories = new ArrayList<>();
            List<TerminalNode> identifiers = constraint.IDENTIFIER();
            // il primo identificatore è il ruolo
            for (int i = 1; i < identifiers.size(); i++) {
                categories.add(identifiers.get(i).getText());
            }
            constraints.add(new RuleDefinition.Constraint(constraint.role.getText(), categories));
        }
        return new RuleDefinition(ctx.name.getText(), constraints, positionOf(ctx));
    }

    @Override
    public Statement visitAxiomDefinition(AxiomDefinitionContext ctx) {
        List<AxiomDefinition.Condition> conditions = new ArrayList<>();
        for (AxiomConditionContext condition : ctx.axiomCondition()) {
            boolean expectedTrue = condition.truthValue() == null || condition.truthValue().FALSE() == null;
            conditions.add(new AxiomDefinition.Condition(expressions.build(condition.expression()), expectedTrue));
        }
        Expression conclusion = ctx.conclusion != null ? expressions.build(ctx.conclusion) : null;
        return new AxiomDefinition(ctx.name.getText(), conditions, conclusion, positionOf(ctx));
    }

    @Override
    public Statement visitTextualDefinition(TextualDefinitionContext ctx) {
        List<PropositionDefinition.TagAnnotation> tags = new ArrayList<>();
        for (TagAnnotationContext tag : ctx.tagAnnotation()) {
            tags.add(new PropositionDefinition.TagAnnotation(
                    unquote(tag.phrase.getText()),
                    tag.role.getText(),
                    tag.cat != null ? tag.cat.getText() : null));
        }
        return PropositionDefinition.textual(ctx.name.getText(), unquote(ctx.sentence.getText()), tags,
                positionOf(ctx));
    }

    @Override
    public Statement visitNumericDefinition(NumericDefinitionContext ctx) {
        return PropositionDefinition.numeric(ctx.name.getText(),
                expressions.buildArithmetic(ctx.arithmetic()), positionOf(ctx));
    }

    //endregion

    //region ISTRUZIONI

    @Override
    public Statement visitAssertStatement(AssertStatementContext ctx) {
        return new Assertion(expressions.build(ctx.expression()), positionOf(ctx));
    }

    @Override
    public Statement visitProofBlock(ProofBlockContext ctx) {
        List<Expression> givens = new ArrayList<>();
        for (GivenClauseContext given : ctx.givenClause()) {
            givens.add(expressions.build(given.expression()));
        }

        List<String> using = new ArrayList<>();
        if (ctx.usingClause() != null) {
            for (TerminalNode axiom : ctx.usingClause().IDENTIFIER()) {
                using.add(axiom.getText());
            }
        }

        List<ProofStep> steps = new ArrayList<>();
        int previous = Integer.MIN_VALUE;
        for (ProofStepContext stepContext : ctx.proofStep()) {
            ProofStep step = buildStep(stepContext);
            if (step.number() <= previous) {
                throw new SyntaxException("Numerazione dei passi non crescente: STEP " + step.number()
                        + " dopo STEP " + previous, "STEP " + step.number(), "STEP > " + previous,
                        "proofStep", step.position());
            }
            previous = step.number();
            steps.add(step);
        }

        return new ProofBlock(givens, expressions.build(ctx.goal), using, steps, positionOf(ctx));
    }

    private ProofStep buildStep(ProofStepContext ctx) {
        SourcePosition position = positionOf(ctx);
        if (ctx instanceof AssertStepContext) {
            AssertStepContext step = (AssertStepContext) ctx;
            return ProofStep.assertion(stepNumber(step.NUMBER(), position),
                    expressions.build(step.expression()), position);
        }
        InferStepContext step = (InferStepContext) ctx;
        List<Expression> premises = new ArrayList<>();
        if (step.premiseList() != null) {
            for (ExpressionContext premise : step.premiseList().expression()) {
                premises.add(expressions.build(premise));
            }
        }
        return ProofStep.inference(stepNumber(step.NUMBER(), position), expressions.build(step.goal),
                premises, step.axiom.getText(), position);
    }

    private static int stepNumber(TerminalNode number, SourcePosition position) {
        String text = number.getText();
        if (!text.matches("\\d+")) {
            throw new SyntaxException("Numero di passo non intero: " + text, text, "intero", "proofStep", position);
        }
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Numero di passo fuori intervallo: " + text, text,
                    "intero positivo", "proofStep", position);
        }
        // 0 è riservato ai fallimenti fuori dai passi (goal, premesse)
        if (value == 0) {
            throw new SyntaxException("Numero di passo nullo: " + text, text, "intero positivo", "proofStep", position);
        }
        return value;
    }

    @Override
    public Statement visitQueryStatement(QueryStatementContext ctx) {
        return new Query(expressions.build(ctx.expression()), positionOf(ctx));
    }

    @Override
    public Statement visitSymbolizeStatement(SymbolizeStatementContext ctx) {
        return new Symbolize(expressions.build(ctx.expression()), positionOf(ctx));
    }

    //endregion

    //region PRAGMA

    @Override
    public Statement visitBridgePragma(BridgePragmaContext ctx) {
        return Pragma.bridge(ctx.toggle.getType() == FallParser.ON, positionOf(ctx));
    }

    @Override
    public Statement visitFrameworkPragma(FrameworkPragmaContext ctx) {
        List<String> ids = new ArrayList<>();
        for (TerminalNode id : ctx.IDENTIFIER()) {
            ids.add(id.getText());
        }
        return Pragma.useFrameworks(ids, positionOf(ctx));
    }

    @Override
    public Statement visitSelectFrameworkPragma(SelectFrameworkPragmaContext ctx) {
        return Pragma.selectFramework(expressions.build(ctx.expression()), positionOf(ctx));
    }

    //endregion

    /**
     * Rimuove le virgolette e risolve gli escape \" e \\.
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                sb.append(body.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}

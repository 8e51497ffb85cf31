package org.formalities.fall.ast;

import org.formalities.core.NumericProposition;
import org.formalities.fall.lexer.SourcePosition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ESPRESSIONE - Nodo non risolto dell'AST
 *
 * I nomi restano stringhe: la risoluzione verso proposizioni registrate avviene
 * nell'interprete. Gli operatori sono indicati con il nome di registrazione
 * (es. "IMPLIES"), l'aritmetica con il segno ("+", "-", "*", "/", "neg").
 *
 * UGUAGLIANZA: strutturale, la posizione non partecipa.
 */
public final class Expression {

    public enum Kind {
        REFERENCE,
        CONSTANT,
        OPERATION,
        COMPARISON,
        NUMBER,
        ARITHMETIC
    }

    private final Kind kind;
    private final String name;
    private final boolean constant;
    private final double number;
    private final List<Expression> operands;
    private final SourcePosition position;

    private Expression(Kind kind, String name, boolean constant, double number,
                       List<Expression> operands, SourcePosition position) {
        this.kind = kind;
        this.name = name;
        this.constant = constant;
        this.number = number;
        this.operands = List.copyOf(operands);
        this.position = position != null ? position : SourcePosition.UNKNOWN;
    }

    public static Expression reference(String name, SourcePosition position) {
        return new Expression(Kind.REFERENCE, Objects.requireNonNull(name), false, 0, List.of(), position);
    }

    public static Expression constant(boolean value, SourcePosition position) {
        return new Expression(Kind.CONSTANT, value ? "TRUE" : "FALSE", value, 0, List.of(), position);
    }

    public static Expression operation(String operatorName, List<Expression> operands, SourcePosition position) {
        return new Expression(Kind.OPERATION, operatorName, false, 0, operands, position);
    }

    public static Expression comparison(String operatorName, Expression left, Expression right,
                                        SourcePosition position) {
        return new Expression(Kind.COMPARISON, operatorName, false, 0, List.of(left, right), position);
    }

    public static Expression number(double value, SourcePosition position) {
        return new Expression(Kind.NUMBER, NumericProposition.formatNumber(value), false, value, List.of(), position);
    }

    public static Expression arithmetic(String sign, List<Expression> operands, SourcePosition position) {
        return new Expression(Kind.ARITHMETIC, sign, false, 0, operands, position);
    }

    public Kind kind() {
        return kind;
    }

    /** Nome referenziato, operatore o segno aritmetico secondo la variante */
    public String name() {
        return name;
    }

    public boolean constantValue() {
        return constant;
    }

    public double numberValue() {
        return number;
    }

    public List<Expression> operands() {
        return operands;
    }

    public Expression operand(int index) {
        return operands.get(index);
    }

    public SourcePosition position() {
        return position;
    }

    public boolean isReference() {
        return kind == Kind.REFERENCE;
    }

    /**
     * Rendering testuale non risolto, per messaggi e report.
     */
    public String render() {
        return switch (kind) {
            case REFERENCE, CONSTANT, NUMBER -> name;
            case OPERATION -> operands.size() == 1
                    ? name + " " + operands.get(0).render()
                    : name + operands.stream().map(Expression::render).collect(Collectors.joining(", ", "(", ")"));
            case COMPARISON -> "(" + operands.get(0).render() + " " + name + " " + operands.get(1).render() + ")";
            case ARITHMETIC -> operands.size() == 1
                    ? "-" + operands.get(0).render()
                    : "(" + operands.get(0).render() + " " + name + " " + operands.get(1).render() + ")";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        Expression other = (Expression) o;
        return kind == other.kind && constant == other.constant
                && Double.compare(number, other.number) == 0
                && name.equals(other.name) && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, constant, number, operands);
    }

    @Override
    public String toString() {
        return render();
    }
}

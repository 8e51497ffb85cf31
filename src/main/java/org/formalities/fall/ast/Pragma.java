package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;

/**
 * PRAGMA - Direttive che modificano l'ambiente di esecuzione
 *
 * VARIANTI:
 * - BRIDGE_NLP: BRIDGE NLP ON/OFF
 * - USE_FRAMEWORKS: USING FRAMEWORK a, b
 * - SELECT_FRAMEWORK: USING FRAMEWORK FOR espressione
 */
public final class Pragma extends Statement {

    public enum Kind {
        BRIDGE_NLP,
        USE_FRAMEWORKS,
        SELECT_FRAMEWORK
    }

    private final Kind pragmaKind;
    private final boolean enabled;
    private final List<String> frameworkIds;
    private final Expression target;

    private Pragma(Kind pragmaKind, boolean enabled, List<String> frameworkIds, Expression target,
                   SourcePosition position) {
        super(position);
        this.pragmaKind = pragmaKind;
        this.enabled = enabled;
        this.frameworkIds = List.copyOf(frameworkIds);
        this.target = target;
    }

    public static Pragma bridge(boolean enabled, SourcePosition position) {
        return new Pragma(Kind.BRIDGE_NLP, enabled, List.of(), null, position);
    }

    public static Pragma useFrameworks(List<String> ids, SourcePosition position) {
        return new Pragma(Kind.USE_FRAMEWORKS, false, ids, null, position);
    }

    public static Pragma selectFramework(Expression target, SourcePosition position) {
        return new Pragma(Kind.SELECT_FRAMEWORK, false, List.of(), target, position);
    }

    public Kind pragmaKind() {
        return pragmaKind;
    }

    public boolean enabled() {
        return enabled;
    }

    public List<String> frameworkIds() {
        return frameworkIds;
    }

    public Expression target() {
        return target;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PRAGMA;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPragma(this);
    }

    @Override
    public String describe() {
        return switch (pragmaKind) {
            case BRIDGE_NLP -> "BRIDGE NLP " + (enabled ? "ON" : "OFF");
            case USE_FRAMEWORKS -> "USING FRAMEWORK " + String.join(", ", frameworkIds);
            case SELECT_FRAMEWORK -> "USING FRAMEWORK FOR " + target.render();
        };
    }
}

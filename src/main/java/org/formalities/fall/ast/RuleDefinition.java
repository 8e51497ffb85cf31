package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DEFINE RULE: vincoli sulle categorie grammaticali ammesse per ciascun ruolo.
 * Le alternative separate da | formano l'insieme ammesso.
 */
public final class RuleDefinition extends Statement {

    private final String name;
    private final List<Constraint> constraints;

    public RuleDefinition(String name, List<Constraint> constraints, SourcePosition position) {
        super(position);
        this.name = name;
        this.constraints = List.copyOf(constraints);
    }

    public String name() {
        return name;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.RULE_DEFINITION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRuleDefinition(this);
    }

    @Override
    public String describe() {
        return "DEFINE RULE " + name + " WHERE "
                + constraints.stream().map(Constraint::toString).collect(Collectors.joining(" AND "));
    }

    public static final class Constraint {

        private final String role;
        private final List<String> categories;

        public Constraint(String role, List<String> categories) {
            if (categories.isEmpty()) {
                throw new IllegalArgumentException("Vincolo senza categorie per il ruolo " + role);
            }
            this.role = role;
            this.categories = List.copyOf(categories);
        }

        public String role() {
            return role;
        }

        public List<String> categories() {
            return categories;
        }

        public boolean allows(String category) {
            return categories.contains(category);
        }

        @Override
        public String toString() {
            return role + " CAN BE " + String.join(" | ", categories);
        }
    }
}

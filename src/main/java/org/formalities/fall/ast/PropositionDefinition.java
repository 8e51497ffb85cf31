package org.formalities.fall.ast;

import org.formalities.fall.lexer.SourcePosition;

import java.util.List;

/**
 * DEFINE PROPOSITION: frase in linguaggio naturale con tag, oppure espressione numerica.
 */
public final class PropositionDefinition extends Statement {

    private final String name;
    private final String sentence;
    private final Expression numericExpression;
    private final List<TagAnnotation> tags;

    private PropositionDefinition(String name, String sentence, Expression numericExpression,
                                  List<TagAnnotation> tags, SourcePosition position) {
        super(position);
        this.name = name;
        this.sentence = sentence;
        this.numericExpression = numericExpression;
        this.tags = List.copyOf(tags);
    }

    public static PropositionDefinition textual(String name, String sentence, List<TagAnnotation> tags,
                                                SourcePosition position) {
        return new PropositionDefinition(name, sentence, null, tags, position);
    }

    public static PropositionDefinition numeric(String name, Expression expression, SourcePosition position) {
        return new PropositionDefinition(name, null, expression, List.of(), position);
    }

    public String name() {
        return name;
    }

    public String sentence() {
        return sentence;
    }

    public Expression numericExpression() {
        return numericExpression;
    }

    public boolean isNumeric() {
        return numericExpression != null;
    }

    public List<TagAnnotation> tags() {
        return tags;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PROPOSITION_DEFINITION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPropositionDefinition(this);
    }

    @Override
    public String describe() {
        return "DEFINE PROPOSITION " + name + " AS "
                + (isNumeric() ? numericExpression.render() : "\"" + sentence + "\"");
    }

    /**
     * Annotazione "frammento" IS RUOLO [AS CATEGORIA].
     */
    public static final class TagAnnotation {

        private final String phrase;
        private final String role;
        private final String category;

        public TagAnnotation(String phrase, String role, String category) {
            this.phrase = phrase;
            this.role = role;
            this.category = category;
        }

        public String phrase() {
            return phrase;
        }

        public String role() {
            return role;
        }

        public String category() {
            return category;
        }

        @Override
        public String toString() {
            return "\"" + phrase + "\" IS " + role + (category != null ? " AS " + category : "");
        }
    }
}

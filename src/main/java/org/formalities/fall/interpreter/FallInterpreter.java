package org.formalities.fall.interpreter;

import org.formalities.bridge.CollaboratorInvoker;
import org.formalities.bridge.NlpBridge;
import org.formalities.core.AtomicProposition;
import org.formalities.core.Evaluation;
import org.formalities.core.EvaluationContext;
import org.formalities.core.NumericProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.core.TagSet;
import org.formalities.error.AmbiguousQueryException;
import org.formalities.error.ErrorHandlers;
import org.formalities.error.ErrorKind;
import org.formalities.error.ErrorReport;
import org.formalities.error.FallException;
import org.formalities.error.FrameworkIncompatibleException;
import org.formalities.error.InvalidDefinitionException;
import org.formalities.error.UnknownReferenceException;
import org.formalities.fall.ast.Assertion;
import org.formalities.fall.ast.AxiomDefinition;
import org.formalities.fall.ast.Expression;
import org.formalities.fall.ast.Pragma;
import org.formalities.fall.ast.Program;
import org.formalities.fall.ast.ProofBlock;
import org.formalities.fall.ast.PropositionDefinition;
import org.formalities.fall.ast.Query;
import org.formalities.fall.ast.RuleDefinition;
import org.formalities.fall.ast.Statement;
import org.formalities.fall.ast.StatementKind;
import org.formalities.fall.ast.StatementVisitor;
import org.formalities.fall.ast.Symbolize;
import org.formalities.framework.Diagnostic;
import org.formalities.framework.Framework;
import org.formalities.framework.FrameworkRegistry;
import org.formalities.framework.Law;
import org.formalities.framework.ValidationEngine;
import org.formalities.selection.FrameworkRequirement;
import org.formalities.selection.FrameworkSelector;
import org.formalities.selection.FrameworkSuggestion;
import org.formalities.selection.Selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * INTERPRETE FALL - Esecuzione sequenziale delle istruzioni di un programma
 *
 * RESPONSABILITÀ:
 * - tabelle delle definizioni (regole, assiomi, proposizioni) e assiomi predefiniti
 * - fatti di primo livello, utilizzabili dai blocchi di prova successivi
 * - framework attivi, modificabili con i pragma USING FRAMEWORK
 * - instradamento degli errori: ogni istruzione fallita produce un ErrorReport
 *   e l'esecuzione prosegue con l'istruzione successiva
 *
 * Ogni istanza possiede i propri registri e stati: esecuzioni distinte non
 * condividono nulla di mutabile.
 */
public final class FallInterpreter implements StatementVisitor<StatementResult> {

    private static final Logger LOGGER = Logger.getLogger(FallInterpreter.class.getName());

    private final InterpreterOptions options;
    private final FrameworkRegistry frameworks;
    private final SymbolTable symbols = new SymbolTable();
    private final ExpressionResolver resolver;
    private final ValidationEngine engine;
    private final FrameworkSelector selector;
    private final ErrorHandlers errors = ErrorHandlers.standard();
    private final CollaboratorInvoker invoker;
    private final ProofExecutor executor;
    private final ExecutionStatistics statistics;
    private final Set<Proposition> facts = new LinkedHashSet<>();

    private List<Framework> activeFrameworks;
    private ExecutionState state = ExecutionState.IDLE;
    private ProofOutcome lastProof;
    private boolean bridgeEnabled = false;

    public FallInterpreter(InterpreterOptions options) {
        this(options, new ExecutionStatistics());
    }

    public FallInterpreter(InterpreterOptions options, ExecutionStatistics statistics) {
        this.options = options;
        this.statistics = statistics;
        this.frameworks = options.frameworks();

        OperatorRegistry operators = OperatorRegistry.standard();
        this.invoker = new CollaboratorInvoker(options.collaboratorTimeout());
        this.resolver = new ExpressionResolver(symbols, operators);
        this.engine = ValidationEngine.standard(operators, options.maxDepth(), options.externalValidator(),
                options.externalValidator() != null ? invoker : null);
        this.selector = new FrameworkSelector(frameworks);
        this.executor = new ProofExecutor(symbols, resolver, engine, errors, statistics,
                options.equivalenceMatching(), options.collaboratorTimeout().toMillis());

        this.activeFrameworks = compatibleFrameworks(options.initialFrameworks());

        for (Axiom axiom : AxiomLibrary.standard(operators)) {
            symbols.defineAxiom(axiom);
        }
        LOGGER.fine("Interprete inizializzato: " + options);
    }

    //region ESECUZIONE

    /**
     * Esegue tutte le istruzioni in ordine. Gli errori delle singole istruzioni
     * non interrompono il programma.
     */
    public RunReport run(Program program) {
        if (state == ExecutionState.HALTED) {
            throw new IllegalStateException("Interprete arrestato: nessuna ulteriore esecuzione");
        }
        state = ExecutionState.EXECUTING_TOP_LEVEL;
        LOGGER.info("Esecuzione di " + program.size() + " istruzioni");

        List<StatementResult> results = new ArrayList<>();
        for (Statement statement : program.statements()) {
            results.add(execute(statement));
        }

        state = ExecutionState.IDLE;
        statistics.stopTimer();
        LOGGER.info("Esecuzione completata: " + statistics.toCompactString());
        return RunReport.completed(results, lastProof, statistics);
    }

    /**
     * Arresto per errore lessicale o sintattico: nessuna istruzione viene eseguita.
     */
    public RunReport halt(FallException error) {
        if (!error.kind().isFatal()) {
            throw new IllegalArgumentException("Errore non fatale: " + error.kind());
        }
        state = ExecutionState.HALTED;
        statistics.incrementFailures();
        statistics.stopTimer();
        ErrorReport report = errors.dispatch(error, "programma", "nessuna istruzione eseguita");
        LOGGER.severe("Programma interrotto: " + report.describe());
        return RunReport.halted(report, statistics);
    }

    StatementResult execute(Statement statement) {
        statistics.incrementStatements();
        try {
            StatementResult result = statement.accept(this);
            if (!result.isSuccess()) {
                statistics.incrementFailures();
            }
            return result;
        } catch (FallException e) {
            statistics.incrementFailures();
            if (e.kind() == ErrorKind.TIMEOUT) {
                statistics.incrementTimeouts();
            }
            ErrorReport report = errors.dispatch(e, statement.describe(), priorState());
            LOGGER.warning("Istruzione fallita: " + report.describe());
            return StatementResult.failed(statement.kind(), statement.describe(), report, List.of());
        }
    }

    private String priorState() {
        String prior = "fatti: " + facts.size() + ", framework: " + frameworkIds();
        return lastProof != null ? prior + ", ultima prova: " + lastProof.state().snapshot() : prior;
    }

    //endregion

    //region DEFINIZIONI

    @Override
    public StatementResult visitRuleDefinition(RuleDefinition statement) {
        symbols.defineRule(statement);
        statistics.incrementDefinitions();
        return StatementResult.completed(StatementKind.RULE_DEFINITION, statement.describe(), List.of());
    }

    /**
     * Gli identificatori non definiti come proposizioni diventano metavariabili;
     * {@code X IS FALSE} è lo slot {@code ¬X}.
     *
     * VINCOLI:
     * - una metavariabile inizia con una lettera maiuscola, un nome minuscolo
     *   non definito è un riferimento mancante
     * - ogni metavariabile della conclusione compare in almeno uno slot
     */
    @Override
    public StatementResult visitAxiomDefinition(AxiomDefinition statement) {
        Set<String> metavariables = new LinkedHashSet<>();
        for (AxiomDefinition.Condition condition : statement.conditions()) {
            collectMetavariables(statement.name(), condition.pattern(), metavariables);
        }
        Set<String> bound = Set.copyOf(metavariables);
        if (statement.conclusion() != null) {
            Set<String> unbound = new LinkedHashSet<>();
            collectMetavariables(statement.name(), statement.conclusion(), unbound);
            unbound.removeAll(bound);
            if (!unbound.isEmpty()) {
                throw new InvalidDefinitionException("AXIOM '" + statement.name()
                        + "': metavariabili della conclusione non vincolate dalle premesse " + unbound);
            }
        }

        List<Proposition> slots = new ArrayList<>();
        for (AxiomDefinition.Condition condition : statement.conditions()) {
            Proposition slot = resolver.resolvePattern(condition.pattern(), metavariables);
            slots.add(condition.expectedTrue() ? slot : slot.negate());
        }
        Proposition conclusion = statement.conclusion() != null
                ? resolver.resolvePattern(statement.conclusion(), metavariables)
                : null;

        symbols.defineAxiom(new Axiom(statement.name(), slots, conclusion, metavariables,
                EnumSet.noneOf(Law.class), false));
        statistics.incrementDefinitions();
        return StatementResult.completed(StatementKind.AXIOM_DEFINITION, statement.describe(), List.of());
    }

    private void collectMetavariables(String axiom, Expression expression, Set<String> into) {
        for (String name : ExpressionResolver.references(expression)) {
            if (symbols.isProposition(name)) {
                continue;
            }
            if (!Character.isUpperCase(name.charAt(0))) {
                throw new InvalidDefinitionException("AXIOM '" + axiom + "': proposizione '" + name
                        + "' non definita (le metavariabili iniziano con una maiuscola)");
            }
            into.add(name);
        }
    }

    @Override
    public StatementResult visitPropositionDefinition(PropositionDefinition statement) {
        Proposition proposition = statement.isNumeric()
                ? numericProposition(statement)
                : textualProposition(statement);
        symbols.defineProposition(statement.name(), proposition);
        statistics.incrementDefinitions();
        return StatementResult.completed(StatementKind.PROPOSITION_DEFINITION, statement.describe(), List.of());
    }

    private NumericProposition numericProposition(PropositionDefinition statement) {
        NumericProposition body = resolver.numeric(statement.numericExpression());
        return NumericProposition.named(statement.name(), () -> {
            Evaluation evaluation = body.evaluate(EvaluationContext.empty());
            if (!evaluation.isNumber()) {
                throw new ArithmeticException(evaluation.reason());
            }
            return evaluation.numberValue();
        });
    }

    private AtomicProposition textualProposition(PropositionDefinition statement) {
        TagSet.Builder builder = TagSet.builder();
        for (PropositionDefinition.TagAnnotation tag : statement.tags()) {
            builder.tag(tag.role(), tag.phrase(), tag.category());
        }
        TagSet declared = builder.build();

        TagSet tags;
        if (bridgeEnabled) {
            tags = extractTags(statement.sentence()).mergedWith(declared);
        } else if (declared.isEmpty()) {
            throw new InvalidDefinitionException("Proposizione '" + statement.name()
                    + "' senza etichette: servono clausole WHERE oppure BRIDGE NLP ON");
        } else {
            tags = declared;
        }

        checkRules(statement.name(), tags);
        FrameworkRequirement.fromTags(tags.requirements());
        return AtomicProposition.described(statement.name(), statement.sentence(), tags);
    }

    private TagSet extractTags(String sentence) {
        NlpBridge bridge = options.nlpBridge();
        try {
            TagSet extracted = invoker.invoke(bridge.name(), () -> bridge.extract(sentence));
            return extracted != null ? extracted : TagSet.empty();
        } catch (IllegalStateException e) {
            throw new InvalidDefinitionException("Estrazione del bridge NLP fallita: " + e.getMessage());
        }
    }

    private void checkRules(String name, TagSet tags) {
        for (RuleDefinition rule : symbols.rules()) {
            for (RuleDefinition.Constraint constraint : rule.constraints()) {
                tags.role(constraint.role()).ifPresent(tag -> {
                    if (tag.category() != null && !constraint.allows(tag.category())) {
                        throw new InvalidDefinitionException("Proposizione '" + name + "' viola la regola "
                                + rule.name() + ": " + constraint.role() + " di categoria " + tag.category()
                                + " non ammessa (attese " + constraint.categories() + ")");
                    }
                });
            }
        }
    }

    //endregion

    //region ISTRUZIONI

    @Override
    public StatementResult visitAssertion(Assertion statement) {
        Proposition proposition = resolver.resolve(statement.expression());
        List<Diagnostic> flags = executor.validate(proposition, activeFrameworks, facts);
        facts.add(proposition);
        statistics.incrementAssertions();
        LOGGER.fine("Fatto asserito: " + proposition.toCanonicalString());
        return StatementResult.completed(StatementKind.ASSERTION, statement.describe(), flags);
    }

    @Override
    public StatementResult visitProofBlock(ProofBlock statement) {
        state = ExecutionState.EXECUTING_PROOF;
        ProofOutcome outcome;
        try {
            outcome = executor.execute(statement, facts, activeFrameworks);
        } finally {
            state = ExecutionState.EXECUTING_TOP_LEVEL;
        }
        lastProof = outcome;
        statistics.recordProof(outcome.isProved());
        if (outcome.isProved()) {
            LOGGER.info(outcome.describe());
        } else {
            LOGGER.warning(outcome.describe());
        }
        return StatementResult.ofProof(statement.describe(), outcome);
    }

    /**
     * Risponde rispetto all'ultimo stato di prova unito ai fatti di primo livello.
     */
    @Override
    public StatementResult visitQuery(Query statement) {
        statistics.incrementQueries();
        Expression expression = statement.expression();
        if (expression.isReference()) {
            List<String> namespaces = symbols.namespacesOf(expression.name());
            if (namespaces.size() > 1) {
                throw new AmbiguousQueryException(expression.name(), namespaces);
            }
        }

        Proposition proposition = resolver.resolve(expression);
        Set<Proposition> known = new LinkedHashSet<>(facts);
        if (lastProof != null) {
            known.addAll(lastProof.state().propositions());
        }
        TriState answer = new QueryResolver(known, executor.normalizerFor(activeFrameworks)).resolve(proposition);
        LOGGER.fine("QUERY " + proposition.toCanonicalString() + " => " + answer);
        return StatementResult.answered(statement.describe(), answer);
    }

    @Override
    public StatementResult visitSymbolize(Symbolize statement) {
        Proposition proposition = resolver.resolve(statement.expression());
        return StatementResult.rendered(statement.describe(), PredicateRenderer.render(proposition));
    }

    //endregion

    //region PRAGMA

    @Override
    public StatementResult visitPragma(Pragma statement) {
        switch (statement.pragmaKind()) {
            case BRIDGE_NLP -> toggleBridge(statement.enabled());
            case USE_FRAMEWORKS -> useFrameworks(statement.frameworkIds());
            case SELECT_FRAMEWORK -> selectFramework(resolver.resolve(statement.target()));
        }
        return StatementResult.completed(StatementKind.PRAGMA, statement.describe(), List.of());
    }

    private void toggleBridge(boolean enabled) {
        if (enabled && options.nlpBridge() == null) {
            throw new UnknownReferenceException("nlp-bridge", "Nessun bridge NLP configurato");
        }
        bridgeEnabled = enabled;
        LOGGER.info("Bridge NLP " + (enabled ? "attivato" : "disattivato"));
    }

    private void useFrameworks(List<String> ids) {
        activeFrameworks = compatibleFrameworks(ids);
        LOGGER.info("Framework attivi: " + frameworkIds());
    }

    /**
     * Risolve gli identificatori e verifica la compatibilità a coppie, sia
     * all'avvio sia per {@code USING FRAMEWORK}.
     */
    private List<Framework> compatibleFrameworks(List<String> ids) {
        List<Framework> requested = new ArrayList<>();
        for (String id : ids) {
            requested.add(frameworks.require(id));
        }
        for (int i = 0; i < requested.size(); i++) {
            for (int j = i + 1; j < requested.size(); j++) {
                Framework a = requested.get(i);
                Framework b = requested.get(j);
                if (!engine.isCompatible(a, b)) {
                    throw new FrameworkIncompatibleException("Framework incompatibili: " + a.id() + ", " + b.id(),
                            List.of(a.id() + " impone " + a.laws() + ", " + b.id() + " rifiuta " + b.rejectedLaws()));
                }
            }
        }
        return List.copyOf(requested);
    }

    private void selectFramework(Proposition target) {
        FrameworkRequirement requirement = requirementOf(target);
        Selection selection = selector.select(requirement);
        if (selection.isNone()) {
            List<String> ranking = new ArrayList<>();
            for (FrameworkSuggestion suggestion : selection.ranking()) {
                ranking.add(suggestion.toString());
            }
            throw new FrameworkIncompatibleException("Nessun framework compatibile con " + requirement, ranking);
        }
        activeFrameworks = List.of(selection.require());
        LOGGER.info("Framework selezionato: " + selection.require().id() + " (punteggio " + selection.score() + ")");
    }

    /**
     * Requisiti dichiarati sugli atomi (tag REQUIREMENT) uniti a quelli dedotti dagli operatori.
     */
    static FrameworkRequirement requirementOf(Proposition proposition) {
        List<String> declared = new ArrayList<>();
        for (Proposition atom : proposition.atoms()) {
            if (atom instanceof AtomicProposition) {
                declared.addAll(((AtomicProposition) atom).tags().requirements());
            }
        }
        return FrameworkRequirement.fromTags(declared).union(FrameworkRequirement.inferredFrom(proposition));
    }

    //endregion

    //region ACCESSORS

    public ExecutionState state() {
        return state;
    }

    public List<Framework> activeFrameworks() {
        return activeFrameworks;
    }

    public List<String> frameworkIds() {
        List<String> ids = new ArrayList<>();
        for (Framework framework : activeFrameworks) {
            ids.add(framework.id());
        }
        return ids;
    }

    public Set<Proposition> facts() {
        return Collections.unmodifiableSet(facts);
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public boolean isBridgeEnabled() {
        return bridgeEnabled;
    }

    public ProofOutcome lastProof() {
        return lastProof;
    }

    public ExecutionStatistics statistics() {
        return statistics;
    }

    //endregion
}

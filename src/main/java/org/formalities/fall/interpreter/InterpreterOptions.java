package org.formalities.fall.interpreter;

import org.formalities.bridge.ExternalValidator;
import org.formalities.bridge.NlpBridge;
import org.formalities.framework.FrameworkRegistry;
import org.formalities.framework.StandardFrameworks;
import org.formalities.framework.SyntacticStrategy;

import java.time.Duration;
import java.util.List;

/**
 * OPZIONI INTERPRETE - Configurazione immutabile di una sessione FALL
 *
 * DEFAULT:
 * - timeout collaboratori: 10 secondi
 * - framework iniziale: classical
 * - equivalenza semantica sul goal e nelle QUERY: attiva
 * - profondità massima delle proposizioni: 64
 * - nessun bridge NLP e nessun validatore esterno
 */
public final class InterpreterOptions {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration collaboratorTimeout;
    private final List<String> initialFrameworks;
    private final boolean equivalenceMatching;
    private final int maxDepth;
    private final FrameworkRegistry frameworks;
    private final NlpBridge nlpBridge;
    private final ExternalValidator externalValidator;

    private InterpreterOptions(Builder builder) {
        this.collaboratorTimeout = builder.collaboratorTimeout;
        this.initialFrameworks = List.copyOf(builder.initialFrameworks);
        this.equivalenceMatching = builder.equivalenceMatching;
        this.maxDepth = builder.maxDepth;
        this.frameworks = builder.frameworks;
        this.nlpBridge = builder.nlpBridge;
        this.externalValidator = builder.externalValidator;
    }

    public static InterpreterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration collaboratorTimeout() {
        return collaboratorTimeout;
    }

    public List<String> initialFrameworks() {
        return initialFrameworks;
    }

    public boolean equivalenceMatching() {
        return equivalenceMatching;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public FrameworkRegistry frameworks() {
        return frameworks;
    }

    /** Bridge NLP configurato, oppure null */
    public NlpBridge nlpBridge() {
        return nlpBridge;
    }

    /** Validatore esterno configurato, oppure null */
    public ExternalValidator externalValidator() {
        return externalValidator;
    }

    @Override
    public String toString() {
        return "InterpreterOptions{timeout=" + collaboratorTimeout.toMillis() + "ms, frameworks=" + initialFrameworks
                + ", equivalence=" + equivalenceMatching + ", maxDepth=" + maxDepth
                + ", nlp=" + (nlpBridge != null ? nlpBridge.name() : "-")
                + ", external=" + (externalValidator != null ? externalValidator.name() : "-") + "}";
    }

    public static final class Builder {

        private Duration collaboratorTimeout = DEFAULT_TIMEOUT;
        private List<String> initialFrameworks = List.of(StandardFrameworks.CLASSICAL);
        private boolean equivalenceMatching = true;
        private int maxDepth = SyntacticStrategy.DEFAULT_MAX_DEPTH;
        private FrameworkRegistry frameworks;
        private NlpBridge nlpBridge;
        private ExternalValidator externalValidator;

        private Builder() {
        }

        public Builder collaboratorTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout deve essere positivo: " + timeout);
            }
            this.collaboratorTimeout = timeout;
            return this;
        }

        public Builder initialFrameworks(String... ids) {
            if (ids.length == 0) {
                throw new IllegalArgumentException("Serve almeno un framework iniziale");
            }
            this.initialFrameworks = List.of(ids);
            return this;
        }

        public Builder equivalenceMatching(boolean enabled) {
            this.equivalenceMatching = enabled;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("Profondità massima deve essere >= 1: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder frameworks(FrameworkRegistry registry) {
            this.frameworks = registry;
            return this;
        }

        public Builder nlpBridge(NlpBridge bridge) {
            this.nlpBridge = bridge;
            return this;
        }

        public Builder externalValidator(ExternalValidator validator) {
            this.externalValidator = validator;
            return this;
        }

        public InterpreterOptions build() {
            if (frameworks == null) {
                frameworks = StandardFrameworks.registry();
            }
            for (String id : initialFrameworks) {
                frameworks.require(id);
            }
            return new InterpreterOptions(this);
        }
    }
}

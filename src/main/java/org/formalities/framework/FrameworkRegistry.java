package org.formalities.framework;

import org.formalities.error.UnknownReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tabella esplicita dei framework, costruita una volta e poi in sola lettura.
 * L'iterazione segue l'ordine lessicale degli identificatori.
 */
public final class FrameworkRegistry {

    private final Map<String, Framework> frameworks;

    private FrameworkRegistry(Map<String, Framework> frameworks) {
        this.frameworks = Collections.unmodifiableMap(new TreeMap<>(frameworks));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnknownReferenceException se l'identificatore non è registrato
     */
    public Framework require(String id) {
        Framework framework = frameworks.get(id);
        if (framework == null) {
            throw new UnknownReferenceException(id, "Framework non registrato: " + id
                    + " (disponibili: " + frameworks.keySet() + ")");
        }
        return framework;
    }

    public Optional<Framework> find(String id) {
        return Optional.ofNullable(frameworks.get(id));
    }

    public List<Framework> all() {
        return new ArrayList<>(frameworks.values());
    }

    public int size() {
        return frameworks.size();
    }

    public static final class Builder {

        private final Map<String, Framework> frameworks = new TreeMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException se l'identificatore è già registrato
         */
        public Builder register(Framework framework) {
            if (framework == null) {
                throw new IllegalArgumentException("Framework non può essere null");
            }
            if (frameworks.containsKey(framework.id())) {
                throw new IllegalArgumentException("Framework già registrato: " + framework.id());
            }
            frameworks.put(framework.id(), framework);
            return this;
        }

        public FrameworkRegistry build() {
            return new FrameworkRegistry(frameworks);
        }
    }
}

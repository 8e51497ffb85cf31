package org.formalities.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * INSIEME DI TAG STRUTTURALI - Struttura grammaticale di una proposizione in linguaggio naturale
 *
 * Prodotto dal bridge NLP oppure dichiarato esplicitamente nella clausola WHERE.
 *
 * RUOLI:
 * - SUBJECT, PREDICATE, COPULA, QUANTIFIER: al più un frammento per ruolo,
 *   ciascuno con una categoria grammaticale opzionale (NOUN, VERB, ...)
 * - REQUIREMENT: requisiti dichiarati per la selezione del framework (ripetibile)
 */
public final class TagSet {

    public static final String SUBJECT = "SUBJECT";
    public static final String PREDICATE = "PREDICATE";
    public static final String COPULA = "COPULA";
    public static final String QUANTIFIER = "QUANTIFIER";
    public static final String REQUIREMENT = "REQUIREMENT";

    private static final TagSet EMPTY = new TagSet(Map.of(), List.of());

    private final Map<String, Tag> roles;
    private final List<String> requirements;

    private TagSet(Map<String, Tag> roles, List<String> requirements) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.requirements = List.copyOf(requirements);
    }

    public static TagSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Tag> role(String role) {
        return Optional.ofNullable(roles.get(role));
    }

    public Optional<String> subject() {
        return role(SUBJECT).map(Tag::phrase);
    }

    public Optional<String> predicate() {
        return role(PREDICATE).map(Tag::phrase);
    }

    public Optional<String> copula() {
        return role(COPULA).map(Tag::phrase);
    }

    public Optional<String> quantifier() {
        return role(QUANTIFIER).map(Tag::phrase);
    }

    public Map<String, Tag> roles() {
        return roles;
    }

    public List<String> requirements() {
        return requirements;
    }

    public boolean isEmpty() {
        return roles.isEmpty() && requirements.isEmpty();
    }

    /**
     * Unisce due insiemi; in caso di ruolo ripetuto prevale {@code override}.
     */
    public TagSet mergedWith(TagSet override) {
        Builder builder = builder();
        roles.forEach((role, tag) -> builder.tag(role, tag.phrase(), tag.category()));
        override.roles.forEach((role, tag) -> builder.tag(role, tag.phrase(), tag.category()));
        requirements.forEach(builder::requirement);
        override.requirements.stream().filter(r -> !requirements.contains(r)).forEach(builder::requirement);
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagSet)) return false;
        TagSet other = (TagSet) o;
        return roles.equals(other.roles) && requirements.equals(other.requirements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roles, requirements);
    }

    @Override
    public String toString() {
        return "TagSet" + roles + (requirements.isEmpty() ? "" : " requisiti=" + requirements);
    }

    /**
     * Frammento di testo con categoria grammaticale opzionale.
     */
    public static final class Tag {

        private final String phrase;
        private final String category;

        public Tag(String phrase, String category) {
            if (phrase == null || phrase.isBlank()) {
                throw new IllegalArgumentException("Frammento del tag non può essere vuoto");
            }
            this.phrase = phrase;
            this.category = category;
        }

        public String phrase() {
            return phrase;
        }

        /** @return categoria grammaticale, null se non dichiarata */
        public String category() {
            return category;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Tag)) return false;
            Tag other = (Tag) o;
            return phrase.equals(other.phrase) && Objects.equals(category, other.category);
        }

        @Override
        public int hashCode() {
            return Objects.hash(phrase, category);
        }

        @Override
        public String toString() {
            return category != null ? phrase + ":" + category : phrase;
        }
    }

    public static final class Builder {

        private final Map<String, Tag> roles = new LinkedHashMap<>();
        private final List<String> requirements = new ArrayList<>();

        private Builder() {
        }

        public Builder tag(String role, String phrase, String category) {
            if (REQUIREMENT.equals(role)) {
                return requirement(phrase);
            }
            roles.put(role, new Tag(phrase, category));
            return this;
        }

        public Builder requirement(String requirement) {
            requirements.add(requirement);
            return this;
        }

        public TagSet build() {
            return new TagSet(roles, requirements);
        }
    }
}

package org.kifexport.tool.ontology;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Interning table of the concepts of one run, plus the implication rules found
 * while evaluating it. Nothing is ever removed: concepts, attributes and rules
 * only accumulate.
 * <p>
 * {@link #createOrGet(String)} is a check then act operation so the store
 * must only ever be written from one thread.
 */
@NotThreadSafe
public class OntologyStore {
    private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

    private final Map<String, Concept> concepts = new LinkedHashMap<>();
    /**
     * Subjects carrying at least one value under each label.
     */
    private final SetMultimap<Concept, Concept> subjectsByLabel = LinkedHashMultimap.create();
    private final List<ImplicationRule> rules = new ArrayList<>();
    private int attributeCount;

    /**
     * The interning key of a name: surrounding whitespace dropped, inner runs
     * of whitespace collapsed to a single space except inside double quoted
     * strings, which are kept verbatim.
     */
    public static String normalize(String name) {
        StringBuilder b = new StringBuilder(name.length());
        boolean quoted = false;
        boolean space = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (quoted) {
                b.append(c);
                if (c == '\\' && i + 1 < name.length()) {
                    b.append(name.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (WHITESPACE.matches(c)) {
                space = b.length() > 0;
            } else {
                if (space) {
                    b.append(' ');
                    space = false;
                }
                b.append(c);
                quoted = c == '"';
            }
        }
        return b.toString();
    }

    /**
     * The concept named {@code name}, created on first use. Later calls with
     * the same normalized name return the very same instance.
     */
    public Concept createOrGet(String name) {
        String normalized = normalize(checkNotNull(name, "name"));
        checkArgument(!normalized.isEmpty(), "Concept names can't be blank");
        return concepts.computeIfAbsent(normalized, Concept::new);
    }

    public Optional<Concept> find(String name) {
        return Optional.ofNullable(concepts.get(normalize(name)));
    }

    /**
     * Record {@code subject --label--> value} unless it is already there.
     *
     * @return whether the attribute was added
     */
    public boolean addAttribute(Concept subject, Concept label, Concept value) {
        checkOwned(subject);
        checkOwned(label);
        checkOwned(value);
        if (!subject.add(label, value)) {
            return false;
        }
        subjectsByLabel.put(label, subject);
        attributeCount++;
        return true;
    }

    public boolean addAttribute(Relation relation) {
        return addAttribute(relation.getSubject(), relation.getLabel(), relation.getObject());
    }

    private void checkOwned(Concept concept) {
        checkArgument(concepts.get(concept.getName()) == concept, "%s belongs to another store", concept);
    }

    /**
     * Subjects with at least one value under {@code label}, in the order they
     * first got one.
     */
    public Set<Concept> subjectsWith(Concept label) {
        return Collections.unmodifiableSet(subjectsByLabel.get(label));
    }

    /**
     * Concepts used as a label at least once.
     */
    public Set<Concept> labels() {
        return Collections.unmodifiableSet(subjectsByLabel.keySet());
    }

    /**
     * All concepts in creation order.
     */
    public Collection<Concept> concepts() {
        return Collections.unmodifiableCollection(concepts.values());
    }

    public int size() {
        return concepts.size();
    }

    public int attributeCount() {
        return attributeCount;
    }

    /**
     * Every attribute edge, subjects in creation order and then labels and
     * values in insertion order.
     */
    public List<Relation> relations() {
        ImmutableList.Builder<Relation> relations = ImmutableList.builder();
        for (Concept subject : concepts.values()) {
            subject.getAttributes().forEach((label, values) -> {
                for (Concept value : values) {
                    relations.add(new Relation(subject, label, value));
                }
            });
        }
        return relations.build();
    }

    public void addRule(ImplicationRule rule) {
        rules.add(checkNotNull(rule));
    }

    public List<ImplicationRule> rules() {
        return Collections.unmodifiableList(rules);
    }
}

package org.kifexport.tool.eval;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import lombok.Value;

/**
 * Maps a relation instance {@code (R a1 ... an)} onto attribute edges.
 * <p>
 * By default {@code a1} is the subject and every other argument becomes a
 * value under label {@code R}, in argument order. Implicit subject predicates
 * take their subject from another position. Binary symmetric predicates
 * produce the reverse edge too. Unary relations produce no edge. Two forms get
 * dedicated edges:
 * <ul>
 * <li>{@code (domain R N C)}: {@code R --"domain #N"--> C}
 * <li>{@code (documentation X L "text")}: {@code X --documentation--> "text"}
 * </ul>
 */
public final class PredicateConventions {
    public static final ImmutableSet<String> DEFAULT_SYMMETRIC = ImmutableSet.of(
            "equal", "disjoint", "connected", "inverse", "overlapsSpatially", "meetsSpatially", "sibling", "relative");
    /**
     * 1-based argument position of the subject.
     */
    public static final ImmutableMap<String, Integer> DEFAULT_SUBJECT_POSITIONS = ImmutableMap.of(
            "termFormat", 2,
            "format", 2);

    private static final String DOMAIN = "domain";
    private static final String DOCUMENTATION = "documentation";
    private static final Pattern POSITIVE_INTEGER = Pattern.compile("0*[1-9]\\d*");

    private final ImmutableSet<String> symmetric;
    private final ImmutableMap<String, Integer> subjectPositions;

    public PredicateConventions(Set<String> symmetric, Map<String, Integer> subjectPositions) {
        for (Map.Entry<String, Integer> position : subjectPositions.entrySet()) {
            checkArgument(position.getValue() > 0, "Subject position of %s must be positive", position.getKey());
        }
        this.symmetric = ImmutableSet.copyOf(symmetric);
        this.subjectPositions = ImmutableMap.copyOf(subjectPositions);
    }

    public static PredicateConventions defaults() {
        return new PredicateConventions(DEFAULT_SYMMETRIC, DEFAULT_SUBJECT_POSITIONS);
    }

    /**
     * Edges asserted by a relation form.
     *
     * @throws SemanticException if a dedicated form has the wrong shape
     */
    public List<Edge> edges(KifForm relation) {
        checkArgument(relation.getKind() == KifForm.Kind.RELATION, "%s is not a relation", relation);
        String head = relation.head().getText();
        List<KifForm> arguments = relation.arguments();
        int arity = arguments.size();
        if (head.equals(DOMAIN)) {
            return domainEdges(relation, arguments);
        }
        if (head.equals(DOCUMENTATION)) {
            return documentationEdges(relation, arguments);
        }
        if (arity < 2) {
            return ImmutableList.of();
        }
        int subject = subjectPositions.getOrDefault(head, 1);
        if (subject > arity) {
            throw new SemanticException(head + " takes its subject from argument " + subject
                    + " but has " + arity + " arguments: " + relation, relation.getOffset());
        }
        ImmutableList.Builder<Edge> edges = ImmutableList.builder();
        for (int i = 1; i <= arity; i++) {
            if (i != subject) {
                edges.add(new Edge(subject, null, i));
            }
        }
        if (arity == 2 && symmetric.contains(head)) {
            edges.add(new Edge(3 - subject, null, subject));
        }
        return edges.build();
    }

    private static List<Edge> domainEdges(KifForm relation, List<KifForm> arguments) {
        if (arguments.size() != 3) {
            throw new SemanticException("domain takes 3 arguments: " + relation, relation.getOffset());
        }
        KifForm position = arguments.get(1);
        if (position.getKind() != KifForm.Kind.NUMBER || !POSITIVE_INTEGER.matcher(position.getText()).matches()) {
            throw new SemanticException("domain needs a positive argument number, not " + position, position.getOffset());
        }
        return ImmutableList.of(new Edge(1, "domain #" + position.getText().replaceFirst("^0+", ""), 3));
    }

    private static List<Edge> documentationEdges(KifForm relation, List<KifForm> arguments) {
        if (arguments.size() != 3) {
            throw new SemanticException("documentation takes 3 arguments: " + relation, relation.getOffset());
        }
        KifForm text = arguments.get(2);
        if (text.getKind() != KifForm.Kind.STRING) {
            throw new SemanticException("documentation needs a string, not " + text, text.getOffset());
        }
        return ImmutableList.of(new Edge(1, null, 3));
    }

    public Set<String> getSymmetric() {
        return symmetric;
    }

    public Map<String, Integer> getSubjectPositions() {
        return subjectPositions;
    }

    /**
     * An edge between two arguments of a relation form, by 1-based argument
     * position.
     */
    @Value
    public static class Edge {
        int subject;
        /**
         * Name of the label concept, null for the head of the relation.
         */
        @Nullable
        String label;
        int object;
    }
}

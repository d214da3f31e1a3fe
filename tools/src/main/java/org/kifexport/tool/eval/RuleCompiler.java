package org.kifexport.tool.eval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.kifexport.tool.ontology.Concept;
import org.kifexport.tool.ontology.ImplicationRule;
import org.kifexport.tool.ontology.OntologyStore;
import org.kifexport.tool.ontology.PatternTerm;
import org.kifexport.tool.ontology.TriplePattern;

import com.google.common.collect.ImmutableList;

/**
 * Compiles the two sides of an implication into an {@link ImplicationRule}.
 * <p>
 * The premise is put in disjunctive normal form: {@code or} splits it into
 * alternatives, {@code and} and {@code exists} conjoin. The conclusion must be
 * a relation or a conjunction of relations whose variables are bound by every
 * alternative of the premise. Anything else can't be applied by adding
 * attributes and is rejected.
 */
public class RuleCompiler {
    /**
     * Bound on the alternatives of one premise, conjunctions of disjunctions
     * multiply them.
     */
    public static final int MAX_ALTERNATIVES = 64;

    private final OntologyStore store;
    private final PredicateConventions conventions;

    public RuleCompiler(OntologyStore store, PredicateConventions conventions) {
        this.store = store;
        this.conventions = conventions;
    }

    /**
     * Compile {@code premise => conclusion}.
     *
     * @param concepts the concepts sub forms were interned to, compound forms
     *      the rule points at are added to it
     * @throws UnsupportedRuleException if the implication can't be a monotone
     *      rule
     */
    public ImplicationRule compile(int id, KifForm premise, KifForm conclusion, Map<KifForm, Concept> concepts) {
        List<List<TriplePattern>> antecedent = antecedent(premise, concepts);
        List<TriplePattern> consequent = consequent(conclusion, concepts);
        Set<String> needed = new LinkedHashSet<>();
        for (TriplePattern pattern : consequent) {
            needed.addAll(pattern.variables());
        }
        for (List<TriplePattern> alternative : antecedent) {
            Set<String> bound = new LinkedHashSet<>();
            for (TriplePattern pattern : alternative) {
                bound.addAll(pattern.variables());
            }
            for (String variable : needed) {
                if (!bound.contains(variable)) {
                    throw new UnsupportedRuleException("Variable " + variable + " of " + conclusion
                            + " is not bound by every alternative of " + premise);
                }
            }
        }
        ImmutableList.Builder<ImmutableList<TriplePattern>> alternatives = ImmutableList.builder();
        for (List<TriplePattern> alternative : antecedent) {
            alternatives.add(ImmutableList.copyOf(alternative));
        }
        return new ImplicationRule(id, alternatives.build(), ImmutableList.copyOf(consequent),
                concept(premise, concepts), concept(conclusion, concepts));
    }

    private List<List<TriplePattern>> antecedent(KifForm premise, Map<KifForm, Concept> concepts) {
        Map<KifForm, List<List<TriplePattern>>> alternatives = new HashMap<>();
        FormWalker.<Boolean, UnsupportedRuleException>postOrder(premise, Boolean.TRUE, RuleCompiler::skipArguments, (form, ignored) -> {
            switch (form.getKind()) {
                case RELATION:
                    List<TriplePattern> patterns = patterns(form, concepts);
                    if (patterns.isEmpty()) {
                        throw new UnsupportedRuleException("No attribute can match " + form);
                    }
                    List<List<TriplePattern>> single = new ArrayList<>();
                    single.add(patterns);
                    alternatives.put(form, single);
                    break;
                case AND:
                    List<List<TriplePattern>> product = new ArrayList<>();
                    product.add(new ArrayList<>());
                    for (KifForm conjunct : form.getChildren()) {
                        List<List<TriplePattern>> next = new ArrayList<>();
                        for (List<TriplePattern> left : product) {
                            for (List<TriplePattern> right : alternatives.remove(conjunct)) {
                                List<TriplePattern> joined = new ArrayList<>(left);
                                joined.addAll(right);
                                next.add(joined);
                            }
                        }
                        checkAlternatives(next.size(), premise);
                        product = next;
                    }
                    alternatives.put(form, product);
                    break;
                case OR:
                    List<List<TriplePattern>> union = new ArrayList<>();
                    for (KifForm disjunct : form.getChildren()) {
                        union.addAll(alternatives.remove(disjunct));
                    }
                    checkAlternatives(union.size(), premise);
                    alternatives.put(form, union);
                    break;
                case EXISTS:
                    alternatives.put(form, alternatives.remove(form.body()));
                    break;
                case WORD:
                case VARIABLE:
                case STRING:
                case NUMBER:
                    break;
                default:
                    throw new UnsupportedRuleException("Can't match " + form.getKind().keyword() + " in the premise " + premise);
            }
        });
        return alternatives.get(premise);
    }

    private List<TriplePattern> consequent(KifForm conclusion, Map<KifForm, Concept> concepts) {
        Map<KifForm, List<TriplePattern>> triples = new HashMap<>();
        FormWalker.<Boolean, UnsupportedRuleException>postOrder(conclusion, Boolean.TRUE, RuleCompiler::skipArguments, (form, ignored) -> {
            switch (form.getKind()) {
                case RELATION:
                    triples.put(form, patterns(form, concepts));
                    break;
                case AND:
                    List<TriplePattern> all = new ArrayList<>();
                    for (KifForm conjunct : form.getChildren()) {
                        all.addAll(triples.remove(conjunct));
                    }
                    triples.put(form, all);
                    break;
                case WORD:
                case VARIABLE:
                case STRING:
                case NUMBER:
                    break;
                default:
                    throw new UnsupportedRuleException("Can't conclude " + form.getKind().keyword() + " in " + conclusion);
            }
        });
        List<TriplePattern> consequent = triples.get(conclusion);
        if (consequent.isEmpty()) {
            throw new UnsupportedRuleException("The conclusion " + conclusion + " asserts no attribute");
        }
        return consequent;
    }

    /**
     * Arguments of a relation are terms, not formulas to compile.
     */
    private static Boolean skipArguments(KifForm parent, Boolean context, int index) {
        return parent.getKind() == KifForm.Kind.RELATION ? null : context;
    }

    private static void checkAlternatives(int count, KifForm premise) {
        if (count > MAX_ALTERNATIVES) {
            throw new UnsupportedRuleException("The premise " + premise + " has more than "
                    + MAX_ALTERNATIVES + " alternatives");
        }
    }

    private List<TriplePattern> patterns(KifForm relation, Map<KifForm, Concept> concepts) {
        List<PredicateConventions.Edge> edges;
        try {
            edges = conventions.edges(relation);
        } catch (SemanticException e) {
            throw new UnsupportedRuleException(e.getMessage(), e);
        }
        List<TriplePattern> patterns = new ArrayList<>(edges.size());
        for (PredicateConventions.Edge edge : edges) {
            PatternTerm label = edge.getLabel() == null
                    ? term(relation.head(), concepts)
                    : PatternTerm.of(store.createOrGet(edge.getLabel()));
            patterns.add(new TriplePattern(
                    term(relation.child(edge.getSubject()), concepts),
                    label,
                    term(relation.child(edge.getObject()), concepts)));
        }
        return patterns;
    }

    private PatternTerm term(KifForm form, Map<KifForm, Concept> concepts) {
        if (form.getKind() == KifForm.Kind.VARIABLE) {
            return PatternTerm.variable(form.getText());
        }
        if (!form.isGround()) {
            throw new UnsupportedRuleException("Can't match inside the term " + form);
        }
        return PatternTerm.of(concept(form, concepts));
    }

    private Concept concept(KifForm form, Map<KifForm, Concept> concepts) {
        return concepts.computeIfAbsent(form, f -> store.createOrGet(f.getText()));
    }
}

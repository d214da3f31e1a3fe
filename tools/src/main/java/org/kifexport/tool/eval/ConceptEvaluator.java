package org.kifexport.tool.eval;

import static org.kifexport.common.Diagnostic.Kind.RULE_SKIPPED;
import static org.kifexport.common.Diagnostic.Kind.SEMANTIC_ERROR;
import static org.kifexport.parser.grammar.KifGrammar.DOCUMENT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.kifexport.common.Diagnostics;
import org.kifexport.common.LoggingNames;
import org.kifexport.parser.Constituent;
import org.kifexport.parser.ParseForest;
import org.kifexport.tool.ontology.Concept;
import org.kifexport.tool.ontology.OntologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.google.common.collect.Sets;

import lombok.Value;

/**
 * Turns parsed formulas into concepts and attributes of an
 * {@link OntologyStore}.
 * <p>
 * Every atom is interned. Compound forms are interned under their canonical
 * text when something points at them: the top level formula itself, the
 * terms of its asserted attributes, and the two sides of its rules. Relation
 * instances only become
 * attributes when they are asserted: at top level, as conjuncts of an
 * asserted {@code and}, or as the body of an asserted {@code forall}; and only
 * when they contain no variable. Asserted implications register rules.
 * <p>
 * A formula is checked in full before the store is touched, so a formula
 * rejected with a {@link SemanticException} leaves no trace.
 */
public class ConceptEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConceptEvaluator.class);

    private final OntologyStore store;
    private final PredicateConventions conventions;
    private final RuleCompiler compiler;
    private final Diagnostics diagnostics;

    public ConceptEvaluator(OntologyStore store, PredicateConventions conventions, Diagnostics diagnostics) {
        this.store = store;
        this.conventions = conventions;
        this.compiler = new RuleCompiler(store, conventions);
        this.diagnostics = diagnostics;
    }

    /**
     * Evaluate every top level formula under the canonical root, in document
     * order. Formulas failing with a {@link SemanticException} are reported
     * and left out of the result.
     */
    public List<Expression> evaluateDocument(ParseForest forest, @Nullable Constituent root) {
        FormBuilder builder = new FormBuilder(forest);
        List<Expression> expressions = new ArrayList<>();
        int index = 0;
        for (Constituent item : topLevel(forest, root)) {
            index++;
            try (MDC.MDCCloseable expression = MDC.putCloseable(LoggingNames.EXPRESSION_ID, Integer.toString(index))) {
                Concept concept = evaluate(builder.build(item));
                expressions.add(new Expression(index, forest.text(item), concept, forest.offset(item)));
            } catch (SemanticException e) {
                log.debug("Skipping expression {}", index, e);
                diagnostics.report(SEMANTIC_ERROR, e.getOffset(), e.getMessage());
            }
        }
        log.debug("Evaluated {} of {} expressions into {} concepts", expressions.size(), index, store.size());
        return expressions;
    }

    /**
     * Evaluate one formula of the forest.
     *
     * @throws SemanticException if the constituent can't be evaluated
     */
    public Concept evaluate(ParseForest forest, Constituent constituent) {
        return evaluate(new FormBuilder(forest).build(constituent));
    }

    /**
     * Evaluate a form, returning the concept it is interned to.
     *
     * @throws SemanticException if the form can't be evaluated
     */
    public Concept evaluate(KifForm form) {
        Plan plan = plan(form);
        Set<KifForm> named = Sets.newIdentityHashSet();
        named.add(form);
        for (Assertion assertion : plan.assertions) {
            for (PredicateConventions.Edge edge : assertion.getEdges()) {
                named.add(assertion.getRelation().child(edge.getSubject()));
                named.add(assertion.getRelation().child(edge.getObject()));
            }
        }
        Map<KifForm, Concept> concepts = intern(form, named);
        for (Assertion assertion : plan.assertions) {
            KifForm relation = assertion.getRelation();
            for (PredicateConventions.Edge edge : assertion.getEdges()) {
                Concept label = edge.getLabel() == null
                        ? concepts.get(relation.head())
                        : store.createOrGet(edge.getLabel());
                store.addAttribute(
                        concepts.get(relation.child(edge.getSubject())),
                        label,
                        concepts.get(relation.child(edge.getObject())));
            }
        }
        for (KifForm implication : plan.implications) {
            register(implication, concepts);
        }
        return concepts.get(form);
    }

    /**
     * Find what {@code form} asserts, validating it on the way.
     */
    private Plan plan(KifForm form) {
        Plan plan = new Plan();
        FormWalker.<Boolean, SemanticException>postOrder(form, Boolean.TRUE, ConceptEvaluator::assertedChild, (f, asserted) -> {
            if (f.getKind() == KifForm.Kind.RELATION && f.isGround()) {
                plan.assertions.add(new Assertion(f, conventions.edges(f)));
            } else if (f.getKind() == KifForm.Kind.IMPLIES || f.getKind() == KifForm.Kind.IFF) {
                plan.implications.add(f);
            }
        });
        return plan;
    }

    /**
     * Only asserted children are visited while planning.
     */
    @Nullable
    private static Boolean assertedChild(KifForm parent, Boolean asserted, int index) {
        switch (parent.getKind()) {
            case AND:
                return asserted;
            case FORALL:
                return index == parent.getChildren().size() - 1 ? asserted : null;
            default:
                return null;
        }
    }

    /**
     * Intern every atom of {@code form} and the compound forms in
     * {@code named}, children first.
     */
    private Map<KifForm, Concept> intern(KifForm form, Set<KifForm> named) {
        Map<KifForm, Concept> concepts = new HashMap<>();
        FormWalker.<Boolean, RuntimeException>postOrder(form, Boolean.TRUE, (parent, context, index) -> context,
                (f, context) -> {
                    if (f.isAtom() || named.contains(f)) {
                        concepts.put(f, store.createOrGet(f.getText()));
                    }
                });
        return concepts;
    }

    private void register(KifForm implication, Map<KifForm, Concept> concepts) {
        addRule(implication.child(0), implication.child(1), implication, concepts);
        if (implication.getKind() == KifForm.Kind.IFF) {
            addRule(implication.child(1), implication.child(0), implication, concepts);
        }
    }

    private void addRule(KifForm premise, KifForm conclusion, KifForm implication, Map<KifForm, Concept> concepts) {
        try {
            store.addRule(compiler.compile(store.rules().size() + 1, premise, conclusion, concepts));
        } catch (UnsupportedRuleException e) {
            log.debug("Not registering {} => {}", premise, conclusion, e);
            diagnostics.report(RULE_SKIPPED, implication.getOffset(), e.getMessage());
        }
    }

    /**
     * Top level formulas under the root: the items of a document, or the root
     * itself.
     */
    private static List<Constituent> topLevel(ParseForest forest, @Nullable Constituent root) {
        if (root == null) {
            return Collections.emptyList();
        }
        List<Constituent> items = new ArrayList<>();
        if (!root.getCategory().equals(DOCUMENT)) {
            items.add(root);
            return items;
        }
        // Document := Formula | Document Formula
        Constituent current = root;
        while (true) {
            List<Constituent> children = forest.children(current);
            items.add(children.get(children.size() - 1));
            if (children.size() == 1) {
                break;
            }
            current = children.get(0);
        }
        Collections.reverse(items);
        return items;
    }

    private static final class Plan {
        private final List<Assertion> assertions = new ArrayList<>();
        private final List<KifForm> implications = new ArrayList<>();
    }

    @Value
    private static class Assertion {
        KifForm relation;
        List<PredicateConventions.Edge> edges;
    }
}

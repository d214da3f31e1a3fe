package org.kifexport.tool;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.kifexport.common.Diagnostics;
import org.kifexport.parser.AmbiguityResolver;
import org.kifexport.parser.ChartParser;
import org.kifexport.parser.Lexer;
import org.kifexport.parser.ParseForest;
import org.kifexport.parser.Resolution;
import org.kifexport.parser.grammar.KifGrammar;
import org.kifexport.tool.eval.ConceptEvaluator;
import org.kifexport.tool.eval.Expression;
import org.kifexport.tool.eval.PredicateConventions;
import org.kifexport.tool.ontology.Concept;
import org.kifexport.tool.ontology.OntologyStore;
import org.kifexport.tool.ontology.Relation;

/**
 * Evaluates SUO-KIF text into a store for tests that start from an ontology.
 */
public final class OntologyLoader {
    private OntologyLoader() {
        // Uncallable utility constructor
    }

    public static List<Expression> load(String text, OntologyStore store, Diagnostics diagnostics) {
        return load(text, store, PredicateConventions.defaults(), diagnostics);
    }

    public static List<Expression> load(String text, OntologyStore store, PredicateConventions conventions,
            Diagnostics diagnostics) {
        ParseForest forest = new ChartParser(KifGrammar.grammar()).parse(text, Lexer.tokenize(text));
        Resolution resolution = new AmbiguityResolver().resolve(forest, diagnostics);
        return new ConceptEvaluator(store, conventions, diagnostics).evaluateDocument(forest, resolution.root().orElse(null));
    }

    /**
     * Names of the values of {@code subject} under {@code label}.
     */
    public static List<String> values(OntologyStore store, String subject, String label) {
        Concept s = store.find(subject).orElseThrow(() -> new AssertionError("No concept " + subject));
        Concept l = store.find(label).orElseThrow(() -> new AssertionError("No concept " + label));
        return s.values(l).stream().map(Concept::getName).collect(Collectors.toList());
    }

    /**
     * Every attribute as {@code "subject label object"}.
     */
    public static Set<String> triples(OntologyStore store) {
        Set<String> triples = new LinkedHashSet<>();
        for (Relation relation : store.relations()) {
            triples.add(relation.getSubject().getName() + " " + relation.getLabel().getName() + " "
                    + relation.getObject().getName());
        }
        return triples;
    }
}

package org.kifexport.tool.inference;

import static com.google.common.base.Preconditions.checkArgument;
import static org.kifexport.common.Diagnostic.Kind.INFERENCE_NON_TERMINATION;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.kifexport.common.Diagnostics;
import org.kifexport.tool.ontology.Concept;
import org.kifexport.tool.ontology.ImplicationRule;
import org.kifexport.tool.ontology.OntologyStore;
import org.kifexport.tool.ontology.PatternTerm;
import org.kifexport.tool.ontology.Relation;
import org.kifexport.tool.ontology.TriplePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward chains the rules of a store to a fixed point.
 * <p>
 * Each pass evaluates every rule against the current attributes and adds the
 * missing conclusions; the attributes a rule derives are all collected before
 * any is added. Rules only add attributes and never create concepts, so the
 * closure is finite and does not depend on rule order. The pass bound is the
 * only guard: hitting it is reported and keeps whatever was derived.
 */
public class ImplicationEngine {
    public static final int DEFAULT_MAX_PASSES = 100;
    private static final Logger log = LoggerFactory.getLogger(ImplicationEngine.class);

    private final int maxPasses;

    public ImplicationEngine() {
        this(DEFAULT_MAX_PASSES);
    }

    public ImplicationEngine(int maxPasses) {
        checkArgument(maxPasses > 0, "maxPasses must be positive but was %s", maxPasses);
        this.maxPasses = maxPasses;
    }

    /**
     * Saturate the store.
     *
     * @return how many attributes were added
     */
    public int saturate(OntologyStore store, Diagnostics diagnostics) {
        List<ImplicationRule> rules = store.rules();
        int total = 0;
        for (int pass = 1; pass <= maxPasses; pass++) {
            int added = 0;
            for (ImplicationRule rule : rules) {
                for (Relation relation : derive(store, rule)) {
                    if (store.addAttribute(relation)) {
                        added++;
                    }
                }
            }
            total += added;
            log.debug("Inference pass {} added {} attributes", pass, added);
            if (added == 0) {
                log.info("Inference reached a fixed point after {} passes, {} attributes added", pass, total);
                return total;
            }
        }
        diagnostics.report(INFERENCE_NON_TERMINATION, "No fixed point after " + maxPasses
                + " inference passes, keeping the " + total + " attributes derived so far");
        return total;
    }

    /**
     * Every conclusion of {@code rule} under the current attributes, missing
     * or not.
     */
    Set<Relation> derive(OntologyStore store, ImplicationRule rule) {
        Set<Relation> derived = new LinkedHashSet<>();
        for (List<TriplePattern> alternative : rule.getAntecedent()) {
            for (Map<String, Concept> bindings : match(store, alternative)) {
                for (TriplePattern template : rule.getConsequent()) {
                    derived.add(new Relation(
                            template.getSubject().resolve(bindings),
                            template.getLabel().resolve(bindings),
                            template.getObject().resolve(bindings)));
                }
            }
        }
        return derived;
    }

    /**
     * All bindings satisfying every pattern, joined one pattern at a time.
     */
    List<Map<String, Concept>> match(OntologyStore store, List<TriplePattern> patterns) {
        List<Map<String, Concept>> bindings = new ArrayList<>();
        bindings.add(Collections.emptyMap());
        for (TriplePattern pattern : patterns) {
            List<Map<String, Concept>> next = new ArrayList<>();
            for (Map<String, Concept> partial : bindings) {
                extend(store, pattern, partial, next);
            }
            if (next.isEmpty()) {
                return next;
            }
            bindings = next;
        }
        return bindings;
    }

    private static void extend(OntologyStore store, TriplePattern pattern, Map<String, Concept> partial,
            List<Map<String, Concept>> out) {
        Concept subject = pattern.getSubject().resolve(partial);
        Concept label = pattern.getLabel().resolve(partial);
        Collection<Concept> labels;
        if (label != null) {
            labels = Collections.singleton(label);
        } else if (subject != null) {
            labels = subject.getAttributes().keySet();
        } else {
            labels = store.labels();
        }
        for (Concept l : labels) {
            Map<String, Concept> withLabel = bind(partial, pattern.getLabel(), l);
            if (withLabel == null) {
                continue;
            }
            Collection<Concept> subjects = subject != null
                    ? Collections.singleton(subject)
                    : store.subjectsWith(l);
            for (Concept s : subjects) {
                Map<String, Concept> withSubject = bind(withLabel, pattern.getSubject(), s);
                if (withSubject == null) {
                    continue;
                }
                for (Concept o : s.values(l)) {
                    Map<String, Concept> complete = bind(withSubject, pattern.getObject(), o);
                    if (complete != null) {
                        out.add(complete);
                    }
                }
            }
        }
    }

    /**
     * Bind {@code term} to {@code concept}.
     *
     * @return the extended bindings or null if {@code term} is bound to
     *      something else
     */
    @Nullable
    private static Map<String, Concept> bind(Map<String, Concept> bindings, PatternTerm term, Concept concept) {
        Concept current = term.resolve(bindings);
        if (current != null) {
            return current == concept ? bindings : null;
        }
        Map<String, Concept> extended = new HashMap<>(bindings);
        extended.put(term.getVariable(), concept);
        return extended;
    }
}

package org.kifexport.tool.ontology;

import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * A monotone forward chaining rule compiled from {@code =>} or {@code <=>}.
 * The antecedent is in disjunctive normal form: the rule fires for every
 * binding satisfying all patterns of at least one alternative.
 */
@Value
public class ImplicationRule {
    /**
     * Registration order, starting at 1.
     */
    int id;
    ImmutableList<ImmutableList<TriplePattern>> antecedent;
    ImmutableList<TriplePattern> consequent;
    /**
     * Formula concept of the premise side.
     */
    Concept premise;
    /**
     * Formula concept of the conclusion side.
     */
    Concept conclusion;

    @Override
    public String toString() {
        return "rule " + id + ": " + premise + " => " + conclusion;
    }
}

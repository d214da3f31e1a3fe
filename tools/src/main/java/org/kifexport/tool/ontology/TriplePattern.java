package org.kifexport.tool.ontology;

import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Value;

/**
 * A {@code subject --label--> object} edge where any position may be a
 * variable.
 */
@Value
public class TriplePattern {
    PatternTerm subject;
    PatternTerm label;
    PatternTerm object;

    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        for (PatternTerm term : new PatternTerm[] {subject, label, object}) {
            if (term.isVariable()) {
                variables.add(term.getVariable());
            }
        }
        return variables;
    }

    @Override
    public String toString() {
        return "(" + subject + " " + label + " " + object + ")";
    }
}

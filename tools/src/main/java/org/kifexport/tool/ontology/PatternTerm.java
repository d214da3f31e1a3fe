package org.kifexport.tool.ontology;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import javax.annotation.Nullable;

import lombok.Value;

/**
 * One position of a {@link TriplePattern}: either a fixed concept or a
 * variable.
 */
@Value
public class PatternTerm {
    @Nullable
    Concept concept;
    @Nullable
    String variable;

    public static PatternTerm of(Concept concept) {
        return new PatternTerm(checkNotNull(concept), null);
    }

    public static PatternTerm variable(String name) {
        return new PatternTerm(null, checkNotNull(name));
    }

    public boolean isVariable() {
        return variable != null;
    }

    /**
     * The concept this term stands for under {@code bindings}, null for an
     * unbound variable.
     */
    @Nullable
    public Concept resolve(Map<String, Concept> bindings) {
        if (variable == null) {
            return concept;
        }
        return bindings.get(variable);
    }

    @Override
    public String toString() {
        return variable == null ? concept.getName() : variable;
    }
}

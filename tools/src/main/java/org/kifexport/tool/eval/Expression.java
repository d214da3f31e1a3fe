package org.kifexport.tool.eval;

import org.kifexport.tool.ontology.Concept;

import lombok.Value;

/**
 * A top level formula of the document and the concept it evaluated to.
 */
@Value
public class Expression {
    /**
     * 1-based position among the top level formulas of the document.
     */
    int index;
    /**
     * The formula exactly as written.
     */
    String sourceText;
    Concept root;
    int offset;
}

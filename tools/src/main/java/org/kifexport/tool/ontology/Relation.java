package org.kifexport.tool.ontology;

import lombok.Value;

/**
 * One attribute edge read off a subject: {@code subject --label--> object}.
 */
@Value
public class Relation {
    Concept subject;
    Concept label;
    Concept object;

    @Override
    public String toString() {
        return subject + " --" + label + "--> " + object;
    }
}

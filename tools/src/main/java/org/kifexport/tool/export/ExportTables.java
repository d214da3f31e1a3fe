package org.kifexport.tool.export;

import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * The three exported tables, rows in discovery order.
 */
@Value
public class ExportTables {
    ImmutableList<ExpressionRow> expressions;
    ImmutableList<ConceptRow> concepts;
    ImmutableList<RelationRow> relations;

    /**
     * One top level formula.
     */
    @Value
    public static class ExpressionRow {
        int id;
        String sourceText;
        int rootConceptId;
    }

    @Value
    public static class ConceptRow {
        int id;
        String name;
    }

    /**
     * One {@code subject --label--> object} edge, by concept id.
     */
    @Value
    public static class RelationRow {
        int subjectId;
        int labelId;
        int objectId;
    }
}

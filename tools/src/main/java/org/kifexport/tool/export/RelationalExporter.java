package org.kifexport.tool.export;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.kifexport.tool.eval.Expression;
import org.kifexport.tool.export.ExportTables.ConceptRow;
import org.kifexport.tool.export.ExportTables.ExpressionRow;
import org.kifexport.tool.export.ExportTables.RelationRow;
import org.kifexport.tool.ontology.Concept;
import org.kifexport.tool.ontology.OntologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Flattens a store and its expressions into relational tables.
 * <p>
 * Ids start at 1. Expressions are numbered in document order. Concepts are
 * numbered the first time the walk meets them: concepts in creation order,
 * and for each its labels and their values in insertion order.
 */
public class RelationalExporter {
    private static final Logger log = LoggerFactory.getLogger(RelationalExporter.class);

    /**
     * Build the tables.
     *
     * @throws ExportReferentialException if a row would reference a missing
     *      id
     */
    public ExportTables export(OntologyStore store, List<Expression> expressions) {
        Map<Concept, Integer> ids = new HashMap<>();
        ImmutableList.Builder<ConceptRow> concepts = ImmutableList.builder();
        ImmutableList.Builder<RelationRow> relations = ImmutableList.builder();
        for (Concept subject : store.concepts()) {
            int subjectId = id(subject, ids, concepts);
            for (Map.Entry<Concept, List<Concept>> attribute : subject.getAttributes().entrySet()) {
                int labelId = id(attribute.getKey(), ids, concepts);
                for (Concept value : attribute.getValue()) {
                    relations.add(new RelationRow(subjectId, labelId, id(value, ids, concepts)));
                }
            }
        }
        ImmutableList.Builder<ExpressionRow> expressionRows = ImmutableList.builder();
        int expressionId = 0;
        for (Expression expression : expressions) {
            Integer root = ids.get(expression.getRoot());
            expressionRows.add(new ExpressionRow(++expressionId, expression.getSourceText(), root == null ? 0 : root));
        }
        ExportTables tables = new ExportTables(expressionRows.build(), concepts.build(), relations.build());
        validate(tables);
        log.debug("Exported {} expressions, {} concepts and {} relations",
                tables.getExpressions().size(), tables.getConcepts().size(), tables.getRelations().size());
        return tables;
    }

    private static int id(Concept concept, Map<Concept, Integer> ids, ImmutableList.Builder<ConceptRow> rows) {
        Integer id = ids.get(concept);
        if (id == null) {
            id = ids.size() + 1;
            ids.put(concept, id);
            rows.add(new ConceptRow(id, concept.getName()));
        }
        return id;
    }

    /**
     * Check that ids are unique and that every reference resolves.
     *
     * @throws ExportReferentialException on the first violation
     */
    public static void validate(ExportTables tables) {
        Set<Integer> conceptIds = new HashSet<>();
        for (ConceptRow row : tables.getConcepts()) {
            if (!conceptIds.add(row.getId())) {
                throw new ExportReferentialException("Duplicate concept id " + row.getId());
            }
        }
        for (RelationRow row : tables.getRelations()) {
            if (!conceptIds.contains(row.getSubjectId()) || !conceptIds.contains(row.getLabelId())
                    || !conceptIds.contains(row.getObjectId())) {
                throw new ExportReferentialException("Relation " + row + " references a missing concept");
            }
        }
        Set<Integer> expressionIds = new HashSet<>();
        for (ExpressionRow row : tables.getExpressions()) {
            if (!expressionIds.add(row.getId())) {
                throw new ExportReferentialException("Duplicate expression id " + row.getId());
            }
            if (!conceptIds.contains(row.getRootConceptId())) {
                throw new ExportReferentialException("Expression " + row.getId() + " references missing concept "
                        + row.getRootConceptId());
            }
        }
    }
}

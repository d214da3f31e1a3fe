package org.kifexport.tool.export;

import java.io.IOException;
import java.io.Writer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.kifexport.tool.export.ExportTables.ConceptRow;
import org.kifexport.tool.export.ExportTables.ExpressionRow;
import org.kifexport.tool.export.ExportTables.RelationRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes export tables as CSV with a header row. Cells containing commas,
 * quotes or line breaks are quoted.
 */
public class CsvTableWriter {
    public static final String EXPRESSIONS = "expressions.csv";
    public static final String CONCEPTS = "concepts.csv";
    public static final String RELATIONS = "relations.csv";

    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    private final TableSink sink;
    private final boolean expressionRoots;

    /**
     * @param expressionRoots whether the expressions table gets a
     *      {@code root_concept_id} column
     */
    public CsvTableWriter(TableSink sink, boolean expressionRoots) {
        this.sink = sink;
        this.expressionRoots = expressionRoots;
    }

    public void write(ExportTables tables) throws IOException {
        String[] expressionHeader = expressionRoots
                ? new String[] {"id", "source_text", "root_concept_id"}
                : new String[] {"id", "source_text"};
        try (CSVPrinter printer = printer(EXPRESSIONS, expressionHeader)) {
            for (ExpressionRow row : tables.getExpressions()) {
                if (expressionRoots) {
                    printer.printRecord(row.getId(), row.getSourceText(), row.getRootConceptId());
                } else {
                    printer.printRecord(row.getId(), row.getSourceText());
                }
            }
        }
        try (CSVPrinter printer = printer(CONCEPTS, "id", "name")) {
            for (ConceptRow row : tables.getConcepts()) {
                printer.printRecord(row.getId(), row.getName());
            }
        }
        try (CSVPrinter printer = printer(RELATIONS, "subject_id", "label_id", "object_id")) {
            for (RelationRow row : tables.getRelations()) {
                printer.printRecord(row.getSubjectId(), row.getLabelId(), row.getObjectId());
            }
        }
        log.info("Wrote {} expressions, {} concepts and {} relations", tables.getExpressions().size(),
                tables.getConcepts().size(), tables.getRelations().size());
    }

    private CSVPrinter printer(String table, String... header) throws IOException {
        Writer writer = sink.open(table);
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setRecordSeparator('\n')
                .build();
        return new CSVPrinter(writer, format);
    }
}

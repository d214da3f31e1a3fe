package org.kifexport.tool;

import java.util.List;

import org.kifexport.common.Diagnostic;
import org.kifexport.tool.eval.Expression;
import org.kifexport.tool.export.ExportTables;
import org.kifexport.tool.ontology.OntologyStore;

import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * Everything one run of {@link KifPipeline} produced.
 */
@Value
public class PipelineResult {
    ExportTables tables;
    ImmutableList<Diagnostic> diagnostics;
    /**
     * Attributes added by inference, 0 when it was skipped.
     */
    int inferred;
    List<Expression> expressions;
    OntologyStore store;
}

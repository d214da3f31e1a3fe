package org.kifexport.tool;

import static org.kifexport.tool.options.OptionsUtils.handleOptions;
import static org.kifexport.tool.options.OptionsUtils.pipelineFromOptions;

import java.io.IOException;
import java.io.Reader;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.kifexport.common.Diagnostics;
import org.kifexport.tool.export.CsvTableWriter;
import org.kifexport.tool.options.ExportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;

/**
 * Exports a SUO-KIF ontology as three CSV tables: expressions, concepts and
 * relations.
 */
public class KifExport {
    private static final Logger log = LoggerFactory.getLogger(KifExport.class);

    /**
     * Run an export configured from the command line.
     */
    @SuppressWarnings("IllegalCatch")
    public static void main(String[] args) {
        ExportOptions options = handleOptions(ExportOptions.class, args);
        try {
            KifPipeline pipeline = pipelineFromOptions(options);
            CsvTableWriter writer = new CsvTableWriter(CliUtils.directory(options.to()), options.expressionRoots());
            KifExport export = new KifExport(pipeline, CliUtils.reader(options.from()), writer);
            export.run();
        } catch (Exception e) {
            log.error("Fatal error exporting KIF", e);
            System.exit(1);
        }
    }

    private final KifPipeline pipeline;
    /**
     * Source of the SUO-KIF text.
     */
    private final Reader from;
    private final CsvTableWriter writer;

    public KifExport(KifPipeline pipeline, Reader from, CsvTableWriter writer) {
        this.pipeline = pipeline;
        this.from = from;
        this.writer = writer;
    }

    /**
     * Convert the whole input, then write the tables. Nothing is written if
     * the conversion fails.
     */
    public PipelineResult run() throws IOException {
        PipelineResult result;
        try {
            result = pipeline.run(from);
        } finally {
            try {
                from.close();
            } catch (IOException e) {
                log.error("Error closing input", e);
            }
        }
        Diagnostics.logAll(result.getDiagnostics(), log);
        writer.write(result.getTables());
        for (Map.Entry<String, Timer> timer : pipeline.getMetrics().getTimers().entrySet()) {
            log.info("{} took {} ms", timer.getKey(),
                    TimeUnit.NANOSECONDS.toMillis((long) timer.getValue().getSnapshot().getMean()));
        }
        return result;
    }
}

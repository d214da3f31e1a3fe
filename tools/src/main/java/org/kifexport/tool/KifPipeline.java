package org.kifexport.tool;

import static com.codahale.metrics.MetricRegistry.name;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.kifexport.common.Diagnostics;
import org.kifexport.common.LoggingNames;
import org.kifexport.parser.AmbiguityResolver;
import org.kifexport.parser.ChartParser;
import org.kifexport.parser.Lexer;
import org.kifexport.parser.ParseForest;
import org.kifexport.parser.Resolution;
import org.kifexport.parser.Token;
import org.kifexport.parser.grammar.KifGrammar;
import org.kifexport.tool.eval.ConceptEvaluator;
import org.kifexport.tool.eval.Expression;
import org.kifexport.tool.eval.PredicateConventions;
import org.kifexport.tool.export.ExportTables;
import org.kifexport.tool.export.RelationalExporter;
import org.kifexport.tool.inference.ImplicationEngine;
import org.kifexport.tool.ontology.OntologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;

/**
 * Converts SUO-KIF text into export tables: lex, parse, resolve the canonical
 * root, evaluate into a fresh store, optionally saturate, export. Fatal
 * problems are thrown, everything else ends up in the diagnostics of the
 * result.
 * <p>
 * Each run gets its own {@link OntologyStore} so a pipeline can run any number
 * of documents.
 */
public class KifPipeline {
    private static final Logger log = LoggerFactory.getLogger(KifPipeline.class);

    private final ChartParser parser = new ChartParser(KifGrammar.grammar());
    private final AmbiguityResolver resolver = new AmbiguityResolver();
    private final RelationalExporter exporter = new RelationalExporter();
    private final PredicateConventions conventions;
    private final boolean inference;
    private final int maxPasses;
    private final MetricRegistry metrics;

    KifPipeline(PredicateConventions conventions, boolean inference, int maxPasses, MetricRegistry metrics) {
        this.conventions = conventions;
        this.inference = inference;
        this.maxPasses = maxPasses;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineResult run(Reader reader) throws IOException {
        return run(CharStreams.toString(reader));
    }

    public PipelineResult run(String text) {
        Diagnostics diagnostics = new Diagnostics();
        List<Token> tokens = stage("lex", () -> Lexer.tokenize(text));
        ParseForest forest = stage("parse", () -> parser.parse(text, tokens));
        Resolution resolution = stage("resolve", () -> resolver.resolve(forest, diagnostics));
        OntologyStore store = new OntologyStore();
        ConceptEvaluator evaluator = new ConceptEvaluator(store, conventions, diagnostics);
        List<Expression> expressions = stage("evaluate",
                () -> evaluator.evaluateDocument(forest, resolution.getRoot()));
        int inferred = 0;
        if (inference) {
            ImplicationEngine engine = new ImplicationEngine(maxPasses);
            inferred = stage("infer", () -> engine.saturate(store, diagnostics));
        } else {
            log.debug("Skipping inference over {} rules", store.rules().size());
        }
        ExportTables tables = stage("export", () -> exporter.export(store, expressions));

        metrics.counter(name(KifPipeline.class, "tokens")).inc(tokens.size());
        metrics.counter(name(KifPipeline.class, "expressions")).inc(expressions.size());
        metrics.counter(name(KifPipeline.class, "concepts")).inc(store.size());
        metrics.counter(name(KifPipeline.class, "relations")).inc(store.attributeCount());
        metrics.counter(name(KifPipeline.class, "rules")).inc(store.rules().size());
        metrics.counter(name(KifPipeline.class, "inferred")).inc(inferred);
        log.info("Converted {} tokens into {} expressions, {} concepts and {} relations ({} inferred), {} diagnostics",
                tokens.size(), expressions.size(), store.size(), store.attributeCount(), inferred, diagnostics.size());
        return new PipelineResult(tables, ImmutableList.copyOf(diagnostics.list()), inferred,
                ImmutableList.copyOf(expressions), store);
    }

    private <T> T stage(String stage, Supplier<T> work) {
        Timer timer = metrics.timer(name(KifPipeline.class, stage));
        try (MDC.MDCCloseable stageName = MDC.putCloseable(LoggingNames.STAGE, stage);
                Timer.Context context = timer.time()) {
            return work.get();
        }
    }

    public MetricRegistry getMetrics() {
        return metrics;
    }

    /**
     * Configures a {@link KifPipeline}.
     */
    public static final class Builder {
        private Set<String> symmetric = PredicateConventions.DEFAULT_SYMMETRIC;
        private Map<String, Integer> subjectPositions = PredicateConventions.DEFAULT_SUBJECT_POSITIONS;
        private boolean inference = true;
        private int maxPasses = ImplicationEngine.DEFAULT_MAX_PASSES;
        private MetricRegistry metrics = new MetricRegistry();

        private Builder() {
        }

        /**
         * Replace the binary predicates asserted in both directions.
         */
        public Builder symmetric(Set<String> symmetric) {
            this.symmetric = symmetric;
            return this;
        }

        /**
         * Replace the predicates taking their subject from another argument
         * than the first, by 1-based position.
         */
        public Builder subjectPositions(Map<String, Integer> subjectPositions) {
            this.subjectPositions = subjectPositions;
            return this;
        }

        public Builder skipInference() {
            this.inference = false;
            return this;
        }

        public Builder maxPasses(int maxPasses) {
            this.maxPasses = maxPasses;
            return this;
        }

        public Builder metrics(MetricRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public KifPipeline build() {
            if (maxPasses < 1) {
                throw new IllegalArgumentException("maxPasses must be positive but was " + maxPasses);
            }
            return new KifPipeline(new PredicateConventions(symmetric, subjectPositions), inference, maxPasses, metrics);
        }
    }
}

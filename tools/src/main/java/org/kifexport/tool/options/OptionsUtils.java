package org.kifexport.tool.options;

import static com.google.common.io.Resources.getResource;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import org.kifexport.tool.CliUtils.ForbiddenOk;
import org.kifexport.tool.KifPipeline;
import org.kifexport.tool.inference.ImplicationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.Cli;
import com.lexicalscope.jewel.cli.CliFactory;
import com.lexicalscope.jewel.cli.HelpRequestedException;
import com.lexicalscope.jewel.cli.Option;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;

/**
 * Utilities for parsing options.
 */
public final class OptionsUtils {
    private static final Logger log = LoggerFactory.getLogger(OptionsUtils.class);

    /**
     * Basic options for parsing with JewelCLI.
     */
    @SuppressWarnings("checkstyle:javadocmethod")
    public interface BasicOptions {
        @Option(shortName = "v", description = "Verbose mode")
        boolean verbose();

        @Option(helpRequest = true, description = "Show this message")
        boolean help();
    }

    /**
     * Command line options for setting up a KifPipeline instance.
     */
    @SuppressWarnings("checkstyle:javadocmethod")
    public interface PipelineOptions {
        @Option(description = "Export the attributes found in the document without applying its implications")
        boolean skipInference();

        @Option(defaultValue = "" + ImplicationEngine.DEFAULT_MAX_PASSES, description = "Maximum number of inference "
                + "passes. Inference stops with a warning, keeping what it derived, if it has not reached a fixed point by then.")
        int maxPasses();

        @Option(defaultToNull = true, description = "Binary predicates asserted in both directions. Replaces the "
                + "default list: equal, disjoint, connected, inverse, overlapsSpatially, meetsSpatially, sibling, relative.")
        List<String> symmetric();

        @Option(longName = "subjectPosition", defaultToNull = true, description = "predicate:position pairs naming the "
                + "1-based argument used as subject by a predicate. Replaces the default list: termFormat:2, format:2.")
        List<String> subjectPositions();
    }

    /**
     * Parses options and handles the verbose flag.
     *
     * @param optionsClass class defining options
     * @param args arguments to parse
     * @return parse options
     */
    public static <T extends BasicOptions> T handleOptions(Class<T> optionsClass, String... args) {
        T options = parseOptions(optionsClass, args);
        if (options.verbose()) {
            log.info("Verbose mode activated");
            // Assumes logback which is pretty safe in main.
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            try {
                JoranConfigurator configurator = new JoranConfigurator();
                configurator.setContext(context);
                context.reset();
                configurator.doConfigure(getResource("logback-verbose.xml"));
            } catch (JoranException je) {
                // StatusPrinter will handle this
            }
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        }
        return options;
    }

    /**
     * If list contains any options joined by commas, split them to separate options.
     * @param options Original options list
     * @return Split options list
     */
    public static List<String> splitByComma(Iterable<String> options) {
        if (options == null) {
            return null;
        }
        List<String> newOptions = new LinkedList<>();
        for (String option: options) {
            if (option.contains(",")) {
                newOptions.addAll(Splitter.on(",").omitEmptyStrings().trimResults().splitToList(option));
            } else {
                newOptions.add(option);
            }
        }
        return newOptions;
    }

    /**
     * Parse {@code predicate:position} pairs.
     *
     * @throws IllegalArgumentException if a pair is malformed or its position
     *      is not a positive integer
     */
    public static Map<String, Integer> parseSubjectPositions(Iterable<String> pairs) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (String pair : splitByComma(pairs)) {
            List<String> parts = Splitter.on(':').trimResults().splitToList(pair);
            if (parts.size() != 2 || parts.get(0).isEmpty()) {
                throw new IllegalArgumentException("Expected predicate:position but got " + pair);
            }
            int position;
            try {
                position = Integer.parseInt(parts.get(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid position in " + pair, e);
            }
            if (position < 1) {
                throw new IllegalArgumentException("Positions are 1-based, got " + pair);
            }
            positions.put(parts.get(0), position);
        }
        return positions;
    }

    /**
     * Build a pipeline from a PipelineOptions instance.
     */
    public static KifPipeline pipelineFromOptions(PipelineOptions options) {
        KifPipeline.Builder builder = KifPipeline.builder().maxPasses(options.maxPasses());
        if (options.skipInference()) {
            builder = builder.skipInference();
        }
        if (options.symmetric() != null) {
            builder = builder.symmetric(new LinkedHashSet<>(splitByComma(options.symmetric())));
        }
        if (options.subjectPositions() != null) {
            builder = builder.subjectPositions(parseSubjectPositions(options.subjectPositions()));
        }
        return builder.build();
    }

    /**
     * Parse command line options, exiting if there is an error or the user
     * asked for help.
     */
    private static <T> T parseOptions(Class<T> optionsClass, String... args) {
        Cli<T> cli = CliFactory.createCli(optionsClass);
        try {
            return cli.parseArguments(args);
        } catch (HelpRequestedException e) {
            ForbiddenOk.systemDotOut().println(cli.getHelpMessage());
            System.exit(0);
        } catch (ArgumentValidationException e) {
            ForbiddenOk.systemDotErr().println("Invalid argument:  " + e);
            ForbiddenOk.systemDotErr().println(cli.getHelpMessage());
            System.exit(1);
        }
        throw new RuntimeException("Should be unreachable.");
    }

    private OptionsUtils() {
        // Utils uncallable constructor
    }
}

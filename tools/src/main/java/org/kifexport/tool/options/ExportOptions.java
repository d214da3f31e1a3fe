package org.kifexport.tool.options;

import com.lexicalscope.jewel.cli.Option;

/**
 * CLI options for use with JewelCli.
 */
@SuppressWarnings("checkstyle:javadocmethod")
public interface ExportOptions extends OptionsUtils.BasicOptions, OptionsUtils.PipelineOptions {
    @Option(shortName = "f", defaultValue = "-", description = "SUO-KIF file to export, .gz and .bz2 files are "
            + "decompressed. Default is - aka stdin.")
    String from();

    @Option(shortName = "t", defaultValue = ".", description = "Directory receiving expressions.csv, concepts.csv and "
            + "relations.csv. Created ala mkdir -p if it doesn't exist. Default is the working directory.")
    String to();

    @Option(description = "Add the root_concept_id column to expressions.csv")
    boolean expressionRoots();
}

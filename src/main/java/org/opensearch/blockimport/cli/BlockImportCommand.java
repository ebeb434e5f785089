/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.blockimport.BlockImportSettings;
import org.opensearch.blockimport.core.block.BlockId;
import org.opensearch.blockimport.core.block.BlockWriter;
import org.opensearch.blockimport.core.block.HeadBlockWriter;
import org.opensearch.blockimport.core.block.MultiBlockWriter;
import org.opensearch.blockimport.exceptions.BlockImportException;
import org.opensearch.blockimport.importer.BlockImporter;
import org.opensearch.blockimport.parser.SampleParser;
import org.opensearch.blockimport.parser.TextFormatParser;
import org.opensearch.common.settings.Settings;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Imports samples in text exposition format into blocks under an output directory and prints the id of every
 * written block, one per line.
 */
@Command(
    name = "block-import",
    description = "Import timestamped samples into time-partitioned blocks.",
    mixinStandardHelpOptions = true,
    version = "block-import 1.0"
)
public class BlockImportCommand implements Callable<Integer> {
    private static final Logger log = LogManager.getLogger(BlockImportCommand.class);

    @Spec
    private CommandSpec commandSpec;

    @Option(names = "--output-dir", required = true, paramLabel = "DIR", description = "Directory the blocks are written to.")
    private Path outputDir;

    @Option(
        names = "--block-duration",
        defaultValue = "2h",
        paramLabel = "DURATION",
        description = "Time range covered by one block, e.g. 2h or 30m (default: ${DEFAULT-VALUE})."
    )
    private String blockDuration;

    @Option(names = "--label", paramLabel = "NAME=VALUE", description = "External label stamped on every block. Repeatable.")
    private Map<String, String> labels = new LinkedHashMap<>();

    @Option(names = "--source", paramLabel = "SOURCE", description = "Source tag recorded in the block metadata.")
    private String source;

    @Option(names = "--single-block", description = "Write all samples into one block regardless of their time range.")
    private boolean singleBlock;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "Input file. Reads standard input when omitted.")
    private Path input;

    @Override
    public Integer call() {
        Settings settings;
        try {
            settings = buildSettings();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), e.getMessage(), e);
        }

        PrintWriter out = commandSpec.commandLine().getOut();
        PrintWriter err = commandSpec.commandLine().getErr();
        try (SampleParser parser = new TextFormatParser(openInput())) {
            BlockWriter writer = singleBlock ? new HeadBlockWriter(settings) : new MultiBlockWriter(settings);
            List<BlockId> ids = new BlockImporter().importSamples(parser, writer);
            for (BlockId id : ids) {
                out.println(id);
            }
            out.flush();
            return 0;
        } catch (IOException | BlockImportException e) {
            log.error("import into {} failed", outputDir, e);
            err.println("import failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    Settings buildSettings() {
        Settings.Builder builder = Settings.builder()
            .put(BlockImportSettings.OUTPUT_DIR.getKey(), outputDir.toString())
            .put(BlockImportSettings.BLOCK_DURATION.getKey(), blockDuration);
        if (source != null) {
            builder.put(BlockImportSettings.SOURCE.getKey(), source);
        }
        for (Map.Entry<String, String> label : labels.entrySet()) {
            builder.put(BlockImportSettings.EXTERNAL_LABELS.getKey() + label.getKey(), label.getValue());
        }
        Settings settings = builder.build();
        // fail on an invalid duration before any input is read
        BlockImportSettings.BLOCK_DURATION.get(settings);
        return settings;
    }

    private Reader openInput() throws IOException {
        if (input == null) {
            return new InputStreamReader(System.in, StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(input, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new BlockImportCommand()).execute(args));
    }
}

package org.clex.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.clex.cli.config.ConfigLoader;
import org.clex.cli.config.LoggingConfigurator;
import org.clex.diagnostics.DiagnosticsEngine;
import org.clex.scanner.Cursor;
import org.clex.scanner.Scanner;
import org.clex.scanner.ScannerException;
import org.clex.scanner.output.OutputFormat;
import org.clex.scanner.output.TokenWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "clex",
    mixinStandardHelpOptions = true,
    version = "clex 1.0",
    description = "Scans a C source file and writes one classified token per line."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "The source file to scan.")
    private File inputFile;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT",
        description = "The file to write the tokens to (default: clex.output.default-file, output.txt).")
    private File outputFile;

    @Option(names = {"-c", "--config"}, description = "Path to a configuration file (default: clex.conf if present)")
    private File configFile;

    @Option(names = {"-f", "--format"}, description = "Output layout: ${COMPLETION-CANDIDATES} (default: clex.output.format)")
    private OutputFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (inputFile == null) {
            spec.commandLine().usage(spec.commandLine().getOut());
            return 0;
        }

        final Config config;
        final OutputFormat effectiveFormat;
        final Path output;
        try {
            config = ConfigLoader.load(configFile);
            effectiveFormat = format != null
                ? format
                : config.getEnum(OutputFormat.class, "clex.output.format");
            output = outputFile != null
                ? outputFile.toPath()
                : Path.of(config.getString("clex.output.default-file"));
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final Cursor cursor;
        try {
            cursor = new Cursor(new FileInputStream(inputFile));
        } catch (FileNotFoundException e) {
            LOG.error("Cannot open input file {}: {}", inputFile, e.getMessage());
            return 1;
        }

        try (cursor) {
            final TokenWriter writer;
            try {
                writer = TokenWriter.open(output, effectiveFormat);
            } catch (IOException e) {
                LOG.error("Cannot open output file {}: {}", output, e.getMessage());
                return 1;
            }
            try (writer) {
                final int tokenCount = new Scanner(cursor, diagnostics, inputFile.getName()).scan(writer);
                LOG.info("Wrote {} tokens from {} to {}", tokenCount, inputFile, output);
            }
        } catch (ScannerException e) {
            LOG.error("Scanning {} failed: {}", inputFile, e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to close files for {}: {}", inputFile, e.getMessage());
            return 1;
        }

        if (diagnostics.hasErrors()) {
            final PrintWriter err = spec.commandLine().getErr();
            err.println(diagnostics.summary());
            err.flush();
            LOG.info("{} lexical errors in {}", diagnostics.errorCount(), inputFile);
        }
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}

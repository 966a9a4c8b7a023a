package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import io.github.manjago.gtm.core.ProgramException;
import io.github.manjago.gtm.core.SpecializedTable;
import io.github.manjago.gtm.export.ExportException;
import io.github.manjago.gtm.export.SimulatorExporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: generate
 * 
 * Writes the specialized machine in the input format of turingmachinesimulator.com.
 * 
 * Usage:
 *   gtm generate prog.tm                  # Print to stdout
 *   gtm generate prog.tm -o prog.txt      # Write to a file
 *   gtm generate prog.tm --name "adder"   # Set the name: line
 */
@Command(
    name = "generate",
    description = "Export for turingmachinesimulator.com",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOption configOption;

    @Parameters(index = "0", arity = "0..1", description = "Program file ('-' or none for stdin)")
    private String programFile;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path outputFile;

    @Option(names = {"-n", "--name"}, description = "Machine name (default: export.machine-name)")
    private String machineName;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GtmConfig.Builder builder = configOption.builder();
        if (machineName != null) builder.machineName(machineName);
        GtmConfig config = builder.build();

        ProgramSource source;
        try {
            source = ProgramSource.read(programFile, System.in);
        } catch (IOException e) {
            err.println("❌ Cannot read program: " + e.getMessage());
            return 1;
        }

        String text;
        try {
            SpecializedTable table = source.compile(config);
            source.printWarnings(table, err);
            text = new SimulatorExporter(config.machineName()).export(table);
        } catch (ProgramException e) {
            source.printError(e, err);
            return 1;
        } catch (ExportException e) {
            err.println("❌ Export error: " + e.getMessage());
            return 1;
        }

        if (outputFile == null) {
            out.print(text);
            out.flush();
            return 0;
        }
        try {
            Files.writeString(outputFile, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("❌ Cannot write " + outputFile + ": " + e.getMessage());
            return 1;
        }
        out.println("✓ Written to: " + outputFile);
        return 0;
    }
}

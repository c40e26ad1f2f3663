package org.zignet.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.cli.CommandLineInterface;
import org.zignet.compiler.Compiler;
import org.zignet.compiler.api.FormatResult;
import org.zignet.compiler.api.ResultFormatter;
import org.zignet.compiler.backend.emit.CodeGenOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "format", description = "Prints a source file in canonical layout.")
public class FormatCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--indent", description = "Spaces per indentation level (overrides zignet.format.indent-size).")
    private Integer indentSize;

    @Option(names = "--tabs", description = "Indent with tabs.")
    private boolean useTabs;

    @Option(names = {"-w", "--write"}, description = "Write the result back to the file instead of printing it.")
    private boolean write;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CodeGenOptions options = parent.getFormatOptions();
        if (indentSize != null) {
            options = options.withIndentSize(indentSize);
        }
        if (useTabs) {
            options = options.withUseTabs(true);
        }

        final FormatResult result = new Compiler(options).format(Files.readString(file.toPath()));
        if (!result.success()) {
            LOGGER.debug("Formatting {} failed", file);
            spec.commandLine().getErr().println(ResultFormatter.render(result));
            return 1;
        }

        final PrintWriter out = spec.commandLine().getOut();
        if (write) {
            Files.writeString(file.toPath(), result.output());
            LOGGER.info("Formatted {}", file);
        } else {
            out.print(result.output());
        }
        out.flush();
        return 0;
    }
}

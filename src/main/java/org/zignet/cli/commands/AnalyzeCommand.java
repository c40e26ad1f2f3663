package org.zignet.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.cli.CommandLineInterface;
import org.zignet.compiler.Compiler;
import org.zignet.compiler.api.AnalysisResult;
import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.api.ResultFormatter;
import org.zignet.compiler.util.AstDump;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Checks a source file for syntax and type errors.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--json", description = "Print the result as JSON.")
    private boolean json;

    @Option(names = "--dump-ast", description = "Also print the syntax tree as an indented outline.")
    private boolean dumpAst;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final Compiler compiler = new Compiler(parent.getFormatOptions());
        final String source = Files.readString(file.toPath());
        final AnalysisResult result = compiler.analyze(source);
        LOGGER.debug("Analyzed {}: success={}", file, result.success());

        final PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
            out.println(gson.toJson(result));
        } else {
            out.println(ResultFormatter.render(result));
        }

        if (dumpAst) {
            try {
                out.print(AstDump.dump(compiler.parse(source)));
            } catch (CompilationException e) {
                spec.commandLine().getErr().println("Cannot dump the syntax tree: " + e.getMessage());
            }
        }
        out.flush();
        return result.success() ? 0 : 1;
    }
}

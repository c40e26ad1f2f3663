package org.zignet.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.compiler.api.AnalysisResult;
import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.api.FormatResult;
import org.zignet.compiler.api.ICompiler;
import org.zignet.compiler.api.SourceInfo;
import org.zignet.compiler.backend.emit.CodeGenOptions;
import org.zignet.compiler.backend.emit.CodeGenerator;
import org.zignet.compiler.diagnostics.Diagnostic;
import org.zignet.compiler.frontend.lexer.Lexer;
import org.zignet.compiler.frontend.lexer.Token;
import org.zignet.compiler.frontend.parser.Parser;
import org.zignet.compiler.frontend.parser.ast.Program;
import org.zignet.compiler.frontend.semantics.TypeChecker;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The main front-end implementation. This class orchestrates the pipeline
 * Lexer → Parser → TypeChecker / CodeGenerator for one source unit per call.
 * <p>
 * Every call creates fresh pipeline stages, so one instance can be shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

    private final CodeGenOptions formatOptions;

    public Compiler() {
        this(CodeGenOptions.defaults());
    }

    /**
     * @param formatOptions The layout used by {@link #format(String)}.
     */
    public Compiler(CodeGenOptions formatOptions) {
        this.formatOptions = formatOptions;
    }

    @Override
    public Program parse(String source) throws CompilationException {
        List<Token> tokens = new Lexer(source).scanTokens();
        return new Parser(tokens).parse();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Blank input is valid. A lexical or syntax error ends the analysis with that single error;
     * otherwise all type checker diagnostics are returned, split by severity.
     */
    @Override
    public AnalysisResult analyze(String source) {
        if (source == null || source.isBlank()) {
            return new AnalysisResult(true, List.of(), List.of(), "Analysis Result: Empty code (valid)");
        }

        Program program;
        try {
            program = parse(source);
        } catch (CompilationException e) {
            LOGGER.debug("Analysis stopped at a structural error: {}", e.getMessage());
            List<Diagnostic> errors = List.of(toDiagnostic(e));
            return new AnalysisResult(false, errors, List.of(), summary(false, errors.size(), 0));
        }

        TypeChecker checker = new TypeChecker();
        checker.check(program);
        List<Diagnostic> errors = ofType(checker.getErrors(), Diagnostic.Type.ERROR);
        List<Diagnostic> warnings = ofType(checker.getErrors(), Diagnostic.Type.WARNING);
        LOGGER.debug("Analysis finished with {} errors and {} warnings", errors.size(), warnings.size());
        return new AnalysisResult(errors.isEmpty(), errors, warnings, summary(true, errors.size(), warnings.size()));
    }

    /**
     * {@inheritDoc}
     * <p>
     * Formatting does not type check; only lexical and syntax errors make it fail.
     */
    @Override
    public FormatResult format(String source) {
        if (source == null || source.isBlank()) {
            return new FormatResult(false, null,
                    List.of(new Diagnostic(Diagnostic.Type.ERROR, "Input code cannot be empty", null)), "Empty input");
        }
        try {
            String output = new CodeGenerator(formatOptions).generate(parse(source));
            return new FormatResult(true, output, List.of(), "Formatted successfully");
        } catch (CompilationException e) {
            LOGGER.debug("Formatting failed: {}", e.getMessage());
            return new FormatResult(false, null, List.of(toDiagnostic(e)), "Format failed");
        }
    }

    private static Diagnostic toDiagnostic(CompilationException e) {
        SourceInfo position = e.getSourceInfo();
        return new Diagnostic(Diagnostic.Type.ERROR, e.getDetail(), position);
    }

    private static List<Diagnostic> ofType(List<Diagnostic> diagnostics, Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).collect(Collectors.toList());
    }

    private static String summary(boolean syntaxValid, int errorCount, int warningCount) {
        return String.join("\n",
                "Analysis Result:",
                "- Syntax: " + (syntaxValid ? "Valid" : "Invalid"),
                "- Type Check: " + (syntaxValid && errorCount == 0 ? "PASS" : "FAIL"),
                "- Warnings: " + warningCount,
                "- Errors: " + errorCount);
    }
}

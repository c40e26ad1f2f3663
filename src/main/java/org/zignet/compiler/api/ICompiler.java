package org.zignet.compiler.api;

import org.zignet.compiler.frontend.parser.ast.Program;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the front end: analysis and formatting of a single source unit.
 */
public interface ICompiler {

    /**
     * Runs lexing, parsing and type checking and collects every finding.
     * Structural failures are reported as a single error instead of being thrown.
     *
     * @param source The complete source text.
     * @return The analysis result.
     */
    AnalysisResult analyze(String source);

    /**
     * Parses the source and prints it in canonical form.
     *
     * @param source The complete source text.
     * @return The formatting result, carrying the formatted text on success.
     */
    FormatResult format(String source);

    /**
     * Lexes and parses the source without checking it.
     *
     * @param source The complete source text.
     * @return The syntax tree.
     * @throws CompilationException at the first lexical or syntax error.
     */
    Program parse(String source) throws CompilationException;

    /**
     * Analyzes the contents of a file.
     * @param sourcePath The path of the source file.
     * @return The analysis result.
     * @throws IOException if the file cannot be read.
     */
    default AnalysisResult analyze(Path sourcePath) throws IOException {
        return analyze(Files.readString(sourcePath));
    }
}

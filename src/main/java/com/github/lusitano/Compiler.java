package com.github.lusitano;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.lusitano.diagnostics.Diagnostic;
import com.github.lusitano.diagnostics.Diagnostic.Phase;
import com.github.lusitano.diagnostics.Diagnostics;
import com.github.lusitano.parser.AstTyper;
import com.github.lusitano.parser.Parser;

import lombok.Setter;

/**
 * Runs the phases in order: scanning, parsing, semantic analysis and, unless lexical or syntax
 * errors were found, Python generation. Each call compiles independently.
 */
public class Compiler implements ConfigReader.ConfigTarget {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    @Setter
    private String target = ".";
    @Setter
    private boolean entryPoint = true;
    @Setter
    private boolean header = true;

    public static void main(String[] args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);

        int failed = 0;
        for (var arg : args) {
            if (!compiler.compileFile(Path.of(arg)).succeeded()) {
                failed++;
            }
        }
        if (failed > 0) {
            LOG.error("{} of {} file(s) failed to compile", failed, args.length);
            System.exit(1);
        }
    }

    public CompilationResult compile(String source) {
        var diagnostics = new Diagnostics();

        var tokens = new Tokenizer().tokenize(source, diagnostics);
        LOG.debug("scanned {} tokens", tokens.size());

        var compilationUnit = new Parser(diagnostics).parseCompilationUnit(tokens);
        var typed = new AstTyper(diagnostics).typeCompilationUnit(compilationUnit);

        Optional<String> python = Optional.empty();
        if (diagnostics.hasErrors(Phase.LEXICAL, Phase.SYNTAX)) {
            LOG.debug("skipping code generation because of lexical or syntax errors");
        } else {
            python = Optional.of(new PythonGenerator(header, entryPoint).generate(typed));
        }

        return new CompilationResult(diagnostics.all(), python);
    }

    /** Compiles {@code source} and writes {@code <target>/<name>.py} when code was generated. */
    public CompilationResult compileFile(Path source) {
        String program;
        try {
            program = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + source, e);
        }

        LOG.info("compiling {}", source);
        var result = compile(program);
        result.byPhase().forEach((phase, diagnostics) -> {
            LOG.info("{} phase: {} diagnostic(s)", phase, diagnostics.size());
            diagnostics.forEach(d -> log(source, d));
        });

        result.python().ifPresent(python -> {
            var fileName = source.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            var stem = dot > 0 ? fileName.substring(0, dot) : fileName;
            var outputPath = Path.of(target, stem + ".py");
            try {
                Files.createDirectories(outputPath.toAbsolutePath().getParent());
                Files.writeString(outputPath, python, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot write " + outputPath, e);
            }
            LOG.info("wrote {}", outputPath);
        });

        if (result.diagnostics().isEmpty()) {
            LOG.info("{} compiled without diagnostics", source);
        } else if (result.succeeded()) {
            LOG.info("{} compiled with {} warning(s)", source, result.diagnostics().size());
        } else {
            LOG.info("{} failed with {} error(s) and {} warning(s)", source, result.errors().size(),
                    result.diagnostics().size() - result.errors().size());
        }
        return result;
    }

    private static void log(Path source, Diagnostic diagnostic) {
        if (diagnostic.isError()) {
            LOG.error("{}:{}:{}: {}", source, diagnostic.line(), diagnostic.column(), diagnostic);
        } else {
            LOG.warn("{}:{}:{}: {}", source, diagnostic.line(), diagnostic.column(), diagnostic);
        }
    }

}

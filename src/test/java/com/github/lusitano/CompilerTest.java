package com.github.lusitano;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.lusitano.diagnostics.Diagnostic;
import com.github.lusitano.diagnostics.Diagnostic.Kind;
import com.github.lusitano.diagnostics.Diagnostic.Phase;

public class CompilerTest {

    @TempDir
    Path tempDir;

    @Test
    void validProgramSucceeds() {
        var result = new Compiler().compile("var x: inteiro = 25\nescreva(x)");

        assertTrue(result.succeeded());
        assertTrue(result.diagnostics().isEmpty());
        assertTrue(result.python().get().contains("print(x, sep=\"\")"));
    }

    @Test
    void syntaxErrorSkipsGenerationButAnalysisContinues() {
        var result = new Compiler().compile("""
                var x: inteiro = 20
                se (x > 10 {
                    escreva(x)
                }
                escreva(y)
                """);

        assertFalse(result.succeeded());
        assertEquals(Optional.empty(), result.python());
        assertEquals(List.of(Kind.SYNTAX_ERROR, Kind.UNDECLARED_IDENTIFIER),
                result.diagnostics().stream().map(Diagnostic::kind).toList());

        var syntaxError = result.diagnostics().get(0);
        assertEquals(Optional.of("')'"), syntaxError.expected());
        assertEquals(Optional.of("'{'"), syntaxError.found());
        assertEquals(2, syntaxError.line());
    }

    @Test
    void lexicalErrorSkipsGeneration() {
        var result = new Compiler().compile("var x: inteiro = 1 @");

        assertEquals(Optional.empty(), result.python());
        assertEquals(Phase.LEXICAL, result.diagnostics().get(0).phase());
    }

    @Test
    void semanticErrorStillGenerates() {
        var result = new Compiler().compile("const PI: real = 3.14159\nPI = 3.0");

        assertFalse(result.succeeded());
        assertEquals(1, result.diagnostics().size());
        assertEquals(Kind.CONSTANT_REASSIGNMENT, result.diagnostics().get(0).kind());
        assertTrue(result.python().isPresent());
    }

    @Test
    void warningsDoNotFailTheCompilation() {
        var result = new Compiler().compile("funcao f(): inteiro { para i de 1 ate 3 { retorna i } }\nescreva(f())");

        assertTrue(result.succeeded());
        assertTrue(result.errors().isEmpty());
        assertEquals(List.of(Kind.MISSING_RETURN), result.diagnostics().stream().map(Diagnostic::kind).toList());
        assertEquals(Diagnostic.Severity.WARNING, result.diagnostics().get(0).severity());
        assertTrue(result.python().isPresent());
    }

    @Test
    void returnInsideEndlessLoopIsNotMissing() {
        var result = new Compiler().compile("funcao f(): inteiro { enquanto (verdadeiro) { retorna 1 } }\nescreva(f())");

        assertTrue(result.succeeded());
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
    }

    @Test
    void diagnosticsAreGroupedByPhase() {
        var result = new Compiler().compile("escreva(y)\nvar a: inteiro = 1 $");

        var byPhase = result.byPhase();
        assertEquals(List.of(Phase.LEXICAL, Phase.SEMANTIC), List.copyOf(byPhase.keySet()));
        assertEquals(Kind.UNDECLARED_IDENTIFIER, byPhase.get(Phase.SEMANTIC).get(0).kind());
    }

    @Test
    void compilationsAreIndependent() {
        var compiler = new Compiler();
        compiler.compile("escreva(y)");
        var result = compiler.compile("var y: inteiro = 1");

        assertTrue(result.succeeded());
    }

    @Test
    void compileFileWritesPythonNextToTarget() throws IOException {
        var source = tempDir.resolve("ola.lus");
        Files.writeString(source, "funcao principal() {\n    escreva(\"ola\")\n}\n");

        var compiler = new Compiler();
        compiler.setTarget(tempDir.resolve("out").toString());
        compiler.setHeader(false);
        var result = compiler.compileFile(source);

        assertTrue(result.succeeded());
        var generated = tempDir.resolve("out").resolve("ola.py");
        assertEquals(result.python().get(), Files.readString(generated));
        assertTrue(Files.readString(generated).endsWith("    principal()\n"));
    }

    @Test
    void compileFileWritesNothingOnSyntaxErrors() throws IOException {
        var source = tempDir.resolve("quebrado.lus");
        Files.writeString(source, "escreva(1 +)");

        var compiler = new Compiler();
        compiler.setTarget(tempDir.toString());
        var result = compiler.compileFile(source);

        assertFalse(result.succeeded());
        assertFalse(Files.exists(tempDir.resolve("quebrado.py")));
    }

    @Test
    void configIsApplied() throws IOException {
        var file = tempDir.resolve(ConfigReader.CONFIG_FILE);
        Files.writeString(file, "target = build/py\nentryPoint = false\n");
        var target = new RecordingTarget();

        ConfigReader.readConfig(file).applyConfig(target);

        assertEquals("build/py", target.target);
        assertFalse(target.entryPoint);
        assertTrue(target.header);
    }

    @Test
    void missingConfigUsesDefaults() {
        var target = new RecordingTarget();

        ConfigReader.readConfig(tempDir.resolve("nao-existe.cfg")).applyConfig(target);

        assertEquals(".", target.target);
        assertTrue(target.entryPoint);
        assertTrue(target.header);
    }

    private static class RecordingTarget implements ConfigReader.ConfigTarget {
        String target;
        boolean entryPoint;
        boolean header;

        @Override
        public void setTarget(String target) {
            this.target = target;
        }

        @Override
        public void setEntryPoint(boolean entryPoint) {
            this.entryPoint = entryPoint;
        }

        @Override
        public void setHeader(boolean header) {
            this.header = header;
        }
    }

}

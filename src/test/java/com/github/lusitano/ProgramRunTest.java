package com.github.lusitano;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;
import org.junit.jupiter.api.io.TempDir;

/**
 * Compiles every program under {@code src/test/resources/programs}, runs the result with
 * {@code python3} and compares its output with the lines after {@code // EXPECTED-OUTPUT}.
 */
public class ProgramRunTest {

    private static final String PYTHON = "python3";

    @TempDir
    Path tempDir;

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/programs";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".lus"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Program runs", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("run " + testName, () -> {
            assumeTrue(pythonAvailable(), "python3 is not installed");

            var compiler = new Compiler();
            compiler.setTarget(tempDir.toString());
            var result = compiler.compileFile(testFile.toPath());
            assertTrue(result.succeeded(), () -> result.diagnostics().toString());

            String expectedOutput;
            try (var s = Files.lines(testFile.toPath())) {
                expectedOutput = s.dropWhile(l -> !l.equals("// EXPECTED-OUTPUT")).skip(1)
                    .map(l -> l.substring(2).trim()).reduce("", (a, b) -> a + b + "\n");
            }

            var process = new ProcessBuilder(PYTHON, tempDir.resolve(testName + ".py").toString())
                .redirectErrorStream(true)
                .start();
            process.getOutputStream().close();
            var output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            assertTrue(process.waitFor(30, TimeUnit.SECONDS), "python3 did not finish");

            assertEquals(expectedOutput, output.replace("\r\n", "\n"));
            assertEquals(0, process.exitValue());
        });
    }

    private static boolean pythonAvailable() {
        try {
            var process = new ProcessBuilder(PYTHON, "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

}

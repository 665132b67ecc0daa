package org.tabelle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tabelle.pipeline.TruthTableRunner;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static final String NL = System.lineSeparator();

    @TempDir
    Path directory;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        return Main.run(args,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void helpExitsSuccessfully() {
        assertThat(run("", "-h")).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        assertThat(out()).contains("UTILIZZO:").contains("-fmt=");
    }

    @Test
    void readsStandardInputAsLatexByDefault() {
        assertThat(run("p -> q\n")).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        assertThat(out()).startsWith("\\begin{tabular}{ccc}\\toprule").endsWith("\\end{tabular}" + NL);
    }

    @Test
    void textFormatFromFlag() {
        assertThat(run("p\n", "-fmt=text")).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        assertThat(out()).isEqualTo("p\n-\n1\n0" + NL);
    }

    @Test
    void strictFlagTurnsStrayCharactersIntoErrors() {
        assertThat(run("p;\n")).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        out.reset();

        assertThat(run("p;\n", "-strict")).isEqualTo(TruthTableRunner.EXIT_FAILURE);
        assertThat(err()).contains("[E] <stdin>:1:").contains("';'");
    }

    @Test
    void invalidArgumentsExitWithUsageError() throws IOException {
        Path formulas = Files.writeString(directory.resolve("f.txt"), "p\n");

        assertThat(run("", "-x")).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(err()).contains("Parametro sconosciuto: -x");
        assertThat(run("", "-j", "0")).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(run("", "-j", "molti")).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(run("", "-f")).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(run("", "-fmt=html")).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(run("", "-f", directory.resolve("assente.txt").toString())).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(run("", "-f", formulas.toString(), "-d", directory.toString()))
                .isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
    }

    @Test
    void directoryWithoutFormulaFilesIsRejected() {
        assertThat(run("", "-d", directory.toString())).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(err()).contains("Nessun file .txt");
    }

    @Test
    void directoryModeWritesOneOutputPerFile() throws IOException {
        Path input = Files.createDirectory(directory.resolve("formule"));
        Files.writeString(input.resolve("uno.txt"), "p\n");
        Files.writeString(input.resolve("due.txt"), "q\n\nq ^ r\n");
        Path output = directory.resolve("tabelle");

        int exitCode = run("", "-d", input.toString(), "-o", output.toString(), "-fmt=text");

        assertThat(exitCode).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        assertThat(Files.readString(output.resolve("uno.txt"))).isEqualTo("p\n-\n1\n0\n");
        assertThat(Files.readString(output.resolve("due.txt")))
                .startsWith("q\n-\n1\n0\n\nq | r | q ^ r\n");
        assertThat(out()).isEmpty();
        assertThat(err().indexOf("due.txt")).isLessThan(err().indexOf("uno.txt"));
    }

    @Test
    void sourcesWritingTheSameOutputFileAreRejected() throws IOException {
        Path first = Files.createDirectory(directory.resolve("a"));
        Path second = Files.createDirectory(directory.resolve("b"));
        Path one = Files.writeString(first.resolve("f.txt"), "p\n");
        Path other = Files.writeString(second.resolve("f.txt"), "q\n");
        Path output = directory.resolve("tabelle");

        int exitCode = run("", "-f", one.toString(), "-f", other.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(err()).contains("stesso file di output f.tex");
        assertThat(output).doesNotExist();
    }

    @Test
    void outputNamesDifferingOnlyInCaseAreRejected() throws IOException {
        Path input = Files.createDirectory(directory.resolve("formule"));
        Files.writeString(input.resolve("x.txt"), "p\n");
        Path upper = input.resolve("X.txt");
        if (Files.exists(upper)) {
            return; // file system insensibile alle maiuscole: un solo file
        }
        Files.writeString(upper, "q\n");

        int exitCode = run("", "-d", input.toString(), "-o", directory.resolve("tabelle").toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_INVALID_ARGUMENTS);
        assertThat(err()).contains("stesso file di output");
    }

    @Test
    void sameBaseNameIsAllowedWithoutOutputDirectory() throws IOException {
        Path first = Files.createDirectory(directory.resolve("a"));
        Path second = Files.createDirectory(directory.resolve("b"));
        Path one = Files.writeString(first.resolve("f.txt"), "p\n");
        Path other = Files.writeString(second.resolve("f.txt"), "q\n");

        int exitCode = run("", "-fmt=text", "-f", one.toString(), "-f", other.toString());

        assertThat(exitCode).isEqualTo(TruthTableRunner.EXIT_SUCCESS);
        assertThat(out()).isEqualTo("p\n-\n1\n0" + NL + "q\n-\n1\n0" + NL);
    }
}

package com.example.dedupe;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.dedupe.config.AppConfig;
import com.example.dedupe.pipeline.Pipeline.Cancellation;

class MainTest {

    @TempDir
    Path root;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Test
    void reportsDuplicatesAndExitsZero() throws IOException {
        write("a.txt", "alpha");
        write("sub/c.txt", "alpha");

        int code = run("--algo=sha256", "--workers=2", root.toString());

        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(output()).contains("Duplicados encontrados:").contains(root.resolve("sub/c.txt").toString());
        assertThat(Files.isSameFile(root.resolve("a.txt"), root.resolve("sub/c.txt"))).isFalse();
    }

    @Test
    void hardlinkReplacesDuplicatesAndDryRunDoesNot() throws IOException {
        Path a = write("a.txt", "alpha");
        Path c = write("sub/c.txt", "alpha");

        assertThat(run("--hardlink", "--dry-run", root.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(Files.isSameFile(a, c)).isFalse();
        assertThat(output()).contains("Dry-run");

        assertThat(run("--hardlink", root.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(Files.isSameFile(a, c)).isTrue();
        assertThat(output()).contains("Links criados: 1");
    }

    @Test
    void dryRunNoticeIsPrintedWithoutHardlink() throws IOException {
        write("a.txt", "alpha");
        write("b.txt", "alpha");

        assertThat(run("--dry-run", root.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(output()).contains("Dry-run: nenhum arquivo foi modificado.");
    }

    @Test
    void writesJsonReportWhenAsked(@TempDir Path reports) throws IOException {
        write("a.txt", "alpha");

        int code = run("--report-dir=" + reports, root.toString());

        assertThat(code).isEqualTo(Main.EXIT_OK);
        try (Stream<Path> files = Files.list(reports)) {
            assertThat(files).singleElement()
                    .satisfies(p -> assertThat(p.getFileName().toString()).startsWith("dedupe-report-").endsWith(".json"));
        }
    }

    @Test
    void configurationErrorsExitWithTwo() {
        assertThat(run("--algo=crc32", root.toString())).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("--workers=0", root.toString())).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("--unknown", root.toString())).isEqualTo(Main.EXIT_USAGE);
        assertThat(run("--timeout=-1", root.toString())).isEqualTo(Main.EXIT_USAGE);
        assertThat(run(root.toString(), root.toString())).isEqualTo(Main.EXIT_USAGE);
        assertThat(output()).contains("uso: dedupe");
    }

    @Test
    void missingRootExitsWithOne() {
        assertThat(run(root.resolve("missing").toString())).isEqualTo(Main.EXIT_FAILURE);
    }

    @Test
    void cancelledRunExitsWith130AndSkipsConsolidation() throws IOException {
        Path a = write("a.txt", "alpha");
        Path c = write("c.txt", "alpha");

        int code = new Main(AppConfig.fromMap(Map.of()), out())
                .run(new String[] {"--hardlink", root.toString()}, Cancellation.cancelled());

        assertThat(code).isEqualTo(Main.EXIT_CANCELLED);
        assertThat(Files.isSameFile(a, c)).isFalse();
    }

    @Test
    void helpPrintsUsage() {
        assertThat(run("--help")).isEqualTo(Main.EXIT_OK);
        assertThat(output()).startsWith("uso: dedupe");
    }

    private int run(String... args) {
        return new Main(AppConfig.fromMap(Map.of()), out()).run(args, Cancellation.create());
    }

    private PrintStream out() {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}

package com.example.dedupe.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.dedupe.scan.Scanner.TreeWalker;
import com.example.dedupe.scan.Scanner.WalkOutcome;
import com.example.dedupe.scan.Scanner.WalkSink;

class ScannerTest {

    @TempDir
    Path root;

    private final TreeWalker walker = new TreeWalker();

    @Test
    void emitsFilesAndDirectoriesInLexicalPreOrder() throws IOException {
        Files.createDirectories(root.resolve("b/inner"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("z.txt"), "z");
        Files.writeString(root.resolve("a/1.txt"), "1");
        Files.writeString(root.resolve("b/inner/2.txt"), "2");
        Files.writeString(root.resolve("b/0.txt"), "0");

        RecordingSink sink = new RecordingSink();
        WalkOutcome outcome = walker.walk(root, sink, () -> false);

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(sink.events).containsExactly(
                "dir a", "file a/1.txt",
                "dir b", "file b/0.txt", "dir b/inner", "file b/inner/2.txt",
                "file z.txt");
        assertThat(outcome.statistics().filesVisited()).isEqualTo(4);
        assertThat(outcome.statistics().directoriesVisited()).isEqualTo(3);
    }

    @Test
    void rootIsNeverReportedAsDirectory() throws IOException {
        Files.writeString(root.resolve("only.txt"), "x");

        RecordingSink sink = new RecordingSink();
        walker.walk(root, sink, () -> false);

        assertThat(sink.events).containsExactly("file only.txt");
    }

    @Test
    void symbolicLinksAreNotFollowed() throws IOException {
        Path target = Files.createDirectories(root.resolve("real"));
        Files.writeString(target.resolve("f.txt"), "f");
        try {
            Files.createSymbolicLink(root.resolve("link-dir"), target);
            Files.createSymbolicLink(root.resolve("link-file"), target.resolve("f.txt"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symlinks indisponíveis: " + e);
        }

        RecordingSink sink = new RecordingSink();
        walker.walk(root, sink, () -> false);

        assertThat(sink.events).containsExactly("dir real", "file real/f.txt");
    }

    @Test
    void missingRootIsFatal() {
        RecordingSink sink = new RecordingSink();

        WalkOutcome outcome = walker.walk(root.resolve("nope"), sink, () -> false);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.FAILED);
        assertThat(outcome.failure()).isPresent();
        assertThat(sink.events).isEmpty();
    }

    @Test
    void regularFileAsRootIsFatal() throws IOException {
        Path file = Files.writeString(root.resolve("file.txt"), "x");

        WalkOutcome outcome = walker.walk(file, new RecordingSink(), () -> false);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.FAILED);
    }

    @Test
    void alreadyCancelledEmitsNothing() throws IOException {
        Files.writeString(root.resolve("a.txt"), "a");
        RecordingSink sink = new RecordingSink();

        WalkOutcome outcome = walker.walk(root, sink, () -> true);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.CANCELLED);
        assertThat(sink.events).isEmpty();
    }

    @Test
    void stopsEmittingOnceCancelled() throws IOException {
        for (int i = 0; i < 10; i++) {
            Files.writeString(root.resolve("f" + i + ".txt"), "x");
        }
        AtomicBoolean cancelled = new AtomicBoolean();
        RecordingSink sink = new RecordingSink() {
            @Override
            public void onFile(Path file) {
                super.onFile(file);
                if (events.size() == 3) {
                    cancelled.set(true);
                }
            }
        };

        WalkOutcome outcome = walker.walk(root, sink, cancelled::get);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.CANCELLED);
        assertThat(sink.events).hasSize(3);
    }

    @Test
    void unreadableSubdirectoryIsSkippedAndReported() throws IOException {
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(locked.resolve("hidden.txt"), "h");
        Files.writeString(root.resolve("visible.txt"), "v");
        try {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException e) {
            assumeTrue(false, "sem permissões POSIX");
        }
        try {
            assumeTrue(!Files.isReadable(locked), "usuário ignora permissões (root)");

            RecordingSink sink = new RecordingSink();
            WalkOutcome outcome = walker.walk(root, sink, () -> false);

            assertThat(outcome.isCompleted()).isTrue();
            assertThat(sink.events).containsExactly("dir locked", "error locked", "file visible.txt");
            assertThat(outcome.statistics().entriesFailed()).isEqualTo(1);
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void deniedSubdirectoryListingIsSkippedAndReported() throws IOException {
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(locked.resolve("hidden.txt"), "h");
        Files.writeString(root.resolve("visible.txt"), "v");
        TreeWalker denying = new TreeWalker(dir -> {
            if (dir.equals(locked)) {
                throw new AccessDeniedException(dir.toString());
            }
            return listReversed(dir);
        });

        RecordingSink sink = new RecordingSink();
        WalkOutcome outcome = denying.walk(root, sink, () -> false);

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(sink.events).containsExactly("dir locked", "error locked", "file visible.txt");
        assertThat(outcome.statistics().entriesFailed()).isEqualTo(1);
        assertThat(outcome.statistics().filesVisited()).isEqualTo(1);
    }

    @Test
    void deniedRootListingFailsTheWalk() throws IOException {
        Files.writeString(root.resolve("a.txt"), "a");
        TreeWalker denying = new TreeWalker(dir -> {
            throw new AccessDeniedException(dir.toString());
        });

        RecordingSink sink = new RecordingSink();
        WalkOutcome outcome = denying.walk(root, sink, () -> false);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.FAILED);
        assertThat(outcome.failure()).containsInstanceOf(AccessDeniedException.class);
        assertThat(sink.events).isEmpty();
    }

    @Test
    void interruptedSinkEndsWalkAsCancelled() throws IOException {
        Files.writeString(root.resolve("a.txt"), "a");
        WalkSink sink = new WalkSink() {
            @Override
            public void onDirectory(Path directory) { }

            @Override
            public void onFile(Path file) throws InterruptedException {
                throw new InterruptedException();
            }
        };

        WalkOutcome outcome = walker.walk(root, sink, () -> false);

        assertThat(outcome.status()).isEqualTo(WalkOutcome.Status.CANCELLED);
        assertThat(Thread.interrupted()).isTrue();
    }

    private static List<Path> listReversed(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            List<Path> list = children.collect(Collectors.toList());
            Collections.reverse(list);
            return list;
        }
    }

    private class RecordingSink implements WalkSink {
        final List<String> events = new ArrayList<>();

        @Override
        public void onDirectory(Path directory) {
            events.add("dir " + relative(directory));
        }

        @Override
        public void onFile(Path file) {
            events.add("file " + relative(file));
        }

        @Override
        public void onError(Path path, IOException exc) {
            events.add("error " + relative(path));
        }

        private String relative(Path p) {
            return root.relativize(p).toString().replace('\\', '/');
        }
    }
}

package com.codeforge.orchestrator.sandbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for SandboxedFileGateway against a real temp directory.
 */
class SandboxedFileGatewayTest {

    @TempDir Path tmp;

    Path root;
    SandboxedFileGateway gateway;

    @BeforeEach
    void setUp() {
        root = tmp.resolve("project");
        gateway = new SandboxedFileGateway(root);
    }

    // ------------------------------------------------------------------
    // Path resolution
    // ------------------------------------------------------------------

    @Test
    void resolve_relativePath_staysUnderRoot() {
        Path p = gateway.resolve("src/app/main.py");
        assertThat(p).startsWith(gateway.root());
        assertThat(gateway.relativize(p)).isEqualTo("src/app/main.py");
    }

    @Test
    void resolve_blankPath_isRoot() {
        assertThat(gateway.resolve("")).isEqualTo(gateway.root());
        assertThat(gateway.resolve(null)).isEqualTo(gateway.root());
    }

    @Test
    void resolve_dotDotInsideRoot_isAllowed() {
        assertThat(gateway.relativize(gateway.resolve("src/../README.md"))).isEqualTo("README.md");
    }

    @Test
    void resolve_parentTraversal_rejected() {
        assertThatThrownBy(() -> gateway.resolve("../../etc/passwd"))
                .isInstanceOf(PathViolationException.class)
                .hasMessageContaining("outside the project root");
    }

    @Test
    void resolve_absolutePath_rejected() {
        assertThatThrownBy(() -> gateway.resolve("/etc/passwd"))
                .isInstanceOf(PathViolationException.class);
    }

    @Test
    void resolve_nulCharacter_rejected() {
        assertThatThrownBy(() -> gateway.resolve("a\0b"))
                .isInstanceOf(PathViolationException.class)
                .hasMessageContaining("NUL");
    }

    @Test
    void resolve_symlinkEscapingRoot_rejected() throws IOException {
        Path outside = Files.createDirectories(tmp.resolve("outside"));
        try {
            Files.createSymbolicLink(gateway.root().resolve("link"), outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported here");
        }

        assertThatThrownBy(() -> gateway.writeFile("link/evil.txt", "x"))
                .isInstanceOf(PathViolationException.class)
                .hasMessageContaining("symbolic link");
        assertThat(outside.resolve("evil.txt")).doesNotExist();
    }

    // ------------------------------------------------------------------
    // File operations
    // ------------------------------------------------------------------

    @Test
    void writeFile_createsParentsAndReturnsByteCount() {
        int bytes = gateway.writeFile("pkg/sub/mod.py", "print('hé')\n");

        assertThat(bytes).isEqualTo("print('hé')\n".getBytes(java.nio.charset.StandardCharsets.UTF_8).length);
        assertThat(gateway.readFile("pkg/sub/mod.py")).contains("print('hé')\n");
        assertThat(gateway.exists("pkg/sub")).isTrue();
    }

    @Test
    void writeFile_overwritesExistingContent() {
        gateway.writeFile("a.txt", "one");
        gateway.writeFile("a.txt", "two");
        assertThat(gateway.readFile("a.txt")).contains("two");
    }

    @Test
    void writeFile_outsideRoot_writesNothing() {
        assertThatThrownBy(() -> gateway.writeFile("../escaped.txt", "x"))
                .isInstanceOf(PathViolationException.class);
        assertThat(tmp.resolve("escaped.txt")).doesNotExist();
    }

    @Test
    void writeFile_ontoDirectory_rejected() {
        gateway.writeFile("dir/file.txt", "x");
        assertThatThrownBy(() -> gateway.writeFile("dir", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readFile_missing_isEmpty() {
        assertThat(gateway.readFile("nope.txt")).isEmpty();
    }

    @Test
    void listFiles_returnsSortedRelativePaths() {
        gateway.writeFile("b.py", "");
        gateway.writeFile("a/z.py", "");
        gateway.writeFile("a/y.py", "");

        assertThat(gateway.listFiles(".")).containsExactly("a/y.py", "a/z.py", "b.py");
        assertThat(gateway.listFiles("a")).containsExactly("a/y.py", "a/z.py");
    }

    @Test
    void listFiles_notADirectory_rejected() {
        gateway.writeFile("f.txt", "");
        assertThatThrownBy(() -> gateway.listFiles("f.txt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void currentDirectory_isRoot() {
        assertThat(gateway.currentDirectory()).isEqualTo(".");
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentWritesToSameFile_leaveOneCompleteVersion() throws Exception {
        int writers = 8;
        String[] contents = new String[writers];
        for (int i = 0; i < writers; i++) {
            contents[i] = String.valueOf((char) ('a' + i)).repeat(50_000);
        }
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (String c : contents) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return gateway.writeFile("shared.txt", c);
                }));
            }
            start.countDown();
            for (Future<Integer> f : futures) {
                assertThat(f.get(10, TimeUnit.SECONDS)).isEqualTo(50_000);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(gateway.readFile("shared.txt").orElseThrow()).isIn((Object[]) contents);
        assertThat(gateway.listFiles(".")).containsExactly("shared.txt");
    }
}

package com.codeforge.orchestrator.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * The single enforcement point for "no tool call may read or write outside its
 * project root".
 *
 * Every path is resolved against the root, normalised, and re-checked against
 * the real (symlink-free) location of its deepest existing ancestor. Anything
 * that lands outside the root raises {@link PathViolationException} before the
 * filesystem is touched.
 *
 * <p>Thread-safe. Writes to the same file are serialised with a per-path lock;
 * writes to distinct files proceed in parallel. Each write goes to a temp file
 * in the target directory and is then moved into place.
 */
public class SandboxedFileGateway {

    private static final Logger log = LoggerFactory.getLogger(SandboxedFileGateway.class);

    private static final String TEMP_PREFIX = ".codeforge-";

    private final Path root;
    private final ConcurrentHashMap<Path, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    /**
     * @param root the project's output directory; created if missing
     */
    public SandboxedFileGateway(Path root) {
        try {
            Files.createDirectories(root);
            this.root = root.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create sandbox root " + root, e);
        }
    }

    public Path root() { return root; }

    // ------------------------------------------------------------------
    // Path resolution
    // ------------------------------------------------------------------

    /**
     * Resolve a sandbox-relative path to an absolute path inside the root.
     * A null or blank path means the root itself.
     *
     * @throws PathViolationException if the canonical result is outside the root
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            return root;
        }
        if (path.indexOf('\0') >= 0) {
            throw new PathViolationException(path, "contains a NUL character");
        }
        Path candidate;
        try {
            candidate = root.resolve(path).normalize();
        } catch (InvalidPathException e) {
            throw new PathViolationException(path, "not a valid path: " + e.getReason());
        }
        if (!candidate.startsWith(root)) {
            throw new PathViolationException(path, "resolves outside the project root");
        }

        // Follow symlinks on the part of the path that already exists.
        Path existing = candidate;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new PathViolationException(path, "no existing ancestor");
        }
        Path canonical;
        try {
            canonical = existing.toRealPath().resolve(existing.relativize(candidate)).normalize();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot canonicalise " + candidate, e);
        }
        if (!canonical.startsWith(root)) {
            throw new PathViolationException(path, "escapes the project root through a symbolic link");
        }
        return canonical;
    }

    /** Render an absolute in-sandbox path as a '/'-separated sandbox-relative string. */
    public String relativize(Path absolute) {
        Path rel = root.relativize(absolute);
        String s = rel.toString().replace('\\', '/');
        return s.isEmpty() ? "." : s;
    }

    // ------------------------------------------------------------------
    // File operations
    // ------------------------------------------------------------------

    /**
     * Create or overwrite a file, creating parent directories as needed.
     *
     * @return number of bytes written (UTF-8)
     */
    public int writeFile(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("write_file requires a non-empty path");
        }
        if (content == null) {
            throw new IllegalArgumentException("write_file requires content");
        }
        Path target = resolve(path);
        if (target.equals(root) || Files.isDirectory(target)) {
            throw new IllegalArgumentException("'" + path + "' is a directory");
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        ReentrantLock lock = writeLocks.computeIfAbsent(target, p -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(target.getParent());
            // Parent creation may have followed a link created concurrently; re-check.
            resolve(path);
            Path tmp = Files.createTempFile(target.getParent(), TEMP_PREFIX, ".tmp");
            try {
                Files.write(tmp, bytes);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        } finally {
            lock.unlock();
        }
        log.debug("Wrote {} bytes to {}", bytes.length, relativize(target));
        return bytes.length;
    }

    /** Read a file; empty if it does not exist. */
    public Optional<String> readFile(String path) {
        Path target = resolve(path);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    /**
     * List every regular file below {@code directory}, as sandbox-relative
     * paths in lexical order. In-flight temp files are not listed.
     */
    public List<String> listFiles(String directory) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("'" + directory + "' is not a directory");
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith(TEMP_PREFIX))
                    .map(this::relativize)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    /** The sandbox-relative working directory, which is always the root. */
    public String currentDirectory() {
        return ".";
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

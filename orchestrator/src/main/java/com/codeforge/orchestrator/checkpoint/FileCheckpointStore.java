package com.codeforge.orchestrator.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link CheckpointStore} keeping one JSON file per project id under a base
 * directory.
 *
 * Each save writes the full document to a temp file in the same directory and
 * renames it over the previous checkpoint, so a crash mid-write leaves the old
 * checkpoint intact. The temp file is forced to disk before the rename.
 * Saves for the same file are serialised by a per-file lock; saves for
 * different ids run in parallel.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final String SUFFIX = ".checkpoint.json";

    private final Path         baseDir;
    private final ObjectMapper json;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileCheckpointStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.json    = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String save(Checkpoint checkpoint) {
        String id = checkpoint.projectId();
        String name = fileName(id);
        Path target = baseDir.resolve(name + SUFFIX);
        ReentrantLock lock = locks.computeIfAbsent(name, k -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(baseDir);
            byte[] bytes = json.writeValueAsBytes(checkpoint);
            Path tmp = Files.createTempFile(baseDir, "." + name, ".tmp");
            try {
                writeDurably(tmp, bytes);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CheckpointException("Cannot write checkpoint for " + id + " to " + target, e);
        } finally {
            lock.unlock();
        }
        log.info("Checkpoint saved: project={} stage={} path={}", id, checkpoint.lastCompletedStage(), target);
        return target.toString();
    }

    @Override
    public Optional<Checkpoint> load(String projectId) {
        Path file = fileFor(projectId);
        try {
            return Optional.of(json.readValue(Files.readAllBytes(file), Checkpoint.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointException("Cannot read checkpoint " + file, e);
        }
    }

    @Override
    public String locationOf(String projectId) {
        return fileFor(projectId).toString();
    }

    @Override
    public boolean delete(String projectId) {
        try {
            return Files.deleteIfExists(fileFor(projectId));
        } catch (IOException e) {
            throw new CheckpointException("Cannot delete checkpoint for " + projectId, e);
        }
    }

    private static void writeDurably(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
            channel.force(true);
        }
    }

    private Path fileFor(String projectId) {
        return baseDir.resolve(fileName(projectId) + SUFFIX);
    }

    /**
     * Maps a project id to a file name that stays inside the base directory.
     * Characters outside {@code [A-Za-z0-9._-]}, and leading dots, are
     * percent-encoded as UTF-8 bytes, so distinct ids never share a file.
     */
    static String fileName(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("project id must not be blank");
        }
        StringBuilder out = new StringBuilder(projectId.length());
        boolean leading = true;
        for (byte b : projectId.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            boolean plain = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '-' || (c == '.' && !leading);
            if (plain) {
                out.append((char) c);
            } else {
                out.append('%').append(String.format("%02X", c));
            }
            leading = leading && c == '.';
        }
        return out.toString();
    }
}

package com.wavegate.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link SessionStore} backed by flat JSON files.
 * <p>
 * Layout under the base directory:
 * <pre>
 * &lt;session-id&gt;/session.json
 * &lt;session-id&gt;/context.json
 * &lt;session-id&gt;/checkpoints/001.json
 * &lt;session-id&gt;/result.json
 * </pre>
 * Each file is written to a temporary sibling and moved into place, so readers only ever
 * see complete documents.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final String SESSION_FILE = "session.json";
    private static final String CONTEXT_FILE = "context.json";
    private static final String RESULT_FILE = "result.json";
    private static final String CHECKPOINT_DIR = "checkpoints";

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    public FileSessionStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = Objects.requireNonNull(baseDir, "Base directory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new StoreException("Cannot create store directory " + baseDir, e);
        }
        log.info("File session store at {}", baseDir.toAbsolutePath());
    }

    @Override
    public void createSession(Session session) {
        Path dir = sessionDir(session.id());
        if (Files.exists(dir.resolve(SESSION_FILE))) {
            throw new IllegalStateException("Session already exists: " + session.id());
        }
        write(dir.resolve(CONTEXT_FILE), SharedContext.empty());
        write(dir.resolve(SESSION_FILE), session);
    }

    @Override
    public Optional<Session> loadSession(String sessionId) {
        if (!isSafe(sessionId)) {
            return Optional.empty();
        }
        return read(sessionDir(sessionId).resolve(SESSION_FILE), Session.class);
    }

    @Override
    public void saveSession(Session session) {
        write(sessionDir(session.id()).resolve(SESSION_FILE), session);
    }

    @Override
    public SharedContext loadContext(String sessionId) {
        if (!isSafe(sessionId)) {
            return SharedContext.empty();
        }
        return read(sessionDir(sessionId).resolve(CONTEXT_FILE), SharedContext.class)
                .orElseGet(SharedContext::empty);
    }

    @Override
    public void saveContext(String sessionId, SharedContext context) {
        write(sessionDir(sessionId).resolve(CONTEXT_FILE), context);
    }

    @Override
    public void saveCheckpoint(String sessionId, Checkpoint checkpoint) {
        write(checkpointFile(sessionId, checkpoint.number()), checkpoint);
    }

    @Override
    public Optional<Checkpoint> loadCheckpoint(String sessionId, int number) {
        if (!isSafe(sessionId) || number < 1) {
            return Optional.empty();
        }
        return read(checkpointFile(sessionId, number), Checkpoint.class);
    }

    @Override
    public List<Checkpoint> listCheckpoints(String sessionId) {
        if (!isSafe(sessionId)) {
            return List.of();
        }
        Path dir = sessionDir(sessionId).resolve(CHECKPOINT_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        var checkpoints = new ArrayList<Checkpoint>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "[0-9]*.json")) {
            for (Path file : files) {
                read(file, Checkpoint.class).ifPresent(checkpoints::add);
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list checkpoints of session " + sessionId, e);
        }
        checkpoints.sort(Comparator.comparingInt(Checkpoint::number));
        return checkpoints;
    }

    @Override
    public void saveTerminalArtifact(TerminalArtifact artifact) {
        write(sessionDir(artifact.sessionId()).resolve(RESULT_FILE), artifact);
    }

    @Override
    public Optional<TerminalArtifact> loadTerminalArtifact(String sessionId) {
        if (!isSafe(sessionId)) {
            return Optional.empty();
        }
        return read(sessionDir(sessionId).resolve(RESULT_FILE), TerminalArtifact.class);
    }

    @Override
    public List<String> listSessionIds() {
        var sessions = new ArrayList<Session>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                String id = dir.getFileName().toString();
                if (isSafe(id)) {
                    loadSession(id).ifPresent(sessions::add);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list sessions in " + baseDir, e);
        }
        sessions.sort(Comparator.comparing(Session::createdAt).thenComparing(Session::id));
        return sessions.stream().map(Session::id).toList();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Path sessionDir(String sessionId) {
        if (!isSafe(sessionId)) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return baseDir.resolve(sessionId);
    }

    private Path checkpointFile(String sessionId, int number) {
        return sessionDir(sessionId).resolve(CHECKPOINT_DIR).resolve("%03d.json".formatted(number));
    }

    private static boolean isSafe(String sessionId) {
        return sessionId != null && SAFE_ID.matcher(sessionId).matches();
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new StoreException("Cannot read " + file, e);
        }
    }

    private void write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
                moveIntoPlace(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Wrote {}", file);
        } catch (IOException e) {
            throw new StoreException("Cannot write " + file, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

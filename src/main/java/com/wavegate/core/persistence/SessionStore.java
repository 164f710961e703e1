package com.wavegate.core.persistence;

import com.wavegate.core.model.Checkpoint;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SharedContext;
import com.wavegate.core.model.TerminalArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of sessions, keyed by session id.
 * <p>
 * Every write is atomic per key: a crash in the middle of a write leaves the previously
 * committed value intact. Implementations throw {@link StoreException} on I/O failures.
 */
public interface SessionStore {

    /**
     * Persists a new session together with an empty shared context.
     *
     * @throws IllegalStateException if a session with the same id already exists
     */
    void createSession(Session session);

    Optional<Session> loadSession(String sessionId);

    void saveSession(Session session);

    /** Shared context of a session; empty if none was saved yet. */
    SharedContext loadContext(String sessionId);

    void saveContext(String sessionId, SharedContext context);

    /** Inserts or overwrites the checkpoint with {@code checkpoint.number()}. */
    void saveCheckpoint(String sessionId, Checkpoint checkpoint);

    Optional<Checkpoint> loadCheckpoint(String sessionId, int number);

    /** All checkpoints of a session ordered by number. */
    List<Checkpoint> listCheckpoints(String sessionId);

    void saveTerminalArtifact(TerminalArtifact artifact);

    Optional<TerminalArtifact> loadTerminalArtifact(String sessionId);

    /** Ids of all stored sessions, oldest first. */
    List<String> listSessionIds();

    /** Loads a session or fails with {@link SessionNotFoundException}. */
    default Session requireSession(String sessionId) {
        return loadSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}

package ae.teletronics.ingest.application;

import ae.teletronics.ingest.application.dto.CompletedUpload;
import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.IngestException;
import ae.teletronics.ingest.application.exceptions.NotFoundException;
import ae.teletronics.ingest.application.exceptions.UploadSessionException;
import ae.teletronics.ingest.domain.UploadSessionStatus;
import ae.teletronics.ingest.domain.model.UploadSession;
import ae.teletronics.ingest.ports.ChunkFileStore;
import ae.teletronics.ingest.ports.ClockProvider;
import ae.teletronics.ingest.ports.UploadSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chunked, resumable uploads.
 *
 * Each session owns a temp file pre-sized to the declared total; chunk {@code i} is written at
 * offset {@code i * chunkSize}, so chunks may arrive in any order and a repeated chunk lands on
 * the same bytes. Writes for one session are serialized by a per-session lock, and the store
 * applies each chunk with a conditional update so a second node cannot double count it.
 */
@Service
public class ResumableUploadManager {

    private static final Logger log = LoggerFactory.getLogger(ResumableUploadManager.class);

    static final int SWEEP_BATCH_SIZE = 500;

    private final UploadSessionStore sessions;
    private final ChunkFileStore chunkFiles;
    private final ClockProvider clock;
    private final Duration sessionTtl;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ResumableUploadManager(UploadSessionStore sessions,
                                  ChunkFileStore chunkFiles,
                                  ClockProvider clock,
                                  @Value("${ingest.sessions.ttl:PT24H}") Duration sessionTtl) {
        this.sessions = sessions;
        this.chunkFiles = chunkFiles;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
    }

    public UploadSession initUpload(String filename,
                                    long totalSize,
                                    String mimeType,
                                    int chunkSize,
                                    String ownerId,
                                    Map<String, Object> metadata) throws IOException {
        if (!StringUtils.hasText(ownerId) || !StringUtils.hasText(filename)) {
            throw IngestException.invalidArgument("ownerId and filename are required");
        }
        if (totalSize <= 0) {
            throw IngestException.invalidArgument("totalSize must be > 0");
        }
        if (chunkSize <= 0) {
            throw IngestException.invalidArgument("chunkSize must be > 0");
        }
        if ((totalSize + chunkSize - 1) / chunkSize > Integer.MAX_VALUE) {
            throw IngestException.invalidArgument("chunkSize too small for a file of " + totalSize + " bytes");
        }

        String tempPath = chunkFiles.allocate(filename, totalSize);
        Instant now = clock.now();
        UploadSession session = new UploadSession(
                ownerId, filename, mimeType, totalSize, chunkSize, tempPath, metadata, now, now.plus(sessionTtl));
        try {
            session = sessions.create(session);
        } catch (RuntimeException e) {
            chunkFiles.delete(tempPath);
            throw e;
        }

        log.info("Upload session {} created for owner {}: {} bytes in {} chunk(s)",
                session.getId(), ownerId, totalSize, session.getTotalChunks());
        return session;
    }

    /**
     * Writes one chunk. A chunk that is already present is ignored and the current session
     * returned. Validation errors leave the session untouched; an I/O failure marks it FAILED.
     */
    public UploadSession uploadChunk(String sessionId, int chunkIndex, byte[] data, String ownerId) throws IOException {
        load(sessionId, ownerId);

        ReentrantLock lock = locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
        lock.lock();
        try {
            UploadSession session;
            try {
                session = load(sessionId, ownerId);
            } catch (NotFoundException e) {
                locks.remove(sessionId, lock);
                throw e;
            }

            if (session.getStatus() != UploadSessionStatus.ACTIVE) {
                throw new UploadSessionException(ErrorKind.SESSION_NOT_WRITABLE, sessionId,
                        "Upload session " + sessionId + " is " + session.getStatus() + " and accepts no more chunks");
            }
            if (!session.isValidChunkIndex(chunkIndex)) {
                throw new UploadSessionException(ErrorKind.INVALID_CHUNK_INDEX, sessionId,
                        "Invalid chunk index " + chunkIndex + ", expected 0.." + (session.getTotalChunks() - 1));
            }
            long expected = session.expectedChunkLength(chunkIndex);
            if (data == null || data.length != expected) {
                throw new UploadSessionException(ErrorKind.CHUNK_SIZE_MISMATCH, sessionId,
                        "Invalid chunk size: expected " + expected + ", got " + (data == null ? 0 : data.length));
            }
            if (session.hasChunk(chunkIndex)) {
                log.warn("Chunk {} already uploaded for session {}", chunkIndex, sessionId);
                return session;
            }

            try {
                chunkFiles.write(session.getTempStoragePath(), session.offsetOf(chunkIndex), data);
            } catch (IOException e) {
                log.error("Failed to write chunk {} for session {}", chunkIndex, sessionId, e);
                sessions.transition(sessionId, UploadSessionStatus.ACTIVE, UploadSessionStatus.FAILED, clock.now());
                throw e;
            }

            Optional<UploadSession> updated = sessions.recordChunk(sessionId, chunkIndex, data.length, clock.now());
            if (updated.isEmpty()) {
                // another node recorded it first, or the session left ACTIVE meanwhile
                return sessions.findById(sessionId)
                        .orElseThrow(() -> new NotFoundException("Upload session not found: " + sessionId));
            }

            UploadSession current = updated.get();
            if (current.isFullyUploaded()
                    && sessions.transition(sessionId, UploadSessionStatus.ACTIVE, UploadSessionStatus.COMPLETED, clock.now())) {
                current.setStatus(UploadSessionStatus.COMPLETED);
                log.info("Upload completed for session {}", sessionId);
            } else {
                log.debug("Chunk {} uploaded for session {} ({}%)", chunkIndex, sessionId, current.progressPercentage());
            }
            return current;
        } finally {
            lock.unlock();
        }
    }

    public UploadSession getStatus(String sessionId, String ownerId) {
        return load(sessionId, ownerId);
    }

    public List<Integer> getMissingChunks(String sessionId, String ownerId) {
        return load(sessionId, ownerId).missingChunks();
    }

    /**
     * Reads the assembled file back; the byte count must match the declared total.
     */
    public CompletedUpload completeUpload(String sessionId, String ownerId) throws IOException {
        UploadSession session = load(sessionId, ownerId);
        if (session.getStatus() != UploadSessionStatus.COMPLETED) {
            throw new UploadSessionException(ErrorKind.NOT_COMPLETED, sessionId,
                    "Upload session " + sessionId + " is not completed");
        }

        byte[] bytes = chunkFiles.readAll(session.getTempStoragePath());
        if (bytes.length != session.getTotalSize()) {
            log.error("Size mismatch for session {}: expected {}, got {}", sessionId, session.getTotalSize(), bytes.length);
            throw new UploadSessionException(ErrorKind.SIZE_MISMATCH, sessionId,
                    "File size mismatch: expected " + session.getTotalSize() + ", got " + bytes.length);
        }
        log.info("Upload verified for session {}", sessionId);
        return new CompletedUpload(bytes, session);
    }

    /**
     * Marks the session FAILED and removes its temp file and record. A session that no longer
     * exists (or has expired) is a no-op.
     */
    public void cancelUpload(String sessionId, String ownerId) throws IOException {
        Optional<UploadSession> found = sessions.findById(sessionId);
        if (found.isEmpty()) {
            return;
        }
        UploadSession session = found.get();
        if (!session.getOwnerId().equals(ownerId)) {
            throw new NotFoundException("Upload session not found: " + sessionId);
        }
        if (isGone(session, clock.now())) {
            return;
        }

        sessions.transition(sessionId, UploadSessionStatus.ACTIVE, UploadSessionStatus.FAILED, clock.now());
        destroy(session);
        log.info("Upload session {} cancelled", sessionId);
    }

    /**
     * Drops record and temp file after the content has been handed over.
     */
    public void release(String sessionId) throws IOException {
        Optional<UploadSession> found = sessions.findById(sessionId);
        if (found.isPresent()) {
            destroy(found.get());
            log.debug("Upload session {} released", sessionId);
        }
    }

    /**
     * Expires ACTIVE sessions past their deadline, then drops COMPLETED or FAILED sessions past
     * theirs that were never released. Failures are logged per session and never abort the sweep.
     *
     * @return number of ACTIVE sessions expired
     */
    public int sweepExpired() {
        Instant now = clock.now();
        List<UploadSession> expired = sessions.findExpiredActive(now, SWEEP_BATCH_SIZE);
        int count = 0;
        for (UploadSession s : expired) {
            try {
                if (sessions.transition(s.getId(), UploadSessionStatus.ACTIVE, UploadSessionStatus.EXPIRED, now)) {
                    count++;
                }
                destroy(s);
            } catch (Exception e) {
                log.error("Failed to clean up expired upload session {}: {}", s.getId(), e.getMessage(), e);
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} upload session(s)", count);
        }

        List<UploadSession> abandoned = sessions.findExpiredInactive(now, SWEEP_BATCH_SIZE);
        for (UploadSession s : abandoned) {
            try {
                destroy(s);
            } catch (Exception e) {
                log.error("Failed to drop abandoned upload session {}: {}", s.getId(), e.getMessage(), e);
            }
        }
        if (!abandoned.isEmpty()) {
            log.info("Dropped {} abandoned completed or failed upload session(s)", abandoned.size());
        }
        return count;
    }

    int trackedLocks() {
        return locks.size();
    }

    /* helpers */

    private UploadSession load(String sessionId, String ownerId) {
        UploadSession session = sessions.findById(sessionId)
                .filter(s -> s.getOwnerId().equals(ownerId))
                .orElseThrow(() -> new NotFoundException("Upload session not found: " + sessionId));
        if (isGone(session, clock.now())) {
            throw new NotFoundException("Upload session not found: " + sessionId);
        }
        return session;
    }

    private static boolean isGone(UploadSession session, Instant now) {
        return session.getStatus() == UploadSessionStatus.EXPIRED || session.isExpiredAt(now);
    }

    private void destroy(UploadSession session) throws IOException {
        try {
            chunkFiles.delete(session.getTempStoragePath());
        } finally {
            sessions.delete(session.getId());
            locks.remove(session.getId());
        }
    }
}

package ae.teletronics.ingest.ports;

import ae.teletronics.ingest.domain.UploadSessionStatus;
import ae.teletronics.ingest.domain.model.UploadSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of in-flight chunked uploads. Mutations are conditional so that two writers
 * can never both apply the same chunk or both move a session out of ACTIVE.
 */
public interface UploadSessionStore {

    UploadSession create(UploadSession session);

    Optional<UploadSession> findById(String sessionId);

    /**
     * Adds the chunk index and its length if the session is ACTIVE and does not have it yet.
     *
     * @return the updated session, or empty when nothing was applied
     */
    Optional<UploadSession> recordChunk(String sessionId, int chunkIndex, long length, Instant now);

    /**
     * Compare-and-set on the status field.
     *
     * @return true if this call performed the transition
     */
    boolean transition(String sessionId, UploadSessionStatus from, UploadSessionStatus to, Instant now);

    List<UploadSession> findExpiredActive(Instant now, int limit);

    /**
     * COMPLETED or FAILED sessions whose deadline has passed, oldest first.
     */
    List<UploadSession> findExpiredInactive(Instant now, int limit);

    void delete(String sessionId);
}

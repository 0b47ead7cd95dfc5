package ae.teletronics.ingest.adapters.persistence;

import ae.teletronics.ingest.domain.UploadSessionStatus;
import ae.teletronics.ingest.domain.model.UploadSession;
import ae.teletronics.ingest.ports.UploadSessionStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Upload sessions in the {@code upload_sessions} collection. Chunk bookkeeping is a single
 * findAndModify guarded on status and on the chunk not being present yet.
 */
public class MongoUploadSessionStore implements UploadSessionStore {

    private final MongoTemplate mongo;

    public MongoUploadSessionStore(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public UploadSession create(UploadSession session) {
        return mongo.insert(session);
    }

    @Override
    public Optional<UploadSession> findById(String sessionId) {
        return Optional.ofNullable(mongo.findById(sessionId, UploadSession.class));
    }

    @Override
    public Optional<UploadSession> recordChunk(String sessionId, int chunkIndex, long length, Instant now) {
        Query q = Query.query(Criteria.where("_id").is(sessionId)
                .and("status").is(UploadSessionStatus.ACTIVE)
                .and("uploadedChunks").ne(chunkIndex));
        Update u = new Update()
                .addToSet("uploadedChunks", chunkIndex)
                .inc("uploadedSize", length)
                .set("updatedAt", now);
        return Optional.ofNullable(mongo.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), UploadSession.class));
    }

    @Override
    public boolean transition(String sessionId, UploadSessionStatus from, UploadSessionStatus to, Instant now) {
        Query q = Query.query(Criteria.where("_id").is(sessionId).and("status").is(from));
        Update u = new Update().set("status", to).set("updatedAt", now);
        return mongo.updateFirst(q, u, UploadSession.class).getModifiedCount() > 0;
    }

    @Override
    public List<UploadSession> findExpiredActive(Instant now, int limit) {
        Query q = Query.query(Criteria.where("status").is(UploadSessionStatus.ACTIVE).and("expiresAt").lt(now))
                .with(Sort.by(Sort.Direction.ASC, "expiresAt"))
                .limit(limit);
        return mongo.find(q, UploadSession.class);
    }

    @Override
    public List<UploadSession> findExpiredInactive(Instant now, int limit) {
        Query q = Query.query(Criteria.where("status").in(UploadSessionStatus.COMPLETED, UploadSessionStatus.FAILED)
                        .and("expiresAt").lt(now))
                .with(Sort.by(Sort.Direction.ASC, "expiresAt"))
                .limit(limit);
        return mongo.find(q, UploadSession.class);
    }

    @Override
    public void delete(String sessionId) {
        mongo.remove(Query.query(Criteria.where("_id").is(sessionId)), UploadSession.class);
    }
}

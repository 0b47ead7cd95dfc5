package ae.teletronics.ingest.adapters.persistence.repo;

import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.StoredFile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class StoredFileRepositoryImpl implements StoredFileRepositoryCustom {

    @Autowired
    MongoTemplate mongoTemplate;

    @Override
    public boolean recordBackup(String fileId, ProviderKind provider, String objectId, String url, Instant now) {
        return mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(fileId).and("status").ne(FileStatus.DELETED)),
                new Update()
                        .set("backupProvider", provider)
                        .set("backupObjectId", objectId)
                        .set("backupUrl", url)
                        .set("updatedAt", now),
                StoredFile.class
        ).getModifiedCount() > 0;
    }

    @Override
    public boolean markDeleted(String fileId, Instant now) {
        return mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(fileId).and("status").ne(FileStatus.DELETED)),
                new Update()
                        .set("status", FileStatus.DELETED)
                        .set("deletedAt", now)
                        .set("updatedAt", now),
                StoredFile.class
        ).getModifiedCount() > 0;
    }
}

package ae.teletronics.ingest.adapters.persistence.repo;

import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.model.StoredFile;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface StoredFileRepository
        extends MongoRepository<StoredFile, String>, StoredFileRepositoryCustom {

    Optional<StoredFile> findFirstByOwnerIdAndContentHashAndStatus(String ownerId, String contentHash, FileStatus status);
}

package ae.teletronics.ingest.adapters.persistence.repo;

import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.FileVariant;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface FileVariantRepository extends MongoRepository<FileVariant, String> {

    List<FileVariant> findByFileId(String fileId);

    Optional<FileVariant> findByFileIdAndVariant(String fileId, VariantKind variant);

    long deleteByFileId(String fileId);
}

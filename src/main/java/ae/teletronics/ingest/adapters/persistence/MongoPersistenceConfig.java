package ae.teletronics.ingest.adapters.persistence;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Auditing fills createdAt/updatedAt on files and variants.
 * Indexes come from the document annotations (auto-index-creation).
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "ae.teletronics.ingest.adapters.persistence.repo")
public class MongoPersistenceConfig {
}

package ae.teletronics.ingest.ports;

import java.io.IOException;
import java.util.Objects;

/**
 * Local holding area for accepted bytes between the upload call and the workers that push
 * them to remote providers. Keys are opaque to callers.
 */
public interface StagingStoragePort {

    /**
     * Persist the binary stream and return the assigned key and size.
     *
     * @param source        re-openable stream source
     * @param suggestedKey  optional key hint (e.g., owner/generated-name); null picks a random key
     */
    StagedObject save(StreamSource source, String suggestedKey) throws IOException;

    /**
     * Read the whole object back.
     *
     * @throws java.nio.file.NoSuchFileException when nothing is staged under the key
     */
    byte[] read(String key) throws IOException;

    /**
     * Idempotent: no error if the object doesn't exist.
     */
    void delete(String key) throws IOException;

    record StagedObject(String key, long size) {
        public StagedObject {
            Objects.requireNonNull(key, "key");
        }
    }
}

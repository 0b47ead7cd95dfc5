package ae.teletronics.ingest.ports;

import java.io.IOException;

/**
 * Pre-sized temp files that receive chunk payloads at fixed offsets.
 */
public interface ChunkFileStore {

    /**
     * Create an empty file of exactly {@code totalSize} bytes and return its path.
     */
    String allocate(String filenameHint, long totalSize) throws IOException;

    void write(String path, long offset, byte[] data) throws IOException;

    /** Reads the whole file; the caller checks the length. */
    byte[] readAll(String path) throws IOException;

    /** Idempotent. */
    void delete(String path) throws IOException;
}

package ae.teletronics.ingest.adapters.storage;

import ae.teletronics.ingest.application.util.FilenameGenerator;
import ae.teletronics.ingest.application.util.TokenGenerator;
import ae.teletronics.ingest.ports.ChunkFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Temp files for chunked uploads, named {@code upload_<millis>_<random>_<safe-name>} under one directory.
 */
public class LocalChunkFileStore implements ChunkFileStore {

    private static final Logger log = LoggerFactory.getLogger(LocalChunkFileStore.class);

    private static final int MAX_NAME_LENGTH = 80;

    private final Path tempDir;

    public LocalChunkFileStore(Path tempDir) throws IOException {
        this.tempDir = Objects.requireNonNull(tempDir, "tempDir").toAbsolutePath().normalize();
        Files.createDirectories(this.tempDir);
    }

    @Override
    public String allocate(String filenameHint, long totalSize) throws IOException {
        String safeName = FilenameGenerator.sanitize(filenameHint);
        if (safeName.length() > MAX_NAME_LENGTH) safeName = safeName.substring(safeName.length() - MAX_NAME_LENGTH);
        Path file = tempDir.resolve("upload_" + System.currentTimeMillis() + "_" + TokenGenerator.randomSuffix(6) + "_" + safeName);

        // setLength leaves a sparse file on most file systems
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.setLength(totalSize);
        }
        log.debug("Allocated {} bytes at {}", totalSize, file);
        return file.toString();
    }

    @Override
    public void write(String path, long offset, byte[] data) throws IOException {
        Path file = resolve(path);
        if (!Files.exists(file)) throw new NoSuchFileException(path);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(data);
            long position = offset;
            while (buf.hasRemaining()) {
                position += ch.write(buf, position);
            }
        }
    }

    @Override
    public byte[] readAll(String path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public void delete(String path) throws IOException {
        if (path == null || path.isBlank()) return;
        if (Files.deleteIfExists(resolve(path))) {
            log.debug("Deleted temp file {}", path);
        }
    }

    private Path resolve(String path) throws IOException {
        Path p = Path.of(path).toAbsolutePath().normalize();
        if (!p.startsWith(tempDir)) {
            throw new IOException("Path is outside the upload temp directory: " + path);
        }
        return p;
    }
}

package ae.teletronics.ingest.adapters.storage;

import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StreamSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.UUID;

/**
 * Staging area on the local file system. Writes go to a temp sibling first and are moved
 * into place, so a reader never sees a half-written object.
 */
public class LocalFsStorageAdapter implements StagingStoragePort {

    private final Path rootDir;
    private final boolean fsyncOnWrite;

    public LocalFsStorageAdapter(Path rootDir, boolean fsyncOnWrite) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
        this.fsyncOnWrite = fsyncOnWrite;
    }

    @Override
    public StagedObject save(StreamSource source, String suggestedKey) throws IOException {
        Objects.requireNonNull(source, "source");

        final String key = (suggestedKey != null && !suggestedKey.isBlank())
                ? sanitizeKey(suggestedKey)
                : randomKey();

        Path target = resolve(key);
        Files.createDirectories(target.getParent());
        Path partial = target.resolveSibling(target.getFileName() + ".part");

        long total = 0L;
        try (InputStream in = source.openStream();
             OutputStream out = Files.newOutputStream(partial, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) != -1) {
                out.write(buf, 0, r);
                total += r;
            }
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }

        if (fsyncOnWrite) {
            try (FileChannel ch = FileChannel.open(partial, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
        }
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        return new StagedObject(key, total);
    }

    @Override
    public byte[] read(String key) throws IOException {
        Path p = resolve(sanitizeKey(key));
        if (!Files.exists(p)) throw new NoSuchFileException(key);
        return Files.readAllBytes(p);
    }

    @Override
    public void delete(String key) throws IOException {
        if (key == null || key.isBlank()) return;
        Path p = resolve(sanitizeKey(key));
        try {
            Files.deleteIfExists(p);
            Path parent = p.getParent();
            for (int i = 0; i < 2 && parent != null && !parent.equals(rootDir); i++) {
                try {
                    Files.delete(parent);
                    parent = parent.getParent();
                } catch (DirectoryNotEmptyException | NoSuchFileException ex) {
                    break;
                }
            }
        } catch (SecurityException se) {
            throw new IOException("Failed to delete: " + key, se);
        }
    }

    /* helpers */

    private Path resolve(String safeKey) throws IOException {
        Path p = rootDir.resolve(safeKey).normalize();
        if (!p.startsWith(rootDir) || p.equals(rootDir)) {
            throw new IOException("Refusing to escape root directory: " + safeKey);
        }
        return p;
    }

    private static String sanitizeKey(String input) {
        String trimmed = input.trim().replace("\\", "/");
        while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
        return trimmed;
    }

    private static String randomKey() {
        String uuid = UUID.randomUUID().toString().replace("-", "");
        return uuid.substring(0, 2) + "/" + uuid.substring(2, 4) + "/" + uuid;
    }
}

package ae.teletronics.ingest.adapters.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class LocalChunkFileStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void allocate_creates_presized_file_inside_temp_dir() throws Exception {
        LocalChunkFileStore store = new LocalChunkFileStore(tempDir.resolve("chunks"));

        String path = store.allocate("../evil name.bin", 1000);

        Path p = Path.of(path);
        assertThat(p.getParent()).isEqualTo(tempDir.resolve("chunks").toAbsolutePath().normalize());
        assertThat(p.getFileName().toString()).matches("upload_\\d+_[a-z0-9]{6}_.._evil_name\\.bin");
        assertThat(Files.size(p)).isEqualTo(1000);
    }

    @Test
    void writes_land_at_their_offsets_in_any_order() throws Exception {
        LocalChunkFileStore store = new LocalChunkFileStore(tempDir);
        String path = store.allocate("a.txt", 6);

        store.write(path, 4, "ef".getBytes());
        store.write(path, 0, "ab".getBytes());
        store.write(path, 2, "cd".getBytes());

        assertThat(new String(store.readAll(path))).isEqualTo("abcdef");
    }

    @Test
    void write_to_deleted_file_fails() throws Exception {
        LocalChunkFileStore store = new LocalChunkFileStore(tempDir);
        String path = store.allocate("a.txt", 2);
        store.delete(path);

        assertThatThrownBy(() -> store.write(path, 0, "x".getBytes())).isInstanceOf(NoSuchFileException.class);
        assertThatCode(() -> store.delete(path)).doesNotThrowAnyException();
    }

    @Test
    void paths_outside_temp_dir_are_refused() throws Exception {
        LocalChunkFileStore store = new LocalChunkFileStore(tempDir.resolve("chunks"));
        Path outside = Files.writeString(tempDir.resolve("other.txt"), "keep");

        assertThatThrownBy(() -> store.readAll(outside.toString())).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> store.delete(outside.toString())).isInstanceOf(IOException.class);
        assertThat(Files.exists(outside)).isTrue();
    }
}

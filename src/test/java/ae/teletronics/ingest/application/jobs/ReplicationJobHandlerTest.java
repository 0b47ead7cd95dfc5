package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.exceptions.ProviderException;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.testing.InMemoryStorageProvider;
import ae.teletronics.ingest.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReplicationJobHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String KEY = "u1/cat_1_abcdef.png";

    @Mock StoredFileRepository files;
    @Mock StagingStoragePort staging;
    InMemoryStorageProvider cloudinary;
    InMemoryStorageProvider s3;
    ReplicationJobHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        when(staging.read(KEY)).thenReturn(new byte[]{7, 7});
        cloudinary = new InMemoryStorageProvider(ProviderKind.TRANSFORM, EnumSet.of(FileTypeCategory.IMAGE));
        s3 = new InMemoryStorageProvider(ProviderKind.OBJECT_STORE, EnumSet.allOf(FileTypeCategory.class));

        handler = new ReplicationJobHandler(files, staging, new ProviderRouter(List.of(cloudinary, s3)),
                new MutableClock(NOW));
    }

    private StoredFile readyImage() {
        StoredFile f = new StoredFile("u1", "cat.png", "cat_1_abcdef.png", "image/png", 2, "h", null, null, null);
        f.setId("f1");
        f.markReady(ProviderKind.TRANSFORM, "image/upload/cat_1_abcdef", "https://res.example/cat.png", Map.of());
        when(files.findById("f1")).thenReturn(Optional.of(f));
        return f;
    }

    private static QueuedJob job() {
        return new QueuedJob(JobKind.REPLICATE_BACKUP,
                Map.of(JobPayloads.FILE_ID, "f1", JobPayloads.STAGING_KEY, KEY), 5, 3, 2000, NOW);
    }

    @Test
    void private_copy_goes_to_backup_folder_and_is_recorded() throws Exception {
        readyImage();

        handler.handle(job());

        assertThat(s3.objects()).containsOnlyKeys("backups/backup_cat_1_abcdef.png");
        verify(files).recordBackup("f1", ProviderKind.OBJECT_STORE, "backups/backup_cat_1_abcdef.png",
                "mem://s3/backups/backup_cat_1_abcdef.png", NOW);
        verify(staging).delete(KEY);
    }

    @Test
    void backup_failure_is_swallowed_and_staging_still_dropped() throws Exception {
        readyImage();
        StorageProvider failing = mock(StorageProvider.class);
        when(failing.kind()).thenReturn(ProviderKind.OBJECT_STORE);
        when(failing.upload(any())).thenThrow(new ProviderException(ProviderKind.OBJECT_STORE, "s3 down", null));
        handler = new ReplicationJobHandler(files, staging, new ProviderRouter(List.of(cloudinary, failing)),
                new MutableClock(NOW));

        assertThatCode(() -> handler.handle(job())).doesNotThrowAnyException();

        verify(files, never()).recordBackup(any(), any(), any(), any(), any());
        verify(staging).delete(KEY);
    }

    @Test
    void deleted_file_only_drops_staging() throws Exception {
        StoredFile f = readyImage();
        f.markDeleted(NOW);

        handler.handle(job());

        assertThat(s3.objects()).isEmpty();
        verify(staging, never()).read(anyString());
        verify(staging).delete(KEY);
    }

    @Test
    void unreadable_staging_fails_the_attempt() throws Exception {
        readyImage();
        when(staging.read(KEY)).thenThrow(new IOException("gone"));

        assertThatThrownBy(() -> handler.handle(job())).isInstanceOf(IOException.class);
    }
}

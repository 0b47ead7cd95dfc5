package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.FileVariantRepository;
import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.ports.StorageProvider.DeleteRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CleanupJobHandlerTest {

    @Mock StoredFileRepository files;
    @Mock FileVariantRepository variants;
    @Mock StagingStoragePort staging;
    @Mock StorageProvider cloudinary;
    @Mock StorageProvider s3;
    CleanupJobHandler handler;

    @BeforeEach
    void setUp() {
        when(cloudinary.kind()).thenReturn(ProviderKind.TRANSFORM);
        when(s3.kind()).thenReturn(ProviderKind.OBJECT_STORE);
        when(variants.deleteByFileId("f1")).thenReturn(2L);

        handler = new CleanupJobHandler(files, variants, staging, new ProviderRouter(List.of(cloudinary, s3)));
    }

    private static QueuedJob job() {
        return new QueuedJob(JobKind.CLEANUP, Map.of(JobPayloads.FILE_ID, "f1"), 10, 3, 2000, Instant.EPOCH);
    }

    @Test
    void primary_backup_variants_and_staging_are_removed() throws Exception {
        StoredFile f = new StoredFile("User 1", "cat.png", "cat_1_abcdef.png", "image/png", 2, "h", null, null, null);
        f.setId("f1");
        f.markReady(ProviderKind.TRANSFORM, "image/upload/cat_1_abcdef", "https://res.example/cat.png", Map.of());
        f.setBackupProvider(ProviderKind.OBJECT_STORE);
        f.setBackupObjectId("backups/backup_cat_1_abcdef.png");
        f.markDeleted(Instant.EPOCH);
        when(files.findById("f1")).thenReturn(Optional.of(f));

        handler.handle(job());

        verify(cloudinary).delete(DeleteRequest.byId("image/upload/cat_1_abcdef", true));
        verify(s3).delete(DeleteRequest.byId("backups/backup_cat_1_abcdef.png", true));
        verify(variants).deleteByFileId("f1");
        verify(staging).delete(JobPayloads.stagingKey(f));
    }

    @Test
    void file_never_stored_only_drops_local_state() throws Exception {
        StoredFile f = new StoredFile("u1", "doc.pdf", "doc_1_abcdef.pdf", "application/pdf", 2, "h", null, null, null);
        f.setId("f1");
        f.markFailed("boom", Instant.EPOCH);
        when(files.findById("f1")).thenReturn(Optional.of(f));

        handler.handle(job());

        verify(cloudinary, never()).delete(any());
        verify(s3, never()).delete(any());
        verify(staging).delete("u1/doc_1_abcdef.pdf");
    }

    @Test
    void missing_file_still_removes_variant_rows() throws Exception {
        when(files.findById("f1")).thenReturn(Optional.empty());

        handler.handle(job());

        verify(variants).deleteByFileId("f1");
        verifyNoInteractions(staging);
    }
}

package ae.teletronics.ingest.application;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.dto.CompletedUpload;
import ae.teletronics.ingest.application.dto.UploadCommand;
import ae.teletronics.ingest.application.exceptions.ErrorKind;
import ae.teletronics.ingest.application.exceptions.IngestException;
import ae.teletronics.ingest.application.jobs.JobPayloads;
import ae.teletronics.ingest.application.policy.ContentInspector;
import ae.teletronics.ingest.application.policy.UploadPolicy;
import ae.teletronics.ingest.domain.FileCategory;
import ae.teletronics.ingest.domain.FilePrivacy;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.FileTypeCategory;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.VariantKind;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.domain.model.UploadSession;
import ae.teletronics.ingest.ports.FileTypeDetector;
import ae.teletronics.ingest.ports.JobQueue;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StagingStoragePort.StagedObject;
import ae.teletronics.ingest.ports.VirusScanner;
import ae.teletronics.ingest.ports.VirusScanner.ScanReport;
import ae.teletronics.ingest.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UploadOrchestratorTest {

    private static final String OWNER = "u1";
    private static final byte[] PNG = new byte[]{(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 13};

    @Mock StoredFileRepository files;
    @Mock StagingStoragePort staging;
    @Mock JobQueue queue;
    @Mock FileTypeDetector detector;
    @Mock VirusScanner scanner;
    @Mock ResumableUploadManager resumable;
    MutableClock clock;

    UploadOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

        when(files.findFirstByOwnerIdAndContentHashAndStatus(anyString(), anyString(), eq(FileStatus.READY)))
                .thenReturn(Optional.empty());
        when(files.save(any(StoredFile.class))).thenAnswer(inv -> {
            StoredFile f = inv.getArgument(0);
            if (f.getId() == null) f.setId(UUID.randomUUID().toString());
            return f;
        });
        when(staging.save(any(), anyString())).thenAnswer(inv -> new StagedObject(inv.getArgument(1), 1L));
        when(detector.detect(any(), any())).thenReturn(Optional.empty());
        when(scanner.scan(any())).thenReturn(ScanReport.clean("test"));

        orchestrator = newOrchestrator(false);
    }

    private UploadOrchestrator newOrchestrator(boolean strictScan) {
        return new UploadOrchestrator(files, staging, queue,
                new UploadPolicy(1024, List.of("image/*", "application/pdf", "text/plain")),
                new ContentInspector(detector), scanner, resumable, clock, strictScan);
    }

    private static UploadCommand cmd(String name, String mime, byte[] bytes, List<VariantKind> variants) {
        return new UploadCommand(OWNER, name, mime, bytes, FileCategory.MEDIA, FilePrivacy.PUBLIC, variants, Map.of("k", "v"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void new_image_is_staged_persisted_and_enqueued_with_image_priority() throws Exception {
        StoredFile file = orchestrator.submitUpload(cmd("My Photo.png", "image/png", PNG, List.of(VariantKind.THUMBNAIL)));

        assertThat(file.getId()).isNotNull();
        assertThat(file.getStatus()).isEqualTo(FileStatus.UPLOADING);
        assertThat(file.getTypeCategory()).isEqualTo(FileTypeCategory.IMAGE);
        assertThat(file.getGeneratedFilename()).matches("My_Photo_" + clock.now().toEpochMilli() + "_[a-z0-9]{6}\\.png");
        assertThat(file.getContentHash()).hasSize(64);
        assertThat(file.getMetadata()).containsEntry("k", "v").containsKeys("uploadedAt", "virusScanResult");

        verify(staging).save(any(), eq(JobPayloads.stagingKey(file)));

        ArgumentCaptor<Map<String, String>> payload = ArgumentCaptor.forClass(Map.class);
        verify(queue).enqueue(eq(JobKind.ACCEPT_UPLOAD), payload.capture(), eq(1));
        assertThat(payload.getValue())
                .containsEntry(JobPayloads.FILE_ID, file.getId())
                .containsEntry(JobPayloads.STAGING_KEY, JobPayloads.stagingKey(file))
                .containsEntry(JobPayloads.VARIANTS, "THUMBNAIL");
    }

    @Test
    void document_gets_document_priority() throws Exception {
        orchestrator.submitUpload(cmd("report.pdf", "application/pdf", "%PDF-1.4".getBytes(StandardCharsets.US_ASCII), List.of()));

        verify(queue).enqueue(eq(JobKind.ACCEPT_UPLOAD), anyMap(), eq(3));
    }

    @Test
    void same_content_for_same_owner_returns_existing_ready_file() throws Exception {
        StoredFile existing = new StoredFile(OWNER, "old.png", "old_1_abcdef.png", "image/png", PNG.length, "h", null, null, null);
        existing.setId("f-existing");
        existing.setStatus(FileStatus.READY);
        when(files.findFirstByOwnerIdAndContentHashAndStatus(eq(OWNER), anyString(), eq(FileStatus.READY)))
                .thenReturn(Optional.of(existing));

        StoredFile result = orchestrator.submitUpload(cmd("again.png", "image/png", PNG, List.of()));

        assertThat(result.getId()).isEqualTo("f-existing");
        verify(staging, never()).save(any(), any());
        verify(files, never()).save(any());
        verifyNoInteractions(queue);
    }

    @Test
    void script_in_first_kilobyte_is_rejected_before_staging() throws Exception {
        byte[] evil = "hello <script>alert(1)</script>".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("note.txt", "text/plain", evil, List.of())))
                .isInstanceOf(IngestException.class)
                .extracting(e -> ((IngestException) e).getKind()).isEqualTo(ErrorKind.SUSPICIOUS_CONTENT);
        verify(staging, never()).save(any(), any());
        verifyNoInteractions(queue);
    }

    @Test
    void mime_mismatch_is_only_a_warning() throws Exception {
        when(detector.detect(any(), any())).thenReturn(Optional.of("application/x-msdownload"));

        StoredFile file = orchestrator.submitUpload(cmd("pic.png", "image/png", PNG, List.of()));

        assertThat(file.getMetadata()).containsEntry("detectedMimeType", "application/x-msdownload");
        assertThat((List<?>) file.getMetadata().get("warnings")).hasSize(1);
        verify(queue).enqueue(eq(JobKind.ACCEPT_UPLOAD), anyMap(), anyInt());
    }

    @Test
    void policy_rejects_size_and_type() {
        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("big.png", "image/png", new byte[2048], List.of())))
                .extracting(e -> ((IngestException) e).getKind()).isEqualTo(ErrorKind.REJECTED);
        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("x.exe", "application/x-msdownload", new byte[4], List.of())))
                .extracting(e -> ((IngestException) e).getKind()).isEqualTo(ErrorKind.REJECTED);
    }

    @Test
    void empty_content_is_invalid() {
        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("e.txt", "text/plain", new byte[0], List.of())))
                .extracting(e -> ((IngestException) e).getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void infected_upload_is_rejected() throws Exception {
        when(scanner.scan(any())).thenReturn(ScanReport.infected("ClamAV", List.of("Eicar-Test-Signature")));

        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("v.png", "image/png", PNG, List.of())))
                .isInstanceOf(IngestException.class)
                .hasMessageContaining("Eicar-Test-Signature");
        verifyNoInteractions(queue);
    }

    @Test
    void scanner_error_is_accepted_unless_strict() throws Exception {
        when(scanner.scan(any())).thenReturn(ScanReport.error("ClamAV", "connection refused"));

        StoredFile file = orchestrator.submitUpload(cmd("a.png", "image/png", PNG, List.of()));
        @SuppressWarnings("unchecked")
        Map<String, Object> scan = (Map<String, Object>) file.getMetadata().get("virusScanResult");
        assertThat(scan).containsEntry("scanned", false).containsEntry("clean", false);

        UploadOrchestrator strict = newOrchestrator(true);
        assertThatThrownBy(() -> strict.submitUpload(cmd("b.png", "image/png", PNG, List.of())))
                .extracting(e -> ((IngestException) e).getKind()).isEqualTo(ErrorKind.REJECTED);
    }

    @Test
    void enqueue_failure_marks_file_failed_and_drops_staged_bytes() throws Exception {
        when(queue.enqueue(any(), anyMap(), anyInt())).thenThrow(new IllegalStateException("queue down"));

        assertThatThrownBy(() -> orchestrator.submitUpload(cmd("a.png", "image/png", PNG, List.of())))
                .isInstanceOf(IllegalStateException.class);

        ArgumentCaptor<StoredFile> saved = ArgumentCaptor.forClass(StoredFile.class);
        verify(files, times(2)).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(FileStatus.FAILED);
        verify(staging).delete(JobPayloads.stagingKey(saved.getValue()));
    }

    @Test
    void finalize_hands_session_content_over_and_releases_it() throws Exception {
        UploadSession session = new UploadSession(OWNER, "clip.png", "image/png", PNG.length, 4, "/tmp/x",
                Map.of("source", "mobile"), clock.now(), clock.now().plusSeconds(60));
        session.setId("s1");
        when(resumable.completeUpload("s1", OWNER)).thenReturn(new CompletedUpload(PNG, session));

        StoredFile file = orchestrator.finalizeResumableUpload("s1", OWNER, FileCategory.MEDIA, FilePrivacy.PRIVATE, List.of());

        assertThat(file.getOriginalName()).isEqualTo("clip.png");
        assertThat(file.getPrivacy()).isEqualTo(FilePrivacy.PRIVATE);
        assertThat(file.getMetadata()).containsEntry("source", "mobile");
        verify(resumable).release("s1");
    }

    @Test
    void finalize_keeps_session_when_submission_fails() throws Exception {
        UploadSession session = new UploadSession(OWNER, "evil.txt", "text/plain", 8, 8, "/tmp/x",
                null, clock.now(), clock.now().plusSeconds(60));
        session.setId("s2");
        when(resumable.completeUpload("s2", OWNER))
                .thenReturn(new CompletedUpload("<script>".getBytes(StandardCharsets.UTF_8), session));

        assertThatThrownBy(() -> orchestrator.finalizeResumableUpload("s2", OWNER, null, null, List.of()))
                .isInstanceOf(IngestException.class);
        verify(resumable, never()).release(anyString());
    }
}

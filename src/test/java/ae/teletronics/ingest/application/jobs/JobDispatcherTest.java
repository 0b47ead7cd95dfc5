package ae.teletronics.ingest.application.jobs;

import ae.teletronics.ingest.adapters.persistence.repo.StoredFileRepository;
import ae.teletronics.ingest.application.exceptions.NotFoundException;
import ae.teletronics.ingest.application.exceptions.ProviderException;
import ae.teletronics.ingest.application.routing.ProviderRouter;
import ae.teletronics.ingest.domain.FileStatus;
import ae.teletronics.ingest.domain.JobKind;
import ae.teletronics.ingest.domain.JobStatus;
import ae.teletronics.ingest.domain.ProviderKind;
import ae.teletronics.ingest.domain.QueueName;
import ae.teletronics.ingest.domain.model.QueuedJob;
import ae.teletronics.ingest.domain.model.StoredFile;
import ae.teletronics.ingest.ports.StagingStoragePort;
import ae.teletronics.ingest.ports.StorageProvider;
import ae.teletronics.ingest.testing.InMemoryJobQueue;
import ae.teletronics.ingest.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JobDispatcherTest {

    MutableClock clock;
    InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        queue = new InMemoryJobQueue(clock, RetryPolicy.defaults());
    }

    interface Body {
        void run(QueuedJob job) throws Exception;
    }

    private static JobHandler handler(JobKind kind, Body body) {
        return new JobHandler() {
            @Override
            public JobKind kind() { return kind; }

            @Override
            public void handle(QueuedJob job) throws Exception { body.run(job); }
        };
    }

    @Test
    void successful_job_is_acked() {
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of(handler(JobKind.CLEANUP, job -> { })));
        QueuedJob job = queue.enqueue(JobKind.CLEANUP, Map.of(), 10);

        assertThat(dispatcher.runNext(QueueName.PROCESSING)).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(dispatcher.runNext(QueueName.PROCESSING)).isFalse();
    }

    @Test
    void lower_priority_value_runs_first() {
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of(handler(JobKind.ACCEPT_UPLOAD, job -> { })));
        QueuedJob other = queue.enqueue(JobKind.ACCEPT_UPLOAD, Map.of(), 5);
        QueuedJob image = queue.enqueue(JobKind.ACCEPT_UPLOAD, Map.of(), 1);

        dispatcher.runNext(QueueName.ACCEPT);

        assertThat(image.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(other.getStatus()).isEqualTo(JobStatus.WAITING);
    }

    @Test
    void accept_job_is_attempted_three_times_then_file_failed_and_job_dead() throws Exception {
        StoredFile file = new StoredFile("u1", "a.png", "a_1_abcdef.png", "image/png", 3, "h", null, null, null);
        file.setId("f1");
        StoredFileRepository files = mock(StoredFileRepository.class);
        when(files.findById("f1")).thenReturn(Optional.of(file));
        when(files.save(any(StoredFile.class))).thenAnswer(inv -> inv.getArgument(0));
        StagingStoragePort staging = mock(StagingStoragePort.class);
        when(staging.read(anyString())).thenReturn(new byte[]{1, 2, 3});
        StorageProvider cloudinary = mock(StorageProvider.class);
        when(cloudinary.kind()).thenReturn(ProviderKind.TRANSFORM);
        when(cloudinary.upload(any())).thenThrow(new ProviderException(ProviderKind.TRANSFORM, "503 from upstream", null));

        AcceptJobHandler accept = new AcceptJobHandler(files, staging, new ProviderRouter(List.of(cloudinary)), queue, clock);
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of(accept));
        QueuedJob job = queue.enqueue(JobKind.ACCEPT_UPLOAD, Map.of(
                JobPayloads.FILE_ID, "f1", JobPayloads.STAGING_KEY, "u1/a_1_abcdef.png"), 1);

        assertThat(dispatcher.runNext(QueueName.ACCEPT)).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.WAITING);
        assertThat(job.getRunAt()).isEqualTo(clock.now().plusSeconds(2));

        // backoff not elapsed yet
        assertThat(dispatcher.runNext(QueueName.ACCEPT)).isFalse();

        clock.advance(Duration.ofSeconds(2));
        assertThat(dispatcher.runNext(QueueName.ACCEPT)).isTrue();
        assertThat(job.getRunAt()).isEqualTo(clock.now().plusSeconds(4));

        clock.advance(Duration.ofSeconds(4));
        assertThat(dispatcher.runNext(QueueName.ACCEPT)).isTrue();

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getLastError()).contains("failed after 3 attempt(s)");
        assertThat(file.getStatus()).isEqualTo(FileStatus.FAILED);
        verify(cloudinary, times(3)).upload(any());

        clock.advance(Duration.ofMinutes(5));
        assertThat(dispatcher.runNext(QueueName.ACCEPT)).isFalse();
        assertThat(queue.stats(QueueName.ACCEPT).failed()).isEqualTo(1);
    }

    @Test
    void non_retryable_error_goes_straight_to_dead_list() {
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of(handler(JobKind.CLEANUP, job -> {
            throw new NotFoundException("File not found: x");
        })));
        QueuedJob job = queue.enqueue(JobKind.CLEANUP, Map.of(), 10);

        dispatcher.runNext(QueueName.PROCESSING);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getLastError()).contains("File not found");
    }

    @Test
    void unexpected_runtime_error_is_retried() {
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of(handler(JobKind.CLEANUP, job -> {
            throw new IllegalStateException("boom");
        })));
        QueuedJob job = queue.enqueue(JobKind.CLEANUP, Map.of(), 10);

        dispatcher.runNext(QueueName.PROCESSING);

        assertThat(job.getStatus()).isEqualTo(JobStatus.WAITING);
        assertThat(queue.stats(QueueName.PROCESSING).delayed()).isEqualTo(1);
    }

    @Test
    void job_without_handler_is_dead() {
        JobDispatcher dispatcher = new JobDispatcher(queue, List.of());
        QueuedJob job = queue.enqueue(JobKind.REPLICATE_BACKUP, Map.of(), 5);

        dispatcher.runNext(QueueName.PROCESSING);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void two_handlers_for_one_kind_are_refused() {
        assertThatThrownBy(() -> new JobDispatcher(queue, List.of(
                handler(JobKind.CLEANUP, job -> { }), handler(JobKind.CLEANUP, job -> { }))))
                .isInstanceOf(IllegalStateException.class);
    }
}

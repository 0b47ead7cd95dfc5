package ae.teletronics.ingest.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class UploadSessionTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static UploadSession session(long total, int chunk) {
        return new UploadSession("u1", "a.bin", "application/octet-stream", total, chunk,
                "/tmp/x", null, T0, T0.plusSeconds(3600));
    }

    @Test
    void remainder_goes_to_the_last_chunk() {
        UploadSession s = session(10_000_001, 2_000_000);

        assertThat(s.getTotalChunks()).isEqualTo(6);
        assertThat(s.expectedChunkLength(0)).isEqualTo(2_000_000);
        assertThat(s.expectedChunkLength(5)).isEqualTo(1);
        assertThat(s.offsetOf(5)).isEqualTo(10_000_000L);
    }

    @Test
    void exact_multiple_has_full_last_chunk() {
        UploadSession s = session(10_000_000, 2_000_000);

        assertThat(s.getTotalChunks()).isEqualTo(5);
        assertThat(s.expectedChunkLength(4)).isEqualTo(2_000_000);
    }

    @Test
    void progress_and_missing_chunks_follow_uploaded_set() {
        UploadSession s = session(100, 30);
        s.setUploadedChunks(Set.of(0, 3));
        s.setUploadedSize(40);

        assertThat(s.missingChunks()).containsExactly(1, 2);
        assertThat(s.progressPercentage()).isEqualTo(40);
        assertThat(s.isFullyUploaded()).isFalse();
        assertThat(s.isValidChunkIndex(3)).isTrue();
        assertThat(s.isValidChunkIndex(4)).isFalse();
        assertThat(s.isValidChunkIndex(-1)).isFalse();
    }

    @Test
    void expiry_is_strictly_after_deadline() {
        UploadSession s = session(100, 30);

        assertThat(s.isExpiredAt(T0.plusSeconds(3600))).isFalse();
        assertThat(s.isExpiredAt(T0.plusSeconds(3601))).isTrue();
    }

    @Test
    void non_positive_sizes_are_refused() {
        assertThatThrownBy(() -> UploadSession.computeTotalChunks(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UploadSession.computeTotalChunks(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}

package ae.teletronics.ingest.adapters.detection;

import ae.teletronics.ingest.ports.StreamSource;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class TikaFileTypeDetectorTest {

    private static final byte[] PNG_HEADER = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 13, 'I', 'H', 'D', 'R'
    };

    TikaFileTypeDetector detector = new TikaFileTypeDetector();

    @Test
    void magic_bytes_win_over_filename() throws Exception {
        assertThat(detector.detect(StreamSource.of(PNG_HEADER), "report.pdf")).contains("image/png");
    }

    @Test
    void pdf_is_detected() throws Exception {
        byte[] pdf = "%PDF-1.4\n%âãÏÓ\n".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(detector.detect(StreamSource.of(pdf), null)).contains("application/pdf");
    }

    @Test
    void unknown_binary_is_empty() throws Exception {
        assertThat(detector.detect(StreamSource.of(new byte[]{0, 1, 2, 3, (byte) 0xFE}), null)).isEmpty();
    }
}

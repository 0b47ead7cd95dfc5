package ae.teletronics.ingest.application.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class FilenameGeneratorTest {

    private static final Instant NOW = Instant.ofEpochMilli(1714557600000L);

    @Test
    void keeps_extension_and_adds_time_and_suffix() {
        String name = FilenameGenerator.generate("My Photo (1).JPG", NOW);

        assertThat(name).matches("My_Photo__1__1714557600000_[a-z0-9]{6}\\.jpg");
    }

    @Test
    void empty_name_falls_back_to_file() {
        assertThat(FilenameGenerator.generate("  ", NOW)).matches("file_1714557600000_[a-z0-9]{6}");
        assertThat(FilenameGenerator.generate(".hidden", NOW)).startsWith(".hidden_");
    }

    @Test
    void long_base_is_truncated() {
        String name = FilenameGenerator.generate("x".repeat(300) + ".pdf", NOW);

        assertThat(name).startsWith("x".repeat(100) + "_").endsWith(".pdf");
    }

    @Test
    void two_names_for_the_same_file_differ() {
        assertThat(FilenameGenerator.generate("a.png", NOW)).isNotEqualTo(FilenameGenerator.generate("a.png", NOW));
    }

    @Test
    void extension_rules() {
        assertThat(FilenameGenerator.extension("archive.tar.GZ")).isEqualTo("gz");
        assertThat(FilenameGenerator.extension("noext")).isEmpty();
        assertThat(FilenameGenerator.extension("trailing.")).isEmpty();
        assertThat(FilenameGenerator.extension("weird.ext with space")).isEmpty();
        assertThat(FilenameGenerator.stripExtension("cat_1_abc.png")).isEqualTo("cat_1_abc");
    }

    @Test
    void sanitize_replaces_unsafe_characters() {
        assertThat(FilenameGenerator.sanitize("../etc/passwd")).isEqualTo(".._etc_passwd");
        assertThat(FilenameGenerator.sanitize("user@example.com")).isEqualTo("user_example.com");
    }
}

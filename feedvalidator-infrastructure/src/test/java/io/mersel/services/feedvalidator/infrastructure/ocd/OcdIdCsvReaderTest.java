package io.mersel.services.feedvalidator.infrastructure.ocd;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OcdIdCsvReader")
class OcdIdCsvReaderTest {

    private final OcdIdCsvReader reader = new OcdIdCsvReader();

    @Test
    @DisplayName("read - ids in file order, names trimmed, blanks skipped")
    void read(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("country-de.csv"), """
                id,name,sameAs
                ocd-division/country:de,Deutschland,
                ocd-division/country:de/land:thüringen, Thüringen ,
                ,orphan,
                "ocd-division/country:de/land:berlin","Berlin, Stadt",
                """, StandardCharsets.UTF_8);

        Map<String, String> entries = reader.read(file);

        assertThat(entries).containsExactly(
                Map.entry("ocd-division/country:de", "Deutschland"),
                Map.entry("ocd-division/country:de/land:thüringen", "Thüringen"),
                Map.entry("ocd-division/country:de/land:berlin", "Berlin, Stadt"));
        assertThat(reader.verify(file)).isEqualTo(3);
    }

    @Test
    @DisplayName("no_id_column - rejected")
    void no_id_column(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("bad.csv"), "code,name\nx,y\n");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no 'id' column");
    }

    @Test
    @DisplayName("header_only - no identifiers")
    void header_only(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("empty.csv"), "id,name\n");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("verify_empty_file - zero bytes")
    void verify_empty_file(@TempDir Path dir) throws Exception {
        Path file = Files.createFile(dir.resolve("zero.csv"));

        assertThatThrownBy(() -> reader.verify(file))
                .isInstanceOf(IOException.class)
                .hasMessage("Downloaded OCD-ID catalogue is empty");
    }
}

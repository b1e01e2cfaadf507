package io.mersel.services.feedvalidator.infrastructure.ocd;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OcdIdNormalizer")
class OcdIdNormalizerTest {

    @Test
    @DisplayName("text_kept - strings are returned unchanged")
    void text_kept() {
        assertThat(OcdIdNormalizer.normalize("ocd-division/country:us")).isEqualTo("ocd-division/country:us");
    }

    @Test
    @DisplayName("bytes_decoded - UTF-8 bytes become text")
    void bytes_decoded() {
        byte[] bytes = "ocd-division/country:de/land:thüringen".getBytes(StandardCharsets.UTF_8);

        assertThat(OcdIdNormalizer.normalize(bytes)).isEqualTo("ocd-division/country:de/land:thüringen");
    }

    @Test
    @DisplayName("other_types - empty string")
    void other_types() {
        assertThat(OcdIdNormalizer.normalize(null)).isEmpty();
        assertThat(OcdIdNormalizer.normalize(42)).isEmpty();
    }
}

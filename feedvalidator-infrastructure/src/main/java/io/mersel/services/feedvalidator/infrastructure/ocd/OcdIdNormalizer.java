package io.mersel.services.feedvalidator.infrastructure.ocd;

import java.nio.charset.StandardCharsets;

/**
 * Canonical form of OCD-ID values read from a feed or a catalogue.
 */
public final class OcdIdNormalizer {

    private OcdIdNormalizer() {
    }

    /**
     * Text values are kept, byte sequences are decoded as UTF-8 and every other type
     * becomes the empty string, which never matches a catalogue entry.
     */
    public static String normalize(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return "";
    }
}

package io.mersel.services.feedvalidator.infrastructure.tree;

/**
 * A loaded election feed.
 *
 * @param root     Document element
 * @param encoding Encoding declared in the XML declaration, {@code null} when undeclared
 * @param systemId Feed location used in messages
 */
public record ElectionTree(ElectionElement root, String encoding, String systemId) {

    /**
     * True when the feed declares UTF-8 or declares nothing (XML defaults to UTF-8).
     */
    public boolean isUtf8() {
        return encoding == null || encoding.equalsIgnoreCase("UTF-8") || encoding.equalsIgnoreCase("UTF8");
    }
}

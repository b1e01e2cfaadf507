package io.mersel.services.feedvalidator.infrastructure.tree;

import io.mersel.services.feedvalidator.application.interfaces.FeedLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ElectionTreeLoader")
class ElectionTreeLoaderTest {

    private final ElectionTreeLoader loader = new ElectionTreeLoader();

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <ElectionReport xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
              <GpUnitCollection>
                <GpUnit objectId="ru1" xsi:type="ReportingUnit">
                  <ComposingGpUnitIds>ru2 ru3</ComposingGpUnitIds>
                </GpUnit>
              </GpUnitCollection>
              <Text>   </Text>
            </ElectionReport>
            """;

    @Test
    @DisplayName("lines_and_xsi_type - elements keep source lines and unprefixed xsi:type")
    void lines_and_xsi_type() throws Exception {
        ElectionTree tree = loader.parse(FEED.getBytes(StandardCharsets.UTF_8), "feed.xml");

        ElectionElement gpUnit = tree.root().find("GpUnitCollection/GpUnit");
        assertThat(tree.root().tag()).isEqualTo("ElectionReport");
        assertThat(gpUnit.line()).isEqualTo(4);
        assertThat(gpUnit.objectId()).isEqualTo("ru1");
        assertThat(gpUnit.xsiType()).isEqualTo("ReportingUnit");
        assertThat(gpUnit.matches("ReportingUnit")).isTrue();
        assertThat(gpUnit.matches("GpUnit")).isTrue();
        assertThat(gpUnit.childText("ComposingGpUnitIds")).isEqualTo("ru2 ru3");
        assertThat(tree.root().iter("ReportingUnit")).containsExactly(gpUnit);
    }

    @Test
    @DisplayName("text - whitespace only text is kept raw but has no trimmed content")
    void text() throws Exception {
        ElectionTree tree = loader.parse(FEED.getBytes(StandardCharsets.UTF_8), "feed.xml");

        ElectionElement text = tree.root().child("Text");
        assertThat(text.text()).isEqualTo("   ");
        assertThat(text.hasText()).isFalse();
        assertThat(tree.root().child("GpUnitCollection").child("Missing")).isNull();
    }

    @Test
    @DisplayName("subtree_order - document order, root first")
    void subtree_order() throws Exception {
        ElectionTree tree = loader.parse(FEED.getBytes(StandardCharsets.UTF_8), "feed.xml");

        assertThat(tree.root().subtree()).extracting(ElectionElement::tag)
                .containsExactly("ElectionReport", "GpUnitCollection", "GpUnit", "ComposingGpUnitIds", "Text");
    }

    @Test
    @DisplayName("encoding_declared - declared encoding is exposed")
    void encoding_declared() throws Exception {
        String latin = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><ElectionReport/>";

        ElectionTree tree = loader.parse(latin.getBytes(StandardCharsets.ISO_8859_1), "latin.xml");

        assertThat(tree.encoding()).isEqualToIgnoringCase("ISO-8859-1");
        assertThat(tree.isUtf8()).isFalse();
    }

    @Test
    @DisplayName("encoding_utf8 - UTF-8 declaration passes")
    void encoding_utf8() throws Exception {
        ElectionTree tree = loader.parse(FEED.getBytes(StandardCharsets.UTF_8), "feed.xml");

        assertThat(tree.isUtf8()).isTrue();
    }

    @Test
    @DisplayName("malformed - not well formed XML is a FeedLoadException")
    void malformed() {
        assertThatThrownBy(() -> loader.parse("<ElectionReport><Open></ElectionReport>".getBytes(StandardCharsets.UTF_8), "bad.xml"))
                .isInstanceOf(FeedLoadException.class)
                .hasMessageContaining("not well formed");
    }

    @Test
    @DisplayName("doctype_rejected - DOCTYPE declarations are refused")
    void doctype_rejected() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";

        assertThatThrownBy(() -> loader.parse(xxe.getBytes(StandardCharsets.UTF_8), "xxe.xml"))
                .isInstanceOf(FeedLoadException.class);
    }

    @Test
    @DisplayName("missing_file - load of a path that does not exist fails")
    void missing_file(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("none.xml")))
                .isInstanceOf(FeedLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("load_from_file - file content is parsed")
    void load_from_file(@TempDir Path tempDir) throws Exception {
        Path feed = Files.writeString(tempDir.resolve("feed.xml"), FEED);

        assertThat(loader.load(feed).systemId()).isEqualTo(feed.toString());
    }
}

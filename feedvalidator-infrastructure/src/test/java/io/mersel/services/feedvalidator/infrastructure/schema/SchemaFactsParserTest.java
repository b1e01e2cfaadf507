package io.mersel.services.feedvalidator.infrastructure.schema;

import io.mersel.services.feedvalidator.application.interfaces.SchemaLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemaFactsParser")
class SchemaFactsParserTest {

    private final SchemaFactsParser parser = new SchemaFactsParser();

    private static Path resource(String name) throws Exception {
        return Path.of(SchemaFactsParserTest.class.getResource("/feeds/" + name).toURI());
    }

    @Test
    @DisplayName("facts - optional, IDREF, enumeration and OtherType facts are collected")
    void facts() throws Exception {
        SchemaFacts facts = parser.parse(resource("mini.xsd"));

        assertThat(facts.optionalElements())
                .contains("OtherType", "ExternalIdentifier", "Name", "FullName", "PartyId", "Party", "Person")
                .doesNotContain("Type", "Value", "ElectionReport");
        assertThat(facts.idrefElements()).containsExactly("LeaderPersonIds", "PartyId");
        assertThat(facts.enumerationValues()).containsExactly("fips", "ocd-id");
        assertThat(facts.otherTypeContainers()).containsExactly("ExternalIdentifier");
    }

    @Test
    @DisplayName("unprefixed_schema - declarations without a prefix are recognised")
    void unprefixed_schema() throws Exception {
        String xsd = """
                <schema xmlns="http://www.w3.org/2001/XMLSchema">
                  <element name="Root">
                    <complexType>
                      <sequence>
                        <element name="Ref" type="IDREF" minOccurs="0"/>
                      </sequence>
                    </complexType>
                  </element>
                </schema>
                """;

        SchemaFacts facts = parser.parse(xsd.getBytes(StandardCharsets.UTF_8));

        assertThat(facts.optionalElements()).containsExactly("Ref");
        assertThat(facts.idrefElements()).containsExactly("Ref");
    }

    @Test
    @DisplayName("not_xml - unparsable schema is a SchemaLoadException")
    void not_xml() {
        assertThatThrownBy(() -> parser.parse("not a schema".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SchemaLoadException.class)
                .hasMessageContaining("could not be parsed correctly");
    }

    @Test
    @DisplayName("missing_file - unreadable schema path")
    void missing_file() {
        assertThatThrownBy(() -> parser.parse(Path.of("does-not-exist.xsd")))
                .isInstanceOf(SchemaLoadException.class);
    }
}

package io.mersel.services.feedvalidator.infrastructure.schema;

import java.util.List;

/**
 * Element and type facts read from the feed's XSD.
 *
 * @param optionalElements    Names of elements declared {@code minOccurs="0"}, document order
 * @param idrefElements       Names of elements typed {@code xs:IDREF} or {@code xs:IDREFS}
 * @param enumerationValues   Enumeration values of all simple types except {@code other}
 * @param otherTypeContainers Complex types declaring an {@code OtherType} child element
 */
public record SchemaFacts(
        List<String> optionalElements,
        List<String> idrefElements,
        List<String> enumerationValues,
        List<String> otherTypeContainers
) {

    public SchemaFacts {
        optionalElements = List.copyOf(optionalElements);
        idrefElements = List.copyOf(idrefElements);
        enumerationValues = List.copyOf(enumerationValues);
        otherTypeContainers = List.copyOf(otherTypeContainers);
    }

    public static SchemaFacts empty() {
        return new SchemaFacts(List.of(), List.of(), List.of(), List.of());
    }
}

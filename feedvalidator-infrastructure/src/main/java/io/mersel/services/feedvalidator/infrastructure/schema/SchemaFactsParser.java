package io.mersel.services.feedvalidator.infrastructure.schema;

import io.mersel.services.feedvalidator.application.interfaces.SchemaLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@link SchemaFacts} from an XSD with DOM.
 * <p>
 * Schema components are matched by local name so both prefixed ({@code xs:element})
 * and unprefixed declarations are recognised.
 */
@Service
public class SchemaFactsParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaFactsParser.class);

    public SchemaFacts parse(Path schema) throws SchemaLoadException {
        try {
            return parse(Files.readAllBytes(schema));
        } catch (IOException e) {
            throw new SchemaLoadException("The schema file could not be read: " + schema, e);
        }
    }

    public SchemaFacts parse(byte[] schema) throws SchemaLoadException {
        Document document = parseDocument(schema);

        Set<String> optional = new LinkedHashSet<>();
        Set<String> idrefs = new LinkedHashSet<>();
        for (Element element : byLocalName(document, "element")) {
            String name = element.getAttribute("name");
            if (name.isEmpty()) {
                continue;
            }
            if ("0".equals(element.getAttribute("minOccurs"))) {
                optional.add(name);
            }
            String type = stripPrefix(element.getAttribute("type"));
            if ("IDREF".equals(type) || "IDREFS".equals(type)) {
                idrefs.add(name);
            }
        }

        Set<String> enumerations = new LinkedHashSet<>();
        for (Element simpleType : byLocalName(document, "simpleType")) {
            for (Element enumeration : descendants(simpleType, "enumeration")) {
                String value = enumeration.getAttribute("value");
                if (!value.isEmpty() && !"other".equals(value)) {
                    enumerations.add(value);
                }
            }
        }

        Set<String> otherTypeContainers = new LinkedHashSet<>();
        for (Element complexType : byLocalName(document, "complexType")) {
            String name = complexType.getAttribute("name");
            if (name.isEmpty()) {
                continue;
            }
            for (Element element : descendants(complexType, "element")) {
                if ("OtherType".equals(element.getAttribute("name"))) {
                    otherTypeContainers.add(name);
                    break;
                }
            }
        }

        var facts = new SchemaFacts(List.copyOf(optional), List.copyOf(idrefs),
                List.copyOf(enumerations), List.copyOf(otherTypeContainers));
        log.debug("Schema facts: {} optional, {} IDREF, {} enumeration values, {} OtherType containers",
                optional.size(), idrefs.size(), enumerations.size(), otherTypeContainers.size());
        return facts;
    }

    private static Document parseDocument(byte[] schema) throws SchemaLoadException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            return factory.newDocumentBuilder().parse(new ByteArrayInputStream(schema));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new SchemaLoadException("The schema file could not be parsed correctly: " + e.getMessage(), e);
        }
    }

    private static List<Element> byLocalName(Document document, String localName) {
        return toElements(document.getElementsByTagNameNS("*", localName));
    }

    private static List<Element> descendants(Element parent, String localName) {
        return toElements(parent.getElementsByTagNameNS("*", localName));
    }

    private static List<Element> toElements(NodeList nodes) {
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    private static String stripPrefix(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }
}

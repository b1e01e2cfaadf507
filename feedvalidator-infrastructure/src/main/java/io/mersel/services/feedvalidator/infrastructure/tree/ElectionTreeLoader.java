package io.mersel.services.feedvalidator.infrastructure.tree;

import io.mersel.services.feedvalidator.application.interfaces.FeedLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.ext.Locator2;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SAX based loader building an {@link ElectionTree} with source line numbers.
 * <p>
 * The parser is namespace aware, DOCTYPE declarations are rejected and external
 * entities are never resolved.
 */
@Service
public class ElectionTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(ElectionTreeLoader.class);

    public ElectionTree load(Path feed) throws FeedLoadException {
        if (feed == null || !Files.isRegularFile(feed)) {
            throw new FeedLoadException("Election file not found: " + feed);
        }
        try (InputStream in = Files.newInputStream(feed)) {
            return parse(in, feed.toString());
        } catch (IOException e) {
            throw new FeedLoadException("Election file could not be read: " + feed + " (" + e.getMessage() + ")", e);
        }
    }

    public ElectionTree parse(byte[] content, String systemId) throws FeedLoadException {
        if (content == null || content.length == 0) {
            throw new FeedLoadException("Election file is empty: " + systemId);
        }
        try {
            return parse(new ByteArrayInputStream(content), systemId);
        } catch (IOException e) {
            throw new FeedLoadException("Election file could not be read: " + systemId, e);
        }
    }

    private ElectionTree parse(InputStream in, String systemId) throws IOException, FeedLoadException {
        var handler = new TreeBuildingHandler();
        try {
            SAXParser parser = newParserFactory().newSAXParser();
            InputSource source = new InputSource(in);
            source.setSystemId(systemId);
            parser.parse(source, handler);
        } catch (SAXParseException e) {
            throw new FeedLoadException("Election file is not well formed XML (line "
                    + e.getLineNumber() + "): " + e.getMessage(), e);
        } catch (SAXException | ParserConfigurationException e) {
            throw new FeedLoadException("Election file could not be parsed: " + e.getMessage(), e);
        }

        if (handler.root == null) {
            throw new FeedLoadException("Election file has no document element: " + systemId);
        }
        log.debug("Feed loaded: {} (root={}, encoding={})", systemId, handler.root.tag(), handler.encoding);
        return new ElectionTree(handler.root, handler.encoding, systemId);
    }

    private static SAXParserFactory newParserFactory() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        // XXE
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory;
    }

    // ── SAX Handler ─────────────────────────────────────────────────

    private static class TreeBuildingHandler extends DefaultHandler {

        private Locator locator;
        private ElectionElement root;
        private ElectionElement current;
        private String encoding;

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            if (root == null && locator instanceof Locator2 locator2) {
                encoding = locator2.getEncoding();
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                String attrUri = attributes.getURI(i);
                String attrName = attributes.getLocalName(i);
                if (attrName == null || attrName.isEmpty()) {
                    attrName = attributes.getQName(i);
                }
                String key = attrUri == null || attrUri.isEmpty() ? attrName : "{" + attrUri + "}" + attrName;
                values.put(key, attributes.getValue(i));
            }
            String tag = localName == null || localName.isEmpty() ? qName : localName;
            int line = locator != null ? locator.getLineNumber() : 0;
            var element = new ElectionElement(tag, values, current, line);
            if (root == null) {
                root = element;
            }
            current = element;
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            current = current.parent();
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (current != null) {
                current.appendText(ch, start, length);
            }
        }
    }
}

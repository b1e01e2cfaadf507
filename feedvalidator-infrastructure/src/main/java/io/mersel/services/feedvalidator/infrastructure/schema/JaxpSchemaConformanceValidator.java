package io.mersel.services.feedvalidator.infrastructure.schema;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.feedvalidator.application.interfaces.ISchemaConformanceValidator;
import io.mersel.services.feedvalidator.application.interfaces.SchemaLoadException;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JAXP based XML Schema conformance check.
 * <p>
 * Compiled schemas are kept in a small Caffeine cache keyed by path and modification
 * time, so repeated runs against the same XSD compile it once.
 */
@Service
public class JaxpSchemaConformanceValidator implements ISchemaConformanceValidator {

    private static final Logger log = LoggerFactory.getLogger(JaxpSchemaConformanceValidator.class);

    private final Cache<String, Schema> compiledSchemas = Caffeine.newBuilder()
            .maximumSize(16)
            .build();

    @Override
    public List<IssueDetail> validate(Path feed, Path schemaPath) throws SchemaLoadException {
        Schema schema = compile(schemaPath);
        List<IssueDetail> errors = new ArrayList<>();

        Validator validator = schema.newValidator();
        // XXE
        try {
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.warn("Validator does not support the XXE protection properties");
        }

        validator.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                log.debug("Schema warning at line {}: {}", e.getLineNumber(), e.getMessage());
            }

            @Override
            public void error(SAXParseException e) {
                errors.add(toDetail(e));
            }

            @Override
            public void fatalError(SAXParseException e) {
                errors.add(toDetail(e));
            }
        });

        try {
            validator.validate(new StreamSource(feed.toFile()));
        } catch (SAXException e) {
            // fatal errors are already collected by the handler
            if (errors.isEmpty()) {
                errors.add(IssueDetail.of(e.getMessage()));
            }
        } catch (IOException e) {
            errors.add(IssueDetail.of("Election file could not be read: " + e.getMessage()));
        }

        log.debug("Schema conformance of {}: {} error(s)", feed, errors.size());
        return errors;
    }

    private Schema compile(Path schemaPath) throws SchemaLoadException {
        if (schemaPath == null || !Files.isRegularFile(schemaPath)) {
            throw new SchemaLoadException("The schema file could not be parsed correctly: file not found " + schemaPath);
        }
        String key;
        try {
            key = schemaPath.toAbsolutePath().normalize() + "@" + Files.getLastModifiedTime(schemaPath).toMillis();
        } catch (IOException e) {
            throw new SchemaLoadException("The schema file could not be read: " + schemaPath, e);
        }

        Schema cached = compiledSchemas.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        long startTime = System.currentTimeMillis();
        SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
        try {
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "file");
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.warn("SchemaFactory does not support the XXE protection properties");
        }

        try {
            Schema schema = factory.newSchema(schemaPath.toFile());
            compiledSchemas.put(key, schema);
            log.info("Schema compiled: {} ({} ms)", schemaPath, System.currentTimeMillis() - startTime);
            return schema;
        } catch (SAXException e) {
            throw new SchemaLoadException("The schema file could not be parsed correctly: " + e.getMessage(), e);
        }
    }

    private static IssueDetail toDetail(SAXParseException e) {
        return new IssueDetail(e.getMessage(), e.getLineNumber() > 0 ? e.getLineNumber() : null);
    }
}

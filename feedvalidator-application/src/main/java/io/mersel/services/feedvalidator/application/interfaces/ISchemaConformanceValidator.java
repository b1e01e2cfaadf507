package io.mersel.services.feedvalidator.application.interfaces;

import io.mersel.services.feedvalidator.application.models.IssueDetail;

import java.nio.file.Path;
import java.util.List;

/**
 * Validates a feed against an XML Schema (XSD).
 */
public interface ISchemaConformanceValidator {

    /**
     * @param feed   Feed to validate
     * @param schema XSD to validate against
     * @return One entry per schema violation (empty list = conformant)
     * @throws SchemaLoadException the schema could not be parsed or compiled
     */
    List<IssueDetail> validate(Path feed, Path schema) throws SchemaLoadException;
}

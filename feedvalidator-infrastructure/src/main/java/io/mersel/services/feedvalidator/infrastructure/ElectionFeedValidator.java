package io.mersel.services.feedvalidator.infrastructure;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.interfaces.FeedLoadException;
import io.mersel.services.feedvalidator.application.interfaces.IFeedValidator;
import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.ISchemaConformanceValidator;
import io.mersel.services.feedvalidator.application.interfaces.SchemaLoadException;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import io.mersel.services.feedvalidator.application.models.ValidationRequest;
import io.mersel.services.feedvalidator.infrastructure.config.OcdIdProperties;
import io.mersel.services.feedvalidator.infrastructure.config.ValidatorProperties;
import io.mersel.services.feedvalidator.infrastructure.diagnostics.ValidatorMetrics;
import io.mersel.services.feedvalidator.infrastructure.ocd.OcdIdLookup;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.RulesRegistry;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ValidationRule;
import io.mersel.services.feedvalidator.infrastructure.schema.SchemaFacts;
import io.mersel.services.feedvalidator.infrastructure.schema.SchemaFactsParser;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionTree;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionTreeLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one feed through schema conformance and the rule catalogue.
 * <p>
 * Loading the feed or the schema is fatal to the run. Everything after that is
 * isolated per rule: a rule that throws is reported as an Error and the remaining rules
 * still run.
 */
@Service
public class ElectionFeedValidator implements IFeedValidator {

    private static final Logger log = LoggerFactory.getLogger(ElectionFeedValidator.class);

    static final String SCHEMA_RULE = "Schema";
    static final List<String> COUNTED_ENTITIES = List.of("Party", "Person", "Candidate", "Office", "GpUnit", "Contest");

    private final ElectionTreeLoader treeLoader;
    private final SchemaFactsParser schemaFactsParser;
    private final ISchemaConformanceValidator conformanceValidator;
    private final IOcdIdDatasetProvider ocdIdProvider;
    private final ValidatorProperties validatorProperties;
    private final OcdIdProperties ocdIdProperties;
    private final ValidatorMetrics metrics;
    private final Clock clock;

    public ElectionFeedValidator(ElectionTreeLoader treeLoader,
                                 SchemaFactsParser schemaFactsParser,
                                 ISchemaConformanceValidator conformanceValidator,
                                 IOcdIdDatasetProvider ocdIdProvider,
                                 ValidatorProperties validatorProperties,
                                 OcdIdProperties ocdIdProperties,
                                 ValidatorMetrics metrics,
                                 Clock clock) {
        this.treeLoader = treeLoader;
        this.schemaFactsParser = schemaFactsParser;
        this.conformanceValidator = conformanceValidator;
        this.ocdIdProvider = ocdIdProvider;
        this.validatorProperties = validatorProperties;
        this.ocdIdProperties = ocdIdProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ValidationReport validate(ValidationRequest request) throws FeedLoadException, SchemaLoadException {
        long startTime = System.currentTimeMillis();
        RuleSet ruleSet = request.ruleSet();
        log.info("Validating {} against {} (rule set {})", request.feed(), request.schema(), ruleSet);

        ElectionTree tree;
        SchemaFacts facts;
        List<IssueDetail> schemaErrors;
        try {
            tree = treeLoader.load(request.feed());
            facts = schemaFactsParser.parse(request.schema());
            schemaErrors = conformanceValidator.validate(request.feed(), request.schema());
        } catch (FeedLoadException | SchemaLoadException e) {
            metrics.recordValidation(ruleSet.name(), "error", System.currentTimeMillis() - startTime);
            throw e;
        }

        List<ValidationIssue> issues = new ArrayList<>();

        // ── Schema conformance ──
        if (!schemaErrors.isEmpty()) {
            IssueCollector schemaIssues = new IssueCollector(SCHEMA_RULE, Severity.ERROR,
                    validatorProperties.getMaxDetailsPerIssue());
            schemaIssues.report("The election file didn't validate against schema.", schemaErrors);
            issues.addAll(schemaIssues.issues());
        }

        // ── Rules ──
        RuleContext context = new RuleContext(tree, facts, ocdIdLookup(request), clock);
        for (ValidationRule rule : RulesRegistry.create(ruleSet, context, excludedRules(request))) {
            issues.addAll(runRule(rule, tree.root()));
        }

        long elapsed = System.currentTimeMillis() - startTime;
        ValidationReport report = new ValidationReport(request.feed().toString(), ruleSet, issues,
                countEntities(tree.root()), elapsed);

        for (Severity severity : Severity.values()) {
            metrics.recordIssues(severity, report.count(severity));
        }
        metrics.recordValidation(ruleSet.name(), report.passed() ? "valid" : "invalid", elapsed);
        log.info("Validation finished: {} - errors: {}, warnings: {}, info: {}, {}ms",
                report.passed() ? "PASSED" : "FAILED",
                report.count(Severity.ERROR), report.count(Severity.WARNING), report.count(Severity.INFO), elapsed);
        return report;
    }

    @Override
    public List<String> ruleNames(RuleSet ruleSet) {
        return RulesRegistry.names(ruleSet);
    }

    /**
     * Evaluates one rule. Element rules are called for every matching element in
     * document order, tree rules once.
     */
    List<ValidationIssue> runRule(ValidationRule rule, ElectionElement root) {
        Severity severity = validatorProperties.getSeverityOverrides()
                .getOrDefault(rule.name(), rule.defaultSeverity());
        IssueCollector issues = new IssueCollector(rule.name(), severity, validatorProperties.getMaxDetailsPerIssue());

        try {
            if (rule instanceof ElementRule elementRule) {
                runElementRule(elementRule, root, issues);
            } else if (rule instanceof TreeRule treeRule) {
                if (treeRule.prepare(issues)) {
                    treeRule.check(issues);
                }
            }
        } catch (RuntimeException e) {
            log.error("Rule {} failed: {}", rule.name(), e.getMessage(), e);
            metrics.recordRuleFailure(rule.name());
            issues.error("Rule failed unexpectedly: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    (ElectionElement) null);
        }

        if (!issues.isEmpty()) {
            log.debug("Rule {} reported {} issue(s)", rule.name(), issues.issues().size());
        }
        return issues.issues();
    }

    private static void runElementRule(ElementRule rule, ElectionElement root, IssueCollector issues) {
        List<String> names = rule.elements();
        if (names.isEmpty() || root == null) {
            return;
        }
        if (!rule.prepare(issues)) {
            return;
        }
        for (ElectionElement element : root.subtree()) {
            if (matchesAny(element, names)) {
                rule.check(element, issues);
            }
        }
    }

    private static boolean matchesAny(ElectionElement element, List<String> names) {
        for (String name : names) {
            if (element.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private OcdIdLookup ocdIdLookup(ValidationRequest request) {
        String countryCode = request.countryCode() != null && !request.countryCode().isBlank()
                ? request.countryCode()
                : ocdIdProperties.getCountryCode();
        Path localFile = request.localOcdFile();
        if (localFile == null && ocdIdProperties.getLocalFile() != null && !ocdIdProperties.getLocalFile().isBlank()) {
            localFile = Path.of(ocdIdProperties.getLocalFile());
        }
        return new OcdIdLookup(ocdIdProvider, countryCode, localFile);
    }

    private Set<String> excludedRules(ValidationRequest request) {
        Set<String> excluded = new HashSet<>(validatorProperties.getExcluded());
        excluded.addAll(request.excludedRules());
        return excluded;
    }

    static Map<String, Integer> countEntities(ElectionElement root) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String entity : COUNTED_ENTITIES) {
            counts.put(entity, root == null ? 0 : root.iter(entity).size());
        }
        return counts;
    }
}

package io.mersel.services.feedvalidator.cli;

import io.mersel.services.feedvalidator.application.enums.ReportFormat;
import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.interfaces.FeedLoadException;
import io.mersel.services.feedvalidator.application.interfaces.IFeedValidator;
import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.interfaces.SchemaLoadException;
import io.mersel.services.feedvalidator.application.models.DatasetSyncResult;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import io.mersel.services.feedvalidator.application.models.ValidationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the command line into a validation run, prints the report and sets the
 * process exit code.
 * <p>
 * Exit codes: {@code 0} passed, {@code 1} the feed has errors, {@code 2} usage error or
 * the feed/schema could not be loaded.
 */
@Component
public class FeedValidatorRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(FeedValidatorRunner.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: feed-validator --feed=<path> --xsd=<path> [options]

              --rule-set=election|officeholder   Rule set to run (default: election)
              --country=<code>                   Country of the OCD-ID catalogue
              --local-ocd-file=<path>            Local OCD-ID catalogue instead of the remote one
              --exclude=RuleA,RuleB              Rules to skip
              --format=text|json                 Report format (default: text)
              --list-rules                       Print the rules of the selected rule set
              --sync-ocd                         Refresh the cached OCD-ID catalogue of --country
            """;

    private final IFeedValidator feedValidator;
    private final IOcdIdDatasetProvider ocdIdProvider;
    private final ReportPrinter printer;
    private final PrintStream out;

    private int exitCode = EXIT_PASSED;

    @Autowired
    public FeedValidatorRunner(IFeedValidator feedValidator, IOcdIdDatasetProvider ocdIdProvider, ReportPrinter printer) {
        this(feedValidator, ocdIdProvider, printer, System.out);
    }

    FeedValidatorRunner(IFeedValidator feedValidator, IOcdIdDatasetProvider ocdIdProvider,
                        ReportPrinter printer, PrintStream out) {
        this.feedValidator = feedValidator;
        this.ocdIdProvider = ocdIdProvider;
        this.printer = printer;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        try {
            if (args.containsOption("list-rules")) {
                return listRules(ruleSet(args));
            }
            if (args.containsOption("sync-ocd")) {
                return syncCatalogue(required(args, "country"));
            }
            return validate(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println();
            out.print(USAGE);
            return EXIT_USAGE;
        }
    }

    // ── Commands ──────────────────────────────────────────────────────

    private int listRules(RuleSet ruleSet) {
        List<String> names = feedValidator.ruleNames(ruleSet);
        out.println("Rule set " + ruleSet + " (" + names.size() + " rules):");
        names.forEach(name -> out.println("  " + name));
        return EXIT_PASSED;
    }

    private int syncCatalogue(String countryCode) {
        DatasetSyncResult result = ocdIdProvider.sync(countryCode);
        if (!result.success()) {
            out.println("OCD-ID catalogue sync failed for " + countryCode + ": " + result.error());
            return EXIT_USAGE;
        }
        out.println("OCD-ID catalogue for " + result.countryCode() + ": " + result.entryCount()
                + " entries (" + result.source() + ", " + result.durationMs() + "ms)");
        try {
            Optional<String> sha = ocdIdProvider.findRemoteBlobSha(countryCode);
            out.println("Remote blob: " + sha.orElse("not listed"));
        } catch (OcdIdDatasetException e) {
            log.warn("Remote listing unavailable: {}", e.getMessage());
            out.println("Remote blob: unavailable (" + e.getMessage() + ")");
        }
        return EXIT_PASSED;
    }

    private int validate(ApplicationArguments args) {
        ValidationRequest request = toRequest(args);
        ReportFormat format = format(args);
        try {
            ValidationReport report = feedValidator.validate(request);
            out.print(printer.render(report, format));
            return report.passed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (FeedLoadException | SchemaLoadException e) {
            log.error("Validation aborted: {}", e.getMessage());
            out.println("Validation aborted: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    // ── Arguments ─────────────────────────────────────────────────────

    static ValidationRequest toRequest(ApplicationArguments args) {
        Path feed = existingFile(required(args, "feed"), "feed");
        Path schema = existingFile(required(args, "xsd"), "xsd");
        String localOcd = optional(args, "local-ocd-file");
        return new ValidationRequest(
                feed,
                schema,
                ruleSet(args),
                optional(args, "country"),
                localOcd == null ? null : Path.of(localOcd),
                excluded(args));
    }

    static RuleSet ruleSet(ApplicationArguments args) {
        String value = optional(args, "rule-set");
        return value == null ? RuleSet.ELECTION : RuleSet.fromName(value);
    }

    static ReportFormat format(ApplicationArguments args) {
        String value = optional(args, "format");
        if (value == null) {
            return ReportFormat.TEXT;
        }
        for (ReportFormat format : ReportFormat.values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown format: " + value);
    }

    static Set<String> excluded(ApplicationArguments args) {
        Set<String> names = new LinkedHashSet<>();
        List<String> values = args.getOptionValues("exclude");
        if (values != null) {
            values.stream()
                    .flatMap(v -> Arrays.stream(v.split(",")))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(names::add);
        }
        return names;
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1).trim();
        return value.isEmpty() ? null : value;
    }

    private static Path existingFile(String value, String option) {
        Path path = Path.of(value);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("--" + option + " file not found: " + value);
        }
        return path;
    }
}

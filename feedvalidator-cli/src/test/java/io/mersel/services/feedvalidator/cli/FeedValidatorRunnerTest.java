package io.mersel.services.feedvalidator.cli;

import io.mersel.services.feedvalidator.application.enums.ReportFormat;
import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.interfaces.FeedLoadException;
import io.mersel.services.feedvalidator.application.interfaces.IFeedValidator;
import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.models.DatasetSyncResult;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import io.mersel.services.feedvalidator.application.models.ValidationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeedValidatorRunner")
class FeedValidatorRunnerTest {

    @Mock
    private IFeedValidator feedValidator;

    @Mock
    private IOcdIdDatasetProvider ocdIdProvider;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private FeedValidatorRunner runner;
    private Path feed;
    private Path xsd;

    @BeforeEach
    void setUp(@TempDir Path tempDir) throws Exception {
        runner = new FeedValidatorRunner(feedValidator, ocdIdProvider,
                new ReportPrinter(Clock.systemUTC()), new PrintStream(output, true, StandardCharsets.UTF_8));
        feed = Files.writeString(tempDir.resolve("feed.xml"), "<ElectionReport/>");
        xsd = Files.writeString(tempDir.resolve("nist.xsd"), "<xs:schema/>");
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("exit_0_when_passed - report without errors")
        void exit_0_when_passed() throws Exception {
            when(feedValidator.validate(any())).thenReturn(
                    new ValidationReport(feed.toString(), RuleSet.ELECTION,
                            List.of(ValidationIssue.warning("AllCaps", "caps", 3)), Map.of(), 1));

            int code = runner.execute(args("--feed=" + feed, "--xsd=" + xsd));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_PASSED);
            assertThat(printed()).contains("Result: PASSED");
        }

        @Test
        @DisplayName("exit_1_when_errors - report with an Error issue")
        void exit_1_when_errors() throws Exception {
            when(feedValidator.validate(any())).thenReturn(
                    new ValidationReport(feed.toString(), RuleSet.ELECTION,
                            List.of(ValidationIssue.error("DuplicateID", "dup", 3)), Map.of(), 1));

            int code = runner.execute(args("--feed=" + feed, "--xsd=" + xsd, "--format=json"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_FAILED);
            assertThat(printed()).contains("\"passed\" : false");
        }

        @Test
        @DisplayName("exit_2_when_feed_cannot_load - fatal load error")
        void exit_2_when_feed_cannot_load() throws Exception {
            when(feedValidator.validate(any())).thenThrow(new FeedLoadException("Feed is not well-formed XML"));

            int code = runner.execute(args("--feed=" + feed, "--xsd=" + xsd));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_USAGE);
            assertThat(printed()).contains("Validation aborted: Feed is not well-formed XML");
        }

        @Test
        @DisplayName("request_built_from_options - rule set, country, local file and exclusions")
        void request_built_from_options() throws Exception {
            when(feedValidator.validate(any())).thenReturn(
                    new ValidationReport(feed.toString(), RuleSet.OFFICEHOLDER, List.of(), Map.of(), 1));

            runner.execute(args("--feed=" + feed, "--xsd=" + xsd, "--rule-set=officeholder",
                    "--country=us", "--local-ocd-file=/tmp/ocd.csv", "--exclude=AllCaps, EmptyText",
                    "--exclude=PersonHasOffice"));

            ArgumentCaptor<ValidationRequest> captor = ArgumentCaptor.forClass(ValidationRequest.class);
            verify(feedValidator).validate(captor.capture());
            ValidationRequest request = captor.getValue();
            assertThat(request.ruleSet()).isEqualTo(RuleSet.OFFICEHOLDER);
            assertThat(request.countryCode()).isEqualTo("us");
            assertThat(request.localOcdFile()).isEqualTo(Path.of("/tmp/ocd.csv"));
            assertThat(request.excludedRules()).containsExactlyInAnyOrder("AllCaps", "EmptyText", "PersonHasOffice");
        }
    }

    @Nested
    @DisplayName("usage errors")
    class Usage {

        @Test
        @DisplayName("missing_feed - exit 2 and usage text")
        void missing_feed() {
            int code = runner.execute(args("--xsd=" + xsd));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_USAGE);
            assertThat(printed()).contains("--feed is required").contains("Usage: feed-validator");
            verifyNoInteractions(feedValidator);
        }

        @Test
        @DisplayName("feed_not_found - path that does not exist")
        void feed_not_found() {
            int code = runner.execute(args("--feed=" + feed.resolveSibling("missing.xml"), "--xsd=" + xsd));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_USAGE);
            assertThat(printed()).contains("--feed file not found");
        }

        @Test
        @DisplayName("unknown_rule_set - rejected before validation")
        void unknown_rule_set() {
            int code = runner.execute(args("--feed=" + feed, "--xsd=" + xsd, "--rule-set=referendum"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_USAGE);
            assertThat(printed()).contains("Unknown rule set: referendum");
        }

        @Test
        @DisplayName("format_parsing - case insensitive, unknown rejected")
        void format_parsing() {
            assertThat(FeedValidatorRunner.format(args("--format=JSON"))).isEqualTo(ReportFormat.JSON);
            assertThat(FeedValidatorRunner.format(args())).isEqualTo(ReportFormat.TEXT);
            assertThatThrownBy(() -> FeedValidatorRunner.format(args("--format=xml")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("other commands")
    class Commands {

        @Test
        @DisplayName("list_rules - prints the rule names of the selected set")
        void list_rules() {
            when(feedValidator.ruleNames(RuleSet.OFFICEHOLDER)).thenReturn(List.of("Encoding", "PersonHasOffice"));

            int code = runner.execute(args("--list-rules", "--rule-set=officeholder"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_PASSED);
            assertThat(printed()).contains("Rule set OFFICEHOLDER (2 rules):")
                    .contains("  Encoding").contains("  PersonHasOffice");
        }

        @Test
        @DisplayName("sync_ocd_success - prints entry count and remote blob")
        void sync_ocd_success() throws Exception {
            when(ocdIdProvider.sync("us")).thenReturn(DatasetSyncResult.success("us", "download", 120, 15));
            when(ocdIdProvider.findRemoteBlobSha("us")).thenReturn(Optional.of("abc123"));

            int code = runner.execute(args("--sync-ocd", "--country=us"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_PASSED);
            assertThat(printed()).contains("120 entries (download").contains("Remote blob: abc123");
        }

        @Test
        @DisplayName("sync_ocd_listing_unavailable - sync result still counts")
        void sync_ocd_listing_unavailable() throws Exception {
            when(ocdIdProvider.sync("us")).thenReturn(DatasetSyncResult.success("us", "cache", 3, 1));
            when(ocdIdProvider.findRemoteBlobSha("us")).thenThrow(new OcdIdDatasetException("HTTP 403"));

            int code = runner.execute(args("--sync-ocd", "--country=us"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_PASSED);
            assertThat(printed()).contains("Remote blob: unavailable (HTTP 403)");
        }

        @Test
        @DisplayName("sync_ocd_failure - exit 2")
        void sync_ocd_failure() {
            when(ocdIdProvider.sync("us")).thenReturn(DatasetSyncResult.failure("us", 4, "no network"));

            int code = runner.execute(args("--sync-ocd", "--country=us"));

            assertThat(code).isEqualTo(FeedValidatorRunner.EXIT_USAGE);
            assertThat(printed()).contains("sync failed for us: no network");
        }
    }
}

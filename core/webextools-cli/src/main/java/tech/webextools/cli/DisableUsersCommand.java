package tech.webextools.cli;

import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.webextools.cli.config.WebexClientFactory;
import tech.webextools.cli.console.ErrorFormatter;
import tech.webextools.cli.disable.DisableResult;
import tech.webextools.cli.disable.DisableStatus;
import tech.webextools.cli.disable.DisableUsersWorkflow;
import tech.webextools.cli.io.CsvFiles;
import tech.webextools.cli.io.JsonReportWriter;
import tech.webextools.sdk.exception.WebexApiException;
import tech.webextools.sdk.http.LoggingOptions;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "disable-users", mixinStandardHelpOptions = true,
    description = "Disable Webex users listed in a CSV file")
public class DisableUsersCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(DisableUsersCommand.class);

    static final String REPORT_PREFIX = "disabled_users_report";

    @Inject
    WebexClientFactory clientFactory;

    @Inject
    JsonReportWriter reportWriter;

    @Spec
    CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "CSV file with users data")
    Path file;

    @Option(names = {"-c", "--column"}, defaultValue = "email",
        description = "Column name to use for user email (default: email)")
    String column;

    @Option(names = {"-r", "--report"}, description = "Write the report to a JSON file")
    boolean report;

    @Option(names = {"--dry-run"}, description = "Show what would be disabled without changing anything")
    boolean dryRun;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output; repeat for debug output")
    boolean[] verbosity = new boolean[0];

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LoggingOptions logging = LoggingOptions.fromVerbosity(verbosity.length);

        try {
            List<String> emails = CsvFiles.readColumn(file, column);
            if (emails.isEmpty()) {
                err.println("No users found in the CSV file.");
                return 1;
            }

            var workflow = new DisableUsersWorkflow(clientFactory.create(logging).scimUsers(), logging);
            List<DisableResult> results = workflow.disable(emails, dryRun);

            Map<DisableStatus, Long> counts = results.stream()
                .collect(Collectors.groupingBy(DisableResult::status, Collectors.counting()));
            out.printf("Processed %d users: %s%n", results.size(), counts.entrySet().stream()
                .map(e -> e.getKey().label() + "=" + e.getValue())
                .collect(Collectors.joining(", ")));

            if (report) {
                Path written = reportWriter.write(Path.of(""), REPORT_PREFIX, results);
                out.printf("%nReport written to %s%n%n", written);
            }
            return counts.getOrDefault(DisableStatus.FAILED, 0L) > 0 ? 1 : 0;
        } catch (WebexApiException e) {
            err.println(ErrorFormatter.format(e, logging.debug()));
            LOG.debug("disable-users failed", e);
            return 1;
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

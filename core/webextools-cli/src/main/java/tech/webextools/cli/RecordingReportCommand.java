package tech.webextools.cli;

import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import tech.webextools.cli.config.WebexClientFactory;
import tech.webextools.cli.console.ErrorFormatter;
import tech.webextools.cli.io.CsvFiles;
import tech.webextools.cli.io.JsonReportWriter;
import tech.webextools.cli.recording.RecordingAccessRow;
import tech.webextools.cli.recording.RecordingReportWorkflow;
import tech.webextools.cli.recording.TimeRanges;
import tech.webextools.sdk.exception.WebexApiException;
import tech.webextools.sdk.http.LoggingOptions;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "recording-report", mixinStandardHelpOptions = true,
    description = "Generate recording audit report")
public class RecordingReportCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(RecordingReportCommand.class);

    @Inject
    WebexClientFactory clientFactory;

    @Inject
    JsonReportWriter reportWriter;

    @Inject
    Clock clock;

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--period"}, defaultValue = "90",
        description = "Recording report period in days (default 90 days, max 365 days)")
    int period;

    @Option(names = {"-s", "--span"}, defaultValue = "7",
        description = "Recording report span in days (default 7 days, max 90 days)")
    int span;

    @Option(names = {"-w", "--write"}, paramLabel = "FILENAME",
        description = "Specify the file name to write the report")
    Path write;

    @Option(names = {"-v", "--verbose"}, description = "Print detailed information; repeat for debug output")
    boolean[] verbosity = new boolean[0];

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LoggingOptions logging = LoggingOptions.fromVerbosity(verbosity.length);

        try {
            RecordingReportWorkflow.validate(period, span);
            var client = clientFactory.create(logging);
            var workflow = new RecordingReportWorkflow(client.recordingReports(), new TimeRanges(clock));
            List<RecordingAccessRow> rows = workflow.run(period, span);

            if (rows.isEmpty()) {
                out.println("No recording report found.");
                return 0;
            }
            if (write != null) {
                Path written = CsvFiles.write(write, RecordingAccessRow.COLUMNS,
                    rows.stream().map(RecordingAccessRow::values).toList());
                out.println("Report was saved to " + written);
            }
            if (logging.verbose()) {
                out.println(reportWriter.toJson(rows));
            }
            return 0;
        } catch (WebexApiException e) {
            err.println(ErrorFormatter.format(e, logging.debug()));
            LOG.debug("recording-report failed", e);
            return 1;
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

package tech.webextools.cli.recording;

import org.jboss.logging.Logger;
import tech.webextools.sdk.client.resources.RecordingReports;
import tech.webextools.sdk.dto.RecordingAccessDetail;
import tech.webextools.sdk.dto.RecordingAccessSummary;
import tech.webextools.sdk.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the recording audit: who viewed or downloaded which recording over a period.
 */
public class RecordingReportWorkflow {

    private static final Logger LOG = Logger.getLogger(RecordingReportWorkflow.class);

    public static final int MAX_PERIOD_DAYS = 365;
    public static final int MAX_SPAN_DAYS = 90;

    private final RecordingReports recordingReports;
    private final TimeRanges timeRanges;

    public RecordingReportWorkflow(RecordingReports recordingReports, TimeRanges timeRanges) {
        this.recordingReports = recordingReports;
        this.timeRanges = timeRanges;
    }

    public static void validate(int periodDays, int spanDays) {
        if (periodDays > MAX_PERIOD_DAYS || spanDays > MAX_SPAN_DAYS || periodDays <= 0 || spanDays <= 0) {
            throw new ValidationException("Invalid argument values. Please check the specified values for period and span.",
                List.of(new ValidationException.ValidationError("period",
                    "period must be 1-" + MAX_PERIOD_DAYS + " and span 1-" + MAX_SPAN_DAYS + " days", "INVALID_RANGE")));
        }
    }

    /**
     * @return one row per access, grouped by recording in summary order; empty when nothing was accessed
     */
    public List<RecordingAccessRow> run(int periodDays, int spanDays) {
        validate(periodDays, spanDays);

        List<RecordingAccessSummary> summaries = new ArrayList<>();
        for (TimeRange range : timeRanges.split(periodDays, spanDays)) {
            LOG.debugf("Collecting recording summaries from %s to %s", range.from(), range.to());
            recordingReports.accessSummary(range.from(), range.to()).forEach(summaries::add);
        }

        List<RecordingAccessRow> rows = new ArrayList<>();
        for (RecordingAccessSummary summary : summaries) {
            List<RecordingAccessDetail> details = recordingReports.accessDetail(summary.recordingId()).items();
            if (details.isEmpty()) {
                LOG.infof("No detailed report found for %s", summary.recordingId());
                continue;
            }
            for (RecordingAccessDetail detail : details) {
                rows.add(new RecordingAccessRow(
                    summary.recordingId(),
                    summary.topic(),
                    summary.timeRecorded(),
                    Objects.requireNonNullElse(detail.name(), ""),
                    Objects.requireNonNullElse(detail.email(), ""),
                    detail.accessTime(),
                    detail.downloaded(),
                    detail.viewed()));
            }
        }
        return rows;
    }
}

package tech.webextools.cli.recording;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.List;

/**
 * One access to one recording, as written to the audit report.
 */
@JsonPropertyOrder({"recordingId", "topic", "timeRecorded", "requestorName", "requestorEmail",
    "accessTime", "downloaded", "viewed"})
public record RecordingAccessRow(
    String recordingId,
    String topic,
    String timeRecorded,
    String requestorName,
    String requestorEmail,
    String accessTime,
    boolean downloaded,
    boolean viewed
) {
    public static final List<String> COLUMNS = List.of("recordingId", "topic", "timeRecorded",
        "requestorName", "requestorEmail", "accessTime", "downloaded", "viewed");

    public List<Object> values() {
        return Arrays.asList(recordingId, topic, timeRecorded, requestorName, requestorEmail, accessTime,
            downloaded, viewed);
    }
}

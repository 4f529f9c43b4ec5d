package tech.webextools.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A recording that was accessed during the reporting window.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingAccessSummary(
    String recordingId,
    String topic,
    String timeRecorded,
    String siteUrl,
    String hostEmail,
    Integer viewCount,
    Integer downloadCount
) {}

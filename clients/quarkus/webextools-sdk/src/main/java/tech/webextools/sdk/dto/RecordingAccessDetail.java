package tech.webextools.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One person's access to a recording.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordingAccessDetail(
    String recordingId,
    String name,
    String email,
    String accessTime,
    boolean viewed,
    boolean downloaded
) {}

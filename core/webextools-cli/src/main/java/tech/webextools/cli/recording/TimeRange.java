package tech.webextools.cli.recording;

/**
 * Report window in the local time format accepted by the recording report API.
 */
public record TimeRange(String from, String to) {}

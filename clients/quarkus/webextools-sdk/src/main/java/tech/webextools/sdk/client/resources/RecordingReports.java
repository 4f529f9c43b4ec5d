package tech.webextools.sdk.client.resources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.webextools.sdk.catalog.ResourceCatalog;
import tech.webextools.sdk.dto.ListResult;
import tech.webextools.sdk.dto.RecordingAccessDetail;
import tech.webextools.sdk.dto.RecordingAccessSummary;
import tech.webextools.sdk.exception.ValidationException;
import tech.webextools.sdk.exception.WebexApiException;
import tech.webextools.sdk.http.ApiResponse;
import tech.webextools.sdk.http.RequestOptions;
import tech.webextools.sdk.http.ResilientSession;

import java.util.List;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Resource for recording access reports.
 */
public class RecordingReports {

    private final ResilientSession session;

    public RecordingReports(ResilientSession session) {
        this.session = session;
    }

    /**
     * Recordings of all hosts accessed within a window, following every result page lazily.
     *
     * @param from start of the window, ISO-8601
     * @param to end of the window, ISO-8601
     */
    public Stream<RecordingAccessSummary> accessSummary(String from, String to) {
        var options = RequestOptions.builder()
            .query("hostEmail", "all")
            .query("from", from)
            .query("to", to)
            .build();
        return session.get(path(ResourceCatalog.RECORDING_ACCESS_SUMMARY), options)
            .stream()
            .flatMap(response -> items(response, RecordingAccessSummary.class));
    }

    /**
     * Everyone who viewed or downloaded one recording.
     */
    public ListResult<RecordingAccessDetail> accessDetail(String recordingId) {
        if (recordingId == null || recordingId.isBlank()) {
            throw new ValidationException("recordingId", "Recording ID is required");
        }
        var options = RequestOptions.builder().query("recordingId", recordingId).build();
        List<RecordingAccessDetail> details = session.get(path(ResourceCatalog.RECORDING_ACCESS_DETAIL), options)
            .stream()
            .flatMap(response -> items(response, RecordingAccessDetail.class))
            .toList();
        return ListResult.of(details);
    }

    private static String path(String name) {
        return ResourceCatalog.path(name).orElseThrow();
    }

    private <T> Stream<T> items(ApiResponse response, Class<T> type) {
        ObjectMapper mapper = session.getObjectMapper();
        JsonNode items = response.json(mapper).path("items");
        if (!items.isArray()) {
            return Stream.empty();
        }
        return StreamSupport.stream(items.spliterator(), false).map(item -> convert(mapper, item, type));
    }

    private static <T> T convert(ObjectMapper mapper, JsonNode item, Class<T> type) {
        try {
            return mapper.treeToValue(item, type);
        } catch (JsonProcessingException e) {
            throw new WebexApiException("Failed to parse " + type.getSimpleName(), e);
        }
    }
}

package tech.webextools.sdk.catalog;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Logical Webex resource names and their paths relative to the API root.
 */
public final class ResourceCatalog {

    public static final String PEOPLE = "people";
    public static final String PMR = "pmr";
    public static final String REPORTS = "reports";
    public static final String RECORDING_ACCESS_SUMMARY = "recordingAccessSummary";
    public static final String RECORDING_ACCESS_DETAIL = "recordingAccessDetail";
    public static final String SCIM_USERS = "scimUsers";

    private static final String ORG_PLACEHOLDER = "{orgId}";

    private static final Map<String, String> PATHS = Map.of(
        PEOPLE, "people",
        PMR, "meetingPreferences/personalMeetingRoom",
        REPORTS, "reports",
        RECORDING_ACCESS_SUMMARY, "recordingReport/accessSummary",
        RECORDING_ACCESS_DETAIL, "recordingReport/accessDetail",
        SCIM_USERS, "scim/" + ORG_PLACEHOLDER + "/v2/Users"
    );

    private ResourceCatalog() {
    }

    public static Optional<String> path(String name) {
        return Optional.ofNullable(PATHS.get(name));
    }

    /**
     * Path of a resource with extra segments appended, e.g. {@code path("people", id)}.
     */
    public static Optional<String> path(String name, String... segments) {
        return path(name).map(base -> join(base, segments));
    }

    /**
     * Absolute URL of a resource under the given API root.
     */
    public static Optional<String> url(String baseUrl, String name, String... segments) {
        return path(name, segments).map(path -> baseUrl.replaceAll("/+$", "") + "/" + path);
    }

    /**
     * SCIM user collection of one organization, with optional trailing segments (a user id).
     */
    public static String scimUsersPath(String orgId, String... segments) {
        String base = PATHS.get(SCIM_USERS).replace(ORG_PLACEHOLDER, orgId);
        return join(base, segments);
    }

    private static String join(String base, String... segments) {
        if (segments.length == 0) {
            return base;
        }
        return Stream.concat(Stream.of(base), Arrays.stream(segments)).collect(Collectors.joining("/"));
    }
}

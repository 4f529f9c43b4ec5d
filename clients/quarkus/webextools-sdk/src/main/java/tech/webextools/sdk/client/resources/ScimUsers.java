package tech.webextools.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.webextools.sdk.catalog.ResourceCatalog;
import tech.webextools.sdk.dto.ScimPatch;
import tech.webextools.sdk.dto.ScimUser;
import tech.webextools.sdk.exception.ValidationException;
import tech.webextools.sdk.http.ApiResponse;
import tech.webextools.sdk.http.LoggingOptions;
import tech.webextools.sdk.http.PageSequence;
import tech.webextools.sdk.http.RequestOptions;
import tech.webextools.sdk.http.ResilientSession;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Resource for the SCIM users of a Webex organization.
 *
 * <p>Every operation is scoped to an organization: the one passed in, else the default given at
 * construction. With neither, the call fails with {@link ValidationException} before any request.
 */
public class ScimUsers {

    private static final Logger LOG = Logger.getLogger(ScimUsers.class);

    private final ResilientSession session;
    private final String defaultOrgId;
    private final LoggingOptions logging;

    /**
     * @param session session bound to the identity API root
     * @param defaultOrgId organization used when a call names none, may be {@code null}
     * @param logging diagnostic switches
     */
    public ScimUsers(ResilientSession session, String defaultOrgId, LoggingOptions logging) {
        this.session = session;
        this.defaultOrgId = defaultOrgId;
        this.logging = logging != null ? logging : LoggingOptions.quiet();
    }

    /**
     * List all users of the default organization.
     */
    public Stream<ScimUser> listUsers() {
        return listUsers(null);
    }

    /**
     * List all users of an organization.
     *
     * <p>The stream is lazy and single-use: a page is requested only when the previous one has
     * been consumed, so a caller that stops early never fetches the remaining pages.
     *
     * @param orgId organization, or {@code null} for the default
     */
    public Stream<ScimUser> listUsers(String orgId) {
        String path = ResourceCatalog.scimUsersPath(resolveOrgId(orgId));
        var iterator = new UserIterator(path, new OffsetCursor(session.getOptions().maxPages()));
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public Optional<ScimUser> getUser(String userId) {
        return getUser(userId, null);
    }

    /**
     * Get a user by id.
     *
     * @return the user, or empty when the response body is empty
     */
    public Optional<ScimUser> getUser(String userId, String orgId) {
        String path = ResourceCatalog.scimUsersPath(resolveOrgId(orgId), requireUserId(userId));
        return decodeSingle(session.get(path));
    }

    /**
     * Update a user with a SCIM PatchOp document.
     *
     * <p>The document must carry {@code schemas} and {@code Operations}; see {@link ScimPatch}.
     * Callers should check the returned record to confirm the change took effect.
     *
     * @return the updated user, or empty when the response body is empty
     */
    public Optional<ScimUser> updateUserPatch(String userId, Map<String, Object> patch, String orgId) {
        String org = resolveOrgId(orgId);
        validatePatch(patch);
        String path = ResourceCatalog.scimUsersPath(org, requireUserId(userId));
        return decodeSingle(session.patch(path, RequestOptions.json(patch)));
    }

    /**
     * Set {@code active=false} on a user.
     */
    public Optional<ScimUser> deactivateUser(String userId, String orgId) {
        return updateUserPatch(userId, ScimPatch.deactivate(), orgId);
    }

    String resolveOrgId(String orgId) {
        if (orgId != null && !orgId.isBlank()) {
            return orgId;
        }
        if (defaultOrgId != null && !defaultOrgId.isBlank()) {
            return defaultOrgId;
        }
        throw ValidationException.missingOrganizationId();
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId", "User ID is required");
        }
        return userId;
    }

    private static void validatePatch(Map<String, Object> patch) {
        if (patch == null) {
            throw ValidationException.invalidPatch("document is missing");
        }
        if (!patch.containsKey(ScimPatch.SCHEMAS)) {
            throw ValidationException.invalidPatch("'" + ScimPatch.SCHEMAS + "' is required");
        }
        if (!patch.containsKey(ScimPatch.OPERATIONS)) {
            throw ValidationException.invalidPatch("'" + ScimPatch.OPERATIONS + "' is required");
        }
    }

    private Optional<ScimUser> decodeSingle(PageSequence pages) {
        return pages.first()
            .filter(ApiResponse::hasBody)
            .map(response -> ScimUser.fromJson(response.json(session.getObjectMapper())));
    }

    /**
     * Yields the users of one page at a time, requesting the next page when the buffer runs dry.
     */
    private final class UserIterator implements Iterator<ScimUser> {

        private final String path;
        private final OffsetCursor cursor;
        private final Deque<ScimUser> buffer = new ArrayDeque<>();

        UserIterator(String path, OffsetCursor cursor) {
            this.path = path;
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !cursor.isFinished()) {
                fetchPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public ScimUser next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.removeFirst();
        }

        private void fetchPage() {
            PageSequence pages = session.get(path, cursor.requestOptions());
            while (pages.hasNext() && !cursor.isFinished() && !cursor.hasPendingFailure()) {
                JsonNode data = pages.next().json(session.getObjectMapper());
                JsonNode resources = data.path("Resources");
                int count = resources.isArray() ? resources.size() : 0;
                if (count > 0) {
                    resources.forEach(resource -> buffer.addLast(ScimUser.fromJson(resource)));
                }
                cursor.advance(
                    intOrNull(data, "totalResults"),
                    data.path("itemsPerPage").asInt(0),
                    intOrNull(data, "startIndex"),
                    count);
                if (logging.verbose()) {
                    LOG.infof("Fetched %d users, next startIndex %d of %d total",
                        count, cursor.getStartIndex(), cursor.getTotalResults());
                }
            }
        }

        private Integer intOrNull(JsonNode data, String field) {
            JsonNode value = data.path(field);
            return value.isNumber() ? value.intValue() : null;
        }
    }
}

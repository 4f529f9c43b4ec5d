package tech.webextools.sdk.client.auth;

import tech.webextools.sdk.exception.ValidationException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives the organization id embedded in a Webex access token.
 *
 * <p>Webex tokens end with {@code _<orgId>}, where the org id is a UUID.
 */
public final class OrganizationIds {

    private static final Pattern CANONICAL_UUID =
        Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private OrganizationIds() {
    }

    /**
     * @throws ValidationException if the token has no {@code _} or its last segment is not a UUID
     */
    public static String fromToken(String token) {
        if (token == null || token.indexOf('_') < 0) {
            throw ValidationException.invalidToken("token does not carry an organization id");
        }
        String candidate = token.substring(token.lastIndexOf('_') + 1).trim();
        if (!CANONICAL_UUID.matcher(candidate).matches()) {
            throw new ValidationException("orgId", "Invalid organization ID: '" + candidate + "'");
        }
        return candidate;
    }

    /**
     * Like {@link #fromToken(String)}, but empty instead of failing.
     */
    public static Optional<String> tryFromToken(String token) {
        if (token == null || token.indexOf('_') < 0) {
            return Optional.empty();
        }
        String candidate = token.substring(token.lastIndexOf('_') + 1).trim();
        return CANONICAL_UUID.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
    }
}

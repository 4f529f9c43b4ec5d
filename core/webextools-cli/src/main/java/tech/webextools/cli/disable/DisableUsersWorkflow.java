package tech.webextools.cli.disable;

import org.jboss.logging.Logger;
import tech.webextools.sdk.client.resources.ScimUsers;
import tech.webextools.sdk.dto.ScimUser;
import tech.webextools.sdk.exception.WebexApiException;
import tech.webextools.sdk.http.LoggingOptions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Deactivates the directory users matching a list of email addresses.
 *
 * <p>The directory is listed lazily and listing stops as soon as every address has a match.
 * Results come back in the order of the input addresses, one per distinct address.
 */
public class DisableUsersWorkflow {

    private static final Logger LOG = Logger.getLogger(DisableUsersWorkflow.class);

    private final ScimUsers scimUsers;
    private final LoggingOptions logging;

    public DisableUsersWorkflow(ScimUsers scimUsers, LoggingOptions logging) {
        this.scimUsers = scimUsers;
        this.logging = logging;
    }

    public List<DisableResult> disable(List<String> emails, boolean dryRun) {
        Map<String, String> wanted = new LinkedHashMap<>();
        for (String email : emails) {
            if (email != null && !email.isBlank()) {
                wanted.putIfAbsent(key(email), email.trim());
            }
        }
        Map<String, ScimUser> matches = findUsers(wanted.keySet());

        List<DisableResult> results = new ArrayList<>();
        wanted.forEach((key, email) -> {
            ScimUser user = matches.get(key);
            if (user == null) {
                if (logging.verbose()) {
                    LOG.infof("[NotFound] %s", email);
                }
                results.add(DisableResult.notFound(email));
            } else {
                results.add(disableOne(email, user, dryRun));
            }
        });
        return results;
    }

    private Map<String, ScimUser> findUsers(Set<String> keys) {
        Map<String, ScimUser> matches = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return matches;
        }
        try (Stream<ScimUser> users = scimUsers.listUsers()) {
            Iterator<ScimUser> iterator = users.iterator();
            // hasNext() may fetch the next page, so it must run only while matches are missing
            while (matches.size() < keys.size() && iterator.hasNext()) {
                ScimUser user = iterator.next();
                for (String key : keys) {
                    if (!matches.containsKey(key) && user.hasEmail(key)) {
                        matches.put(key, user);
                    }
                }
            }
        }
        return matches;
    }

    private DisableResult disableOne(String email, ScimUser user, boolean dryRun) {
        if (!user.active()) {
            log("Skipped", "User is already inactive", user);
            return result(email, user, DisableStatus.SKIPPED, null);
        }
        if (dryRun) {
            log("DryRun", "Would disable user", user);
            return result(email, user, DisableStatus.DRY_RUN, null);
        }

        try {
            Optional<ScimUser> updated = scimUsers.deactivateUser(user.id(), null);
            if (updated.isPresent() && !updated.get().active()) {
                log("Success", "Disabling user", user);
                return result(email, user, DisableStatus.SUCCESS, null);
            }
            log("Failed", "User is still active after update", user);
            return result(email, user, DisableStatus.FAILED, "User is still active after update");
        } catch (WebexApiException e) {
            LOG.warnf("[Failed] Unable to disable user: %s (%s): %s", user.displayName(), email, e.getMessage());
            return result(email, user, DisableStatus.FAILED, e.getMessage());
        }
    }

    private void log(String label, String action, ScimUser user) {
        if (logging.verbose()) {
            LOG.infof("[%s] %s: %s (%s)", label, action, user.displayName(), user.primaryEmail());
        }
    }

    private static DisableResult result(String email, ScimUser user, DisableStatus status, String message) {
        return new DisableResult(email, user.id(), user.displayName(), status, message);
    }

    private static String key(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}

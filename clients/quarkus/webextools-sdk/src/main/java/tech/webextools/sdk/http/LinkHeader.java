package tech.webextools.sdk.http;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parser for RFC 8288 {@code Link} headers, e.g.
 * {@code <https://webexapis.com/v1/people?cursor=abc>; rel="next"}.
 */
public final class LinkHeader {

    private LinkHeader() {
    }

    public record Link(String url, String rel) {}

    /**
     * Parse every link of one header value. Malformed entries are skipped.
     */
    public static List<Link> parse(String headerValue) {
        List<Link> links = new ArrayList<>();
        if (headerValue == null || headerValue.isBlank()) {
            return links;
        }
        int pos = 0;
        int length = headerValue.length();
        while (pos < length) {
            int open = headerValue.indexOf('<', pos);
            if (open < 0) {
                break;
            }
            int close = headerValue.indexOf('>', open);
            if (close < 0) {
                break;
            }
            String url = headerValue.substring(open + 1, close).trim();
            int nextLink = headerValue.indexOf('<', close);
            String params = nextLink < 0 ? headerValue.substring(close + 1) : headerValue.substring(close + 1, nextLink);
            links.add(new Link(url, relOf(params)));
            pos = nextLink < 0 ? length : nextLink;
        }
        return links;
    }

    /**
     * First {@code rel="next"} URL across all Link headers.
     */
    public static Optional<String> next(HttpHeaders headers) {
        for (String value : headers.allValues("Link")) {
            for (Link link : parse(value)) {
                if (link.rel() != null && hasRelation(link.rel(), "next")) {
                    return Optional.of(link.url());
                }
            }
        }
        return Optional.empty();
    }

    private static String relOf(String params) {
        for (String param : params.split(";")) {
            String trimmed = param.trim();
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String name = trimmed.substring(0, eq).trim();
            if (name.equalsIgnoreCase("rel")) {
                String value = trimmed.substring(eq + 1).trim();
                if (value.endsWith(",")) {
                    value = value.substring(0, value.length() - 1).trim();
                }
                return value.replace("\"", "");
            }
        }
        return null;
    }

    // rel may hold several space-separated relation types
    private static boolean hasRelation(String rel, String wanted) {
        for (String part : rel.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (part.equals(wanted)) {
                return true;
            }
        }
        return false;
    }
}

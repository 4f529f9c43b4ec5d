package tech.webextools.sdk.exception;

/**
 * Exception thrown when a server's pagination cursor stops making progress.
 */
public class PaginationException extends WebexApiException {

    public PaginationException(String message) {
        super(message);
    }

    public static PaginationException repeatedLink(String url) {
        return new PaginationException("Next page link points to an already fetched page: " + url);
    }

    public static PaginationException pageLimitExceeded(int maxPages) {
        return new PaginationException("Pagination exceeded the limit of " + maxPages + " pages");
    }

    public static PaginationException cursorDidNotAdvance(int currentIndex, int nextIndex) {
        return new PaginationException(
            "Start index did not advance (current " + currentIndex + ", next " + nextIndex + ")");
    }
}

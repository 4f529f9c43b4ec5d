package tech.webextools.sdk.client.resources;

import tech.webextools.sdk.exception.PaginationException;
import tech.webextools.sdk.http.RequestOptions;

/**
 * Position in a SCIM list: the next {@code startIndex} (1-based), the page size the server
 * last reported, and the total reported by the first page.
 *
 * <p>The listing ends once {@code startIndex - 1 >= totalResults} or a page arrives empty.
 * A page that does not move the start index forward, or a listing longer than the page cap,
 * leaves a pending {@link PaginationException}. The page that caused it is still consumed; the
 * failure is raised when the next page is requested.
 */
final class OffsetCursor {

    private final int maxPages;

    private int startIndex = 1;
    private int itemsPerPage;
    private Integer totalResults;
    private int pagesFetched;
    private boolean finished;
    private PaginationException pendingFailure;

    OffsetCursor(int maxPages) {
        this.maxPages = maxPages;
    }

    /**
     * Query for the next page.
     *
     * @throws PaginationException if the previous page left the cursor unusable
     */
    RequestOptions requestOptions() {
        if (pendingFailure != null) {
            PaginationException failure = pendingFailure;
            pendingFailure = null;
            finished = true;
            throw failure;
        }
        return RequestOptions.builder()
            .query("startIndex", startIndex)
            .query("count", itemsPerPage > 0 ? itemsPerPage : null)
            .build();
    }

    /**
     * Move past one page of results.
     *
     * @param reportedTotal {@code totalResults} of the page, {@code null} when absent
     * @param reportedItemsPerPage {@code itemsPerPage} of the page, 0 when absent
     * @param reportedStartIndex {@code startIndex} of the page, {@code null} when absent
     * @param resourceCount number of resources the page carried
     */
    void advance(Integer reportedTotal, int reportedItemsPerPage, Integer reportedStartIndex, int resourceCount) {
        pagesFetched++;
        if (totalResults == null) {
            totalResults = reportedTotal != null ? reportedTotal : 0;
        }
        itemsPerPage = reportedItemsPerPage;

        if (resourceCount == 0) {
            finished = true;
            return;
        }

        int pageStart = reportedStartIndex != null ? reportedStartIndex : startIndex;
        int step = itemsPerPage > 0 ? itemsPerPage : resourceCount;
        int next = pageStart + step;
        if (next <= startIndex) {
            pendingFailure = PaginationException.cursorDidNotAdvance(startIndex, next);
            return;
        }
        startIndex = next;

        if (startIndex - 1 >= totalResults) {
            finished = true;
        } else if (pagesFetched >= maxPages) {
            pendingFailure = PaginationException.pageLimitExceeded(maxPages);
        }
    }

    boolean isFinished() {
        return finished;
    }

    boolean hasPendingFailure() {
        return pendingFailure != null;
    }

    int getStartIndex() {
        return startIndex;
    }

    int getTotalResults() {
        return totalResults != null ? totalResults : 0;
    }

    int getPagesFetched() {
        return pagesFetched;
    }
}

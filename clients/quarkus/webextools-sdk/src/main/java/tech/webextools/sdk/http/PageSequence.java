package tech.webextools.sdk.http;

import tech.webextools.sdk.exception.PaginationException;
import tech.webextools.sdk.exception.WebexApiException;

import java.net.URI;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite, single-use sequence of responses for one logical call.
 *
 * <p>The cursor is the URL of the next page. It starts at the request URL and is replaced by the
 * {@code rel="next"} link of each response; a response without one ends the sequence. A link
 * pointing back at an already fetched page, or more pages than the session allows, ends the
 * sequence with a {@link PaginationException} once the caller asks for the offending page.
 *
 * <p>Any exception thrown while fetching also ends the sequence.
 */
public class PageSequence implements Iterator<ApiResponse> {

    private final ResilientSession session;
    private final String method;
    private final RequestOptions requestOptions;
    private final int maxPages;

    private URI nextUri;
    private int pagesFetched;
    private final Set<URI> visited = new HashSet<>();
    private WebexApiException pendingFailure;

    PageSequence(ResilientSession session, String method, URI firstUri, RequestOptions requestOptions, int maxPages) {
        this.session = session;
        this.method = method;
        this.nextUri = firstUri;
        this.requestOptions = requestOptions;
        this.maxPages = maxPages;
    }

    /**
     * Fetch the next page, or return empty once the sequence is finished.
     */
    public Optional<ApiResponse> nextPage() {
        if (pendingFailure != null) {
            WebexApiException failure = pendingFailure;
            pendingFailure = null;
            throw failure;
        }
        if (nextUri == null) {
            return Optional.empty();
        }

        URI current = nextUri;
        nextUri = null;
        ApiResponse response = session.fetch(method, current, requestOptions);
        visited.add(current);
        pagesFetched++;

        Optional<String> link = response.nextLink();
        if (link.isPresent()) {
            URI candidate = URI.create(session.normalizeUrl(link.get()));
            if (visited.contains(candidate)) {
                pendingFailure = PaginationException.repeatedLink(candidate.toString());
            } else if (pagesFetched >= maxPages) {
                pendingFailure = PaginationException.pageLimitExceeded(maxPages);
            } else {
                nextUri = candidate;
            }
        }
        return Optional.of(response);
    }

    @Override
    public boolean hasNext() {
        return nextUri != null || pendingFailure != null;
    }

    @Override
    public ApiResponse next() {
        return nextPage().orElseThrow(NoSuchElementException::new);
    }

    /**
     * Fetch only the first page. Later pages, if any, are never requested.
     */
    public Optional<ApiResponse> first() {
        return nextPage();
    }

    /**
     * One-shot stream over the remaining pages.
     */
    public Stream<ApiResponse> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public int getPagesFetched() {
        return pagesFetched;
    }
}

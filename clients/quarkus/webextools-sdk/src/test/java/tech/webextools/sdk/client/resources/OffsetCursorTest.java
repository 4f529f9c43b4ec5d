package tech.webextools.sdk.client.resources;

import org.junit.jupiter.api.Test;
import tech.webextools.sdk.exception.PaginationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the SCIM offset cursor.
 */
class OffsetCursorTest {

    @Test
    void firstRequest_sendsStartIndexOnly() {
        var cursor = new OffsetCursor(100);

        assertEquals("startIndex=1", cursor.requestOptions().queryString());
    }

    @Test
    void advance_movesByItemsPerPage() {
        var cursor = new OffsetCursor(100);

        cursor.advance(10, 3, 1, 3);

        assertEquals(4, cursor.getStartIndex());
        assertEquals(10, cursor.getTotalResults());
        assertFalse(cursor.isFinished());
        assertEquals("startIndex=4&count=3", cursor.requestOptions().queryString());
    }

    @Test
    void advance_finishesWhenTotalReached() {
        var cursor = new OffsetCursor(100);

        cursor.advance(4, 2, 1, 2);
        cursor.advance(4, 2, 3, 2);

        assertTrue(cursor.isFinished());
        assertEquals(2, cursor.getPagesFetched());
    }

    @Test
    void advance_usesResourceCountWhenItemsPerPageMissing() {
        var cursor = new OffsetCursor(100);

        cursor.advance(10, 0, null, 4);

        assertEquals(5, cursor.getStartIndex());
        assertEquals("startIndex=5", cursor.requestOptions().queryString());
    }

    @Test
    void advance_keepsTotalFromFirstPage() {
        var cursor = new OffsetCursor(100);

        cursor.advance(3, 2, 1, 2);
        cursor.advance(50, 2, 3, 1);

        assertTrue(cursor.isFinished());
        assertEquals(3, cursor.getTotalResults());
    }

    @Test
    void advance_emptyPageFinishes() {
        var cursor = new OffsetCursor(100);

        cursor.advance(10, 2, 1, 0);

        assertTrue(cursor.isFinished());
    }

    @Test
    void advance_missingTotalFinishesAfterFirstPage() {
        var cursor = new OffsetCursor(100);

        cursor.advance(null, 2, 1, 2);

        assertTrue(cursor.isFinished());
    }

    @Test
    void advance_cursorThatDoesNotMoveFailsOnNextRequest() {
        var cursor = new OffsetCursor(100);
        cursor.advance(10, 2, 1, 2);

        cursor.advance(10, 2, 1, 2);

        assertTrue(cursor.hasPendingFailure());
        assertFalse(cursor.isFinished());
        assertThrows(PaginationException.class, cursor::requestOptions);
        assertTrue(cursor.isFinished());
        assertFalse(cursor.hasPendingFailure());
    }

    @Test
    void advance_pageCapFailsOnNextRequest() {
        var cursor = new OffsetCursor(2);
        cursor.advance(100, 1, 1, 1);

        cursor.advance(100, 1, 2, 1);

        assertEquals(3, cursor.getStartIndex());
        var failure = assertThrows(PaginationException.class, cursor::requestOptions);
        assertTrue(failure.getMessage().contains("2 pages"));
    }

    @Test
    void advance_lastPageWithinCapFinishesWithoutFailure() {
        var cursor = new OffsetCursor(2);
        cursor.advance(2, 1, 1, 1);

        cursor.advance(2, 1, 2, 1);

        assertTrue(cursor.isFinished());
        assertFalse(cursor.hasPendingFailure());
    }
}

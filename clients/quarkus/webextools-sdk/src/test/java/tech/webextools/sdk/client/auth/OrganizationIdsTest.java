package tech.webextools.sdk.client.auth;

import org.junit.jupiter.api.Test;
import tech.webextools.sdk.exception.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for deriving the organization id from a token.
 */
class OrganizationIdsTest {

    private static final String ORG = "11111111-2222-3333-4444-555555555555";

    @Test
    void fromToken_returnsTrailingUuid() {
        assertEquals(ORG, OrganizationIds.fromToken("abc123_" + ORG));
    }

    @Test
    void fromToken_usesLastSegment() {
        assertEquals(ORG, OrganizationIds.fromToken("part_one_PF84_" + ORG));
    }

    @Test
    void fromToken_withoutUnderscore_isRejected() {
        assertThrows(ValidationException.class, () -> OrganizationIds.fromToken("abc123"));
    }

    @Test
    void fromToken_nonUuidSegment_isRejected() {
        var error = assertThrows(ValidationException.class, () -> OrganizationIds.fromToken("abc_not-a-uuid"));
        assertEquals("orgId", error.getErrors().get(0).field());
    }

    @Test
    void fromToken_nonCanonicalUuid_isRejected() {
        assertThrows(ValidationException.class,
            () -> OrganizationIds.fromToken("abc_111111112222333344445555555555555"));
    }

    @Test
    void tryFromToken_isEmptyInsteadOfFailing() {
        assertTrue(OrganizationIds.tryFromToken("abc123").isEmpty());
        assertTrue(OrganizationIds.tryFromToken(null).isEmpty());
        assertEquals(ORG, OrganizationIds.tryFromToken("abc_" + ORG).orElseThrow());
    }
}

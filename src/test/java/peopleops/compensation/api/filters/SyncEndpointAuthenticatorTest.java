package peopleops.compensation.api.filters;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import peopleops.compensation.TestConstants;

/**
 * Unit tests for {@link SyncEndpointAuthenticator}.
 */
class SyncEndpointAuthenticatorTest {

    private SyncEndpointAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authenticator = new SyncEndpointAuthenticator();
        authenticator.syncEndpointKey = TestConstants.SYNC_ENDPOINT_KEY;
    }

    @Test
    void testAcceptsMatchingBearerToken() {
        assertTrue(authenticator.isAuthorized(TestConstants.BEARER_HEADER));
    }

    @Test
    void testRejectsWrongOrMissingToken() {
        assertFalse(authenticator.isAuthorized("Bearer wrong-key"));
        assertFalse(authenticator.isAuthorized(TestConstants.SYNC_ENDPOINT_KEY));
        assertFalse(authenticator.isAuthorized("Basic " + TestConstants.SYNC_ENDPOINT_KEY));
        assertFalse(authenticator.isAuthorized("Bearer "));
        assertFalse(authenticator.isAuthorized(null));
    }

    @Test
    void testRejectsEverythingWhenKeyUnset() {
        authenticator.syncEndpointKey = "";

        assertFalse(authenticator.isAuthorized("Bearer "));
        assertFalse(authenticator.isAuthorized(TestConstants.BEARER_HEADER));
    }

    @Test
    void testValidToken_comparesBareQueryToken() {
        assertTrue(authenticator.isValidToken(TestConstants.SYNC_ENDPOINT_KEY));
        assertFalse(authenticator.isValidToken(TestConstants.BEARER_HEADER));
        assertFalse(authenticator.isValidToken("wrong-key"));
        assertFalse(authenticator.isValidToken(""));
        assertFalse(authenticator.isValidToken(null));

        authenticator.syncEndpointKey = "";
        assertFalse(authenticator.isValidToken(""));
    }
}
